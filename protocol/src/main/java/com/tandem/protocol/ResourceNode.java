package com.tandem.protocol;

import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.annotation.Nullable;

import java.util.List;

/**
 * A node of a domain tree as served by the storage collaborator.
 *
 * Trees may be delivered nested ({@code children}) or flat ({@code parentId});
 * consumers must accept both. The coordination layer only ever holds
 * transient copies of these for diffing.
 */
@Serdeable
@Schema(description = "Resource tree node")
public record ResourceNode(
    String id,
    String name,
    NodeKind kind,
    @Nullable String parentId,
    @Nullable String revision,
    @Nullable Domain domain,
    @Nullable List<ResourceNode> children
) {

    public ResourceNode {
        children = children == null ? List.of() : List.copyOf(children);
    }

    public static ResourceNode folder(String id, String name, @Nullable String parentId,
                                      List<ResourceNode> children) {
        return new ResourceNode(id, name, NodeKind.FOLDER, parentId, null, null, children);
    }

    public static ResourceNode leaf(String id, String name, @Nullable String parentId,
                                    @Nullable String revision) {
        return new ResourceNode(id, name, NodeKind.LEAF, parentId, revision, null, List.of());
    }
}
