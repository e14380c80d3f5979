package com.tandem.client.tree;

import com.tandem.protocol.Domain;
import com.tandem.protocol.ResourceNode;
import com.tandem.protocol.ResourceSnapshot;
import jakarta.annotation.Nullable;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Read access to the storage collaborator, the only source of authoritative
 * trees. The coordination layer never writes through it.
 */
public interface ResourceStore {

    /** Full tree of a domain, optionally narrowed to a scope (a project, a folder). */
    CompletableFuture<List<ResourceNode>> getTree(Domain domain, @Nullable String scope);

    CompletableFuture<ResourceSnapshot> getResource(Domain domain, String resourceId);
}
