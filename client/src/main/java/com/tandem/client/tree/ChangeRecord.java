package com.tandem.client.tree;

import com.tandem.protocol.NodeKind;
import jakarta.annotation.Nullable;

/**
 * One classified change between two tree snapshots.
 *
 * @param path slash-separated location in the previous tree; set for deletions only
 */
public record ChangeRecord(
    String resourceId,
    ChangeKind kind,
    String name,
    NodeKind nodeKind,
    @Nullable String path
) {}
