package com.tandem.client.tree;

import com.tandem.protocol.Domain;
import jakarta.annotation.Nullable;

import java.util.List;

/**
 * Result of one re-diff of a tracked scope.
 *
 * @param changes   every classified change
 * @param surfaced  the changes worth notifying about, capped per kind
 * @param omitted   changes left out of {@code surfaced} by the cap
 * @param suppressed true when the batch echoes a recent local mutation;
 *                   {@code surfaced} is then empty
 */
public record ChangeBatch(
    Domain domain,
    @Nullable String scope,
    List<ChangeRecord> changes,
    List<ChangeRecord> surfaced,
    int omitted,
    boolean suppressed
) {

    public ChangeBatch {
        changes = List.copyOf(changes);
        surfaced = List.copyOf(surfaced);
    }

    public boolean isEmpty() {
        return changes.isEmpty();
    }
}
