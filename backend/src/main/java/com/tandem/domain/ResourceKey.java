package com.tandem.domain;

import com.tandem.protocol.Domain;

/**
 * Identity of one coordinated resource. Lock and presence state is
 * serialized per key, so unrelated resources never contend.
 */
public record ResourceKey(Domain domain, String resourceId) {

    public static ResourceKey of(Domain domain, String resourceId) {
        if (resourceId == null || resourceId.isBlank()) {
            throw new IllegalArgumentException("Resource ID required");
        }
        return new ResourceKey(domain, resourceId);
    }

    /** Parse a path-style domain segment ({@code document}, {@code vault}, ...). */
    public static ResourceKey of(String domain, String resourceId) {
        return of(Domain.fromWire(domain), resourceId);
    }

    @Override
    public String toString() {
        return domain.wireName() + "/" + resourceId;
    }
}
