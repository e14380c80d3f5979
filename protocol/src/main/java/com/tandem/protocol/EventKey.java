package com.tandem.protocol;

import jakarta.annotation.Nullable;

/**
 * A (domain, kind) pair: the unit of subscription on the client and the
 * source of the {@code type} field on the wire.
 */
public record EventKey(Domain domain, EventKind kind) {

    public static EventKey of(Domain domain, EventKind kind) {
        return new EventKey(domain, kind);
    }

    public String wireName() {
        return kind.domainScoped() ? domain.wireName() + "_" + kind.suffix() : kind.suffix();
    }

    /**
     * Resolve a wire {@code type}. Resource-scoped kinds take their domain from
     * the message body; a missing body domain defaults to {@link Domain#DOCUMENT}.
     *
     * @throws IllegalArgumentException when the type is not part of the protocol
     */
    public static EventKey parse(String type, @Nullable Domain bodyDomain) {
        for (EventKind kind : EventKind.values()) {
            if (kind.domainScoped()) {
                for (Domain d : Domain.values()) {
                    if (type.equals(d.wireName() + "_" + kind.suffix())) {
                        return new EventKey(d, kind);
                    }
                }
            } else if (type.equals(kind.suffix())) {
                return new EventKey(bodyDomain != null ? bodyDomain : Domain.DOCUMENT, kind);
            }
        }
        throw new IllegalArgumentException("Unknown event type: " + type);
    }
}
