package com.tandem.protocol;

import java.util.Arrays;
import java.util.Locale;

/**
 * Independent resource families sharing the coordination layer.
 * The wire name is the lowercase prefix used in domain-scoped event names
 * ({@code document_tree_changed}, {@code vault_lock_updated}, ...).
 */
public enum Domain {
    DOCUMENT,
    TASK,
    VAULT,
    FILE,
    SCHEMA;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Domain fromWire(String value) {
        return Arrays.stream(values())
            .filter(d -> d.wireName().equalsIgnoreCase(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown domain: " + value));
    }
}
