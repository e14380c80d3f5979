package com.tandem.protocol;

import io.micronaut.serde.annotation.Serdeable;
import jakarta.annotation.Nullable;

/** Opaque resource content plus its revision marker. */
@Serdeable
public record ResourceSnapshot(
    String id,
    @Nullable String content,
    @Nullable String revision
) {}
