package com.tandem.dto;

import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.annotation.Nullable;
import jakarta.validation.constraints.NotNull;

@Serdeable
@Schema(description = "A chunk of streamed agent output")
public record StreamChunkRequest(
    @NotNull String text,

    @Nullable
    @Schema(description = "Override the running position")
    Integer position
) {}
