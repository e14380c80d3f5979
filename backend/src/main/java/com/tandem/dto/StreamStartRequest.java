package com.tandem.dto;

import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.annotation.Nullable;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

@Serdeable
@Schema(description = "Request to open an agent streaming session")
public record StreamStartRequest(
    @NotBlank String userId,
    @Nullable String username,
    @Nullable String agentName,

    @PositiveOrZero
    @Schema(description = "Where to start writing", defaultValue = "0")
    int position
) {}
