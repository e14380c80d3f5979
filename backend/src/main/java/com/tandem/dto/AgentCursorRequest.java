package com.tandem.dto;

import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.annotation.Nullable;
import jakarta.validation.constraints.PositiveOrZero;

@Serdeable
@Schema(description = "Agent cursor position")
public record AgentCursorRequest(
    @PositiveOrZero int position,
    @Nullable Integer line,
    @Nullable Integer column
) {}
