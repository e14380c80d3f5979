package com.tandem.dto;

import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.annotation.Nullable;
import jakarta.validation.constraints.NotNull;

@Serdeable
@Schema(description = "Full content written by an agent, pushed to the room as a sync")
public record AgentContentRequest(
    @NotNull String content,
    @Nullable String revision
) {}
