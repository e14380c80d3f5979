package com.tandem.dto;

import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.annotation.Nullable;
import jakarta.validation.constraints.NotBlank;

@Serdeable
@Schema(description = "An agent joining a resource over REST")
public record AgentJoinRequest(
    @NotBlank
    @Schema(description = "User the agent acts for")
    String userId,

    @Nullable
    @Schema(description = "Display name of that user")
    String username,

    @Nullable
    @Schema(description = "Agent name, also selects its colour", defaultValue = "Agent")
    String agentName
) {}
