package com.tandem.dto;

import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;

@Serdeable
@Schema(description = "State of an agent streaming session")
public record StreamSessionResponse(
    String sessionId,
    String domain,
    String resourceId,
    String agentName,
    int startPosition,
    int currentPosition,
    boolean active
) {}
