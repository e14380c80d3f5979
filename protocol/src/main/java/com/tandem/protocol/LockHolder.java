package com.tandem.protocol;

import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;

@Serdeable
@Schema(description = "Current holder of a soft lock")
public record LockHolder(
    String userId,
    String username,
    Instant acquiredAt,
    Instant lastHeartbeatAt
) {}
