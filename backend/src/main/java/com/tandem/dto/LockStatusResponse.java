package com.tandem.dto;

import com.tandem.protocol.LockHolder;
import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.annotation.Nullable;

@Serdeable
@Schema(description = "Current lock state of a resource")
public record LockStatusResponse(
    String domain,
    String resourceId,
    boolean locked,
    @Nullable LockHolder lockedBy
) {}
