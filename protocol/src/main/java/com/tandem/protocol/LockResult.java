package com.tandem.protocol;

import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.annotation.Nullable;

/**
 * Outcome of a lock operation. A conflict is a normal result, not an error:
 * {@code success=false} with {@code lockedBy} naming the current holder.
 */
@Serdeable
@Schema(description = "Result of a lock, heartbeat or release request")
public record LockResult(
    boolean success,
    String message,
    @Nullable LockHolder lockedBy
) {

    public static LockResult granted(String message, LockHolder holder) {
        return new LockResult(true, message, holder);
    }

    public static LockResult released(String message) {
        return new LockResult(true, message, null);
    }

    public static LockResult denied(String message, @Nullable LockHolder holder) {
        return new LockResult(false, message, holder);
    }
}
