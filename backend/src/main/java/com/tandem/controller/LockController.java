package com.tandem.controller;

import com.tandem.domain.ResourceKey;
import com.tandem.dto.LockStatusResponse;
import com.tandem.protocol.LockResult;
import com.tandem.service.LockService;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.annotation.*;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.annotation.Nullable;
import jakarta.inject.Inject;

/**
 * Soft-lock endpoints, symmetric across domains.
 * A conflict is a 200 with {@code success=false} and the current holder.
 */
@Controller("/api/v1/{domain}/resources/{resourceId}/lock")
@Tag(name = "locks")
public class LockController {

    static final String USER_ID = "X-User-Id";
    static final String USER_NAME = "X-User-Name";

    @Inject
    LockService lockService;

    @Post
    @Operation(summary = "Acquire or refresh the edit lock")
    public HttpResponse<LockResult> acquire(String domain, String resourceId,
                                            @Header(USER_ID) String userId,
                                            @Nullable @Header(USER_NAME) String username) {
        ResourceKey key = ResourceKey.of(domain, resourceId);
        return HttpResponse.ok(lockService.acquire(key, userId, username != null ? username : userId));
    }

    @Post("/heartbeat")
    @Operation(summary = "Renew the caller's lock")
    public HttpResponse<LockResult> heartbeat(String domain, String resourceId, @Header(USER_ID) String userId) {
        return HttpResponse.ok(lockService.heartbeat(ResourceKey.of(domain, resourceId), userId));
    }

    @Delete
    @Operation(summary = "Release the caller's lock")
    public HttpResponse<LockResult> release(String domain, String resourceId, @Header(USER_ID) String userId) {
        return HttpResponse.ok(lockService.release(ResourceKey.of(domain, resourceId), userId));
    }

    @Post("/force-unlock")
    @Operation(summary = "Release the lock regardless of holder")
    public HttpResponse<LockResult> forceUnlock(String domain, String resourceId) {
        return HttpResponse.ok(lockService.forceUnlock(ResourceKey.of(domain, resourceId)));
    }

    @Get
    @Operation(summary = "Current lock holder, if any")
    public HttpResponse<LockStatusResponse> status(String domain, String resourceId) {
        ResourceKey key = ResourceKey.of(domain, resourceId);
        return HttpResponse.ok(lockService.current(key)
            .map(h -> new LockStatusResponse(key.domain().wireName(), resourceId, true, h))
            .orElseGet(() -> new LockStatusResponse(key.domain().wireName(), resourceId, false, null)));
    }
}
