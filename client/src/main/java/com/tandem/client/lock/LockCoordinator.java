package com.tandem.client.lock;

import com.tandem.protocol.Domain;
import com.tandem.protocol.LockResult;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * Client half of the soft-lock protocol. Every call is a server round trip:
 * the caller may only treat the resource as locked once the returned result
 * says so. A conflict completes normally with {@code success=false}; a
 * transport failure completes the future exceptionally.
 */
@Singleton
public class LockCoordinator {

    private static final Logger log = LoggerFactory.getLogger(LockCoordinator.class);

    @Inject LockClient lockClient;

    public CompletableFuture<LockResult> lock(Domain domain, String resourceId) {
        return lockClient.acquire(domain.wireName(), resourceId).whenComplete((result, error) -> {
            if (error != null) {
                log.warn("Lock request for {}/{} failed: {}", domain.wireName(), resourceId, error.getMessage());
            } else if (!result.success() && result.lockedBy() != null) {
                log.info("{}/{} is being edited by {}", domain.wireName(), resourceId, result.lockedBy().username());
            }
        });
    }

    public CompletableFuture<LockResult> heartbeat(Domain domain, String resourceId) {
        return lockClient.heartbeat(domain.wireName(), resourceId).whenComplete((result, error) -> {
            if (error != null) {
                log.warn("Lock heartbeat for {}/{} failed: {}", domain.wireName(), resourceId, error.getMessage());
            } else if (!result.success()) {
                log.warn("Lock heartbeat for {}/{} rejected: {}", domain.wireName(), resourceId, result.message());
            }
        });
    }

    public CompletableFuture<LockResult> unlock(Domain domain, String resourceId) {
        return lockClient.release(domain.wireName(), resourceId).whenComplete((result, error) -> {
            if (error != null) {
                log.warn("Unlock of {}/{} failed: {}", domain.wireName(), resourceId, error.getMessage());
            }
        });
    }
}
