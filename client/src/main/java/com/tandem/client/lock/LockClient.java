package com.tandem.client.lock;

import com.tandem.protocol.LockResult;
import io.micronaut.http.annotation.Delete;
import io.micronaut.http.annotation.Header;
import io.micronaut.http.annotation.Post;
import io.micronaut.http.client.annotation.Client;

import java.util.concurrent.CompletableFuture;

/** Declarative client for the server's lock endpoints. Identity comes from configuration. */
@Client(value = "${tandem.client.server-url}", path = "/api/v1")
@Header(name = "X-User-Id", value = "${tandem.client.user-id}")
@Header(name = "X-User-Name", value = "${tandem.client.username}")
public interface LockClient {

    @Post("/{domain}/resources/{resourceId}/lock")
    CompletableFuture<LockResult> acquire(String domain, String resourceId);

    @Post("/{domain}/resources/{resourceId}/lock/heartbeat")
    CompletableFuture<LockResult> heartbeat(String domain, String resourceId);

    @Delete("/{domain}/resources/{resourceId}/lock")
    CompletableFuture<LockResult> release(String domain, String resourceId);
}
