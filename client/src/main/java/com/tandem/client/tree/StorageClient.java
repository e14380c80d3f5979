package com.tandem.client.tree;

import com.tandem.protocol.ResourceNode;
import com.tandem.protocol.ResourceSnapshot;
import io.micronaut.http.annotation.Get;
import io.micronaut.http.annotation.QueryValue;
import io.micronaut.http.client.annotation.Client;
import jakarta.annotation.Nullable;

import java.util.List;
import java.util.concurrent.CompletableFuture;

@Client("${tandem.client.storage-url}")
public interface StorageClient {

    @Get("/api/{domain}/tree")
    CompletableFuture<List<ResourceNode>> tree(String domain, @Nullable @QueryValue String scope);

    @Get("/api/{domain}/resources/{resourceId}")
    CompletableFuture<ResourceSnapshot> resource(String domain, String resourceId);
}
