package com.tandem.client.tree;

import com.tandem.protocol.Domain;
import com.tandem.protocol.ResourceNode;
import com.tandem.protocol.ResourceSnapshot;
import jakarta.annotation.Nullable;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/** {@link ResourceStore} over the storage collaborator's HTTP API. */
@Singleton
public class HttpResourceStore implements ResourceStore {

    @Inject StorageClient storageClient;

    @Override
    public CompletableFuture<List<ResourceNode>> getTree(Domain domain, @Nullable String scope) {
        return storageClient.tree(domain.wireName(), scope);
    }

    @Override
    public CompletableFuture<ResourceSnapshot> getResource(Domain domain, String resourceId) {
        return storageClient.resource(domain.wireName(), resourceId);
    }
}
