package com.tandem.client.transport;

import java.util.concurrent.CompletableFuture;

/**
 * Opens physical channels for the {@link TransportHub}.
 * The future completes once the channel is open and bound to {@code listener}.
 */
public interface ChannelFactory {

    CompletableFuture<TransportChannel> open(ChannelListener listener);
}
