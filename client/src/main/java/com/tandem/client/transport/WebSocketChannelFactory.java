package com.tandem.client.transport;

import com.tandem.client.ClientConfiguration;
import io.micronaut.http.client.annotation.Client;
import io.micronaut.http.uri.UriBuilder;
import io.micronaut.websocket.WebSocketClient;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.concurrent.CompletableFuture;

/** Opens {@link CollabClientSocket}s against {@code tandem.client.server-url}. */
@Singleton
public class WebSocketChannelFactory implements ChannelFactory {

    static final String PATH = "/ws/collab";

    @Inject
    @Client("${tandem.client.server-url}")
    WebSocketClient webSocketClient;

    @Inject
    ClientConfiguration config;

    @Override
    public CompletableFuture<TransportChannel> open(ChannelListener listener) {
        URI uri = UriBuilder.of(PATH)
            .queryParam("userId", config.getUserId())
            .queryParam("username", config.getUsername())
            .build();
        return Mono.from(webSocketClient.connect(CollabClientSocket.class, uri.toString()))
            .map(socket -> {
                socket.bind(listener);
                return (TransportChannel) socket;
            })
            .toFuture();
    }
}
