package com.tandem;

import com.tandem.domain.ResourceKey;
import com.tandem.protocol.ClientMessage;
import com.tandem.protocol.Domain;
import com.tandem.protocol.ServerMessage;
import com.tandem.service.LockService;
import com.tandem.service.PresenceService;
import com.tandem.websocket.ConnectionRegistry;
import io.micronaut.context.BeanContext;
import io.micronaut.http.uri.UriBuilder;
import io.micronaut.runtime.server.EmbeddedServer;
import io.micronaut.serde.ObjectMapper;
import io.micronaut.test.extensions.junit5.annotation.MicronautTest;
import io.micronaut.websocket.WebSocketClient;
import jakarta.inject.Inject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;

@MicronautTest
class CollaborationWebSocketTest {

    private static final long WAIT_MS = 5000;

    @Inject EmbeddedServer server;
    @Inject BeanContext beanContext;
    @Inject ConnectionRegistry connectionRegistry;
    @Inject ObjectMapper objectMapper;
    @Inject PresenceService presenceService;
    @Inject LockService lockService;

    private final List<CollabTestSocket> sockets = new ArrayList<>();
    private ResourceKey key;

    @BeforeEach
    void setup() {
        key = ResourceKey.of(Domain.DOCUMENT, UUID.randomUUID().toString());
    }

    @AfterEach
    void cleanup() throws Exception {
        for (CollabTestSocket socket : sockets) {
            socket.close();
        }
    }

    @Test
    void join_secondUser_seesBothMembersAndFirstIsNotified() throws Exception {
        CollabTestSocket alice = connect("alice", "Alice");
        send(alice, ClientMessage.join(Domain.DOCUMENT, key.resourceId()));
        awaitCondition(() -> presenceService.members(key).size() == 1);

        CollabTestSocket bob = connect("bob", "Bob");
        send(bob, ClientMessage.join(Domain.DOCUMENT, key.resourceId()));

        ServerMessage joined = await(alice, "presence:join");
        assertThat(joined.userId()).isEqualTo("bob");
        ServerMessage updated = await(bob, "presence_updated");
        assertThat(updated.users()).extracting(u -> u.userId()).containsExactly("alice", "bob");
    }

    @Test
    void cursor_reachesOthersButNotSender() throws Exception {
        CollabTestSocket alice = connect("alice", "Alice");
        CollabTestSocket bob = connect("bob", "Bob");
        send(alice, ClientMessage.join(Domain.DOCUMENT, key.resourceId()));
        send(bob, ClientMessage.join(Domain.DOCUMENT, key.resourceId()));
        awaitCondition(() -> presenceService.members(key).size() == 2);

        send(bob, ClientMessage.cursor(Domain.DOCUMENT, key.resourceId(), 3, 7, 42, null, null));

        ServerMessage cursor = await(alice, "presence:cursor");
        assertThat(cursor.userId()).isEqualTo("bob");
        assertThat(cursor.position()).isEqualTo(42);
        assertThat(cursor.user().cursorLine()).isEqualTo(3);
        assertThat(hasFrame(bob, "presence:cursor")).isFalse();
    }

    @Test
    void contentChange_reachesOthersButNotSender() throws Exception {
        CollabTestSocket alice = connect("alice", "Alice");
        CollabTestSocket bob = connect("bob", "Bob");
        send(alice, ClientMessage.join(Domain.DOCUMENT, key.resourceId()));
        send(bob, ClientMessage.join(Domain.DOCUMENT, key.resourceId()));
        awaitCondition(() -> presenceService.members(key).size() == 2);

        send(alice, ClientMessage.content(Domain.DOCUMENT, key.resourceId(), "# Title", 7));

        ServerMessage change = await(bob, "content:change");
        assertThat(change.content()).isEqualTo("# Title");
        assertThat(change.username()).isEqualTo("Alice");
        assertThat(hasFrame(alice, "content:change")).isFalse();
    }

    @Test
    void unknownFrameType_repliesWithError() throws Exception {
        CollabTestSocket alice = connect("alice", "Alice");

        alice.send("{\"type\":\"dance\",\"resourceId\":\"x\"}");

        ServerMessage error = await(alice, "error");
        assertThat(error.error()).isNotBlank();
    }

    @Test
    void close_lastConnection_releasesLocksAndPresence() throws Exception {
        String userId = "carol-" + UUID.randomUUID();
        CollabTestSocket carol = connect(userId, "Carol");
        send(carol, ClientMessage.join(Domain.DOCUMENT, key.resourceId()));
        awaitCondition(() -> presenceService.members(key).size() == 1);
        assertThat(lockService.acquire(key, userId, "Carol").success()).isTrue();

        carol.close();
        sockets.remove(carol);

        awaitCondition(() -> lockService.current(key).isEmpty());
        assertThat(presenceService.members(key)).isEmpty();
    }

    @Test
    void lockUpdate_isBroadcastToConnectedClients() throws Exception {
        String watcherId = "watcher-" + UUID.randomUUID();
        CollabTestSocket watcher = connect(watcherId, "Watcher");
        awaitCondition(() -> connectionRegistry.hasOpenConnection(watcherId));

        lockService.acquire(key, "dave", "Dave");

        ServerMessage update = await(watcher, "document_lock_updated", key.resourceId());
        assertThat(update.lockedBy().userId()).isEqualTo("dave");
    }

    // ── Helpers ─────────────────────────────────────────────────────────────

    private CollabTestSocket connect(String userId, String username) {
        WebSocketClient webSocketClient = beanContext.getBean(WebSocketClient.class);
        URI uri = UriBuilder.of("ws://localhost").port(server.getPort())
            .path("ws").path("collab")
            .queryParam("userId", userId)
            .queryParam("username", username)
            .build();
        CollabTestSocket socket = Flux.from(webSocketClient.connect(CollabTestSocket.class, uri))
            .blockFirst(Duration.ofSeconds(5));
        sockets.add(socket);
        return socket;
    }

    private void send(CollabTestSocket socket, ClientMessage message) throws IOException {
        socket.send(objectMapper.writeValueAsString(message));
    }

    private ServerMessage await(CollabTestSocket socket, String type) throws Exception {
        return await(socket, type, null);
    }

    private ServerMessage await(CollabTestSocket socket, String type, String resourceId) throws Exception {
        long deadline = System.currentTimeMillis() + WAIT_MS;
        while (System.currentTimeMillis() < deadline) {
            String frame = socket.frames.poll(100, TimeUnit.MILLISECONDS);
            if (frame == null) continue;
            ServerMessage msg = objectMapper.readValue(frame, ServerMessage.class);
            if (msg.type().equals(type) && (resourceId == null || resourceId.equals(msg.resourceId()))) {
                return msg;
            }
        }
        throw new AssertionError("No " + type + " frame within " + WAIT_MS + "ms");
    }

    /** Waits briefly, then reports whether any frame of {@code type} arrived. */
    private boolean hasFrame(CollabTestSocket socket, String type) throws Exception {
        Thread.sleep(300);
        for (String frame : socket.frames) {
            if (objectMapper.readValue(frame, ServerMessage.class).type().equals(type)) {
                return true;
            }
        }
        return false;
    }

    private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + WAIT_MS;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                throw new AssertionError("Condition not met within " + WAIT_MS + "ms");
            }
            Thread.sleep(50);
        }
    }
}
