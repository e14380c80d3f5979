package com.tandem.websocket;

import com.tandem.domain.ResourceKey;
import com.tandem.protocol.ClientMessage;
import com.tandem.protocol.ServerMessage;
import com.tandem.service.BroadcastService;
import com.tandem.service.LockService;
import com.tandem.service.PresenceService;
import io.micronaut.http.HttpRequest;
import io.micronaut.serde.ObjectMapper;
import io.micronaut.websocket.CloseReason;
import io.micronaut.websocket.WebSocketSession;
import io.micronaut.websocket.annotation.OnClose;
import io.micronaut.websocket.annotation.OnError;
import io.micronaut.websocket.annotation.OnMessage;
import io.micronaut.websocket.annotation.OnOpen;
import io.micronaut.websocket.annotation.ServerWebSocket;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * The single multiplexed collaboration channel per client.
 *
 * Connect: ws://host/ws/collab?userId={id}&username={name}
 * Up: {@link ClientMessage} JSON frames (join/leave/cursor/content/heartbeat).
 * Down: {@link ServerMessage} JSON frames for every domain.
 *
 * Closing the socket, gracefully or not, removes the connection from every
 * presence room; when it was the user's last socket, their locks go too.
 */
@ServerWebSocket("/ws/collab")
public class CollaborationWebSocket {

    private static final Logger log = LoggerFactory.getLogger(CollaborationWebSocket.class);

    @Inject ConnectionRegistry connectionRegistry;
    @Inject PresenceService presenceService;
    @Inject LockService lockService;
    @Inject BroadcastService broadcastService;
    @Inject ObjectMapper objectMapper;

    @OnOpen
    public void onOpen(WebSocketSession session, HttpRequest<?> request) {
        String userId = request.getParameters().get("userId");
        if (userId == null || userId.isBlank()) {
            log.warn("Collab WS rejected, no userId: session={}", session.getId());
            session.close(CloseReason.POLICY_VIOLATION);
            return;
        }
        String username = request.getParameters().get("username");
        connectionRegistry.register(session, userId, username != null && !username.isBlank() ? username : "Anonymous");
    }

    @OnMessage
    public void onMessage(String message, WebSocketSession session) {
        ConnectionRegistry.Connection connection = connectionRegistry.find(session.getId()).orElse(null);
        if (connection == null) {
            return;
        }

        ClientMessage msg;
        try {
            msg = objectMapper.readValue(message, ClientMessage.class);
        } catch (IOException e) {
            log.debug("Malformed frame from session {}: {}", session.getId(), e.getMessage());
            connectionRegistry.sendTo(session.getId(), ServerMessage.error("Malformed message"));
            return;
        }

        try {
            dispatch(connection, msg);
        } catch (IllegalArgumentException e) {
            connectionRegistry.sendTo(session.getId(), ServerMessage.error(e.getMessage()));
        }
    }

    private void dispatch(ConnectionRegistry.Connection connection, ClientMessage msg) {
        ResourceKey key = ResourceKey.of(msg.domainOrDefault(), msg.resourceId());
        switch (msg.action()) {
            case JOIN -> presenceService.join(key, connection.userId(), connection.username(), connection.id(), null);
            case LEAVE -> presenceService.leaveConnection(key, connection.id());
            case HEARTBEAT -> presenceService.heartbeat(key, connection.id());
            case CURSOR -> broadcastService.cursor(key, connection.id(), msg.line(), msg.column(),
                msg.position(), msg.selectionStart(), msg.selectionEnd());
            case CONTENT -> {
                if (msg.content() == null) {
                    throw new IllegalArgumentException("Content required");
                }
                broadcastService.content(key, connection.id(), msg.content(), msg.cursorPosition());
            }
        }
    }

    @OnClose
    public void onClose(WebSocketSession session) {
        connectionRegistry.unregister(session.getId()).ifPresent(connection -> {
            presenceService.leaveAll(connection.id());
            if (!connectionRegistry.hasOpenConnection(connection.userId())) {
                int released = lockService.releaseAllHeldBy(connection.userId());
                if (released > 0) {
                    log.info("Released {} lock(s) held by disconnected user {}", released, connection.userId());
                }
            }
            log.info("Collab WS closed: session={} user={}", session.getId(), connection.userId());
        });
    }

    @OnError
    public void onError(WebSocketSession session, Throwable t) {
        log.warn("Collab WS error on {}: {}", session.getId(), t.getMessage());
    }
}
