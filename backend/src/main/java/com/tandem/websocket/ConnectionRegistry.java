package com.tandem.websocket;

import com.tandem.protocol.ServerMessage;
import io.micronaut.serde.ObjectMapper;
import io.micronaut.websocket.WebSocketSession;
import jakarta.annotation.Nullable;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Collection;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Open collaboration sockets, keyed by connection id.
 *
 * Registry is in-process only (single node). Agents that talk REST get a
 * synthetic {@code agent:{userId}} connection id with no socket behind it;
 * sends to such ids are silently skipped.
 */
@Singleton
public class ConnectionRegistry {

    private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

    @Inject ObjectMapper objectMapper;

    public record Connection(String id, String userId, String username, WebSocketSession session) {}

    private final ConcurrentHashMap<String, Connection> connections = new ConcurrentHashMap<>();

    public Connection register(WebSocketSession session, String userId, String username) {
        Connection connection = new Connection(session.getId(), userId, username, session);
        connections.put(connection.id(), connection);
        log.info("Collab WS registered: session={} user={} total={}", session.getId(), userId, connections.size());
        return connection;
    }

    public Optional<Connection> unregister(String connectionId) {
        return Optional.ofNullable(connections.remove(connectionId));
    }

    public Optional<Connection> find(String connectionId) {
        return Optional.ofNullable(connections.get(connectionId));
    }

    /** True while the user still has at least one open socket. */
    public boolean hasOpenConnection(String userId) {
        return connections.values().stream()
            .anyMatch(c -> c.userId().equals(userId) && c.session().isOpen());
    }

    public int size() {
        return connections.size();
    }

    /** Fan a message out to every open connection. Best-effort. */
    public void broadcastAll(ServerMessage message) {
        String json = toJson(message);
        if (json == null) return;
        connections.values().forEach(c -> send(c, json));
        log.debug("Broadcast {} to {} connections", message.type(), connections.size());
    }

    /** Send to the given connections, skipping {@code excludeConnectionId}. Best-effort. */
    public void sendTo(Collection<String> connectionIds, ServerMessage message,
                       @Nullable String excludeConnectionId) {
        if (connectionIds.isEmpty()) return;
        String json = toJson(message);
        if (json == null) return;
        for (String id : connectionIds) {
            if (id.equals(excludeConnectionId)) continue;
            Connection c = connections.get(id);
            if (c != null) {
                send(c, json);
            }
        }
    }

    public void sendTo(String connectionId, ServerMessage message) {
        Connection c = connections.get(connectionId);
        String json = c != null ? toJson(message) : null;
        if (json != null) {
            send(c, json);
        }
    }

    private void send(Connection c, String json) {
        if (!c.session().isOpen()) return;
        try {
            c.session().sendAsync(json);
        } catch (Exception e) {
            log.debug("WS send failed for session {}: {}", c.id(), e.getMessage());
        }
    }

    private String toJson(ServerMessage message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (IOException e) {
            log.warn("Failed to serialize {} message: {}", message.type(), e.getMessage());
            return null;
        }
    }
}
