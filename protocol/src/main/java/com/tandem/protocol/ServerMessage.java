package com.tandem.protocol;

import io.micronaut.serde.annotation.Serdeable;
import jakarta.annotation.Nullable;

import java.time.Instant;
import java.util.List;

/**
 * Frame pushed by the server. One flat shape for every {@link EventKind};
 * fields not relevant to a kind are left null.
 */
@Serdeable
public record ServerMessage(
    String type,
    @Nullable Domain domain,
    @Nullable String resourceId,
    @Nullable String userId,
    @Nullable String username,
    @Nullable String color,
    @Nullable String agentName,
    @Nullable PresenceUser user,
    @Nullable List<PresenceUser> users,
    @Nullable LockHolder lockedBy,
    @Nullable String revision,
    @Nullable String name,
    @Nullable String content,
    @Nullable Integer position,
    @Nullable String sessionId,
    @Nullable String text,
    @Nullable String error,
    @Nullable Instant timestamp
) {

    public ServerMessage {
        users = users == null ? List.of() : List.copyOf(users);
    }

    public EventKey eventKey() {
        return EventKey.parse(type, domain);
    }

    // ── Domain-scoped ───────────────────────────────────────────────────────

    public static ServerMessage treeChanged(Domain domain) {
        return builder(EventKey.of(domain, EventKind.TREE_CHANGED)).build();
    }

    public static ServerMessage lockUpdated(Domain domain, String resourceId, @Nullable LockHolder holder) {
        Builder b = builder(EventKey.of(domain, EventKind.LOCK_UPDATED));
        b.resourceId = resourceId;
        b.lockedBy = holder;
        return b.build();
    }

    public static ServerMessage contentUpdated(Domain domain, String resourceId, @Nullable String revision,
                                               @Nullable String name, @Nullable String userId) {
        Builder b = builder(EventKey.of(domain, EventKind.CONTENT_UPDATED));
        b.resourceId = resourceId;
        b.revision = revision;
        b.name = name;
        b.userId = userId;
        return b.build();
    }

    // ── Presence ────────────────────────────────────────────────────────────

    public static ServerMessage presenceUpdated(Domain domain, String resourceId, List<PresenceUser> users) {
        Builder b = builder(EventKey.of(domain, EventKind.PRESENCE_UPDATED));
        b.resourceId = resourceId;
        b.users = users;
        return b.build();
    }

    public static ServerMessage presenceJoin(Domain domain, String resourceId, PresenceUser user) {
        Builder b = builder(EventKey.of(domain, EventKind.PRESENCE_JOIN));
        b.resourceId = resourceId;
        b.user = user;
        b.userId = user.userId();
        b.username = user.username();
        return b.build();
    }

    public static ServerMessage presenceLeave(Domain domain, String resourceId, PresenceUser user) {
        Builder b = builder(EventKey.of(domain, EventKind.PRESENCE_LEAVE));
        b.resourceId = resourceId;
        b.userId = user.userId();
        b.username = user.username();
        return b.build();
    }

    public static ServerMessage cursor(Domain domain, String resourceId, PresenceUser user) {
        Builder b = builder(EventKey.of(domain, EventKind.CURSOR));
        b.resourceId = resourceId;
        b.user = user;
        b.userId = user.userId();
        b.username = user.username();
        b.color = user.color();
        b.position = user.cursorPosition();
        return b.build();
    }

    // ── Content ─────────────────────────────────────────────────────────────

    public static ServerMessage contentChange(Domain domain, String resourceId, String userId, String username,
                                              String content, @Nullable Integer cursorPosition) {
        Builder b = builder(EventKey.of(domain, EventKind.CONTENT_CHANGE));
        b.resourceId = resourceId;
        b.userId = userId;
        b.username = username;
        b.content = content;
        b.position = cursorPosition;
        b.timestamp = Instant.now();
        return b.build();
    }

    public static ServerMessage contentSync(Domain domain, String resourceId, String content,
                                            @Nullable String revision) {
        Builder b = builder(EventKey.of(domain, EventKind.CONTENT_SYNC));
        b.resourceId = resourceId;
        b.content = content;
        b.revision = revision;
        b.timestamp = Instant.now();
        return b.build();
    }

    // ── Agent streaming ─────────────────────────────────────────────────────

    public static ServerMessage streamStart(Domain domain, String resourceId, String sessionId, String userId,
                                            String username, String agentName, int position, String color) {
        Builder b = builder(EventKey.of(domain, EventKind.STREAM_START));
        b.resourceId = resourceId;
        b.sessionId = sessionId;
        b.userId = userId;
        b.username = username;
        b.agentName = agentName;
        b.position = position;
        b.color = color;
        return b.build();
    }

    public static ServerMessage streamChunk(Domain domain, String resourceId, String sessionId, String userId,
                                            String agentName, String text, int position) {
        Builder b = builder(EventKey.of(domain, EventKind.STREAM_CHUNK));
        b.resourceId = resourceId;
        b.sessionId = sessionId;
        b.userId = userId;
        b.agentName = agentName;
        b.text = text;
        b.position = position;
        return b.build();
    }

    public static ServerMessage streamEnd(Domain domain, String resourceId, String sessionId, String userId,
                                          String agentName, int finalPosition) {
        Builder b = builder(EventKey.of(domain, EventKind.STREAM_END));
        b.resourceId = resourceId;
        b.sessionId = sessionId;
        b.userId = userId;
        b.agentName = agentName;
        b.position = finalPosition;
        return b.build();
    }

    public static ServerMessage error(String message) {
        Builder b = builder(EventKey.of(Domain.DOCUMENT, EventKind.ERROR));
        b.domain = null;
        b.error = message;
        return b.build();
    }

    private static Builder builder(EventKey key) {
        Builder b = new Builder();
        b.type = key.wireName();
        b.domain = key.domain();
        return b;
    }

    private static final class Builder {
        String type;
        Domain domain;
        String resourceId;
        String userId;
        String username;
        String color;
        String agentName;
        PresenceUser user;
        List<PresenceUser> users;
        LockHolder lockedBy;
        String revision;
        String name;
        String content;
        Integer position;
        String sessionId;
        String text;
        String error;
        Instant timestamp;

        ServerMessage build() {
            return new ServerMessage(type, domain, resourceId, userId, username, color, agentName, user, users,
                lockedBy, revision, name, content, position, sessionId, text, error, timestamp);
        }
    }
}
