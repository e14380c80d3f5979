package com.tandem.service;

import com.tandem.domain.ResourceKey;
import com.tandem.protocol.PresenceUser;
import com.tandem.protocol.ServerMessage;
import com.tandem.websocket.ConnectionRegistry;
import io.micronaut.context.annotation.Value;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.exceptions.HttpStatusException;
import io.micronaut.scheduling.TaskExecutors;
import io.micronaut.scheduling.TaskScheduler;
import io.micronaut.scheduling.annotation.Scheduled;
import jakarta.annotation.Nullable;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fire-and-forget fan-out of cursor moves, content edits and agent streams
 * to the members of a resource room.
 *
 * The sender is always excluded from its own cursor and content echoes.
 * Stream events go to the whole room, since the streaming agent has no
 * socket of its own. A stream that stops receiving chunks for longer than
 * the presence timeout is ended by the idle sweep.
 */
@Singleton
public class BroadcastService {

    private static final Logger log = LoggerFactory.getLogger(BroadcastService.class);

    @Inject PresenceService presenceService;
    @Inject ConnectionRegistry connectionRegistry;
    @Inject @Named(TaskExecutors.SCHEDULED) TaskScheduler taskScheduler;
    @Inject Clock clock;

    @Value("${tandem.collab.stream-retention:5s}")
    Duration streamRetention;

    @Value("${tandem.collab.presence-timeout:90s}")
    Duration streamIdleTimeout;

    private final ConcurrentHashMap<String, StreamSession> streams = new ConcurrentHashMap<>();

    /** An agent writing into a resource chunk by chunk. */
    public static final class StreamSession {
        private final String id;
        private final ResourceKey key;
        private final String userId;
        private final String username;
        private final String agentName;
        private final int startPosition;
        private int currentPosition;
        private boolean active = true;
        private Instant lastActivity;

        StreamSession(String id, ResourceKey key, String userId, String username, String agentName, int start,
                      Instant startedAt) {
            this.id = id;
            this.key = key;
            this.userId = userId;
            this.username = username;
            this.agentName = agentName;
            this.startPosition = start;
            this.currentPosition = start;
            this.lastActivity = startedAt;
        }

        public String id() { return id; }
        public ResourceKey key() { return key; }
        public String userId() { return userId; }
        public String username() { return username; }
        public String agentName() { return agentName; }
        public int startPosition() { return startPosition; }
        public synchronized int currentPosition() { return currentPosition; }
        public synchronized boolean active() { return active; }
        public synchronized Instant lastActivity() { return lastActivity; }
    }

    // ── Cursor & content ────────────────────────────────────────────────────

    public void cursor(ResourceKey key, String connectionId, @Nullable Integer line, @Nullable Integer column,
                       @Nullable Integer position, @Nullable Integer selectionStart, @Nullable Integer selectionEnd) {
        Optional<PresenceUser> moved = presenceService.updateCursor(key, connectionId, position, line, column,
            selectionStart, selectionEnd);
        if (moved.isEmpty()) {
            log.debug("Cursor from non-member ignored: resource={} connection={}", key, connectionId);
            return;
        }
        connectionRegistry.sendTo(presenceService.audience(key),
            ServerMessage.cursor(key.domain(), key.resourceId(), moved.get()), connectionId);
    }

    public void content(ResourceKey key, String connectionId, String content, @Nullable Integer cursorPosition) {
        Optional<PresenceUser> sender = presenceService.memberFor(key, connectionId);
        if (sender.isEmpty()) {
            log.debug("Content from non-member ignored: resource={} connection={}", key, connectionId);
            return;
        }
        PresenceUser user = sender.get();
        connectionRegistry.sendTo(presenceService.audience(key),
            ServerMessage.contentChange(key.domain(), key.resourceId(), user.userId(), user.username(),
                content, cursorPosition),
            connectionId);
    }

    /** Push a full replacement of the content to everyone in the room. */
    public void sync(ResourceKey key, String content, @Nullable String revision) {
        connectionRegistry.sendTo(presenceService.audience(key),
            ServerMessage.contentSync(key.domain(), key.resourceId(), content, revision), null);
    }

    // ── Agent streaming ─────────────────────────────────────────────────────

    public StreamSession startStream(ResourceKey key, String userId, String username,
                                     String agentName, int startPosition) {
        StreamSession session = new StreamSession(UUID.randomUUID().toString(), key, userId, username,
            agentName, startPosition, clock.instant());
        streams.put(session.id(), session);
        log.info("Stream started: session={} resource={} agent={}", session.id(), key, agentName);

        connectionRegistry.sendTo(presenceService.audience(key),
            ServerMessage.streamStart(key.domain(), key.resourceId(), session.id(), userId, username,
                agentName, startPosition, Palette.agentColor(agentName)),
            null);
        return session;
    }

    /**
     * Append a chunk. Without an explicit position the running position
     * advances by the chunk length.
     *
     * @return the position after the chunk
     */
    public int streamChunk(String sessionId, String text, @Nullable Integer position) {
        StreamSession session = activeStream(sessionId);
        int current;
        synchronized (session) {
            session.currentPosition = position != null ? position : session.currentPosition + text.length();
            session.lastActivity = clock.instant();
            current = session.currentPosition;
        }
        ResourceKey key = session.key();
        connectionRegistry.sendTo(presenceService.audience(key),
            ServerMessage.streamChunk(key.domain(), key.resourceId(), sessionId, session.userId(),
                session.agentName(), text, current),
            null);
        return current;
    }

    public StreamSession endStream(String sessionId) {
        StreamSession session = activeStream(sessionId);
        if (!finish(session)) {
            throw new HttpStatusException(HttpStatus.NOT_FOUND, "Stream session not found: " + sessionId);
        }
        log.info("Stream ended: session={} resource={} final position={}", sessionId, session.key(),
            session.currentPosition());
        return session;
    }

    /**
     * Scheduled idle sweep.
     * Ends streams whose agent went quiet so clients drop the writing indicator.
     */
    @Scheduled(fixedDelay = "${tandem.collab.stream-sweep-interval:15s}")
    public void sweepIdleStreams() {
        try {
            Instant cutoff = clock.instant().minus(streamIdleTimeout);
            int ended = 0;
            for (StreamSession session : List.copyOf(streams.values())) {
                boolean idle;
                synchronized (session) {
                    idle = session.active && session.lastActivity.isBefore(cutoff);
                }
                if (idle && finish(session)) {
                    log.info("Stream abandoned: session={} resource={} agent={}", session.id(), session.key(),
                        session.agentName());
                    ended++;
                }
            }
            if (ended > 0) {
                log.info("Ended {} idle streams", ended);
            }
        } catch (Exception e) {
            log.warn("Error sweeping idle streams: {}", e.getMessage());
        }
    }

    public Optional<StreamSession> findStream(String sessionId) {
        return Optional.ofNullable(streams.get(sessionId));
    }

    /** Deactivate, announce {@code stream:end} and schedule removal. False if already ended. */
    private boolean finish(StreamSession session) {
        synchronized (session) {
            if (!session.active) return false;
            session.active = false;
        }
        String sessionId = session.id();
        ResourceKey key = session.key();
        connectionRegistry.sendTo(presenceService.audience(key),
            ServerMessage.streamEnd(key.domain(), key.resourceId(), sessionId, session.userId(),
                session.agentName(), session.currentPosition()),
            null);
        taskScheduler.schedule(streamRetention, () -> streams.remove(sessionId));
        return true;
    }

    private StreamSession activeStream(String sessionId) {
        StreamSession session = streams.get(sessionId);
        if (session == null || !session.active()) {
            throw new HttpStatusException(HttpStatus.NOT_FOUND, "Stream session not found: " + sessionId);
        }
        return session;
    }
}
