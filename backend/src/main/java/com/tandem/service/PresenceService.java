package com.tandem.service;

import com.tandem.domain.ResourceKey;
import com.tandem.protocol.PresenceUser;
import com.tandem.protocol.ServerMessage;
import com.tandem.websocket.ConnectionRegistry;
import io.micronaut.context.annotation.Value;
import io.micronaut.scheduling.annotation.Scheduled;
import jakarta.annotation.Nullable;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Tracks who is currently joined to each resource.
 *
 * Membership is a set keyed by (resource, member key). The member key is the
 * user id, suffixed with {@code _agent} for agent presences so a person and
 * an agent acting for them show up separately. Joining again from another
 * socket replaces the earlier entry rather than duplicating it.
 *
 * Every mutation runs inside {@code rooms.compute(key, ...)}, which serializes
 * access per resource. Broadcasts are sent after the room has been updated.
 */
@Singleton
public class PresenceService {

    private static final Logger log = LoggerFactory.getLogger(PresenceService.class);

    @Inject ConnectionRegistry connectionRegistry;
    @Inject Clock clock;

    @Value("${tandem.collab.presence-timeout:90s}")
    Duration presenceTimeout;

    private final ConcurrentHashMap<ResourceKey, Room> rooms = new ConcurrentHashMap<>();

    private static final class Member {
        PresenceUser user;
        String connectionId;
        Instant lastActivity;

        Member(PresenceUser user, String connectionId, Instant lastActivity) {
            this.user = user;
            this.connectionId = connectionId;
            this.lastActivity = lastActivity;
        }
    }

    private static final class Room {
        final Map<String, Member> members = new LinkedHashMap<>();
        int nextColor;

        List<PresenceUser> users() {
            return members.values().stream().map(m -> m.user).toList();
        }

        Set<String> connectionIds() {
            return members.values().stream().map(m -> m.connectionId).collect(Collectors.toSet());
        }

        Optional<Map.Entry<String, Member>> byConnection(String connectionId) {
            return members.entrySet().stream()
                .filter(e -> e.getValue().connectionId.equals(connectionId))
                .findFirst();
        }
    }

    /** What a mutation changed, captured under the per-resource lock. */
    private record Change(@Nullable PresenceUser user, List<PresenceUser> users, Set<String> audience) {}

    // ── Join / leave ────────────────────────────────────────────────────────

    /**
     * Add (or refresh) a member and broadcast the new membership to the room.
     *
     * @param agentName non-null for agent presences
     * @return the membership after the join
     */
    public List<PresenceUser> join(ResourceKey key, String userId, String username,
                                   String connectionId, @Nullable String agentName) {
        boolean agent = agentName != null;
        String memberKey = memberKey(userId, agent);

        Change change = mutate(key, room -> {
            Member existing = room.members.get(memberKey);
            String color;
            if (existing != null) {
                color = existing.user.color();
            } else if (agent) {
                color = Palette.agentColor(agentName);
            } else {
                color = Palette.userColor(room.nextColor++);
            }
            PresenceUser user = new PresenceUser(userId, username, color, agent, agentName,
                null, null, null, null, null, false);
            room.members.put(memberKey, new Member(user, connectionId, clock.instant()));
            return new Change(user, room.users(), room.connectionIds());
        });

        log.info("Presence join: resource={} user={} members={}", key, memberKey, change.users().size());
        connectionRegistry.sendTo(change.audience(),
            ServerMessage.presenceJoin(key.domain(), key.resourceId(), change.user()), null);
        connectionRegistry.sendTo(change.audience(),
            ServerMessage.presenceUpdated(key.domain(), key.resourceId(), change.users()), null);
        return change.users();
    }

    /** Remove a user's (or agent's) membership. Returns false when it was not joined. */
    public boolean leave(ResourceKey key, String userId, boolean agent) {
        String memberKey = memberKey(userId, agent);
        Set<String> previousAudience = audience(key);
        Change change = mutate(key, room -> {
            Member removed = room.members.remove(memberKey);
            return removed == null ? null : new Change(removed.user, room.users(), room.connectionIds());
        });
        return announceLeave(key, change, previousAudience);
    }

    /** Remove whichever member the given socket backs in this room. */
    public boolean leaveConnection(ResourceKey key, String connectionId) {
        Set<String> previousAudience = audience(key);
        Change change = mutate(key, room -> room.byConnection(connectionId)
            .map(e -> {
                room.members.remove(e.getKey());
                return new Change(e.getValue().user, room.users(), room.connectionIds());
            })
            .orElse(null));
        return announceLeave(key, change, previousAudience);
    }

    /** Transport dropped: leave every room this connection was part of. */
    public int leaveAll(String connectionId) {
        int left = 0;
        for (ResourceKey key : List.copyOf(rooms.keySet())) {
            if (leaveConnection(key, connectionId)) {
                left++;
            }
        }
        return left;
    }

    private boolean announceLeave(ResourceKey key, @Nullable Change change, Set<String> audience) {
        if (change == null) {
            return false;
        }
        log.info("Presence leave: resource={} user={} members={}", key, change.user().userId(), change.users().size());
        connectionRegistry.sendTo(audience,
            ServerMessage.presenceLeave(key.domain(), key.resourceId(), change.user()), null);
        connectionRegistry.sendTo(change.audience(),
            ServerMessage.presenceUpdated(key.domain(), key.resourceId(), change.users()), null);
        return true;
    }

    // ── Activity ────────────────────────────────────────────────────────────

    public boolean heartbeat(ResourceKey key, String connectionId) {
        Boolean touched = mutate(key, room -> room.byConnection(connectionId)
            .map(e -> {
                e.getValue().lastActivity = clock.instant();
                return Boolean.TRUE;
            })
            .orElse(null));
        return touched != null;
    }

    /** Record a cursor move for the member backed by {@code connectionId}. */
    public Optional<PresenceUser> updateCursor(ResourceKey key, String connectionId,
                                               @Nullable Integer position, @Nullable Integer line,
                                               @Nullable Integer column, @Nullable Integer selectionStart,
                                               @Nullable Integer selectionEnd) {
        PresenceUser updated = mutate(key, room -> room.byConnection(connectionId)
            .map(e -> {
                Member m = e.getValue();
                m.user = m.user.withCursor(position, line, column, selectionStart, selectionEnd);
                m.lastActivity = clock.instant();
                return m.user;
            })
            .orElse(null));
        return Optional.ofNullable(updated);
    }

    // ── Queries ─────────────────────────────────────────────────────────────

    public List<PresenceUser> members(ResourceKey key) {
        Room room = rooms.get(key);
        if (room == null) return List.of();
        synchronized (room) {
            return room.users();
        }
    }

    public Optional<PresenceUser> memberFor(ResourceKey key, String connectionId) {
        Room room = rooms.get(key);
        if (room == null) return Optional.empty();
        synchronized (room) {
            return room.byConnection(connectionId).map(e -> e.getValue().user);
        }
    }

    /** Socket ids of everyone joined to the resource. */
    public Set<String> audience(ResourceKey key) {
        Room room = rooms.get(key);
        if (room == null) return Set.of();
        synchronized (room) {
            return room.connectionIds();
        }
    }

    // ── Stale sweep ─────────────────────────────────────────────────────────

    /**
     * Evicts members whose last activity is older than the presence timeout.
     * Covers half-open sockets and REST agents that stopped heartbeating.
     */
    @Scheduled(fixedDelay = "${tandem.collab.presence-sweep-interval:15s}")
    public void sweepStale() {
        try {
            Instant cutoff = clock.instant().minus(presenceTimeout);
            int cleaned = 0;
            for (ResourceKey key : List.copyOf(rooms.keySet())) {
                List<String> stale = new ArrayList<>();
                Room room = rooms.get(key);
                if (room == null) continue;
                synchronized (room) {
                    room.members.values().stream()
                        .filter(m -> m.lastActivity.isBefore(cutoff))
                        .forEach(m -> stale.add(m.connectionId));
                }
                for (String connectionId : stale) {
                    if (leaveConnection(key, connectionId)) cleaned++;
                }
            }
            if (cleaned > 0) {
                log.info("Cleaned {} stale presence entries", cleaned);
            }
        } catch (Exception e) {
            log.warn("Error cleaning stale presence: {}", e.getMessage());
        }
    }

    // ── Helpers ─────────────────────────────────────────────────────────────

    /**
     * Run {@code action} against the room for {@code key} while holding the
     * per-resource lock. Empty rooms are discarded together with their colour
     * counter.
     */
    private <T> T mutate(ResourceKey key, Function<Room, T> action) {
        List<T> result = new ArrayList<>(1);
        rooms.compute(key, (k, room) -> {
            Room target = room != null ? room : new Room();
            synchronized (target) {
                result.add(action.apply(target));
                return target.members.isEmpty() ? null : target;
            }
        });
        return result.get(0);
    }

    static String memberKey(String userId, boolean agent) {
        return agent ? userId + "_agent" : userId;
    }
}
