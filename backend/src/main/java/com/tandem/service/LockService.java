package com.tandem.service;

import com.tandem.domain.ResourceKey;
import com.tandem.protocol.LockHolder;
import com.tandem.protocol.LockResult;
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
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Advisory, time-limited edit locks.
 *
 * One live lock per resource. A lock whose last heartbeat is older than the
 * TTL is abandoned and may be taken by anyone. The TTL defaults to 2.5x the
 * client heartbeat interval so a single missed heartbeat never loses a lock.
 *
 * State transitions run inside {@code locks.compute(key, ...)}: one critical
 * section per resource, no global lock. Every acquire, release, expiry and
 * force-unlock is announced as {@code {domain}_lock_updated}; heartbeats are
 * silent.
 */
@Singleton
public class LockService {

    private static final Logger log = LoggerFactory.getLogger(LockService.class);

    @Inject ConnectionRegistry connectionRegistry;
    @Inject Clock clock;

    @Value("${tandem.collab.lock-ttl:300s}")
    Duration lockTtl;

    private final ConcurrentHashMap<ResourceKey, LockHolder> locks = new ConcurrentHashMap<>();

    /** Outcome computed under the per-resource lock; announced afterwards. */
    private record Transition(LockResult result, boolean changed, @Nullable LockHolder holder) {}

    public LockResult acquire(ResourceKey key, String userId, String username) {
        Instant now = clock.instant();
        Transition t = transition(key, (current, out) -> {
            if (current == null || isExpired(current, now)) {
                if (current != null) {
                    log.info("Lock taken over: resource={} abandoned by {}", key, current.userId());
                }
                LockHolder holder = new LockHolder(userId, username, now, now);
                out.add(new Transition(LockResult.granted("Resource locked", holder), true, holder));
                return holder;
            }
            if (current.userId().equals(userId)) {
                LockHolder refreshed = new LockHolder(userId, username, current.acquiredAt(), now);
                out.add(new Transition(LockResult.granted("Lock refreshed", refreshed), true, refreshed));
                return refreshed;
            }
            out.add(new Transition(LockResult.denied("Resource already locked", current), false, current));
            return current;
        });

        if (t.changed()) {
            log.info("Lock acquired: resource={} user={}", key, userId);
            announce(key, t.holder());
        } else {
            log.debug("Lock denied: resource={} user={} holder={}", key, userId, t.holder().userId());
        }
        return t.result();
    }

    /** Renew the holder's lock. A heartbeat from anyone else changes nothing. */
    public LockResult heartbeat(ResourceKey key, String userId) {
        Instant now = clock.instant();
        Transition t = transition(key, (current, out) -> {
            if (current == null || isExpired(current, now)) {
                out.add(new Transition(LockResult.denied("Resource not locked", null), false, null));
                return current;
            }
            if (!current.userId().equals(userId)) {
                out.add(new Transition(LockResult.denied("Lock owned by another user", current), false, current));
                return current;
            }
            LockHolder renewed = new LockHolder(current.userId(), current.username(), current.acquiredAt(), now);
            out.add(new Transition(LockResult.granted("Heartbeat recorded", renewed), false, renewed));
            return renewed;
        });
        return t.result();
    }

    /** Release by the holder only; a non-holder release leaves the lock intact. */
    public LockResult release(ResourceKey key, String userId) {
        Transition t = transition(key, (current, out) -> {
            if (current == null) {
                out.add(new Transition(LockResult.released("Resource not locked"), false, null));
                return null;
            }
            if (!current.userId().equals(userId)) {
                out.add(new Transition(LockResult.denied("Lock owned by another user", current), false, current));
                return current;
            }
            out.add(new Transition(LockResult.released("Resource unlocked"), true, null));
            return null;
        });

        if (t.changed()) {
            log.info("Lock released: resource={} user={}", key, userId);
            announce(key, null);
        }
        return t.result();
    }

    /** Administrative unlock, regardless of holder. Like {@link #release}, an unlocked resource is a no-op. */
    public LockResult forceUnlock(ResourceKey key) {
        LockHolder removed = locks.remove(key);
        if (removed == null) {
            return LockResult.released("Resource not locked");
        }
        log.info("Lock force-released: resource={} previous holder={}", key, removed.userId());
        announce(key, null);
        return LockResult.released("Resource force unlocked");
    }

    /** Live (non-expired) holder of the resource, if any. */
    public Optional<LockHolder> current(ResourceKey key) {
        LockHolder holder = locks.get(key);
        if (holder == null || isExpired(holder, clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(holder);
    }

    /** Drop every lock held by a user whose last connection went away. */
    public int releaseAllHeldBy(String userId) {
        int released = 0;
        for (Map.Entry<ResourceKey, LockHolder> entry : List.copyOf(locks.entrySet())) {
            if (entry.getValue().userId().equals(userId) && release(entry.getKey(), userId).success()) {
                released++;
            }
        }
        return released;
    }

    /**
     * Scheduled expiry sweep.
     * Removes abandoned locks and tells everyone the resource is free again.
     */
    @Scheduled(fixedDelay = "${tandem.collab.lock-sweep-interval:30s}")
    public void sweepExpired() {
        try {
            Instant now = clock.instant();
            int expired = 0;
            for (ResourceKey key : List.copyOf(locks.keySet())) {
                AtomicBoolean removed = new AtomicBoolean();
                locks.computeIfPresent(key, (k, holder) -> {
                    if (isExpired(holder, now)) {
                        removed.set(true);
                        return null;
                    }
                    return holder;
                });
                if (removed.get()) {
                    announce(key, null);
                    expired++;
                }
            }
            if (expired > 0) {
                log.info("Cleaned {} expired locks", expired);
            }
        } catch (Exception e) {
            log.warn("Error cleaning expired locks: {}", e.getMessage());
        }
    }

    boolean isExpired(LockHolder holder, Instant now) {
        return Duration.between(holder.lastHeartbeatAt(), now).compareTo(lockTtl) > 0;
    }

    // ── Helpers ─────────────────────────────────────────────────────────────

    @FunctionalInterface
    private interface Step {
        /** Returns the new lock (null to remove) and records the outcome in {@code out}. */
        @Nullable LockHolder apply(@Nullable LockHolder current, List<Transition> out);
    }

    private Transition transition(ResourceKey key, Step step) {
        List<Transition> out = new ArrayList<>(1);
        locks.compute(key, (k, current) -> step.apply(current, out));
        return out.get(0);
    }

    private void announce(ResourceKey key, @Nullable LockHolder holder) {
        connectionRegistry.broadcastAll(ServerMessage.lockUpdated(key.domain(), key.resourceId(), holder));
    }
}
