package com.tandem.client.tree;

import com.tandem.client.ClientConfiguration;
import com.tandem.client.subscription.Subscription;
import com.tandem.client.subscription.SubscriptionRegistry;
import com.tandem.protocol.Domain;
import com.tandem.protocol.EventKind;
import com.tandem.protocol.ResourceNode;
import jakarta.annotation.Nullable;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Turns {@code {domain}_tree_changed} signals into classified change batches.
 *
 * <p>One baseline tree is kept per tracked (domain, scope). On every signal
 * the tree is fetched again from the storage collaborator, diffed against
 * the baseline, and the fetched tree becomes the new baseline. A missed
 * signal therefore folds into the next diff. The first fetch of a scope
 * only establishes its baseline. Fetches may overlap; a result older than
 * the applied baseline is discarded.
 *
 * <p>Batches that arrive shortly after a local mutation in the same domain
 * are echoes of our own change: the baseline still moves and listeners still
 * hear about it, but nothing is surfaced.
 */
@Singleton
public class TreeChangeTracker {

    private static final Logger log = LoggerFactory.getLogger(TreeChangeTracker.class);

    @Inject ResourceStore resourceStore;
    @Inject TreeDiffEngine diffEngine;
    @Inject SubscriptionRegistry subscriptions;
    @Inject ClientConfiguration config;
    @Inject Clock clock;

    public record Scope(Domain domain, @Nullable String scope) {}

    /** A fetched tree and the issue order of the fetch that produced it. */
    private record Baseline(List<ResourceNode> tree, long sequence) {}

    private final Set<Scope> tracked = ConcurrentHashMap.newKeySet();
    private final Map<Scope, Baseline> baselines = new ConcurrentHashMap<>();
    private final AtomicLong fetchSequence = new AtomicLong();
    private final Map<Domain, Subscription> signals = new ConcurrentHashMap<>();
    private final Map<Domain, Instant> localMutations = new ConcurrentHashMap<>();
    private final List<TreeChangeListener> listeners = new CopyOnWriteArrayList<>();

    // ── Tracking ────────────────────────────────────────────────────────────

    /** Start tracking a scope; completes once its baseline has been fetched. */
    public CompletableFuture<Void> track(Domain domain, @Nullable String scope) {
        Scope key = new Scope(domain, scope);
        tracked.add(key);
        signals.computeIfAbsent(domain,
            d -> subscriptions.subscribe(d, EventKind.TREE_CHANGED, message -> refreshDomain(d)));
        return refresh(key).thenApply(batch -> null);
    }

    public void untrack(Domain domain, @Nullable String scope) {
        Scope key = new Scope(domain, scope);
        tracked.remove(key);
        baselines.remove(key);
        if (tracked.stream().noneMatch(s -> s.domain() == domain)) {
            Subscription signal = signals.remove(domain);
            if (signal != null) signal.close();
        }
    }

    public boolean isTracking(Domain domain, @Nullable String scope) {
        return tracked.contains(new Scope(domain, scope));
    }

    public Subscription addListener(TreeChangeListener listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    /** Forget all scopes, baselines and listeners. */
    public void clear() {
        signals.values().forEach(Subscription::close);
        signals.clear();
        tracked.clear();
        baselines.clear();
        localMutations.clear();
        listeners.clear();
    }

    /** Record that this client just changed the tree of {@code domain}. */
    public void markLocalMutation(Domain domain) {
        localMutations.put(domain, clock.instant());
    }

    // ── Refresh ─────────────────────────────────────────────────────────────

    /** Re-fetch every tracked scope, e.g. after the transport reconnects. */
    public CompletableFuture<Void> refreshAll() {
        return CompletableFuture.allOf(tracked.stream().map(this::refresh).toArray(CompletableFuture[]::new));
    }

    void refreshDomain(Domain domain) {
        tracked.stream().filter(s -> s.domain() == domain).forEach(this::refresh);
    }

    /**
     * Fetch, diff and publish one scope. Fetch failures leave the baseline as
     * it was and complete with an empty result.
     */
    public CompletableFuture<Optional<ChangeBatch>> refresh(Scope scope) {
        long sequence = fetchSequence.incrementAndGet();
        return resourceStore.getTree(scope.domain(), scope.scope())
            .thenApply(tree -> apply(scope, tree, sequence))
            .exceptionally(e -> {
                log.warn("Could not fetch {} tree (scope={}): {}", scope.domain().wireName(), scope.scope(),
                    e.getMessage());
                return Optional.empty();
            });
    }

    Optional<ChangeBatch> apply(Scope scope, List<ResourceNode> tree, long sequence) {
        if (!tracked.contains(scope)) {
            return Optional.empty();
        }
        List<ResourceNode> next = List.copyOf(tree);
        AtomicReference<List<ResourceNode>> previous = new AtomicReference<>();
        AtomicBoolean outdated = new AtomicBoolean();
        baselines.compute(scope, (k, old) -> {
            if (old != null && old.sequence() > sequence) {
                outdated.set(true);
                return old;
            }
            previous.set(old == null ? null : old.tree());
            return new Baseline(next, sequence);
        });
        if (outdated.get()) {
            log.debug("Discarded outdated {} tree (scope={})", scope.domain().wireName(), scope.scope());
            return Optional.empty();
        }
        if (previous.get() == null) {
            log.debug("Baseline established for {} (scope={})", scope.domain().wireName(), scope.scope());
            return Optional.empty();
        }

        List<ChangeRecord> changes = diffEngine.classify(previous.get(), next);
        if (changes.isEmpty()) {
            return Optional.empty();
        }

        ChangeBatch batch = isLocalEcho(scope.domain())
            ? new ChangeBatch(scope.domain(), scope.scope(), changes, List.of(), 0, true)
            : capped(scope, changes);
        log.debug("{} change(s) in {} (surfaced={}, suppressed={})", changes.size(), scope.domain().wireName(),
            batch.surfaced().size(), batch.suppressed());
        publish(batch);
        return Optional.of(batch);
    }

    private ChangeBatch capped(Scope scope, List<ChangeRecord> changes) {
        int limit = config.getMaxNotificationsPerKind();
        Map<ChangeKind, Integer> counts = new EnumMap<>(ChangeKind.class);
        List<ChangeRecord> surfaced = new ArrayList<>();
        for (ChangeRecord change : changes) {
            int seen = counts.merge(change.kind(), 1, Integer::sum);
            if (seen <= limit) {
                surfaced.add(change);
            }
        }
        return new ChangeBatch(scope.domain(), scope.scope(), changes, surfaced,
            changes.size() - surfaced.size(), false);
    }

    private boolean isLocalEcho(Domain domain) {
        Instant mutatedAt = localMutations.get(domain);
        return mutatedAt != null && !clock.instant().isAfter(mutatedAt.plus(config.getLocalEchoWindow()));
    }

    private void publish(ChangeBatch batch) {
        for (TreeChangeListener listener : listeners) {
            try {
                listener.onChanges(batch);
            } catch (RuntimeException e) {
                log.warn("Tree change listener failed: {}", e.getMessage(), e);
            }
        }
    }
}
