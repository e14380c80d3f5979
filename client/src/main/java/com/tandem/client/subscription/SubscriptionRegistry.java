package com.tandem.client.subscription;

import com.tandem.client.transport.TransportHub;
import com.tandem.protocol.Domain;
import com.tandem.protocol.EventKey;
import com.tandem.protocol.EventKind;
import com.tandem.protocol.ServerMessage;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Fans transport events out to feature callbacks.
 *
 * The first subscription to a (domain, kind) pair attaches exactly one
 * listener to the hub; later subscriptions to the same pair only add a
 * callback. Subscribing does not require a live connection.
 */
@Singleton
public class SubscriptionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionRegistry.class);

    @Inject TransportHub hub;

    private final Map<EventKey, List<Entry>> callbacks = new ConcurrentHashMap<>();

    private static final class Entry {
        final Consumer<ServerMessage> callback;

        Entry(Consumer<ServerMessage> callback) {
            this.callback = callback;
        }
    }

    public Subscription subscribe(Domain domain, EventKind kind, Consumer<ServerMessage> callback) {
        EventKey key = EventKey.of(domain, kind);
        Entry entry = new Entry(callback);
        callbacks.computeIfAbsent(key, k -> {
            hub.addListener(k, message -> fanOut(k, message));
            log.debug("Attached transport listener for {}", k.wireName());
            return new CopyOnWriteArrayList<>();
        }).add(entry);

        AtomicBoolean closed = new AtomicBoolean();
        return () -> {
            if (closed.compareAndSet(false, true)) {
                List<Entry> forKey = callbacks.get(key);
                if (forKey != null) {
                    forKey.remove(entry);
                }
            }
        };
    }

    public int callbackCount(Domain domain, EventKind kind) {
        List<Entry> forKey = callbacks.get(EventKey.of(domain, kind));
        return forKey == null ? 0 : forKey.size();
    }

    /** Drop every callback; used when the client session shuts down. */
    public void clear() {
        callbacks.clear();
    }

    private void fanOut(EventKey key, ServerMessage message) {
        List<Entry> forKey = callbacks.get(key);
        if (forKey == null) return;
        for (Entry entry : forKey) {
            try {
                entry.callback.accept(message);
            } catch (RuntimeException e) {
                log.warn("Subscriber for {} failed: {}", key.wireName(), e.getMessage(), e);
            }
        }
    }
}
