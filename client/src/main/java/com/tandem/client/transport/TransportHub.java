package com.tandem.client.transport;

import com.tandem.client.ClientConfiguration;
import com.tandem.protocol.ClientMessage;
import com.tandem.protocol.EventKey;
import com.tandem.protocol.ServerMessage;
import io.micronaut.scheduling.TaskExecutors;
import io.micronaut.scheduling.TaskScheduler;
import io.micronaut.serde.ObjectMapper;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * One shared, reference-counted channel to the collaboration server.
 *
 * <p>Features call {@link #connect()} when they need live events and
 * {@link #disconnect()} when done; the physical channel is closed only when
 * the last user lets go. An unexpected drop is retried a bounded number of
 * times, after which the hub settles in {@link ConnectionState#DISCONNECTED}.
 * Callers treat that as a normal state: nothing is queued while
 * disconnected and nothing is replayed after a reconnect.
 *
 * <p>Lifecycle is owned by the client session: {@link #init()} before first
 * use, {@link #shutdown()} to tear everything down regardless of the count.
 */
@Singleton
public class TransportHub {

    private static final Logger log = LoggerFactory.getLogger(TransportHub.class);

    @Inject ChannelFactory channelFactory;
    @Inject ObjectMapper objectMapper;
    @Inject ClientConfiguration config;
    @Inject @Named(TaskExecutors.SCHEDULED) TaskScheduler taskScheduler;

    private final Object lock = new Object();
    private final Map<EventKey, List<Consumer<ServerMessage>>> listeners = new ConcurrentHashMap<>();
    private final List<ConnectionStateListener> stateListeners = new CopyOnWriteArrayList<>();

    // guarded by lock
    private boolean initialized;
    private int refCount;
    private TransportChannel channel;
    private ConnectionState state = ConnectionState.DISCONNECTED;
    private int reconnectAttempts;
    private ScheduledFuture<?> reconnectTask;
    private long generation;

    // ── Lifecycle ───────────────────────────────────────────────────────────

    public void init() {
        synchronized (lock) {
            initialized = true;
        }
        log.info("Transport hub initialised for {}", config.getServerUrl());
    }

    public void shutdown() {
        synchronized (lock) {
            if (!initialized) return;
            initialized = false;
            refCount = 0;
            closeChannel();
        }
        listeners.clear();
        stateListeners.clear();
        log.info("Transport hub shut down");
    }

    // ── Reference counting ──────────────────────────────────────────────────

    /** Take a reference, opening the channel if this is the first one. */
    public void connect() {
        synchronized (lock) {
            if (!initialized) {
                throw new IllegalStateException("Transport hub not initialised");
            }
            refCount++;
            log.debug("Transport connect: refCount={}", refCount);
            if (channel == null && state == ConnectionState.DISCONNECTED) {
                reconnectAttempts = 0;
                openChannel(false);
            }
        }
    }

    /** Release a reference; the channel closes when none remain. Extra calls are ignored. */
    public void disconnect() {
        synchronized (lock) {
            if (refCount == 0) return;
            refCount--;
            log.debug("Transport disconnect: refCount={}", refCount);
            if (refCount == 0) {
                closeChannel();
            }
        }
    }

    public int refCount() {
        synchronized (lock) {
            return refCount;
        }
    }

    public ConnectionState state() {
        synchronized (lock) {
            return state;
        }
    }

    public boolean isConnected() {
        synchronized (lock) {
            return channel != null && channel.isOpen();
        }
    }

    // ── Messaging ───────────────────────────────────────────────────────────

    /**
     * Fire-and-forget send.
     *
     * @return false when there is no live channel; the message is dropped
     */
    public boolean send(ClientMessage message) {
        TransportChannel current;
        synchronized (lock) {
            current = channel;
        }
        if (current == null || !current.isOpen()) {
            log.debug("Dropped {} while disconnected", message.type());
            return false;
        }
        try {
            return current.send(objectMapper.writeValueAsString(message));
        } catch (IOException e) {
            log.warn("Could not serialise {}: {}", message.type(), e.getMessage());
            return false;
        }
    }

    public void addListener(EventKey key, Consumer<ServerMessage> listener) {
        listeners.computeIfAbsent(key, k -> new CopyOnWriteArrayList<>()).add(listener);
    }

    public int listenerCount(EventKey key) {
        List<Consumer<ServerMessage>> forKey = listeners.get(key);
        return forKey == null ? 0 : forKey.size();
    }

    public void addStateListener(ConnectionStateListener listener) {
        stateListeners.add(listener);
    }

    public void removeStateListener(ConnectionStateListener listener) {
        stateListeners.remove(listener);
    }

    // ── Channel management (callers hold lock) ──────────────────────────────

    private void openChannel(boolean reconnect) {
        long gen = ++generation;
        state = reconnect ? ConnectionState.RECONNECTING : ConnectionState.CONNECTING;
        channelFactory.open(new Handler(gen))
            .orTimeout(config.getConnectTimeout().toMillis(), TimeUnit.MILLISECONDS)
            .whenComplete((opened, error) -> onOpened(gen, opened, error, reconnect));
    }

    private void closeChannel() {
        generation++;
        if (reconnectTask != null) {
            reconnectTask.cancel(false);
            reconnectTask = null;
        }
        TransportChannel closing = channel;
        channel = null;
        state = ConnectionState.DISCONNECTED;
        if (closing != null) {
            closing.close();
            log.info("Transport channel closed");
        }
    }

    private void scheduleReconnect() {
        if (reconnectAttempts >= config.getMaxReconnectAttempts()) {
            state = ConnectionState.DISCONNECTED;
            log.warn("Giving up on collaboration server after {} reconnect attempts", reconnectAttempts);
            return;
        }
        reconnectAttempts++;
        Duration delay = reconnectDelay(reconnectAttempts);
        state = ConnectionState.RECONNECTING;
        long gen = generation;
        log.info("Reconnecting in {} ms (attempt {}/{})", delay.toMillis(), reconnectAttempts,
            config.getMaxReconnectAttempts());
        reconnectTask = taskScheduler.schedule(delay, () -> {
            synchronized (lock) {
                if (gen != generation || refCount == 0) return;
                reconnectTask = null;
                openChannel(true);
            }
        });
    }

    /** Doubles from the base delay, never above the ceiling. */
    Duration reconnectDelay(int attempt) {
        Duration delay = config.getReconnectDelay().multipliedBy(1L << Math.min(attempt - 1, 16));
        return delay.compareTo(config.getMaxReconnectDelay()) > 0 ? config.getMaxReconnectDelay() : delay;
    }

    // ── Channel callbacks ───────────────────────────────────────────────────

    private void onOpened(long gen, TransportChannel opened, Throwable error, boolean reconnect) {
        synchronized (lock) {
            if (gen != generation || refCount == 0) {
                if (opened != null) opened.close();
                return;
            }
            if (error != null) {
                log.warn("Could not open collaboration channel: {}", error.getMessage());
                scheduleReconnect();
                return;
            }
            channel = opened;
            reconnectAttempts = 0;
            state = ConnectionState.CONNECTED;
        }
        log.info("Transport channel {}", reconnect ? "re-established" : "open");
        for (ConnectionStateListener l : stateListeners) {
            try {
                l.onConnected(reconnect);
            } catch (RuntimeException e) {
                log.warn("Connection listener failed: {}", e.getMessage(), e);
            }
        }
    }

    private void onClosed(long gen) {
        synchronized (lock) {
            if (gen != generation) return;
            channel = null;
            if (refCount > 0) {
                log.warn("Transport channel dropped unexpectedly");
                scheduleReconnect();
            } else {
                state = ConnectionState.DISCONNECTED;
            }
        }
        for (ConnectionStateListener l : stateListeners) {
            try {
                l.onDisconnected();
            } catch (RuntimeException e) {
                log.warn("Connection listener failed: {}", e.getMessage(), e);
            }
        }
    }

    private void dispatch(String frame) {
        ServerMessage message;
        EventKey key;
        try {
            message = objectMapper.readValue(frame, ServerMessage.class);
            key = message.eventKey();
        } catch (IOException | IllegalArgumentException e) {
            log.debug("Ignoring unreadable frame: {}", e.getMessage());
            return;
        }
        List<Consumer<ServerMessage>> forKey = listeners.get(key);
        if (forKey == null) return;
        for (Consumer<ServerMessage> l : forKey) {
            try {
                l.accept(message);
            } catch (RuntimeException e) {
                log.warn("Listener for {} failed: {}", key.wireName(), e.getMessage(), e);
            }
        }
    }

    /** Binds a channel's callbacks to the generation that opened it. */
    private final class Handler implements ChannelListener {
        private final long gen;

        Handler(long gen) {
            this.gen = gen;
        }

        @Override
        public void onFrame(String frame) {
            dispatch(frame);
        }

        @Override
        public void onClosed() {
            TransportHub.this.onClosed(gen);
        }
    }
}
