package com.tandem.client.session;

import com.tandem.client.ClientConfiguration;
import com.tandem.client.lock.LockCoordinator;
import com.tandem.client.subscription.Subscription;
import com.tandem.client.subscription.SubscriptionRegistry;
import com.tandem.client.transport.ConnectionStateListener;
import com.tandem.client.transport.TransportHub;
import com.tandem.protocol.ClientMessage;
import com.tandem.protocol.Domain;
import com.tandem.protocol.EventKind;
import com.tandem.protocol.LockHolder;
import com.tandem.protocol.LockResult;
import com.tandem.protocol.ServerMessage;
import io.micronaut.scheduling.TaskScheduler;
import jakarta.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Everything one open editor does with the coordination layer.
 *
 * <p>Opening a session takes a transport reference, joins presence and keeps
 * it alive; closing leaves, releases a held lock and cancels every timer the
 * session started. Timers belong to the session, so switching resources never
 * leaks them.
 *
 * <p>Echo rules: remote content is dropped while a local edit is younger than
 * {@code local-edit-debounce}. Applied remote content marks the session
 * remote-origin for {@code remote-origin-window}; local changes reported in
 * that window are not broadcast back.
 */
public class EditorSession implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EditorSession.class);

    private static final Set<EventKind> KINDS = EnumSet.of(
        EventKind.PRESENCE_UPDATED, EventKind.CURSOR, EventKind.CONTENT_CHANGE, EventKind.CONTENT_SYNC,
        EventKind.STREAM_START, EventKind.STREAM_CHUNK, EventKind.STREAM_END, EventKind.LOCK_UPDATED);

    private final Domain domain;
    private final String resourceId;
    private final EditorListener editor;
    private final TransportHub hub;
    private final SubscriptionRegistry subscriptions;
    private final LockCoordinator locks;
    private final TaskScheduler scheduler;
    private final Clock clock;
    private final ClientConfiguration config;

    private final List<Subscription> handles = new ArrayList<>();
    private final Map<String, ScheduledFuture<?>> typingTimers = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final ConnectionStateListener rejoin = reconnect -> sendJoin();

    private volatile boolean remoteOrigin;
    private volatile Instant lastLocalEdit;
    private volatile StreamingIndicator streaming;

    // guarded by this
    private ScheduledFuture<?> remoteOriginTimer;
    private ScheduledFuture<?> presenceHeartbeat;
    private ScheduledFuture<?> lockHeartbeat;

    public EditorSession(Domain domain, String resourceId, EditorListener editor, TransportHub hub,
                         SubscriptionRegistry subscriptions, LockCoordinator locks, TaskScheduler scheduler,
                         Clock clock, ClientConfiguration config) {
        this.domain = domain;
        this.resourceId = resourceId;
        this.editor = editor;
        this.hub = hub;
        this.subscriptions = subscriptions;
        this.locks = locks;
        this.scheduler = scheduler;
        this.clock = clock;
        this.config = config;
    }

    /** Take a transport reference, subscribe and join presence. */
    public EditorSession open() {
        for (EventKind kind : KINDS) {
            handles.add(subscriptions.subscribe(domain, kind, this::onEvent));
        }
        hub.addStateListener(rejoin);
        boolean shared = hub.isConnected();
        hub.connect();
        if (shared) {
            // the channel was already up, so no connect event will trigger the join
            sendJoin();
        }
        synchronized (this) {
            presenceHeartbeat = scheduler.scheduleAtFixedRate(config.getPresenceHeartbeatInterval(),
                config.getPresenceHeartbeatInterval(), () -> hub.send(ClientMessage.heartbeat(domain, resourceId)));
        }
        log.info("Editor session opened: {}/{}", domain.wireName(), resourceId);
        return this;
    }

    public Domain domain() {
        return domain;
    }

    public String resourceId() {
        return resourceId;
    }

    // ── Outbound ────────────────────────────────────────────────────────────

    /**
     * Report a local edit.
     *
     * @return true if it was broadcast; false inside the remote-origin window or while disconnected
     */
    public boolean onLocalChange(String content, int cursorPosition) {
        if (remoteOrigin) {
            return false;
        }
        lastLocalEdit = clock.instant();
        return hub.send(ClientMessage.content(domain, resourceId, content, cursorPosition));
    }

    public boolean broadcastCursor(int line, int column, int position,
                                   @Nullable Integer selectionStart, @Nullable Integer selectionEnd) {
        return hub.send(ClientMessage.cursor(domain, resourceId, line, column, position, selectionStart, selectionEnd));
    }

    public boolean isRemoteOrigin() {
        return remoteOrigin;
    }

    @Nullable
    public StreamingIndicator streaming() {
        return streaming;
    }

    // ── Locking ─────────────────────────────────────────────────────────────

    /**
     * Ask for the edit lock; on success the session keeps it alive until unlock
     * or close. A grant that arrives after the session closed is released at once.
     */
    public CompletableFuture<LockResult> lock() {
        return locks.lock(domain, resourceId).thenApply(result -> {
            if (result.success() && !startLockHeartbeat()) {
                log.info("Lock on {}/{} granted after close, releasing", domain.wireName(), resourceId);
                locks.unlock(domain, resourceId);
            }
            return result;
        });
    }

    public CompletableFuture<LockResult> unlock() {
        stopLockHeartbeat();
        return locks.unlock(domain, resourceId);
    }

    public synchronized boolean holdsLock() {
        return lockHeartbeat != null;
    }

    /** @return false when the session is already closed */
    private synchronized boolean startLockHeartbeat() {
        if (closed.get()) return false;
        if (lockHeartbeat == null) {
            lockHeartbeat = scheduler.scheduleAtFixedRate(config.getLockHeartbeatInterval(),
                config.getLockHeartbeatInterval(), this::sendLockHeartbeat);
        }
        return true;
    }

    /** One heartbeat; a rejection means the lock is gone. Transport failures leave it to the next beat. */
    private void sendLockHeartbeat() {
        locks.heartbeat(domain, resourceId).thenAccept(result -> {
            if (!result.success() && stopLockHeartbeat()) {
                log.info("Lost lock on {}/{}: {}", domain.wireName(), resourceId, result.message());
            }
        });
    }

    /** @return whether a heartbeat was running */
    private synchronized boolean stopLockHeartbeat() {
        if (lockHeartbeat == null) return false;
        lockHeartbeat.cancel(false);
        lockHeartbeat = null;
        return true;
    }

    // ── Inbound ─────────────────────────────────────────────────────────────

    void onEvent(ServerMessage message) {
        if (closed.get() || !resourceId.equals(message.resourceId())) {
            return;
        }
        switch (message.eventKey().kind()) {
            case PRESENCE_UPDATED -> editor.presenceChanged(message.users());
            case CURSOR -> {
                if (message.user() != null) editor.cursorMoved(message.user());
            }
            case CONTENT_CHANGE -> onRemoteContent(message);
            case CONTENT_SYNC -> {
                if (message.content() != null) applyRemote(() -> editor.replaceContent(message.content()));
            }
            case STREAM_START -> setStreaming(new StreamingIndicator(message.sessionId(), message.userId(),
                message.agentName(), message.color()));
            case STREAM_CHUNK -> onStreamChunk(message);
            case STREAM_END -> {
                StreamingIndicator current = streaming;
                if (current != null && current.sessionId().equals(message.sessionId())) {
                    setStreaming(null);
                }
            }
            case LOCK_UPDATED -> onLockUpdated(message.lockedBy());
            default -> log.debug("Ignoring {} in editor session", message.type());
        }
    }

    private void onRemoteContent(ServerMessage message) {
        if (message.content() == null) return;
        Instant local = lastLocalEdit;
        if (local != null && clock.instant().isBefore(local.plus(config.getLocalEditDebounce()))) {
            log.debug("Remote content from {} dropped, local edit in progress", message.userId());
            return;
        }
        applyRemote(() -> editor.replaceContent(message.content()));
        if (message.userId() != null) {
            showTyping(message.userId());
        }
    }

    /** The reported position is where the stream stands after this chunk. */
    private void onStreamChunk(ServerMessage message) {
        if (message.text() == null || message.position() == null) return;
        int at = Math.max(0, message.position() - message.text().length());
        applyRemote(() -> editor.insertText(at, message.text()));
    }

    /**
     * Lock updates are not ordered against our own lock requests: a release
     * announcement can arrive after a newer grant. While holding, an update
     * naming someone else is checked with the server before the lock is dropped.
     */
    private void onLockUpdated(@Nullable LockHolder holder) {
        if ((holder == null || !holder.userId().equals(config.getUserId())) && holdsLock()) {
            sendLockHeartbeat();
        }
        editor.lockChanged(holder);
    }

    private void applyRemote(Runnable apply) {
        synchronized (this) {
            remoteOrigin = true;
            if (remoteOriginTimer != null) {
                remoteOriginTimer.cancel(false);
            }
        }
        try {
            apply.run();
        } finally {
            synchronized (this) {
                remoteOriginTimer = scheduler.schedule(config.getRemoteOriginWindow(), () -> remoteOrigin = false);
            }
        }
    }

    private void showTyping(String userId) {
        editor.typingChanged(userId, true);
        ScheduledFuture<?> previous = typingTimers.put(userId, scheduler.schedule(config.getTypingIndicator(), () -> {
            typingTimers.remove(userId);
            editor.typingChanged(userId, false);
        }));
        if (previous != null) {
            previous.cancel(false);
        }
    }

    private void setStreaming(@Nullable StreamingIndicator indicator) {
        streaming = indicator;
        editor.streamingChanged(indicator);
    }

    private void sendJoin() {
        if (!closed.get()) {
            hub.send(ClientMessage.join(domain, resourceId));
        }
    }

    // ── Teardown ────────────────────────────────────────────────────────────

    /** Leave, release a held lock and cancel every timer. Best-effort; safe to call twice. */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        boolean heldLock = stopLockHeartbeat();
        synchronized (this) {
            if (presenceHeartbeat != null) presenceHeartbeat.cancel(false);
            if (remoteOriginTimer != null) remoteOriginTimer.cancel(false);
        }
        typingTimers.values().forEach(t -> t.cancel(false));
        typingTimers.clear();

        if (heldLock) {
            locks.unlock(domain, resourceId);
        }
        hub.send(ClientMessage.leave(domain, resourceId));
        handles.forEach(Subscription::close);
        hub.removeStateListener(rejoin);
        hub.disconnect();
        log.info("Editor session closed: {}/{}", domain.wireName(), resourceId);
    }
}
