package com.tandem.client;

import com.tandem.client.lock.LockCoordinator;
import com.tandem.client.session.EditorListener;
import com.tandem.client.session.EditorSession;
import com.tandem.client.subscription.Subscription;
import com.tandem.client.subscription.SubscriptionRegistry;
import com.tandem.client.transport.ConnectionStateListener;
import com.tandem.client.transport.TransportHub;
import com.tandem.client.tree.TreeChangeListener;
import com.tandem.client.tree.TreeChangeTracker;
import com.tandem.protocol.Domain;
import com.tandem.protocol.EventKind;
import com.tandem.protocol.LockResult;
import com.tandem.protocol.ServerMessage;
import io.micronaut.scheduling.TaskExecutors;
import io.micronaut.scheduling.TaskScheduler;
import jakarta.annotation.Nullable;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Entry point for applications: one instance per signed-in session.
 *
 * <pre>{@code
 * client.init();
 * client.connect();
 * client.onTreeChanges(batch -> toast(batch.surfaced()));
 * EditorSession editor = client.joinResource(Domain.DOCUMENT, "doc-1", listener);
 * editor.lock().thenAccept(result -> setEditable(result.success()));
 * ...
 * client.leaveResource(Domain.DOCUMENT, "doc-1");
 * client.shutdown();
 * }</pre>
 */
@Singleton
public class CollabClient {

    private static final Logger log = LoggerFactory.getLogger(CollabClient.class);

    @Inject TransportHub hub;
    @Inject SubscriptionRegistry subscriptions;
    @Inject LockCoordinator locks;
    @Inject TreeChangeTracker treeTracker;
    @Inject ClientConfiguration config;
    @Inject Clock clock;
    @Inject @Named(TaskExecutors.SCHEDULED) TaskScheduler scheduler;

    private final Map<String, EditorSession> sessions = new ConcurrentHashMap<>();
    private final ConnectionStateListener resync = reconnect -> {
        if (reconnect) {
            treeTracker.refreshAll();
        }
    };

    // ── Lifecycle ───────────────────────────────────────────────────────────

    public void init() {
        hub.init();
        hub.addStateListener(resync);
        log.info("Collaboration client ready for user {}", config.getUserId());
    }

    @PreDestroy
    public void shutdown() {
        sessions.values().forEach(EditorSession::close);
        sessions.clear();
        treeTracker.clear();
        subscriptions.clear();
        hub.shutdown();
    }

    public void connect() {
        hub.connect();
    }

    public void disconnect() {
        hub.disconnect();
    }

    // ── Domain events ───────────────────────────────────────────────────────

    public Subscription onTreeChanged(Domain domain, Consumer<ServerMessage> callback) {
        return subscriptions.subscribe(domain, EventKind.TREE_CHANGED, callback);
    }

    public Subscription onLockUpdated(Domain domain, Consumer<ServerMessage> callback) {
        return subscriptions.subscribe(domain, EventKind.LOCK_UPDATED, callback);
    }

    public Subscription onContentUpdated(Domain domain, Consumer<ServerMessage> callback) {
        return subscriptions.subscribe(domain, EventKind.CONTENT_UPDATED, callback);
    }

    /** Classified tree changes for every scope passed to {@link #trackTree}. */
    public Subscription onTreeChanges(TreeChangeListener listener) {
        return treeTracker.addListener(listener);
    }

    public CompletableFuture<Void> trackTree(Domain domain, @Nullable String scope) {
        return treeTracker.track(domain, scope);
    }

    public void untrackTree(Domain domain, @Nullable String scope) {
        treeTracker.untrack(domain, scope);
    }

    /** Call right before asking storage to change the tree, to mute the echo. */
    public void markLocalMutation(Domain domain) {
        treeTracker.markLocalMutation(domain);
    }

    // ── Locks ───────────────────────────────────────────────────────────────

    public CompletableFuture<LockResult> lock(Domain domain, String resourceId) {
        EditorSession session = sessions.get(sessionKey(domain, resourceId));
        return session != null ? session.lock() : locks.lock(domain, resourceId);
    }

    public CompletableFuture<LockResult> unlock(Domain domain, String resourceId) {
        EditorSession session = sessions.get(sessionKey(domain, resourceId));
        return session != null ? session.unlock() : locks.unlock(domain, resourceId);
    }

    public CompletableFuture<LockResult> heartbeat(Domain domain, String resourceId) {
        return locks.heartbeat(domain, resourceId);
    }

    // ── Resources ───────────────────────────────────────────────────────────

    /** Join a resource for editing. Joining one that is already open returns the open session. */
    public EditorSession joinResource(Domain domain, String resourceId, EditorListener editor) {
        return sessions.computeIfAbsent(sessionKey(domain, resourceId), k ->
            new EditorSession(domain, resourceId, editor, hub, subscriptions, locks, scheduler, clock, config).open());
    }

    public void leaveResource(Domain domain, String resourceId) {
        EditorSession session = sessions.remove(sessionKey(domain, resourceId));
        if (session != null) {
            session.close();
        }
    }

    public boolean broadcastCursor(Domain domain, String resourceId, int line, int column, int position,
                                   @Nullable Integer selectionStart, @Nullable Integer selectionEnd) {
        EditorSession session = sessions.get(sessionKey(domain, resourceId));
        return session != null && session.broadcastCursor(line, column, position, selectionStart, selectionEnd);
    }

    public boolean broadcastContent(Domain domain, String resourceId, String content, int cursorPosition) {
        EditorSession session = sessions.get(sessionKey(domain, resourceId));
        return session != null && session.onLocalChange(content, cursorPosition);
    }

    private static String sessionKey(Domain domain, String resourceId) {
        return domain.wireName() + "/" + resourceId;
    }
}
