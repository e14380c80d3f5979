package com.tandem.client.session;

import com.tandem.client.ClientConfiguration;
import com.tandem.client.FakeChannelFactory;
import com.tandem.client.MutableClock;
import com.tandem.client.lock.LockCoordinator;
import com.tandem.client.subscription.SubscriptionRegistry;
import com.tandem.client.transport.TransportHub;
import com.tandem.protocol.Domain;
import com.tandem.protocol.LockHolder;
import com.tandem.protocol.LockResult;
import com.tandem.protocol.PresenceUser;
import com.tandem.protocol.ServerMessage;
import io.micronaut.scheduling.TaskExecutors;
import io.micronaut.scheduling.TaskScheduler;
import io.micronaut.serde.ObjectMapper;
import io.micronaut.test.extensions.junit5.annotation.MicronautTest;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@MicronautTest
class EditorSessionTest {

    private static final String DOC = "doc-1";

    @Inject TransportHub hub;
    @Inject SubscriptionRegistry subscriptions;
    @Inject FakeChannelFactory channels;
    @Inject ObjectMapper objectMapper;
    @Inject ClientConfiguration config;
    @Inject MutableClock clock;
    @Inject @Named(TaskExecutors.SCHEDULED) TaskScheduler scheduler;

    private final LockCoordinator locks = mock(LockCoordinator.class);
    private final EditorListener editor = mock(EditorListener.class);
    private EditorSession session;

    @BeforeEach
    void setup() {
        channels.reset();
        hub.init();
        when(locks.unlock(Domain.DOCUMENT, DOC))
            .thenReturn(CompletableFuture.completedFuture(LockResult.released("Resource unlocked")));
        session = new EditorSession(Domain.DOCUMENT, DOC, editor, hub, subscriptions, locks, scheduler, clock, config)
            .open();
    }

    @AfterEach
    void cleanup() {
        session.close();
        subscriptions.clear();
        hub.shutdown();
    }

    @Test
    void open_joinsPresenceOnce() {
        assertThat(hub.refCount()).isEqualTo(1);
        assertThat(channels.current().sent()).filteredOn(f -> f.contains("join_document")).hasSize(1);
    }

    @Test
    void secondSessionOnSharedChannel_joinsToo() {
        EditorSession other = new EditorSession(Domain.DOCUMENT, "doc-2", editor, hub, subscriptions, locks,
            scheduler, clock, config).open();
        try {
            assertThat(channels.opened()).hasSize(1);
            assertThat(channels.current().sent()).filteredOn(f -> f.contains("doc-2")).hasSize(1);
        } finally {
            other.close();
        }
    }

    @Test
    void remoteContent_isAppliedAndNotEchoedBack() throws Exception {
        deliver(ServerMessage.contentChange(Domain.DOCUMENT, DOC, "bob", "Bob", "hello", 5));

        verify(editor).replaceContent("hello");
        verify(editor).typingChanged("bob", true);
        assertThat(session.onLocalChange("hello", 5)).isFalse();

        await(() -> !session.isRemoteOrigin());
        assertThat(session.onLocalChange("hello!", 6)).isTrue();
        verify(editor, timeout(2000)).typingChanged("bob", false);
    }

    @Test
    void remoteContent_duringLocalEdit_isDropped() throws Exception {
        assertThat(session.onLocalChange("mine", 4)).isTrue();

        deliver(ServerMessage.contentChange(Domain.DOCUMENT, DOC, "bob", "Bob", "theirs", 6));
        verify(editor, never()).replaceContent(anyString());

        clock.advance(Duration.ofSeconds(1));
        deliver(ServerMessage.contentChange(Domain.DOCUMENT, DOC, "bob", "Bob", "theirs", 6));
        verify(editor).replaceContent("theirs");
    }

    @Test
    void contentSync_isAppliedEvenDuringLocalEdit() throws Exception {
        session.onLocalChange("mine", 4);

        deliver(ServerMessage.contentSync(Domain.DOCUMENT, DOC, "from storage", "r2"));

        verify(editor).replaceContent("from storage");
    }

    @Test
    void eventsForOtherResources_areIgnored() throws Exception {
        deliver(ServerMessage.contentChange(Domain.DOCUMENT, "doc-2", "bob", "Bob", "other", 5));
        deliver(ServerMessage.contentChange(Domain.VAULT, DOC, "bob", "Bob", "vault", 5));

        verify(editor, never()).replaceContent(anyString());
    }

    @Test
    void presenceUpdate_reachesEditor() throws Exception {
        PresenceUser bob = new PresenceUser("bob", "Bob", "#EC4899", false, null, null, null, null, null, null, false);

        deliver(ServerMessage.presenceUpdated(Domain.DOCUMENT, DOC, List.of(bob)));

        verify(editor).presenceChanged(List.of(bob));
    }

    @Test
    void agentStream_showsIndicatorAndInsertsChunks() throws Exception {
        deliver(ServerMessage.streamStart(Domain.DOCUMENT, DOC, "s1", "bot", "Bot", "Claude", 10, "#FF6B35"));

        assertThat(session.streaming()).isEqualTo(new StreamingIndicator("s1", "bot", "Claude", "#FF6B35"));

        deliver(ServerMessage.streamChunk(Domain.DOCUMENT, DOC, "s1", "bot", "Claude", "Hello", 15));
        verify(editor).insertText(10, "Hello");

        deliver(ServerMessage.streamEnd(Domain.DOCUMENT, DOC, "s1", "bot", "Claude", 15));
        assertThat(session.streaming()).isNull();
        verify(editor).streamingChanged(null);
    }

    @Test
    void grantedLock_isKeptAliveUntilClose() {
        LockHolder alice = holder("alice");
        when(locks.lock(Domain.DOCUMENT, DOC)).thenReturn(CompletableFuture.completedFuture(
            LockResult.granted("Resource locked", alice)));
        when(locks.heartbeat(Domain.DOCUMENT, DOC)).thenReturn(CompletableFuture.completedFuture(
            LockResult.granted("Heartbeat recorded", alice)));

        assertThat(session.lock().join().success()).isTrue();

        assertThat(session.holdsLock()).isTrue();
        verify(locks, timeout(2000).atLeast(2)).heartbeat(Domain.DOCUMENT, DOC);

        session.close();
        assertThat(session.holdsLock()).isFalse();
        verify(locks).unlock(Domain.DOCUMENT, DOC);
    }

    @Test
    void deniedLock_startsNoHeartbeat() throws Exception {
        when(locks.lock(Domain.DOCUMENT, DOC)).thenReturn(CompletableFuture.completedFuture(
            LockResult.denied("Resource already locked", holder("bob"))));

        assertThat(session.lock().join().success()).isFalse();
        Thread.sleep(200);

        assertThat(session.holdsLock()).isFalse();
        verify(locks, never()).heartbeat(Domain.DOCUMENT, DOC);
    }

    @Test
    void lockTakenByOther_stopsHeartbeat() throws Exception {
        when(locks.lock(Domain.DOCUMENT, DOC)).thenReturn(CompletableFuture.completedFuture(
            LockResult.granted("Resource locked", holder("alice"))));
        when(locks.heartbeat(Domain.DOCUMENT, DOC)).thenReturn(CompletableFuture.completedFuture(
            LockResult.granted("Heartbeat recorded", holder("alice"))));
        session.lock().join();

        when(locks.heartbeat(Domain.DOCUMENT, DOC)).thenReturn(CompletableFuture.completedFuture(
            LockResult.denied("Resource locked by another user", holder("bob"))));
        LockHolder bob = holder("bob");
        deliver(ServerMessage.lockUpdated(Domain.DOCUMENT, DOC, bob));

        await(() -> !session.holdsLock());
        verify(editor).lockChanged(bob);
    }

    @Test
    void lateReleaseAnnouncement_keepsNewLock() throws Exception {
        when(locks.lock(Domain.DOCUMENT, DOC)).thenReturn(CompletableFuture.completedFuture(
            LockResult.granted("Resource locked", holder("alice"))));
        when(locks.heartbeat(Domain.DOCUMENT, DOC)).thenReturn(CompletableFuture.completedFuture(
            LockResult.granted("Heartbeat recorded", holder("alice"))));
        session.lock().join();
        session.unlock().join();
        session.lock().join();

        // the release from the first unlock arrives after the second grant
        deliver(ServerMessage.lockUpdated(Domain.DOCUMENT, DOC, null));

        verify(editor).lockChanged(null);
        verify(locks, timeout(2000).atLeast(1)).heartbeat(Domain.DOCUMENT, DOC);
        assertThat(session.holdsLock()).isTrue();
    }

    @Test
    void lockGrantedAfterClose_isReleased() {
        CompletableFuture<LockResult> pending = new CompletableFuture<>();
        when(locks.lock(Domain.DOCUMENT, DOC)).thenReturn(pending);
        CompletableFuture<LockResult> result = session.lock();

        session.close();
        verify(locks, never()).unlock(Domain.DOCUMENT, DOC);
        pending.complete(LockResult.granted("Resource locked", holder("alice")));

        assertThat(result.join().success()).isTrue();
        assertThat(session.holdsLock()).isFalse();
        verify(locks).unlock(Domain.DOCUMENT, DOC);
    }

    @Test
    void rejectedHeartbeat_stopsHeartbeat() throws Exception {
        when(locks.lock(Domain.DOCUMENT, DOC)).thenReturn(CompletableFuture.completedFuture(
            LockResult.granted("Resource locked", holder("alice"))));
        when(locks.heartbeat(Domain.DOCUMENT, DOC)).thenReturn(CompletableFuture.completedFuture(
            LockResult.denied("Resource not locked", null)));

        session.lock().join();

        await(() -> !session.holdsLock());
    }

    @Test
    void close_leavesAndReleasesTransport() {
        session.close();
        session.close();

        assertThat(channels.current().sent()).filteredOn(f -> f.contains("leave_document")).hasSize(1);
        assertThat(hub.refCount()).isZero();
        assertThat(hub.isConnected()).isFalse();
        verify(locks, never()).unlock(Domain.DOCUMENT, DOC);
    }

    private static LockHolder holder(String userId) {
        Instant now = Instant.parse("2024-01-01T00:00:00Z");
        return new LockHolder(userId, userId, now, now);
    }

    private void deliver(ServerMessage message) throws Exception {
        channels.current().deliver(objectMapper.writeValueAsString(message));
    }

    private static void await(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                throw new AssertionError("Condition not met within 5s");
            }
            Thread.sleep(20);
        }
    }
}
