package com.tandem;

import com.tandem.domain.ResourceKey;
import com.tandem.protocol.Domain;
import com.tandem.protocol.LockResult;
import com.tandem.protocol.ServerMessage;
import com.tandem.service.LockService;
import com.tandem.websocket.ConnectionRegistry;
import io.micronaut.test.annotation.MockBean;
import io.micronaut.test.extensions.junit5.annotation.MicronautTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@MicronautTest
class LockServiceTest {

    @Inject
    LockService lockService;

    @Inject
    MutableClock clock;

    @Inject
    ConnectionRegistry connectionRegistry;

    @MockBean(ConnectionRegistry.class)
    ConnectionRegistry mockRegistry() {
        return mock(ConnectionRegistry.class);
    }

    @Test
    void acquire_freeResource_grantsLock() {
        ResourceKey key = freshKey();

        LockResult result = lockService.acquire(key, "alice", "Alice");

        assertThat(result.success()).isTrue();
        assertThat(result.lockedBy()).isNotNull();
        assertThat(result.lockedBy().userId()).isEqualTo("alice");
        assertThat(lockService.current(key)).isPresent();
    }

    @Test
    void acquire_heldByOther_deniedWithHolder() {
        ResourceKey key = freshKey();
        lockService.acquire(key, "alice", "Alice");

        LockResult result = lockService.acquire(key, "bob", "Bob");

        assertThat(result.success()).isFalse();
        assertThat(result.lockedBy().userId()).isEqualTo("alice");
        assertThat(lockService.current(key).orElseThrow().userId()).isEqualTo("alice");
    }

    @Test
    void acquire_sameHolder_refreshesKeepingAcquiredAt() {
        ResourceKey key = freshKey();
        LockResult first = lockService.acquire(key, "alice", "Alice");
        clock.advance(Duration.ofSeconds(60));

        LockResult again = lockService.acquire(key, "alice", "Alice");

        assertThat(again.success()).isTrue();
        assertThat(again.lockedBy().acquiredAt()).isEqualTo(first.lockedBy().acquiredAt());
        assertThat(again.lockedBy().lastHeartbeatAt()).isAfter(first.lockedBy().lastHeartbeatAt());
    }

    @Test
    void acquire_afterTtl_anotherUserTakesOver() {
        ResourceKey key = freshKey();
        lockService.acquire(key, "alice", "Alice");
        clock.advance(Duration.ofSeconds(301));

        assertThat(lockService.current(key)).isEmpty();
        LockResult result = lockService.acquire(key, "bob", "Bob");

        assertThat(result.success()).isTrue();
        assertThat(result.lockedBy().userId()).isEqualTo("bob");
    }

    @Test
    void heartbeat_keepsLockAlivePastTtl() {
        ResourceKey key = freshKey();
        lockService.acquire(key, "alice", "Alice");

        for (int i = 0; i < 4; i++) {
            clock.advance(Duration.ofSeconds(120));
            assertThat(lockService.heartbeat(key, "alice").success()).isTrue();
        }

        assertThat(lockService.acquire(key, "bob", "Bob").success()).isFalse();
    }

    @Test
    void heartbeat_fromNonHolder_changesNothing() {
        ResourceKey key = freshKey();
        lockService.acquire(key, "alice", "Alice");

        LockResult result = lockService.heartbeat(key, "bob");

        assertThat(result.success()).isFalse();
        assertThat(result.message()).isEqualTo("Lock owned by another user");
        assertThat(lockService.current(key).orElseThrow().userId()).isEqualTo("alice");
    }

    @Test
    void heartbeat_unlockedResource_fails() {
        LockResult result = lockService.heartbeat(freshKey(), "alice");

        assertThat(result.success()).isFalse();
        assertThat(result.message()).isEqualTo("Resource not locked");
    }

    @Test
    void release_byNonHolder_leavesLockIntact() {
        ResourceKey key = freshKey();
        lockService.acquire(key, "alice", "Alice");

        LockResult result = lockService.release(key, "bob");

        assertThat(result.success()).isFalse();
        assertThat(lockService.current(key)).isPresent();
    }

    @Test
    void release_unlockedResource_isNoOp() {
        LockResult result = lockService.release(freshKey(), "alice");

        assertThat(result.success()).isTrue();
        assertThat(result.message()).isEqualTo("Resource not locked");
    }

    @Test
    void aliceReleases_thenBobAcquires() {
        ResourceKey key = freshKey();
        lockService.acquire(key, "alice", "Alice");
        assertThat(lockService.acquire(key, "bob", "Bob").success()).isFalse();

        assertThat(lockService.release(key, "alice").success()).isTrue();
        LockResult bob = lockService.acquire(key, "bob", "Bob");

        assertThat(bob.success()).isTrue();
        assertThat(bob.lockedBy().username()).isEqualTo("Bob");
    }

    @Test
    void forceUnlock_removesAnyHolder() {
        ResourceKey key = freshKey();
        lockService.acquire(key, "alice", "Alice");

        assertThat(lockService.forceUnlock(key).success()).isTrue();
        assertThat(lockService.current(key)).isEmpty();
    }

    @Test
    void forceUnlock_unlockedResource_isNoOpSuccess() {
        ResourceKey key = freshKey();

        LockResult result = lockService.forceUnlock(key);

        assertThat(result.success()).isTrue();
        assertThat(result.lockedBy()).isNull();
        verify(connectionRegistry, never())
            .broadcastAll(ServerMessage.lockUpdated(key.domain(), key.resourceId(), null));
    }

    @Test
    void sweepExpired_removesAbandonedLockAndAnnouncesIt() {
        ResourceKey key = freshKey();
        lockService.acquire(key, "alice", "Alice");

        clock.advance(Duration.ofSeconds(301));
        lockService.sweepExpired();

        assertThat(lockService.current(key)).isEmpty();
        verify(connectionRegistry).broadcastAll(ServerMessage.lockUpdated(key.domain(), key.resourceId(), null));
    }

    @Test
    void sweepExpired_keepsLiveLock() {
        ResourceKey key = freshKey();
        lockService.acquire(key, "alice", "Alice");

        clock.advance(Duration.ofSeconds(120));
        lockService.sweepExpired();

        assertThat(lockService.current(key)).isPresent();
        verify(connectionRegistry, never())
            .broadcastAll(ServerMessage.lockUpdated(key.domain(), key.resourceId(), null));
    }

    @Test
    void releaseAllHeldBy_dropsOnlyThatUsersLocks() {
        ResourceKey a = freshKey();
        ResourceKey b = freshKey();
        ResourceKey c = freshKey();
        String user = "carol-" + UUID.randomUUID();
        lockService.acquire(a, user, "Carol");
        lockService.acquire(b, user, "Carol");
        lockService.acquire(c, "dave", "Dave");

        assertThat(lockService.releaseAllHeldBy(user)).isEqualTo(2);
        assertThat(lockService.current(a)).isEmpty();
        assertThat(lockService.current(b)).isEmpty();
        assertThat(lockService.current(c)).isPresent();
    }

    @Test
    void sameIdInDifferentDomains_lockedIndependently() {
        String id = UUID.randomUUID().toString();
        lockService.acquire(ResourceKey.of(Domain.DOCUMENT, id), "alice", "Alice");

        LockResult vault = lockService.acquire(ResourceKey.of(Domain.VAULT, id), "bob", "Bob");

        assertThat(vault.success()).isTrue();
    }

    // ── Helpers ─────────────────────────────────────────────────────────────

    private static ResourceKey freshKey() {
        return ResourceKey.of(Domain.DOCUMENT, UUID.randomUUID().toString());
    }
}
