package com.tandem.client;

import com.tandem.client.session.EditorListener;
import com.tandem.client.session.EditorSession;
import com.tandem.client.transport.TransportHub;
import com.tandem.client.tree.ChangeBatch;
import com.tandem.client.tree.ChangeKind;
import com.tandem.client.tree.ChangeRecord;
import com.tandem.client.tree.FakeResourceStore;
import com.tandem.protocol.Domain;
import com.tandem.protocol.ResourceNode;
import io.micronaut.test.extensions.junit5.annotation.MicronautTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

@MicronautTest
class CollabClientTest {

    @Inject CollabClient client;
    @Inject TransportHub hub;
    @Inject FakeChannelFactory channels;
    @Inject FakeResourceStore store;

    private final EditorListener editor = mock(EditorListener.class);

    @BeforeEach
    void setup() {
        channels.reset();
        store.reset();
        client.init();
    }

    @AfterEach
    void cleanup() {
        client.shutdown();
    }

    @Test
    void joiningTwice_returnsTheOpenSession() {
        EditorSession first = client.joinResource(Domain.DOCUMENT, "doc-1", editor);
        EditorSession second = client.joinResource(Domain.DOCUMENT, "doc-1", editor);

        assertThat(second).isSameAs(first);
        assertThat(hub.refCount()).isEqualTo(1);
    }

    @Test
    void leaveResource_releasesItsReference() {
        client.connect();
        client.joinResource(Domain.DOCUMENT, "doc-1", editor);
        client.joinResource(Domain.TASK, "task-1", editor);
        assertThat(hub.refCount()).isEqualTo(3);

        client.leaveResource(Domain.DOCUMENT, "doc-1");
        client.leaveResource(Domain.DOCUMENT, "doc-1");

        assertThat(hub.refCount()).isEqualTo(2);
        assertThat(channels.current().sent()).filteredOn(f -> f.contains("leave_document")).hasSize(1);
    }

    @Test
    void broadcasts_requireAnOpenSession() {
        assertThat(client.broadcastContent(Domain.DOCUMENT, "doc-1", "text", 4)).isFalse();
        assertThat(client.broadcastCursor(Domain.DOCUMENT, "doc-1", 1, 1, 0, null, null)).isFalse();

        client.joinResource(Domain.DOCUMENT, "doc-1", editor);

        assertThat(client.broadcastContent(Domain.DOCUMENT, "doc-1", "text", 4)).isTrue();
        assertThat(client.broadcastCursor(Domain.DOCUMENT, "doc-1", 1, 1, 0, null, null)).isTrue();
    }

    @Test
    void reconnect_refetchesTrackedTrees() throws Exception {
        List<ChangeBatch> batches = new CopyOnWriteArrayList<>();
        client.onTreeChanges(batches::add);
        client.trackTree(Domain.VAULT, null).join();
        client.connect();

        store.put(Domain.VAULT, List.of(ResourceNode.leaf("v1", "secret", null, "r1")));
        channels.current().drop();

        long deadline = System.currentTimeMillis() + 5000;
        while (batches.isEmpty() && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertThat(batches).singleElement().satisfies(b ->
            assertThat(b.surfaced()).extracting(ChangeRecord::kind).containsExactly(ChangeKind.CREATED));
    }

    @Test
    void shutdown_closesEverything() {
        client.joinResource(Domain.DOCUMENT, "doc-1", editor);

        client.shutdown();

        assertThat(hub.refCount()).isZero();
        assertThat(hub.isConnected()).isFalse();
        assertThatThrownBy(() -> client.connect()).isInstanceOf(IllegalStateException.class);
    }
}
