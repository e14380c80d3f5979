package com.tandem.service;

import com.tandem.protocol.Domain;
import com.tandem.protocol.ServerMessage;
import com.tandem.websocket.ConnectionRegistry;
import jakarta.annotation.Nullable;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Relays storage-side changes to every connected client.
 *
 * The storage collaborator calls in after it commits a structural change or
 * a content save. No tree is sent along: clients re-fetch the tree and diff
 * it themselves, so a missed signal just folds into the next one.
 */
@Singleton
public class ChangeFeedService {

    private static final Logger log = LoggerFactory.getLogger(ChangeFeedService.class);

    @Inject ConnectionRegistry connectionRegistry;

    public void treeChanged(Domain domain) {
        connectionRegistry.broadcastAll(ServerMessage.treeChanged(domain));
        log.debug("Tree change signalled: domain={} connections={}", domain.wireName(), connectionRegistry.size());
    }

    public void contentUpdated(Domain domain, String resourceId, @Nullable String revision,
                               @Nullable String name, @Nullable String userId) {
        connectionRegistry.broadcastAll(ServerMessage.contentUpdated(domain, resourceId, revision, name, userId));
        log.debug("Content update signalled: domain={} resource={} revision={}", domain.wireName(), resourceId, revision);
    }
}
