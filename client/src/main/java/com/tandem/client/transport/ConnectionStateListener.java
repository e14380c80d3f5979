package com.tandem.client.transport;

/**
 * Notified when the hub's channel comes up or goes away. Events missed while
 * disconnected are never replayed, so dependants re-fetch and re-join here.
 */
public interface ConnectionStateListener {

    /** @param reconnect true when this follows an unexpected drop */
    void onConnected(boolean reconnect);

    default void onDisconnected() {
    }
}
