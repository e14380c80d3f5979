package com.tandem.client.transport;

/** Callbacks a {@link TransportChannel} delivers to its owner. */
public interface ChannelListener {

    void onFrame(String frame);

    /** The channel closed, whether by the peer, the network or a local close. */
    void onClosed();
}
