package com.tandem.client.transport;

/** One physical, bidirectional text channel to the collaboration server. */
public interface TransportChannel extends AutoCloseable {

    /**
     * Queue a frame for sending.
     *
     * @return false when the channel is no longer open; the frame is dropped
     */
    boolean send(String frame);

    boolean isOpen();

    @Override
    void close();
}
