package com.tandem.client.subscription;

/** Handle for one registered callback. Closing it twice is harmless. */
public interface Subscription extends AutoCloseable {

    @Override
    void close();
}
