package com.tandem.infra;

import io.micronaut.context.annotation.Factory;
import jakarta.inject.Singleton;

import java.time.Clock;

/**
 * Provides the wall clock used for lock expiry and presence staleness.
 * Tests replace it with a clock they can move by hand.
 */
@Factory
public class ClockFactory {

    @Singleton
    public Clock clock() {
        return Clock.systemUTC();
    }
}
