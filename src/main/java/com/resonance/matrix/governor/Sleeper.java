package com.resonance.matrix.governor;

import java.time.Duration;

/**
 * Pauses the calling thread. Replaced in tests to avoid real delays.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());
}
