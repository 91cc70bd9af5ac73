package com.blissfly.proxy.core.fetch;

import java.time.Duration;

/**
 * Waits between retry attempts. Replaced by a recording stub in tests.
 */
@FunctionalInterface
public interface Sleeper {
    /** Sleeps the calling thread. */
    Sleeper SYSTEM = d -> Thread.sleep(d.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
