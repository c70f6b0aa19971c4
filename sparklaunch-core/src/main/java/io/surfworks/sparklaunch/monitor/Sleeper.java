package io.surfworks.sparklaunch.monitor;

import java.time.Duration;

/**
 * Pauses the calling thread between polls.
 */
@FunctionalInterface
public interface Sleeper {

    /** Sleeper backed by {@link Thread#sleep(long)} */
    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
