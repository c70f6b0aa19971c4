package io.surfworks.sparklaunch.monitor;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * State of one monitor invocation: created when monitoring starts, discarded when it returns.
 *
 * @param clusterId    cluster being watched
 * @param deadline     instant after which an active cluster is terminated
 * @param pollInterval pause between two status checks
 */
public record MonitorSession(String clusterId, Instant deadline, Duration pollInterval) {

    public MonitorSession {
        Objects.requireNonNull(clusterId, "clusterId cannot be null");
        Objects.requireNonNull(deadline, "deadline cannot be null");
        Objects.requireNonNull(pollInterval, "pollInterval cannot be null");
    }

    /**
     * Starts a session whose deadline is {@code timeout} after {@code now}.
     */
    public static MonitorSession start(String clusterId, Instant now, Duration timeout, Duration pollInterval) {
        return new MonitorSession(clusterId, now.plus(timeout), pollInterval);
    }

    /**
     * Returns true once {@code now} has reached the deadline.
     */
    public boolean isExpired(Instant now) {
        return !now.isBefore(deadline);
    }
}
