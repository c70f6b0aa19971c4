package io.surfworks.sparklaunch.monitor;

import io.surfworks.sparklaunch.provider.ClusterHandle;
import io.surfworks.sparklaunch.provider.ClusterProvider;
import io.surfworks.sparklaunch.provider.ProviderException;
import io.surfworks.sparklaunch.provider.StepHandle;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * Polls a cluster until it terminates, the timeout passes, or the caller cancels.
 *
 * <p>On timeout the cluster is terminated. A cluster that terminates on its own
 * is never touched: its steps are inspected to decide between success and
 * abnormal termination.
 *
 * <p>Blocks the calling thread for the whole run. Provider calls are strictly
 * sequential.
 */
public final class ClusterMonitor {

    private static final Logger LOG = Logger.getLogger(ClusterMonitor.class.getName());

    /** Pause between two status checks */
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(5);

    private final ClusterProvider provider;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Duration pollInterval;
    private final Consumer<ClusterHandle> tickListener;

    /**
     * Creates a monitor using the system clock and a real sleep.
     */
    public ClusterMonitor(ClusterProvider provider) {
        this(provider, Clock.systemUTC(), Sleeper.SYSTEM, DEFAULT_POLL_INTERVAL, handle -> { });
    }

    /**
     * @param provider     provider to poll
     * @param clock        source of the current time
     * @param sleeper      pause between polls
     * @param pollInterval pause length
     * @param tickListener called with each fresh snapshot of an active cluster
     */
    public ClusterMonitor(ClusterProvider provider, Clock clock, Sleeper sleeper,
                          Duration pollInterval, Consumer<ClusterHandle> tickListener) {
        this.provider = Objects.requireNonNull(provider, "provider cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper cannot be null");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval cannot be null");
        this.tickListener = Objects.requireNonNull(tickListener, "tickListener cannot be null");

        if (pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval cannot be negative");
        }
    }

    /**
     * Returns a copy of this monitor that reports every tick to {@code listener}.
     */
    public ClusterMonitor withTickListener(Consumer<ClusterHandle> listener) {
        return new ClusterMonitor(provider, clock, sleeper, pollInterval, listener);
    }

    /**
     * Monitors a cluster without cancellation.
     */
    public MonitorResult monitor(String clusterId, Duration timeout) throws ProviderException {
        return monitor(clusterId, timeout, CancellationToken.none());
    }

    /**
     * Monitors a cluster until it leaves the activated states or {@code timeout} passes.
     *
     * @param clusterId    cluster to watch
     * @param timeout      time after which an active cluster is terminated
     * @param cancellation checked once per poll
     * @return how monitoring ended
     * @throws ProviderException if a status, step or terminate call fails
     */
    public MonitorResult monitor(String clusterId, Duration timeout, CancellationToken cancellation)
            throws ProviderException {
        Objects.requireNonNull(clusterId, "clusterId cannot be null");
        Objects.requireNonNull(timeout, "timeout cannot be null");
        Objects.requireNonNull(cancellation, "cancellation cannot be null");

        MonitorSession session = MonitorSession.start(clusterId, clock.instant(), timeout, pollInterval);
        int polls = 0;
        String lastStatus = null;

        while (true) {
            if (cancellation.isCancelled()) {
                LOG.info("Monitoring of cluster " + clusterId + " cancelled.");
                return new MonitorResult(clusterId, MonitorOutcome.CANCELLED, lastStatus, List.of(), polls);
            }

            ClusterHandle cluster = provider.describeCluster(clusterId);
            polls++;
            lastStatus = cluster.status();

            if (!cluster.isActive()) {
                return finished(cluster, polls);
            }

            if (session.isExpired(clock.instant())) {
                provider.terminateCluster(clusterId);
                LOG.warning("Timeout. Cluster " + clusterId + " terminated.");
                return new MonitorResult(clusterId, MonitorOutcome.TIMEOUT, lastStatus, List.of(), polls);
            }

            LOG.fine("Cluster " + clusterId + " is " + lastStatus + " (poll " + polls + ").");
            tickListener.accept(cluster);

            try {
                sleeper.sleep(session.pollInterval());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.info("Monitoring of cluster " + clusterId + " interrupted.");
                return new MonitorResult(clusterId, MonitorOutcome.CANCELLED, lastStatus, List.of(), polls);
            }
        }
    }

    private MonitorResult finished(ClusterHandle cluster, int polls) throws ProviderException {
        List<StepHandle> failed = provider.listSteps(cluster.id()).stream()
                .filter(step -> !step.isCompleted())
                .toList();

        if (failed.isEmpty()) {
            LOG.info("Cluster " + cluster.id() + " terminated without error.");
            return new MonitorResult(cluster.id(), MonitorOutcome.SUCCESS, cluster.status(), List.of(), polls);
        }
        for (StepHandle step : failed) {
            LOG.warning("Step " + step.name() + " (" + step.id() + ") ended in state " + step.status() + ".");
        }
        return new MonitorResult(cluster.id(), MonitorOutcome.ABNORMAL_TERMINATION, cluster.status(), failed, polls);
    }
}
