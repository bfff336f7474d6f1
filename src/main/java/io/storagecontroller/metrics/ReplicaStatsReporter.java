package io.storagecontroller.metrics;

import io.storagecontroller.model.ReplicaStat;
import io.storagecontroller.registry.Registry;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodically collects IO counters of all replicas and publishes them as
 * gauges tagged with node, pool and replica.
 */
@Slf4j
public class ReplicaStatsReporter {

    private final Registry registry;
    private final MetricsProvider metricsProvider;
    private final ScheduledExecutorService scheduler;
    private final Duration interval;

    private ScheduledFuture<?> task;

    public ReplicaStatsReporter(Registry registry, MetricsProvider metricsProvider,
                                ScheduledExecutorService scheduler, Duration interval) {
        this.registry = registry;
        this.metricsProvider = metricsProvider;
        this.scheduler = scheduler;
        this.interval = interval;
    }

    public synchronized void start() {
        if (task != null) {
            return;
        }
        long millis = interval.toMillis();
        task = scheduler.scheduleWithFixedDelay(this::report, millis, millis, TimeUnit.MILLISECONDS);
        log.info("Reporting replica stats every {}", interval);
    }

    public synchronized void stop() {
        if (task == null) {
            return;
        }
        task.cancel(false);
        task = null;
    }

    /**
     * Collect the counters once.
     */
    public CompletableFuture<Void> report() {
        return registry.listReplicaStats()
                .thenAccept(this::publish)
                .exceptionally(error -> {
                    log.warn("Failed to collect replica stats: {}", error.getMessage());
                    return null;
                });
    }

    private void publish(List<ReplicaStat> stats) {
        log.debug("Publishing stats of {} replicas", stats.size());
        for (ReplicaStat stat : stats) {
            Map<String, String> tags = Map.of(
                    MetricsConstants.NODE_TAG, stat.getNode(),
                    MetricsConstants.POOL_TAG, stat.getPool(),
                    MetricsConstants.REPLICA_TAG, stat.getUuid());
            metricsProvider.gauge(MetricsConstants.REPLICA_READ_OPS_METRIC_NAME, tags).set(stat.getNumReadOps());
            metricsProvider.gauge(MetricsConstants.REPLICA_WRITE_OPS_METRIC_NAME, tags).set(stat.getNumWriteOps());
            metricsProvider.gauge(MetricsConstants.REPLICA_BYTES_READ_METRIC_NAME, tags).set(stat.getBytesRead());
            metricsProvider.gauge(MetricsConstants.REPLICA_BYTES_WRITTEN_METRIC_NAME, tags).set(stat.getBytesWritten());
        }
    }
}
