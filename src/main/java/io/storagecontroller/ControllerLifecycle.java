package io.storagecontroller;

import io.storagecontroller.metrics.ReplicaStatsReporter;
import io.storagecontroller.pool.PoolOperator;
import io.storagecontroller.registry.Registry;
import io.storagecontroller.volume.VolumeManager;
import io.storagecontroller.watcher.NodeSpec;
import io.storagecontroller.watcher.PoolSpec;
import io.storagecontroller.watcher.SpecSource;
import io.storagecontroller.watcher.VolumeSpecRecord;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Starts the controller once all beans are wired and stops it in reverse order.
 * <p>
 * Nodes are loaded first, then the declared pools, so that the volumes replayed
 * last find the pools they were placed on.
 */
@Slf4j
@Component
public class ControllerLifecycle {

    private final SpecSource<NodeSpec> nodeWatcher;
    private final SpecSource<PoolSpec> poolWatcher;
    private final SpecSource<VolumeSpecRecord> volumeWatcher;
    private final Registry registry;
    private final PoolOperator poolOperator;
    private final VolumeManager volumeManager;
    private final ReplicaStatsReporter statsReporter;

    public ControllerLifecycle(@Qualifier("nodeWatcher") SpecSource<NodeSpec> nodeWatcher,
                               @Qualifier("poolWatcher") SpecSource<PoolSpec> poolWatcher,
                               @Qualifier("volumeWatcher") SpecSource<VolumeSpecRecord> volumeWatcher,
                               Registry registry,
                               PoolOperator poolOperator,
                               VolumeManager volumeManager,
                               ReplicaStatsReporter statsReporter) {
        this.nodeWatcher = nodeWatcher;
        this.poolWatcher = poolWatcher;
        this.volumeWatcher = volumeWatcher;
        this.registry = registry;
        this.poolOperator = poolOperator;
        this.volumeManager = volumeManager;
        this.statsReporter = statsReporter;
    }

    @PostConstruct
    public void start() {
        log.info("Starting storage controller");
        nodeWatcher.start(registry);
        poolOperator.start();
        poolWatcher.start(poolOperator);
        volumeManager.start();
        volumeWatcher.start(volumeManager);
        statsReporter.start();
        log.info("Storage controller is running with {} nodes, {} pools and {} volumes",
                registry.getNodes().size(), registry.getPools().size(), volumeManager.list().size());
    }

    @PreDestroy
    public void stop() {
        log.info("Stopping storage controller");
        statsReporter.stop();
        volumeWatcher.stop();
        volumeManager.stop();
        poolWatcher.stop();
        poolOperator.stop();
        nodeWatcher.stop();
        registry.close();
        log.info("Storage controller stopped");
    }
}
