package io.storagecontroller.volume;

import com.google.common.util.concurrent.AtomicDouble;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.storagecontroller.events.EventBus;
import io.storagecontroller.events.EventKind;
import io.storagecontroller.events.EventListener;
import io.storagecontroller.events.EventType;
import io.storagecontroller.events.StorageEvent;
import io.storagecontroller.metrics.MetricsConstants;
import io.storagecontroller.metrics.MetricsProvider;
import io.storagecontroller.model.Nexus;
import io.storagecontroller.model.Replica;
import io.storagecontroller.node.Node;
import io.storagecontroller.registry.Registry;
import io.storagecontroller.rpc.RpcCode;
import io.storagecontroller.rpc.RpcException;
import io.storagecontroller.watcher.SpecListener;
import io.storagecontroller.watcher.VolumeSpecRecord;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Keeps the set of volumes and drives their reconciliation.
 * <p>
 * Volumes are reconciled when they are created or updated, when the registry
 * reports a change that may affect them and periodically. Reconciliation
 * passes are dispatched to the executor so that event delivery never blocks.
 */
@Slf4j
public class VolumeManager implements SpecListener<VolumeSpecRecord> {

    private static final Set<VolumeState> WAITING_FOR_POOLS =
            EnumSet.of(VolumeState.PENDING, VolumeState.DEGRADED, VolumeState.FAULTED);

    private final Registry registry;
    private final ScheduledExecutorService executor;
    private final Duration reconcileInterval;
    private final Map<String, Volume> volumes = new ConcurrentHashMap<>();
    @Getter
    private final EventBus eventBus = new EventBus("volumes");
    private final EventListener registryListener = this::onRegistryEvent;

    private final AtomicDouble volumesTotal;
    private final Counter ensureFailures;
    private final Timer ensureDuration;

    private ScheduledFuture<?> reconcileTask;

    public VolumeManager(Registry registry, MetricsProvider metricsProvider,
                         ScheduledExecutorService executor, Duration reconcileInterval) {
        this.registry = registry;
        this.executor = executor;
        this.reconcileInterval = reconcileInterval;
        this.volumesTotal = metricsProvider.gauge(MetricsConstants.VOLUMES_TOTAL_METRIC_NAME, Map.of());
        this.ensureFailures = metricsProvider.counter(MetricsConstants.VOLUME_ENSURE_FAILURES_METRIC_NAME, Map.of());
        this.ensureDuration = metricsProvider.timer(MetricsConstants.VOLUME_ENSURE_DURATION_METRIC_NAME, Map.of());
    }

    /**
     * Subscribe to registry events and start the periodic reconciliation.
     */
    public synchronized void start() {
        if (reconcileTask != null) {
            return;
        }
        registry.subscribe(registryListener);
        long millis = reconcileInterval.toMillis();
        reconcileTask = executor.scheduleWithFixedDelay(this::reconcileAll, millis, millis, TimeUnit.MILLISECONDS);
        log.info("Volume manager started, reconciling every {}", reconcileInterval);
    }

    public synchronized void stop() {
        if (reconcileTask == null) {
            return;
        }
        registry.unsubscribe(registryListener);
        reconcileTask.cancel(false);
        reconcileTask = null;
        log.info("Volume manager stopped");
    }

    /**
     * Create a volume, or update it if it already exists.
     *
     * @return future completing after the first reconciliation pass
     */
    public CompletableFuture<Volume> createVolume(String uuid, VolumeSpec spec) {
        if (spec == null || spec.getRequiredBytes() <= 0) {
            return CompletableFuture.failedFuture(new RpcException(RpcCode.INVALID_ARGUMENT,
                    "Required bytes of volume \"" + uuid + "\" must be greater than zero"));
        }
        Volume existing = volumes.get(uuid);
        if (existing != null && existing.getState() == VolumeState.DESTROYED) {
            // the teardown of a previous incarnation failed; finish it and start over
            log.info("Volume \"{}\" is created again while its destruction is pending", uuid);
            return existing.destroy()
                    .handle((v, error) -> {
                        if (error != null) {
                            log.warn("Dropping volume \"{}\" whose destruction failed: {}", uuid,
                                    RpcException.unwrap(error).getMessage());
                        }
                        volumes.remove(uuid, existing);
                        return null;
                    })
                    .thenCompose(v -> createVolume(uuid, spec));
        }
        if (existing != null) {
            return existing.update(spec).thenApply(v -> existing);
        }
        Volume volume = new Volume(uuid, spec, registry, eventBus);
        Volume raced = volumes.putIfAbsent(uuid, volume);
        if (raced != null) {
            return raced.update(spec).thenApply(v -> raced);
        }
        log.info("Creating volume \"{}\" with {} replicas of {} bytes",
                uuid, spec.getReplicaCount(), spec.getRequiredBytes());
        volumesTotal.set(volumes.size());
        eventBus.emit(EventKind.VOLUME, EventType.NEW, volume);
        return timedEnsure(volume).thenApply(v -> volume);
    }

    /**
     * Destroy a volume. Unknown volumes are silently ignored.
     */
    public CompletableFuture<Void> destroyVolume(String uuid) {
        Volume volume = volumes.get(uuid);
        if (volume == null) {
            return CompletableFuture.completedFuture(null);
        }
        return volume.destroy().thenRun(() -> {
            volumes.remove(uuid, volume);
            volumesTotal.set(volumes.size());
        });
    }

    public Optional<Volume> get(String uuid) {
        return Optional.ofNullable(volumes.get(uuid));
    }

    public List<Volume> list() {
        return new ArrayList<>(volumes.values());
    }

    /**
     * Reconcile every volume. Volumes stuck in destruction retry their teardown.
     */
    public void reconcileAll() {
        log.debug("Reconciling {} volumes", volumes.size());
        for (Volume volume : volumes.values()) {
            if (volume.getState() == VolumeState.DESTROYED) {
                destroyVolume(volume.getUuid()).exceptionally(error -> {
                    log.error("Failed to destroy volume \"{}\": {}", volume.getUuid(),
                            RpcException.unwrap(error).getMessage());
                    return null;
                });
            } else {
                timedEnsure(volume);
            }
        }
    }

    @Override
    public void onNew(VolumeSpecRecord record) {
        applyRecord(record);
    }

    @Override
    public void onMod(VolumeSpecRecord record) {
        applyRecord(record);
    }

    @Override
    public void onDel(String uuid) {
        destroyVolume(uuid).exceptionally(error -> {
            log.error("Failed to destroy volume \"{}\": {}", uuid, RpcException.unwrap(error).getMessage());
            return null;
        });
    }

    private void applyRecord(VolumeSpecRecord record) {
        createVolume(record.getUuid(), record.getSpec()).exceptionally(error -> {
            log.error("Failed to create or update volume \"{}\": {}", record.getUuid(),
                    RpcException.unwrap(error).getMessage());
            return null;
        });
    }

    void onRegistryEvent(StorageEvent event) {
        switch (event.getKind()) {
            case POOL:
                if (event.getType() == EventType.NEW) {
                    volumes.values().stream()
                            .filter(v -> WAITING_FOR_POOLS.contains(v.getState()))
                            .forEach(this::dispatchEnsure);
                }
                break;
            case REPLICA:
                dispatchEnsure(event.getObject(Replica.class).getUuid());
                break;
            case NEXUS:
                dispatchEnsure(event.getObject(Nexus.class).getUuid());
                break;
            case NODE:
                if (event.getType() == EventType.SYNC) {
                    String nodeName = event.getObject(Node.class).getName();
                    volumes.values().stream()
                            .filter(v -> nodeName.equals(v.getPublishedOn()))
                            .forEach(this::dispatchEnsure);
                }
                break;
            default:
                break;
        }
    }

    private void dispatchEnsure(String uuid) {
        Volume volume = volumes.get(uuid);
        if (volume != null) {
            dispatchEnsure(volume);
        }
    }

    private void dispatchEnsure(Volume volume) {
        if (volume.getState() == VolumeState.DESTROYED) {
            return;
        }
        executor.execute(() -> timedEnsure(volume));
    }

    private CompletableFuture<Void> timedEnsure(Volume volume) {
        Timer.Sample sample = Timer.start();
        return volume.ensure().whenComplete((v, error) -> {
            sample.stop(ensureDuration);
            if (error != null || volume.getState() == VolumeState.FAULTED) {
                ensureFailures.increment();
            }
        });
    }
}
