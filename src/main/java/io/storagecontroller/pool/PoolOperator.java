package io.storagecontroller.pool;

import com.google.common.util.concurrent.AtomicDouble;
import io.storagecontroller.events.EventListener;
import io.storagecontroller.events.EventType;
import io.storagecontroller.events.StorageEvent;
import io.storagecontroller.metrics.MetricsConstants;
import io.storagecontroller.metrics.MetricsProvider;
import io.storagecontroller.model.Pool;
import io.storagecontroller.node.Node;
import io.storagecontroller.registry.Registry;
import io.storagecontroller.rpc.RpcException;
import io.storagecontroller.watcher.PoolSpec;
import io.storagecontroller.watcher.SpecListener;
import io.storagecontroller.workq.WorkQueue;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Creates and destroys storage pools so that the nodes carry the declared pools.
 * <p>
 * A declared pool is created as soon as its node is synced. Until then it stays
 * pending and is retried when the node syncs. A declared pool which disappears
 * from its node is created again. Pools found on nodes without a declaration
 * are left alone. The node and disks of a declared pool are fixed when it is
 * first seen; later changes are ignored with a warning.
 * <p>
 * All operations run one at a time through the operator's {@link WorkQueue}.
 */
@Slf4j
public class PoolOperator implements SpecListener<PoolSpec> {

    private final Registry registry;
    private final WorkQueue workQueue = new WorkQueue("pool-operator");
    private final Map<String, PoolSpec> specs = new ConcurrentHashMap<>();
    private final Map<String, PoolStatus> statuses = new ConcurrentHashMap<>();
    private final EventListener registryListener = this::onRegistryEvent;
    private final AtomicDouble poolsPending;

    private boolean started;

    public PoolOperator(Registry registry, MetricsProvider metricsProvider) {
        this.registry = registry;
        this.poolsPending = metricsProvider.gauge(MetricsConstants.POOLS_PENDING_METRIC_NAME, Map.of());
    }

    public synchronized void start() {
        if (started) {
            return;
        }
        registry.subscribe(registryListener);
        started = true;
        log.info("Pool operator started");
    }

    public synchronized void stop() {
        if (!started) {
            return;
        }
        registry.unsubscribe(registryListener);
        started = false;
        log.info("Pool operator stopped");
    }

    @Override
    public void onNew(PoolSpec spec) {
        if (spec.getNode() == null || spec.getNode().isBlank()
                || spec.getDisks() == null || spec.getDisks().isEmpty()) {
            log.error("Ignoring pool \"{}\" without a node or disks", spec.getName());
            statuses.put(spec.getName(), PoolStatus.error("pool needs a node and at least one disk"));
            return;
        }
        specs.put(spec.getName(), spec);
        log.info("New pool \"{}\" on node \"{}\" with disks {}", spec.getName(), spec.getNode(), spec.getDisks());
        submit(spec);
    }

    @Override
    public void onMod(PoolSpec spec) {
        PoolSpec current = specs.get(spec.getName());
        if (current == null) {
            onNew(spec);
            return;
        }
        if (!Objects.equals(current.getNode(), spec.getNode()) || !Objects.equals(current.getDisks(), spec.getDisks())) {
            log.warn("Ignoring changes of node or disks of the pool \"{}\"", spec.getName());
        }
        submit(current);
    }

    @Override
    public void onDel(String name) {
        specs.remove(name);
        statuses.remove(name);
        updatePendingGauge();
        log.info("Pool \"{}\" is no longer declared", name);
        workQueue.push(name, this::destroyPool);
    }

    public Optional<PoolStatus> getStatus(String name) {
        return Optional.ofNullable(statuses.get(name));
    }

    public List<PoolSpec> list() {
        return new ArrayList<>(specs.values());
    }

    void onRegistryEvent(StorageEvent event) {
        switch (event.getKind()) {
            case NODE:
                if (event.getType() == EventType.SYNC) {
                    String nodeName = event.getObject(Node.class).getName();
                    log.debug("Checking pools declared on node \"{}\"", nodeName);
                    specs.values().stream()
                            .filter(spec -> spec.getNode().equals(nodeName))
                            .forEach(this::submit);
                }
                break;
            case POOL:
                onPoolEvent(event.getType(), event.getObject(Pool.class));
                break;
            default:
                break;
        }
    }

    private void onPoolEvent(EventType type, Pool pool) {
        PoolSpec spec = specs.get(pool.getName());
        if (spec == null) {
            if (type == EventType.NEW) {
                log.debug("Pool \"{}\" is not declared, leaving it alone", pool);
            }
            return;
        }
        if (type == EventType.DEL) {
            log.warn("Recreating destroyed pool \"{}\"", pool.getName());
            submit(spec);
        } else {
            setStatus(spec.getName(), PoolStatus.of(pool));
        }
    }

    private void submit(PoolSpec spec) {
        workQueue.push(spec, this::createPool);
    }

    private CompletableFuture<Void> createPool(PoolSpec spec) {
        String name = spec.getName();
        if (!specs.containsKey(name)) {
            return CompletableFuture.completedFuture(null);
        }
        Optional<Pool> existing = registry.getPool(name);
        if (existing.isPresent()) {
            setStatus(name, PoolStatus.of(existing.get()));
            return CompletableFuture.completedFuture(null);
        }
        Node node = registry.getNode(spec.getNode()).orElse(null);
        if (node == null) {
            String reason = "storage agent does not run on the node \"" + spec.getNode() + "\"";
            log.warn("Cannot create pool \"{}\": {}", name, reason);
            setStatus(name, PoolStatus.pending(reason));
            return CompletableFuture.completedFuture(null);
        }
        if (!node.isSynced()) {
            String reason = "storage agent on the node \"" + spec.getNode() + "\" is offline";
            log.warn("Cannot create pool \"{}\": {}", name, reason);
            setStatus(name, PoolStatus.pending(reason));
            return CompletableFuture.completedFuture(null);
        }
        setStatus(name, PoolStatus.pending("Creating the pool"));
        return node.createPool(name, spec.getDisks())
                .handle((pool, error) -> {
                    if (error != null) {
                        Throwable cause = RpcException.unwrap(error);
                        log.error("Failed to create pool \"{}\": {}", name, cause.getMessage());
                        setStatus(name, PoolStatus.error(cause.getMessage()));
                    } else {
                        setStatus(name, PoolStatus.of(pool));
                    }
                    return null;
                });
    }

    private CompletableFuture<Void> destroyPool(String name) {
        if (specs.containsKey(name)) {
            // declared again in the meantime
            return CompletableFuture.completedFuture(null);
        }
        Optional<Pool> pool = registry.getPool(name);
        if (pool.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        return pool.get().destroy().exceptionally(error -> {
            log.error("Failed to destroy pool \"{}\": {}", pool.get(), RpcException.unwrap(error).getMessage());
            return null;
        });
    }

    private void setStatus(String name, PoolStatus status) {
        if (!specs.containsKey(name)) {
            return;
        }
        PoolStatus previous = statuses.put(name, status);
        if (!status.equals(previous)) {
            log.debug("Pool \"{}\" is {} {}", name, status.getPhase(), status.getReason());
        }
        updatePendingGauge();
    }

    private void updatePendingGauge() {
        poolsPending.set(statuses.values().stream()
                .filter(s -> s.getPhase() == PoolStatus.Phase.PENDING || s.getPhase() == PoolStatus.Phase.ERROR)
                .count());
    }
}
