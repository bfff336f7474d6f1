package io.storagecontroller.registry;

import com.google.common.util.concurrent.AtomicDouble;
import io.storagecontroller.events.EventBus;
import io.storagecontroller.events.EventKind;
import io.storagecontroller.events.EventListener;
import io.storagecontroller.events.EventType;
import io.storagecontroller.events.StorageEvent;
import io.storagecontroller.metrics.MetricsConstants;
import io.storagecontroller.metrics.MetricsProvider;
import io.storagecontroller.model.Nexus;
import io.storagecontroller.model.Pool;
import io.storagecontroller.model.PoolState;
import io.storagecontroller.model.Replica;
import io.storagecontroller.model.ReplicaStat;
import io.storagecontroller.node.Node;
import io.storagecontroller.node.NodeFactory;
import io.storagecontroller.watcher.NodeSpec;
import io.storagecontroller.watcher.SpecListener;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Directory of storage nodes and, through them, of all pools, replicas and nexus.
 * <p>
 * Node lifecycle is driven by node specifications (see {@link SpecListener}).
 * Events of every registered node are relayed on the registry's own
 * {@link EventBus} together with node new/del events. The registry does no
 * merging itself; it only routes lifecycle calls to nodes and gives read access
 * to their cached objects.
 */
@Slf4j
public class Registry implements SpecListener<NodeSpec>, AutoCloseable {

    private final NodeFactory nodeFactory;
    private final MetricsProvider metricsProvider;
    private final Map<String, Node> nodes = new ConcurrentHashMap<>();
    private final Map<String, EventListener> relays = new ConcurrentHashMap<>();
    @Getter
    private final EventBus eventBus = new EventBus("registry");

    private final AtomicDouble nodesTotal;
    private final AtomicDouble nodesSynced;
    private final AtomicDouble freeBytes;

    public Registry(NodeFactory nodeFactory, MetricsProvider metricsProvider) {
        this.nodeFactory = nodeFactory;
        this.metricsProvider = metricsProvider;
        this.nodesTotal = metricsProvider.gauge(MetricsConstants.NODES_TOTAL_METRIC_NAME, Map.of());
        this.nodesSynced = metricsProvider.gauge(MetricsConstants.NODES_SYNCED_METRIC_NAME, Map.of());
        this.freeBytes = metricsProvider.gauge(MetricsConstants.FREE_BYTES_METRIC_NAME, Map.of());
        log.info("Registry initialized");
    }

    public void subscribe(EventListener listener) {
        eventBus.subscribe(listener);
    }

    public void unsubscribe(EventListener listener) {
        eventBus.unsubscribe(listener);
    }

    /**
     * Add a node or update the endpoint of a known one.
     */
    public void addNode(String name, String endpoint) {
        Node node = nodes.get(name);
        if (node != null) {
            node.connect(endpoint);
            return;
        }
        node = nodeFactory.create(name);
        registerNode(node);
        eventBus.emit(EventKind.NODE, EventType.NEW, node);
        node.connect(endpoint);
        updateNodeGauges();
    }

    /**
     * Put a node object into the registry and start relaying its events.
     */
    void registerNode(Node node) {
        if (nodes.putIfAbsent(node.getName(), node) != null) {
            throw new IllegalStateException("Node \"" + node.getName() + "\" is already registered");
        }
        EventListener relay = event -> relay(node, event);
        relays.put(node.getName(), relay);
        node.getEventBus().subscribe(relay);
        log.info("Storage node \"{}\" just joined", node.getName());
    }

    /**
     * Disconnect a node but keep it (and its objects, now offline) in the registry.
     */
    public void disconnectNode(String name) {
        Node node = nodes.get(name);
        if (node == null) {
            return;
        }
        log.info("Storage node \"{}\" left", name);
        node.disconnect();
    }

    /**
     * Disconnect a node, drop its objects and forget it.
     */
    public void removeNode(String name) {
        Node node = nodes.remove(name);
        if (node == null) {
            return;
        }
        log.info("Removing storage node \"{}\"", name);
        node.disconnect();
        node.unbind();
        eventBus.emit(EventKind.NODE, EventType.DEL, node);
        EventListener relay = relays.remove(name);
        if (relay != null) {
            node.getEventBus().unsubscribe(relay);
        }
        updateNodeGauges();
    }

    public Optional<Node> getNode(String name) {
        return Optional.ofNullable(nodes.get(name));
    }

    public List<Node> getNodes() {
        return new ArrayList<>(nodes.values());
    }

    public Optional<Pool> getPool(String name) {
        return getPools().stream().filter(p -> p.getName().equals(name)).findFirst();
    }

    public List<Pool> getPools() {
        List<Pool> pools = new ArrayList<>();
        for (Node node : nodes.values()) {
            pools.addAll(node.getPools());
        }
        return pools;
    }

    public Optional<Nexus> getNexus(String uuid) {
        return getNexuses().stream().filter(n -> n.getUuid().equals(uuid)).findFirst();
    }

    public List<Nexus> getNexuses() {
        List<Nexus> nexuses = new ArrayList<>();
        for (Node node : nodes.values()) {
            nexuses.addAll(node.getNexuses());
        }
        return nexuses;
    }

    /**
     * All replicas of one volume.
     */
    public List<Replica> getReplicaSet(String uuid) {
        return getReplicas().stream().filter(r -> r.getUuid().equals(uuid)).collect(Collectors.toList());
    }

    public List<Replica> getReplicas() {
        List<Replica> replicas = new ArrayList<>();
        for (Node node : nodes.values()) {
            replicas.addAll(node.getReplicas());
        }
        return replicas;
    }

    /**
     * Free bytes of all accessible pools.
     */
    public long getCapacity() {
        return capacityOf(getPools());
    }

    /**
     * Free bytes of accessible pools on one node.
     */
    public long getCapacity(String nodeName) {
        return capacityOf(getNode(nodeName).map(Node::getPools).orElse(List.of()));
    }

    /**
     * Pools suitable for a new replica, best first, at most one per node.
     * <p>
     * Candidates are accessible pools with at least {@code requiredBytes} free
     * on one of {@code mustNodes} (any node if empty). They are ranked by:
     * preferred node, ONLINE over DEGRADED, fewer replicas, more free bytes.
     */
    public List<Pool> choosePools(long requiredBytes, List<String> mustNodes, List<String> shouldNodes) {
        List<String> must = mustNodes != null ? mustNodes : List.of();
        List<String> should = shouldNodes != null ? shouldNodes : List.of();

        Comparator<Pool> ranking = Comparator
                .comparing((Pool p) -> should.contains(p.getNode().getName()) ? 0 : 1)
                .thenComparing(p -> p.getState() == PoolState.ONLINE ? 0 : 1)
                .thenComparingInt(p -> p.getReplicas().size())
                .thenComparing(Comparator.comparingLong(Pool::freeBytes).reversed());

        List<Pool> candidates = new ArrayList<>();
        for (Pool pool : getPools()) {
            Node node = pool.getNode();
            if (node != null
                    && pool.isAccessible()
                    && pool.freeBytes() >= requiredBytes
                    && (must.isEmpty() || must.contains(node.getName()))) {
                candidates.add(pool);
            }
        }
        candidates.sort(ranking);

        Set<String> usedNodes = new HashSet<>();
        List<Pool> chosen = new ArrayList<>();
        for (Pool pool : candidates) {
            if (usedNodes.add(pool.getNode().getName())) {
                chosen.add(pool);
            }
        }
        return chosen;
    }

    /**
     * IO statistics of replicas on all synced nodes. Nodes failing to report are skipped.
     */
    public CompletableFuture<List<ReplicaStat>> listReplicaStats() {
        List<CompletableFuture<List<ReplicaStat>>> perNode = nodes.values().stream()
                .filter(Node::isSynced)
                .map(node -> node.getStats().exceptionally(error -> {
                    log.warn("Failed to retrieve replica stats from node \"{}\": {}", node.getName(), error.getMessage());
                    return List.of();
                }))
                .collect(Collectors.toList());
        return CompletableFuture.allOf(perNode.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> perNode.stream()
                        .flatMap(f -> f.join().stream())
                        .collect(Collectors.toList()));
    }

    @Override
    public void onNew(NodeSpec spec) {
        applySpec(spec);
    }

    @Override
    public void onMod(NodeSpec spec) {
        applySpec(spec);
    }

    @Override
    public void onDel(String name) {
        removeNode(name);
    }

    /**
     * Remove all nodes.
     */
    @Override
    public void close() {
        for (String name : new ArrayList<>(nodes.keySet())) {
            removeNode(name);
        }
    }

    // a node without an endpoint is known to the orchestrator but its storage agent is gone
    private void applySpec(NodeSpec spec) {
        String endpoint = spec.getEndpoint();
        if (endpoint == null || endpoint.isBlank()) {
            if (nodes.containsKey(spec.getName())) {
                disconnectNode(spec.getName());
            } else {
                log.debug("Storage node \"{}\" has no endpoint yet", spec.getName());
            }
            return;
        }
        addNode(spec.getName(), endpoint);
    }

    private void relay(Node node, StorageEvent event) {
        switch (event.getKind()) {
            case NODE:
                if (event.getType() == EventType.MOD && !node.isSynced()) {
                    metricsProvider.counter(MetricsConstants.NODE_OFFLINE_METRIC_NAME,
                            Map.of(MetricsConstants.NODE_TAG, node.getName())).increment();
                }
                updateNodeGauges();
                updateCapacityGauges(node);
                break;
            case POOL:
            case REPLICA:
                updateCapacityGauges(node);
                break;
            default:
                break;
        }
        eventBus.emit(event);
    }

    private void updateCapacityGauges(Node node) {
        metricsProvider.gauge(MetricsConstants.NODE_FREE_BYTES_METRIC_NAME,
                Map.of(MetricsConstants.NODE_TAG, node.getName())).set(getCapacity(node.getName()));
        freeBytes.set(getCapacity());
    }

    private void updateNodeGauges() {
        nodesTotal.set(nodes.size());
        nodesSynced.set(nodes.values().stream().filter(Node::isSynced).count());
    }

    private static long capacityOf(List<Pool> pools) {
        return pools.stream().filter(Pool::isAccessible).mapToLong(Pool::freeBytes).sum();
    }
}
