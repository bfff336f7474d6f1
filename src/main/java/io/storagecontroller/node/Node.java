package io.storagecontroller.node;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.storagecontroller.events.EventBus;
import io.storagecontroller.events.EventKind;
import io.storagecontroller.events.EventType;
import io.storagecontroller.model.Nexus;
import io.storagecontroller.model.NexusInfo;
import io.storagecontroller.model.Pool;
import io.storagecontroller.model.PoolInfo;
import io.storagecontroller.model.Replica;
import io.storagecontroller.model.ReplicaInfo;
import io.storagecontroller.model.ReplicaStat;
import io.storagecontroller.rpc.NodeOfflineException;
import io.storagecontroller.rpc.RpcClient;
import io.storagecontroller.rpc.RpcClientFactory;
import io.storagecontroller.rpc.RpcCode;
import io.storagecontroller.rpc.RpcException;
import io.storagecontroller.workq.WorkQueue;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Storage node running a storage agent, together with the pools, replicas and
 * nexus found on it.
 * <p>
 * The node periodically lists the objects on the agent and merges them into its
 * cache, emitting new/mod/del events on its {@link EventBus}. All calls to the
 * agent are serialized through the node's {@link WorkQueue}. The node's monitor
 * guards its object set: pools, replicas and nexus are mutated only while it is
 * held.
 * <p>
 * A node that failed {@code syncBadLimit} consecutive syncs is not synced any
 * more; its objects are forced offline, destructive operations on them are
 * faked and constructive ones fail with {@link NodeOfflineException}.
 */
@Slf4j
public class Node {

    public static final Duration NEXUS_CREATE_TIMEOUT = Duration.ofSeconds(60);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    @Getter
    private final String name;
    @Getter
    private final NodeOptions options;
    private final RpcClientFactory clientFactory;
    private final ScheduledExecutorService scheduler;
    private final WorkQueue workQueue;
    @Getter
    private final EventBus eventBus;
    private final List<Pool> pools = new CopyOnWriteArrayList<>();
    private final List<Nexus> nexus = new CopyOnWriteArrayList<>();

    @Getter
    private volatile String endpoint;
    private volatile RpcClient client;
    // number of consecutive failed syncs, starts at the bad limit so that an
    // unreachable node does not flip its (nonexistent) objects offline
    private volatile int syncFailed;
    @Getter
    private volatile NodeState state = NodeState.DISCONNECTED;

    private final Object timerLock = new Object();
    private ScheduledFuture<?> syncTimer;

    public Node(String name, NodeOptions options, RpcClientFactory clientFactory, ScheduledExecutorService scheduler) {
        this.name = name;
        this.options = options;
        this.clientFactory = clientFactory;
        this.scheduler = scheduler;
        this.workQueue = new WorkQueue("rpc@" + name);
        this.eventBus = new EventBus("node " + name);
        this.syncFailed = options.getSyncBadLimit();
    }

    /**
     * Open a connection to the storage agent and start syncing. Nothing happens
     * if the node is already connected to the same endpoint.
     */
    public synchronized void connect(String endpoint) {
        RpcClient old = client;
        if (old != null) {
            if (endpoint.equals(this.endpoint)) {
                return;
            }
            log.info("Storage agent endpoint on node \"{}\" changed from \"{}\" to \"{}\"",
                    name, this.endpoint, endpoint);
            cancelTimer();
            client = null;
            old.close();
        } else {
            log.info("New storage node \"{}\" with endpoint \"{}\"", name, endpoint);
            state = NodeState.CONNECTING;
        }
        this.endpoint = endpoint;
        this.client = clientFactory.create(endpoint, options.getRpcTimeout());
        if (old != null) {
            emit(EventKind.NODE, EventType.MOD, this);
        }
        sync();
    }

    /**
     * Close the connection and force all objects on the node offline.
     */
    public synchronized void disconnect() {
        RpcClient old = client;
        if (old == null) {
            return;
        }
        log.info("Storage agent on node \"{}\" is gone", name);
        cancelTimer();
        client = null;
        endpoint = null;
        old.close();
        syncFailed = options.getSyncBadLimit();
        state = NodeState.DISCONNECTED;
        forceOffline();
    }

    /**
     * Remove all objects of the node from the cache, emitting del events.
     */
    public synchronized void unbind() {
        for (Pool pool : pools) {
            pool.unbind();
        }
        for (Nexus n : nexus) {
            n.unbind();
        }
    }

    /**
     * True if the node is connected and fewer than {@code syncBadLimit}
     * consecutive syncs have failed.
     */
    public boolean isSynced() {
        return client != null && syncFailed < options.getSyncBadLimit();
    }

    public int getSyncFailed() {
        return syncFailed;
    }

    /**
     * Run one sync tick through the work queue and schedule the next one.
     *
     * @return future completing with true if the tick succeeded; it never
     *         completes exceptionally
     */
    public CompletableFuture<Boolean> sync() {
        cancelTimer();
        return workQueue.push(null, ignored -> runSyncTick())
                .thenApply(ok -> {
                    scheduleNext(ok ? options.getSyncPeriod() : options.getSyncRetry());
                    return ok;
                });
    }

    /**
     * Call a method on the storage agent. Calls are serialized with other calls
     * and sync ticks of the node.
     */
    public CompletableFuture<JsonNode> call(String method, Map<String, Object> args) {
        return call(method, args, (Duration) null);
    }

    /**
     * Call a method with a timeout overriding the client's default.
     */
    public CompletableFuture<JsonNode> call(String method, Map<String, Object> args, Duration timeout) {
        return workQueue.push(args, a -> rawCall(method, a, timeout));
    }

    /**
     * Call a method and decode its reply.
     */
    public <T> CompletableFuture<T> call(String method, Map<String, Object> args, Class<T> replyType) {
        return call(method, args, null, replyType);
    }

    public <T> CompletableFuture<T> call(String method, Map<String, Object> args, Duration timeout, Class<T> replyType) {
        return call(method, args, timeout).thenApply(reply -> decode(method, reply, replyType));
    }

    /**
     * Create a storage pool on the node.
     */
    public CompletableFuture<Pool> createPool(String poolName, List<String> disks) {
        if (!isSynced()) {
            return CompletableFuture.failedFuture(new NodeOfflineException(name, "create pool " + poolName));
        }
        log.debug("Creating pool \"{}@{}\" ...", poolName, name);
        Map<String, Object> args = new HashMap<>();
        args.put("name", poolName);
        args.put("disks", disks);
        return call("createPool", args, PoolInfo.class)
                .thenApply(info -> {
                    synchronized (this) {
                        Pool pool = registerPool(new Pool(info), List.of());
                        log.info("Created pool \"{}\"", pool);
                        return pool;
                    }
                });
    }

    /**
     * Create a nexus over the given replicas.
     */
    public CompletableFuture<Nexus> createNexus(String uuid, long size, List<Replica> replicas) {
        if (!isSynced()) {
            return CompletableFuture.failedFuture(new NodeOfflineException(name, "create nexus " + uuid));
        }
        List<String> children = replicas.stream().map(Replica::getUri).collect(Collectors.toList());
        log.debug("Creating nexus \"{}@{}\" with children {}", uuid, name, children);
        Map<String, Object> args = new HashMap<>();
        args.put("uuid", uuid);
        args.put("size", size);
        args.put("children", children);
        return call("createNexus", args, NEXUS_CREATE_TIMEOUT, NexusInfo.class)
                .thenApply(info -> {
                    synchronized (this) {
                        Nexus created = registerNexus(new Nexus(info));
                        log.info("Created nexus \"{}\"", created);
                        return created;
                    }
                });
    }

    /**
     * IO statistics of all replicas on the node.
     */
    public CompletableFuture<List<ReplicaStat>> getStats() {
        log.debug("Retrieving replica stats from node \"{}\"", name);
        return call("statReplicas", Map.of())
                .thenApply(reply -> {
                    String timestamp = Instant.now().toString();
                    List<ReplicaStat> stats = new ArrayList<>();
                    for (JsonNode replica : reply.path("replicas")) {
                        JsonNode counters = replica.path("stats");
                        stats.add(ReplicaStat.builder()
                                .timestamp(timestamp)
                                .uuid(replica.path("uuid").asText())
                                .node(name)
                                .pool(replica.path("pool").asText())
                                .numReadOps(counters.path("numReadOps").asLong())
                                .numWriteOps(counters.path("numWriteOps").asLong())
                                .bytesRead(counters.path("bytesRead").asLong())
                                .bytesWritten(counters.path("bytesWritten").asLong())
                                .build());
                    }
                    return stats;
                });
    }

    public List<Pool> getPools() {
        return Collections.unmodifiableList(pools);
    }

    public Optional<Pool> getPool(String poolName) {
        return pools.stream().filter(p -> p.getName().equals(poolName)).findFirst();
    }

    public List<Nexus> getNexuses() {
        return Collections.unmodifiableList(nexus);
    }

    public Optional<Nexus> getNexus(String uuid) {
        return nexus.stream().filter(n -> n.getUuid().equals(uuid)).findFirst();
    }

    /**
     * All replicas across all pools of the node.
     */
    public List<Replica> getReplicas() {
        List<Replica> replicas = new ArrayList<>();
        for (Pool pool : pools) {
            replicas.addAll(pool.getReplicas());
        }
        return replicas;
    }

    /**
     * Add a pool to the node, bind it and register its replicas. An already
     * registered pool of the same name is returned as is.
     */
    public synchronized Pool registerPool(Pool pool, List<ReplicaInfo> replicas) {
        Optional<Pool> existing = getPool(pool.getName());
        if (existing.isPresent()) {
            log.warn("Pool \"{}\" is already registered on the node \"{}\"", pool.getName(), name);
            return existing.get();
        }
        pools.add(pool);
        pool.bind(this);
        for (ReplicaInfo info : replicas) {
            pool.registerReplica(new Replica(info));
        }
        return pool;
    }

    public synchronized void unregisterPool(Pool pool) {
        if (!pools.remove(pool)) {
            log.warn("Pool \"{}\" is being deregistered and not assigned to the node \"{}\"", pool, name);
        }
    }

    public synchronized Nexus registerNexus(Nexus added) {
        Optional<Nexus> existing = getNexus(added.getUuid());
        if (existing.isPresent()) {
            log.warn("Nexus \"{}\" is already registered on the node \"{}\"", added.getUuid(), name);
            return existing.get();
        }
        nexus.add(added);
        added.bind(this);
        return added;
    }

    public synchronized void unregisterNexus(Nexus removed) {
        if (!nexus.remove(removed)) {
            log.warn("Nexus \"{}\" is being deregistered and not assigned to the node \"{}\"", removed, name);
        }
    }

    public void emit(EventKind kind, EventType type, Object object) {
        eventBus.emit(kind, type, object);
    }

    private CompletableFuture<JsonNode> rawCall(String method, Map<String, Object> args, Duration timeout) {
        RpcClient current = client;
        if (current == null) {
            return CompletableFuture.failedFuture(new NodeOfflineException(name, "call " + method));
        }
        return timeout != null ? current.call(method, args, timeout) : current.call(method, args);
    }

    private CompletableFuture<Boolean> runSyncTick() {
        log.debug("Syncing the node \"{}\"", name);
        RpcClient tickClient = client;
        return list("listPools", "pools", PoolInfo.class)
                .thenCompose(poolList -> list("listReplicas", "replicas", ReplicaInfo.class)
                        .thenCompose(replicaList -> list("listNexus", "nexusList", NexusInfo.class)
                                .thenApply(nexusList -> onSyncSuccess(tickClient, poolList, replicaList, nexusList))))
                .exceptionally(error -> {
                    onSyncFailure(tickClient, error);
                    return false;
                });
    }

    // a tick started on a client which has been closed or replaced since
    private boolean isStale(RpcClient tickClient) {
        return client == null || client != tickClient;
    }

    private <T> CompletableFuture<List<T>> list(String method, String field, Class<T> type) {
        return rawCall(method, Map.of(), null)
                .thenApply(reply -> {
                    List<T> items = new ArrayList<>();
                    for (JsonNode item : reply.path(field)) {
                        items.add(decode(method, item, type));
                    }
                    return items;
                });
    }

    private synchronized boolean onSyncSuccess(RpcClient tickClient, List<PoolInfo> poolList,
                                               List<ReplicaInfo> replicaList, List<NexusInfo> nexusList) {
        if (isStale(tickClient)) {
            log.debug("Dropping the result of a stale sync of the node \"{}\"", name);
            return false;
        }
        boolean wasSynced = isSynced();
        // the node has to be synced before merging so that merges see a healthy node
        syncFailed = 0;
        state = NodeState.SYNCED;
        mergePoolsAndReplicas(poolList, replicaList);
        mergeNexus(nexusList);
        log.debug("The node \"{}\" was successfully synced", name);
        if (!wasSynced) {
            log.info("The node \"{}\" is in sync", name);
            emit(EventKind.NODE, EventType.SYNC, this);
        }
        return true;
    }

    private synchronized void onSyncFailure(RpcClient tickClient, Throwable error) {
        Throwable cause = RpcException.unwrap(error);
        if (isStale(tickClient)) {
            log.debug("Ignoring a failed sync of the node \"{}\" on a stale connection: {}", name, cause.toString());
            return;
        }
        int limit = options.getSyncBadLimit();
        if (!(cause instanceof RpcException)) {
            log.error("Unexpected error while syncing the node \"{}\": {}", name, cause.getMessage(), cause);
        }
        if (syncFailed >= limit) {
            log.debug("Failed to sync the node \"{}\": {}", name, cause.toString());
            return;
        }
        syncFailed++;
        if (syncFailed == limit) {
            log.error("The node \"{}\" is out of sync: {}", name, cause.toString());
            state = NodeState.OFFLINE;
            forceOffline();
        } else {
            log.warn("Failed to sync the node \"{}\": {}", name, cause.toString());
            state = NodeState.SYNC_FAILED;
        }
    }

    private void forceOffline() {
        emit(EventKind.NODE, EventType.MOD, this);
        String reason = "node \"" + name + "\" is unavailable";
        for (Pool pool : pools) {
            pool.offline(reason);
        }
        for (Nexus n : nexus) {
            n.offline();
        }
    }

    private void mergePoolsAndReplicas(List<PoolInfo> poolList, List<ReplicaInfo> replicaList) {
        Map<String, List<ReplicaInfo>> replicasByPool = new HashMap<>();
        for (ReplicaInfo replica : replicaList) {
            replicasByPool.computeIfAbsent(replica.getPool(), k -> new ArrayList<>()).add(replica);
        }
        Set<String> fresh = new HashSet<>();
        List<PoolInfo> existing = new ArrayList<>();
        for (PoolInfo info : poolList) {
            fresh.add(info.getName());
            if (getPool(info.getName()).isPresent()) {
                existing.add(info);
            } else {
                registerPool(new Pool(info), replicasByPool.getOrDefault(info.getName(), List.of()));
            }
        }
        for (PoolInfo info : existing) {
            getPool(info.getName()).ifPresent(pool ->
                    pool.merge(info, replicasByPool.getOrDefault(info.getName(), List.of())));
        }
        for (Pool pool : pools) {
            if (!fresh.contains(pool.getName())) {
                pool.unbind();
            }
        }
    }

    private void mergeNexus(List<NexusInfo> nexusList) {
        Set<String> fresh = new HashSet<>();
        List<NexusInfo> existing = new ArrayList<>();
        for (NexusInfo info : nexusList) {
            fresh.add(info.getUuid());
            if (getNexus(info.getUuid()).isPresent()) {
                existing.add(info);
            } else {
                registerNexus(new Nexus(info));
            }
        }
        for (NexusInfo info : existing) {
            getNexus(info.getUuid()).ifPresent(n -> n.merge(info));
        }
        for (Nexus n : nexus) {
            if (!fresh.contains(n.getUuid())) {
                n.unbind();
            }
        }
    }

    private void scheduleNext(Duration delay) {
        synchronized (timerLock) {
            if (syncTimer != null || client == null || scheduler.isShutdown()) {
                return;
            }
            syncTimer = scheduler.schedule(this::onTimer, delay.toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    private void onTimer() {
        synchronized (timerLock) {
            syncTimer = null;
        }
        sync();
    }

    private void cancelTimer() {
        synchronized (timerLock) {
            if (syncTimer != null) {
                syncTimer.cancel(false);
                syncTimer = null;
            }
        }
    }

    private <T> T decode(String method, JsonNode reply, Class<T> type) {
        try {
            return MAPPER.treeToValue(reply, type);
        } catch (Exception e) {
            throw new RpcException(RpcCode.INTERNAL, "Unexpected reply to " + method + " from node \"" + name + "\"", e);
        }
    }

    @Override
    public String toString() {
        return name;
    }
}
