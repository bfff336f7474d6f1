package io.storagecontroller.model;

import io.storagecontroller.events.EventKind;
import io.storagecontroller.events.EventType;
import io.storagecontroller.node.Node;
import io.storagecontroller.rpc.NodeOfflineException;
import io.storagecontroller.rpc.RpcCode;
import io.storagecontroller.rpc.RpcException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Storage pool on a node, owning the replicas allocated from it.
 * <p>
 * Mutated only while holding the monitor of the owning {@link Node}.
 */
@Slf4j
public class Pool {

    private static final Pattern URI_PATTERN = Pattern.compile("^([^:]+)://(.+)$");

    @Getter
    private final String name;
    private volatile Node node;
    @Getter
    private volatile List<String> disks;
    @Getter
    private volatile PoolState state;
    @Getter
    private volatile String reason;
    @Getter
    private volatile long capacity;
    @Getter
    private volatile long used;
    private final List<Replica> replicas = new CopyOnWriteArrayList<>();

    public Pool(PoolInfo info) {
        this.name = info.getName();
        this.disks = sortedDisks(info.getDisks());
        this.state = info.getState() != null ? info.getState() : PoolState.OFFLINE;
        this.capacity = info.getCapacity();
        this.used = info.getUsed();
    }

    public Node getNode() {
        return node;
    }

    public List<Replica> getReplicas() {
        return Collections.unmodifiableList(replicas);
    }

    public long freeBytes() {
        return capacity - used;
    }

    /**
     * A pool is accessible when replicas can be created on it.
     */
    public boolean isAccessible() {
        return state == PoolState.ONLINE || state == PoolState.DEGRADED;
    }

    /**
     * Update the pool from a fresh listing and reconcile its replicas.
     *
     * @param info     fresh pool attributes
     * @param replicas fresh listing of replicas on this pool
     * @return true if pool attributes changed (a mod event has been emitted)
     */
    public boolean merge(PoolInfo info, List<ReplicaInfo> replicas) {
        boolean changed = false;

        List<String> newDisks = sortedDisks(info.getDisks());
        if (!disks.equals(newDisks)) {
            List<String> oldDevices = stripSchemes(disks);
            List<String> newDevices = stripSchemes(newDisks);
            if (!oldDevices.equals(newDevices)) {
                log.warn("Unexpected disk change in the pool \"{}\" from {} to {}", this, oldDevices, newDevices);
            }
            disks = newDisks;
            changed = true;
        }
        PoolState newState = info.getState() != null ? info.getState() : PoolState.OFFLINE;
        if (state != newState) {
            state = newState;
            reason = null;
            changed = true;
        }
        if (capacity != info.getCapacity()) {
            capacity = info.getCapacity();
            changed = true;
        }
        if (used != info.getUsed()) {
            used = info.getUsed();
            changed = true;
        }
        if (changed) {
            emit(EventType.MOD);
        }

        mergeReplicas(replicas);
        return changed;
    }

    /**
     * Three-way diff of cached replicas against a fresh listing. Events are
     * emitted for creations first, then modifications (both in listing order),
     * then deletions (in cache order).
     */
    public void mergeReplicas(List<ReplicaInfo> fresh) {
        Map<String, Replica> cached = new HashMap<>();
        for (Replica replica : replicas) {
            cached.put(replica.getUuid(), replica);
        }
        Set<String> freshUuids = new HashSet<>();
        List<ReplicaInfo> existing = new ArrayList<>();

        for (ReplicaInfo info : fresh) {
            freshUuids.add(info.getUuid());
            if (cached.containsKey(info.getUuid())) {
                existing.add(info);
            } else {
                registerReplica(new Replica(info));
            }
        }
        for (ReplicaInfo info : existing) {
            cached.get(info.getUuid()).merge(info);
        }
        for (Replica replica : replicas) {
            if (!freshUuids.contains(replica.getUuid())) {
                replica.unbind();
            }
        }
    }

    /**
     * Add a replica to the pool and bind it. If a replica with the same uuid is
     * already registered, that one is returned instead.
     */
    public Replica registerReplica(Replica replica) {
        for (Replica r : replicas) {
            if (r.getUuid().equals(replica.getUuid())) {
                log.warn("Replica \"{}\" is already registered in the pool \"{}\"", replica.getUuid(), this);
                return r;
            }
        }
        replicas.add(replica);
        replica.bind(this);
        return replica;
    }

    public void unregisterReplica(Replica replica) {
        if (!replicas.remove(replica)) {
            log.warn("Replica \"{}\" is being deregistered and not assigned to the pool \"{}\"", replica, this);
        }
    }

    /**
     * Attach the pool to a node and announce it.
     */
    public void bind(Node node) {
        this.node = node;
        log.debug("Adding pool \"{}\" to the list of pools on \"{}\"", name, node.getName());
        emit(EventType.NEW);
    }

    /**
     * Detach the pool and all its replicas from the node. Replica del events
     * come before the pool del event.
     */
    public void unbind() {
        Node current = node;
        if (current == null) {
            return;
        }
        log.debug("Removing pool \"{}\" from the list of pools", this);
        for (Replica replica : replicas) {
            replica.unbind();
        }
        current.unregisterPool(this);
        node = null;
        current.emit(EventKind.POOL, EventType.DEL, this);
    }

    /**
     * Force the pool and all its replicas offline.
     *
     * @param reason why the pool is not accessible
     */
    public void offline(String reason) {
        log.warn("Pool \"{}\" got offline: {}", this, reason);
        for (Replica replica : replicas) {
            replica.offline();
        }
        this.state = PoolState.OFFLINE;
        this.reason = reason;
        emit(EventType.MOD);
    }

    /**
     * Create a replica in this pool.
     */
    public CompletableFuture<Replica> createReplica(String uuid, long size) {
        Node current = node;
        if (current == null) {
            return CompletableFuture.failedFuture(new RpcException(RpcCode.INTERNAL,
                    "Cannot create replica on disassociated pool \"" + name + "\""));
        }
        if (!current.isSynced()) {
            return CompletableFuture.failedFuture(
                    new NodeOfflineException(current.getName(), "create replica " + uuid));
        }
        Map<String, Object> args = new HashMap<>();
        args.put("uuid", uuid);
        args.put("pool", name);
        args.put("size", size);
        args.put("thin", false);
        args.put("share", ShareProtocol.NONE.name());

        log.debug("Creating replica \"{}\" on the pool \"{}\" ...", uuid, this);
        return current.call("createReplica", args, ReplicaInfo.class)
                .thenApply(info -> {
                    synchronized (current) {
                        Replica replica = registerReplica(new Replica(info));
                        log.info("Created replica \"{}\" on the pool \"{}\"", uuid, this);
                        return replica;
                    }
                });
    }

    /**
     * Destroy the pool on its node. Faked when the node is not synced.
     */
    public CompletableFuture<Void> destroy() {
        Node current = node;
        if (current == null) {
            return CompletableFuture.failedFuture(new RpcException(RpcCode.INTERNAL,
                    "Cannot destroy disassociated pool \"" + name + "\""));
        }
        if (!current.isSynced()) {
            log.warn("Faking the destroy of pool \"{}\" because node is unreachable", this);
            synchronized (current) {
                unbind();
            }
            return CompletableFuture.completedFuture(null);
        }
        log.debug("Destroying pool \"{}\" ...", this);
        return current.call("destroyPool", Map.of("name", name))
                .handle((reply, error) -> {
                    if (error != null) {
                        if (!RpcException.hasCode(error, RpcCode.NOT_FOUND)) {
                            throw RpcException.from(error);
                        }
                        log.warn("Pool \"{}\" was already gone", this);
                    } else {
                        log.info("Destroyed pool \"{}\"", this);
                    }
                    synchronized (current) {
                        unbind();
                    }
                    return null;
                });
    }

    private void emit(EventType type) {
        Node current = node;
        if (current != null) {
            current.emit(EventKind.POOL, type, this);
        }
    }

    private static List<String> sortedDisks(List<String> disks) {
        if (disks == null) {
            return List.of();
        }
        return disks.stream().sorted().collect(Collectors.toUnmodifiableList());
    }

    private static List<String> stripSchemes(List<String> disks) {
        return disks.stream()
                .map(disk -> {
                    Matcher matcher = URI_PATTERN.matcher(disk);
                    return matcher.matches() ? matcher.group(2) : disk;
                })
                .sorted()
                .collect(Collectors.toList());
    }

    @Override
    public String toString() {
        Node current = node;
        return name + "@" + (current != null ? current.getName() : "nowhere");
    }
}
