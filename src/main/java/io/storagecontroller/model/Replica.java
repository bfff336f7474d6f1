package io.storagecontroller.model;

import io.storagecontroller.events.EventKind;
import io.storagecontroller.events.EventType;
import io.storagecontroller.node.Node;
import io.storagecontroller.rpc.NodeOfflineException;
import io.storagecontroller.rpc.RpcCode;
import io.storagecontroller.rpc.RpcException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Replica of a volume living in a storage pool.
 * <p>
 * Mutated only while holding the monitor of the owning {@link Node}; fields are
 * volatile so that other components can read them at any time.
 */
@Slf4j
public class Replica {

    @Getter
    private final String uuid;
    private volatile Pool pool;
    @Getter
    private volatile long size;
    @Getter
    private volatile ShareProtocol share;
    @Getter
    private volatile String uri;
    @Getter
    private volatile ReplicaState state;

    public Replica(ReplicaInfo info) {
        this.uuid = info.getUuid();
        this.size = info.getSize();
        this.share = shareOf(info);
        this.uri = info.getUri();
        this.state = stateOf(info);
    }

    public Pool getPool() {
        return pool;
    }

    /**
     * Node hosting the replica or null if the replica is not bound.
     */
    public Node getNode() {
        Pool current = pool;
        return current != null ? current.getNode() : null;
    }

    public String getPoolName() {
        Pool current = pool;
        return current != null ? current.getName() : null;
    }

    /**
     * Update volatile attributes from a fresh listing.
     *
     * @return true if anything changed (a mod event has been emitted)
     */
    public boolean merge(ReplicaInfo info) {
        boolean changed = false;
        if (size != info.getSize()) {
            size = info.getSize();
            changed = true;
        }
        ShareProtocol newShare = shareOf(info);
        if (share != newShare) {
            share = newShare;
            changed = true;
        }
        if (!Objects.equals(uri, info.getUri())) {
            uri = info.getUri();
            changed = true;
        }
        ReplicaState newState = stateOf(info);
        if (state != newState) {
            state = newState;
            changed = true;
        }
        if (changed) {
            emit(EventType.MOD);
        }
        return changed;
    }

    /**
     * Attach the replica to a pool and announce it.
     */
    public void bind(Pool pool) {
        this.pool = pool;
        log.debug("Adding replica \"{}\" to the list of replicas of pool \"{}\"", uuid, pool);
        emit(EventType.NEW);
    }

    /**
     * Detach the replica from its pool. The pool link is already cleared when
     * the del event is delivered.
     */
    public void unbind() {
        Pool current = pool;
        if (current == null) {
            return;
        }
        log.debug("Removing replica \"{}\" from the list of replicas", this);
        Node node = current.getNode();
        current.unregisterReplica(this);
        pool = null;
        if (node != null) {
            node.emit(EventKind.REPLICA, EventType.DEL, this);
        }
    }

    /**
     * Mark the replica unreachable. Called when its pool or node goes offline.
     */
    public void offline() {
        state = ReplicaState.OFFLINE;
        emit(EventType.MOD);
    }

    /**
     * True if the replica cannot be used: it is offline, unbound, or its node is
     * not synced.
     */
    public boolean isOffline() {
        Node node = getNode();
        return node == null || !node.isSynced() || state == ReplicaState.OFFLINE;
    }

    /**
     * Export the replica with a different protocol.
     *
     * @return future with the new replica URI
     */
    public CompletableFuture<String> setShare(ShareProtocol protocol) {
        Node node = getNode();
        if (node == null) {
            return CompletableFuture.failedFuture(new RpcException(RpcCode.INTERNAL,
                    "Cannot share disassociated replica \"" + uuid + "\""));
        }
        if (!node.isSynced()) {
            return CompletableFuture.failedFuture(new NodeOfflineException(node.getName(), "share replica " + uuid));
        }
        log.debug("Setting share protocol of replica \"{}\" to {} ...", this, protocol);
        return node.call("shareReplica", Map.of("uuid", uuid, "share", protocol.name()))
                .thenApply(reply -> {
                    String newUri = reply.path("uri").asText();
                    synchronized (node) {
                        share = protocol;
                        uri = newUri;
                        log.info("Share protocol of replica \"{}\" set to {} with uri \"{}\"", this, protocol, newUri);
                        emit(EventType.MOD);
                    }
                    return newUri;
                });
    }

    /**
     * Destroy the replica on its node and remove it from its pool. If the node
     * is not synced the destroy is faked: nothing is sent and the replica is
     * just removed locally.
     */
    public CompletableFuture<Void> destroy() {
        Node node = getNode();
        if (node == null) {
            return CompletableFuture.failedFuture(new RpcException(RpcCode.INTERNAL,
                    "Cannot destroy disassociated replica \"" + uuid + "\""));
        }
        if (!node.isSynced()) {
            log.warn("Faking the destroy of replica \"{}\" because node \"{}\" is unreachable", this, node.getName());
            synchronized (node) {
                unbind();
            }
            return CompletableFuture.completedFuture(null);
        }
        log.debug("Destroying replica \"{}\" ...", this);
        return node.call("destroyReplica", Map.of("uuid", uuid))
                .handle((reply, error) -> {
                    if (error != null) {
                        if (!RpcException.hasCode(error, RpcCode.NOT_FOUND)) {
                            throw RpcException.from(error);
                        }
                        log.warn("Replica \"{}\" was already gone", this);
                    } else {
                        log.info("Destroyed replica \"{}\"", this);
                    }
                    synchronized (node) {
                        unbind();
                    }
                    return null;
                });
    }

    private void emit(EventType type) {
        Node node = getNode();
        if (node != null) {
            node.emit(EventKind.REPLICA, type, this);
        }
    }

    private static ShareProtocol shareOf(ReplicaInfo info) {
        return info.getShare() != null ? info.getShare() : ShareProtocol.NONE;
    }

    private static ReplicaState stateOf(ReplicaInfo info) {
        return info.getState() != null ? info.getState() : ReplicaState.ONLINE;
    }

    @Override
    public String toString() {
        Node node = getNode();
        return uuid + "@" + (node != null ? node.getName() : "nowhere");
    }
}
