package io.storagecontroller.model;

import io.storagecontroller.events.EventKind;
import io.storagecontroller.events.EventType;
import io.storagecontroller.node.Node;
import io.storagecontroller.rpc.NodeOfflineException;
import io.storagecontroller.rpc.RpcCode;
import io.storagecontroller.rpc.RpcException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Nexus on a node: the data path aggregating replicas of one volume into a
 * single block device.
 * <p>
 * Mutated only while holding the monitor of the owning {@link Node}.
 */
@Slf4j
public class Nexus {

    public static final Duration DESTROY_TIMEOUT = Duration.ofSeconds(60);

    @Getter
    private final String uuid;
    private volatile Node node;
    @Getter
    private volatile long size;
    @Getter
    private volatile NexusState state;
    private volatile List<NexusChild> children;
    @Getter
    private volatile String deviceUri;

    public Nexus(NexusInfo info) {
        this.uuid = info.getUuid();
        this.size = info.getSize();
        this.state = info.getState() != null ? info.getState() : NexusState.UNKNOWN;
        this.children = childrenOf(info);
        this.deviceUri = info.getDeviceUri() != null ? info.getDeviceUri() : "";
    }

    public Node getNode() {
        return node;
    }

    /**
     * Children sorted by URI.
     */
    public List<NexusChild> getChildren() {
        return children;
    }

    public boolean isPublished() {
        return !deviceUri.isEmpty();
    }

    /**
     * True if the node of the nexus is unknown or not synced.
     */
    public boolean isOffline() {
        Node current = node;
        return current == null || !current.isSynced();
    }

    /**
     * Update volatile attributes from a fresh listing.
     *
     * @return true if anything changed (a mod event has been emitted)
     */
    public boolean merge(NexusInfo info) {
        boolean changed = false;
        if (size != info.getSize()) {
            size = info.getSize();
            changed = true;
        }
        String newDeviceUri = info.getDeviceUri() != null ? info.getDeviceUri() : "";
        if (!deviceUri.equals(newDeviceUri)) {
            deviceUri = newDeviceUri;
            changed = true;
        }
        NexusState newState = info.getState() != null ? info.getState() : NexusState.UNKNOWN;
        if (state != newState) {
            state = newState;
            changed = true;
        }
        List<NexusChild> newChildren = childrenOf(info);
        if (!children.equals(newChildren)) {
            children = newChildren;
            changed = true;
        }
        if (changed) {
            emit(EventType.MOD);
        }
        return changed;
    }

    public void bind(Node node) {
        this.node = node;
        log.debug("Adding nexus \"{}\" to the nexus list of node \"{}\"", uuid, node.getName());
        emit(EventType.NEW);
    }

    public void unbind() {
        Node current = node;
        if (current == null) {
            return;
        }
        log.debug("Removing nexus \"{}\" from the nexus list", this);
        current.unregisterNexus(this);
        node = null;
        current.emit(EventKind.NEXUS, EventType.DEL, this);
    }

    public void offline() {
        log.warn("Nexus \"{}\" got offline", this);
        state = NexusState.OFFLINE;
        emit(EventType.MOD);
    }

    /**
     * Publish the nexus as a block device.
     *
     * @return future with the device URI
     */
    public CompletableFuture<String> publish(NexusProtocol protocol) {
        if (isPublished()) {
            return CompletableFuture.failedFuture(new RpcException(RpcCode.ALREADY_EXISTS,
                    "Nexus \"" + this + "\" has been already published"));
        }
        Node current = node;
        if (current == null) {
            return CompletableFuture.failedFuture(disassociated("publish"));
        }
        if (!current.isSynced()) {
            return CompletableFuture.failedFuture(new NodeOfflineException(current.getName(), "publish nexus " + uuid));
        }
        log.info("Publishing nexus \"{}\" with protocol {} ...", this, protocol);
        Map<String, Object> args = new HashMap<>();
        args.put("uuid", uuid);
        args.put("key", "");
        args.put("share", protocol.name());
        return current.call("publishNexus", args)
                .thenApply(reply -> {
                    String uri = reply.path("deviceUri").asText();
                    synchronized (current) {
                        deviceUri = uri;
                        log.info("Nexus \"{}\" is published at \"{}\"", this, uri);
                        emit(EventType.MOD);
                    }
                    return uri;
                });
    }

    /**
     * Unpublish the nexus. Faked when the node is not synced.
     */
    public CompletableFuture<Void> unpublish() {
        Node current = node;
        if (current == null) {
            return CompletableFuture.failedFuture(disassociated("unpublish"));
        }
        log.debug("Unpublishing nexus \"{}\" ...", this);
        if (!current.isSynced()) {
            log.warn("Faking the unpublish of \"{}\" because it is unreachable", this);
            synchronized (current) {
                clearDeviceUri();
            }
            return CompletableFuture.completedFuture(null);
        }
        return current.call("unpublishNexus", Map.of("uuid", uuid))
                .handle((reply, error) -> {
                    if (error != null) {
                        if (!RpcException.hasCode(error, RpcCode.NOT_FOUND)) {
                            throw RpcException.from(error);
                        }
                        log.warn("The nexus \"{}\" does not exist", this);
                    }
                    log.info("Nexus \"{}\" was unpublished", this);
                    synchronized (current) {
                        clearDeviceUri();
                    }
                    return null;
                });
    }

    /**
     * Add the replica as a child. The nexus is marked DEGRADED until the next
     * sync reports the rebuild outcome.
     */
    public CompletableFuture<NexusChild> addReplica(Replica replica) {
        String uri = replica.getUri();
        Optional<NexusChild> existing = findChild(uri);
        if (existing.isPresent()) {
            return CompletableFuture.completedFuture(existing.get());
        }
        Node current = node;
        if (current == null) {
            return CompletableFuture.failedFuture(disassociated("add child to"));
        }
        if (!current.isSynced()) {
            return CompletableFuture.failedFuture(
                    new NodeOfflineException(current.getName(), "add child to nexus " + uuid));
        }
        log.debug("Adding uri \"{}\" to nexus \"{}\" ...", uri, this);
        Map<String, Object> args = new HashMap<>();
        args.put("uuid", uuid);
        args.put("uri", uri);
        args.put("norebuild", false);
        return current.call("addChildNexus", args, NexusInfo.Child.class)
                .thenApply(info -> {
                    NexusChild child = NexusChild.of(info);
                    synchronized (current) {
                        children = withChild(child);
                        state = NexusState.DEGRADED;
                        log.info("Replica uri \"{}\" added to the nexus \"{}\"", uri, this);
                        emit(EventType.MOD);
                    }
                    return child;
                });
    }

    /**
     * Remove a child by URI. Faked when the node is not synced.
     */
    public CompletableFuture<Void> removeReplica(String uri) {
        if (findChild(uri).isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        Node current = node;
        if (current == null) {
            return CompletableFuture.failedFuture(disassociated("remove child from"));
        }
        if (!current.isSynced()) {
            log.warn("Faking the removal of uri \"{}\" from \"{}\" because it is unreachable", uri, this);
            synchronized (current) {
                dropChild(uri);
            }
            return CompletableFuture.completedFuture(null);
        }
        log.debug("Removing uri \"{}\" from nexus \"{}\" ...", uri, this);
        return current.call("removeChildNexus", Map.of("uuid", uuid, "uri", uri))
                .handle((reply, error) -> {
                    if (error != null && !RpcException.hasCode(error, RpcCode.NOT_FOUND)) {
                        throw RpcException.from(error);
                    }
                    synchronized (current) {
                        dropChild(uri);
                    }
                    log.info("Replica uri \"{}\" removed from the nexus \"{}\"", uri, this);
                    return null;
                });
    }

    /**
     * Destroy the nexus and remove it from its node. Faked when the node is not synced.
     */
    public CompletableFuture<Void> destroy() {
        Node current = node;
        if (current == null) {
            return CompletableFuture.failedFuture(disassociated("destroy"));
        }
        log.debug("Destroying nexus \"{}\" ...", this);
        if (!current.isSynced()) {
            log.warn("Faking the destroy of \"{}\" because it is unreachable", this);
            synchronized (current) {
                unbind();
            }
            return CompletableFuture.completedFuture(null);
        }
        return current.call("destroyNexus", Map.of("uuid", uuid), DESTROY_TIMEOUT)
                .handle((reply, error) -> {
                    if (error != null) {
                        if (!RpcException.hasCode(error, RpcCode.NOT_FOUND)) {
                            throw RpcException.from(error);
                        }
                        log.warn("Nexus \"{}\" was already gone", this);
                    } else {
                        log.info("Destroyed nexus \"{}\"", this);
                    }
                    synchronized (current) {
                        unbind();
                    }
                    return null;
                });
    }

    private Optional<NexusChild> findChild(String uri) {
        return children.stream().filter(ch -> ch.getUri().equals(uri)).findFirst();
    }

    private void dropChild(String uri) {
        List<NexusChild> remaining = children.stream()
                .filter(ch -> !ch.getUri().equals(uri))
                .collect(Collectors.toUnmodifiableList());
        if (remaining.size() != children.size()) {
            children = remaining;
            emit(EventType.MOD);
        }
    }

    private void clearDeviceUri() {
        deviceUri = "";
        emit(EventType.MOD);
    }

    private void emit(EventType type) {
        Node current = node;
        if (current != null) {
            current.emit(EventKind.NEXUS, type, this);
        }
    }

    private RpcException disassociated(String operation) {
        return new RpcException(RpcCode.INTERNAL, "Cannot " + operation + " disassociated nexus \"" + uuid + "\"");
    }

    private static List<NexusChild> childrenOf(NexusInfo info) {
        if (info.getChildren() == null) {
            return List.of();
        }
        return info.getChildren().stream()
                .map(NexusChild::of)
                .sorted()
                .collect(Collectors.toUnmodifiableList());
    }

    private List<NexusChild> withChild(NexusChild added) {
        return Stream.concat(children.stream(), Stream.of(added))
                .sorted()
                .collect(Collectors.toUnmodifiableList());
    }

    @Override
    public String toString() {
        Node current = node;
        return uuid + "@" + (current != null ? current.getName() : "nowhere");
    }
}
