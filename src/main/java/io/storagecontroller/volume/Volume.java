package io.storagecontroller.volume;

import io.storagecontroller.events.EventBus;
import io.storagecontroller.events.EventKind;
import io.storagecontroller.events.EventType;
import io.storagecontroller.model.ChildState;
import io.storagecontroller.model.Nexus;
import io.storagecontroller.model.NexusChild;
import io.storagecontroller.model.NexusProtocol;
import io.storagecontroller.model.NexusState;
import io.storagecontroller.model.Pool;
import io.storagecontroller.model.Replica;
import io.storagecontroller.model.ShareProtocol;
import io.storagecontroller.node.Node;
import io.storagecontroller.registry.Registry;
import io.storagecontroller.rpc.RpcCode;
import io.storagecontroller.rpc.RpcException;
import io.storagecontroller.workq.WorkQueue;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Volume: a set of replicas on different nodes plus at most one nexus
 * aggregating them.
 * <p>
 * The volume does not own its replicas and nexus, the nodes do. It keeps a
 * derived view of them refreshed from the {@link Registry} at the beginning of
 * every reconciliation pass ({@link #attach()}). All public operations are
 * serialized through the volume's own {@link WorkQueue}. A reconciliation pass
 * never fails: every step logs its errors and the pass continues, leaving the
 * rest to the next pass.
 */
@Slf4j
public class Volume {

    // replica scoring, the sum of the less important criteria never outweighs a more important one
    private static final int SCORE_REQUIRED_NODE = 100;
    private static final int SCORE_ONLINE = 50;
    private static final int SCORE_PREFERRED_NODE = 20;
    private static final int SCORE_LOCAL_NODE = 9;
    private static final int SCORE_NEXUS_NODE = 1;

    @Getter
    private final String uuid;
    private final Registry registry;
    private final EventBus eventBus;
    private final WorkQueue workQueue;

    @Getter
    private volatile VolumeSpec spec;
    @Getter
    private volatile long size;
    @Getter
    private volatile String publishedOn;
    @Getter
    private volatile VolumeState state = VolumeState.PENDING;
    @Getter
    private volatile Nexus nexus;
    // replicas keyed by the name of the node hosting them
    private final Map<String, Replica> replicas = new ConcurrentHashMap<>();

    // reconciliation pass queued but not started yet, guarded by this
    private CompletableFuture<Void> queuedEnsure;

    public Volume(String uuid, VolumeSpec spec, Registry registry, EventBus eventBus) {
        this.uuid = uuid;
        this.spec = normalize(spec);
        this.registry = registry;
        this.eventBus = eventBus;
        this.workQueue = new WorkQueue("volume@" + uuid);
    }

    public List<Replica> getReplicas() {
        return new ArrayList<>(replicas.values());
    }

    /**
     * Refresh replicas and nexus of the volume from the registry.
     */
    public void attach() {
        Map<String, Replica> fresh = new HashMap<>();
        for (Replica replica : registry.getReplicaSet(uuid)) {
            Node node = replica.getNode();
            if (node == null) {
                continue;
            }
            if (fresh.putIfAbsent(node.getName(), replica) != null) {
                log.warn("Volume \"{}\" has more than one replica on node \"{}\"", uuid, node.getName());
            }
        }
        replicas.keySet().retainAll(fresh.keySet());
        replicas.putAll(fresh);

        List<Nexus> candidates = registry.getNexuses().stream()
                .filter(n -> n.getUuid().equals(uuid))
                .collect(Collectors.toList());
        String target = publishedOn;
        nexus = candidates.stream()
                .filter(n -> target != null && n.getNode() != null && n.getNode().getName().equals(target))
                .findFirst()
                .orElse(candidates.isEmpty() ? null : candidates.get(0));

        if (size == 0) {
            Nexus current = nexus;
            if (current != null && current.getSize() > 0) {
                size = current.getSize();
            } else {
                fresh.values().stream().mapToLong(Replica::getSize).filter(s -> s > 0).min()
                        .ifPresent(s -> size = s);
            }
        }
    }

    /**
     * Run a reconciliation pass. A pass queued but not started yet is shared by
     * all callers.
     */
    public CompletableFuture<Void> ensure() {
        CompletableFuture<Void> gate;
        CompletableFuture<Void> result;
        synchronized (this) {
            if (queuedEnsure != null) {
                return queuedEnsure;
            }
            gate = new CompletableFuture<>();
            result = workQueue.push(gate, g -> g.thenCompose(ignored -> startEnsure()));
            queuedEnsure = result;
        }
        gate.complete(null);
        return result;
    }

    /**
     * Make the volume accessible from the given node.
     *
     * @return future with the device URI of the published nexus
     */
    public CompletableFuture<String> publish(String nodeName) {
        return workQueue.push(nodeName, this::doPublish);
    }

    public CompletableFuture<Void> unpublish() {
        return workQueue.push(null, ignored -> doUnpublish());
    }

    /**
     * Destroy the nexus and all replicas of the volume.
     */
    public CompletableFuture<Void> destroy() {
        return workQueue.push(null, ignored -> doDestroy());
    }

    /**
     * Apply a new specification. Size and protocol cannot change.
     */
    public CompletableFuture<Void> update(VolumeSpec newSpec) {
        return workQueue.push(normalize(newSpec), this::doUpdate);
    }

    private CompletableFuture<Void> startEnsure() {
        synchronized (this) {
            queuedEnsure = null;
        }
        return doEnsure();
    }

    CompletableFuture<Void> doEnsure() {
        if (state == VolumeState.DESTROYED) {
            log.debug("Volume \"{}\" is being destroyed, retrying the teardown", uuid);
            return doDestroy().exceptionally(error -> {
                log.error("Failed to destroy volume \"{}\": {}", uuid, RpcException.unwrap(error).getMessage());
                return null;
            });
        }
        log.debug("Ensuring state of volume \"{}\"", uuid);
        attach();
        return step("create replicas", this::createMissingReplicas)
                .thenCompose(v -> step("remove excess replicas", this::removeExcessReplicas))
                .thenCompose(v -> step("ensure nexus", this::ensureNexus))
                .thenCompose(v -> step("publish nexus", this::ensurePublished))
                .thenRun(this::updateState);
    }

    private CompletableFuture<Void> createMissingReplicas() {
        VolumeSpec current = spec;
        long healthy = replicas.values().stream().filter(r -> !r.isOffline()).count();
        int missing = (int) (current.getReplicaCount() - healthy);
        if (missing <= 0) {
            return CompletableFuture.completedFuture(null);
        }
        long replicaSize = size > 0 ? size : current.getRequiredBytes();
        List<Pool> pools = registry.choosePools(replicaSize, current.getRequiredNodes(), current.getPreferredNodes())
                .stream()
                .filter(p -> !replicas.containsKey(p.getNode().getName()))
                .collect(Collectors.toCollection(ArrayList::new));
        if (current.isLocal() && !current.getPreferredNodes().isEmpty()) {
            String localNode = current.getPreferredNodes().get(0);
            pools.stream()
                    .filter(p -> p.getNode().getName().equals(localNode))
                    .findFirst()
                    .ifPresent(local -> {
                        pools.remove(local);
                        pools.add(0, local);
                    });
        }
        if (pools.size() < missing) {
            log.warn("Not enough suitable pools for volume \"{}\": {} replicas missing, {} pools available",
                    uuid, missing, pools.size());
        }
        return createOnPools(pools.iterator(), missing, replicaSize);
    }

    // creates replicas one by one, falling back to the next pool on failure
    private CompletableFuture<Void> createOnPools(Iterator<Pool> pools, int remaining, long replicaSize) {
        if (remaining <= 0 || !pools.hasNext()) {
            return CompletableFuture.completedFuture(null);
        }
        Pool pool = pools.next();
        log.info("Creating replica of volume \"{}\" on pool \"{}\"", uuid, pool);
        return pool.createReplica(uuid, replicaSize)
                .handle((replica, error) -> {
                    if (error != null) {
                        log.error("Failed to create replica of volume \"{}\" on pool \"{}\": {}",
                                uuid, pool, RpcException.unwrap(error).getMessage());
                        return createOnPools(pools, remaining, replicaSize);
                    }
                    Node node = replica.getNode();
                    if (node != null) {
                        replicas.put(node.getName(), replica);
                    }
                    if (size == 0) {
                        size = replicaSize;
                    }
                    return createOnPools(pools, remaining - 1, replicaSize);
                })
                .thenCompose(next -> next);
    }

    private CompletableFuture<Void> removeExcessReplicas() {
        int desired = spec.getReplicaCount();
        List<Replica> all = new ArrayList<>(replicas.values());
        long healthy = all.stream().filter(r -> !r.isOffline()).count();
        if (healthy < desired || all.size() <= desired) {
            return CompletableFuture.completedFuture(null);
        }
        List<Replica> victims = all.stream()
                .sorted(Comparator.comparing((Replica r) -> r.isOffline() ? 0 : 1)
                        .thenComparingInt(this::score))
                .limit(all.size() - desired)
                .collect(Collectors.toList());
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (Replica victim : victims) {
            chain = chain.thenCompose(v -> removeReplica(victim));
        }
        return chain;
    }

    private CompletableFuture<Void> removeReplica(Replica replica) {
        log.info("Removing excess replica \"{}\" of volume \"{}\"", replica, uuid);
        Node node = replica.getNode();
        Nexus current = nexus;
        CompletableFuture<Void> detached = current != null && replica.getUri() != null
                ? current.removeReplica(replica.getUri())
                : CompletableFuture.completedFuture(null);
        return detached
                .thenCompose(v -> replica.destroy())
                .handle((v, error) -> {
                    if (error != null) {
                        log.error("Failed to remove replica \"{}\" of volume \"{}\": {}",
                                replica, uuid, RpcException.unwrap(error).getMessage());
                    } else if (node != null) {
                        replicas.remove(node.getName(), replica);
                    }
                    return null;
                });
    }

    private CompletableFuture<Void> ensureNexus() {
        List<Replica> active = activeReplicas();
        if (active.isEmpty()) {
            log.warn("Volume \"{}\" has no healthy replicas", uuid);
            return CompletableFuture.completedFuture(null);
        }
        Node nexusNode = desiredNexusNode(active, null);
        if (nexusNode == null) {
            log.warn("Node \"{}\" for the nexus of volume \"{}\" is unknown", publishedOn, uuid);
            return CompletableFuture.completedFuture(null);
        }

        CompletableFuture<Void> ready = CompletableFuture.completedFuture(null);
        Nexus current = nexus;
        if (current != null && current.getNode() != nexusNode) {
            log.info("Moving nexus of volume \"{}\" from \"{}\" to node \"{}\"", uuid, current, nexusNode.getName());
            ready = current.destroy().thenRun(() -> nexus = null);
        } else if (current != null && current.isOffline()) {
            log.warn("Nexus \"{}\" of volume \"{}\" is offline", current, uuid);
            return CompletableFuture.completedFuture(null);
        }

        return ready
                .thenCompose(v -> shareReplicas(nexusNode, active))
                .thenCompose(accessible -> {
                    Nexus existing = nexus;
                    if (existing == null) {
                        return createNexus(nexusNode, accessible);
                    }
                    return syncChildren(existing, accessible);
                });
    }

    // shares replicas so that the nexus can open them, returns those it can access
    private CompletableFuture<List<Replica>> shareReplicas(Node nexusNode, List<Replica> active) {
        List<Replica> accessible = new ArrayList<>();
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (Replica replica : active) {
            boolean local = replica.getNode() == nexusNode;
            ShareProtocol wanted = null;
            if (local && replica.getShare() != ShareProtocol.NONE) {
                wanted = ShareProtocol.NONE;
            } else if (!local && replica.getShare() == ShareProtocol.NONE) {
                wanted = ShareProtocol.NVMF;
            }
            if (wanted == null) {
                accessible.add(replica);
                continue;
            }
            ShareProtocol protocol = wanted;
            chain = chain.thenCompose(v -> replica.setShare(protocol)
                    .handle((uri, error) -> {
                        if (error != null) {
                            log.error("Failed to set share protocol of replica \"{}\" to {}: {}",
                                    replica, protocol, RpcException.unwrap(error).getMessage());
                        } else {
                            accessible.add(replica);
                        }
                        return null;
                    }));
        }
        return chain.thenApply(v -> accessible);
    }

    private CompletableFuture<Void> createNexus(Node nexusNode, List<Replica> accessible) {
        if (accessible.isEmpty()) {
            return CompletableFuture.failedFuture(new RpcException(RpcCode.INTERNAL,
                    "No replica of volume \"" + uuid + "\" is accessible from node \"" + nexusNode.getName() + "\""));
        }
        long nexusSize = size > 0 ? size : accessible.stream().mapToLong(Replica::getSize).min().orElse(0);
        log.info("Creating nexus of volume \"{}\" on node \"{}\" over {} replicas",
                uuid, nexusNode.getName(), accessible.size());
        return nexusNode.createNexus(uuid, nexusSize, accessible)
                .thenAccept(created -> {
                    nexus = created;
                    if (size == 0) {
                        size = nexusSize;
                    }
                });
    }

    private CompletableFuture<Void> syncChildren(Nexus existing, List<Replica> accessible) {
        Set<String> childUris = existing.getChildren().stream()
                .map(NexusChild::getUri)
                .collect(Collectors.toSet());
        Set<String> replicaUris = replicas.values().stream()
                .map(Replica::getUri)
                .filter(uri -> uri != null)
                .collect(Collectors.toCollection(HashSet::new));

        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (Replica replica : accessible) {
            if (!childUris.contains(replica.getUri())) {
                chain = chain.thenCompose(v -> existing.addReplica(replica)
                        .handle((child, error) -> {
                            if (error != null) {
                                log.error("Failed to add replica \"{}\" to nexus \"{}\": {}",
                                        replica, existing, RpcException.unwrap(error).getMessage());
                            }
                            return null;
                        }));
            }
        }
        for (String uri : childUris) {
            if (!replicaUris.contains(uri)) {
                chain = chain.thenCompose(v -> existing.removeReplica(uri)
                        .handle((ignored, error) -> {
                            if (error != null) {
                                log.error("Failed to remove uri \"{}\" from nexus \"{}\": {}",
                                        uri, existing, RpcException.unwrap(error).getMessage());
                            }
                            return null;
                        }));
            }
        }
        return chain;
    }

    private CompletableFuture<Void> ensurePublished() {
        Nexus current = nexus;
        if (publishedOn == null || current == null || current.isPublished() || current.isOffline()) {
            return CompletableFuture.completedFuture(null);
        }
        return current.publish(spec.getProtocol())
                .thenAccept(uri -> log.info("Volume \"{}\" published at \"{}\"", uuid, uri));
    }

    private void updateState() {
        if (state == VolumeState.DESTROYED) {
            return;
        }
        int desired = spec.getReplicaCount();
        long healthy = replicas.values().stream().filter(r -> !r.isOffline()).count();
        Nexus current = nexus;
        VolumeState newState;
        if (healthy == 0) {
            newState = VolumeState.FAULTED;
        } else if (current == null) {
            if (publishedOn != null) {
                newState = VolumeState.OFFLINE;
            } else {
                newState = healthy < desired ? VolumeState.DEGRADED : VolumeState.HEALTHY;
            }
        } else if (current.isOffline()) {
            newState = VolumeState.OFFLINE;
        } else if (current.getState() == NexusState.FAULTED) {
            newState = VolumeState.FAULTED;
        } else {
            List<NexusChild> children = current.getChildren();
            long online = children.stream().filter(ch -> ch.getState() == ChildState.ONLINE).count();
            boolean rebuilding = children.stream().anyMatch(NexusChild::isRebuilding);
            newState = online < desired || rebuilding ? VolumeState.DEGRADED : VolumeState.HEALTHY;
        }
        setState(newState);
    }

    private void setState(VolumeState newState) {
        if (state == newState) {
            return;
        }
        log.info("Volume \"{}\" changed state from {} to {}", uuid, state, newState);
        state = newState;
        eventBus.emit(EventKind.VOLUME, EventType.MOD, this);
    }

    private CompletableFuture<String> doPublish(String nodeName) {
        if (state == VolumeState.DESTROYED) {
            return CompletableFuture.failedFuture(new RpcException(RpcCode.NOT_FOUND,
                    "Volume \"" + uuid + "\" is being destroyed"));
        }
        attach();
        if (publishedOn == null) {
            Node target = desiredNexusNode(activeReplicas(), nodeName);
            if (target == null) {
                return CompletableFuture.failedFuture(new RpcException(RpcCode.INTERNAL,
                        "Cannot find a node for the nexus of volume \"" + uuid + "\""));
            }
            publishedOn = target.getName();
            log.info("Publishing volume \"{}\" on node \"{}\"", uuid, publishedOn);
        }
        return doEnsure().thenApply(v -> {
            Nexus current = nexus;
            if (current == null || !current.isPublished()) {
                throw new RpcException(RpcCode.INTERNAL, "Failed to publish volume \"" + uuid + "\"");
            }
            return current.getDeviceUri();
        });
    }

    private CompletableFuture<Void> doUnpublish() {
        publishedOn = null;
        attach();
        Nexus current = nexus;
        if (current == null || !current.isPublished()) {
            updateState();
            return CompletableFuture.completedFuture(null);
        }
        log.info("Unpublishing volume \"{}\"", uuid);
        return current.unpublish().thenRun(this::updateState);
    }

    private CompletableFuture<Void> doDestroy() {
        if (state != VolumeState.DESTROYED) {
            log.info("Destroying volume \"{}\"", uuid);
            state = VolumeState.DESTROYED;
        }
        attach();
        Nexus current = nexus;
        CompletableFuture<Void> nexusGone = current != null
                ? current.destroy()
                : CompletableFuture.completedFuture(null);
        return nexusGone
                .thenCompose(v -> {
                    nexus = null;
                    CompletableFuture<?>[] destroys = replicas.values().stream()
                            .map(Replica::destroy)
                            .toArray(CompletableFuture[]::new);
                    return CompletableFuture.allOf(destroys);
                })
                .thenRun(() -> {
                    replicas.clear();
                    log.info("Volume \"{}\" destroyed", uuid);
                    eventBus.emit(EventKind.VOLUME, EventType.DEL, this);
                });
    }

    private CompletableFuture<Void> doUpdate(VolumeSpec newSpec) {
        long current = size;
        if (current > 0 && current < newSpec.getRequiredBytes()) {
            return CompletableFuture.failedFuture(new RpcException(RpcCode.INVALID_ARGUMENT,
                    "Extending the volume \"" + uuid + "\" is not supported"));
        }
        if (newSpec.getLimitBytes() > 0 && current > newSpec.getLimitBytes()) {
            return CompletableFuture.failedFuture(new RpcException(RpcCode.INVALID_ARGUMENT,
                    "Shrinking the volume \"" + uuid + "\" is not supported"));
        }
        if (spec.getProtocol() != newSpec.getProtocol()) {
            return CompletableFuture.failedFuture(new RpcException(RpcCode.INVALID_ARGUMENT,
                    "Changing the protocol for volume \"" + uuid + "\" is not supported"));
        }
        if (spec.equals(newSpec)) {
            return CompletableFuture.completedFuture(null);
        }
        log.info("Updating spec of volume \"{}\"", uuid);
        spec = newSpec;
        eventBus.emit(EventKind.VOLUME, EventType.MOD, this);
        return doEnsure();
    }

    /**
     * Node where the nexus is or should be: the node the volume is published on,
     * the application node, the node of the existing nexus, or the replica node
     * hosting the fewest nexus.
     */
    private Node desiredNexusNode(List<Replica> active, String appNode) {
        String target = publishedOn;
        if (target != null) {
            return registry.getNode(target).orElse(null);
        }
        if (appNode != null) {
            Node node = registry.getNode(appNode).orElse(null);
            if (node != null) {
                return node;
            }
        }
        Nexus current = nexus;
        if (current != null && current.getNode() != null) {
            return current.getNode();
        }
        return active.stream()
                .map(Replica::getNode)
                .filter(n -> n != null)
                .min(Comparator.comparingInt(n -> n.getNexuses().size()))
                .orElse(null);
    }

    // healthy replicas, best first
    private List<Replica> activeReplicas() {
        return replicas.values().stream()
                .filter(r -> !r.isOffline())
                .sorted(Comparator.comparingInt(this::score).reversed())
                .collect(Collectors.toList());
    }

    int score(Replica replica) {
        Node node = replica.getNode();
        if (node == null) {
            return 0;
        }
        VolumeSpec current = spec;
        int score = 0;
        if (current.getRequiredNodes().contains(node.getName())) {
            score += SCORE_REQUIRED_NODE;
        }
        if (!replica.isOffline()) {
            score += SCORE_ONLINE;
        }
        if (current.getPreferredNodes().contains(node.getName())) {
            score += SCORE_PREFERRED_NODE;
        }
        if (current.isLocal()
                && !current.getPreferredNodes().isEmpty()
                && current.getPreferredNodes().get(0).equals(node.getName())) {
            score += SCORE_LOCAL_NODE;
        }
        Nexus currentNexus = nexus;
        if (currentNexus != null && currentNexus.getNode() == node) {
            score += SCORE_NEXUS_NODE;
        }
        return score;
    }

    private CompletableFuture<Void> step(String what, Supplier<CompletableFuture<Void>> action) {
        CompletableFuture<Void> future;
        try {
            future = action.get();
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        return future.exceptionally(error -> {
            log.error("Failed to {} of volume \"{}\": {}", what, uuid, RpcException.unwrap(error).getMessage());
            return null;
        });
    }

    private static VolumeSpec normalize(VolumeSpec spec) {
        VolumeSpec.VolumeSpecBuilder builder = spec.toBuilder();
        if (spec.getPreferredNodes() == null) {
            builder.preferredNodes(new ArrayList<>());
        }
        if (spec.getRequiredNodes() == null) {
            builder.requiredNodes(new ArrayList<>());
        }
        if (spec.getProtocol() == null) {
            builder.protocol(NexusProtocol.NVMF);
        }
        return builder.build();
    }

    @Override
    public String toString() {
        return uuid;
    }
}
