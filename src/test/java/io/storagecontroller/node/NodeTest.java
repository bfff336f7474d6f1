package io.storagecontroller.node;

import com.fasterxml.jackson.databind.JsonNode;
import io.storagecontroller.events.EventKind;
import io.storagecontroller.events.EventType;
import io.storagecontroller.events.StorageEvent;
import io.storagecontroller.model.Pool;
import io.storagecontroller.model.PoolState;
import io.storagecontroller.model.ReplicaStat;
import io.storagecontroller.rpc.NodeOfflineException;
import io.storagecontroller.rpc.RpcClientFactory;
import io.storagecontroller.rpc.RpcCode;
import io.storagecontroller.rpc.RpcException;
import io.storagecontroller.testing.FakeRpcClient;
import io.storagecontroller.testing.StorageFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

class NodeTest {

    private ScheduledExecutorService scheduler;
    private FakeRpcClient client;
    private AtomicInteger clientsCreated;
    private Node node;
    private final List<StorageEvent> events = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        client = new FakeRpcClient()
                .listPools(StorageFixtures.pool("pool", 1000, 100))
                .listReplicas(StorageFixtures.replica("r1", "pool", 100))
                .listNexus(StorageFixtures.nexus("r1", 100, List.of("bdev:///r1")));
        clientsCreated = new AtomicInteger();
        RpcClientFactory factory = (endpoint, timeout) -> {
            clientsCreated.incrementAndGet();
            return client;
        };
        node = new Node("node-1", StorageFixtures.quietOptions(3), factory, scheduler);
        node.getEventBus().subscribe(events::add);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    private long count(EventKind kind, EventType type) {
        return events.stream().filter(e -> e.getKind() == kind && e.getType() == type).count();
    }

    private void failListings() {
        client.fail("listPools", RpcCode.UNAVAILABLE);
    }

    @Test
    void testConnect_SyncsObjectsAndEmitsSync() {
        // When
        node.connect("node-1:10124");

        // Then
        assertThat(node.isSynced()).isTrue();
        assertThat(node.getState()).isEqualTo(NodeState.SYNCED);
        assertThat(node.getPools()).extracting(Pool::getName).containsExactly("pool");
        assertThat(node.getReplicas()).hasSize(1);
        assertThat(node.getNexuses()).hasSize(1);
        assertThat(client.getCalls()).extracting(FakeRpcClient.Call::getMethod)
                .containsExactly("listPools", "listReplicas", "listNexus");
        assertThat(events).extracting(StorageEvent::getKind, StorageEvent::getType)
                .containsExactly(
                        tuple(EventKind.POOL, EventType.NEW),
                        tuple(EventKind.REPLICA, EventType.NEW),
                        tuple(EventKind.NEXUS, EventType.NEW),
                        tuple(EventKind.NODE, EventType.SYNC));
    }

    @Test
    void testConnect_SameEndpointIsNoop() {
        // Given
        node.connect("node-1:10124");
        events.clear();

        // When
        node.connect("node-1:10124");

        // Then
        assertThat(clientsCreated.get()).isEqualTo(1);
        assertThat(events).isEmpty();
    }

    @Test
    void testConnect_NewEndpointReconnects() {
        // Given
        node.connect("node-1:10124");
        events.clear();

        // When
        node.connect("node-1:20124");

        // Then
        assertThat(clientsCreated.get()).isEqualTo(2);
        assertThat(node.getEndpoint()).isEqualTo("node-1:20124");
        assertThat(count(EventKind.NODE, EventType.MOD)).isEqualTo(1);
    }

    @Test
    void testSync_GoesOfflineAfterBadLimitAndRecovers() {
        // Given
        node.connect("node-1:10124");
        events.clear();
        failListings();

        // When two syncs fail the node is still usable
        assertThat(node.sync().join()).isFalse();
        assertThat(node.sync().join()).isFalse();

        // Then
        assertThat(node.isSynced()).isTrue();
        assertThat(node.getState()).isEqualTo(NodeState.SYNC_FAILED);
        assertThat(events).isEmpty();

        // When the third one fails
        node.sync().join();

        // Then
        assertThat(node.isSynced()).isFalse();
        assertThat(node.getState()).isEqualTo(NodeState.OFFLINE);
        assertThat(count(EventKind.NODE, EventType.MOD)).isEqualTo(1);
        Pool pool = node.getPool("pool").orElseThrow();
        assertThat(pool.getState()).isEqualTo(PoolState.OFFLINE);
        assertThat(pool.getReason()).isEqualTo("node \"node-1\" is unavailable");
        assertThat(node.getReplicas().get(0).isOffline()).isTrue();
        assertThat(node.getNexuses().get(0).isOffline()).isTrue();

        // When further syncs fail nothing more is emitted
        node.sync().join();
        assertThat(count(EventKind.NODE, EventType.MOD)).isEqualTo(1);

        // When the agent comes back
        client.listPools(StorageFixtures.pool("pool", 1000, 100));
        assertThat(node.sync().join()).isTrue();

        // Then
        assertThat(node.isSynced()).isTrue();
        assertThat(node.getSyncFailed()).isZero();
        assertThat(count(EventKind.NODE, EventType.SYNC)).isEqualTo(1);
        assertThat(node.getPool("pool").orElseThrow().getState()).isEqualTo(PoolState.ONLINE);
    }

    @Test
    void testSync_UnreachableAtStartDoesNotForceOffline() {
        // Given
        failListings();

        // When
        node.connect("node-1:10124");

        // Then
        assertThat(node.isSynced()).isFalse();
        assertThat(node.getState()).isEqualTo(NodeState.CONNECTING);
        assertThat(events).isEmpty();
    }

    @Test
    void testSync_RemovedObjectsAreUnbound() {
        // Given
        node.connect("node-1:10124");
        events.clear();
        client.listPools().listReplicas().listNexus();

        // When
        node.sync().join();

        // Then
        assertThat(node.getPools()).isEmpty();
        assertThat(node.getNexuses()).isEmpty();
        assertThat(events).extracting(StorageEvent::getKind, StorageEvent::getType)
                .containsExactly(
                        tuple(EventKind.REPLICA, EventType.DEL),
                        tuple(EventKind.POOL, EventType.DEL),
                        tuple(EventKind.NEXUS, EventType.DEL));
    }

    @Test
    void testDisconnect_ForcesObjectsOffline() {
        // Given
        node.connect("node-1:10124");
        events.clear();

        // When
        node.disconnect();

        // Then
        assertThat(client.isClosed()).isTrue();
        assertThat(node.isSynced()).isFalse();
        assertThat(node.getState()).isEqualTo(NodeState.DISCONNECTED);
        assertThat(node.getEndpoint()).isNull();
        assertThat(events.get(0).getKind()).isEqualTo(EventKind.NODE);
        assertThat(node.getPool("pool").orElseThrow().getState()).isEqualTo(PoolState.OFFLINE);
    }

    @Test
    void testDisconnect_SyncInFlightDoesNotBringObjectsBack() {
        // Given a sync waiting for the nexus listing
        node.connect("node-1:10124");
        CompletableFuture<JsonNode> nexusReply = client.defer("listNexus");
        CompletableFuture<Boolean> tick = node.sync();
        assertThat(tick).isNotDone();

        // When the node is disconnected and the listing arrives afterwards
        node.disconnect();
        nexusReply.complete(FakeRpcClient.MAPPER.valueToTree(Map.of("nexusList", List.of())));

        // Then
        assertThat(tick.join()).isFalse();
        assertThat(node.isSynced()).isFalse();
        assertThat(node.getState()).isEqualTo(NodeState.DISCONNECTED);
        assertThat(node.getPool("pool").orElseThrow().getState()).isEqualTo(PoolState.OFFLINE);
        assertThat(node.getNexuses()).hasSize(1);
        assertThat(node.getNexuses().get(0).isOffline()).isTrue();
    }

    @Test
    void testConnect_NewEndpointIgnoresFailureOfOldConnection() {
        // Given a node giving up after one failed sync, connected to a first agent
        FakeRpcClient first = new FakeRpcClient()
                .listPools(StorageFixtures.pool("pool", 1000, 100));
        FakeRpcClient second = new FakeRpcClient();
        Map<String, FakeRpcClient> agents = Map.of("node-2:10124", first, "node-2:20124", second);
        Node strict = new Node("node-2", StorageFixtures.quietOptions(1),
                (endpoint, timeout) -> agents.get(endpoint), scheduler);
        strict.connect("node-2:10124");
        assertThat(strict.isSynced()).isTrue();
        CompletableFuture<JsonNode> oldReply = first.defer("listReplicas");
        strict.sync();
        CompletableFuture<JsonNode> newReply = second.defer("listPools");

        // When the endpoint changes and the old call is cancelled
        strict.connect("node-2:20124");
        oldReply.completeExceptionally(new RpcException(RpcCode.CANCELLED, "closed"));

        // Then the node waits for the new agent instead of going offline
        assertThat(strict.isSynced()).isTrue();
        assertThat(strict.getSyncFailed()).isZero();
        assertThat(strict.getState()).isEqualTo(NodeState.SYNCED);
        assertThat(strict.getPool("pool").orElseThrow().getState()).isEqualTo(PoolState.ONLINE);
        assertThat(second.count("listPools")).isEqualTo(1);

        // When the new agent answers
        newReply.complete(FakeRpcClient.MAPPER.valueToTree(
                Map.of("pools", List.of(StorageFixtures.pool("pool", 1000, 100)))));

        // Then
        assertThat(strict.getState()).isEqualTo(NodeState.SYNCED);
    }

    @Test
    void testCreatePool_FailsWhenNodeIsNotSynced() {
        assertThatThrownBy(() -> node.createPool("pool-2", List.of("/dev/sdc")).join())
                .hasCauseInstanceOf(NodeOfflineException.class);
    }

    @Test
    void testCreatePool_RegistersPool() {
        // Given
        node.connect("node-1:10124");
        client.reply("createPool", StorageFixtures.pool("pool-2", 2000, 0));

        // When
        Pool pool = node.createPool("pool-2", List.of("/dev/sdc")).join();

        // Then
        assertThat(pool.getNode()).isSameAs(node);
        assertThat(node.getPools()).extracting(Pool::getName).containsExactly("pool", "pool-2");
    }

    @Test
    void testCreateNexus_UsesReplicaUris() {
        // Given
        node.connect("node-1:10124");
        StorageFixtures.agent("node-1", client);
        node.getNexus("r1").orElseThrow().unbind();

        // When
        node.createNexus("r1", 100, node.getReplicas()).join();

        // Then
        FakeRpcClient.Call call = client.calls("createNexus").get(0);
        assertThat(call.getArgs()).containsEntry("children", List.of("bdev:///r1"));
        assertThat(call.getTimeout()).isEqualTo(Node.NEXUS_CREATE_TIMEOUT);
        assertThat(node.getNexus("r1")).isPresent();
    }

    @Test
    void testGetStats_ReadsCountersOfReplicas() {
        // Given
        node.connect("node-1:10124");
        client.reply("statReplicas", Map.of("replicas", List.of(Map.of(
                "uuid", "r1",
                "pool", "pool",
                "stats", Map.of("numReadOps", 5, "numWriteOps", 7, "bytesRead", 512, "bytesWritten", 1024)))));

        // When
        List<ReplicaStat> stats = node.getStats().join();

        // Then
        assertThat(stats).hasSize(1);
        ReplicaStat stat = stats.get(0);
        assertThat(stat.getNode()).isEqualTo("node-1");
        assertThat(stat.getNumReadOps()).isEqualTo(5);
        assertThat(stat.getBytesWritten()).isEqualTo(1024);
        assertThat(stat.getTimestamp()).isNotBlank();
    }

    @Test
    void testCall_FailsWithNodeOfflineWhenDisconnected() {
        assertThatThrownBy(() -> node.call("listPools", Map.of()).join())
                .hasCauseInstanceOf(NodeOfflineException.class);
        assertThat(events.stream().map(StorageEvent::getKind).collect(Collectors.toList())).isEmpty();
    }
}
