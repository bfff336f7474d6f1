package io.storagecontroller.registry;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.storagecontroller.events.EventKind;
import io.storagecontroller.events.EventType;
import io.storagecontroller.events.StorageEvent;
import io.storagecontroller.metrics.MetricsConstants;
import io.storagecontroller.metrics.MetricsProvider;
import io.storagecontroller.model.Pool;
import io.storagecontroller.model.PoolState;
import io.storagecontroller.model.ReplicaStat;
import io.storagecontroller.node.Node;
import io.storagecontroller.rpc.RpcCode;
import io.storagecontroller.testing.FakeRpcClient;
import io.storagecontroller.testing.StorageFixtures;
import io.storagecontroller.watcher.NodeSpec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.assertj.core.api.Assertions.*;

class RegistryTest {

    private ScheduledExecutorService scheduler;
    private SimpleMeterRegistry meterRegistry;
    private final Map<String, FakeRpcClient> agents = new ConcurrentHashMap<>();
    private Registry registry;
    private final List<StorageEvent> events = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        meterRegistry = new SimpleMeterRegistry();
        registry = new Registry(
                name -> StorageFixtures.node(name, agents.computeIfAbsent(name, n -> new FakeRpcClient()), scheduler),
                new MetricsProvider(meterRegistry, "test-controller"));
        registry.subscribe(events::add);
    }

    @AfterEach
    void tearDown() {
        registry.close();
        scheduler.shutdownNow();
    }

    private FakeRpcClient agent(String name) {
        return agents.computeIfAbsent(name, n -> new FakeRpcClient());
    }

    private void addNodeWithPool(String nodeName, String poolName, long capacity, long used) {
        agent(nodeName).listPools(StorageFixtures.pool(poolName, capacity, used));
        registry.addNode(nodeName, nodeName + ":10124");
    }

    private double gauge(String name) {
        return meterRegistry.find(name).gauge().value();
    }

    @Test
    void testAddNode_RegistersNodeAndRelaysEvents() {
        // When
        addNodeWithPool("node-1", "pool-1", 1000, 0);

        // Then
        assertThat(registry.getNode("node-1")).isPresent();
        assertThat(registry.getPools()).extracting(Pool::getName).containsExactly("pool-1");
        assertThat(events).extracting(StorageEvent::getKind, StorageEvent::getType)
                .containsExactly(
                        tuple(EventKind.NODE, EventType.NEW),
                        tuple(EventKind.POOL, EventType.NEW),
                        tuple(EventKind.NODE, EventType.SYNC));
        assertThat(gauge(MetricsConstants.NODES_TOTAL_METRIC_NAME)).isEqualTo(1.0);
        assertThat(gauge(MetricsConstants.NODES_SYNCED_METRIC_NAME)).isEqualTo(1.0);
    }

    @Test
    void testAddNode_KnownNodeWithSameEndpointIsNoop() {
        // Given
        addNodeWithPool("node-1", "pool-1", 1000, 0);
        Node node = registry.getNode("node-1").orElseThrow();
        events.clear();

        // When
        registry.onMod(new NodeSpec("node-1", "node-1:10124"));

        // Then
        assertThat(registry.getNode("node-1")).containsSame(node);
        assertThat(events).isEmpty();
    }

    @Test
    void testRemoveNode_UnbindsObjectsAndStopsRelaying() {
        // Given
        addNodeWithPool("node-1", "pool-1", 1000, 0);
        Node node = registry.getNode("node-1").orElseThrow();
        events.clear();

        // When
        registry.onDel("node-1");
        node.emit(EventKind.POOL, EventType.MOD, "ignored");

        // Then
        assertThat(registry.getNodes()).isEmpty();
        assertThat(registry.getPools()).isEmpty();
        assertThat(events).extracting(StorageEvent::getKind, StorageEvent::getType)
                .containsExactly(
                        tuple(EventKind.NODE, EventType.MOD),
                        tuple(EventKind.POOL, EventType.MOD),
                        tuple(EventKind.POOL, EventType.DEL),
                        tuple(EventKind.NODE, EventType.DEL));
        assertThat(node.getEventBus().listenerCount()).isZero();
        assertThat(meterRegistry.find(MetricsConstants.NODE_OFFLINE_METRIC_NAME).counter().count()).isEqualTo(1.0);
    }

    @Test
    void testDisconnectNode_KeepsNodeOffline() {
        // Given
        addNodeWithPool("node-1", "pool-1", 1000, 0);

        // When
        registry.disconnectNode("node-1");

        // Then
        assertThat(registry.getNode("node-1")).isPresent();
        assertThat(registry.getPools()).hasSize(1);
        assertThat(registry.getCapacity()).isZero();
        assertThat(gauge(MetricsConstants.NODES_SYNCED_METRIC_NAME)).isZero();
    }

    @Test
    void testOnMod_NodeWithoutEndpointIsDisconnected() {
        // Given
        addNodeWithPool("node-1", "pool-1", 1000, 0);

        // When
        registry.onMod(new NodeSpec("node-1", ""));
        registry.onNew(new NodeSpec("node-2", null));

        // Then
        Node node = registry.getNode("node-1").orElseThrow();
        assertThat(node.isSynced()).isFalse();
        assertThat(node.getEndpoint()).isNull();
        assertThat(agent("node-1").isClosed()).isTrue();
        assertThat(registry.getPool("pool-1").orElseThrow().getState()).isEqualTo(PoolState.OFFLINE);
        assertThat(registry.getNode("node-2")).isEmpty();
    }

    @Test
    void testCapacityGauges_FollowPoolsAndNodes() {
        // Given
        addNodeWithPool("node-1", "pool-1", 1000, 100);
        addNodeWithPool("node-2", "pool-2", 500, 0);

        // Then
        assertThat(gauge(MetricsConstants.FREE_BYTES_METRIC_NAME)).isEqualTo(1400);
        assertThat(meterRegistry.find(MetricsConstants.NODE_FREE_BYTES_METRIC_NAME)
                .tag(MetricsConstants.NODE_TAG, "node-2").gauge().value()).isEqualTo(500);

        // When
        registry.disconnectNode("node-1");

        // Then
        assertThat(gauge(MetricsConstants.FREE_BYTES_METRIC_NAME)).isEqualTo(500);
        assertThat(meterRegistry.find(MetricsConstants.NODE_FREE_BYTES_METRIC_NAME)
                .tag(MetricsConstants.NODE_TAG, "node-1").gauge().value()).isZero();
    }

    @Test
    void testGetCapacity_SumsFreeBytesOfAccessiblePools() {
        // Given
        addNodeWithPool("node-1", "pool-1", 1000, 100);
        addNodeWithPool("node-2", "pool-2", 500, 0);

        // Then
        assertThat(registry.getCapacity()).isEqualTo(1400);
        assertThat(registry.getCapacity("node-2")).isEqualTo(500);
        assertThat(registry.getCapacity("unknown")).isZero();
    }

    @Test
    void testChoosePools_RanksPreferredThenStateThenReplicasThenFreeBytes() {
        // Given
        agent("node-1").listPools(StorageFixtures.pool("pool-1", 1000, 0));
        agent("node-2").listPools(StorageFixtures.pool("pool-2", 2000, 0));
        Map<String, Object> degraded = StorageFixtures.pool("pool-3", 5000, 0);
        degraded.put("state", "POOL_DEGRADED");
        agent("node-3").listPools(degraded);
        agent("node-4").listPools(StorageFixtures.pool("pool-4", 3000, 0))
                .listReplicas(StorageFixtures.replica("other", "pool-4", 10));
        agent("node-5").listPools(StorageFixtures.pool("pool-5", 50, 0));
        for (String name : List.of("node-1", "node-2", "node-3", "node-4", "node-5")) {
            registry.addNode(name, name + ":10124");
        }

        // When
        List<Pool> pools = registry.choosePools(100, List.of(), List.of("node-1"));

        // Then
        assertThat(pools).extracting(Pool::getName).containsExactly("pool-1", "pool-2", "pool-4", "pool-3");
    }

    @Test
    void testChoosePools_HonorsRequiredNodesAndOnePoolPerNode() {
        // Given
        agent("node-1").listPools(StorageFixtures.pool("pool-1a", 1000, 0), StorageFixtures.pool("pool-1b", 2000, 0));
        agent("node-2").listPools(StorageFixtures.pool("pool-2", 3000, 0));
        registry.addNode("node-1", "node-1:10124");
        registry.addNode("node-2", "node-2:10124");

        // When
        List<Pool> pools = registry.choosePools(100, List.of("node-1"), List.of());

        // Then
        assertThat(pools).extracting(Pool::getName).containsExactly("pool-1b");
    }

    @Test
    void testGetReplicaSet_CollectsReplicasAcrossNodes() {
        // Given
        agent("node-1").listPools(StorageFixtures.pool("pool-1", 1000, 0))
                .listReplicas(StorageFixtures.replica("v1", "pool-1", 10), StorageFixtures.replica("v2", "pool-1", 10));
        agent("node-2").listPools(StorageFixtures.pool("pool-2", 1000, 0))
                .listReplicas(StorageFixtures.replica("v1", "pool-2", 10))
                .listNexus(StorageFixtures.nexus("v1", 10, List.of("bdev:///v1")));
        registry.addNode("node-1", "node-1:10124");
        registry.addNode("node-2", "node-2:10124");

        // Then
        assertThat(registry.getReplicaSet("v1")).hasSize(2);
        assertThat(registry.getReplicas()).hasSize(3);
        assertThat(registry.getNexus("v1")).isPresent();
        assertThat(registry.getNexuses()).hasSize(1);
        assertThat(registry.getPool("pool-2")).isPresent();
    }

    @Test
    void testListReplicaStats_SkipsFailingNodes() {
        // Given
        agent("node-1").reply("statReplicas", Map.of("replicas", List.of(Map.of(
                "uuid", "v1", "pool", "pool-1", "stats", Map.of("numReadOps", 1)))));
        agent("node-2").fail("statReplicas", RpcCode.INTERNAL);
        registry.addNode("node-1", "node-1:10124");
        registry.addNode("node-2", "node-2:10124");

        // When
        List<ReplicaStat> stats = registry.listReplicaStats().join();

        // Then
        assertThat(stats).extracting(ReplicaStat::getNode).containsExactly("node-1");
    }
}
