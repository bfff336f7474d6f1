package io.storagecontroller.config;

import io.storagecontroller.node.NodeOptions;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.time.Duration;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.*;

class StorageControllerConfigTest {

    private static InputStream yaml(String text) {
        return new ByteArrayInputStream(text.getBytes(UTF_8));
    }

    private static StorageControllerConfig load(String text) {
        return new StorageControllerConfig(StorageControllerConfig.parse(yaml(text)));
    }

    @Test
    void testParse_ReadsAllSections() {
        // Given
        String text = String.join("\n",
                "spring:",
                "  application:",
                "    name: storage-controller",
                "etcd:",
                "  endpoints:",
                "    - http://etcd-0:2379",
                "    - http://etcd-1:2379",
                "node:",
                "  syncPeriodMillis: 5000",
                "  syncRetryMillis: 1000",
                "  syncBadLimit: 5",
                "rpc:",
                "  timeoutMillis: 2000",
                "volume:",
                "  reconcileIntervalSeconds: 10",
                "watch:",
                "  nodePrefix: /test/nodes",
                "  volumePrefix: /test/volumes",
                "  poolPrefix: /test/pools",
                "metrics:",
                "  statsIntervalSeconds: 15",
                "controller:",
                "  id: controller-1",
                "  schedulerThreads: 2");

        // When
        StorageControllerConfig config = load(text);

        // Then
        assertThat(config.getEtcdEndpoints()).containsExactly("http://etcd-0:2379", "http://etcd-1:2379");
        assertThat(config.getSyncPeriodMillis()).isEqualTo(5000);
        assertThat(config.getSyncRetryMillis()).isEqualTo(1000);
        assertThat(config.getSyncBadLimit()).isEqualTo(5);
        assertThat(config.getRpcTimeoutMillis()).isEqualTo(2000);
        assertThat(config.getReconcileInterval()).isEqualTo(Duration.ofSeconds(10));
        assertThat(config.getSchedulerThreads()).isEqualTo(2);
        assertThat(config.getNodePrefix()).isEqualTo("/test/nodes");
        assertThat(config.getVolumePrefix()).isEqualTo("/test/volumes");
        assertThat(config.getPoolPrefix()).isEqualTo("/test/pools");
        assertThat(config.getStatsInterval()).isEqualTo(Duration.ofSeconds(15));
    }

    @Test
    void testParse_EmptyDocumentUsesDefaults() {
        // When
        StorageControllerConfig config = load("");

        // Then
        assertThat(config.getEtcdEndpoints()).containsExactly(Constants.DEFAULT_ETCD_ENDPOINT);
        assertThat(config.getSyncPeriodMillis()).isEqualTo(Constants.DEFAULT_SYNC_PERIOD_MILLIS);
        assertThat(config.getSyncRetryMillis()).isEqualTo(Constants.DEFAULT_SYNC_RETRY_MILLIS);
        assertThat(config.getSyncBadLimit()).isEqualTo(Constants.DEFAULT_SYNC_BAD_LIMIT);
        assertThat(config.getRpcTimeoutMillis()).isEqualTo(Constants.DEFAULT_RPC_TIMEOUT_MILLIS);
        assertThat(config.getReconcileIntervalSeconds()).isEqualTo(Constants.DEFAULT_RECONCILE_INTERVAL_SECONDS);
        assertThat(config.getSchedulerThreads()).isEqualTo(Constants.DEFAULT_SCHEDULER_THREADS);
        assertThat(config.getNodePrefix()).isEqualTo(Constants.DEFAULT_NODE_PREFIX);
        assertThat(config.getVolumePrefix()).isEqualTo(Constants.DEFAULT_VOLUME_PREFIX);
        assertThat(config.getPoolPrefix()).isEqualTo(Constants.DEFAULT_POOL_PREFIX);
        assertThat(config.getStatsIntervalSeconds()).isEqualTo(Constants.DEFAULT_STATS_INTERVAL_SECONDS);
    }

    @Test
    void testParse_MalformedDocumentUsesDefaults() {
        // When
        StorageControllerConfig config = load("etcd: [unclosed");

        // Then
        assertThat(config.getEtcdEndpoints()).containsExactly(Constants.DEFAULT_ETCD_ENDPOINT);
    }

    @Test
    void testParse_NonPositiveValuesFallBackToDefaults() {
        // Given
        String text = String.join("\n",
                "node:",
                "  syncPeriodMillis: 0",
                "  syncBadLimit: -1",
                "rpc:",
                "  timeoutMillis: -5",
                "watch:",
                "  nodePrefix: ' '");

        // When
        StorageControllerConfig config = load(text);

        // Then
        assertThat(config.getSyncPeriodMillis()).isEqualTo(Constants.DEFAULT_SYNC_PERIOD_MILLIS);
        assertThat(config.getSyncBadLimit()).isEqualTo(Constants.DEFAULT_SYNC_BAD_LIMIT);
        assertThat(config.getRpcTimeoutMillis()).isEqualTo(Constants.DEFAULT_RPC_TIMEOUT_MILLIS);
        assertThat(config.getNodePrefix()).isEqualTo(Constants.DEFAULT_NODE_PREFIX);
    }

    @Test
    void testToNodeOptions_CarriesSyncSettings() {
        // Given
        StorageControllerConfig config = load(String.join("\n",
                "node:",
                "  syncPeriodMillis: 3000",
                "  syncRetryMillis: 500",
                "  syncBadLimit: 2",
                "rpc:",
                "  timeoutMillis: 750"));

        // When
        NodeOptions options = config.toNodeOptions();

        // Then
        assertThat(options.getSyncPeriod()).isEqualTo(Duration.ofMillis(3000));
        assertThat(options.getSyncRetry()).isEqualTo(Duration.ofMillis(500));
        assertThat(options.getSyncBadLimit()).isEqualTo(2);
        assertThat(options.getRpcTimeout()).isEqualTo(Duration.ofMillis(750));
    }

    @Test
    void testDefaultConstructor_LoadsBundledConfiguration() {
        // When
        StorageControllerConfig config = new StorageControllerConfig();

        // Then
        assertThat(config.getEtcdEndpoints()).isNotEmpty();
        assertThat(config.getNodePrefix()).startsWith("/");
    }
}
