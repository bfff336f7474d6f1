package io.storagecontroller.config;

import io.storagecontroller.node.NodeOptions;
import lombok.Data;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;

import static io.storagecontroller.config.Constants.*;

/**
 * Configuration for the storage controller.
 * Loads configuration from application.yml with fallbacks to constants.
 */
@Slf4j
@Getter
public class StorageControllerConfig {

    private final String[] etcdEndpoints;
    private final long syncPeriodMillis;
    private final long syncRetryMillis;
    private final int syncBadLimit;
    private final long rpcTimeoutMillis;
    private final long reconcileIntervalSeconds;
    private final int schedulerThreads;
    private final String nodePrefix;
    private final String volumePrefix;
    private final String poolPrefix;
    private final long statsIntervalSeconds;

    // Default classpath location
    private static final String DEFAULT_CONFIG_FILE_CLASSPATH = "application.yml";
    // Environment variable to check for external config file path
    private static final String EXTERNAL_CONFIG_ENV_VAR = "CONTROLLER_CONFIG_FILE";

    public StorageControllerConfig() {
        this(loadYamlConfig());
    }

    StorageControllerConfig(ConfigModel config) {
        this.etcdEndpoints = parseEndpoints(config);
        this.syncPeriodMillis = positiveOr(config.getNode() != null ? config.getNode().getSyncPeriodMillis() : null,
                DEFAULT_SYNC_PERIOD_MILLIS, "node.syncPeriodMillis");
        this.syncRetryMillis = positiveOr(config.getNode() != null ? config.getNode().getSyncRetryMillis() : null,
                DEFAULT_SYNC_RETRY_MILLIS, "node.syncRetryMillis");
        this.syncBadLimit = (int) positiveOr(config.getNode() != null && config.getNode().getSyncBadLimit() != null
                        ? Long.valueOf(config.getNode().getSyncBadLimit()) : null,
                DEFAULT_SYNC_BAD_LIMIT, "node.syncBadLimit");
        this.rpcTimeoutMillis = positiveOr(config.getRpc() != null ? config.getRpc().getTimeoutMillis() : null,
                DEFAULT_RPC_TIMEOUT_MILLIS, "rpc.timeoutMillis");
        this.reconcileIntervalSeconds = positiveOr(
                config.getVolume() != null ? config.getVolume().getReconcileIntervalSeconds() : null,
                DEFAULT_RECONCILE_INTERVAL_SECONDS, "volume.reconcileIntervalSeconds");
        this.schedulerThreads = (int) positiveOr(
                config.getController() != null && config.getController().getSchedulerThreads() != null
                        ? Long.valueOf(config.getController().getSchedulerThreads()) : null,
                DEFAULT_SCHEDULER_THREADS, "controller.schedulerThreads");
        this.nodePrefix = nonBlankOr(config.getWatch() != null ? config.getWatch().getNodePrefix() : null,
                DEFAULT_NODE_PREFIX);
        this.volumePrefix = nonBlankOr(config.getWatch() != null ? config.getWatch().getVolumePrefix() : null,
                DEFAULT_VOLUME_PREFIX);
        this.poolPrefix = nonBlankOr(config.getWatch() != null ? config.getWatch().getPoolPrefix() : null,
                DEFAULT_POOL_PREFIX);
        this.statsIntervalSeconds = positiveOr(
                config.getMetrics() != null ? config.getMetrics().getStatsIntervalSeconds() : null,
                DEFAULT_STATS_INTERVAL_SECONDS, "metrics.statsIntervalSeconds");

        log.info("Loaded storage controller config - etcd endpoints: {}, sync period: {}ms, sync retry: {}ms, "
                        + "bad sync limit: {}, rpc timeout: {}ms, reconcile interval: {}s",
                String.join(", ", etcdEndpoints), syncPeriodMillis, syncRetryMillis, syncBadLimit,
                rpcTimeoutMillis, reconcileIntervalSeconds);
    }

    /**
     * Options every storage node is created with.
     */
    public NodeOptions toNodeOptions() {
        return NodeOptions.builder()
                .syncPeriod(Duration.ofMillis(syncPeriodMillis))
                .syncRetry(Duration.ofMillis(syncRetryMillis))
                .syncBadLimit(syncBadLimit)
                .rpcTimeout(Duration.ofMillis(rpcTimeoutMillis))
                .build();
    }

    public Duration getReconcileInterval() {
        return Duration.ofSeconds(reconcileIntervalSeconds);
    }

    public Duration getStatsInterval() {
        return Duration.ofSeconds(statsIntervalSeconds);
    }

    private static ConfigModel loadYamlConfig() {
        InputStream inputStream = null;
        String loadedFrom = "";

        // 1. Check environment variable for external config file path
        String externalConfigPath = System.getenv(EXTERNAL_CONFIG_ENV_VAR);
        if (externalConfigPath != null && !externalConfigPath.trim().isEmpty()) {
            log.info("External config file path specified via {}: {}", EXTERNAL_CONFIG_ENV_VAR, externalConfigPath);
            try {
                if (Files.exists(Paths.get(externalConfigPath))) {
                    inputStream = new FileInputStream(externalConfigPath);
                    loadedFrom = "external file (" + externalConfigPath + ")";
                } else {
                    log.warn("External config file specified but not found at path: {}. Falling back.", externalConfigPath);
                }
            } catch (IOException e) {
                log.warn("Error opening external config file {}: {}. Falling back.", externalConfigPath, e.getMessage());
            } catch (SecurityException se) {
                log.warn("Permission denied accessing external config file {}: {}. Falling back.", externalConfigPath, se.getMessage());
            }
        } else {
            log.debug("{} environment variable not set, looking for config on classpath.", EXTERNAL_CONFIG_ENV_VAR);
        }

        // 2. If external file wasn't loaded, try classpath
        if (inputStream == null) {
            log.info("Loading config from classpath: {}", DEFAULT_CONFIG_FILE_CLASSPATH);
            inputStream = StorageControllerConfig.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE_CLASSPATH);
            loadedFrom = "classpath (" + DEFAULT_CONFIG_FILE_CLASSPATH + ")";
            if (inputStream == null) {
                log.warn("Config file not found on classpath: {}. Using defaults.", DEFAULT_CONFIG_FILE_CLASSPATH);
                return new ConfigModel();
            }
        }

        // 3. Load from the determined InputStream
        try (InputStream in = inputStream) {
            ConfigModel config = parse(in);
            log.info("Successfully loaded configuration from {}", loadedFrom);
            return config;
        } catch (IOException e) {
            log.error("Error closing config file input stream: {}", e.getMessage());
            return new ConfigModel();
        }
    }

    /**
     * Parse a YAML document. Unknown keys are ignored, a malformed document yields defaults.
     */
    static ConfigModel parse(InputStream inputStream) {
        LoaderOptions options = new LoaderOptions();
        Constructor constructor = new Constructor(ConfigModel.class, options);
        constructor.getPropertyUtils().setSkipMissingProperties(true);
        Yaml yaml = new Yaml(constructor);
        try {
            ConfigModel config = yaml.load(inputStream);
            return config != null ? config : new ConfigModel();
        } catch (Exception e) {
            log.warn("Failed to parse configuration: {}. Using defaults.", e.getMessage());
            return new ConfigModel();
        }
    }

    private static String[] parseEndpoints(ConfigModel config) {
        if (config.getEtcd() != null && config.getEtcd().getEndpoints() != null) {
            List<String> endpoints = config.getEtcd().getEndpoints();
            if (!endpoints.isEmpty()) {
                return endpoints.toArray(new String[0]);
            }
        }
        return new String[]{DEFAULT_ETCD_ENDPOINT};
    }

    private static long positiveOr(Long value, long defaultValue, String key) {
        if (value == null) {
            return defaultValue;
        }
        if (value <= 0) {
            log.warn("Ignoring non-positive value {} of {}, using default {}", value, key, defaultValue);
            return defaultValue;
        }
        return value;
    }

    private static String nonBlankOr(String value, String defaultValue) {
        return value != null && !value.isBlank() ? value : defaultValue;
    }

    /**
     * Configuration model for the application.yml file.
     */
    @Data
    public static class ConfigModel {
        private Etcd etcd;
        private NodeSection node;
        private Rpc rpc;
        private VolumeSection volume;
        private Watch watch;
        private MetricsSection metrics;
        private Controller controller; // id is resolved by Spring @Value
    }

    @Data
    public static class Etcd {
        private List<String> endpoints;
    }

    @Data
    public static class NodeSection {
        private Long syncPeriodMillis;
        private Long syncRetryMillis;
        private Integer syncBadLimit;
    }

    @Data
    public static class Rpc {
        private Long timeoutMillis;
    }

    @Data
    public static class VolumeSection {
        private Long reconcileIntervalSeconds;
    }

    @Data
    public static class Watch {
        private String nodePrefix;
        private String volumePrefix;
        private String poolPrefix;
    }

    @Data
    public static class MetricsSection {
        private Long statsIntervalSeconds;
    }

    @Data
    public static class Controller {
        private String id;
        private Integer schedulerThreads;
    }
}
