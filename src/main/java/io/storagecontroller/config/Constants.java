package io.storagecontroller.config;

/**
 * Application constants.
 */
public final class Constants {

    private Constants() {
        // Utility class
    }

    // Default configuration values
    public static final String DEFAULT_ETCD_ENDPOINT = "http://localhost:2379";
    public static final long DEFAULT_SYNC_PERIOD_MILLIS = 60_000L;
    public static final long DEFAULT_SYNC_RETRY_MILLIS = 10_000L;
    public static final int DEFAULT_SYNC_BAD_LIMIT = 3;
    public static final long DEFAULT_RPC_TIMEOUT_MILLIS = 15_000L;
    public static final long DEFAULT_RECONCILE_INTERVAL_SECONDS = 30L;
    public static final int DEFAULT_SCHEDULER_THREADS = 4;
    public static final long DEFAULT_STATS_INTERVAL_SECONDS = 60L;

    // etcd key prefixes of watched specifications
    public static final String DEFAULT_NODE_PREFIX = "/storage/nodes";
    public static final String DEFAULT_VOLUME_PREFIX = "/storage/volumes";
    public static final String DEFAULT_POOL_PREFIX = "/storage/pools";
}
