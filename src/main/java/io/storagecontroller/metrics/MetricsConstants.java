package io.storagecontroller.metrics;

/**
 * Constants for metrics names and tags used in the storage controller.
 */
public class MetricsConstants {
    public final static String NODES_TOTAL_METRIC_NAME = "storage_nodes_total";
    public final static String NODES_SYNCED_METRIC_NAME = "storage_nodes_synced";
    public final static String NODE_OFFLINE_METRIC_NAME = "storage_node_offline_total";
    public final static String VOLUMES_TOTAL_METRIC_NAME = "storage_volumes_total";
    public final static String VOLUME_ENSURE_FAILURES_METRIC_NAME = "storage_volume_ensure_failures_total";
    public final static String VOLUME_ENSURE_DURATION_METRIC_NAME = "storage_volume_ensure_duration";
    public final static String FREE_BYTES_METRIC_NAME = "storage_free_bytes";
    public final static String NODE_FREE_BYTES_METRIC_NAME = "storage_node_free_bytes";
    public final static String POOLS_PENDING_METRIC_NAME = "storage_pools_pending";
    public final static String REPLICA_READ_OPS_METRIC_NAME = "storage_replica_read_ops";
    public final static String REPLICA_WRITE_OPS_METRIC_NAME = "storage_replica_write_ops";
    public final static String REPLICA_BYTES_READ_METRIC_NAME = "storage_replica_bytes_read";
    public final static String REPLICA_BYTES_WRITTEN_METRIC_NAME = "storage_replica_bytes_written";
    public final static String CONTROLLER_TAG = "controller";
    public final static String NODE_TAG = "node";
    public final static String POOL_TAG = "pool";
    public final static String REPLICA_TAG = "replica";

    private MetricsConstants() {}
}
