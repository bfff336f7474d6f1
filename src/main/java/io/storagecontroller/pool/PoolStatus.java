package io.storagecontroller.pool;

import io.storagecontroller.model.Pool;
import lombok.Value;

/**
 * Observed status of a declared pool.
 */
@Value
public class PoolStatus {

    public enum Phase {
        PENDING,
        ONLINE,
        DEGRADED,
        FAULTED,
        OFFLINE,
        ERROR
    }

    Phase phase;
    String reason;

    public static PoolStatus pending(String reason) {
        return new PoolStatus(Phase.PENDING, reason);
    }

    public static PoolStatus error(String reason) {
        return new PoolStatus(Phase.ERROR, reason);
    }

    /**
     * Status of a pool present on its node.
     */
    public static PoolStatus of(Pool pool) {
        switch (pool.getState()) {
            case ONLINE:
                return new PoolStatus(Phase.ONLINE, "");
            case DEGRADED:
                return new PoolStatus(Phase.DEGRADED, "");
            case FAULTED:
                return new PoolStatus(Phase.FAULTED, "");
            case PENDING:
                return new PoolStatus(Phase.PENDING, "");
            default:
                return new PoolStatus(Phase.OFFLINE, pool.getReason() != null ? pool.getReason() : "");
        }
    }
}
