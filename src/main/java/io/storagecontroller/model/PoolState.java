package io.storagecontroller.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * State of a storage pool as reported by its node.
 *
 * <ul>
 *   <li><strong>ONLINE</strong> - all disks healthy</li>
 *   <li><strong>DEGRADED</strong> - usable with reduced redundancy</li>
 *   <li><strong>FAULTED</strong> - unusable</li>
 *   <li><strong>OFFLINE</strong> - node not reachable</li>
 *   <li><strong>PENDING</strong> - being created</li>
 * </ul>
 */
public enum PoolState {
    ONLINE,
    DEGRADED,
    FAULTED,
    OFFLINE,
    PENDING;

    /**
     * Decode the agent's state string, accepting both "online" and "POOL_ONLINE" forms.
     * Unrecognized values decode to OFFLINE.
     */
    @JsonCreator
    public static PoolState fromWire(String value) {
        if (value == null) {
            return OFFLINE;
        }
        String normalized = value.toUpperCase(Locale.ROOT);
        if (normalized.startsWith("POOL_")) {
            normalized = normalized.substring("POOL_".length());
        }
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            return OFFLINE;
        }
    }
}
