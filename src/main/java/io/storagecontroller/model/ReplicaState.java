package io.storagecontroller.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * State of a replica. A listing without state means ONLINE.
 */
public enum ReplicaState {
    ONLINE,
    DEGRADED,
    OFFLINE;

    @JsonCreator
    public static ReplicaState fromWire(String value) {
        if (value == null || value.isEmpty()) {
            return ONLINE;
        }
        String normalized = value.toUpperCase(Locale.ROOT);
        if (normalized.startsWith("REPLICA_")) {
            normalized = normalized.substring("REPLICA_".length());
        }
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            return OFFLINE;
        }
    }
}
