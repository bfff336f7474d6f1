package io.storagecontroller.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * How a replica is exported to a nexus. NONE means the nexus opens it locally.
 */
public enum ShareProtocol {
    NONE,
    ISCSI,
    NVMF;

    @JsonCreator
    public static ShareProtocol fromWire(String value) {
        if (value == null || value.isEmpty()) {
            return NONE;
        }
        String normalized = value.toUpperCase(Locale.ROOT);
        if (normalized.startsWith("REPLICA_")) {
            normalized = normalized.substring("REPLICA_".length());
        }
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            return NONE;
        }
    }
}
