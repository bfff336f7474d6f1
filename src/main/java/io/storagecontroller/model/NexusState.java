package io.storagecontroller.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * State of a nexus.
 */
public enum NexusState {
    UNKNOWN,
    ONLINE,
    DEGRADED,
    FAULTED,
    OFFLINE;

    @JsonCreator
    public static NexusState fromWire(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        String normalized = value.toUpperCase(Locale.ROOT);
        if (normalized.startsWith("NEXUS_")) {
            normalized = normalized.substring("NEXUS_".length());
        }
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
