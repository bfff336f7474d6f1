package io.storagecontroller.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * State of one nexus child. DEGRADED children are being rebuilt.
 */
public enum ChildState {
    ONLINE,
    DEGRADED,
    FAULTED;

    @JsonCreator
    public static ChildState fromWire(String value) {
        if (value == null) {
            return FAULTED;
        }
        String normalized = value.toUpperCase(Locale.ROOT);
        if (normalized.startsWith("CHILD_")) {
            normalized = normalized.substring("CHILD_".length());
        }
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            return FAULTED;
        }
    }
}
