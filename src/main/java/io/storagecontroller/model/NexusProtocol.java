package io.storagecontroller.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Protocol a nexus is published with to the consumer.
 */
public enum NexusProtocol {
    ISCSI,
    NVMF;

    @JsonCreator
    public static NexusProtocol fromWire(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.toUpperCase(Locale.ROOT);
        if (normalized.startsWith("NEXUS_")) {
            normalized = normalized.substring("NEXUS_".length());
        }
        return valueOf(normalized);
    }

    /**
     * Scheme of device URIs published with this protocol.
     */
    public String scheme() {
        return name().toLowerCase(Locale.ROOT);
    }
}
