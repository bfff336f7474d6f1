package io.storagecontroller.events;

/**
 * Type of object carried by a {@link StorageEvent}.
 */
public enum EventKind {
    NODE,
    POOL,
    REPLICA,
    NEXUS,
    VOLUME
}
