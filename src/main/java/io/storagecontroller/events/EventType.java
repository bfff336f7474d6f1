package io.storagecontroller.events;

/**
 * What happened to the object carried by a {@link StorageEvent}.
 */
public enum EventType {
    NEW,
    MOD,
    DEL,
    /**
     * A node that was out of sync has been synced again.
     */
    SYNC
}
