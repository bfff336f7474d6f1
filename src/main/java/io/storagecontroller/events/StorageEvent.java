package io.storagecontroller.events;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Change notification for a node, pool, replica, nexus or volume.
 */
@Getter
@AllArgsConstructor
public class StorageEvent {
    private final EventKind kind;
    private final EventType type;
    private final Object object;

    /**
     * Typed access to the carried object.
     */
    public <T> T getObject(Class<T> type) {
        return type.cast(object);
    }

    @Override
    public String toString() {
        return kind + " " + type + " " + object;
    }
}
