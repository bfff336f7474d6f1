package io.storagecontroller.events;

/**
 * Receiver of storage events. Invoked synchronously on the emitting thread,
 * so implementations must not block.
 */
@FunctionalInterface
public interface EventListener {

    void onEvent(StorageEvent event);
}
