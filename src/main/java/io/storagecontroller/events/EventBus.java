package io.storagecontroller.events;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Publish/subscribe channel owned by one aggregate (a node, the registry or the
 * volume manager). Listeners are called in subscription order; a failing
 * listener is logged and does not prevent delivery to the others.
 */
@Slf4j
public class EventBus {

    private final String owner;
    private final List<EventListener> listeners = new CopyOnWriteArrayList<>();

    public EventBus(String owner) {
        this.owner = owner;
    }

    public void subscribe(EventListener listener) {
        listeners.add(listener);
    }

    public void unsubscribe(EventListener listener) {
        listeners.remove(listener);
    }

    public void emit(EventKind kind, EventType type, Object object) {
        emit(new StorageEvent(kind, type, object));
    }

    public void emit(StorageEvent event) {
        log.trace("[{}] emitting {}", owner, event);
        for (EventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.error("[{}] listener failed to handle {}: {}", owner, event, e.getMessage(), e);
            }
        }
    }

    public int listenerCount() {
        return listeners.size();
    }
}
