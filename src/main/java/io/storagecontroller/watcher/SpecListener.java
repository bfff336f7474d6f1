package io.storagecontroller.watcher;

/**
 * Receives changes of watched specifications.
 *
 * @param <T> specification type
 */
public interface SpecListener<T> {

    void onNew(T spec);

    void onMod(T spec);

    /**
     * @param name name (key suffix) of the removed specification
     */
    void onDel(String name);
}
