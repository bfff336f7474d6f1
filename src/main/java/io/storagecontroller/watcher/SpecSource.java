package io.storagecontroller.watcher;

/**
 * Source of desired-state specifications.
 * <p>
 * {@link #start(SpecListener)} replays all existing specifications as
 * {@code onNew} calls before delivering subsequent changes.
 *
 * @param <T> specification type
 */
public interface SpecSource<T> {

    void start(SpecListener<T> listener);

    void stop();
}
