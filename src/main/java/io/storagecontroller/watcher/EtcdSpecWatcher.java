package io.storagecontroller.watcher;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.etcd.jetcd.ByteSequence;
import io.etcd.jetcd.Client;
import io.etcd.jetcd.KV;
import io.etcd.jetcd.KeyValue;
import io.etcd.jetcd.Watch;
import io.etcd.jetcd.kv.GetResponse;
import io.etcd.jetcd.options.GetOption;
import io.etcd.jetcd.options.WatchOption;
import io.etcd.jetcd.watch.WatchEvent;
import io.etcd.jetcd.watch.WatchResponse;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.BiConsumer;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Watches JSON specifications stored in etcd under a key prefix.
 * <p>
 * The name of a specification is its key relative to the prefix. Existing keys
 * are replayed as {@code onNew} calls, then the prefix is watched from the
 * revision following the replay: a put of an unknown key is reported as new, of
 * a known key as modified, and a delete as removed. Values that cannot be
 * decoded are logged and skipped.
 * <p>
 * When the watch fails (lost connection, compacted revision) the prefix is
 * listed again after a delay and the listing is compared with the keys seen so
 * far, then watching resumes. The delay doubles while listing keeps failing.
 *
 * @param <T> specification type
 */
@Slf4j
public class EtcdSpecWatcher<T> implements SpecSource<T> {

    private static final long GET_TIMEOUT_SECONDS = 10;
    static final Duration RESTART_DELAY = Duration.ofSeconds(1);
    static final Duration MAX_RESTART_DELAY = Duration.ofSeconds(30);

    private final KV kvClient;
    private final Watch watchClient;
    @Getter
    private final String prefix;
    private final Class<T> type;
    private final BiConsumer<T, String> nameSetter;
    private final ObjectMapper objectMapper;
    private final ScheduledExecutorService scheduler;
    // name of every known specification and the revision it was last modified at
    private final Map<String, Long> known = new ConcurrentHashMap<>();
    private volatile Watch.Watcher watcher;
    private volatile boolean running;
    private ScheduledFuture<?> restartTask;

    /**
     * @param etcdClient   etcd client
     * @param prefix       key prefix, a trailing slash is added if missing
     * @param type         type the values decode to
     * @param nameSetter   stores the name derived from the key into a decoded value
     * @param objectMapper JSON mapper for values
     * @param scheduler    runs restarts of a failed watch
     */
    public EtcdSpecWatcher(Client etcdClient, String prefix, Class<T> type,
                           BiConsumer<T, String> nameSetter, ObjectMapper objectMapper,
                           ScheduledExecutorService scheduler) {
        this.kvClient = etcdClient.getKVClient();
        this.watchClient = etcdClient.getWatchClient();
        this.prefix = prefix.endsWith("/") ? prefix : prefix + "/";
        this.type = type;
        this.nameSetter = nameSetter;
        this.objectMapper = objectMapper;
        this.scheduler = scheduler;
    }

    @Override
    public synchronized void start(SpecListener<T> listener) {
        GetResponse response = list();
        log.info("Replaying {} specifications under {}", response.getKvs().size(), prefix);
        running = true;
        resync(response, listener);
        watch(response.getHeader().getRevision() + 1, listener);
    }

    @Override
    public synchronized void stop() {
        running = false;
        if (restartTask != null) {
            restartTask.cancel(false);
            restartTask = null;
        }
        if (closeWatcher()) {
            log.info("Stopped watching {}", prefix);
        }
        known.clear();
    }

    /**
     * List the prefix again, report what changed while the watch was down and
     * watch from the revision of the listing.
     */
    synchronized void restart(SpecListener<T> listener, Duration delay) {
        restartTask = null;
        if (!running) {
            return;
        }
        GetResponse response;
        try {
            response = list();
        } catch (IllegalStateException e) {
            Duration next = delay.multipliedBy(2).compareTo(MAX_RESTART_DELAY) > 0
                    ? MAX_RESTART_DELAY
                    : delay.multipliedBy(2);
            log.warn("{}, retrying in {}", e.getMessage(), next);
            scheduleRestart(listener, next);
            return;
        }
        resync(response, listener);
        watch(response.getHeader().getRevision() + 1, listener);
    }

    void handle(WatchResponse response, SpecListener<T> listener) {
        for (WatchEvent event : response.getEvents()) {
            KeyValue kv = event.getKeyValue();
            String name = nameOf(kv.getKey());
            if (name.isEmpty()) {
                continue;
            }
            switch (event.getEventType()) {
                case PUT:
                    decode(name, kv.getValue()).ifPresent(spec -> {
                        if (known.put(name, kv.getModRevision()) == null) {
                            deliver(() -> listener.onNew(spec), name);
                        } else {
                            deliver(() -> listener.onMod(spec), name);
                        }
                    });
                    break;
                case DELETE:
                    known.remove(name);
                    deliver(() -> listener.onDel(name), name);
                    break;
                default:
                    log.debug("Ignoring {} event for {}", event.getEventType(), name);
            }
        }
    }

    private GetResponse list() {
        ByteSequence prefixKey = ByteSequence.from(prefix, UTF_8);
        try {
            return kvClient.get(prefixKey, GetOption.newBuilder().withPrefix(prefixKey).build())
                    .get(GET_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while listing " + prefix, e);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to list specifications under " + prefix, e);
        }
    }

    private void resync(GetResponse response, SpecListener<T> listener) {
        Set<String> present = new HashSet<>();
        for (KeyValue kv : response.getKvs()) {
            String name = nameOf(kv.getKey());
            if (name.isEmpty()) {
                continue;
            }
            // an undecodable value still counts as present
            present.add(name);
            long revision = kv.getModRevision();
            Long previous = known.get(name);
            if (previous != null && previous == revision) {
                continue;
            }
            decode(name, kv.getValue()).ifPresent(spec -> {
                known.put(name, revision);
                if (previous == null) {
                    deliver(() -> listener.onNew(spec), name);
                } else {
                    deliver(() -> listener.onMod(spec), name);
                }
            });
        }
        List<String> removed = new ArrayList<>(known.keySet());
        removed.removeAll(present);
        for (String name : removed) {
            known.remove(name);
            deliver(() -> listener.onDel(name), name);
        }
    }

    private void watch(long revision, SpecListener<T> listener) {
        ByteSequence prefixKey = ByteSequence.from(prefix, UTF_8);
        watcher = watchClient.watch(
                prefixKey,
                WatchOption.newBuilder()
                        .withPrefix(prefixKey)
                        .withRevision(revision)
                        .build(),
                Watch.listener(
                        watchResponse -> handle(watchResponse, listener),
                        error -> onWatchError(error, listener)));
        log.info("Watching specifications under {} from revision {}", prefix, revision);
    }

    private synchronized void onWatchError(Throwable error, SpecListener<T> listener) {
        log.error("Watch of {} failed: {}", prefix, error.getMessage(), error);
        if (!running || restartTask != null) {
            return;
        }
        closeWatcher();
        scheduleRestart(listener, RESTART_DELAY);
    }

    private void scheduleRestart(SpecListener<T> listener, Duration delay) {
        restartTask = scheduler.schedule(() -> restart(listener, delay), delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private boolean closeWatcher() {
        Watch.Watcher current = watcher;
        watcher = null;
        if (current == null) {
            return false;
        }
        current.close();
        return true;
    }

    private Optional<T> decode(String name, ByteSequence value) {
        try {
            T spec = objectMapper.readValue(value.getBytes(), type);
            nameSetter.accept(spec, name);
            return Optional.of(spec);
        } catch (Exception e) {
            log.warn("Ignoring undecodable specification \"{}\" under {}: {}", name, prefix, e.getMessage());
            return Optional.empty();
        }
    }

    private void deliver(Runnable delivery, String name) {
        try {
            delivery.run();
        } catch (RuntimeException e) {
            log.error("Failed to process specification \"{}\" under {}: {}", name, prefix, e.getMessage(), e);
        }
    }

    private String nameOf(ByteSequence key) {
        String path = key.toString(UTF_8);
        return path.startsWith(prefix) ? path.substring(prefix.length()) : path;
    }
}
