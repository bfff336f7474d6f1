package io.storagecontroller.workq;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * FIFO serializer for asynchronous operations.
 * <p>
 * Operations pushed to the same queue run strictly one after another in push
 * order. An operation starts only when the previous one has settled, whether it
 * succeeded or failed, so a failure never blocks the operations queued behind it.
 * Each owner (a storage node, a volume) has its own queue; unrelated owners
 * proceed in parallel.
 */
@Slf4j
public class WorkQueue {

    @Getter
    private final String name;
    private final AtomicInteger pending = new AtomicInteger();

    // settles (never exceptionally) when the last pushed operation settles
    private CompletableFuture<Void> tail = CompletableFuture.completedFuture(null);

    public WorkQueue(String name) {
        this.name = name;
    }

    /**
     * Queue an operation.
     *
     * @param arg       argument handed to the operation when it starts
     * @param operation asynchronous operation to run
     * @return future completing with the operation's own outcome
     */
    public synchronized <A, R> CompletableFuture<R> push(A arg, Function<A, CompletableFuture<R>> operation) {
        int depth = pending.incrementAndGet();
        if (depth > 1) {
            log.debug("Work queue '{}' has {} operations pending", name, depth);
        }
        CompletableFuture<R> result = tail.thenCompose(ignored -> start(arg, operation));
        tail = result.handle((value, error) -> {
            pending.decrementAndGet();
            return null;
        });
        return result;
    }

    /**
     * Number of queued and in-flight operations.
     */
    public int size() {
        return pending.get();
    }

    private static <A, R> CompletableFuture<R> start(A arg, Function<A, CompletableFuture<R>> operation) {
        try {
            CompletableFuture<R> future = operation.apply(arg);
            return future != null ? future : CompletableFuture.completedFuture(null);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
