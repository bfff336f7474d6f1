package io.storagecontroller.workq;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class WorkQueueTest {

    private final ScheduledExecutorService scheduler = Executors.newScheduledThreadPool(2);

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    private CompletableFuture<String> delayed(String value, long millis, List<String> log) {
        log.add("start " + value);
        CompletableFuture<String> result = new CompletableFuture<>();
        scheduler.schedule(() -> {
            log.add("end " + value);
            result.complete(value);
        }, millis, TimeUnit.MILLISECONDS);
        return result;
    }

    @Test
    void testPush_RunsOperationsInOrderEvenIfLaterOneIsFaster() throws Exception {
        // Given
        WorkQueue queue = new WorkQueue("test");
        List<String> log = new CopyOnWriteArrayList<>();

        // When
        CompletableFuture<String> a = queue.push("A", v -> delayed(v, 100, log));
        CompletableFuture<String> b = queue.push("B", v -> delayed(v, 1, log));

        // Then
        assertThat(b.get(5, TimeUnit.SECONDS)).isEqualTo("B");
        assertThat(a.get(5, TimeUnit.SECONDS)).isEqualTo("A");
        assertThat(log).containsExactly("start A", "end A", "start B", "end B");
    }

    @Test
    void testPush_FailedOperationDoesNotBlockNextOne() throws Exception {
        // Given
        WorkQueue queue = new WorkQueue("test");

        // When
        CompletableFuture<String> failed = queue.push("A",
                v -> CompletableFuture.failedFuture(new IllegalStateException("boom")));
        CompletableFuture<String> next = queue.push("B", CompletableFuture::completedFuture);

        // Then
        assertThatThrownBy(() -> failed.get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
        assertThat(next.get(5, TimeUnit.SECONDS)).isEqualTo("B");
    }

    @Test
    void testPush_SynchronousThrowBecomesFailedFuture() throws Exception {
        // Given
        WorkQueue queue = new WorkQueue("test");

        // When
        CompletableFuture<String> failed = queue.push("A", v -> {
            throw new IllegalArgumentException("bad " + v);
        });
        CompletableFuture<String> next = queue.push("B", CompletableFuture::completedFuture);

        // Then
        assertThat(failed).isCompletedExceptionally();
        assertThat(next.get(5, TimeUnit.SECONDS)).isEqualTo("B");
    }

    @Test
    void testSize_CountsQueuedAndInFlightOperations() throws Exception {
        // Given
        WorkQueue queue = new WorkQueue("test");
        CompletableFuture<String> gate = new CompletableFuture<>();

        // When
        queue.push("A", v -> gate);
        CompletableFuture<String> b = queue.push("B", CompletableFuture::completedFuture);

        // Then
        assertThat(queue.size()).isEqualTo(2);
        gate.complete("A");
        assertThat(b.get(5, TimeUnit.SECONDS)).isEqualTo("B");
        assertThat(queue.size()).isZero();
    }

    @Test
    void testPush_OperationDoesNotStartBeforePreviousSettles() {
        // Given
        WorkQueue queue = new WorkQueue("test");
        CompletableFuture<String> gate = new CompletableFuture<>();
        List<String> started = new CopyOnWriteArrayList<>();

        // When
        queue.push("A", v -> {
            started.add(v);
            return gate;
        });
        queue.push("B", v -> {
            started.add(v);
            return CompletableFuture.completedFuture(v);
        });

        // Then
        assertThat(started).containsExactly("A");
        gate.completeExceptionally(new RuntimeException("A failed"));
        assertThat(started).containsExactly("A", "B");
    }
}
