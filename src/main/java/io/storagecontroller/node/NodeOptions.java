package io.storagecontroller.node;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * Tunables of a storage node.
 */
@Getter
@Builder
@ToString
public class NodeOptions {

    /** How often a healthy node is synced. */
    @Builder.Default
    private final Duration syncPeriod = Duration.ofSeconds(60);

    /** How soon a failed sync is retried. */
    @Builder.Default
    private final Duration syncRetry = Duration.ofSeconds(10);

    /** Consecutive failed syncs after which the node is considered offline. */
    @Builder.Default
    private final int syncBadLimit = 3;

    /** Default timeout of calls to the storage agent. */
    @Builder.Default
    private final Duration rpcTimeout = Duration.ofSeconds(15);

    public static NodeOptions defaults() {
        return NodeOptions.builder().build();
    }

    /**
     * Bad limit clamped to at least one failure.
     */
    public int getSyncBadLimit() {
        return Math.max(1, syncBadLimit);
    }
}
