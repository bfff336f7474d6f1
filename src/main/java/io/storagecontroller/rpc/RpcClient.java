package io.storagecontroller.rpc;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Call primitive of a storage agent connection.
 * <p>
 * Returned futures complete exceptionally with {@link RpcException}. Once the
 * client is closed, in-flight and later calls fail with {@link RpcCode#CANCELLED}.
 */
public interface RpcClient extends AutoCloseable {

    /**
     * Call a method using the client's default timeout.
     */
    CompletableFuture<JsonNode> call(String method, Map<String, Object> args);

    /**
     * Call a method with a per-call timeout overriding the default one.
     */
    CompletableFuture<JsonNode> call(String method, Map<String, Object> args, Duration timeout);

    @Override
    void close();
}
