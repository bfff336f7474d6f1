package io.storagecontroller.testing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.storagecontroller.rpc.RpcClient;
import io.storagecontroller.rpc.RpcCode;
import io.storagecontroller.rpc.RpcException;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * In-memory storage agent connection. Replies are produced by per-method
 * handlers and completed immediately; every call is recorded.
 * <p>
 * Without a handler, list methods reply with empty lists and any other method
 * with an empty object.
 */
public class FakeRpcClient implements RpcClient {

    public static final ObjectMapper MAPPER = new ObjectMapper();

    // orders calls across all fake agents of a test
    private static final AtomicLong SEQUENCE = new AtomicLong();

    private final Map<String, Function<Map<String, Object>, CompletableFuture<JsonNode>>> handlers =
            new ConcurrentHashMap<>();
    private final List<Call> calls = new CopyOnWriteArrayList<>();
    @Getter
    private volatile boolean closed;

    @Getter
    @AllArgsConstructor
    public static class Call {
        private final String method;
        private final Map<String, Object> args;
        private final Duration timeout;
        private final long seq = SEQUENCE.incrementAndGet();
    }

    /**
     * Reply to a method with a value computed from the call arguments.
     */
    public FakeRpcClient on(String method, Function<Map<String, Object>, Object> reply) {
        handlers.put(method, args -> CompletableFuture.completedFuture(MAPPER.valueToTree(reply.apply(args))));
        return this;
    }

    public FakeRpcClient reply(String method, Object reply) {
        return on(method, args -> reply);
    }

    public FakeRpcClient fail(String method, RpcCode code) {
        handlers.put(method, args -> CompletableFuture.failedFuture(new RpcException(code, method + " failed")));
        return this;
    }

    /**
     * Leave calls of the method pending forever.
     */
    public FakeRpcClient hang(String method) {
        handlers.put(method, args -> new CompletableFuture<>());
        return this;
    }

    /**
     * Make calls of the method wait for a reply which the test completes
     * later. All calls share the returned future.
     */
    public CompletableFuture<JsonNode> defer(String method) {
        CompletableFuture<JsonNode> reply = new CompletableFuture<>();
        handlers.put(method, args -> reply);
        return reply;
    }

    public FakeRpcClient listPools(Object... pools) {
        return reply("listPools", Map.of("pools", List.of(pools)));
    }

    public FakeRpcClient listReplicas(Object... replicas) {
        return reply("listReplicas", Map.of("replicas", List.of(replicas)));
    }

    public FakeRpcClient listNexus(Object... nexus) {
        return reply("listNexus", Map.of("nexusList", List.of(nexus)));
    }

    @Override
    public CompletableFuture<JsonNode> call(String method, Map<String, Object> args) {
        return call(method, args, null);
    }

    @Override
    public CompletableFuture<JsonNode> call(String method, Map<String, Object> args, Duration timeout) {
        calls.add(new Call(method, args, timeout));
        if (closed) {
            return CompletableFuture.failedFuture(new RpcException(RpcCode.CANCELLED, "closed"));
        }
        Function<Map<String, Object>, CompletableFuture<JsonNode>> handler = handlers.get(method);
        if (handler != null) {
            return handler.apply(args);
        }
        switch (method) {
            case "listPools":
                return CompletableFuture.completedFuture(MAPPER.valueToTree(Map.of("pools", List.of())));
            case "listReplicas":
                return CompletableFuture.completedFuture(MAPPER.valueToTree(Map.of("replicas", List.of())));
            case "listNexus":
                return CompletableFuture.completedFuture(MAPPER.valueToTree(Map.of("nexusList", List.of())));
            default:
                return CompletableFuture.completedFuture(MAPPER.createObjectNode());
        }
    }

    @Override
    public void close() {
        closed = true;
    }

    public List<Call> getCalls() {
        return List.copyOf(calls);
    }

    public List<Call> calls(String method) {
        return calls.stream().filter(c -> c.getMethod().equals(method)).collect(Collectors.toList());
    }

    public int count(String method) {
        return calls(method).size();
    }

    public void clearCalls() {
        calls.clear();
    }
}
