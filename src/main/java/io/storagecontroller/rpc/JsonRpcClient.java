package io.storagecontroller.rpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * JSON-RPC 2.0 over HTTP connection to a storage agent.
 * <p>
 * Transport failures are mapped onto {@link RpcCode}: refused or reset
 * connections become UNAVAILABLE, elapsed deadlines DEADLINE_EXCEEDED and calls
 * interrupted by {@link #close()} CANCELLED. Agent errors carry a negated errno
 * which is translated by {@link #codeFromError(int)}.
 */
@Slf4j
public class JsonRpcClient implements RpcClient {

    private static final String JSON_RPC_VERSION = "2.0";
    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

    // errno values reported by the agent
    private static final int ENOENT = 2;
    private static final int ENOMEM = 12;
    private static final int EEXIST = 17;
    private static final int EINVAL = 22;
    private static final int ENOSPC = 28;
    private static final int ETIMEDOUT = 110;
    private static final int INVALID_PARAMS = -32602;

    @Getter
    private final String endpoint;
    private final URI uri;
    private final Duration defaultTimeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final AtomicLong nextId = new AtomicLong(1);
    private final Set<CompletableFuture<JsonNode>> inFlight = ConcurrentHashMap.newKeySet();
    private volatile boolean closed = false;

    public JsonRpcClient(String endpoint, Duration defaultTimeout, ObjectMapper objectMapper) {
        this(endpoint, defaultTimeout, objectMapper, HttpClient.newBuilder()
                .connectTimeout(CONNECT_TIMEOUT)
                .followRedirects(HttpClient.Redirect.NEVER)
                .build());
    }

    JsonRpcClient(String endpoint, Duration defaultTimeout, ObjectMapper objectMapper, HttpClient httpClient) {
        this.endpoint = endpoint;
        this.uri = toUri(endpoint);
        this.defaultTimeout = defaultTimeout;
        this.objectMapper = objectMapper;
        this.httpClient = httpClient;
    }

    /**
     * Factory producing JSON-RPC clients that share one object mapper.
     */
    public static RpcClientFactory factory(ObjectMapper objectMapper) {
        return (endpoint, timeout) -> new JsonRpcClient(endpoint, timeout, objectMapper);
    }

    @Override
    public CompletableFuture<JsonNode> call(String method, Map<String, Object> args) {
        return call(method, args, defaultTimeout);
    }

    @Override
    public CompletableFuture<JsonNode> call(String method, Map<String, Object> args, Duration timeout) {
        if (closed) {
            return CompletableFuture.failedFuture(
                    new RpcException(RpcCode.CANCELLED, "Connection to " + endpoint + " is closed"));
        }
        long id = nextId.getAndIncrement();
        String body;
        try {
            ObjectNode request = objectMapper.createObjectNode();
            request.put("jsonrpc", JSON_RPC_VERSION);
            request.put("id", id);
            request.put("method", method);
            request.set("params", objectMapper.valueToTree(args == null ? Map.of() : args));
            body = objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            return CompletableFuture.failedFuture(
                    new RpcException(RpcCode.INVALID_ARGUMENT, "Cannot encode arguments of " + method, e));
        }

        HttpRequest httpRequest = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout != null ? timeout : defaultTimeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        log.debug("Calling {} on {} (id={})", method, endpoint, id);
        CompletableFuture<JsonNode> result = new CompletableFuture<>();
        inFlight.add(result);
        httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString())
                .whenComplete((response, error) -> {
                    try {
                        if (error != null) {
                            result.completeExceptionally(translateTransportError(method, error));
                        } else {
                            result.complete(parseResponse(method, response));
                        }
                    } catch (RpcException e) {
                        result.completeExceptionally(e);
                    } finally {
                        inFlight.remove(result);
                    }
                });
        return result;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        log.debug("Closing connection to {} with {} calls in flight", endpoint, inFlight.size());
        for (CompletableFuture<JsonNode> call : inFlight) {
            call.completeExceptionally(new RpcException(RpcCode.CANCELLED,
                    "Connection to " + endpoint + " was closed"));
        }
        inFlight.clear();
    }

    public boolean isClosed() {
        return closed;
    }

    private JsonNode parseResponse(String method, HttpResponse<String> response) {
        if (response.statusCode() != 200) {
            throw new RpcException(response.statusCode() == 503 ? RpcCode.UNAVAILABLE : RpcCode.INTERNAL,
                    method + " on " + endpoint + " failed with HTTP status " + response.statusCode());
        }
        JsonNode reply;
        try {
            reply = objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new RpcException(RpcCode.INTERNAL, "Malformed reply to " + method + " from " + endpoint, e);
        }
        JsonNode error = reply.get("error");
        if (error != null && !error.isNull()) {
            int code = error.path("code").asInt();
            String message = error.path("message").asText("unknown error");
            throw new RpcException(codeFromError(code), method + ": " + message);
        }
        JsonNode result = reply.get("result");
        return result != null ? result : NullNode.getInstance();
    }

    private RpcException translateTransportError(String method, Throwable error) {
        Throwable cause = RpcException.unwrap(error);
        if (closed) {
            return new RpcException(RpcCode.CANCELLED, method + " cancelled, connection to " + endpoint + " closed");
        }
        if (cause instanceof HttpTimeoutException) {
            return new RpcException(RpcCode.DEADLINE_EXCEEDED, method + " on " + endpoint + " timed out", cause);
        }
        if (cause instanceof ConnectException) {
            return new RpcException(RpcCode.UNAVAILABLE, "Cannot connect to " + endpoint, cause);
        }
        return new RpcException(RpcCode.UNAVAILABLE, method + " on " + endpoint + " failed: " + cause.getMessage(), cause);
    }

    /**
     * Map an agent error code (negated errno or JSON-RPC reserved code) to an RPC code.
     */
    static RpcCode codeFromError(int code) {
        if (code == INVALID_PARAMS) {
            return RpcCode.INVALID_ARGUMENT;
        }
        switch (-code) {
            case ENOENT:
                return RpcCode.NOT_FOUND;
            case EEXIST:
                return RpcCode.ALREADY_EXISTS;
            case EINVAL:
                return RpcCode.INVALID_ARGUMENT;
            case ENOMEM:
            case ENOSPC:
                return RpcCode.RESOURCE_EXHAUSTED;
            case ETIMEDOUT:
                return RpcCode.DEADLINE_EXCEEDED;
            default:
                return RpcCode.INTERNAL;
        }
    }

    private static URI toUri(String endpoint) {
        if (endpoint.contains("://")) {
            return URI.create(endpoint);
        }
        return URI.create("http://" + endpoint + "/");
    }
}
