package io.storagecontroller.rpc;

import java.time.Duration;

/**
 * Opens connections to storage agents.
 */
@FunctionalInterface
public interface RpcClientFactory {

    RpcClient create(String endpoint, Duration defaultTimeout);
}
