package io.storagecontroller.rpc;

/**
 * Closed set of error codes produced by the RPC boundary.
 * NODE_OFFLINE is never sent by a storage agent; it is raised locally when an
 * operation is attempted on a node that is out of sync.
 */
public enum RpcCode {
    NOT_FOUND,
    ALREADY_EXISTS,
    INVALID_ARGUMENT,
    RESOURCE_EXHAUSTED,
    INTERNAL,
    UNAVAILABLE,
    CANCELLED,
    DEADLINE_EXCEEDED,
    NODE_OFFLINE
}
