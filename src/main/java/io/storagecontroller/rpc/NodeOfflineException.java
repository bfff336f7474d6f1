package io.storagecontroller.rpc;

/**
 * Raised without contacting the agent when a constructive operation targets a
 * node whose state is not synchronized.
 */
public class NodeOfflineException extends RpcException {

    public NodeOfflineException(String nodeName, String operation) {
        super(RpcCode.NODE_OFFLINE, "Cannot " + operation + " because node \"" + nodeName + "\" is offline");
    }
}
