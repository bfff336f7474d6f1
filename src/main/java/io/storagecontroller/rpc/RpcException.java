package io.storagecontroller.rpc;

import lombok.Getter;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Failure of a call to a storage agent (or a locally synthesized one).
 */
@Getter
public class RpcException extends RuntimeException {

    private final RpcCode code;

    public RpcException(RpcCode code, String message) {
        super(message);
        this.code = code;
    }

    public RpcException(RpcCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    /**
     * Strip future wrappers from an error so callers see the real cause.
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Check whether a (possibly wrapped) error is an RPC failure with the given code.
     */
    public static boolean hasCode(Throwable error, RpcCode code) {
        Throwable cause = unwrap(error);
        return cause instanceof RpcException && ((RpcException) cause).getCode() == code;
    }

    /**
     * Convert any (possibly wrapped) error to an RpcException, keeping RPC codes intact.
     */
    public static RpcException from(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof RpcException) {
            return (RpcException) cause;
        }
        return new RpcException(RpcCode.INTERNAL, String.valueOf(cause.getMessage()), cause);
    }

    @Override
    public String toString() {
        return code + ": " + getMessage();
    }
}
