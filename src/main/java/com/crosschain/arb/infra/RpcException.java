package com.crosschain.arb.infra;

/**
 * Thrown when a JSON-RPC call fails at transport level, returns an error object, or reverts.
 */
public class RpcException extends RuntimeException {

    public RpcException(String message) {
        super(message);
    }

    public RpcException(String message, Throwable cause) {
        super(message, cause);
    }
}
