package com.crosschain.arb.infra;

/**
 * The execution service could not be reached or answered with something unreadable.
 */
public class ExecutorTransportException extends RuntimeException {

    public ExecutorTransportException(String message) {
        super(message);
    }

    public ExecutorTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
