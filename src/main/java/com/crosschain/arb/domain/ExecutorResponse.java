package com.crosschain.arb.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Reply of the execution service to POST /execute.
 */
@Value
@Builder
public class ExecutorResponse {
    boolean success;
    String mode;
    String txHash;
    String error;

    public static ExecutorResponse failure(String error) {
        return ExecutorResponse.builder().success(false).error(error).build();
    }
}
