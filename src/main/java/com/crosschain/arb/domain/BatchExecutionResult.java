package com.crosschain.arb.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class BatchExecutionResult {
    int total;
    int succeeded;
    int failed;
    @Singular
    List<ExecutorResponse> results;
}
