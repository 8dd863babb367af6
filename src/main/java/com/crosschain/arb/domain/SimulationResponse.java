package com.crosschain.arb.domain;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SimulationResponse {
    boolean success;
    JsonNode simulation; // Executor specific payload, passed through untouched
    String error;
}
