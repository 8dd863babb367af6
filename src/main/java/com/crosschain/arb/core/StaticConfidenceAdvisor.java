package com.crosschain.arb.core;

import com.crosschain.arb.domain.BridgeOpportunity;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class StaticConfidenceAdvisor implements ConfidenceAdvisor {

    static final double DEFAULT_CONFIDENCE = 0.90;

    @Override
    public double confidence(BridgeOpportunity opportunity) {
        return DEFAULT_CONFIDENCE;
    }

    @Override
    public Map<String, Object> recommendParameters(int chainId) {
        return Map.of("urgency", "MEDIUM");
    }
}
