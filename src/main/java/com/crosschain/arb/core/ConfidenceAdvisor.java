package com.crosschain.arb.core;

import com.crosschain.arb.domain.BridgeOpportunity;

import java.util.Map;

/**
 * Advisory scoring of an opportunity. The confidence drives hybrid routing.
 */
public interface ConfidenceAdvisor {

    double confidence(BridgeOpportunity opportunity);

    /** Execution parameters attached to the signal as hints. */
    Map<String, Object> recommendParameters(int chainId);
}
