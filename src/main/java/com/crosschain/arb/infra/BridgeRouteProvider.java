package com.crosschain.arb.infra;

import com.crosschain.arb.domain.BridgeQuote;

import java.math.BigInteger;

/**
 * Cross-chain route quotes from an external aggregator.
 */
public interface BridgeRouteProvider {

    /**
     * @return the best route, or null when no route exists or the aggregator is unreachable
     */
    BridgeQuote getRoute(int srcChain, int dstChain, String tokenAddress, String dstTokenAddress,
                         BigInteger amountRaw, String userAddress);
}
