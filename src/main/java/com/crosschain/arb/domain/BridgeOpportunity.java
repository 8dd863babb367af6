package com.crosschain.arb.domain;

import lombok.Builder;
import lombok.Value;

/**
 * One cross-chain candidate enumerated from the graph; evaluated once per scan cycle.
 */
@Value
@Builder
public class BridgeOpportunity {
    int srcChain;
    int dstChain;
    String token;
    String tokenAddrSrc;
    String tokenAddrDst;
    int decimals;
    boolean stablecoin;

    public static BridgeOpportunity of(BridgeEdge edge) {
        TokenNode src = edge.getSource();
        TokenNode dst = edge.getTarget();
        return BridgeOpportunity.builder()
                .srcChain(src.getChainId())
                .dstChain(dst.getChainId())
                .token(src.getSymbol())
                .tokenAddrSrc(src.getAddress())
                .tokenAddrDst(dst.getAddress())
                .decimals(src.getDecimals())
                .stablecoin(src.isStablecoin())
                .build();
    }
}
