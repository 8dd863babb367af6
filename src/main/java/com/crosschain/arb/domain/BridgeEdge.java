package com.crosschain.arb.domain;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * Directed bridge connection between the same asset on two chains.
 * The weight is reserved for cost-aware routing and stays at zero for now.
 */
@Getter
@ToString
public class BridgeEdge {
    private final TokenNode source;
    private final TokenNode target;

    @Setter
    private volatile double weight;

    public BridgeEdge(TokenNode source, TokenNode target) {
        if (source.getChainId() == target.getChainId()) {
            throw new IllegalArgumentException("Bridge edge must connect two different chains");
        }
        if (!source.getSymbol().equals(target.getSymbol())) {
            throw new IllegalArgumentException("Bridge edge must connect the same symbol");
        }
        this.source = source;
        this.target = target;
        this.weight = 0.0;
    }
}
