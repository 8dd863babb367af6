package com.crosschain.arb.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/**
 * Unit of work handed to the execution router. Immutable once built.
 */
@Value
@Builder(toBuilder = true)
public class TradeSignal {

    public static final int FLASH_SOURCE_BALANCER = 1;

    int chainId;
    String token; // Address of the borrowed token
    BigInteger amount; // Raw loan amount
    @Builder.Default
    int flashSource = FLASH_SOURCE_BALANCER;

    @Singular
    List<RouteHop> hops;
    @Singular("pathToken")
    List<String> path;
    @Singular
    List<String> extras; // Hex encoded per-hop data

    BigDecimal expectedProfitUsd;
    int estimatedSlippageBps;
    double confidence;
    BigDecimal gasCostUsd;
    BigDecimal notionalUsd;

    @Singular
    Map<String, Object> hints;

    public List<Integer> getProtocols() {
        return hops.stream().map(RouteHop::getProtocolId).toList();
    }

    public List<String> getRouters() {
        return hops.stream().map(RouteHop::getRouter).toList();
    }
}
