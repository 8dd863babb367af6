package com.crosschain.arb.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TokenNode {
    int chainId;
    String symbol;
    String address;
    int decimals;
    boolean nativeAsset;
    boolean wrappedNative;
    boolean stablecoin;
}
