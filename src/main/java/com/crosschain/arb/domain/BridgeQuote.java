package com.crosschain.arb.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.math.BigInteger;

@Value
@Builder
public class BridgeQuote {
    String bridgeName;
    BigInteger estimatedOutput;
    BigDecimal feeUsd;
    String txData;
}
