package com.crosschain.arb.domain;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class ProfitBreakdown {
    BigDecimal netProfit;
    BigDecimal grossSpread;
    BigDecimal totalFees;
    boolean profitable;
}
