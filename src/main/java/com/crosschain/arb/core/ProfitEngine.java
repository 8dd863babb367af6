package com.crosschain.arb.core;

import com.crosschain.arb.domain.ProfitBreakdown;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Net profit of a flash-loan round trip, in USD.
 */
@Component
public class ProfitEngine {

    public ProfitBreakdown computeNetProfit(BigDecimal loanUsd, BigDecimal grossOutputUsd,
                                            BigDecimal bridgeFeeUsd, BigDecimal gasFeeUsd,
                                            BigDecimal flashFeeRate) {
        require(loanUsd, "loanUsd");
        require(grossOutputUsd, "grossOutputUsd");
        require(bridgeFeeUsd, "bridgeFeeUsd");
        require(gasFeeUsd, "gasFeeUsd");
        require(flashFeeRate, "flashFeeRate");

        BigDecimal flashFeeCost = loanUsd.multiply(flashFeeRate);
        BigDecimal totalFees = bridgeFeeUsd.add(gasFeeUsd).add(flashFeeCost);
        BigDecimal grossSpread = grossOutputUsd.subtract(loanUsd);
        BigDecimal netProfit = grossSpread.subtract(totalFees);

        return new ProfitBreakdown(netProfit, grossSpread, totalFees, netProfit.signum() > 0);
    }

    private static void require(BigDecimal value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " must not be null");
        }
    }
}
