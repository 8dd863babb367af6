package com.crosschain.arb.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

@ConfigurationProperties(prefix = "crosschain.liquidity")
@NoArgsConstructor
@Getter
@Setter
public class LiquidityProperties {

    /** Largest share of the lender's balance a single loan may take. */
    private BigDecimal maxShareFraction = new BigDecimal("0.20");

    /** Loans below this many whole tokens are not worth the fixed costs. */
    private long minLoanTokens = 500;
}
