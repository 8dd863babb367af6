package com.crosschain.arb.core;

import com.crosschain.arb.config.LiquidityProperties;
import com.crosschain.arb.infra.LiquiditySource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

/**
 * Caps a loan at a share of the lender's verified balance. Returns 0 when the trade should not happen.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LiquidityGuard {

    private final LiquiditySource liquiditySource;
    private final ChainRegistry chainRegistry;
    private final LiquidityProperties properties;

    public BigInteger sizeSafeLoan(String tokenAddress, BigInteger targetRaw, int decimals, int chainId) {
        String chain = chainRegistry.getChainName(chainId);

        BigInteger liquidity;
        try {
            liquidity = liquiditySource.poolLiquidity(chainId, tokenAddress);
        } catch (RuntimeException e) {
            log.warn("[{}] Liquidity check failed for {}: {}", chain, tokenAddress, e.getMessage());
            return BigInteger.ZERO;
        }
        if (liquidity == null || liquidity.signum() <= 0) {
            log.info("[{}] No lender liquidity for {}", chain, tokenAddress);
            return BigInteger.ZERO;
        }

        BigInteger cap = new BigDecimal(liquidity)
                .multiply(properties.getMaxShareFraction())
                .setScale(0, RoundingMode.FLOOR)
                .toBigIntegerExact();

        BigInteger amount = targetRaw;
        if (amount.compareTo(cap) > 0) {
            log.info("[{}] Clamping loan for {} from {} to {} ({} of liquidity {})",
                    chain, tokenAddress, targetRaw, cap, properties.getMaxShareFraction(), liquidity);
            amount = cap;
        }

        BigInteger minFloor = BigInteger.valueOf(properties.getMinLoanTokens()).multiply(BigInteger.TEN.pow(decimals));
        if (amount.compareTo(minFloor) < 0) {
            log.info("[{}] Loan {} for {} below minimum {} (liquidity {})", chain, amount, tokenAddress, minFloor, liquidity);
            return BigInteger.ZERO;
        }

        log.debug("[{}] Safe loan for {}: {} (liquidity {})", chain, tokenAddress, amount, liquidity);
        return amount;
    }
}
