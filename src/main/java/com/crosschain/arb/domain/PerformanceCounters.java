package com.crosschain.arb.domain;

import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Running totals for one executor instance. Safe to read from reporting threads.
 */
public class PerformanceCounters {

    private final AtomicLong trades = new AtomicLong();
    private final AtomicLong successes = new AtomicLong();
    private final AtomicReference<BigDecimal> profit = new AtomicReference<>(BigDecimal.ZERO);
    private final AtomicReference<BigDecimal> volume = new AtomicReference<>(BigDecimal.ZERO);

    public long recordTrade(BigDecimal notionalUsd) {
        if (notionalUsd != null) {
            volume.accumulateAndGet(notionalUsd, BigDecimal::add);
        }
        return trades.incrementAndGet();
    }

    public void recordSuccess(BigDecimal realizedProfit) {
        successes.incrementAndGet();
        addProfit(realizedProfit);
    }

    public void addProfit(BigDecimal delta) {
        if (delta != null) {
            profit.accumulateAndGet(delta, BigDecimal::add);
        }
    }

    public Snapshot snapshot() {
        return snapshot(null, null);
    }

    /**
     * Snapshot carrying a capital account. Executors without one pass nulls.
     */
    public Snapshot snapshot(BigDecimal initialCapital, BigDecimal currentCapital) {
        return new Snapshot(trades.get(), successes.get(), profit.get(), volume.get(), initialCapital, currentCapital);
    }

    @Value
    public static class Snapshot {
        long tradeCount;
        long successCount;
        BigDecimal totalProfit;
        BigDecimal totalVolume;
        BigDecimal initialCapital;
        BigDecimal currentCapital;

        public double winRate() {
            return tradeCount == 0 ? 0.0 : (double) successCount / tradeCount * 100.0;
        }

        public boolean hasCapital() {
            return initialCapital != null && currentCapital != null;
        }

        /**
         * Return on initial capital in percent, zero without a capital account.
         */
        public BigDecimal roi() {
            if (!hasCapital() || initialCapital.signum() <= 0) {
                return BigDecimal.ZERO;
            }
            return currentCapital.subtract(initialCapital)
                    .multiply(BigDecimal.valueOf(100))
                    .divide(initialCapital, 4, RoundingMode.HALF_UP);
        }
    }
}
