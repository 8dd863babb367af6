package com.crosschain.arb.core;

/**
 * Advisory gas model. Fed the primary chain's gas price once per cycle.
 */
public interface GasTrendForecaster {

    void ingestGas(double gwei);

    /**
     * @return true to skip the current cycle because gas is expected to fall
     */
    boolean shouldWait();
}
