package com.crosschain.arb.core;

import org.springframework.stereotype.Component;

@Component
public class NoOpGasTrendForecaster implements GasTrendForecaster {

    @Override
    public void ingestGas(double gwei) {
    }

    @Override
    public boolean shouldWait() {
        return false;
    }
}
