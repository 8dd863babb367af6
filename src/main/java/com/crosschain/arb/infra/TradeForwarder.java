package com.crosschain.arb.infra;

import com.crosschain.arb.domain.ExecutorResponse;
import com.crosschain.arb.domain.TradeSignal;

/**
 * Channel that hands validated signals to the external execution service.
 */
public interface TradeForwarder {

    /**
     * @return the service's answer; a transport failure after all retries is reported as an unsuccessful response
     */
    ExecutorResponse forward(String tradeId, TradeSignal signal);

    boolean isAvailable();
}
