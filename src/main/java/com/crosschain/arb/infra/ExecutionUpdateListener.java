package com.crosschain.arb.infra;

import com.crosschain.arb.domain.ExecutionUpdate;

public interface ExecutionUpdateListener {

    void onUpdate(ExecutionUpdate update);

    /**
     * Stream ended, either closed by the server or failed. {@code cause} is null on a clean close.
     */
    void onClosed(Throwable cause);
}
