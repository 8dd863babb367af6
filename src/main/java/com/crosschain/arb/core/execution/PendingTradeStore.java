package com.crosschain.arb.core.execution;

import lombok.Value;

import java.util.OptionalInt;

/**
 * Trades forwarded to the execution service whose outcome has not been recorded yet.
 */
public interface PendingTradeStore {

    /**
     * @return the number of pending trades, or empty when the store cannot be read
     */
    OptionalInt pendingCount();

    /**
     * Marks the trade pending only if fewer than {@code limit} trades are pending. The check and the
     * mark happen as one step, so concurrent callers can never push the count past the limit.
     */
    Reservation tryReserve(String tradeId, int limit);

    /**
     * @return true if the trade was pending
     */
    boolean clearPending(String tradeId);

    enum Outcome {
        RESERVED,
        REJECTED,
        UNAVAILABLE
    }

    @Value
    class Reservation {
        Outcome outcome;
        int pendingCount; // -1 when unknown

        public static Reservation reserved(int pendingCount) {
            return new Reservation(Outcome.RESERVED, pendingCount);
        }

        public static Reservation rejected(int pendingCount) {
            return new Reservation(Outcome.REJECTED, pendingCount);
        }

        public static Reservation unavailable() {
            return new Reservation(Outcome.UNAVAILABLE, -1);
        }
    }
}
