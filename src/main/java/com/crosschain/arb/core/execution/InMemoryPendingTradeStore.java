package com.crosschain.arb.core.execution;

import org.springframework.stereotype.Component;

import java.util.OptionalInt;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class InMemoryPendingTradeStore implements PendingTradeStore {

    private final Set<String> pending = ConcurrentHashMap.newKeySet();

    @Override
    public OptionalInt pendingCount() {
        return OptionalInt.of(pending.size());
    }

    // Removals only shrink the set, so clearPending does not need the lock
    @Override
    public synchronized Reservation tryReserve(String tradeId, int limit) {
        int current = pending.size();
        if (current >= limit) {
            return Reservation.rejected(current);
        }
        pending.add(tradeId);
        return Reservation.reserved(current + 1);
    }

    @Override
    public boolean clearPending(String tradeId) {
        return pending.remove(tradeId);
    }
}
