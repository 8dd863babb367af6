package com.crosschain.arb.core.execution;

import com.crosschain.arb.domain.TradeRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Most recent trade records of one executor, keyed by trade id. The oldest record is evicted once
 * the capacity is reached.
 */
public class TradeHistory {

    private final Map<String, TradeRecord> records;

    public TradeHistory(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("History capacity must be positive: " + capacity);
        }
        this.records = new LinkedHashMap<>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, TradeRecord> eldest) {
                return size() > capacity;
            }
        };
    }

    public synchronized void add(TradeRecord record) {
        records.put(record.getTradeId(), record);
    }

    /**
     * Replaces the record of the given trade, keeping its position. No-op once it has been evicted.
     */
    public synchronized boolean update(String tradeId, UnaryOperator<TradeRecord> change) {
        return records.computeIfPresent(tradeId, (id, current) -> change.apply(current)) != null;
    }

    /**
     * @return newest first
     */
    public synchronized List<TradeRecord> recent() {
        List<TradeRecord> out = new ArrayList<>(records.values());
        Collections.reverse(out);
        return out;
    }

    public synchronized int size() {
        return records.size();
    }
}
