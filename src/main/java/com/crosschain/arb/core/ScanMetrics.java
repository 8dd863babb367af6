package com.crosschain.arb.core;

import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

@Component
public class ScanMetrics {

    private final Map<EvaluationOutcome, AtomicLong> outcomes = new EnumMap<>(EvaluationOutcome.class);
    private final AtomicLong cycles = new AtomicLong();
    private final AtomicLong heldCycles = new AtomicLong();
    private final AtomicLong abandoned = new AtomicLong();

    public ScanMetrics() {
        for (EvaluationOutcome outcome : EvaluationOutcome.values()) {
            outcomes.put(outcome, new AtomicLong());
        }
    }

    public void record(EvaluationOutcome outcome) {
        outcomes.get(outcome).incrementAndGet();
    }

    public void cycleCompleted() {
        cycles.incrementAndGet();
    }

    public void cycleHeld() {
        heldCycles.incrementAndGet();
    }

    public void abandoned(long count) {
        abandoned.addAndGet(count);
    }

    public long count(EvaluationOutcome outcome) {
        return outcomes.get(outcome).get();
    }

    public long cycles() {
        return cycles.get();
    }

    public long heldCycles() {
        return heldCycles.get();
    }

    public long abandonedCount() {
        return abandoned.get();
    }

    public Map<EvaluationOutcome, Long> snapshot() {
        Map<EvaluationOutcome, Long> copy = new EnumMap<>(EvaluationOutcome.class);
        outcomes.forEach((outcome, counter) -> copy.put(outcome, counter.get()));
        return Collections.unmodifiableMap(copy);
    }
}
