package com.crosschain.arb.domain;

import java.util.Locale;
import java.util.Optional;

public enum ExecutionMode {
    PAPER, // Simulate only
    LIVE, // Real capital
    HYBRID; // Confidence based switching

    public static Optional<ExecutionMode> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(ExecutionMode.valueOf(value.strip().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
