package com.bsa.analyzer.detector;

import java.util.Locale;

/** How the reentrancy detector decides that a write comes after a call. */
public enum DetectionMode {
    /** Block creation order. */
    ORDER,
    /** CFG reachability from the call's block. */
    REACHABILITY;

    public static DetectionMode parse(String value) {
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "order" -> ORDER;
            case "reachability" -> REACHABILITY;
            default -> throw new IllegalArgumentException("Unknown detection mode: " + value);
        };
    }
}
