package com.example.demo.deckgen.model;

import java.util.Locale;
import java.util.Optional;

public enum ChartType {
    BAR,
    LINE,
    PIE;

    /**
     * "column" is accepted as an alias of BAR (clustered columns).
     */
    public static Optional<ChartType> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "bar":
            case "column":
                return Optional.of(BAR);
            case "line":
                return Optional.of(LINE);
            case "pie":
                return Optional.of(PIE);
            default:
                return Optional.empty();
        }
    }
}
