package com.example.demo.deckgen.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Header treatment for table slides. The header row is styled distinctly in
 * both cases; HEADER_COLORED uses the dark fill with light text.
 */
public enum TableStyle {
    PLAIN,
    HEADER_COLORED;

    public static Optional<TableStyle> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.of(PLAIN);
        }
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "plain":
            case "default":
                return Optional.of(PLAIN);
            case "header_colored":
            case "header-colored":
                return Optional.of(HEADER_COLORED);
            default:
                return Optional.empty();
        }
    }
}
