package com.example.demo.deckgen.exception;

import lombok.Getter;

/**
 * Raised when a deck description is malformed. Thrown before any rendering
 * work starts, so no partial output exists.
 */
@Getter
public class SchemaValidationException extends DeckGenerationException {
    public static final String CODE = "SCHEMA_VALIDATION";

    private final String reason;

    /**
     * Zero-based slide position, or null when the error concerns the deck itself.
     */
    private final Integer slideIndex;

    public SchemaValidationException(String reason) {
        this(reason, null);
    }

    public SchemaValidationException(String reason, Integer slideIndex) {
        super(CODE, slideIndex == null ? reason : "Slide " + slideIndex + ": " + reason);
        this.reason = reason;
        this.slideIndex = slideIndex;
    }

    /**
     * Re-raise this error attributed to the given slide position. Slide
     * constructors do not know their index; the deck and the parser do.
     */
    public SchemaValidationException atSlide(int index) {
        if (slideIndex != null) {
            return this;
        }
        SchemaValidationException located = new SchemaValidationException(reason, index);
        located.setStackTrace(getStackTrace());
        return located;
    }
}
