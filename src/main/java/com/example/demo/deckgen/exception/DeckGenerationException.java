package com.example.demo.deckgen.exception;

import lombok.Getter;

/**
 * Base class for failures that abort a single deck render.
 * Carries a stable code (mapped to HTTP status by the controller) and a
 * human readable description.
 */
@Getter
public class DeckGenerationException extends RuntimeException {
    private final String code;
    private final String description;

    public DeckGenerationException(String code, String description) {
        super(code + ": " + description);
        this.code = code;
        this.description = description;
    }

    public DeckGenerationException(String code, String description, Throwable cause) {
        super(code + ": " + description, cause);
        this.code = code;
        this.description = description;
    }
}
