package com.example.demo.deckgen.exception;

/**
 * The rendering thread was interrupted, usually because the caller went away.
 */
public class RenderCancelledException extends DeckGenerationException {
    public static final String CODE = "RENDER_CANCELLED";

    public RenderCancelledException(String description, Throwable cause) {
        super(CODE, description, cause);
    }
}
