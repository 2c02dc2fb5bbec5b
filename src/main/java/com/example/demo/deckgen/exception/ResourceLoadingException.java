package com.example.demo.deckgen.exception;

/**
 * A configured resource (template document, fallback image) could not be
 * located or read.
 */
public class ResourceLoadingException extends DeckGenerationException {

    public ResourceLoadingException(String code, String description) {
        super(code, description);
    }

    public ResourceLoadingException(String code, String description, Throwable cause) {
        super(code, description, cause);
    }
}
