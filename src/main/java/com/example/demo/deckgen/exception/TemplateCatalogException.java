package com.example.demo.deckgen.exception;

/**
 * Unrecoverable template defect. Raised while loading the template or building
 * the catalog at startup, and by the layout resolver if ContentOnly is missing.
 */
public class TemplateCatalogException extends DeckGenerationException {

    public TemplateCatalogException(String code, String description) {
        super(code, description);
    }

    public TemplateCatalogException(String code, String description, Throwable cause) {
        super(code, description, cause);
    }
}
