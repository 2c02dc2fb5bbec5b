package com.example.demo.deckgen.exception;

/**
 * Serialization-level fault while building the package (corrupt resource,
 * unreadable media, write failure). Fatal for the request.
 */
public class DocumentAssemblyException extends DeckGenerationException {
    public static final String CODE = "DOCUMENT_ASSEMBLY_ERROR";

    public DocumentAssemblyException(String description, Throwable cause) {
        super(CODE, description, cause);
    }

    public DocumentAssemblyException(String code, String description, Throwable cause) {
        super(code, description, cause);
    }
}
