package com.example.demo.deckgen.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request to render a deck: the deck document plus output options.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeckGenerationRequest {
    /**
     * Desired output file name; sanitized, ".pptx" appended when missing.
     * Defaults to the deck title.
     */
    private String fileName;

    /**
     * Language tag written into the package metadata. Overrides the deck's own.
     */
    private String language;

    /**
     * The deck description (title, slides, ...).
     */
    private JsonNode deck;
}
