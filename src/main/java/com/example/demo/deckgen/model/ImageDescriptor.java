package com.example.demo.deckgen.model;

import com.example.demo.deckgen.exception.SchemaValidationException;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * What to show on an image slide: a search query (topic hint) and the
 * resource embedded when the search yields nothing usable.
 */
@Getter
@ToString
@EqualsAndHashCode
public class ImageDescriptor {
    private final String query;
    private final String fallbackResource;

    public ImageDescriptor(String query, String fallbackResource) {
        if (query == null || query.isBlank()) {
            throw new SchemaValidationException("Image requires a query");
        }
        if (fallbackResource == null || fallbackResource.isBlank()) {
            throw new SchemaValidationException("Image requires a fallback resource");
        }
        this.query = query.trim();
        this.fallbackResource = fallbackResource;
    }
}
