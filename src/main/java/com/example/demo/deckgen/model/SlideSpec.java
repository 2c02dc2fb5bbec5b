package com.example.demo.deckgen.model;

import com.example.demo.deckgen.exception.SchemaValidationException;
import lombok.Getter;

/**
 * One slide of a deck. Subclasses are the variants of {@link SlideKind} and
 * carry only the fields meaningful to their kind; every variant validates
 * itself on construction.
 */
@Getter
public abstract class SlideSpec {
    public static final int MAX_TITLE_LENGTH = 200;

    private final SlideKind kind;
    private final String title;

    protected SlideSpec(SlideKind kind, String title) {
        if (kind == null) {
            throw new SchemaValidationException("Slide kind is required");
        }
        if (title == null || title.isBlank()) {
            throw new SchemaValidationException("Slide title is required");
        }
        if (title.length() > MAX_TITLE_LENGTH) {
            throw new SchemaValidationException("Slide title exceeds " + MAX_TITLE_LENGTH + " characters");
        }
        this.kind = kind;
        this.title = title;
    }
}
