package com.example.demo.deckgen.model;

import com.example.demo.deckgen.exception.SchemaValidationException;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * A validated deck: ordered slides plus deck-level metadata. Immutable.
 */
@Getter
@ToString
public class SlideDeckSpec {
    public static final String DEFAULT_LANGUAGE = "en";

    private final String title;
    private final String subtitle;
    private final String author;
    private final String subject;
    private final String language;
    private final int slideCount;
    private final List<SlideSpec> slides;

    @Builder
    public SlideDeckSpec(String title, String subtitle, String author, String subject,
                         String language, Integer slideCount, List<SlideSpec> slides) {
        if (slides == null || slides.isEmpty()) {
            throw new SchemaValidationException("Deck requires at least one slide");
        }
        for (int i = 0; i < slides.size(); i++) {
            if (slides.get(i) == null) {
                throw new SchemaValidationException("Slide is missing", i);
            }
        }
        int declared = slideCount == null ? slides.size() : slideCount;
        if (declared != slides.size()) {
            throw new SchemaValidationException("Declared slideCount " + declared
                    + " does not match the " + slides.size() + " slides provided");
        }
        if (title != null && title.length() > SlideSpec.MAX_TITLE_LENGTH) {
            throw new SchemaValidationException("Deck title exceeds " + SlideSpec.MAX_TITLE_LENGTH + " characters");
        }
        this.title = title;
        this.subtitle = subtitle;
        this.author = author;
        this.subject = subject;
        this.language = language == null || language.isBlank() ? DEFAULT_LANGUAGE : language.trim();
        this.slideCount = declared;
        this.slides = List.copyOf(slides);
    }
}
