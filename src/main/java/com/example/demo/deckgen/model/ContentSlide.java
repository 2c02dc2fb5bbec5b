package com.example.demo.deckgen.model;

import com.example.demo.deckgen.exception.SchemaValidationException;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
public class ContentSlide extends SlideSpec {
    private final SlideText body;

    @Builder
    public ContentSlide(String title, SlideText body) {
        super(SlideKind.CONTENT_ONLY, title);
        if (body == null || body.isEmpty()) {
            throw new SchemaValidationException("Content slide '" + title + "' must have text or bullet points");
        }
        this.body = body;
    }
}
