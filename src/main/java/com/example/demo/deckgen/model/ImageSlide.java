package com.example.demo.deckgen.model;

import com.example.demo.deckgen.exception.SchemaValidationException;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Image slide in one of the three image kinds. The body text is optional.
 */
@Getter
@ToString
public class ImageSlide extends SlideSpec {
    private final ImageDescriptor image;
    private final SlideText body;

    @Builder
    public ImageSlide(SlideKind kind, String title, ImageDescriptor image, SlideText body) {
        super(kind, title);
        if (!kind.isImageKind()) {
            throw new SchemaValidationException("Image slide cannot have kind " + kind);
        }
        if (image == null) {
            throw new SchemaValidationException("Image slide '" + title + "' requires an image");
        }
        this.image = image;
        this.body = body == null ? SlideText.empty() : body;
    }
}
