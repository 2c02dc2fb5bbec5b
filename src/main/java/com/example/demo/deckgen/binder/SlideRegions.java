package com.example.demo.deckgen.binder;

import com.example.demo.deckgen.catalog.PlaceholderRole;
import com.example.demo.deckgen.catalog.PlaceholderSlot;
import com.example.demo.deckgen.model.ImageSlide;
import com.example.demo.deckgen.model.SlideKind;

import java.awt.geom.Rectangle2D;
import java.util.Optional;

/**
 * Where the picture and the text of an image slide go when the layout does
 * not provide both. Computed from the layout's declared boxes so the result
 * does not depend on binder order.
 */
final class SlideRegions {

    private SlideRegions() {
    }

    static Rectangle2D picture(SlideCanvas canvas, ImageSlide slide) {
        if (canvas.exposes(PlaceholderRole.PICTURE)) {
            return canvas.regionFor(PlaceholderRole.PICTURE);
        }
        Rectangle2D area = declared(canvas, PlaceholderRole.BODY);
        if (slide.getBody().isEmpty()) {
            return area;
        }
        return slide.getKind() == SlideKind.IMAGE_LEFT ? SlideCanvas.leftHalf(area) : SlideCanvas.rightHalf(area);
    }

    /**
     * Region for the body text of an image slide, or empty when the layout
     * has no room for it (a full-bleed image layout without a text box).
     */
    static Optional<Rectangle2D> text(SlideCanvas canvas, ImageSlide slide) {
        boolean picture = canvas.exposes(PlaceholderRole.PICTURE);
        boolean body = canvas.exposes(PlaceholderRole.BODY);
        if (picture && body) {
            return Optional.of(canvas.regionFor(PlaceholderRole.BODY));
        }
        if (picture && slide.getKind() == SlideKind.IMAGE_FULL) {
            return Optional.empty();
        }
        Rectangle2D area = declared(canvas, PlaceholderRole.BODY);
        return Optional.of(slide.getKind() == SlideKind.IMAGE_LEFT ? SlideCanvas.rightHalf(area) : SlideCanvas.leftHalf(area));
    }

    private static Rectangle2D declared(SlideCanvas canvas, PlaceholderRole role) {
        return canvas.getLayout().slot(role)
                .map(PlaceholderSlot::getAnchor)
                .orElseGet(() -> canvas.regionFor(role));
    }
}
