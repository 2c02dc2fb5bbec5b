package com.example.demo.deckgen.catalog;

import lombok.Getter;
import lombok.ToString;
import org.apache.poi.sl.usermodel.Placeholder;

import java.awt.geom.Rectangle2D;

/**
 * One role-bearing placeholder of a layout.
 *
 * The ordinal is the placeholder's position among the layout placeholders
 * that are copied onto new slides (see {@link PlaceholderScanner}), which is
 * how the placeholder is found again on a slide created from the layout.
 */
@Getter
@ToString
public class PlaceholderSlot {
    private final int ordinal;
    private final PlaceholderRole role;
    private final Placeholder type;
    private final Rectangle2D anchor;

    public PlaceholderSlot(int ordinal, PlaceholderRole role, Placeholder type, Rectangle2D anchor) {
        this.ordinal = ordinal;
        this.role = role;
        this.type = type;
        this.anchor = anchor == null ? null : (Rectangle2D) anchor.clone();
    }

    /**
     * Bounding box in points as declared by the template, or null when the
     * template leaves it unresolved.
     */
    public Rectangle2D getAnchor() {
        return anchor == null ? null : (Rectangle2D) anchor.clone();
    }
}
