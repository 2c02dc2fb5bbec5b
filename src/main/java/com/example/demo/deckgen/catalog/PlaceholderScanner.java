package com.example.demo.deckgen.catalog;

import org.apache.poi.sl.usermodel.Placeholder;
import org.apache.poi.xslf.usermodel.XSLFShape;
import org.apache.poi.xslf.usermodel.XSLFSheet;
import org.apache.poi.xslf.usermodel.XSLFTextShape;

import java.util.ArrayList;
import java.util.List;

/**
 * Lists the placeholders of a layout or slide in document order, skipping the
 * date, footer and slide-number placeholders. POI copies exactly this set,
 * in this order, from a layout onto a new slide, so ordinals line up between
 * a layout and the slides created from it.
 */
public final class PlaceholderScanner {

    private PlaceholderScanner() {
    }

    public static List<XSLFTextShape> contentPlaceholders(XSLFSheet sheet) {
        List<XSLFTextShape> placeholders = new ArrayList<>();
        for (XSLFShape shape : sheet.getShapes()) {
            if (!(shape instanceof XSLFTextShape)) {
                continue;
            }
            Placeholder type = ((XSLFTextShape) shape).getTextType();
            if (type == null || type == Placeholder.DATETIME || type == Placeholder.FOOTER
                    || type == Placeholder.SLIDE_NUMBER) {
                continue;
            }
            placeholders.add((XSLFTextShape) shape);
        }
        return placeholders;
    }
}
