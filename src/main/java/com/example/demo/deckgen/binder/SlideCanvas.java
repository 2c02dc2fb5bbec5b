package com.example.demo.deckgen.binder;

import com.example.demo.deckgen.catalog.BuiltinTemplateFactory;
import com.example.demo.deckgen.catalog.LayoutHandle;
import com.example.demo.deckgen.catalog.PlaceholderRole;
import com.example.demo.deckgen.catalog.PlaceholderScanner;
import com.example.demo.deckgen.catalog.PlaceholderSlot;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xslf.usermodel.XSLFSlide;
import org.apache.poi.xslf.usermodel.XSLFTextBox;
import org.apache.poi.xslf.usermodel.XSLFTextShape;

import java.awt.Dimension;
import java.awt.geom.Rectangle2D;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A freshly created slide together with the placeholders it inherited from its
 * layout, addressed by role.
 *
 * Roles the layout does not expose are served from computed regions: the
 * title band, the body placeholder's box, or the default content area, split
 * in halves where two items share it.
 */
@Slf4j
public class SlideCanvas {

    private final XSLFSlide slide;
    private final LayoutHandle layout;
    private final Dimension pageSize;
    private final Map<PlaceholderRole, XSLFTextShape> placeholders = new EnumMap<>(PlaceholderRole.class);
    private final List<XSLFTextShape> inherited;
    private final Set<PlaceholderRole> filled = EnumSet.noneOf(PlaceholderRole.class);

    public SlideCanvas(XSLFSlide slide, LayoutHandle layout, Dimension pageSize) {
        this.slide = slide;
        this.layout = layout;
        this.pageSize = pageSize;
        this.inherited = PlaceholderScanner.contentPlaceholders(slide);
        for (PlaceholderSlot slot : layout.getSlots()) {
            if (slot.getOrdinal() < inherited.size()) {
                placeholders.put(slot.getRole(), inherited.get(slot.getOrdinal()));
            } else {
                log.warn("Layout '{}' placeholder {} was not copied onto the slide", layout.getLayoutName(), slot.getOrdinal());
            }
        }
    }

    public XSLFSlide getSlide() {
        return slide;
    }

    public LayoutHandle getLayout() {
        return layout;
    }

    public boolean exposes(PlaceholderRole role) {
        return placeholders.containsKey(role);
    }

    public Optional<XSLFTextShape> placeholder(PlaceholderRole role) {
        return Optional.ofNullable(placeholders.get(role));
    }

    /**
     * Bounding box for a role in points: the placeholder's own box when the
     * layout has one, otherwise a computed region.
     */
    public Rectangle2D regionFor(PlaceholderRole role) {
        XSLFTextShape shape = placeholders.get(role);
        if (shape != null) {
            Rectangle2D anchor = anchorOf(shape);
            if (anchor != null && anchor.getWidth() > 0 && anchor.getHeight() > 0) {
                return anchor;
            }
            Optional<PlaceholderSlot> slot = layout.slot(role);
            if (slot.isPresent() && slot.get().getAnchor() != null) {
                return slot.get().getAnchor();
            }
        }
        switch (role) {
            case TITLE:
                return BuiltinTemplateFactory.titleArea(pageSize);
            case COLUMN_LEFT:
                return leftHalf(regionFor(PlaceholderRole.BODY));
            case COLUMN_RIGHT:
                return rightHalf(regionFor(PlaceholderRole.BODY));
            case BODY:
                return BuiltinTemplateFactory.contentArea(pageSize);
            default:
                return regionFor(PlaceholderRole.BODY);
        }
    }

    /**
     * Shape to write text for a role into: the placeholder, or a new text box
     * over the computed region.
     */
    public XSLFTextShape textTarget(PlaceholderRole role) {
        return textTarget(role, regionFor(role));
    }

    public XSLFTextShape textTarget(PlaceholderRole role, Rectangle2D fallbackRegion) {
        filled.add(role);
        XSLFTextShape shape = placeholders.get(role);
        if (shape != null) {
            return shape;
        }
        XSLFTextBox box = slide.createTextBox();
        box.setAnchor(fallbackRegion);
        box.setWordWrap(true);
        return box;
    }

    /**
     * Claim the region for a graphic (picture, table, chart). A placeholder
     * for the role is removed; the graphic takes its place.
     */
    public Rectangle2D takeRegion(PlaceholderRole role) {
        Rectangle2D region = regionFor(role);
        XSLFTextShape shape = placeholders.remove(role);
        if (shape != null) {
            slide.removeShape(shape);
        }
        filled.add(role);
        return region;
    }

    /**
     * Move a text placeholder, used when a graphic has to share its area.
     */
    public void resize(PlaceholderRole role, Rectangle2D region) {
        XSLFTextShape shape = placeholders.get(role);
        if (shape != null) {
            shape.setAnchor(region);
        }
    }

    /**
     * Remove every inherited placeholder that received no content, so empty
     * prompt boxes never reach the output.
     */
    public void removeUnfilled() {
        for (XSLFTextShape shape : inherited) {
            boolean used = placeholders.entrySet().stream()
                    .anyMatch(e -> e.getValue() == shape && filled.contains(e.getKey()));
            if (!used && slide.getShapes().contains(shape)) {
                slide.removeShape(shape);
            }
        }
    }

    public static Rectangle2D leftHalf(Rectangle2D area) {
        return BuiltinTemplateFactory.leftHalf(area);
    }

    public static Rectangle2D rightHalf(Rectangle2D area) {
        return BuiltinTemplateFactory.rightHalf(area);
    }

    private static Rectangle2D anchorOf(XSLFTextShape shape) {
        try {
            return shape.getAnchor();
        } catch (RuntimeException e) {
            log.debug("Unresolvable anchor on placeholder '{}'", shape.getShapeName());
            return null;
        }
    }
}
