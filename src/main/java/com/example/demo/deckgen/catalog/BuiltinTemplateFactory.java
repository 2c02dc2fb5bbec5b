package com.example.demo.deckgen.catalog;

import com.example.demo.deckgen.exception.TemplateCatalogException;
import com.example.demo.deckgen.model.SlideKind;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.sl.usermodel.Placeholder;
import org.apache.poi.xslf.usermodel.SlideLayout;
import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.apache.poi.xslf.usermodel.XSLFAutoShape;
import org.apache.poi.xslf.usermodel.XSLFShape;
import org.apache.poi.xslf.usermodel.XSLFSlideLayout;
import org.apache.poi.xslf.usermodel.XSLFSlideMaster;
import org.apache.poi.xslf.usermodel.XSLFTextShape;
import org.springframework.stereotype.Component;

import java.awt.Dimension;
import java.awt.geom.Rectangle2D;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Generates a usable template from the Apache POI default slide master when
 * no template document is configured.
 *
 * Stock layouts are renamed to the layout names the catalog recognizes. The
 * image, table and chart layouts have no stock equivalent, so spare layouts
 * are stripped to their title, the title is moved to the top band, and the
 * placeholders the kind needs are laid over the content area. The side image
 * layouts put the picture on the named half and the body on the other.
 */
@Slf4j
@Component
public class BuiltinTemplateFactory {
    static final double MARGIN = 36;
    static final double CONTENT_TOP = 126;
    static final double TITLE_TOP = 24;
    static final double TITLE_HEIGHT = 90;
    static final double GUTTER = 12;

    public byte[] createBytes() {
        return createBytes(EnumSet.allOf(SlideKind.class));
    }

    /**
     * Build a template exposing only the given kinds. Layouts for the other
     * kinds are kept under names the catalog does not recognize.
     */
    public byte[] createBytes(Set<SlideKind> kinds) {
        try (XMLSlideShow ppt = new XMLSlideShow();
             ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            XSLFSlideMaster master = ppt.getSlideMasters().get(0);
            Dimension pageSize = ppt.getPageSize();
            Rectangle2D contentArea = contentArea(pageSize);

            rename(master, SlideLayout.TITLE, SlideKind.TITLE, kinds);
            rename(master, SlideLayout.TITLE_AND_CONTENT, SlideKind.CONTENT_ONLY, kinds);
            rename(master, SlideLayout.TWO_OBJ, SlideKind.TWO_COLUMNS, kinds);

            Map<Placeholder, Rectangle2D> imageRight = new LinkedHashMap<>();
            imageRight.put(Placeholder.PICTURE, rightHalf(contentArea));
            imageRight.put(Placeholder.BODY, leftHalf(contentArea));
            repurpose(master, SlideLayout.PIC_TX, SlideKind.IMAGE_RIGHT, imageRight, pageSize, kinds);

            Map<Placeholder, Rectangle2D> imageLeft = new LinkedHashMap<>();
            imageLeft.put(Placeholder.PICTURE, leftHalf(contentArea));
            imageLeft.put(Placeholder.BODY, rightHalf(contentArea));
            repurpose(master, SlideLayout.OBJ_TX, SlideKind.IMAGE_LEFT, imageLeft, pageSize, kinds);

            repurpose(master, SlideLayout.TITLE_ONLY, SlideKind.IMAGE_FULL, Map.of(Placeholder.PICTURE, contentArea), pageSize, kinds);
            repurpose(master, SlideLayout.SECTION_HEADER, SlideKind.TABLE, Map.of(Placeholder.TABLE, contentArea), pageSize, kinds);
            repurpose(master, SlideLayout.VERT_TX, SlideKind.CHART, Map.of(Placeholder.CHART, contentArea), pageSize, kinds);

            ppt.write(out);
            log.debug("Generated builtin template with layouts {}", kinds);
            return out.toByteArray();
        } catch (IOException e) {
            throw new TemplateCatalogException("TEMPLATE_PARSE_ERROR", "Failed to generate builtin template", e);
        }
    }

    /**
     * Default content region below the title, in points.
     */
    public static Rectangle2D contentArea(Dimension pageSize) {
        return new Rectangle2D.Double(MARGIN, CONTENT_TOP,
                pageSize.getWidth() - 2 * MARGIN, pageSize.getHeight() - CONTENT_TOP - MARGIN);
    }

    /**
     * Title band at the top of the page, in points.
     */
    public static Rectangle2D titleArea(Dimension pageSize) {
        return new Rectangle2D.Double(MARGIN, TITLE_TOP, pageSize.getWidth() - 2 * MARGIN, TITLE_HEIGHT);
    }

    public static Rectangle2D leftHalf(Rectangle2D area) {
        double width = (area.getWidth() - GUTTER) / 2;
        return new Rectangle2D.Double(area.getX(), area.getY(), width, area.getHeight());
    }

    public static Rectangle2D rightHalf(Rectangle2D area) {
        double width = (area.getWidth() - GUTTER) / 2;
        return new Rectangle2D.Double(area.getX() + width + GUTTER, area.getY(), width, area.getHeight());
    }

    private void rename(XSLFSlideMaster master, SlideLayout type, SlideKind kind, Set<SlideKind> kinds) {
        XSLFSlideLayout layout = requireLayout(master, type);
        layout.getXmlObject().getCSld().setName(layoutName(kind, kinds));
    }

    private void repurpose(XSLFSlideMaster master, SlideLayout type, SlideKind kind,
                           Map<Placeholder, Rectangle2D> boxes, Dimension pageSize, Set<SlideKind> kinds) {
        XSLFSlideLayout layout = requireLayout(master, type);
        layout.getXmlObject().getCSld().setName(layoutName(kind, kinds));

        List<XSLFShape> obsolete = new ArrayList<>();
        for (XSLFShape shape : layout.getShapes()) {
            if (!(shape instanceof XSLFTextShape)) {
                continue;
            }
            XSLFTextShape text = (XSLFTextShape) shape;
            if (isContentPlaceholder(text.getTextType())) {
                obsolete.add(shape);
            } else if (isTitle(text.getTextType())) {
                text.setAnchor(titleArea(pageSize));
            }
        }
        obsolete.forEach(layout::removeShape);

        boxes.forEach((placeholder, area) -> {
            XSLFAutoShape box = layout.createAutoShape();
            box.setPlaceholder(placeholder);
            box.setAnchor(area);
        });
    }

    private static boolean isTitle(Placeholder type) {
        return type == Placeholder.TITLE || type == Placeholder.CENTERED_TITLE;
    }

    private static boolean isContentPlaceholder(Placeholder type) {
        return type != null
                && type != Placeholder.TITLE
                && type != Placeholder.CENTERED_TITLE
                && type != Placeholder.DATETIME
                && type != Placeholder.FOOTER
                && type != Placeholder.SLIDE_NUMBER;
    }

    private static String layoutName(SlideKind kind, Set<SlideKind> kinds) {
        return kinds.contains(kind) ? kind.getLayoutName() : "Unused " + kind.name().toLowerCase(Locale.ROOT);
    }

    private static XSLFSlideLayout requireLayout(XSLFSlideMaster master, SlideLayout type) {
        XSLFSlideLayout layout = master.getLayout(type);
        if (layout == null) {
            throw new TemplateCatalogException("TEMPLATE_PARSE_ERROR", "Default master has no " + type + " layout");
        }
        return layout;
    }
}
