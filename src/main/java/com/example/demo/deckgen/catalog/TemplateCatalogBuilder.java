package com.example.demo.deckgen.catalog;

import com.example.demo.deckgen.aspect.LogExecutionTime;
import com.example.demo.deckgen.exception.TemplateCatalogException;
import com.example.demo.deckgen.model.SlideKind;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.sl.usermodel.Placeholder;
import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.apache.poi.xslf.usermodel.XSLFSlideLayout;
import org.apache.poi.xslf.usermodel.XSLFSlideMaster;
import org.apache.poi.xslf.usermodel.XSLFTextShape;
import org.springframework.stereotype.Component;

import java.awt.geom.Rectangle2D;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Scans a template document once and classifies its layouts by name.
 * Placeholder roles are assigned from the placeholder type, and for generic
 * content placeholders from what the layout kind needs.
 */
@Slf4j
@Component
public class TemplateCatalogBuilder {

    @LogExecutionTime("Building Template Catalog")
    public TemplateCatalog build(String source, byte[] templateBytes) {
        try (XMLSlideShow ppt = new XMLSlideShow(new ByteArrayInputStream(templateBytes))) {
            Map<SlideKind, LayoutHandle> handles = new EnumMap<>(SlideKind.class);
            List<XSLFSlideMaster> masters = ppt.getSlideMasters();
            for (int m = 0; m < masters.size(); m++) {
                for (XSLFSlideLayout layout : masters.get(m).getSlideLayouts()) {
                    Optional<SlideKind> kind = SlideKind.fromLayoutName(layout.getName());
                    if (kind.isEmpty()) {
                        log.debug("Ignoring unrecognized layout '{}'", layout.getName());
                        continue;
                    }
                    if (handles.containsKey(kind.get())) {
                        log.debug("Layout '{}' on master {} shadowed by an earlier match", layout.getName(), m);
                        continue;
                    }
                    handles.put(kind.get(), new LayoutHandle(kind.get(), layout.getName(), m,
                            assignRoles(kind.get(), PlaceholderScanner.contentPlaceholders(layout))));
                }
            }
            if (handles.isEmpty()) {
                throw new TemplateCatalogException("MISSING_REQUIRED_LAYOUT",
                        "Template '" + source + "' has no recognizable layouts");
            }
            TemplateCatalog catalog = new TemplateCatalog(source, templateBytes, handles, ppt.getPageSize());
            log.info("Template catalog built from '{}': {}", source, handles.keySet());
            return catalog;
        } catch (IOException | RuntimeException e) {
            if (e instanceof TemplateCatalogException) {
                throw (TemplateCatalogException) e;
            }
            throw new TemplateCatalogException("TEMPLATE_PARSE_ERROR", "Template '" + source + "' is not a readable presentation", e);
        }
    }

    List<PlaceholderSlot> assignRoles(SlideKind kind, List<XSLFTextShape> placeholders) {
        PlaceholderRole[] roles = new PlaceholderRole[placeholders.size()];
        List<Integer> textCandidates = new ArrayList<>();
        List<Integer> generic = new ArrayList<>();

        for (int i = 0; i < placeholders.size(); i++) {
            Placeholder type = placeholders.get(i).getTextType();
            switch (type) {
                case TITLE:
                case CENTERED_TITLE:
                case VERTICAL_TEXT_TITLE:
                    if (!contains(roles, PlaceholderRole.TITLE)) {
                        roles[i] = PlaceholderRole.TITLE;
                    }
                    break;
                case PICTURE:
                    roles[i] = PlaceholderRole.PICTURE;
                    break;
                case TABLE:
                    roles[i] = PlaceholderRole.TABLE;
                    break;
                case CHART:
                    roles[i] = PlaceholderRole.CHART;
                    break;
                case SUBTITLE:
                case BODY:
                case VERTICAL_TEXT_BODY:
                    textCandidates.add(i);
                    break;
                default:
                    generic.add(i);
            }
        }

        if (kind == SlideKind.TWO_COLUMNS) {
            List<Integer> columns = new ArrayList<>(generic);
            columns.addAll(textCandidates);
            columns.sort(Comparator.comparingDouble(i -> x(placeholders.get(i))));
            if (columns.size() >= 2) {
                roles[columns.get(0)] = PlaceholderRole.COLUMN_LEFT;
                roles[columns.get(1)] = PlaceholderRole.COLUMN_RIGHT;
                generic.remove(columns.get(0));
                generic.remove(columns.get(1));
                textCandidates.remove(columns.get(0));
                textCandidates.remove(columns.get(1));
            }
        } else if (kind.isImageKind()) {
            claimLargest(PlaceholderRole.PICTURE, roles, generic, placeholders);
        } else if (kind == SlideKind.TABLE) {
            claimLargest(PlaceholderRole.TABLE, roles, generic, placeholders);
        } else if (kind == SlideKind.CHART) {
            claimLargest(PlaceholderRole.CHART, roles, generic, placeholders);
        }

        if (!contains(roles, PlaceholderRole.BODY)) {
            List<Integer> remaining = new ArrayList<>(textCandidates);
            remaining.addAll(generic);
            remaining.stream().sorted().findFirst().ifPresent(i -> roles[i] = PlaceholderRole.BODY);
        }

        List<PlaceholderSlot> slots = new ArrayList<>();
        for (int i = 0; i < placeholders.size(); i++) {
            if (roles[i] != null) {
                XSLFTextShape shape = placeholders.get(i);
                slots.add(new PlaceholderSlot(i, roles[i], shape.getTextType(), anchorOf(shape)));
            }
        }
        return slots;
    }

    private void claimLargest(PlaceholderRole role, PlaceholderRole[] roles, List<Integer> generic,
                              List<XSLFTextShape> placeholders) {
        if (contains(roles, role) || generic.isEmpty()) {
            return;
        }
        Integer largest = generic.stream()
                .max(Comparator.comparingDouble(i -> area(placeholders.get(i))))
                .orElseThrow();
        roles[largest] = role;
        generic.remove(largest);
    }

    private static boolean contains(PlaceholderRole[] roles, PlaceholderRole role) {
        for (PlaceholderRole r : roles) {
            if (r == role) {
                return true;
            }
        }
        return false;
    }

    private static Rectangle2D anchorOf(XSLFTextShape shape) {
        try {
            return shape.getAnchor();
        } catch (RuntimeException e) {
            log.debug("Placeholder '{}' has no resolvable anchor", shape.getShapeName());
            return null;
        }
    }

    private static double x(XSLFTextShape shape) {
        Rectangle2D anchor = anchorOf(shape);
        return anchor == null ? 0 : anchor.getX();
    }

    private static double area(XSLFTextShape shape) {
        Rectangle2D anchor = anchorOf(shape);
        return anchor == null ? 0 : anchor.getWidth() * anchor.getHeight();
    }
}
