package com.example.demo.deckgen.catalog;

import com.example.demo.deckgen.exception.TemplateCatalogException;
import com.example.demo.deckgen.model.SlideKind;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xslf.usermodel.XMLSlideShow;

import java.awt.Dimension;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only index of the template's layouts, built once at startup and shared
 * by every render. Renders never touch the template directly: they
 * {@link #checkout()} a private working copy parsed from the retained bytes.
 */
@Slf4j
public class TemplateCatalog {
    private final String source;
    private final byte[] templateBytes;
    private final Map<SlideKind, LayoutHandle> layouts;
    private final Dimension pageSize;

    public TemplateCatalog(String source, byte[] templateBytes, Map<SlideKind, LayoutHandle> layouts, Dimension pageSize) {
        if (!layouts.containsKey(SlideKind.CONTENT_ONLY)) {
            throw new TemplateCatalogException("MISSING_REQUIRED_LAYOUT",
                    "Template '" + source + "' has no '" + SlideKind.CONTENT_ONLY.getLayoutName() + "' layout");
        }
        this.source = source;
        this.templateBytes = templateBytes.clone();
        this.layouts = Collections.unmodifiableMap(new EnumMap<>(layouts));
        this.pageSize = new Dimension(pageSize);
    }

    public Optional<LayoutHandle> resolve(SlideKind kind) {
        return Optional.ofNullable(layouts.get(kind));
    }

    public Set<SlideKind> availableKinds() {
        return layouts.keySet();
    }

    public Map<SlideKind, LayoutHandle> getLayouts() {
        return layouts;
    }

    public String getSource() {
        return source;
    }

    /**
     * Slide size in points.
     */
    public Dimension getPageSize() {
        return new Dimension(pageSize);
    }

    /**
     * Parse a fresh, private copy of the template with its sample slides removed.
     */
    public WorkingCopy checkout() {
        try {
            return new WorkingCopy(new XMLSlideShow(new ByteArrayInputStream(templateBytes)));
        } catch (IOException e) {
            throw new TemplateCatalogException("TEMPLATE_READ_ERROR", "Failed to check out template '" + source + "'", e);
        }
    }
}
