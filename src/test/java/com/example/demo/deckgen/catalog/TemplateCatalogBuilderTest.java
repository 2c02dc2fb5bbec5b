package com.example.demo.deckgen.catalog;

import com.example.demo.deckgen.TestFixtures;
import com.example.demo.deckgen.exception.TemplateCatalogException;
import com.example.demo.deckgen.model.SlideKind;
import org.apache.poi.xslf.usermodel.XSLFSlide;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.awt.geom.Rectangle2D;
import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Template catalog")
public class TemplateCatalogBuilderTest {

    @Test
    @DisplayName("Should classify every layout of the builtin template")
    public void testBuiltinTemplateExposesAllKinds() {
        TemplateCatalog catalog = TestFixtures.builtinCatalog();

        assertEquals(EnumSet.allOf(SlideKind.class), catalog.availableKinds());
        for (SlideKind kind : SlideKind.values()) {
            LayoutHandle handle = catalog.resolve(kind).orElseThrow();
            assertEquals(kind.getLayoutName(), handle.getLayoutName());
            assertTrue(handle.exposes(PlaceholderRole.TITLE), kind + " should expose a title");
        }
    }

    @Test
    @DisplayName("Should assign roles from placeholder types and layout kind")
    public void testRoleAssignment() {
        TemplateCatalog catalog = TestFixtures.builtinCatalog();

        assertTrue(catalog.resolve(SlideKind.TITLE).orElseThrow().exposes(PlaceholderRole.BODY));
        assertTrue(catalog.resolve(SlideKind.CONTENT_ONLY).orElseThrow().exposes(PlaceholderRole.BODY));
        assertTrue(catalog.resolve(SlideKind.IMAGE_RIGHT).orElseThrow().exposes(PlaceholderRole.PICTURE));
        assertTrue(catalog.resolve(SlideKind.IMAGE_LEFT).orElseThrow().exposes(PlaceholderRole.PICTURE));
        assertTrue(catalog.resolve(SlideKind.IMAGE_FULL).orElseThrow().exposes(PlaceholderRole.PICTURE));
        assertTrue(catalog.resolve(SlideKind.TABLE).orElseThrow().exposes(PlaceholderRole.TABLE));
        assertTrue(catalog.resolve(SlideKind.CHART).orElseThrow().exposes(PlaceholderRole.CHART));

        LayoutHandle columns = catalog.resolve(SlideKind.TWO_COLUMNS).orElseThrow();
        Rectangle2D left = columns.slot(PlaceholderRole.COLUMN_LEFT).orElseThrow().getAnchor();
        Rectangle2D right = columns.slot(PlaceholderRole.COLUMN_RIGHT).orElseThrow().getAnchor();
        assertTrue(left.getX() < right.getX(), "left column must be left of the right column");
    }

    @Test
    @DisplayName("Should put the builtin side image layouts' picture on the named side of the body")
    public void testBuiltinImageSides() {
        TemplateCatalog catalog = TestFixtures.builtinCatalog();

        LayoutHandle left = catalog.resolve(SlideKind.IMAGE_LEFT).orElseThrow();
        Rectangle2D leftPicture = left.slot(PlaceholderRole.PICTURE).orElseThrow().getAnchor();
        Rectangle2D leftBody = left.slot(PlaceholderRole.BODY).orElseThrow().getAnchor();
        assertTrue(leftPicture.getMaxX() <= leftBody.getX());

        LayoutHandle right = catalog.resolve(SlideKind.IMAGE_RIGHT).orElseThrow();
        Rectangle2D rightPicture = right.slot(PlaceholderRole.PICTURE).orElseThrow().getAnchor();
        Rectangle2D rightBody = right.slot(PlaceholderRole.BODY).orElseThrow().getAnchor();
        assertTrue(rightBody.getMaxX() <= rightPicture.getX());
        assertEquals(rightBody.getY(), rightPicture.getY(), 0.5);
    }

    @Test
    @DisplayName("Should omit layouts the template does not provide")
    public void testPartialTemplate() {
        TemplateCatalog catalog = TestFixtures.catalog(EnumSet.of(SlideKind.TITLE, SlideKind.CONTENT_ONLY));

        assertTrue(catalog.resolve(SlideKind.CONTENT_ONLY).isPresent());
        assertTrue(catalog.resolve(SlideKind.TABLE).isEmpty());
        assertTrue(catalog.resolve(SlideKind.CHART).isEmpty());
    }

    @Test
    @DisplayName("Should fail when the content layout is missing")
    public void testMissingContentLayout() {
        TemplateCatalogException e = assertThrows(TemplateCatalogException.class,
                () -> TestFixtures.catalog(EnumSet.complementOf(EnumSet.of(SlideKind.CONTENT_ONLY))));
        assertEquals("MISSING_REQUIRED_LAYOUT", e.getCode());
    }

    @Test
    @DisplayName("Should fail on bytes that are not a presentation")
    public void testUnreadableTemplate() {
        TemplateCatalogException e = assertThrows(TemplateCatalogException.class,
                () -> new TemplateCatalogBuilder().build("broken.pptx", "not a zip".getBytes()));
        assertEquals("TEMPLATE_PARSE_ERROR", e.getCode());
    }

    @Test
    @DisplayName("Should check out independent working copies without template slides")
    public void testCheckoutIsIsolated() {
        TemplateCatalog catalog = TestFixtures.builtinCatalog();
        LayoutHandle content = catalog.resolve(SlideKind.CONTENT_ONLY).orElseThrow();

        try (WorkingCopy first = catalog.checkout(); WorkingCopy second = catalog.checkout()) {
            assertTrue(first.getSlideShow().getSlides().isEmpty());
            XSLFSlide slide = first.appendSlide(content);

            assertNotNull(slide);
            assertEquals(1, first.getSlideShow().getSlides().size());
            assertEquals(0, second.getSlideShow().getSlides().size());
            assertEquals(content.getSlots().size(), PlaceholderScanner.contentPlaceholders(slide).size());
        }
    }
}
