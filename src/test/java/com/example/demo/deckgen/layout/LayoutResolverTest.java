package com.example.demo.deckgen.layout;

import com.example.demo.deckgen.TestFixtures;
import com.example.demo.deckgen.catalog.TemplateCatalog;
import com.example.demo.deckgen.model.ContentSlide;
import com.example.demo.deckgen.model.SlideKind;
import com.example.demo.deckgen.model.SlideText;
import com.example.demo.deckgen.model.TableSlide;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Layout resolution")
public class LayoutResolverTest {

    private final TableSlide table = new TableSlide("Costs", List.of("Item", "Cost"), List.of(List.of("Rent", "100")), null);

    @Test
    @DisplayName("Should use the exact layout when the template has it")
    public void testExactMatch() {
        LayoutResolver resolver = new LayoutResolver(TestFixtures.builtinCatalog());

        ResolvedLayout resolved = resolver.resolve(table);

        assertFalse(resolved.isDegraded());
        assertEquals(SlideKind.TABLE, resolved.getLayout().getKind());
    }

    @Test
    @DisplayName("Should fall back to the content layout and mark the slide degraded")
    public void testDegradedFallback() {
        TemplateCatalog catalog = TestFixtures.catalog(EnumSet.of(SlideKind.TITLE, SlideKind.CONTENT_ONLY));
        LayoutResolver resolver = new LayoutResolver(catalog);

        ResolvedLayout resolved = resolver.resolve(table);

        assertTrue(resolved.isDegraded());
        assertEquals(SlideKind.TABLE, resolved.getRequestedKind());
        assertEquals(SlideKind.CONTENT_ONLY, resolved.getLayout().getKind());
        assertEquals("Content Only", resolved.getLayout().getLayoutName());

        ResolvedLayout content = resolver.resolve(new ContentSlide("Notes", SlideText.of("text")));
        assertFalse(content.isDegraded());
    }
}
