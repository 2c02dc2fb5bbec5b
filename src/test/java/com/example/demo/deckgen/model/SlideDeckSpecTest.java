package com.example.demo.deckgen.model;

import com.example.demo.deckgen.exception.SchemaValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Deck model validation")
public class SlideDeckSpecTest {

    private static SlideSpec content(String title) {
        return new ContentSlide(title, SlideText.of("Body of " + title));
    }

    @Test
    @DisplayName("Should accept a consistent deck and default the language")
    public void testValidDeck() {
        SlideDeckSpec deck = SlideDeckSpec.builder()
                .title("Review")
                .slides(List.of(new TitleSlide("Review", "Q3"), content("Numbers")))
                .build();

        assertEquals(2, deck.getSlideCount());
        assertEquals("en", deck.getLanguage());
        assertEquals(SlideKind.TITLE, deck.getSlides().get(0).getKind());
    }

    @Test
    @DisplayName("Should reject a declared slide count that disagrees with the list")
    public void testSlideCountMismatch() {
        SchemaValidationException e = assertThrows(SchemaValidationException.class, () -> SlideDeckSpec.builder()
                .slideCount(3)
                .slides(List.of(content("One"), content("Two")))
                .build());
        assertNull(e.getSlideIndex());
        assertTrue(e.getReason().contains("slideCount 3"));
    }

    @Test
    @DisplayName("Should reject an empty deck and report missing slides by index")
    public void testEmptyAndNullSlides() {
        assertThrows(SchemaValidationException.class, () -> SlideDeckSpec.builder().slides(List.of()).build());

        SchemaValidationException e = assertThrows(SchemaValidationException.class,
                () -> SlideDeckSpec.builder().slides(Arrays.asList(content("One"), null)).build());
        assertEquals(1, e.getSlideIndex());
    }

    @Test
    @DisplayName("Should reject ragged table rows")
    public void testRaggedTable() {
        SchemaValidationException e = assertThrows(SchemaValidationException.class, () -> new TableSlide("Costs",
                List.of("Item", "Cost"),
                List.of(List.of("Rent", "100"), List.of("Power")),
                null));
        assertTrue(e.getReason().contains("row 1"));
    }

    @Test
    @DisplayName("Should reject chart series whose length differs from the categories")
    public void testChartSeriesMismatch() {
        assertThrows(SchemaValidationException.class, () -> new ChartSlide("Sales", ChartType.BAR,
                List.of("Q1", "Q2", "Q3"),
                List.of(new ChartSeries("2024", List.of(1.0, 2.0)))));
    }

    @Test
    @DisplayName("Should default a chart to bar and a table to the plain style")
    public void testDefaults() {
        ChartSlide chart = new ChartSlide("Sales", null, List.of("Q1"), List.of(new ChartSeries("2024", List.of(1.0))));
        TableSlide table = new TableSlide("Costs", List.of("Item"), List.of(List.of("Rent")), null);

        assertEquals(ChartType.BAR, chart.getChartType());
        assertEquals(TableStyle.PLAIN, table.getStyle());
        assertEquals(1, table.getColumnCount());
    }

    @Test
    @DisplayName("Should enforce title, bullet level and color constraints")
    public void testFieldConstraints() {
        assertThrows(SchemaValidationException.class, () -> content(" "));
        assertThrows(SchemaValidationException.class, () -> content("x".repeat(SlideSpec.MAX_TITLE_LENGTH + 1)));
        assertThrows(SchemaValidationException.class, () -> new BulletPoint("deep", 6, null));
        assertThrows(SchemaValidationException.class, () -> TextFormatting.builder().color("red").build());
        assertThrows(SchemaValidationException.class, () -> new ContentSlide("Empty", SlideText.empty()));
        assertThrows(SchemaValidationException.class, () -> new TwoColumnsSlide("Empty", List.of(), List.of()));

        assertEquals("#FF0000", TextFormatting.builder().color("FF0000").build().getColor());
    }

    @Test
    @DisplayName("Should only allow image kinds on image slides")
    public void testImageSlideKind() {
        ImageDescriptor image = new ImageDescriptor("mountains", "classpath:images/placeholder.png");
        assertThrows(SchemaValidationException.class, () -> new ImageSlide(SlideKind.TABLE, "Wrong", image, null));

        ImageSlide slide = new ImageSlide(SlideKind.IMAGE_LEFT, "Right", image, null);
        assertTrue(slide.getBody().isEmpty());
    }

    @Test
    @DisplayName("Should match layout names ignoring case and extra whitespace")
    public void testLayoutNameMatching() {
        assertEquals(SlideKind.TWO_COLUMNS, SlideKind.fromLayoutName("  two   COLUMNS ").orElseThrow());
        assertEquals(SlideKind.IMAGE_RIGHT, SlideKind.fromJsonName("Image-Right").orElseThrow());
        assertTrue(SlideKind.fromLayoutName("Comparison").isEmpty());
    }
}
