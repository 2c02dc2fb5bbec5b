package com.example.demo.deckgen.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Output file names")
public class FileNamesTest {

    @Test
    @DisplayName("Should strip unsafe characters and append the extension")
    public void testSanitize() {
        assertEquals("Q3 review-final.pptx", FileNames.sanitize("Q3 review-final", null));
        assertEquals("report.pptx", FileNames.sanitize("<report>", null));
        assertEquals("deck.PPTX", FileNames.sanitize("deck.PPTX", null));
        assertEquals("etcpasswd.pptx", FileNames.sanitize("/etc/passwd", null));
    }

    @Test
    @DisplayName("Should fall back to the deck title, then to a default name")
    public void testFallbacks() {
        assertEquals("Roadmap 2025.pptx", FileNames.sanitize(null, "Roadmap 2025"));
        assertEquals("Roadmap.pptx", FileNames.sanitize("???", "Roadmap!"));
        assertEquals("presentation.pptx", FileNames.sanitize("..", "***"));
        assertEquals("presentation.pptx", FileNames.sanitize("", null));
    }
}
