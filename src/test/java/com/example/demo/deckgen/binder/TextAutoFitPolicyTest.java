package com.example.demo.deckgen.binder;

import com.example.demo.deckgen.TestFixtures;
import com.example.demo.deckgen.config.DeckgenProperties;
import com.example.demo.deckgen.model.BulletPoint;
import com.example.demo.deckgen.model.SlideText;
import com.example.demo.deckgen.model.TextRun;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Text auto-fit")
public class TextAutoFitPolicyTest {

    private final TextAutoFitPolicy policy = new TextAutoFitPolicy(TestFixtures.properties());

    @Test
    @DisplayName("Should leave text within budget untouched")
    public void testFitsAtFullSize() {
        AutoFitResult fit = policy.plan(400, 500);

        assertEquals(1.0, fit.getScale(), 1e-9);
        assertFalse(fit.isTruncated());
        assertEquals(400, fit.getMaxChars());
    }

    @Test
    @DisplayName("Should step the scale down until the text fits")
    public void testShrinks() {
        assertEquals(0.9, policy.plan(600, 500).getScale(), 1e-9);
        assertEquals(0.7, policy.plan(1000, 500).getScale(), 1e-9);

        AutoFitResult atFloor = policy.plan(2000, 500);
        assertEquals(0.5, atFloor.getScale(), 1e-9);
        assertFalse(atFloor.isTruncated());
    }

    @Test
    @DisplayName("Should truncate at the floor capacity with the ellipsis counted")
    public void testTruncatesPastFloor() {
        AutoFitResult fit = policy.plan(10_000, 500);

        assertEquals(0.5, fit.getScale(), 1e-9);
        assertTrue(fit.isTruncated());
        assertEquals(2000, fit.getMaxChars());

        String cut = policy.truncate("x".repeat(10_000), fit);
        assertEquals(2000, cut.length());
        assertTrue(cut.endsWith("…"));
    }

    @Test
    @DisplayName("Should cut runs before bullets and drop what follows the cut")
    public void testTruncateSlideText() {
        SlideText body = new SlideText(
                List.of(TextRun.plain("abcdef")),
                List.of(BulletPoint.of("ghij"), BulletPoint.of("klmnop")));

        SlideText cut = policy.truncate(body, new AutoFitResult(0.5, 9, true));

        assertEquals("abcdef", cut.getRuns().get(0).getText());
        assertEquals(1, cut.getBullets().size());
        assertEquals("gh…", cut.getBullets().get(0).getText());
        assertEquals(9, cut.length());
    }

    @Test
    @DisplayName("Should not split an emoji when truncating")
    public void testTruncateKeepsSurrogatePairs() {
        String emojis = "\uD83D\uDE00".repeat(5_000);
        AutoFitResult fit = policy.plan(emojis.length(), 500);

        String cut = policy.truncate(emojis, fit);

        assertTrue(cut.endsWith("…"));
        String kept = cut.substring(0, cut.length() - 1);
        assertEquals(1998, kept.length());
        assertEquals(kept.length() / 2, kept.codePointCount(0, kept.length()));
        assertFalse(Character.isHighSurrogate(kept.charAt(kept.length() - 1)));
    }

    @Test
    @DisplayName("Should not split an emoji inside a run or bullet")
    public void testTruncateSlideTextKeepsSurrogatePairs() {
        SlideText body = new SlideText(
                List.of(TextRun.plain("ab\uD83D\uDE00\uD83D\uDE00")),
                List.of(BulletPoint.of("later")));

        SlideText cut = policy.truncate(body, new AutoFitResult(0.5, 4, true));

        assertEquals("ab…", cut.getRuns().get(0).getText());
        assertTrue(cut.getBullets().isEmpty());
    }

    @Test
    @DisplayName("Should truncate at full size instead of looping when the scale step is not positive")
    public void testNonPositiveStep() {
        DeckgenProperties properties = TestFixtures.properties();
        properties.getText().setScaleStep(0);
        TextAutoFitPolicy fixed = new TextAutoFitPolicy(properties);

        AutoFitResult fit = assertTimeoutPreemptively(Duration.ofSeconds(2), () -> fixed.plan(10_000, 500));

        assertEquals(1.0, fit.getScale(), 1e-9);
        assertTrue(fit.isTruncated());
        assertEquals(500, fit.getMaxChars());
    }
}
