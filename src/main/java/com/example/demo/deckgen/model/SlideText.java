package com.example.demo.deckgen.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * A text body: one paragraph of runs followed by bullet points. Either part
 * may be empty.
 */
@Getter
@ToString
@EqualsAndHashCode
public class SlideText {
    private static final SlideText EMPTY = new SlideText(List.of(), List.of());

    private final List<TextRun> runs;
    private final List<BulletPoint> bullets;

    public SlideText(List<TextRun> runs, List<BulletPoint> bullets) {
        this.runs = runs == null ? List.of() : List.copyOf(runs);
        this.bullets = bullets == null ? List.of() : List.copyOf(bullets);
    }

    public static SlideText empty() {
        return EMPTY;
    }

    public static SlideText of(String paragraph) {
        return paragraph == null || paragraph.isEmpty() ? EMPTY : new SlideText(List.of(TextRun.plain(paragraph)), List.of());
    }

    public static SlideText ofBullets(List<BulletPoint> bullets) {
        return new SlideText(List.of(), bullets);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return runs.isEmpty() && bullets.isEmpty();
    }

    /**
     * Characters the body will occupy, used for auto-fit budgeting.
     */
    public int length() {
        int total = 0;
        for (TextRun run : runs) {
            total += run.getText().length();
        }
        for (BulletPoint bullet : bullets) {
            total += bullet.getText().length();
        }
        return total;
    }
}
