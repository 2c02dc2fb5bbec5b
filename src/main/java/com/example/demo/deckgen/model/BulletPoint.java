package com.example.demo.deckgen.model;

import com.example.demo.deckgen.exception.SchemaValidationException;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@EqualsAndHashCode
public class BulletPoint {
    public static final int MAX_LEVEL = 5;

    private final String text;
    /** Indentation level, 0 to 5. */
    private final int level;
    private final TextFormatting formatting;

    @Builder
    public BulletPoint(String text, int level, TextFormatting formatting) {
        if (text == null) {
            throw new SchemaValidationException("Bullet point requires text");
        }
        if (level < 0 || level > MAX_LEVEL) {
            throw new SchemaValidationException("Bullet level must be between 0 and " + MAX_LEVEL + ", got " + level);
        }
        this.text = text;
        this.level = level;
        this.formatting = formatting;
    }

    public static BulletPoint of(String text) {
        return new BulletPoint(text, 0, null);
    }
}
