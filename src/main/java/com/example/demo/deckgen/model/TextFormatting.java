package com.example.demo.deckgen.model;

import com.example.demo.deckgen.exception.SchemaValidationException;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.regex.Pattern;

/**
 * Character formatting applied to a run or bullet.
 */
@Getter
@ToString
@EqualsAndHashCode
public class TextFormatting {
    private static final Pattern HEX_COLOR = Pattern.compile("#?[0-9a-fA-F]{6}");

    private final boolean bold;
    private final boolean italic;
    /** Hex color, "#RRGGBB". */
    private final String color;
    /** Font size in points. */
    private final Double size;

    @Builder
    public TextFormatting(boolean bold, boolean italic, String color, Double size) {
        if (color != null && !HEX_COLOR.matcher(color).matches()) {
            throw new SchemaValidationException("Invalid color '" + color + "', expected #RRGGBB");
        }
        if (size != null && (size <= 0 || size.isNaN() || size.isInfinite())) {
            throw new SchemaValidationException("Font size must be positive, got " + size);
        }
        this.bold = bold;
        this.italic = italic;
        this.color = color == null ? null : (color.startsWith("#") ? color : "#" + color);
        this.size = size;
    }
}
