package com.example.demo.deckgen.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Kinds of slide a deck may declare. Each kind maps to one layout name in
 * the template and one identifier in the JSON input.
 */
public enum SlideKind {
    TITLE("Title Slide", "title"),
    CONTENT_ONLY("Content Only", "content_only"),
    IMAGE_RIGHT("Image Right", "image_right"),
    IMAGE_LEFT("Image Left", "image_left"),
    IMAGE_FULL("Image Full", "image_full"),
    TABLE("Table", "table"),
    CHART("Chart", "chart"),
    TWO_COLUMNS("Two Columns", "two_columns");

    private final String layoutName;
    private final String jsonName;

    SlideKind(String layoutName, String jsonName) {
        this.layoutName = layoutName;
        this.jsonName = jsonName;
    }

    public String getLayoutName() {
        return layoutName;
    }

    public String getJsonName() {
        return jsonName;
    }

    public boolean isImageKind() {
        return this == IMAGE_RIGHT || this == IMAGE_LEFT || this == IMAGE_FULL;
    }

    /**
     * Case-insensitive, whitespace-normalized match of a template layout name.
     */
    public static Optional<SlideKind> fromLayoutName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = normalize(name);
        return Arrays.stream(values())
                .filter(k -> normalize(k.layoutName).equals(normalized))
                .findFirst();
    }

    /**
     * Match an input identifier such as "image_right" or "Image Right".
     */
    public static Optional<SlideKind> fromJsonName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT).replace('-', '_').replaceAll("\\s+", "_");
        return Arrays.stream(values())
                .filter(k -> k.jsonName.equals(normalized))
                .findFirst();
    }

    static String normalize(String name) {
        return name.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }
}
