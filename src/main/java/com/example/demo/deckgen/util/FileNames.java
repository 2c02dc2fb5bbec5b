package com.example.demo.deckgen.util;

import java.util.Locale;

/**
 * Output file name handling.
 */
public final class FileNames {
    public static final String EXTENSION = ".pptx";
    private static final String DEFAULT_NAME = "presentation";

    private FileNames() {
    }

    /**
     * Keep letters, digits, space, '-', '_' and '.'; fall back to the deck
     * title, then to "presentation"; always end in ".pptx".
     */
    public static String sanitize(String requested, String deckTitle) {
        String name = clean(requested);
        if (name.isEmpty()) {
            name = clean(deckTitle);
        }
        if (name.isEmpty()) {
            name = DEFAULT_NAME;
        }
        if (!name.toLowerCase(Locale.ROOT).endsWith(EXTENSION)) {
            name = name + EXTENSION;
        }
        return name;
    }

    private static String clean(String value) {
        if (value == null) {
            return "";
        }
        StringBuilder kept = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (Character.isLetterOrDigit(c) || c == ' ' || c == '-' || c == '_' || c == '.') {
                kept.append(c);
            }
        }
        String result = kept.toString().trim();
        // names made only of dots are not file names
        return result.replace(".", "").isEmpty() ? "" : result;
    }
}
