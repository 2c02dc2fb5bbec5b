package com.example.demo.deckgen.catalog;

/**
 * Semantic role of a placeholder, assigned once when the catalog is built.
 * Render-time code only ever asks for a slot by role.
 */
public enum PlaceholderRole {
    TITLE,
    BODY,
    PICTURE,
    TABLE,
    CHART,
    COLUMN_LEFT,
    COLUMN_RIGHT;

    public boolean isText() {
        return this == TITLE || this == BODY || this == COLUMN_LEFT || this == COLUMN_RIGHT;
    }
}
