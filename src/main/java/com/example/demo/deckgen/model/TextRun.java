package com.example.demo.deckgen.model;

import com.example.demo.deckgen.exception.SchemaValidationException;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@EqualsAndHashCode
public class TextRun {
    private final String text;
    private final TextFormatting formatting;
    private final String hyperlink;

    @Builder
    public TextRun(String text, TextFormatting formatting, String hyperlink) {
        if (text == null) {
            throw new SchemaValidationException("Text run requires text");
        }
        this.text = text;
        this.formatting = formatting;
        this.hyperlink = hyperlink == null || hyperlink.isBlank() ? null : hyperlink;
    }

    public static TextRun plain(String text) {
        return new TextRun(text, null, null);
    }
}
