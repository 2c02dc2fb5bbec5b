package com.example.demo.deckgen.model;

import com.example.demo.deckgen.exception.SchemaValidationException;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * Table slide: a header row and body rows, all of the header's width.
 */
@Getter
@ToString
public class TableSlide extends SlideSpec {
    private final List<String> header;
    private final List<List<String>> rows;
    private final TableStyle style;

    @Builder
    public TableSlide(String title, List<String> header, List<List<String>> rows, TableStyle style) {
        super(SlideKind.TABLE, title);
        if (header == null || header.isEmpty()) {
            throw new SchemaValidationException("Table requires at least one header cell");
        }
        if (rows == null || rows.isEmpty()) {
            throw new SchemaValidationException("Table requires at least one row");
        }
        List<List<String>> copy = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            List<String> row = rows.get(i);
            if (row == null || row.size() != header.size()) {
                throw new SchemaValidationException("Table row " + i + " has " + (row == null ? 0 : row.size())
                        + " cells, expected " + header.size());
            }
            copy.add(List.copyOf(row));
        }
        this.header = List.copyOf(header);
        this.rows = List.copyOf(copy);
        this.style = style == null ? TableStyle.PLAIN : style;
    }

    public int getColumnCount() {
        return header.size();
    }
}
