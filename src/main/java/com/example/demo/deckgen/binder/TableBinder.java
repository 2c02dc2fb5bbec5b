package com.example.demo.deckgen.binder;

import com.example.demo.deckgen.assembly.SlidePlan;
import com.example.demo.deckgen.catalog.PlaceholderRole;
import com.example.demo.deckgen.config.DeckgenProperties;
import com.example.demo.deckgen.model.SlideSpec;
import com.example.demo.deckgen.model.TableSlide;
import com.example.demo.deckgen.model.TableStyle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.sl.usermodel.TableCell.BorderEdge;
import org.apache.poi.xslf.usermodel.XSLFTable;
import org.apache.poi.xslf.usermodel.XSLFTableCell;
import org.apache.poi.xslf.usermodel.XSLFTextRun;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.awt.Color;
import java.awt.geom.Rectangle2D;
import java.util.List;

/**
 * Renders a table slide as a native table.
 *
 * With a table placeholder the grid is scaled into the placeholder's box;
 * otherwise it starts at the top of the content area and grows downward at
 * the configured row height. The header row is always bold and filled.
 */
@Slf4j
@Component
@Order(10)
@RequiredArgsConstructor
public class TableBinder implements ContentBinder {
    private static final double FONT_TO_ROW = 0.5;
    private static final BorderEdge[] EDGES = {BorderEdge.top, BorderEdge.bottom, BorderEdge.left, BorderEdge.right};

    private final DeckgenProperties properties;

    @Override
    public boolean supports(SlideSpec slide) {
        return slide instanceof TableSlide;
    }

    @Override
    public void bind(SlideCanvas canvas, SlidePlan plan) {
        TableSlide slide = (TableSlide) plan.getSlide();
        DeckgenProperties.Table config = properties.getTable();
        int rowCount = slide.getRows().size() + 1;
        int columnCount = slide.getColumnCount();

        boolean fixed = canvas.exposes(PlaceholderRole.TABLE);
        Rectangle2D region = canvas.takeRegion(PlaceholderRole.TABLE);
        double rowHeight = fixed ? Math.min(config.getRowHeight(), region.getHeight() / rowCount) : config.getRowHeight();
        double fontSize = clamp(rowHeight * FONT_TO_ROW, config.getMinFontSize(), config.getMaxFontSize());
        double columnWidth = region.getWidth() / columnCount;

        XSLFTable table = canvas.getSlide().createTable(rowCount, columnCount);
        table.setAnchor(new Rectangle2D.Double(region.getX(), region.getY(), region.getWidth(), rowHeight * rowCount));
        for (int c = 0; c < columnCount; c++) {
            table.setColumnWidth(c, columnWidth);
        }
        for (int r = 0; r < rowCount; r++) {
            table.setRowHeight(r, rowHeight);
        }

        Color border = Color.decode(config.getBorderColor());
        writeRow(table, 0, slide.getHeader(), fontSize, border);
        styleHeader(table, columnCount, slide.getStyle(), config);
        for (int r = 0; r < slide.getRows().size(); r++) {
            writeRow(table, r + 1, slide.getRows().get(r), fontSize, border);
        }
        log.debug("Table {}x{} bound {} at row height {}", rowCount, columnCount,
                fixed ? "into placeholder" : "into free area", rowHeight);
    }

    private void writeRow(XSLFTable table, int row, List<String> values, double fontSize, Color border) {
        for (int c = 0; c < values.size(); c++) {
            XSLFTableCell cell = table.getCell(row, c);
            XSLFTextRun run = cell.setText(values.get(c) == null ? "" : values.get(c));
            run.setFontSize(fontSize);
            for (BorderEdge edge : EDGES) {
                cell.setBorderColor(edge, border);
                cell.setBorderWidth(edge, 1.0);
            }
        }
    }

    private void styleHeader(XSLFTable table, int columnCount, TableStyle style, DeckgenProperties.Table config) {
        boolean colored = style == TableStyle.HEADER_COLORED;
        Color fill = Color.decode(colored ? config.getHeaderColoredFill() : config.getHeaderFill());
        for (int c = 0; c < columnCount; c++) {
            XSLFTableCell cell = table.getCell(0, c);
            cell.setFillColor(fill);
            cell.getTextParagraphs().forEach(p -> p.getTextRuns().forEach(run -> {
                run.setBold(true);
                if (colored) {
                    run.setFontColor(Color.decode(config.getHeaderColoredText()));
                }
            }));
        }
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
