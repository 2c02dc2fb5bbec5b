package com.example.demo.deckgen.model;

import com.example.demo.deckgen.exception.SchemaValidationException;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Category chart. Every series has exactly one value per category.
 */
@Getter
@ToString
public class ChartSlide extends SlideSpec {
    private final ChartType chartType;
    private final List<String> categories;
    private final List<ChartSeries> series;

    @Builder
    public ChartSlide(String title, ChartType chartType, List<String> categories, List<ChartSeries> series) {
        super(SlideKind.CHART, title);
        if (categories == null || categories.isEmpty()) {
            throw new SchemaValidationException("Chart requires at least one category");
        }
        if (series == null || series.isEmpty()) {
            throw new SchemaValidationException("Chart requires at least one series");
        }
        for (ChartSeries s : series) {
            if (s.getValues().size() != categories.size()) {
                throw new SchemaValidationException("Chart series '" + s.getName() + "' has " + s.getValues().size()
                        + " values, expected " + categories.size());
            }
        }
        this.chartType = chartType == null ? ChartType.BAR : chartType;
        this.categories = List.copyOf(categories);
        this.series = List.copyOf(series);
    }
}
