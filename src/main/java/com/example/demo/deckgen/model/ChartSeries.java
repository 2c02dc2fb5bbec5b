package com.example.demo.deckgen.model;

import com.example.demo.deckgen.exception.SchemaValidationException;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

@Getter
@ToString
@EqualsAndHashCode
public class ChartSeries {
    private final String name;
    private final List<Double> values;

    public ChartSeries(String name, List<Double> values) {
        if (name == null || name.isBlank()) {
            throw new SchemaValidationException("Chart series requires a name");
        }
        if (values == null) {
            throw new SchemaValidationException("Chart series '" + name + "' requires values");
        }
        for (Double value : values) {
            if (value == null || value.isNaN() || value.isInfinite()) {
                throw new SchemaValidationException("Chart series '" + name + "' contains a non-finite value");
            }
        }
        this.name = name;
        this.values = List.copyOf(values);
    }
}
