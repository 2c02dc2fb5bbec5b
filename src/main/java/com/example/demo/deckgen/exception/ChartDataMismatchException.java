package com.example.demo.deckgen.exception;

public class ChartDataMismatchException extends DeckGenerationException {
    public static final String CODE = "CHART_DATA_MISMATCH";

    public ChartDataMismatchException(String description) {
        super(CODE, description);
    }
}
