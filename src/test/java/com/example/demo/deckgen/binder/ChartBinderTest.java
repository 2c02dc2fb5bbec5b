package com.example.demo.deckgen.binder;

import com.example.demo.deckgen.exception.ChartDataMismatchException;
import com.example.demo.deckgen.model.ChartSeries;
import com.example.demo.deckgen.model.ChartSlide;
import com.example.demo.deckgen.model.ChartType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("Chart binder")
public class ChartBinderTest {

    private final ChartBinder binder = new ChartBinder();

    @Test
    @DisplayName("Should reject series that bypassed model validation")
    public void testMismatchedSeries() {
        ChartSlide slide = mock(ChartSlide.class);
        when(slide.getCategories()).thenReturn(List.of("Q1", "Q2"));
        when(slide.getSeries()).thenReturn(List.of(new ChartSeries("2024", List.of(1.0))));

        ChartDataMismatchException e = assertThrows(ChartDataMismatchException.class, () -> binder.verify(slide));
        assertEquals(ChartDataMismatchException.CODE, e.getCode());
    }

    @Test
    @DisplayName("Should accept consistent series")
    public void testConsistentSeries() {
        ChartSlide slide = new ChartSlide("Sales", ChartType.LINE, List.of("Q1", "Q2"),
                List.of(new ChartSeries("2024", List.of(1.0, 2.0)), new ChartSeries("2025", List.of(3.0, 4.0))));

        assertDoesNotThrow(() -> binder.verify(slide));
        assertTrue(binder.supports(slide));
    }
}
