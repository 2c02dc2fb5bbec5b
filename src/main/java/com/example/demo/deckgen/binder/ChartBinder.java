package com.example.demo.deckgen.binder;

import com.example.demo.deckgen.assembly.SlidePlan;
import com.example.demo.deckgen.catalog.PlaceholderRole;
import com.example.demo.deckgen.exception.ChartDataMismatchException;
import com.example.demo.deckgen.model.ChartSeries;
import com.example.demo.deckgen.model.ChartSlide;
import com.example.demo.deckgen.model.SlideSpec;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.util.CellRangeAddress;
import org.apache.poi.util.Units;
import org.apache.poi.xddf.usermodel.chart.AxisCrossBetween;
import org.apache.poi.xddf.usermodel.chart.AxisCrosses;
import org.apache.poi.xddf.usermodel.chart.AxisPosition;
import org.apache.poi.xddf.usermodel.chart.BarDirection;
import org.apache.poi.xddf.usermodel.chart.BarGrouping;
import org.apache.poi.xddf.usermodel.chart.ChartTypes;
import org.apache.poi.xddf.usermodel.chart.LegendPosition;
import org.apache.poi.xddf.usermodel.chart.XDDFBarChartData;
import org.apache.poi.xddf.usermodel.chart.XDDFCategoryAxis;
import org.apache.poi.xddf.usermodel.chart.XDDFChartData;
import org.apache.poi.xddf.usermodel.chart.XDDFDataSource;
import org.apache.poi.xddf.usermodel.chart.XDDFDataSourcesFactory;
import org.apache.poi.xddf.usermodel.chart.XDDFLineChartData;
import org.apache.poi.xddf.usermodel.chart.XDDFNumericalDataSource;
import org.apache.poi.xddf.usermodel.chart.XDDFValueAxis;
import org.apache.poi.xslf.usermodel.XSLFChart;
import org.apache.poi.xslf.usermodel.XSLFSlide;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.awt.geom.Rectangle2D;
import java.util.List;

/**
 * Renders chart slides as native charts with an embedded data workbook:
 * categories in the first column, one column per series.
 */
@Slf4j
@Component
@Order(10)
public class ChartBinder implements ContentBinder {

    @Override
    public boolean supports(SlideSpec slide) {
        return slide instanceof ChartSlide;
    }

    @Override
    public void bind(SlideCanvas canvas, SlidePlan plan) {
        ChartSlide slide = (ChartSlide) plan.getSlide();
        verify(slide);

        Rectangle2D region = canvas.takeRegion(PlaceholderRole.CHART);
        XSLFSlide target = canvas.getSlide();
        XSLFChart chart = target.getSlideShow().createChart();
        target.addChart(chart, new Rectangle2D.Double(
                Units.toEMU(region.getX()), Units.toEMU(region.getY()),
                Units.toEMU(region.getWidth()), Units.toEMU(region.getHeight())));

        List<String> categories = slide.getCategories();
        int last = categories.size();
        XDDFDataSource<String> categoryData = XDDFDataSourcesFactory.fromArray(
                categories.toArray(new String[0]), chart.formatRange(new CellRangeAddress(1, last, 0, 0)), 0);

        XDDFChartData data = createData(chart, slide);
        for (int i = 0; i < slide.getSeries().size(); i++) {
            ChartSeries series = slide.getSeries().get(i);
            int column = i + 1;
            XDDFNumericalDataSource<Double> values = XDDFDataSourcesFactory.fromArray(
                    series.getValues().toArray(new Double[0]),
                    chart.formatRange(new CellRangeAddress(1, last, column, column)), column);
            XDDFChartData.Series added = data.addSeries(categoryData, values);
            added.setTitle(series.getName(), chart.setSheetTitle(series.getName(), column));
        }
        chart.plot(data);
        chart.setAutoTitleDeleted(true);
        chart.getOrAddLegend().setPosition(LegendPosition.BOTTOM);
        log.debug("{} chart bound with {} series over {} categories", slide.getChartType(), slide.getSeries().size(), last);
    }

    private XDDFChartData createData(XSLFChart chart, ChartSlide slide) {
        switch (slide.getChartType()) {
            case PIE: {
                XDDFChartData pie = chart.createData(ChartTypes.PIE, null, null);
                pie.setVaryColors(true);
                return pie;
            }
            case LINE: {
                XDDFCategoryAxis bottom = chart.createCategoryAxis(AxisPosition.BOTTOM);
                XDDFValueAxis left = valueAxis(chart);
                XDDFLineChartData line = (XDDFLineChartData) chart.createData(ChartTypes.LINE, bottom, left);
                line.setVaryColors(false);
                return line;
            }
            case BAR:
            default: {
                XDDFCategoryAxis bottom = chart.createCategoryAxis(AxisPosition.BOTTOM);
                XDDFValueAxis left = valueAxis(chart);
                XDDFBarChartData bar = (XDDFBarChartData) chart.createData(ChartTypes.BAR, bottom, left);
                bar.setBarDirection(BarDirection.COL);
                bar.setBarGrouping(BarGrouping.CLUSTERED);
                bar.setVaryColors(false);
                return bar;
            }
        }
    }

    private static XDDFValueAxis valueAxis(XSLFChart chart) {
        XDDFValueAxis axis = chart.createValueAxis(AxisPosition.LEFT);
        axis.setCrosses(AxisCrosses.AUTO_ZERO);
        axis.setCrossBetween(AxisCrossBetween.BETWEEN);
        return axis;
    }

    /**
     * Series lengths are validated when the slide is built; this guards
     * against slides constructed around that check.
     */
    void verify(ChartSlide slide) {
        int expected = slide.getCategories().size();
        for (ChartSeries series : slide.getSeries()) {
            if (series.getValues().size() != expected) {
                throw new ChartDataMismatchException("Series '" + series.getName() + "' has "
                        + series.getValues().size() + " values for " + expected + " categories");
            }
        }
    }
}
