package com.reflectionplatform.correlation.align;

import com.reflectionplatform.correlation.catalog.MetricCatalog;
import com.reflectionplatform.correlation.model.DataMetric;
import com.reflectionplatform.correlation.model.DataPoint;
import com.reflectionplatform.correlation.model.DateRange;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Inner join of two daily metrics over a date range, with an optional day shift on
 * the Y side.
 *
 * <p>For every day {@code d} in the range the X value of {@code d} is paired with the
 * Y value of {@code d + lag}. A day is kept only when both values exist. Missing days
 * are skipped; nothing is interpolated. Output is in ascending date order.
 *
 * <p>Short output is not an error. Callers decide whether enough samples remain.
 */
public class SeriesAligner {

    private final MetricCatalog catalog;

    public SeriesAligner(MetricCatalog catalog) {
        this.catalog = catalog;
    }

    public List<DataPoint> align(DataMetric metricX, DataMetric metricY, DateRange range) {
        return align(metricX, metricY, range, 0);
    }

    public List<DataPoint> align(DataMetric metricX, DataMetric metricY, DateRange range, int lag) {
        if (range.isEmpty()) return List.of();

        List<DataPoint> points = new ArrayList<>();
        Iterator<LocalDate> days = range.days().iterator();
        while (days.hasNext()) {
            LocalDate day = days.next();
            OptionalDouble x = catalog.valueFor(metricX, day);
            if (x.isEmpty()) continue;
            OptionalDouble y = catalog.valueFor(metricY, day.plusDays(lag));
            if (y.isEmpty()) continue;
            points.add(new DataPoint(day, x.getAsDouble(), y.getAsDouble()));
        }
        return points;
    }
}
