package com.volarb.timeseries;

import com.volarb.exception.IndexOutOfRangeException;
import com.volarb.exception.InsufficientDataException;
import com.volarb.exception.ValidationException;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.ToDoubleFunction;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

/**
 * Named series of (timestamp, value) points kept in timestamp order.
 *
 * <p>{@link #put} appends or overwrites: writing a timestamp that already exists replaces its
 * value. Derived series ({@link #pctChange}, {@link #logReturns}, {@link #diff}) drop the first
 * point instead of carrying a NaN, so they are one point shorter than the source.
 *
 * <p>Statistics need at least 1 (mean), 2 (variance, std), 3 (skewness) or 4 (kurtosis) points
 * and fail with {@link InsufficientDataException} below that.
 */
public class TimeSeries {

    private final String name;
    private final TreeMap<LocalDateTime, Double> points = new TreeMap<>();

    /** Positional view of the keys, rebuilt lazily after a write. */
    private List<LocalDateTime> indexedTimestamps;

    public TimeSeries(String name) {
        this.name = name;
    }

    public TimeSeries(String name, List<LocalDateTime> timestamps, List<Double> values) {
        this(name);
        if (timestamps.size() != values.size()) {
            throw new ValidationException(String.format(
                    "Timestamps (%d) and values (%d) must have the same size", timestamps.size(), values.size()));
        }
        for (int i = 0; i < timestamps.size(); i++) {
            put(timestamps.get(i), values.get(i));
        }
    }

    public TimeSeries copy() {
        TimeSeries copy = new TimeSeries(name);
        copy.points.putAll(points);
        return copy;
    }

    public String getName() {
        return name;
    }

    public void put(LocalDateTime timestamp, double value) {
        if (points.put(timestamp, value) == null) {
            indexedTimestamps = null;
        }
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public List<LocalDateTime> getTimestamps() {
        return new ArrayList<>(points.keySet());
    }

    public List<Double> getValues() {
        return new ArrayList<>(points.values());
    }

    public double[] toArray() {
        return points.values().stream().mapToDouble(Double::doubleValue).toArray();
    }

    /** Read-only (timestamp, value) entries in timestamp order. */
    public Set<Map.Entry<LocalDateTime, Double>> entries() {
        return Collections.unmodifiableSortedMap(points).entrySet();
    }

    public double getValue(int index) {
        return points.get(getTimestamp(index));
    }

    public LocalDateTime getTimestamp(int index) {
        checkIndex(index);
        if (indexedTimestamps == null) {
            indexedTimestamps = new ArrayList<>(points.keySet());
        }
        return indexedTimestamps.get(index);
    }

    public double firstValue() {
        requireSize(1, "firstValue");
        return points.firstEntry().getValue();
    }

    public double lastValue() {
        requireSize(1, "lastValue");
        return points.lastEntry().getValue();
    }

    public LocalDateTime firstTimestamp() {
        requireSize(1, "firstTimestamp");
        return points.firstKey();
    }

    public LocalDateTime lastTimestamp() {
        requireSize(1, "lastTimestamp");
        return points.lastKey();
    }

    /** Points with index in [fromIndex, toIndex). */
    public TimeSeries slice(int fromIndex, int toIndex) {
        if (fromIndex < 0 || toIndex > size() || fromIndex > toIndex) {
            throw new IndexOutOfRangeException("TimeSeries slice", fromIndex < 0 ? fromIndex : toIndex, size());
        }
        List<LocalDateTime> timestamps = getTimestamps().subList(fromIndex, toIndex);
        List<Double> values = getValues().subList(fromIndex, toIndex);
        return new TimeSeries(name, timestamps, values);
    }

    /** Points with timestamp in [start, end], both inclusive. */
    public TimeSeries sliceByDate(LocalDateTime start, LocalDateTime end) {
        TimeSeries result = new TimeSeries(name);
        if (!start.isAfter(end)) {
            result.points.putAll(points.subMap(start, true, end, true));
        }
        return result;
    }

    public double mean() {
        requireSize(1, "mean");
        return stats().getMean();
    }

    /** Sample (bias-corrected) variance. */
    public double variance() {
        requireSize(2, "variance");
        return stats().getVariance();
    }

    public double std() {
        requireSize(2, "std");
        return stats().getStandardDeviation();
    }

    public double skewness() {
        requireSize(3, "skewness");
        return stats().getSkewness();
    }

    /** Excess kurtosis. */
    public double kurtosis() {
        requireSize(4, "kurtosis");
        return stats().getKurtosis();
    }

    public TimeSeries diff() {
        return derive(name + "_diff", (previous, current) -> current - previous);
    }

    public TimeSeries pctChange() {
        return derive(name + "_pct_change", (previous, current) -> (current - previous) / previous);
    }

    public TimeSeries logReturns() {
        return derive(name + "_log_returns", (previous, current) -> Math.log(current / previous));
    }

    public TimeSeries rollingMean(int window) {
        return rolling(window, name + "_rolling_mean", DescriptiveStatistics::getMean);
    }

    public TimeSeries rollingStd(int window) {
        if (window < 2) {
            throw new ValidationException("Rolling std window must be at least 2, got " + window);
        }
        return rolling(window, name + "_rolling_std", DescriptiveStatistics::getStandardDeviation);
    }

    private TimeSeries derive(String derivedName, PointFunction function) {
        requireSize(2, derivedName);
        TimeSeries result = new TimeSeries(derivedName);
        Map.Entry<LocalDateTime, Double> previous = null;
        for (Map.Entry<LocalDateTime, Double> entry : points.entrySet()) {
            if (previous != null) {
                result.put(entry.getKey(), function.apply(previous.getValue(), entry.getValue()));
            }
            previous = entry;
        }
        return result;
    }

    private TimeSeries rolling(
            int window, String derivedName, ToDoubleFunction<DescriptiveStatistics> statistic) {
        if (window <= 0) {
            throw new ValidationException("Rolling window must be positive, got " + window);
        }
        requireSize(window, derivedName);
        DescriptiveStatistics windowStats = new DescriptiveStatistics(window);
        TimeSeries result = new TimeSeries(derivedName);
        for (Map.Entry<LocalDateTime, Double> entry : points.entrySet()) {
            windowStats.addValue(entry.getValue());
            if (windowStats.getN() == window) {
                result.put(entry.getKey(), statistic.applyAsDouble(windowStats));
            }
        }
        return result;
    }

    private DescriptiveStatistics stats() {
        return new DescriptiveStatistics(toArray());
    }

    private void requireSize(int required, String what) {
        if (size() < required) {
            throw new InsufficientDataException(required, size(), name + "." + what);
        }
    }

    private int checkIndex(int index) {
        if (index < 0 || index >= size()) {
            throw new IndexOutOfRangeException("TimeSeries", index, size());
        }
        return index;
    }

    @FunctionalInterface
    private interface PointFunction {
        double apply(double previous, double current);
    }

    @Override
    public String toString() {
        return "TimeSeries[" + name + ", size=" + size() + "]";
    }
}
