package com.volarb.unit.timeseries;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.volarb.exception.IndexOutOfRangeException;
import com.volarb.exception.InsufficientDataException;
import com.volarb.exception.ValidationException;
import com.volarb.timeseries.TimeSeries;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("TimeSeries")
class TimeSeriesTest {

    private static final LocalDateTime D1 = LocalDateTime.of(2025, 3, 3, 0, 0);

    private static TimeSeries series(double... values) {
        TimeSeries series = new TimeSeries("px");
        for (int i = 0; i < values.length; i++) {
            series.put(D1.plusDays(i), values[i]);
        }
        return series;
    }

    @Nested
    @DisplayName("Container")
    class Container {

        @Test
        @DisplayName("keeps points in timestamp order regardless of insertion order")
        void ordered() {
            TimeSeries series = new TimeSeries("px");
            series.put(D1.plusDays(2), 3.0);
            series.put(D1, 1.0);
            series.put(D1.plusDays(1), 2.0);

            assertThat(series.getValues()).containsExactly(1.0, 2.0, 3.0);
            assertThat(series.firstTimestamp()).isEqualTo(D1);
        }

        @Test
        @DisplayName("put on an existing timestamp updates in place")
        void appendOrUpdate() {
            TimeSeries series = series(1, 2, 3);
            series.put(D1.plusDays(1), 20.0);

            assertThat(series.size()).isEqualTo(3);
            assertThat(series.getValue(1)).isEqualTo(20.0);
        }

        @Test
        @DisplayName("index access and entries follow later inserts")
        void indexAfterInsert() {
            TimeSeries series = series(1, 3);
            assertThat(series.getValue(1)).isEqualTo(3.0);

            series.put(D1.plusHours(12), 2.0);

            assertThat(series.getTimestamp(1)).isEqualTo(D1.plusHours(12));
            assertThat(series.getValue(1)).isEqualTo(2.0);
            assertThat(series.getValue(2)).isEqualTo(3.0);
            assertThat(series.entries()).extracting(Map.Entry::getValue).containsExactly(1.0, 2.0, 3.0);
        }

        @Test
        @DisplayName("entries are read-only")
        void entriesReadOnly() {
            TimeSeries series = series(1, 2);

            assertThatThrownBy(() -> series.entries().clear()).isInstanceOf(UnsupportedOperationException.class);
        }

        @Test
        @DisplayName("rejects mismatched timestamp and value lists")
        void mismatchedSizes() {
            assertThatThrownBy(() -> new TimeSeries("x", List.of(D1), List.of(1.0, 2.0)))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("index access is bounds-checked")
        void indexChecked() {
            TimeSeries series = series(1, 2);

            assertThatThrownBy(() -> series.getValue(2)).isInstanceOf(IndexOutOfRangeException.class);
            assertThatThrownBy(() -> series.getTimestamp(-1)).isInstanceOf(IndexOutOfRangeException.class);
        }

        @Test
        @DisplayName("slices by index (end exclusive) and by date (inclusive)")
        void slicing() {
            TimeSeries series = series(1, 2, 3, 4, 5);

            assertThat(series.slice(1, 3).getValues()).containsExactly(2.0, 3.0);
            assertThat(series.sliceByDate(D1.plusDays(2), D1.plusDays(4)).getValues())
                    .containsExactly(3.0, 4.0, 5.0);
            assertThatThrownBy(() -> series.slice(2, 6)).isInstanceOf(IndexOutOfRangeException.class);
        }
    }

    @Nested
    @DisplayName("Statistics")
    class Statistics {

        @Test
        @DisplayName("mean, sample variance and std")
        void moments() {
            TimeSeries series = series(2, 4, 4, 4, 5, 5, 7, 9);

            assertThat(series.mean()).isEqualTo(5.0);
            assertThat(series.variance()).isCloseTo(32.0 / 7.0, within(1e-12));
            assertThat(series.std()).isCloseTo(Math.sqrt(32.0 / 7.0), within(1e-12));
        }

        @Test
        @DisplayName("minimum point counts are enforced")
        void thresholds() {
            assertThatThrownBy(() -> series().mean()).isInstanceOf(InsufficientDataException.class);
            assertThatThrownBy(() -> series(1).std()).isInstanceOf(InsufficientDataException.class);
            assertThatThrownBy(() -> series(1, 2).skewness()).isInstanceOf(InsufficientDataException.class);
            assertThatThrownBy(() -> series(1, 2, 3).kurtosis()).isInstanceOf(InsufficientDataException.class);
            assertThat(series(1, 2, 4).skewness()).isPositive();
        }
    }

    @Nested
    @DisplayName("Derived series")
    class Derived {

        @Test
        @DisplayName("pctChange, logReturns and diff drop the first point")
        void returns() {
            TimeSeries series = series(100, 110, 99);

            assertThat(series.pctChange().getValues()).containsExactly(0.1, -0.1);
            assertThat(series.diff().getValues()).containsExactly(10.0, -11.0);
            assertThat(series.logReturns().getValue(0)).isCloseTo(Math.log(1.1), within(1e-12));
            assertThat(series.pctChange().firstTimestamp()).isEqualTo(D1.plusDays(1));
        }

        @Test
        @DisplayName("rolling windows start once the window is full")
        void rolling() {
            TimeSeries series = series(1, 2, 3, 4);

            assertThat(series.rollingMean(2).getValues()).containsExactly(1.5, 2.5, 3.5);
            assertThat(series.rollingStd(3).size()).isEqualTo(2);
            assertThat(series.rollingStd(3).getValue(0)).isCloseTo(1.0, within(1e-12));
            assertThatThrownBy(() -> series.rollingStd(1)).isInstanceOf(ValidationException.class);
        }
    }
}
