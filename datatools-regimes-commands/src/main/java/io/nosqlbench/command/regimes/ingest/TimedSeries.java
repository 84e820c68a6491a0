package io.nosqlbench.command.regimes.ingest;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A chronologically ordered series of measurements with their run dates.
 *
 * @param key what was measured
 * @param dates run date of each measurement, non-decreasing
 * @param values measurements, parallel to {@code dates}
 */
public record TimedSeries(SeriesKey key, List<LocalDate> dates, double[] values) {

    public TimedSeries {
        Objects.requireNonNull(key, "key cannot be null");
        dates = List.copyOf(dates);
        Objects.requireNonNull(values, "values cannot be null");
        if (dates.size() != values.length) {
            throw new IllegalArgumentException(
                "dates (" + dates.size() + ") and values (" + values.length + ") differ in length");
        }
    }

    public int size() {
        return values.length;
    }

    public boolean isEmpty() {
        return values.length == 0;
    }

    /// Label for one observation: its run date, or `#index` for undated series.
    public String pointLabel(int index) {
        LocalDate date = dates.get(index);
        return LocalDate.EPOCH.equals(date) ? "#" + index : date.toString();
    }

    /**
     * Accumulates dated measurements in any order and sorts them by date on
     * {@link #build()}; equal dates keep their insertion order.
     */
    public static final class Builder {
        private final SeriesKey key;
        private final List<Point> points = new ArrayList<>();

        private record Point(LocalDate date, double value) {
        }

        public Builder(SeriesKey key) {
            this.key = Objects.requireNonNull(key, "key cannot be null");
        }

        public Builder add(LocalDate date, double value) {
            points.add(new Point(Objects.requireNonNull(date, "date cannot be null"), value));
            return this;
        }

        public TimedSeries build() {
            List<Point> sorted = new ArrayList<>(points);
            Collections.sort(sorted, (a, b) -> a.date().compareTo(b.date()));
            List<LocalDate> dates = new ArrayList<>(sorted.size());
            double[] values = new double[sorted.size()];
            for (int i = 0; i < sorted.size(); i++) {
                dates.add(sorted.get(i).date());
                values[i] = sorted.get(i).value();
            }
            return new TimedSeries(key, dates, values);
        }
    }
}
