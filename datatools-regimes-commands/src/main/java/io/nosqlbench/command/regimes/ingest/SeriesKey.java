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

import java.util.Comparator;
import java.util.Objects;

/**
 * Identifies one measured series: a test case run at a process count, and one of its timers.
 *
 * @param caseName test case name
 * @param processes number of processes the case ran with
 * @param timer timer name
 */
public record SeriesKey(String caseName, int processes, String timer) implements Comparable<SeriesKey> {

    private static final Comparator<SeriesKey> ORDER = Comparator
        .comparing(SeriesKey::caseName)
        .thenComparingInt(SeriesKey::processes)
        .thenComparing(SeriesKey::timer);

    public SeriesKey {
        Objects.requireNonNull(caseName, "caseName cannot be null");
        Objects.requireNonNull(timer, "timer cannot be null");
    }

    /// A key for a series that came from a plain file rather than ctest records, named by its path.
    public static SeriesKey ofFile(String path) {
        return new SeriesKey(path, 0, "value");
    }

    @Override
    public int compareTo(SeriesKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return processes > 0 ? caseName + "_np" + processes + " / " + timer : caseName + " / " + timer;
    }
}
