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

package io.nosqlbench.histogramdata;

import io.nosqlbench.histogramdata.DomainConversion.WidthScaling;

import java.util.function.IntToDoubleFunction;

/// Raw per-bin counts.
///
/// Converts from {@link Frequencies} with `count = frequency * width`.
public final class Counts extends NumericSeries<Counts> implements ESeries {

    /// Creates null counts.
    public Counts() {
        super();
    }

    public Counts(double... values) {
        super(values);
    }

    /// Creates {@code length} zero counts.
    public Counts(int length) {
        super(length);
    }

    public Counts(int length, double value) {
        super(length, value);
    }

    public Counts(int length, IntToDoubleFunction generator) {
        super(length, generator);
    }

    public Counts(Counts other) {
        super(other);
    }

    /// @throws HistogramLogicException if the edges are null or do not match the frequencies
    public Counts(Frequencies frequencies, BinEdges edges) {
        super(DomainConversion.toCounts(frequencies, edges, WidthScaling.LINEAR, Counts.class));
    }

    private Counts(SharedDoubleBuffer buffer) {
        super(buffer);
    }

    public static Counts consume(Frequencies frequencies, BinEdges edges) {
        return new Counts(DomainConversion.consumeToCounts(frequencies, edges, WidthScaling.LINEAR, Counts.class));
    }

    /// Multiplies every count by {@code factor}.
    public Counts scale(double factor) {
        return apply(v -> v * factor);
    }
}
