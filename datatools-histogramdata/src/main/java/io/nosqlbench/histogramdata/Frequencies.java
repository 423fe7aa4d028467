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

/// Per-bin counts divided by bin width.
///
/// Converts from {@link Counts} with `frequency = count / width`.
public final class Frequencies extends NumericSeries<Frequencies> implements ESeries {

    /// Creates null frequencies.
    public Frequencies() {
        super();
    }

    public Frequencies(double... values) {
        super(values);
    }

    /// Creates {@code length} zero frequencies.
    public Frequencies(int length) {
        super(length);
    }

    public Frequencies(int length, double value) {
        super(length, value);
    }

    public Frequencies(int length, IntToDoubleFunction generator) {
        super(length, generator);
    }

    public Frequencies(Frequencies other) {
        super(other);
    }

    /// @throws HistogramLogicException if the edges are null or do not match the counts
    public Frequencies(Counts counts, BinEdges edges) {
        super(DomainConversion.toFrequencies(counts, edges, WidthScaling.LINEAR, Frequencies.class));
    }

    private Frequencies(SharedDoubleBuffer buffer) {
        super(buffer);
    }

    public static Frequencies consume(Counts counts, BinEdges edges) {
        return new Frequencies(
            DomainConversion.consumeToFrequencies(counts, edges, WidthScaling.LINEAR, Frequencies.class));
    }

    /// Multiplies every frequency by {@code factor}.
    public Frequencies scale(double factor) {
        return apply(v -> v * factor);
    }
}
