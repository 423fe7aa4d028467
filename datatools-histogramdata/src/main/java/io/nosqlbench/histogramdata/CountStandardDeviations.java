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

/// Standard deviations of per-bin counts.
///
/// ## Conversions
///
/// | From | Rule |
/// |------|------|
/// | {@link CountVariances} | `sqrt(v)` |
/// | {@link FrequencyStandardDeviations} and {@link BinEdges} | `f * width` |
/// | {@link FrequencyVariances} and {@link BinEdges} | square root, then `* width` |
///
/// Constructors copy the source. The `consume` factories take its buffer instead and leave
/// the source null.
public final class CountStandardDeviations extends NumericSeries<CountStandardDeviations>
    implements StandardDeviationSeries {

    /// Creates null standard deviations.
    public CountStandardDeviations() {
        super();
    }

    public CountStandardDeviations(double... values) {
        super(values);
    }

    /// Creates {@code length} zero standard deviations.
    public CountStandardDeviations(int length) {
        super(length);
    }

    public CountStandardDeviations(int length, double value) {
        super(length, value);
    }

    public CountStandardDeviations(int length, IntToDoubleFunction generator) {
        super(length, generator);
    }

    public CountStandardDeviations(CountStandardDeviations other) {
        super(other);
    }

    public CountStandardDeviations(CountVariances variances) {
        super(RepresentationConversion.standardDeviations(variances));
    }

    /// @throws HistogramLogicException if the edges are null or do not match the frequencies
    public CountStandardDeviations(FrequencyStandardDeviations frequencies, BinEdges edges) {
        super(DomainConversion.toCounts(frequencies, edges, WidthScaling.LINEAR, CountStandardDeviations.class));
    }

    /// @throws HistogramLogicException if the edges are null or do not match the frequencies
    public CountStandardDeviations(FrequencyVariances frequencies, BinEdges edges) {
        super(DomainConversion.consumeToCounts(
            new FrequencyStandardDeviations(frequencies), edges, WidthScaling.LINEAR, CountStandardDeviations.class));
    }

    private CountStandardDeviations(SharedDoubleBuffer buffer) {
        super(buffer);
    }

    public static CountStandardDeviations consume(CountVariances variances) {
        return new CountStandardDeviations(RepresentationConversion.consumeStandardDeviations(variances));
    }

    public static CountStandardDeviations consume(FrequencyStandardDeviations frequencies, BinEdges edges) {
        return new CountStandardDeviations(
            DomainConversion.consumeToCounts(frequencies, edges, WidthScaling.LINEAR, CountStandardDeviations.class));
    }

    public static CountStandardDeviations consume(FrequencyVariances frequencies, BinEdges edges) {
        DomainConversion.checkCompatible(frequencies, edges, CountStandardDeviations.class);
        return consume(FrequencyStandardDeviations.consume(frequencies), edges);
    }
}
