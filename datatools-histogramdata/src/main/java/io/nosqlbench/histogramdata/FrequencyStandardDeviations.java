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

/// Standard deviations of per-bin frequencies, i.e. of counts divided by bin width.
///
/// ## Conversions
///
/// | From | Rule |
/// |------|------|
/// | {@link FrequencyVariances} | `sqrt(v)` |
/// | {@link CountStandardDeviations} and {@link BinEdges} | `c / width` |
/// | {@link CountVariances} and {@link BinEdges} | square root, then `/ width` |
///
/// Constructors copy the source. The `consume` factories take its buffer instead and leave
/// the source null.
public final class FrequencyStandardDeviations extends NumericSeries<FrequencyStandardDeviations>
    implements StandardDeviationSeries {

    /// Creates null standard deviations.
    public FrequencyStandardDeviations() {
        super();
    }

    public FrequencyStandardDeviations(double... values) {
        super(values);
    }

    /// Creates {@code length} zero standard deviations.
    public FrequencyStandardDeviations(int length) {
        super(length);
    }

    public FrequencyStandardDeviations(int length, double value) {
        super(length, value);
    }

    public FrequencyStandardDeviations(int length, IntToDoubleFunction generator) {
        super(length, generator);
    }

    public FrequencyStandardDeviations(FrequencyStandardDeviations other) {
        super(other);
    }

    public FrequencyStandardDeviations(FrequencyVariances variances) {
        super(RepresentationConversion.standardDeviations(variances));
    }

    /// @throws HistogramLogicException if the edges are null or do not match the counts
    public FrequencyStandardDeviations(CountStandardDeviations counts, BinEdges edges) {
        super(DomainConversion.toFrequencies(counts, edges, WidthScaling.LINEAR, FrequencyStandardDeviations.class));
    }

    /// @throws HistogramLogicException if the edges are null or do not match the counts
    public FrequencyStandardDeviations(CountVariances counts, BinEdges edges) {
        super(DomainConversion.consumeToFrequencies(
            new CountStandardDeviations(counts), edges, WidthScaling.LINEAR, FrequencyStandardDeviations.class));
    }

    private FrequencyStandardDeviations(SharedDoubleBuffer buffer) {
        super(buffer);
    }

    public static FrequencyStandardDeviations consume(FrequencyVariances variances) {
        return new FrequencyStandardDeviations(RepresentationConversion.consumeStandardDeviations(variances));
    }

    public static FrequencyStandardDeviations consume(CountStandardDeviations counts, BinEdges edges) {
        return new FrequencyStandardDeviations(
            DomainConversion.consumeToFrequencies(counts, edges, WidthScaling.LINEAR, FrequencyStandardDeviations.class));
    }

    public static FrequencyStandardDeviations consume(CountVariances counts, BinEdges edges) {
        DomainConversion.checkCompatible(counts, edges, FrequencyStandardDeviations.class);
        return consume(CountStandardDeviations.consume(counts), edges);
    }
}
