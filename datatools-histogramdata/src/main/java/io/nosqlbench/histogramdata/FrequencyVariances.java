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

/// Variances of per-bin frequencies, i.e. of counts divided by bin width.
///
/// ## Conversions
///
/// | From | Rule |
/// |------|------|
/// | {@link FrequencyStandardDeviations} | `s * s` |
/// | {@link CountVariances} and {@link BinEdges} | `c / width^2` |
/// | {@link CountStandardDeviations} and {@link BinEdges} | squared, then `/ width^2` |
///
/// Constructors copy the source. The `consume` factories take its buffer instead and leave
/// the source null.
public final class FrequencyVariances extends NumericSeries<FrequencyVariances> implements VarianceSeries {

    /// Creates null variances.
    public FrequencyVariances() {
        super();
    }

    public FrequencyVariances(double... values) {
        super(values);
    }

    /// Creates {@code length} zero variances.
    public FrequencyVariances(int length) {
        super(length);
    }

    public FrequencyVariances(int length, double value) {
        super(length, value);
    }

    public FrequencyVariances(int length, IntToDoubleFunction generator) {
        super(length, generator);
    }

    public FrequencyVariances(FrequencyVariances other) {
        super(other);
    }

    public FrequencyVariances(FrequencyStandardDeviations standardDeviations) {
        super(RepresentationConversion.variances(standardDeviations));
    }

    /// @throws HistogramLogicException if the edges are null or do not match the counts
    public FrequencyVariances(CountVariances counts, BinEdges edges) {
        super(DomainConversion.toFrequencies(counts, edges, WidthScaling.QUADRATIC, FrequencyVariances.class));
    }

    /// @throws HistogramLogicException if the edges are null or do not match the counts
    public FrequencyVariances(CountStandardDeviations counts, BinEdges edges) {
        super(DomainConversion.consumeToFrequencies(
            new CountVariances(counts), edges, WidthScaling.QUADRATIC, FrequencyVariances.class));
    }

    private FrequencyVariances(SharedDoubleBuffer buffer) {
        super(buffer);
    }

    public static FrequencyVariances consume(FrequencyStandardDeviations standardDeviations) {
        return new FrequencyVariances(RepresentationConversion.consumeVariances(standardDeviations));
    }

    public static FrequencyVariances consume(CountVariances counts, BinEdges edges) {
        return new FrequencyVariances(
            DomainConversion.consumeToFrequencies(counts, edges, WidthScaling.QUADRATIC, FrequencyVariances.class));
    }

    public static FrequencyVariances consume(CountStandardDeviations counts, BinEdges edges) {
        DomainConversion.checkCompatible(counts, edges, FrequencyVariances.class);
        return consume(CountVariances.consume(counts), edges);
    }
}
