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

/// Variances of per-bin counts.
///
/// ## Conversions
///
/// | From | Rule |
/// |------|------|
/// | {@link CountStandardDeviations} | `s * s` |
/// | {@link FrequencyVariances} and {@link BinEdges} | `f * width^2` |
/// | {@link FrequencyStandardDeviations} and {@link BinEdges} | squared, then `* width^2` |
///
/// Constructors copy the source. The `consume` factories take its buffer instead and leave
/// the source null.
public final class CountVariances extends NumericSeries<CountVariances> implements VarianceSeries {

    /// Creates null variances.
    public CountVariances() {
        super();
    }

    public CountVariances(double... values) {
        super(values);
    }

    /// Creates {@code length} zero variances.
    public CountVariances(int length) {
        super(length);
    }

    public CountVariances(int length, double value) {
        super(length, value);
    }

    public CountVariances(int length, IntToDoubleFunction generator) {
        super(length, generator);
    }

    public CountVariances(CountVariances other) {
        super(other);
    }

    public CountVariances(CountStandardDeviations standardDeviations) {
        super(RepresentationConversion.variances(standardDeviations));
    }

    /// @throws HistogramLogicException if the edges are null or do not match the frequencies
    public CountVariances(FrequencyVariances frequencies, BinEdges edges) {
        super(DomainConversion.toCounts(frequencies, edges, WidthScaling.QUADRATIC, CountVariances.class));
    }

    /// @throws HistogramLogicException if the edges are null or do not match the frequencies
    public CountVariances(FrequencyStandardDeviations frequencies, BinEdges edges) {
        super(DomainConversion.consumeToCounts(
            new FrequencyVariances(frequencies), edges, WidthScaling.QUADRATIC, CountVariances.class));
    }

    private CountVariances(SharedDoubleBuffer buffer) {
        super(buffer);
    }

    public static CountVariances consume(CountStandardDeviations standardDeviations) {
        return new CountVariances(RepresentationConversion.consumeVariances(standardDeviations));
    }

    public static CountVariances consume(FrequencyVariances frequencies, BinEdges edges) {
        return new CountVariances(
            DomainConversion.consumeToCounts(frequencies, edges, WidthScaling.QUADRATIC, CountVariances.class));
    }

    public static CountVariances consume(FrequencyStandardDeviations frequencies, BinEdges edges) {
        DomainConversion.checkCompatible(frequencies, edges, CountVariances.class);
        return consume(FrequencyVariances.consume(frequencies), edges);
    }
}
