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

/// Conversion between the count domain and the frequency (per unit bin width) domain.
///
/// ## Rules
///
/// With `width[i] = edges[i + 1] - edges[i]` and `p` the {@link WidthScaling#power()}:
/// - frequency to count: `count[i] = frequency[i] * width[i]^p`
/// - count to frequency: `frequency[i] = count[i] / width[i]^p`
///
/// ## Checks, in order
///
/// 1. A null source gives a null result. Nothing else is looked at.
/// 2. Null edges, either a `null` reference or a null {@link BinEdges}, throw
///    {@link HistogramLogicException} ("BinEdges are NULL").
/// 3. `edges.size() != source.size() + 1` throws {@link HistogramLogicException}
///    ("size mismatch"), unless source and edges are both empty.
///
/// The consuming variants run the checks before taking the source buffer, so a failed
/// conversion leaves the source as it was.
final class DomainConversion {

    /// How a quantity scales with bin width.
    enum WidthScaling {
        /// Counts, frequencies and standard deviations.
        LINEAR(1),
        /// Variances.
        QUADRATIC(2);

        private final int power;

        WidthScaling(int power) {
            this.power = power;
        }

        int power() {
            return power;
        }

        double factor(double width) {
            return power == 1 ? width : width * width;
        }
    }

    private DomainConversion() {
    }

    static SharedDoubleBuffer toCounts(NumericSeries<?> frequencies, BinEdges edges, WidthScaling scaling, Class<?> target) {
        double[] factors = widthFactors(frequencies, edges, scaling, target);
        return factors == null ? null : ElementwiseConversion.copying(frequencies, (i, v) -> v * factors[i]);
    }

    static SharedDoubleBuffer consumeToCounts(NumericSeries<?> frequencies, BinEdges edges, WidthScaling scaling, Class<?> target) {
        double[] factors = widthFactors(frequencies, edges, scaling, target);
        return factors == null ? null : ElementwiseConversion.consuming(frequencies, (i, v) -> v * factors[i]);
    }

    static SharedDoubleBuffer toFrequencies(NumericSeries<?> counts, BinEdges edges, WidthScaling scaling, Class<?> target) {
        double[] factors = widthFactors(counts, edges, scaling, target);
        return factors == null ? null : ElementwiseConversion.copying(counts, (i, v) -> v / factors[i]);
    }

    static SharedDoubleBuffer consumeToFrequencies(NumericSeries<?> counts, BinEdges edges, WidthScaling scaling, Class<?> target) {
        double[] factors = widthFactors(counts, edges, scaling, target);
        return factors == null ? null : ElementwiseConversion.consuming(counts, (i, v) -> v / factors[i]);
    }

    /// Runs the checks without converting anything.
    ///
    /// @return false if the source is null, true if a conversion may proceed
    /// @throws HistogramLogicException if the edges are null or of the wrong size
    static boolean checkCompatible(DoubleSeries source, BinEdges edges, Class<?> target) {
        if (!source.hasData()) {
            return false;
        }
        if (edges == null || !edges.hasData()) {
            throw new HistogramLogicException(
                "Cannot construct " + target.getSimpleName() + ": BinEdges are NULL");
        }
        int sourceSize = source.size();
        int edgeCount = edges.size();
        if (edgeCount != sourceSize + 1 && !(sourceSize == 0 && edgeCount == 0)) {
            throw new HistogramLogicException(
                "Cannot construct " + target.getSimpleName() + ": size mismatch, "
                    + sourceSize + " values require " + (sourceSize + 1) + " BinEdges but got " + edgeCount);
        }
        return true;
    }

    /// @return the per-bin `width^p` factors, or null if the source is null
    private static double[] widthFactors(NumericSeries<?> source, BinEdges edges, WidthScaling scaling, Class<?> target) {
        if (!checkCompatible(source, edges, target)) {
            return null;
        }
        int bins = source.size();
        double[] factors = new double[bins];
        for (int i = 0; i < bins; i++) {
            factors[i] = scaling.factor(edges.get(i + 1) - edges.get(i));
        }
        return factors;
    }
}
