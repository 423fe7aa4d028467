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

/// Conversion between the variance and standard deviation forms of the same uncertainty.
///
/// | From | To | Element rule |
/// |------|----|--------------|
/// | {@link VarianceSeries} | {@link StandardDeviationSeries} | `sqrt(v)` |
/// | {@link StandardDeviationSeries} | {@link VarianceSeries} | `s * s` |
///
/// Null sources give null buffers and lengths are preserved. Negative variances are not
/// checked here; {@link io.nosqlbench.histogramdata.validation.EValidator} rejects them.
final class RepresentationConversion {

    private static final ElementwiseConversion.IndexedOperator SQUARE_ROOT = (i, v) -> Math.sqrt(v);
    private static final ElementwiseConversion.IndexedOperator SQUARE = (i, v) -> v * v;

    private RepresentationConversion() {
    }

    static <V extends NumericSeries<V> & VarianceSeries> SharedDoubleBuffer standardDeviations(V variances) {
        return ElementwiseConversion.copying(variances, SQUARE_ROOT);
    }

    static <V extends NumericSeries<V> & VarianceSeries> SharedDoubleBuffer consumeStandardDeviations(V variances) {
        return ElementwiseConversion.consuming(variances, SQUARE_ROOT);
    }

    static <S extends NumericSeries<S> & StandardDeviationSeries> SharedDoubleBuffer variances(S standardDeviations) {
        return ElementwiseConversion.copying(standardDeviations, SQUARE);
    }

    static <S extends NumericSeries<S> & StandardDeviationSeries> SharedDoubleBuffer consumeVariances(S standardDeviations) {
        return ElementwiseConversion.consuming(standardDeviations, SQUARE);
    }
}
