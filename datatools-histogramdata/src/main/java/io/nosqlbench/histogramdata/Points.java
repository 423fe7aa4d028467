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

import java.util.function.IntToDoubleFunction;

/// X coordinates of point data, one per value.
public final class Points extends NumericSeries<Points> implements XSeries {

    /// Creates null points.
    public Points() {
        super();
    }

    public Points(double... values) {
        super(values);
    }

    /// Creates {@code length} zero points.
    public Points(int length) {
        super(length);
    }

    public Points(int length, double value) {
        super(length, value);
    }

    public Points(int length, IntToDoubleFunction generator) {
        super(length, generator);
    }

    public Points(Points other) {
        super(other);
    }

    /// Creates the bin centres of {@code edges}.
    ///
    /// @throws HistogramLogicException if {@code edges} holds exactly one edge
    public Points(BinEdges edges) {
        super(PointConversion.centresOf(edges));
    }

    /// Shifts every point by {@code delta}.
    public Points offset(double delta) {
        return apply(v -> v + delta);
    }

    /// Multiplies every point by {@code factor}.
    public Points scale(double factor) {
        return apply(v -> v * factor);
    }
}
