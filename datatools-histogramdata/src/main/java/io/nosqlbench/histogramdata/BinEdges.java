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

/// Boundaries of consecutive bins: N + 1 edges delimit N bins.
///
/// Bin `i` spans `[get(i), get(i + 1))` and its width is `get(i + 1) - get(i)`. Edges are not
/// checked on construction; use {@link io.nosqlbench.histogramdata.validation.XValidator}.
public final class BinEdges extends NumericSeries<BinEdges> implements XSeries {

    /// Creates null edges.
    public BinEdges() {
        super();
    }

    public BinEdges(double... values) {
        super(values);
    }

    /// Creates {@code length} zero edges.
    public BinEdges(int length) {
        super(length);
    }

    public BinEdges(int length, double value) {
        super(length, value);
    }

    public BinEdges(int length, IntToDoubleFunction generator) {
        super(length, generator);
    }

    public BinEdges(BinEdges other) {
        super(other);
    }

    /// Creates edges around the given points.
    ///
    /// Interior edges are the midpoints between neighbouring points. The outer edges lie half
    /// the first and last spacing beyond the outer points. A single point gets edges at
    /// `p - 0.5` and `p + 0.5`. Null and empty points give null and empty edges.
    public BinEdges(Points points) {
        super(PointConversion.edgesAround(points));
    }

    /// Number of bins these edges delimit, 0 for empty edges.
    public int binCount() {
        return Math.max(0, size() - 1);
    }

    /// @return the width of bin {@code bin}
    public double width(int bin) {
        return get(bin + 1) - get(bin);
    }

    /// Shifts every edge by {@code delta}.
    public BinEdges offset(double delta) {
        return apply(v -> v + delta);
    }

    /// Multiplies every edge by {@code factor}.
    public BinEdges scale(double factor) {
        return apply(v -> v * factor);
    }
}
