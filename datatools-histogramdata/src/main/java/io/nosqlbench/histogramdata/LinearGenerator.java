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

/// Generates the arithmetic sequence `start + i * increment`.
///
/// ```java
/// BinEdges edges = new BinEdges(5, new LinearGenerator(0.0, 0.5));  // {0.0, 0.5, 1.0, 1.5, 2.0}
/// ```
///
/// @param start value at index 0
/// @param increment difference between consecutive values
public record LinearGenerator(double start, double increment) implements IntToDoubleFunction {

    public LinearGenerator {
        if (!Double.isFinite(start) || !Double.isFinite(increment)) {
            throw new IllegalArgumentException(
                "start and increment must be finite, got: " + start + ", " + increment);
        }
    }

    @Override
    public double applyAsDouble(int index) {
        return start + index * increment;
    }
}
