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

/// Read-only view of a fixed-length sequence of doubles that may be in the null state.
///
/// All accessors except {@link #hasData()} require an initialized series and throw
/// {@link IllegalStateException} on a null one.
public interface DoubleSeries {

    /// @return false for a null series, true otherwise, including when empty
    boolean hasData();

    /// @return the number of values
    int size();

    /// @return true when the series is initialized and holds no values
    boolean isEmpty();

    /// @param index position of the value
    /// @return the value at {@code index}
    double get(int index);
}
