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

/// # Synopsis
/// Per-bin histogram data: the X axis, the counts or frequencies measured in each bin, and
/// their uncertainties as variances or standard deviations.
///
/// ## Types
/// | Kind | Types |
/// |------|-------|
/// | X data | {@link io.nosqlbench.histogramdata.BinEdges}, {@link io.nosqlbench.histogramdata.Points} |
/// | Values | {@link io.nosqlbench.histogramdata.Counts}, {@link io.nosqlbench.histogramdata.Frequencies} |
/// | Uncertainties | {@link io.nosqlbench.histogramdata.CountVariances}, {@link io.nosqlbench.histogramdata.CountStandardDeviations}, {@link io.nosqlbench.histogramdata.FrequencyVariances}, {@link io.nosqlbench.histogramdata.FrequencyStandardDeviations} |
///
/// All of them are {@link io.nosqlbench.histogramdata.NumericSeries}: copy-on-write value
/// types with a null state that is distinct from empty.
///
/// ## Conversions
/// Conversions are explicit constructors (copying) or static `consume` factories (taking the
/// source buffer). Variance and standard deviation of the same domain convert by squaring or
/// taking the square root. Count and frequency domains convert through the widths of a
/// {@link io.nosqlbench.histogramdata.BinEdges} with one more edge than there are values.
/// A null source always converts to a null result.
///
/// ## Validation
/// Nothing is validated on construction. See {@link io.nosqlbench.histogramdata.validation}.
package io.nosqlbench.histogramdata;
