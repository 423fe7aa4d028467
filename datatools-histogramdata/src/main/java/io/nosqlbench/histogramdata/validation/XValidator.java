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

package io.nosqlbench.histogramdata.validation;

import io.nosqlbench.histogramdata.XSeries;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/// Validity check for bin edges and points.
///
/// ## Rules
///
/// - Every value is finite. NaN and infinities are invalid.
/// - Values strictly increase. Two equal neighbours form a zero-width bin and are invalid.
/// - The gap between neighbours is a normal double: at least {@link Double#MIN_NORMAL} and
///   not overflowing to infinity. A single subnormal *value* is fine, a subnormal *gap* is not.
///
/// | Input | Valid |
/// |-------|-------|
/// | `{1.0, 2.0}` | yes |
/// | `{1.0, 2.0, 2.0, 3.0}` | no, zero-width bin |
/// | `{0.0, Double.MIN_NORMAL / 2}` | no, subnormal gap |
/// | `{-Double.MAX_VALUE / 2, Double.MAX_VALUE / 2}` | yes |
/// | `{-Double.MAX_VALUE, Double.MAX_VALUE}` | no, gap overflows |
///
/// Series with fewer than two values only need finite values.
public final class XValidator {

    private static final Logger logger = LogManager.getLogger(XValidator.class);

    private XValidator() {
    }

    /// @param x an initialized X series
    /// @return true if {@code x} satisfies every rule above
    /// @throws IllegalStateException if {@code x} is null
    public static boolean isValid(XSeries x) {
        Objects.requireNonNull(x, "x");
        int size = x.size();
        for (int i = 0; i < size; i++) {
            if (!Double.isFinite(x.get(i))) {
                logger.trace("Non-finite X value {} at index {}", x.get(i), i);
                return false;
            }
        }
        for (int i = 1; i < size; i++) {
            double gap = x.get(i) - x.get(i - 1);
            if (!isNormalPositive(gap)) {
                logger.trace("Invalid X gap {} between index {} and {}", gap, i - 1, i);
                return false;
            }
        }
        return true;
    }

    /// False for NaN, zero, negative, subnormal and infinite values.
    private static boolean isNormalPositive(double value) {
        return value >= Double.MIN_NORMAL && value <= Double.MAX_VALUE;
    }
}
