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

import io.nosqlbench.histogramdata.ESeries;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/// Validity check for counts, frequencies, and their variances and standard deviations.
///
/// NaN is accepted and stands for an unknown value. Infinities and negative values are
/// rejected. An empty series is valid.
public final class EValidator {

    private static final Logger logger = LogManager.getLogger(EValidator.class);

    private EValidator() {
    }

    /// @param e an initialized series
    /// @return true if no value is infinite or negative
    /// @throws IllegalStateException if {@code e} is null
    public static boolean isValid(ESeries e) {
        Objects.requireNonNull(e, "e");
        int size = e.size();
        for (int i = 0; i < size; i++) {
            double value = e.get(i);
            if (Double.isNaN(value)) {
                continue;
            }
            if (Double.isInfinite(value) || value < 0.0) {
                logger.trace("Invalid E value {} at index {}", value, i);
                return false;
            }
        }
        return true;
    }
}
