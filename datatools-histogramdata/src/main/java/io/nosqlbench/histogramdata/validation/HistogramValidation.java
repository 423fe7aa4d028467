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
import io.nosqlbench.histogramdata.XSeries;

/// Single entry point for series validation. The overload, and so the rule set, is chosen
/// from the declared type of the argument.
///
/// ```java
/// import static io.nosqlbench.histogramdata.validation.HistogramValidation.isValid;
///
/// isValid(new BinEdges(1.0, 2.0));          // X rules
/// isValid(new CountVariances(Double.NaN));  // E rules
/// ```
public final class HistogramValidation {

    private HistogramValidation() {
    }

    /// @see XValidator#isValid(XSeries)
    public static boolean isValid(XSeries x) {
        return XValidator.isValid(x);
    }

    /// @see EValidator#isValid(ESeries)
    public static boolean isValid(ESeries e) {
        return EValidator.isValid(e);
    }
}
