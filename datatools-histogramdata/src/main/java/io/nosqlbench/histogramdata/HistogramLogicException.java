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

/// Thrown when series are combined in a way that can never be meaningful, such as converting
/// between counts and frequencies without bin edges or with bin edges of the wrong length.
///
/// These are programming errors in the caller and are not recovered from inside this module.
public class HistogramLogicException extends IllegalStateException {

    public HistogramLogicException(String message) {
        super(message);
    }
}
