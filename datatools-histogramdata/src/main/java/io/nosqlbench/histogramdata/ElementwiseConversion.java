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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/// Copying and consuming element-wise transforms shared by every conversion.
///
/// Both variants return null for a null source.
final class ElementwiseConversion {

    private static final Logger logger = LogManager.getLogger(ElementwiseConversion.class);

    /// Transform applied to the value at one index.
    @FunctionalInterface
    interface IndexedOperator {
        double apply(int index, double value);
    }

    private ElementwiseConversion() {
    }

    /// Writes the transformed values of {@code source} into a new buffer. The source is untouched.
    static SharedDoubleBuffer copying(NumericSeries<?> source, IndexedOperator operator) {
        SharedDoubleBuffer input = source.buffer();
        if (input == null) {
            return null;
        }
        double[] from = input.values();
        double[] to = new double[from.length];
        for (int i = 0; i < from.length; i++) {
            to[i] = operator.apply(i, from[i]);
        }
        return SharedDoubleBuffer.adopt(to);
    }

    /// Takes the buffer of {@code source}, leaving it null, and transforms it in place.
    ///
    /// A buffer still shared with other series is copied first; those series keep the
    /// original values.
    static SharedDoubleBuffer consuming(NumericSeries<?> source, IndexedOperator operator) {
        SharedDoubleBuffer taken = source.detach();
        if (taken == null) {
            return null;
        }
        SharedDoubleBuffer owned = taken.exclusive();
        if (owned == taken) {
            logger.trace("Reusing buffer of {} values from {}", owned.length(), source.getClass().getSimpleName());
        } else {
            logger.trace("Copying shared buffer of {} values from {}", owned.length(), source.getClass().getSimpleName());
        }
        double[] values = owned.values();
        for (int i = 0; i < values.length; i++) {
            values[i] = operator.apply(i, values[i]);
        }
        return owned;
    }
}
