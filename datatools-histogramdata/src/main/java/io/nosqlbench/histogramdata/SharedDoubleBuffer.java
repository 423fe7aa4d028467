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

import java.util.concurrent.atomic.AtomicInteger;

/// Reference-counted `double[]` shared by the series that copied it.
///
/// The owner count is incremented by {@link #retain()} when a series copies another, and
/// decremented by {@link #release()} when a series gives the buffer up (reassignment, move,
/// or detaching for a write). A holder that is simply dropped never releases, so the count
/// can only overestimate the number of live owners.
final class SharedDoubleBuffer {

    private final double[] values;
    private final AtomicInteger owners = new AtomicInteger(1);

    private SharedDoubleBuffer(double[] values) {
        this.values = values;
    }

    /// Wraps an array without copying it. The caller must not keep a reference.
    static SharedDoubleBuffer adopt(double[] values) {
        return new SharedDoubleBuffer(values);
    }

    static SharedDoubleBuffer copyOf(double[] values) {
        return new SharedDoubleBuffer(values.clone());
    }

    /// Registers another owner and returns this buffer.
    SharedDoubleBuffer retain() {
        owners.incrementAndGet();
        return this;
    }

    void release() {
        owners.updateAndGet(n -> n > 0 ? n - 1 : 0);
    }

    boolean isShared() {
        return owners.get() > 1;
    }

    int owners() {
        return owners.get();
    }

    int length() {
        return values.length;
    }

    /// Direct access to the backing array. Writers must hold the only reference.
    double[] values() {
        return values;
    }

    /// Returns a buffer that the caller owns exclusively.
    ///
    /// If this buffer is unshared it is returned as is, otherwise this owner's share is
    /// released and a private copy is returned.
    SharedDoubleBuffer exclusive() {
        if (!isShared()) {
            return this;
        }
        SharedDoubleBuffer copy = copyOf(values);
        release();
        return copy;
    }
}
