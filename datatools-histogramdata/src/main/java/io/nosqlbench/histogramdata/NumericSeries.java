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

import java.util.Arrays;
import java.util.Objects;
import java.util.function.DoubleUnaryOperator;
import java.util.function.IntToDoubleFunction;
import java.util.stream.DoubleStream;

/// # NumericSeries
///
/// Fixed-length sequence of doubles with copy-on-write value semantics.
///
/// ## States
///
/// A series is either **null** (no buffer, "not computed yet") or **initialized** (a buffer of
/// zero or more values). Null and empty are different: {@link #hasData()} is false only for
/// null, and an empty series is a perfectly good initialized value.
///
/// ## Sharing
///
/// Copying a series (copy constructor or {@link #assign}) shares the buffer and costs O(1).
/// The first write through {@link #set} or {@link #apply} on a shared buffer makes a private
/// copy, so the other holders never observe the change. Reads never copy. See
/// {@link SharingMode} to disable sharing.
///
/// {@link #moveAssign} and the `consume` factories of the concrete types take the buffer
/// away from their source, which is left null.
///
/// ## Thread Safety
///
/// Instances are NOT thread-safe. Confine each series to one thread at a time; copies may
/// live on other threads.
///
/// @param <T> the concrete series type
public abstract class NumericSeries<T extends NumericSeries<T>> implements DoubleSeries {

    private static final Logger logger = LogManager.getLogger(NumericSeries.class);

    private SharedDoubleBuffer buffer;

    /// Creates a null series.
    protected NumericSeries() {
        this.buffer = null;
    }

    /// Creates a series holding a copy of {@code values}.
    protected NumericSeries(double... values) {
        Objects.requireNonNull(values, "values");
        this.buffer = SharedDoubleBuffer.copyOf(values);
    }

    /// Creates a zero-filled series of the given length.
    protected NumericSeries(int length) {
        this.buffer = SharedDoubleBuffer.adopt(new double[checkLength(length)]);
    }

    /// Creates a series of the given length with every element set to {@code value}.
    protected NumericSeries(int length, double value) {
        double[] values = new double[checkLength(length)];
        Arrays.fill(values, value);
        this.buffer = SharedDoubleBuffer.adopt(values);
    }

    /// Creates a series of the given length with element `i` set to `generator(i)`.
    protected NumericSeries(int length, IntToDoubleFunction generator) {
        Objects.requireNonNull(generator, "generator");
        double[] values = new double[checkLength(length)];
        for (int i = 0; i < values.length; i++) {
            values[i] = generator.applyAsDouble(i);
        }
        this.buffer = SharedDoubleBuffer.adopt(values);
    }

    /// Creates a copy of {@code other}, sharing its buffer.
    protected NumericSeries(T other) {
        Objects.requireNonNull(other, "other");
        this.buffer = shareOf(other);
    }

    /// Wraps a buffer produced by a conversion. The buffer may be null.
    NumericSeries(SharedDoubleBuffer buffer) {
        this.buffer = buffer;
    }

    private static int checkLength(int length) {
        if (length < 0) {
            throw new IllegalArgumentException("length must be non-negative, got: " + length);
        }
        return length;
    }

    private static SharedDoubleBuffer shareOf(NumericSeries<?> other) {
        SharedDoubleBuffer source = other.buffer;
        if (source == null) {
            return null;
        }
        if (SharingMode.effective() == SharingMode.DEEP_COPY) {
            return SharedDoubleBuffer.copyOf(source.values());
        }
        return source.retain();
    }

    @Override
    public final boolean hasData() {
        return buffer != null;
    }

    @Override
    public final int size() {
        return requireData().length();
    }

    @Override
    public final boolean isEmpty() {
        return requireData().length() == 0;
    }

    @Override
    public final double get(int index) {
        return requireData().values()[index];
    }

    /// @return a copy of the values
    public final double[] toArray() {
        return requireData().values().clone();
    }

    /// @return a stream over a snapshot of the values
    public final DoubleStream stream() {
        return Arrays.stream(toArray());
    }

    /// @return the sum of all values
    public final double sum() {
        return sum(0, size());
    }

    /// Sums the values in `[from, to)`.
    ///
    /// @param from first index, inclusive
    /// @param to last index, exclusive
    /// @return the sum, 0.0 for an empty range
    public final double sum(int from, int to) {
        double[] values = requireData().values();
        Objects.checkFromToIndex(from, to, values.length);
        double total = 0.0;
        for (int i = from; i < to; i++) {
            total += values[i];
        }
        return total;
    }

    /// Sets one value, first detaching from any other holder of the buffer.
    ///
    /// @return this series
    public final T set(int index, double value) {
        double[] values = mutableValues();
        Objects.checkIndex(index, values.length);
        values[index] = value;
        return self();
    }

    /// Replaces every value `v` with `operator(v)`, first detaching from any other holder
    /// of the buffer.
    ///
    /// @return this series
    public final T apply(DoubleUnaryOperator operator) {
        Objects.requireNonNull(operator, "operator");
        double[] values = mutableValues();
        for (int i = 0; i < values.length; i++) {
            values[i] = operator.applyAsDouble(values[i]);
        }
        return self();
    }

    /// Makes this series a copy of {@code other}, sharing its buffer.
    ///
    /// @return this series
    public final T assign(T other) {
        Objects.requireNonNull(other, "other");
        if (other == this) {
            return self();
        }
        SharedDoubleBuffer replacement = shareOf(other);
        releaseBuffer();
        this.buffer = replacement;
        return self();
    }

    /// Takes the buffer of {@code other}, leaving it null.
    ///
    /// @return this series
    public final T moveAssign(T other) {
        Objects.requireNonNull(other, "other");
        if (other == this) {
            return self();
        }
        SharedDoubleBuffer replacement = other.detach();
        releaseBuffer();
        this.buffer = replacement;
        return self();
    }

    /// Returns the current buffer, or null. Exposed for conversions and buffer identity checks.
    final SharedDoubleBuffer buffer() {
        return buffer;
    }

    /// Removes the buffer from this series and returns it, leaving this series null.
    /// Ownership transfers to the caller without changing the owner count.
    final SharedDoubleBuffer detach() {
        SharedDoubleBuffer taken = buffer;
        buffer = null;
        return taken;
    }

    /// Returns the backing array after making sure no other series shares it.
    final double[] mutableValues() {
        SharedDoubleBuffer current = requireData();
        if (current.isShared()) {
            logger.trace("Detaching {} from a buffer of {} values shared by {} owners",
                getClass().getSimpleName(), current.length(), current.owners());
            buffer = current.exclusive();
        }
        return buffer.values();
    }

    private void releaseBuffer() {
        if (buffer != null) {
            buffer.release();
            buffer = null;
        }
    }

    private SharedDoubleBuffer requireData() {
        if (buffer == null) {
            throw new IllegalStateException(
                "Cannot access the values of a NULL " + getClass().getSimpleName());
        }
        return buffer;
    }

    @SuppressWarnings("unchecked")
    private T self() {
        return (T) this;
    }

    /// Series are equal when they have the same concrete type and either both are null or
    /// they hold the same values. Values are compared like {@link Arrays#equals(double[], double[])},
    /// so NaN equals NaN and 0.0 differs from -0.0.
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NumericSeries<?> that = (NumericSeries<?>) o;
        if (buffer == null || that.buffer == null) {
            return buffer == that.buffer;
        }
        return buffer == that.buffer || Arrays.equals(buffer.values(), that.buffer.values());
    }

    @Override
    public int hashCode() {
        return buffer == null ? 0 : Arrays.hashCode(buffer.values());
    }

    @Override
    public String toString() {
        String name = getClass().getSimpleName();
        return buffer == null ? name + "[NULL]" : name + Arrays.toString(buffer.values());
    }
}
