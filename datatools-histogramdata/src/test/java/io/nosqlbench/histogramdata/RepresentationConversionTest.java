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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

@DisplayName("variance <-> standard deviation")
class RepresentationConversionTest {

    private static final double TOLERANCE = 1e-14;

    static Stream<Arguments> nonNegativeSeries() {
        return Stream.of(
            Arguments.of((Object) new double[0]),
            Arguments.of((Object) new double[]{0.0}),
            Arguments.of((Object) new double[]{1.0, 2.0, 3.0}),
            Arguments.of((Object) new double[]{0.25, 9.0, 0.01, 7.5}),
            Arguments.of((Object) new double[]{Double.MIN_NORMAL, 1e-3})
        );
    }

    @Test
    void standardDeviationsAreSquareRoots() {
        CountStandardDeviations sigma = new CountStandardDeviations(new CountVariances(4.0, 0.0, 2.25));
        assertThat(sigma.toArray()).containsExactly(2.0, 0.0, 1.5);
    }

    @Test
    void variancesAreSquares() {
        FrequencyVariances variances = new FrequencyVariances(new FrequencyStandardDeviations(3.0, 0.5));
        assertThat(variances.toArray()).containsExactly(9.0, 0.25);
    }

    @Test
    void nanIsCarriedThrough() {
        CountStandardDeviations sigma = new CountStandardDeviations(new CountVariances(Double.NaN, 1.0));
        assertThat(sigma.get(0)).isNaN();
        assertThat(sigma.get(1)).isEqualTo(1.0);
    }

    @ParameterizedTest
    @MethodSource("nonNegativeSeries")
    void varianceRoundTrip(double[] values) {
        CountVariances variances = new CountVariances(values);
        CountVariances roundTrip = new CountVariances(new CountStandardDeviations(variances));
        assertThat(roundTrip.toArray()).containsExactly(values, within(TOLERANCE));
    }

    @ParameterizedTest
    @MethodSource("nonNegativeSeries")
    void standardDeviationRoundTrip(double[] values) {
        FrequencyStandardDeviations sigma = new FrequencyStandardDeviations(values);
        FrequencyStandardDeviations roundTrip = new FrequencyStandardDeviations(new FrequencyVariances(sigma));
        assertThat(roundTrip.toArray()).containsExactly(values, within(TOLERANCE));
    }

    @Test
    void copyConversionLeavesSourceIntact() {
        CountVariances variances = new CountVariances(4.0, 9.0);
        new CountStandardDeviations(variances);
        assertThat(variances.toArray()).containsExactly(4.0, 9.0);
    }

    @Test
    void nullConvertsToNull() {
        assertThat(new CountStandardDeviations(new CountVariances()).hasData()).isFalse();
        assertThat(new CountVariances(new CountStandardDeviations()).hasData()).isFalse();
        assertThat(new FrequencyStandardDeviations(new FrequencyVariances()).hasData()).isFalse();
        assertThat(new FrequencyVariances(new FrequencyStandardDeviations()).hasData()).isFalse();
        assertThat(CountStandardDeviations.consume(new CountVariances()).hasData()).isFalse();
        assertThat(FrequencyVariances.consume(new FrequencyStandardDeviations()).hasData()).isFalse();
    }

    @Test
    void consumeReusesUnsharedBuffer() {
        CountVariances variances = new CountVariances(1.0, 4.0);
        SharedDoubleBuffer before = variances.buffer();

        CountStandardDeviations sigma = CountStandardDeviations.consume(variances);

        assertThat(variances.hasData()).isFalse();
        assertThat(sigma.buffer()).isSameAs(before);
        assertThat(sigma.toArray()).containsExactly(1.0, 2.0);
    }

    @Test
    void consumeCopiesSharedBuffer() {
        assumeTrue(SharingMode.effective() == SharingMode.COPY_ON_WRITE);
        FrequencyStandardDeviations sigma = new FrequencyStandardDeviations(2.0, 3.0);
        FrequencyStandardDeviations otherHolder = new FrequencyStandardDeviations(sigma);
        SharedDoubleBuffer before = sigma.buffer();

        FrequencyVariances variances = FrequencyVariances.consume(sigma);

        assertThat(sigma.hasData()).isFalse();
        assertThat(variances.buffer()).isNotSameAs(before);
        assertThat(variances.toArray()).containsExactly(4.0, 9.0);
        assertThat(otherHolder.buffer()).isSameAs(before);
        assertThat(otherHolder.toArray()).containsExactly(2.0, 3.0);
    }

    @Test
    void consumePreservesLength() {
        CountVariances variances = CountVariances.consume(new CountStandardDeviations(5));
        assertThat(variances.size()).isEqualTo(5);
    }
}
