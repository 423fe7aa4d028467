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

import io.nosqlbench.histogramdata.BinEdges;
import io.nosqlbench.histogramdata.Points;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

@DisplayName("XValidator")
class XValidatorTest {

    static Stream<Arguments> cases() {
        return Stream.of(
            Arguments.of(new double[0], true),
            Arguments.of(new double[]{1.0}, true),
            Arguments.of(new double[]{1.0, 2.0}, true),
            Arguments.of(new double[]{1.0, 2.0, 2.0, 3.0}, false),
            Arguments.of(new double[]{1.0, 3.0, 2.0, 4.0}, false),
            Arguments.of(new double[]{Double.NaN, 1.0}, false),
            Arguments.of(new double[]{1.0, Double.NaN}, false),
            Arguments.of(new double[]{Double.NaN}, false),
            Arguments.of(new double[]{Double.POSITIVE_INFINITY}, false),
            Arguments.of(new double[]{Double.NEGATIVE_INFINITY, 0.0}, false),
            Arguments.of(new double[]{0.0, Double.MIN_NORMAL / 2.0}, false),
            Arguments.of(new double[]{0.0, Double.MIN_NORMAL}, true),
            Arguments.of(new double[]{Double.MIN_VALUE}, true),
            Arguments.of(new double[]{-Double.MAX_VALUE / 2.0, Double.MAX_VALUE / 2.0}, true),
            Arguments.of(new double[]{-Double.MAX_VALUE, Double.MAX_VALUE}, false),
            Arguments.of(new double[]{-Double.MAX_VALUE}, true),
            Arguments.of(new double[]{-3.0, -2.5, 0.0, 1e300}, true)
        );
    }

    @ParameterizedTest
    @MethodSource("cases")
    void binEdges(double[] values, boolean valid) {
        assertThat(XValidator.isValid(new BinEdges(values))).isEqualTo(valid);
    }

    @ParameterizedTest
    @MethodSource("cases")
    void points(double[] values, boolean valid) {
        assertThat(XValidator.isValid(new Points(values))).isEqualTo(valid);
    }

    @Test
    void constructionDoesNotValidate() {
        BinEdges decreasing = new BinEdges(2.0, 1.0);
        assertThat(decreasing.size()).isEqualTo(2);
        assertThat(XValidator.isValid(decreasing)).isFalse();
    }

    @Test
    void nullSeriesIsRejected() {
        assertThatThrownBy(() -> XValidator.isValid(new BinEdges()))
            .isInstanceOf(IllegalStateException.class);
    }
}
