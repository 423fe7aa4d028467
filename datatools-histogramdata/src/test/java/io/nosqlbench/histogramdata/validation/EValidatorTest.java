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

import io.nosqlbench.histogramdata.CountStandardDeviations;
import io.nosqlbench.histogramdata.CountVariances;
import io.nosqlbench.histogramdata.Counts;
import io.nosqlbench.histogramdata.ESeries;
import io.nosqlbench.histogramdata.Frequencies;
import io.nosqlbench.histogramdata.FrequencyStandardDeviations;
import io.nosqlbench.histogramdata.FrequencyVariances;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.function.Function;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

@DisplayName("EValidator")
class EValidatorTest {

    private static final List<Function<double[], ESeries>> FACTORIES = List.of(
        Counts::new,
        Frequencies::new,
        CountVariances::new,
        CountStandardDeviations::new,
        FrequencyVariances::new,
        FrequencyStandardDeviations::new
    );

    static Stream<Arguments> cases() {
        List<Arguments> values = List.of(
            Arguments.of(new double[0], true),
            Arguments.of(new double[]{0.0, 1.0, 2.5}, true),
            Arguments.of(new double[]{-1.0, 1.0, 1.0}, false),
            Arguments.of(new double[]{Double.NaN}, true),
            Arguments.of(new double[]{1.0, Double.NaN, 3.0}, true),
            Arguments.of(new double[]{Double.POSITIVE_INFINITY}, false),
            Arguments.of(new double[]{1.0, Double.NEGATIVE_INFINITY}, false),
            Arguments.of(new double[]{-0.0}, true),
            Arguments.of(new double[]{Double.MIN_VALUE, Double.MAX_VALUE}, true),
            Arguments.of(new double[]{-Double.MIN_VALUE}, false)
        );
        return FACTORIES.stream().flatMap(factory -> values.stream().map(args -> {
            Object[] a = args.get();
            return Arguments.of(factory.apply((double[]) a[0]), a[1]);
        }));
    }

    @ParameterizedTest
    @MethodSource("cases")
    void validity(ESeries series, boolean valid) {
        assertThat(EValidator.isValid(series)).isEqualTo(valid);
    }

    @Test
    void nullSeriesIsRejected() {
        assertThatThrownBy(() -> EValidator.isValid(new CountVariances()))
            .isInstanceOf(IllegalStateException.class);
    }
}
