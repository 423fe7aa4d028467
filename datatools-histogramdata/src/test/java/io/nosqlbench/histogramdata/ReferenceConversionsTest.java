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

import com.google.gson.Gson;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

/// Checks conversions against the reference values in `histogramdata/reference-conversions.json`.
@Tag("unit")
class ReferenceConversionsTest {

    private static final String RESOURCE = "/histogramdata/reference-conversions.json";

    private static final Map<String, BiFunction<double[], BinEdges, NumericSeries<?>>> CONVERSIONS = Map.of(
        "CountStandardDeviations->FrequencyStandardDeviations",
        (v, e) -> new FrequencyStandardDeviations(new CountStandardDeviations(v), e),
        "FrequencyStandardDeviations->CountStandardDeviations",
        (v, e) -> new CountStandardDeviations(new FrequencyStandardDeviations(v), e),
        "FrequencyVariances->CountVariances",
        (v, e) -> new CountVariances(new FrequencyVariances(v), e),
        "CountVariances->FrequencyVariances",
        (v, e) -> new FrequencyVariances(new CountVariances(v), e),
        "CountVariances->CountStandardDeviations",
        (v, e) -> new CountStandardDeviations(new CountVariances(v)),
        "FrequencyStandardDeviations->FrequencyVariances",
        (v, e) -> new FrequencyVariances(new FrequencyStandardDeviations(v)),
        "Counts->Frequencies",
        (v, e) -> new Frequencies(new Counts(v), e)
    );

    static final class ReferenceFile {
        double tolerance;
        List<ReferenceCase> cases;
    }

    static final class ReferenceCase {
        String name;
        String conversion;
        double[] values;
        double[] edges;
        double[] expected;

        @Override
        public String toString() {
            return name;
        }
    }

    private static ReferenceFile load() {
        try (InputStream in = Objects.requireNonNull(
                ReferenceConversionsTest.class.getResourceAsStream(RESOURCE), RESOURCE);
             Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return new Gson().fromJson(reader, ReferenceFile.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    static Stream<Arguments> referenceCases() {
        ReferenceFile file = load();
        return file.cases.stream().map(c -> Arguments.of(c, file.tolerance));
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("referenceCases")
    void matchesReference(ReferenceCase reference, double tolerance) {
        BiFunction<double[], BinEdges, NumericSeries<?>> conversion = CONVERSIONS.get(reference.conversion);
        assertThat(conversion).as("conversion %s", reference.conversion).isNotNull();

        BinEdges edges = reference.edges == null ? new BinEdges() : new BinEdges(reference.edges);
        NumericSeries<?> result = conversion.apply(reference.values, edges);

        assertThat(result.toArray()).containsExactly(reference.expected, within(tolerance));
    }
}
