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

import java.util.Objects;

/// Conversion between bin edges and the points at bin centres.
final class PointConversion {

    private PointConversion() {
    }

    static SharedDoubleBuffer centresOf(BinEdges edges) {
        Objects.requireNonNull(edges, "edges");
        if (!edges.hasData()) {
            return null;
        }
        if (edges.size() == 1) {
            throw new HistogramLogicException("Cannot construct Points: BinEdges of size 1 delimit no bin");
        }
        int count = Math.max(0, edges.size() - 1);
        double[] centres = new double[count];
        for (int i = 0; i < count; i++) {
            centres[i] = 0.5 * (edges.get(i) + edges.get(i + 1));
        }
        return SharedDoubleBuffer.adopt(centres);
    }

    static SharedDoubleBuffer edgesAround(Points points) {
        Objects.requireNonNull(points, "points");
        if (!points.hasData()) {
            return null;
        }
        int count = points.size();
        if (count == 0) {
            return SharedDoubleBuffer.adopt(new double[0]);
        }
        double[] edges = new double[count + 1];
        if (count == 1) {
            edges[0] = points.get(0) - 0.5;
            edges[1] = points.get(0) + 0.5;
            return SharedDoubleBuffer.adopt(edges);
        }
        for (int i = 1; i < count; i++) {
            edges[i] = 0.5 * (points.get(i - 1) + points.get(i));
        }
        // outer edges mirror the nearest interior edge about the outer point
        edges[0] = points.get(0) - (edges[1] - points.get(0));
        edges[count] = points.get(count - 1) + (points.get(count - 1) - edges[count - 1]);
        return SharedDoubleBuffer.adopt(edges);
    }
}
