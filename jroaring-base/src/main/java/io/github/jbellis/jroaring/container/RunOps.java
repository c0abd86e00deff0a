/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.jbellis.jroaring.container;

/**
 * Interval arithmetic over sorted lists of disjoint runs stored as {@code (start, length - 1)} pairs.
 * Each operation walks both lists once.
 */
final class RunOps {
    private RunOps() {
    }

    private static int start(char[] runs, int i) {
        return runs[2 * i];
    }

    private static int end(char[] runs, int i) {
        return runs[2 * i] + runs[2 * i + 1];
    }

    static RunBuilder union(char[] a, int na, char[] b, int nb) {
        RunBuilder out = new RunBuilder(na + nb);
        int i = 0;
        int j = 0;
        while (i < na || j < nb) {
            if (j >= nb || (i < na && start(a, i) <= start(b, j))) {
                out.add(start(a, i), end(a, i));
                i++;
            } else {
                out.add(start(b, j), end(b, j));
                j++;
            }
        }
        return out;
    }

    static RunBuilder intersection(char[] a, int na, char[] b, int nb) {
        RunBuilder out = new RunBuilder(Math.min(na, nb));
        int i = 0;
        int j = 0;
        while (i < na && j < nb) {
            int endA = end(a, i);
            int endB = end(b, j);
            int start = Math.max(start(a, i), start(b, j));
            int end = Math.min(endA, endB);
            if (start <= end) {
                out.add(start, end);
            }
            if (endA < endB) {
                i++;
            } else {
                j++;
            }
        }
        return out;
    }

    static RunBuilder difference(char[] a, int na, char[] b, int nb) {
        RunBuilder out = new RunBuilder(na + nb);
        int j = 0;
        for (int i = 0; i < na; i++) {
            int start = start(a, i);
            int end = end(a, i);
            // runs of b ending before this run cannot affect it or any later run of a
            while (j < nb && end(b, j) < start) {
                j++;
            }
            for (int k = j; k < nb && start(b, k) <= end && start <= end; k++) {
                if (start(b, k) > start) {
                    out.add(start, start(b, k) - 1);
                }
                start = Math.max(start, end(b, k) + 1);
            }
            if (start <= end) {
                out.add(start, end);
            }
        }
        return out;
    }
}
