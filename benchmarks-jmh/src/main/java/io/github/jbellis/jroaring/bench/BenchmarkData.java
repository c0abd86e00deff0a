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

package io.github.jbellis.jroaring.bench;

import io.github.jbellis.jroaring.KeyMode;

import java.util.Arrays;
import java.util.Random;

/**
 * Deterministic inputs shared by the benchmarks.
 */
final class BenchmarkData {
    private BenchmarkData() {
    }

    /**
     * @return {@code count} random values of the mode's range, sorted in unsigned order if requested
     */
    static long[] values(KeyMode mode, int count, boolean sorted, long seed) {
        Random random = new Random(seed);
        long[] values = new long[count];
        for (int i = 0; i < count; i++) {
            values[i] = mode == KeyMode.NARROW ? random.nextInt() & 0xFFFF_FFFFL : random.nextLong();
        }
        if (sorted) {
            // flipping the sign bit makes signed order match unsigned order
            for (int i = 0; i < count; i++) {
                values[i] ^= Long.MIN_VALUE;
            }
            Arrays.sort(values);
            for (int i = 0; i < count; i++) {
                values[i] ^= Long.MIN_VALUE;
            }
        }
        return values;
    }
}
