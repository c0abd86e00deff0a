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

import io.github.jbellis.jroaring.RandomizedBitmapBase;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class TestContainerPolicy extends RandomizedBitmapBase {

    @Before
    public void requireDefaultPolicy() {
        assumeTrue("checks the default thresholds",
                   ContainerPolicy.ARRAY_MAX_CARDINALITY == ContainerPolicy.DEFAULT_ARRAY_MAX_CARDINALITY
                   && ContainerPolicy.RUNS_ENABLED);
    }

    @Test
    public void testSizes() {
        assertEquals(0, ContainerPolicy.arraySizeInBytes(0));
        assertEquals(8192, ContainerPolicy.arraySizeInBytes(4096));
        assertEquals(8192, ContainerPolicy.bitmapSizeInBytes());
        assertEquals(6, ContainerPolicy.runSizeInBytes(1));
        assertEquals(2 + 4 * 100, ContainerPolicy.runSizeInBytes(100));
    }

    @Test
    public void testArrayBitmapThreshold() {
        assertEquals(ContainerKind.ARRAY, ContainerPolicy.bestKind(0, 0));
        assertEquals(ContainerKind.ARRAY, ContainerPolicy.bestKind(1, 1));
        assertEquals(ContainerKind.ARRAY, ContainerPolicy.bestKind(4096, 4096));
        assertEquals(ContainerKind.BITMAP, ContainerPolicy.bestKind(4097, 4097));
        assertEquals(ContainerKind.BITMAP, ContainerPolicy.bestKind(65536 / 2, 65536 / 2));
    }

    @Test
    public void testRunsMustBeStrictlySmaller() {
        // 3 consecutive values: 6 bytes either way, the array wins the tie
        assertEquals(ContainerKind.ARRAY, ContainerPolicy.bestKind(3, 1));
        assertEquals(ContainerKind.RUN, ContainerPolicy.bestKind(4, 1));
        // 2047 runs take 8190 bytes, 2048 runs take 8194
        assertEquals(ContainerKind.RUN, ContainerPolicy.bestKind(10000, 2047));
        assertEquals(ContainerKind.BITMAP, ContainerPolicy.bestKind(10000, 2048));
        assertEquals(ContainerKind.RUN, ContainerPolicy.bestKind(65536, 1));
        // 1000 values in 400 runs: 1602 bytes of runs against 2000 of array
        assertEquals(ContainerKind.RUN, ContainerPolicy.bestKind(1000, 400));
        assertEquals(ContainerKind.ARRAY, ContainerPolicy.bestKind(1000, 500));
    }
}
