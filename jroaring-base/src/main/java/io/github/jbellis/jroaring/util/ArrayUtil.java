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

package io.github.jbellis.jroaring.util;

import java.util.Arrays;

/**
 * Methods for growing arrays.
 */
public final class ArrayUtil {
    private ArrayUtil() {
    }

    /**
     * Returns an array size &gt;= minTargetSize, over-allocating by about 1/8 (at least 3
     * elements) so that repeated single-element appends stay amortized O(1).
     *
     * @param minTargetSize the minimum required size
     * @return the size to allocate
     */
    public static int oversize(int minTargetSize) {
        if (minTargetSize < 0) {
            throw new IllegalArgumentException("invalid array size " + minTargetSize);
        }
        int extra = Math.max(3, minTargetSize >> 3);
        long newSize = (long) minTargetSize + extra;
        return (int) Math.min(newSize, Integer.MAX_VALUE - 8);
    }

    /**
     * Returns an array whose size is at least {@code minSize}, generally over-allocating
     * exponentially. The returned array is the argument itself if it is already large enough.
     *
     * @param array the array to grow
     * @param minSize the minimum size required
     * @return the same or a new, larger array holding the same leading elements
     */
    public static char[] grow(char[] array, int minSize) {
        assert minSize >= 0 : "size must be positive (got " + minSize + "): likely integer overflow?";
        if (array.length < minSize) {
            return Arrays.copyOf(array, oversize(Math.max(minSize, array.length + (array.length >> 1))));
        }
        return array;
    }

    public static long[] grow(long[] array, int minSize) {
        assert minSize >= 0 : "size must be positive (got " + minSize + "): likely integer overflow?";
        if (array.length < minSize) {
            return Arrays.copyOf(array, oversize(Math.max(minSize, array.length + (array.length >> 1))));
        }
        return array;
    }

    public static <T> T[] grow(T[] array, int minSize) {
        assert minSize >= 0 : "size must be positive (got " + minSize + "): likely integer overflow?";
        if (array.length < minSize) {
            return Arrays.copyOf(array, oversize(Math.max(minSize, array.length + (array.length >> 1))));
        }
        return array;
    }

    /**
     * Returns a copy of the first {@code length} elements, sized exactly.
     * @param array the source array
     * @param length the number of leading elements to keep
     * @return a new array of exactly {@code length} elements
     */
    public static char[] copyOfSubArray(char[] array, int length) {
        return Arrays.copyOf(array, length);
    }
}
