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

package io.github.jbellis.jroaring.example;

import io.github.jbellis.jroaring.KeyMode;
import io.github.jbellis.jroaring.RoaringBitmap;
import io.github.jbellis.jroaring.codec.SerializationFormat;

import java.util.Arrays;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Prints the heap and serialized footprint of randomly populated bitmaps of increasing size,
 * in both key modes.
 */
public class MemSizeExample {
    private static final int[] COUNTS = {0, 1, 10, 100, 1_000, 10_000, 100_000, 1_000_000};

    public static void main(String[] args) {
        System.out.printf("%9s %12s %12s %12s %12s%n", "count", "narrow heap", "portable", "wide heap", "compact");
        for (int count : COUNTS) {
            var narrow = randomBitmap(KeyMode.NARROW, count);
            var wide = randomBitmap(KeyMode.WIDE, count);
            System.out.printf("%9d %12s %12s %12s %12s%n", count,
                              humanReadable(narrow.ramBytesUsed()),
                              humanReadable(narrow.serializedSizeInBytes(SerializationFormat.PORTABLE)),
                              humanReadable(wide.ramBytesUsed()),
                              humanReadable(wide.serializedSizeInBytes(SerializationFormat.COMPACT)));
        }
    }

    /**
     * Builds a bitmap from {@code count} uniformly random values of the mode's range.
     */
    static RoaringBitmap randomBitmap(KeyMode mode, int count) {
        var random = ThreadLocalRandom.current();
        long[] values = new long[count];
        for (int i = 0; i < count; i++) {
            values[i] = mode == KeyMode.NARROW ? random.nextInt() & 0xFFFF_FFFFL : random.nextLong();
        }
        Arrays.sort(values);
        return RoaringBitmap.of(mode, values);
    }

    // decimal units
    static String humanReadable(long bytes) {
        if (bytes < 1000) {
            return bytes + " B";
        }
        String[] units = {"kB", "MB", "GB", "TB"};
        double value = bytes;
        int unit = -1;
        while (value >= 1000 && unit < units.length - 1) {
            value /= 1000;
            unit++;
        }
        return String.format("%.2f %s", value, units[unit]);
    }
}
