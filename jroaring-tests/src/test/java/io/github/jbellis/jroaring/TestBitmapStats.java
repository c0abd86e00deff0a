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

package io.github.jbellis.jroaring;

import io.github.jbellis.jroaring.container.ContainerKind;
import io.github.jbellis.jroaring.container.ContainerPolicy;
import org.junit.Test;

import java.util.Locale;
import java.util.Random;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class TestBitmapStats extends RandomizedBitmapBase {

    @Test
    public void testEmpty() {
        BitmapStats stats = RoaringBitmap.wide().stats();
        assertEquals(0, stats.containers());
        assertEquals(0, stats.values());
        assertEquals(0, stats.bytes());
        assertFalse(stats.min().isPresent());
        assertFalse(stats.max().isPresent());
        assertTrue(stats.toString().contains("min=none"));
    }

    @Test
    public void testCountsPerKind() {
        assumeTrue("container kinds depend on the default thresholds",
                   ContainerPolicy.ARRAY_MAX_CARDINALITY == ContainerPolicy.DEFAULT_ARRAY_MAX_CARDINALITY
                   && ContainerPolicy.RUNS_ENABLED);
        RoaringBitmap bitmap = RoaringBitmap.narrow();
        // one sparse chunk, one dense irregular chunk, one contiguous chunk
        bitmap.addAll(1, 100, 1000);
        for (long v = 65536; v < 2 * 65536; v += 3) {
            bitmap.add(v);
        }
        bitmap.addRange(2 * 65536, 2 * 65536 + 50000);

        BitmapStats stats = bitmap.stats();
        assertEquals(3, stats.containers());
        assertEquals(bitmap.cardinality(), stats.values());
        int total = 0;
        for (ContainerKind kind : ContainerKind.values()) {
            total += stats.containers(kind);
        }
        assertEquals(stats.containers(), total);
        assertEquals(1, stats.containers(ContainerKind.ARRAY));
        assertEquals(1, stats.containers(ContainerKind.BITMAP));
        assertEquals(1, stats.containers(ContainerKind.RUN));
        assertEquals(3, stats.values(ContainerKind.ARRAY));
        assertEquals(50000, stats.values(ContainerKind.RUN));
        assertTrue(stats.bytes(ContainerKind.BITMAP) > stats.bytes(ContainerKind.ARRAY));
        assertEquals(1, stats.min().getAsLong());
        assertEquals(2 * 65536 + 49999, stats.max().getAsLong());
    }

    @Test
    public void testTotalsMatchBitmap() {
        Random random = getRandom();
        RoaringBitmap bitmap = randomBitmap(random, KeyMode.WIDE);
        BitmapStats stats = bitmap.stats();
        assertEquals(bitmap.chunks().size(), stats.containers());
        assertEquals(bitmap.cardinality(), stats.values());
        assertEquals(bitmap.min(), stats.min());
        assertEquals(bitmap.max(), stats.max());
        assertTrue(stats.bytes() < bitmap.ramBytesUsed());
    }

    @Test
    public void testToStringIgnoresDefaultLocale() {
        RoaringBitmap bitmap = RoaringBitmap.of(KeyMode.NARROW, 1, 2, 3);
        String expected = bitmap.stats().toString();
        Locale previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            // dotless i under Turkish case rules
            String turkish = bitmap.stats().toString();
            assertEquals(expected, turkish);
            assertTrue(turkish, turkish.contains(", bitmap="));
            assertTrue(turkish, turkish.contains(", array="));
        } finally {
            Locale.setDefault(previous);
        }
    }
}
