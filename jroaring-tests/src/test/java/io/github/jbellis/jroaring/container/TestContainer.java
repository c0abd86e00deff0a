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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.PrimitiveIterator;
import java.util.Random;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class TestContainer extends RandomizedBitmapBase {

    @Before
    public void requireDefaultPolicy() {
        assumeTrue("container kinds are checked against the default thresholds",
                   ContainerPolicy.ARRAY_MAX_CARDINALITY == ContainerPolicy.DEFAULT_ARRAY_MAX_CARDINALITY
                   && ContainerPolicy.RUNS_ENABLED);
    }

    @Test
    public void testAddRemoveContains() {
        Container c = new Container();
        assertTrue(c.isEmpty());
        assertTrue(c.add((char) 7));
        assertFalse(c.add((char) 7));
        assertTrue(c.add((char) 0));
        assertTrue(c.add((char) 65535));
        assertEquals(3, c.cardinality());
        assertTrue(c.contains((char) 0));
        assertTrue(c.contains((char) 7));
        assertTrue(c.contains((char) 65535));
        assertFalse(c.contains((char) 8));

        assertTrue(c.remove((char) 7));
        assertFalse(c.remove((char) 7));
        assertFalse(c.remove((char) 1234));
        assertEquals(2, c.cardinality());
        assertFalse(c.contains((char) 7));
    }

    @Test
    public void testSequentialValuesThroughArrayThreshold() {
        Container c = new Container();
        for (int v = 0; v < 4096; v++) {
            c.add((char) v);
        }
        assertEquals(4096, c.cardinality());
        assertTrue(c.add((char) 4096));

        for (int v = 0; v <= 4096; v++) {
            assertTrue(c.contains((char) v));
        }
        assertFalse(c.contains((char) 4097));
        PrimitiveIterator.OfInt it = c.iterator();
        for (int v = 0; v <= 4096; v++) {
            assertEquals(v, it.nextInt());
        }
        assertFalse(it.hasNext());
        // a single run is cheapest
        assertEquals(ContainerKind.RUN, c.kind());
        assertEquals(1, c.runCount());
    }

    @Test
    public void testArrayBecomesBitmapAndBack() {
        Container c = new Container();
        BitSet expected = new BitSet();
        for (int i = 0; i < 4096; i++) {
            c.add((char) (2 * i));
            expected.set(2 * i);
        }
        assertEquals(ContainerKind.ARRAY, c.kind());
        assertSameValues(expected, c);

        c.add((char) 8192);
        expected.set(8192);
        assertEquals(ContainerKind.BITMAP, c.kind());
        assertSameValues(expected, c);
        for (int v = 0; v <= 8193; v++) {
            assertEquals(expected.get(v), c.contains((char) v));
        }

        c.remove((char) 0);
        expected.clear(0);
        assertEquals(ContainerKind.ARRAY, c.kind());
        assertSameValues(expected, c);
    }

    @Test
    public void testThroughAllRepresentations() {
        Container c = new Container();
        BitSet expected = new BitSet();
        for (int v = 0; v <= 8192; v += 2) {
            c.add((char) v);
            expected.set(v);
        }
        assertEquals(ContainerKind.BITMAP, c.kind());
        assertEquals(4097, c.runCount());

        // filling the gaps merges runs until runs are the smallest encoding
        for (int v = 1; v < 8192; v += 2) {
            c.add((char) v);
            expected.set(v);
            assertEquals(countRuns(expected), c.runCount());
        }
        assertEquals(ContainerKind.RUN, c.kind());
        assertEquals(1, c.runCount());
        assertSameValues(expected, c);

        for (int v = 8192; v >= 3; v--) {
            c.remove((char) v);
            expected.clear(v);
        }
        assertEquals(ContainerKind.ARRAY, c.kind());
        assertSameValues(expected, c);
    }

    @Test
    public void testRandomOperationsMatchReference() {
        Random random = getRandom();
        Container c = new Container();
        BitSet expected = new BitSet();
        int window = 1 + random.nextInt(65536);
        int base = random.nextInt(65536 - window + 1);
        for (int step = 0; step < 20000; step++) {
            char v = (char) (base + random.nextInt(window));
            if (random.nextInt(3) > 0) {
                assertEquals(!expected.get(v), c.add(v));
                expected.set(v);
            } else {
                assertEquals(expected.get(v), c.remove(v));
                expected.clear(v);
            }
            assertEquals(expected.cardinality(), c.cardinality());
            assertTrue(c.contains(v) == expected.get(v));
            if (step % 500 == 0) {
                assertEquals(countRuns(expected), c.runCount());
                assertEquals(ContainerPolicy.bestKind(c.cardinality(), c.runCount()), c.kind());
            }
        }
        assertEquals(countRuns(expected), c.runCount());
        assertSameValues(expected, c);
    }

    @Test
    public void testRankSelectMinMax() {
        Random random = getRandom();
        for (int trial = 0; trial < 20; trial++) {
            BitSet bits = randomLows(random);
            Container c = containerOf(bits);
            assertEquals(bits.nextSetBit(0), c.min());
            assertEquals(bits.length() - 1, c.max());
            int index = 0;
            for (int v = bits.nextSetBit(0); v >= 0; v = bits.nextSetBit(v + 1)) {
                assertEquals(v, c.select(index));
                assertEquals(index + 1, c.rank((char) v));
                index++;
            }
            for (int i = 0; i < 100; i++) {
                char v = (char) random.nextInt(65536);
                assertEquals(bits.get(0, v + 1).cardinality(), c.rank(v));
            }
            assertThrows(IndexOutOfBoundsException.class, () -> c.select(c.cardinality()));
            assertThrows(IndexOutOfBoundsException.class, () -> c.select(-1));
        }
    }

    @Test
    public void testEmptyContainer() {
        Container c = new Container();
        assertThrows(NoSuchElementException.class, c::min);
        assertThrows(NoSuchElementException.class, c::max);
        assertEquals(0, c.rank((char) 65535));
        assertFalse(c.iterator().hasNext());
        assertThrows(NoSuchElementException.class, () -> c.iterator().nextInt());
        assertEquals(0, c.runCount());
    }

    @Test
    public void testAddRange() {
        Random random = getRandom();
        for (int trial = 0; trial < 20; trial++) {
            BitSet bits = randomLows(random);
            Container c = containerOf(bits);
            int start = random.nextInt(65536);
            int end = start + random.nextInt(65536 - start + 1);
            int before = bits.cardinality();
            bits.set(start, end);
            assertEquals(bits.cardinality() - before, c.addRange(start, end));
            assertSameValues(bits, c);
            assertEquals(countRuns(bits), c.runCount());
        }

        Container full = new Container();
        assertEquals(65536, full.addRange(0, 65536));
        assertEquals(65536, full.cardinality());
        assertEquals(ContainerKind.RUN, full.kind());
        assertEquals(0, full.addRange(100, 100));
        assertThrows(IllegalArgumentException.class, () -> full.addRange(5, 4));
        assertThrows(IllegalArgumentException.class, () -> full.addRange(0, 65537));
    }

    @Test
    public void testForEachRunAndToWords() {
        Random random = getRandom();
        for (int trial = 0; trial < 20; trial++) {
            BitSet bits = randomLows(random);
            Container c = containerOf(bits);

            List<int[]> runs = new ArrayList<>();
            c.forEachRun((start, length) -> runs.add(new int[] {start, length}));
            assertEquals(c.runCount(), runs.size());
            int v = bits.nextSetBit(0);
            for (int[] run : runs) {
                assertEquals(v, run[0]);
                int end = bits.nextClearBit(v);
                assertEquals(end - v, run[1]);
                v = bits.nextSetBit(end);
            }
            assertEquals(-1, v);

            long[] expected = Arrays.copyOf(bits.toLongArray(), ContainerPolicy.BITMAP_WORDS);
            assertArrayEquals(expected, c.toWords());

            char[] values = c.toSortedValues();
            assertEquals(c.cardinality(), values.length);
        }
    }

    @Test
    public void testFactories() {
        Container fromValues = Container.fromSortedValues(new char[] {1, 2, 3, 10, 0}, 4);
        assertEquals(4, fromValues.cardinality());
        assertEquals(2, fromValues.runCount());

        long[] words = new long[ContainerPolicy.BITMAP_WORDS];
        words[0] = 0b1110L;
        words[1] = 1L;
        Container fromWords = Container.fromWords(words);
        assertEquals(fromValues.cardinality(), fromWords.cardinality());
        assertTrue(fromWords.contains((char) 64));
        words[2] = 1L;
        assertFalse("the words are copied", fromWords.contains((char) 128));

        Container fromRuns = Container.fromRuns(new char[] {1, 2, 64, 0}, 2);
        assertEquals(fromWords, fromRuns);
        assertEquals(fromWords.hashCode(), fromRuns.hashCode());

        assertThrows(IllegalArgumentException.class, () -> Container.fromSortedValues(new char[] {3, 2}, 2));
        assertThrows(IllegalArgumentException.class, () -> Container.fromSortedValues(new char[] {3, 3}, 2));
        assertThrows(IllegalArgumentException.class, () -> Container.fromWords(new long[10]));
        // adjacent
        assertThrows(IllegalArgumentException.class, () -> Container.fromRuns(new char[] {0, 1, 2, 0}, 2));
        // overlapping
        assertThrows(IllegalArgumentException.class, () -> Container.fromRuns(new char[] {0, 5, 3, 0}, 2));
        // past the end of the domain
        assertThrows(IllegalArgumentException.class, () -> Container.fromRuns(new char[] {65535, 1}, 1));
    }

    @Test
    public void testRange() {
        Container c = Container.range(10, 20);
        assertEquals(10, c.cardinality());
        assertEquals(10, c.min());
        assertEquals(19, c.max());
        assertTrue(Container.range(7, 7).isEmpty());
    }

    @Test
    public void testCopyIsIndependent() {
        Random random = getRandom();
        for (int trial = 0; trial < 10; trial++) {
            BitSet bits = randomLows(random);
            Container original = containerOf(bits);
            Container copy = original.copy();
            assertEquals(original, copy);
            for (int i = 0; i < 100; i++) {
                char v = (char) random.nextInt(65536);
                if (random.nextBoolean()) {
                    copy.add(v);
                } else {
                    copy.remove(v);
                }
            }
            assertSameValues(bits, original);
        }
    }

    @Test
    public void testEquality() {
        Container a = Container.of((char) 1, (char) 5, (char) 9);
        Container b = Container.of((char) 9, (char) 1, (char) 5, (char) 5);
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        b.add((char) 10);
        assertNotEquals(a, b);
        assertNotEquals(a, null);
    }

    @Test
    public void testRamBytesUsed() {
        Container sparse = Container.of((char) 1, (char) 1000, (char) 50000);
        Container dense = new Container();
        for (int v = 0; v < 65536; v += 3) {
            dense.add((char) v);
        }
        assertEquals(ContainerKind.BITMAP, dense.kind());
        assertTrue(sparse.ramBytesUsed() > 0);
        assertTrue(dense.ramBytesUsed() > ContainerPolicy.bitmapSizeInBytes());
        assertTrue(sparse.ramBytesUsed() < dense.ramBytesUsed());
    }
}
