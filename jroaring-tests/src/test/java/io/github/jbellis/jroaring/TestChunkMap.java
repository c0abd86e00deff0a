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

import io.github.jbellis.jroaring.container.Container;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class TestChunkMap extends RandomizedBitmapBase {

    private static ChunkMap mapOf(long... keysAndValues) {
        ChunkMap map = new ChunkMap();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            int index = map.getOrCreate(keysAndValues[i]);
            map.containerAt(index).add((char) keysAndValues[i + 1]);
        }
        return map;
    }

    private static List<Long> keys(ChunkMap map) {
        List<Long> keys = new ArrayList<>();
        for (ChunkMap.Chunk chunk : map) {
            keys.add(chunk.key());
        }
        return keys;
    }

    @Test
    public void testGetOrCreateKeepsKeysSorted() {
        ChunkMap map = new ChunkMap(1);
        long[] keys = {50, 3, 1L << 40, 0, 7, 3, 50};
        for (long key : keys) {
            int i = map.getOrCreate(key);
            assertEquals(key, map.keyAt(i));
            map.containerAt(i).add((char) 1);
        }
        assertEquals(List.of(0L, 3L, 7L, 50L, 1L << 40), keys(map));
        assertEquals(5, map.size());
        assertEquals(5, map.cardinality());
        assertNull(map.get(4));
        assertTrue(map.get(7).contains((char) 1));
        assertThrows(IndexOutOfBoundsException.class, () -> map.keyAt(5));
    }

    @Test
    public void testRemoveIfEmpty() {
        ChunkMap map = mapOf(1, 10, 2, 20, 3, 30);
        assertFalse(map.removeIfEmpty(2));
        map.get(2).remove((char) 20);
        assertTrue(map.removeIfEmpty(2));
        assertFalse(map.removeIfEmpty(2));
        assertEquals(List.of(1L, 3L), keys(map));
    }

    @Test
    public void testAppendValidates() {
        ChunkMap map = new ChunkMap();
        map.append(5, Container.of((char) 1));
        assertThrows(IllegalArgumentException.class, () -> map.append(5, Container.of((char) 1)));
        assertThrows(IllegalArgumentException.class, () -> map.append(4, Container.of((char) 1)));
        assertThrows(IllegalArgumentException.class, () -> map.append(6, new Container()));
        map.append(6, Container.of((char) 2));
        assertEquals(2, map.size());
    }

    @Test
    public void testMergeKeepsOrDropsUnmatchedChunks() {
        ChunkMap left = mapOf(1, 1, 2, 2, 4, 4);
        ChunkMap right = mapOf(2, 2, 3, 3, 4, 5);

        assertEquals(List.of(1L, 2L, 3L, 4L), keys(ChunkMap.merge(left, right, SetOperation.UNION, false)));
        assertEquals(List.of(2L), keys(ChunkMap.merge(left, right, SetOperation.INTERSECTION, false)));
        assertEquals(List.of(1L, 4L), keys(ChunkMap.merge(left, right, SetOperation.DIFFERENCE, false)));
        assertEquals(List.of(1L, 3L, 4L), keys(ChunkMap.merge(left, right, SetOperation.SYMMETRIC_DIFFERENCE, false)));
        assertEquals(2, ChunkMap.merge(left, right, SetOperation.SYMMETRIC_DIFFERENCE, false).get(4).cardinality());
    }

    @Test
    public void testMergeSharingRules() {
        ChunkMap left = mapOf(1, 1, 2, 2);
        ChunkMap right = mapOf(2, 3, 3, 3);

        ChunkMap copied = ChunkMap.merge(left, right, SetOperation.UNION, false);
        assertNotSame(left.get(1), copied.get(1));
        assertNotSame(right.get(3), copied.get(3));

        ChunkMap reused = ChunkMap.merge(left, right, SetOperation.UNION, true);
        assertSame(left.get(1), reused.get(1));
        assertNotSame(right.get(3), reused.get(3));
        assertNotSame(left.get(2), reused.get(2));
    }

    @Test
    public void testCopyIsDeep() {
        ChunkMap map = mapOf(1, 1, 9, 9);
        ChunkMap copy = map.copy();
        assertEquals(map, copy);
        assertEquals(map.hashCode(), copy.hashCode());
        copy.get(1).add((char) 2);
        assertEquals(1, map.get(1).cardinality());
        assertFalse(map.equals(copy));
        assertTrue(map.ramBytesUsed() > 0);
    }
}
