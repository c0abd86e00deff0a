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

import io.github.jbellis.jroaring.ChunkMapView;
import io.github.jbellis.jroaring.KeyMode;
import io.github.jbellis.jroaring.RandomizedBitmapBase;
import io.github.jbellis.jroaring.RoaringBitmap;
import io.github.jbellis.jroaring.codec.SerializationFormat;
import org.junit.Test;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.Random;
import java.util.TreeSet;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;

/**
 * Runs against the policy the {@code tuned-policy} surefire execution configures:
 * {@code array_max_cardinality=100} and {@code runs_enabled=false}.
 */
public class TestTunedContainerPolicy extends RandomizedBitmapBase {

    private static void requireTunedPolicy() {
        assumeTrue("needs array_max_cardinality=100 and runs_enabled=false",
                   ContainerPolicy.ARRAY_MAX_CARDINALITY == 100 && !ContainerPolicy.RUNS_ENABLED);
    }

    private static void assertNoRuns(RoaringBitmap bitmap) {
        ChunkMapView chunks = bitmap.chunks();
        for (int i = 0; i < chunks.size(); i++) {
            assertNotEquals("chunk " + i, ContainerKind.RUN, chunks.containerAt(i).kind());
        }
    }

    @Test
    public void testClampArrayMaxCardinality() {
        assertEquals(1, ContainerPolicy.clampArrayMaxCardinality(0));
        assertEquals(1, ContainerPolicy.clampArrayMaxCardinality(-5));
        assertEquals(100, ContainerPolicy.clampArrayMaxCardinality(100));
        assertEquals(4096, ContainerPolicy.clampArrayMaxCardinality(4096));
        assertEquals(65535, ContainerPolicy.clampArrayMaxCardinality(65535));
        assertEquals(65535, ContainerPolicy.clampArrayMaxCardinality(65536));
        assertEquals(65535, ContainerPolicy.clampArrayMaxCardinality(Integer.MAX_VALUE));
    }

    @Test
    public void testThresholdFollowsProperty() {
        requireTunedPolicy();
        assertEquals(ContainerKind.ARRAY, ContainerPolicy.bestKind(100, 1));
        assertEquals(ContainerKind.BITMAP, ContainerPolicy.bestKind(101, 1));

        Container c = new Container();
        for (int i = 0; i < 100; i++) {
            c.add((char) (2 * i));
        }
        assertEquals(ContainerKind.ARRAY, c.kind());
        c.add((char) 1000);
        assertEquals(ContainerKind.BITMAP, c.kind());
        assertEquals(101, c.cardinality());
        c.remove((char) 1000);
        assertEquals(ContainerKind.ARRAY, c.kind());
        assertEquals(100, c.cardinality());
    }

    @Test
    public void testRunsNeverChosen() {
        requireTunedPolicy();
        assertEquals(ContainerKind.ARRAY, Container.range(0, 50).kind());
        assertEquals(ContainerKind.BITMAP, Container.range(0, 65536).kind());
        assertEquals(ContainerKind.BITMAP, ContainerPolicy.bestKind(65536, 1));

        RoaringBitmap full = RoaringBitmap.narrow();
        full.addRange(10, 3 * 65536 + 7);
        assertNoRuns(full);

        Random random = getRandom();
        for (KeyMode mode : KeyMode.values()) {
            RoaringBitmap bitmap = new RoaringBitmap(mode);
            TreeSet<Long> expected = referenceSet();
            long key = randomHighKey(random, mode);
            for (int step = 0; step < 5000; step++) {
                long value = KeyMode.compose(key, random.nextInt(1 << 10));
                if (random.nextInt(4) > 0) {
                    assertEquals(expected.add(value), bitmap.add(value));
                } else {
                    assertEquals(expected.remove(value), bitmap.remove(value));
                }
            }
            assertSameValues(expected, bitmap);
            assertNoRuns(bitmap);

            RoaringBitmap other = randomBitmap(random, mode);
            assertNoRuns(bitmap.union(other));
            assertNoRuns(bitmap.intersection(other));
            assertNoRuns(bitmap.difference(other));
            assertNoRuns(bitmap.symmetricDifference(other));
        }
    }

    private static byte[] portableSingleRun(int length) {
        ByteBuffer b = ByteBuffer.allocate(16).order(ByteOrder.LITTLE_ENDIAN);
        b.putInt(12347);
        b.put((byte) 1);
        b.putShort((short) 0).putShort((short) (length - 1));
        b.putShort((short) 1);
        b.putShort((short) 0).putShort((short) (length - 1));
        return Arrays.copyOf(b.array(), b.position());
    }

    @Test
    public void testDecodedRunsFollowPolicy() throws Exception {
        requireTunedPolicy();
        RoaringBitmap small = RoaringBitmap.fromBytes(SerializationFormat.PORTABLE, portableSingleRun(100));
        assertEquals(100, small.cardinality());
        assertEquals(ContainerKind.ARRAY, small.chunks().containerAt(0).kind());

        RoaringBitmap large = RoaringBitmap.fromBytes(SerializationFormat.PORTABLE, portableSingleRun(1000));
        assertEquals(1000, large.cardinality());
        assertEquals(ContainerKind.BITMAP, large.chunks().containerAt(0).kind());

        // one chunk at key 0 holding the run 0..99
        byte[] compact = {1, 0, 2, 0, 0, 0, 99, 0};
        RoaringBitmap decoded = RoaringBitmap.fromBytes(SerializationFormat.COMPACT, compact);
        assertEquals(100, decoded.cardinality());
        assertNoRuns(decoded);

        // without run containers the portable writer uses the no-run cookie
        ByteBuffer header = ByteBuffer.wrap(small.toBytes(SerializationFormat.PORTABLE)).order(ByteOrder.LITTLE_ENDIAN);
        assertEquals(12346, header.getInt());
        assertEquals(small, RoaringBitmap.fromBytes(SerializationFormat.PORTABLE, small.toBytes(SerializationFormat.PORTABLE)));
    }
}
