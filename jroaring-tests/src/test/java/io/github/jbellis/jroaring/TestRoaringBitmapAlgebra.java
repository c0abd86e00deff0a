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

import io.github.jbellis.jroaring.exceptions.KeyModeMismatchException;
import org.junit.Test;

import java.util.Random;
import java.util.TreeSet;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class TestRoaringBitmapAlgebra extends RandomizedBitmapBase {

    private static TreeSet<Long> expected(TreeSet<Long> a, TreeSet<Long> b, SetOperation operation) {
        TreeSet<Long> result = referenceSet();
        switch (operation) {
            case UNION:
                result.addAll(a);
                result.addAll(b);
                break;
            case INTERSECTION:
                result.addAll(a);
                result.retainAll(b);
                break;
            case DIFFERENCE:
                result.addAll(a);
                result.removeAll(b);
                break;
            case SYMMETRIC_DIFFERENCE:
                for (long v : a) {
                    if (!b.contains(v)) {
                        result.add(v);
                    }
                }
                for (long v : b) {
                    if (!a.contains(v)) {
                        result.add(v);
                    }
                }
                break;
            default:
                throw new AssertionError(operation);
        }
        return result;
    }

    private static RoaringBitmap apply(RoaringBitmap a, RoaringBitmap b, SetOperation operation) {
        switch (operation) {
            case UNION:
                return a.union(b);
            case INTERSECTION:
                return a.intersection(b);
            case DIFFERENCE:
                return a.difference(b);
            case SYMMETRIC_DIFFERENCE:
                return a.symmetricDifference(b);
            default:
                throw new AssertionError(operation);
        }
    }

    private static void applyInPlace(RoaringBitmap a, RoaringBitmap b, SetOperation operation) {
        switch (operation) {
            case UNION:
                a.unionWith(b);
                break;
            case INTERSECTION:
                a.intersectWith(b);
                break;
            case DIFFERENCE:
                a.subtract(b);
                break;
            case SYMMETRIC_DIFFERENCE:
                a.symmetricDifferenceWith(b);
                break;
            default:
                throw new AssertionError(operation);
        }
    }

    @Test
    public void testOperationsMatchReference() {
        Random random = getRandom();
        for (KeyMode mode : KeyMode.values()) {
            for (int trial = 0; trial < 10; trial++) {
                RoaringBitmap a = randomBitmap(random, mode);
                RoaringBitmap b = randomBitmap(random, mode);
                TreeSet<Long> ra = toReference(a);
                TreeSet<Long> rb = toReference(b);
                for (SetOperation operation : SetOperation.values()) {
                    RoaringBitmap result = apply(a, b, operation);
                    assertSameValues(expected(ra, rb, operation), result);

                    RoaringBitmap inPlace = a.copy();
                    applyInPlace(inPlace, b, operation);
                    assertEquals(result, inPlace);
                    assertEquals(result.cardinality(), inPlace.cardinality());
                }
                // operands are untouched
                assertSameValues(ra, a);
                assertSameValues(rb, b);
            }
        }
    }

    @Test
    public void testInclusionExclusion() {
        Random random = getRandom();
        for (KeyMode mode : KeyMode.values()) {
            RoaringBitmap a = randomBitmap(random, mode);
            RoaringBitmap b = randomBitmap(random, mode);
            long union = a.union(b).cardinality();
            long intersection = a.intersection(b).cardinality();
            assertEquals(a.cardinality() + b.cardinality(), union + intersection);
            assertEquals(union - intersection, a.symmetricDifference(b).cardinality());
            assertEquals(a.cardinality() - intersection, a.difference(b).cardinality());
            assertEquals(a.union(b), b.union(a));
            assertEquals(a.intersection(b), b.intersection(a));
        }
    }

    @Test
    public void testResultSharesNoStateWithOperands() {
        Random random = getRandom();
        RoaringBitmap a = randomBitmap(random, KeyMode.NARROW);
        TreeSet<Long> reference = toReference(a);
        RoaringBitmap union = a.union(RoaringBitmap.narrow());
        assertEquals(a, union);
        union.addRange(0, 1L << 20);
        union.removeAll(reference.stream().mapToLong(Long::longValue).toArray());
        assertSameValues(reference, a);

        RoaringBitmap target = RoaringBitmap.narrow();
        target.unionWith(a);
        assertEquals(a, target);
        target.addRange(0, 1L << 20);
        target.symmetricDifferenceWith(a);
        assertSameValues(reference, a);
    }

    @Test
    public void testSelfOperations() {
        Random random = getRandom();
        RoaringBitmap a = randomBitmap(random, KeyMode.WIDE);
        RoaringBitmap original = a.copy();
        assertEquals(original, a.union(a));
        assertEquals(original, a.intersection(a));
        assertTrue(a.difference(a).isEmpty());
        assertTrue(a.symmetricDifference(a).isEmpty());

        a.unionWith(a);
        assertEquals(original, a);
        a.intersectWith(a);
        assertEquals(original, a);
        a.symmetricDifferenceWith(a);
        assertTrue(a.isEmpty());
        assertEquals(0, a.chunks().size());
    }

    @Test
    public void testEmptyOperands() {
        Random random = getRandom();
        RoaringBitmap a = randomBitmap(random, KeyMode.NARROW);
        RoaringBitmap empty = RoaringBitmap.narrow();
        assertEquals(a, a.union(empty));
        assertEquals(a, empty.union(a));
        assertTrue(a.intersection(empty).isEmpty());
        assertEquals(a, a.difference(empty));
        assertTrue(empty.difference(a).isEmpty());
        assertEquals(a, a.symmetricDifference(empty));
    }

    @Test
    public void testDisjointChunks() {
        RoaringBitmap a = RoaringBitmap.of(KeyMode.WIDE, 1, 2, 3);
        RoaringBitmap b = RoaringBitmap.of(KeyMode.WIDE, 1L << 40, (1L << 40) + 1);
        RoaringBitmap union = a.union(b);
        assertEquals(5, union.cardinality());
        assertEquals(2, union.chunks().size());
        assertTrue(a.intersection(b).isEmpty());
        assertEquals(a, a.difference(b));
        assertEquals(union, a.symmetricDifference(b));
    }

    @Test
    public void testModeMismatch() {
        RoaringBitmap narrow = RoaringBitmap.of(KeyMode.NARROW, 1, 2, 3);
        RoaringBitmap wide = RoaringBitmap.of(KeyMode.WIDE, 3, 4);
        KeyModeMismatchException e = assertThrows(KeyModeMismatchException.class, () -> narrow.union(wide));
        assertSame(KeyMode.NARROW, e.getExpected());
        assertSame(KeyMode.WIDE, e.getActual());
        assertThrows(KeyModeMismatchException.class, () -> narrow.intersection(wide));
        assertThrows(KeyModeMismatchException.class, () -> wide.difference(narrow));
        assertThrows(KeyModeMismatchException.class, () -> wide.symmetricDifference(narrow));
        assertThrows(KeyModeMismatchException.class, () -> narrow.unionWith(wide));
        assertThrows(KeyModeMismatchException.class, () -> wide.subtract(narrow));
        assertEquals(RoaringBitmap.of(KeyMode.NARROW, 1, 2, 3), narrow);
        assertEquals(RoaringBitmap.of(KeyMode.WIDE, 3, 4), wide);
    }
}
