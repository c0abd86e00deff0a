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
import io.github.jbellis.jroaring.RoaringBitmap;
import io.github.jbellis.jroaring.SetOperation;
import org.openjdk.jmh.annotations.*;

import java.util.concurrent.TimeUnit;

/**
 * The four set operations on two bitmaps that overlap by about half, both returning a new
 * bitmap and in place.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Thread)
@Fork(1)
@Warmup(iterations = 2)
@Measurement(iterations = 3)
@Threads(1)
public class SetOperationBenchmark {
    @Param({"NARROW", "WIDE"})
    private KeyMode mode;

    @Param({"1000", "100000"})
    private int count;

    @Param({"UNION", "INTERSECTION", "DIFFERENCE", "SYMMETRIC_DIFFERENCE"})
    private SetOperation operation;

    private RoaringBitmap left;
    private RoaringBitmap right;

    @Setup
    public void setup() {
        long[] a = BenchmarkData.values(mode, count, true, 1);
        long[] b = BenchmarkData.values(mode, count, true, 2);
        System.arraycopy(a, 0, b, 0, count / 2);
        left = RoaringBitmap.of(mode, a);
        right = RoaringBitmap.of(mode, b);
    }

    @Benchmark
    public RoaringBitmap combine() {
        switch (operation) {
            case UNION:
                return left.union(right);
            case INTERSECTION:
                return left.intersection(right);
            case DIFFERENCE:
                return left.difference(right);
            case SYMMETRIC_DIFFERENCE:
                return left.symmetricDifference(right);
            default:
                throw new IllegalStateException("Unknown operation " + operation);
        }
    }

    @Benchmark
    public RoaringBitmap combineInPlace() {
        var target = left.copy();
        switch (operation) {
            case UNION:
                target.unionWith(right);
                break;
            case INTERSECTION:
                target.intersectWith(right);
                break;
            case DIFFERENCE:
                target.subtract(right);
                break;
            case SYMMETRIC_DIFFERENCE:
                target.symmetricDifferenceWith(right);
                break;
            default:
                throw new IllegalStateException("Unknown operation " + operation);
        }
        return target;
    }
}
