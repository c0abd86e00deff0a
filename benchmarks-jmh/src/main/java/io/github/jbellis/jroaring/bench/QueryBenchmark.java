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
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.util.concurrent.TimeUnit;

/**
 * Membership tests for present and absent values, removal, and full iteration.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@State(Scope.Thread)
@Fork(1)
@Warmup(iterations = 2)
@Measurement(iterations = 3)
@Threads(1)
public class QueryBenchmark {
    @Param({"NARROW", "WIDE"})
    private KeyMode mode;

    @Param({"10", "10000", "1000000"})
    private int count;

    private RoaringBitmap bitmap;
    private long present;
    private long absent;

    @Setup
    public void setup() {
        long[] values = BenchmarkData.values(mode, count, false, 7);
        bitmap = RoaringBitmap.of(mode, values);
        present = values[values.length / 2];
        absent = bitmap.max().getAsLong() - 1;
        while (bitmap.contains(absent)) {
            absent--;
        }
    }

    @Benchmark
    public boolean containsPresent() {
        return bitmap.contains(present);
    }

    @Benchmark
    public boolean containsAbsent() {
        return bitmap.contains(absent);
    }

    @Benchmark
    public boolean removeAndRestore() {
        bitmap.remove(present);
        return bitmap.add(present);
    }

    @Benchmark
    public void iterate(Blackhole bh) {
        for (var it = bitmap.iterator(); it.hasNext(); ) {
            bh.consume(it.nextLong());
        }
    }
}
