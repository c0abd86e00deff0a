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

import java.util.concurrent.TimeUnit;

/**
 * Building a bitmap one value at a time, and in bulk, from sorted or shuffled input.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Thread)
@Fork(1)
@Warmup(iterations = 2)
@Measurement(iterations = 3)
@Threads(1)
public class InsertBenchmark {
    @Param({"NARROW", "WIDE"})
    private KeyMode mode;

    @Param({"1", "100", "10000"})
    private int count;

    @Param({"true", "false"})
    private boolean sorted;

    private long[] values;

    @Setup
    public void setup() {
        values = BenchmarkData.values(mode, count, sorted, 42);
    }

    @Benchmark
    public RoaringBitmap insertLoop() {
        var bitmap = new RoaringBitmap(mode);
        for (long v : values) {
            bitmap.add(v);
        }
        return bitmap;
    }

    @Benchmark
    public RoaringBitmap insertAll() {
        return RoaringBitmap.of(mode, values);
    }
}
