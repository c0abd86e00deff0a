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

import io.github.jbellis.jroaring.RoaringBitmap;
import io.github.jbellis.jroaring.codec.SerializationFormat;
import io.github.jbellis.jroaring.exceptions.InvalidFormatException;
import org.openjdk.jmh.annotations.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Encoding and decoding in each format, with sparse, clustered and contiguous data.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Thread)
@Fork(1)
@Warmup(iterations = 2)
@Measurement(iterations = 3)
@Threads(1)
public class CodecBenchmark {
    private static final Logger log = LoggerFactory.getLogger(CodecBenchmark.class);

    @Param({"PORTABLE", "COMPACT"})
    private SerializationFormat format;

    @Param({"sparse", "clustered", "contiguous"})
    private String shape;

    @Param({"100000"})
    private int count;

    private RoaringBitmap bitmap;
    private byte[] encoded;

    @Setup
    public void setup() {
        bitmap = new RoaringBitmap(format.mode());
        switch (shape) {
            case "sparse":
                bitmap.addAll(BenchmarkData.values(format.mode(), count, true, 3));
                break;
            case "clustered":
                for (long v : BenchmarkData.values(format.mode(), count / 100, true, 3)) {
                    long start = v & ~0xFFFFL;
                    for (int i = 0; i < 100; i++) {
                        bitmap.add(start + 3 * i);
                    }
                }
                break;
            case "contiguous":
                bitmap.addRange(0, count);
                break;
            default:
                throw new IllegalArgumentException("Unknown shape " + shape);
        }
        encoded = bitmap.toBytes(format);
        log.info("{} {} bitmap of {} values: {} bytes encoded, {} bytes on heap", shape, format,
                 bitmap.cardinality(), encoded.length, bitmap.ramBytesUsed());
    }

    @Benchmark
    public byte[] encode() {
        return bitmap.toBytes(format);
    }

    @Benchmark
    public RoaringBitmap decode() throws InvalidFormatException {
        return RoaringBitmap.fromBytes(format, encoded);
    }
}
