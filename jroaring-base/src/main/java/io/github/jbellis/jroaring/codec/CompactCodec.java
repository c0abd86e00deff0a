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

package io.github.jbellis.jroaring.codec;

import io.github.jbellis.jroaring.ChunkMap;
import io.github.jbellis.jroaring.ChunkMapView;
import io.github.jbellis.jroaring.KeyMode;
import io.github.jbellis.jroaring.RoaringBitmap;
import io.github.jbellis.jroaring.annotations.VisibleForTesting;
import io.github.jbellis.jroaring.container.Container;
import io.github.jbellis.jroaring.container.ContainerKind;
import io.github.jbellis.jroaring.container.ContainerPolicy;
import io.github.jbellis.jroaring.container.ContainerView;
import io.github.jbellis.jroaring.exceptions.InvalidFormatException;
import io.github.jbellis.jroaring.io.LittleEndianInput;
import io.github.jbellis.jroaring.io.LittleEndianOutput;

import java.io.IOException;

import static io.github.jbellis.jroaring.io.LittleEndianOutput.varLongSize;

/**
 * A compact format for {@link KeyMode#WIDE} bitmaps. Keys are delta-coded varints, there are no
 * offsets, and each container is written in whichever of the three payloads is smallest, so
 * cardinalities never need to be stored separately. Fixed-width fields are little-endian and
 * varints are unsigned LEB128 in their shortest form:
 * <pre>
 * varint containerCount
 * containerCount x:
 *     varint keyDelta    the key itself for the first container, then key - previousKey (at least 1)
 *     u8     tag         0 array, 1 bitmap, 2 run
 *     array:  varint cardinality - 1 (at most 4095), cardinality x u16
 *     bitmap: 1024 x u64, at least one bit set
 *     run:    varint runCount - 1 (at most 32767), runCount x (u16 start, u16 length - 1)
 * </pre>
 * The representation of a decoded container is re-chosen in memory, so the tag only describes
 * the encoding.
 */
public class CompactCodec extends AbstractBitmapCodec {
    static final int TAG_ARRAY = 0;
    static final int TAG_BITMAP = 1;
    static final int TAG_RUN = 2;

    static final int MAX_ARRAY_CARDINALITY = ContainerPolicy.DEFAULT_ARRAY_MAX_CARDINALITY;
    static final int MAX_RUNS = ContainerPolicy.MAX_CARDINALITY / 2;
    static final long MAX_CONTAINERS = 1L << 48;

    public CompactCodec() {
        super(KeyMode.WIDE);
    }

    /**
     * @return the payload encoding the writer uses for this container
     */
    @VisibleForTesting
    static ContainerKind encodingOf(ContainerView container) {
        int cardinality = container.cardinality();
        int runs = container.runCount();
        ContainerKind best = ContainerKind.BITMAP;
        long bestSize = ContainerPolicy.bitmapSizeInBytes();
        if (cardinality <= MAX_ARRAY_CARDINALITY && arrayPayloadSize(cardinality) <= bestSize) {
            best = ContainerKind.ARRAY;
            bestSize = arrayPayloadSize(cardinality);
        }
        if (runPayloadSize(runs) < bestSize) {
            best = ContainerKind.RUN;
        }
        return best;
    }

    private static long arrayPayloadSize(int cardinality) {
        return varLongSize(cardinality - 1) + (long) cardinality * Short.BYTES;
    }

    private static long runPayloadSize(int runs) {
        return varLongSize(runs - 1) + (long) runs * 2 * Short.BYTES;
    }

    private static long payloadSize(ContainerView container) {
        switch (encodingOf(container)) {
            case ARRAY:
                return arrayPayloadSize(container.cardinality());
            case BITMAP:
                return ContainerPolicy.bitmapSizeInBytes();
            case RUN:
                return runPayloadSize(container.runCount());
            default:
                throw new IllegalStateException("Unknown container kind " + encodingOf(container));
        }
    }

    @Override
    protected long sizeOf(RoaringBitmap bitmap) {
        ChunkMapView chunks = bitmap.chunks();
        long size = varLongSize(chunks.size());
        long previousKey = 0;
        for (int i = 0; i < chunks.size(); i++) {
            long key = chunks.keyAt(i);
            size += varLongSize(key - previousKey) + 1 + payloadSize(chunks.containerAt(i));
            previousKey = key;
        }
        return size;
    }

    @Override
    protected void writeBitmap(RoaringBitmap bitmap, LittleEndianOutput out) throws IOException {
        ChunkMapView chunks = bitmap.chunks();
        out.writeVarLong(chunks.size());
        long previousKey = 0;
        for (int i = 0; i < chunks.size(); i++) {
            long key = chunks.keyAt(i);
            ContainerView container = chunks.containerAt(i);
            out.writeVarLong(key - previousKey);
            previousKey = key;
            switch (encodingOf(container)) {
                case ARRAY:
                    out.writeByte(TAG_ARRAY);
                    out.writeVarLong(container.cardinality() - 1);
                    writeArrayValues(container, out);
                    break;
                case BITMAP:
                    out.writeByte(TAG_BITMAP);
                    writeWords(container, out);
                    break;
                case RUN:
                    out.writeByte(TAG_RUN);
                    out.writeVarLong(container.runCount() - 1);
                    writeRunPairs(container, out);
                    break;
                default:
                    throw new IllegalStateException("Unknown container kind " + encodingOf(container));
            }
        }
    }

    @Override
    protected RoaringBitmap readBitmap(LittleEndianInput in) throws IOException {
        long at = in.position();
        long count = in.readVarLong("container count");
        if (Long.compareUnsigned(count, MAX_CONTAINERS) > 0) {
            throw new InvalidFormatException(at, "container count",
                    "container count " + Long.toUnsignedString(count) + " exceeds " + MAX_CONTAINERS);
        }
        long maxKey = KeyMode.WIDE.maxHighKey();
        // the count is not trusted for sizing; the map grows as containers are decoded
        ChunkMap chunks = new ChunkMap((int) Math.min(count, 1024));
        long previousKey = 0;
        for (long i = 0; i < count; i++) {
            at = in.position();
            long delta = in.readVarLong("key delta");
            long key;
            if (i == 0) {
                if (Long.compareUnsigned(delta, maxKey) > 0) {
                    throw new InvalidFormatException(at, "key delta", "key " + Long.toUnsignedString(delta) + " exceeds " + maxKey);
                }
                key = delta;
            } else {
                if (delta == 0) {
                    throw new InvalidFormatException(at, "key delta", "key delta is zero");
                }
                if (Long.compareUnsigned(delta, maxKey - previousKey) > 0) {
                    throw new InvalidFormatException(at, "key delta",
                            "key after " + previousKey + " + " + Long.toUnsignedString(delta) + " exceeds " + maxKey);
                }
                key = previousKey + delta;
            }

            at = in.position();
            int tag = in.readUnsignedByte("tag");
            Container container;
            switch (tag) {
                case TAG_ARRAY:
                    at = in.position();
                    long cardinalityMinusOne = in.readVarLong("array cardinality");
                    if (Long.compareUnsigned(cardinalityMinusOne, MAX_ARRAY_CARDINALITY - 1) > 0) {
                        throw new InvalidFormatException(at, "array cardinality",
                                "array of " + Long.toUnsignedString(cardinalityMinusOne) + " + 1 values exceeds " + MAX_ARRAY_CARDINALITY);
                    }
                    container = readArrayValues(in, (int) cardinalityMinusOne + 1);
                    break;
                case TAG_BITMAP:
                    container = readWords(in, -1);
                    break;
                case TAG_RUN:
                    at = in.position();
                    long runsMinusOne = in.readVarLong("run count");
                    if (Long.compareUnsigned(runsMinusOne, MAX_RUNS - 1) > 0) {
                        throw new InvalidFormatException(at, "run count",
                                Long.toUnsignedString(runsMinusOne) + " + 1 runs exceeds " + MAX_RUNS);
                    }
                    container = readRunPairs(in, (int) runsMinusOne + 1, -1);
                    break;
                default:
                    throw new InvalidFormatException(at, "tag", "unknown container tag " + tag);
            }
            chunks.append(key, container);
            previousKey = key;
        }
        return RoaringBitmap.fromChunks(KeyMode.WIDE, chunks);
    }
}
