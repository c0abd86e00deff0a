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

import io.github.jbellis.jroaring.KeyMode;
import io.github.jbellis.jroaring.RoaringBitmap;
import io.github.jbellis.jroaring.container.Container;
import io.github.jbellis.jroaring.container.ContainerPolicy;
import io.github.jbellis.jroaring.container.ContainerView;
import io.github.jbellis.jroaring.exceptions.InvalidFormatException;
import io.github.jbellis.jroaring.exceptions.KeyModeMismatchException;
import io.github.jbellis.jroaring.io.BufferInput;
import io.github.jbellis.jroaring.io.ExpandableBufferOutput;
import io.github.jbellis.jroaring.io.LittleEndianInput;
import io.github.jbellis.jroaring.io.LittleEndianOutput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Mode checking, whole-array encoding and decoding, rejection logging, and the container payload
 * readers and writers shared by both formats.
 */
public abstract class AbstractBitmapCodec implements BitmapCodec {
    private static final Logger log = LoggerFactory.getLogger(AbstractBitmapCodec.class);

    private final KeyMode mode;

    protected AbstractBitmapCodec(KeyMode mode) {
        this.mode = mode;
    }

    @Override
    public KeyMode mode() {
        return mode;
    }

    protected void checkMode(RoaringBitmap bitmap) {
        if (bitmap.mode() != mode) {
            throw new KeyModeMismatchException(mode, bitmap.mode());
        }
    }

    @Override
    public final void write(RoaringBitmap bitmap, LittleEndianOutput out) throws IOException {
        checkMode(bitmap);
        long start = out.position();
        writeBitmap(bitmap, out);
        if (log.isTraceEnabled()) {
            log.trace("Encoded {} values in {} containers as {} in {} bytes", bitmap.cardinality(),
                      bitmap.chunks().size(), getClass().getSimpleName(), out.position() - start);
        }
    }

    @Override
    public final RoaringBitmap read(LittleEndianInput in) throws IOException {
        try {
            return readBitmap(in);
        } catch (InvalidFormatException e) {
            log.debug("{} rejected its input: {}", getClass().getSimpleName(), e.getMessage());
            throw e;
        }
    }

    @Override
    public final long serializedSizeInBytes(RoaringBitmap bitmap) {
        checkMode(bitmap);
        return sizeOf(bitmap);
    }

    @Override
    public byte[] toBytes(RoaringBitmap bitmap) {
        long size = serializedSizeInBytes(bitmap);
        if (size > Integer.MAX_VALUE - 8) {
            throw new IllegalStateException("bitmap too large for a byte array: " + size + " bytes");
        }
        ExpandableBufferOutput out = new ExpandableBufferOutput((int) size);
        try {
            write(bitmap, out);
        } catch (IOException e) {
            throw new UncheckedIOException("heap buffer write failed", e);
        }
        return out.toByteArray();
    }

    @Override
    public RoaringBitmap fromBytes(byte[] bytes) throws InvalidFormatException {
        BufferInput in = new BufferInput(bytes);
        RoaringBitmap bitmap;
        try {
            bitmap = read(in);
        } catch (InvalidFormatException e) {
            throw e;
        } catch (IOException e) {
            throw new UncheckedIOException("heap buffer read failed", e);
        }
        if (in.remaining() > 0) {
            InvalidFormatException e = new InvalidFormatException(in.position(), "trailer",
                                                                  in.remaining() + " bytes left after the bitmap");
            log.debug("{} rejected its input: {}", getClass().getSimpleName(), e.getMessage());
            throw e;
        }
        return bitmap;
    }

    protected abstract void writeBitmap(RoaringBitmap bitmap, LittleEndianOutput out) throws IOException;

    protected abstract RoaringBitmap readBitmap(LittleEndianInput in) throws IOException;

    protected abstract long sizeOf(RoaringBitmap bitmap);

    // container payloads

    /**
     * @return the container's runs as {@code (start, length - 1)} pairs
     */
    protected static char[] runPairs(ContainerView container) {
        char[] pairs = new char[2 * container.runCount()];
        int[] next = new int[1];
        container.forEachRun((start, length) -> {
            pairs[next[0]++] = (char) start;
            pairs[next[0]++] = (char) (length - 1);
        });
        return pairs;
    }

    protected static void writeArrayValues(ContainerView container, LittleEndianOutput out) throws IOException {
        out.writeShorts(container.toSortedValues(), 0, container.cardinality());
    }

    protected static void writeWords(ContainerView container, LittleEndianOutput out) throws IOException {
        out.writeLongs(container.toWords());
    }

    protected static void writeRunPairs(ContainerView container, LittleEndianOutput out) throws IOException {
        char[] pairs = runPairs(container);
        out.writeShorts(pairs, 0, pairs.length);
    }

    /**
     * Reads {@code cardinality} strictly ascending 16-bit values.
     */
    protected static Container readArrayValues(LittleEndianInput in, int cardinality) throws IOException {
        char[] values = new char[cardinality];
        long start = in.position();
        in.readShorts("array value", values, cardinality);
        for (int i = 1; i < cardinality; i++) {
            if (values[i] <= values[i - 1]) {
                throw new InvalidFormatException(start + 2L * i, "array value",
                        String.format("value %d does not exceed the previous value %d", (int) values[i], (int) values[i - 1]));
            }
        }
        return Container.fromSortedValues(values, cardinality);
    }

    /**
     * Reads the 1024 words of a bitmap payload.
     *
     * @param expectedCardinality the required number of set bits, or -1 to only require at least one
     */
    protected static Container readWords(LittleEndianInput in, int expectedCardinality) throws IOException {
        long at = in.position();
        long[] words = new long[ContainerPolicy.BITMAP_WORDS];
        in.readLongs("bitmap word", words);
        int cardinality = 0;
        for (long word : words) {
            cardinality += Long.bitCount(word);
        }
        if (expectedCardinality < 0 && cardinality == 0) {
            throw new InvalidFormatException(at, "bitmap", "bitmap payload has no bits set");
        }
        if (expectedCardinality >= 0 && cardinality != expectedCardinality) {
            throw new InvalidFormatException(at, "bitmap",
                    String.format("bitmap has %d bits set but the header declares %d", cardinality, expectedCardinality));
        }
        return Container.fromWords(words);
    }

    /**
     * Reads {@code runCount} sorted, disjoint, non-adjacent runs.
     *
     * @param expectedCardinality the required total run length, or -1 to skip that check
     */
    protected static Container readRunPairs(LittleEndianInput in, int runCount, int expectedCardinality) throws IOException {
        long start = in.position();
        char[] pairs = new char[2 * runCount];
        int previousEnd = -2;
        int cardinality = 0;
        for (int i = 0; i < runCount; i++) {
            long at = in.position();
            int runStart = in.readUnsignedShort("run start");
            int lengthMinusOne = in.readUnsignedShort("run length");
            int runEnd = runStart + lengthMinusOne;
            if (runEnd >= ContainerPolicy.MAX_CARDINALITY) {
                throw new InvalidFormatException(at, "run", String.format("run %d..%d extends past 65535", runStart, runEnd));
            }
            if (runStart <= previousEnd + 1) {
                throw new InvalidFormatException(at, "run",
                        String.format("run starting at %d is unsorted, overlapping or adjacent to the previous run ending at %d", runStart, previousEnd));
            }
            pairs[2 * i] = (char) runStart;
            pairs[2 * i + 1] = (char) lengthMinusOne;
            cardinality += lengthMinusOne + 1;
            previousEnd = runEnd;
        }
        if (expectedCardinality >= 0 && cardinality != expectedCardinality) {
            throw new InvalidFormatException(start, "run",
                    String.format("runs hold %d values but the header declares %d", cardinality, expectedCardinality));
        }
        return Container.fromRuns(pairs, runCount);
    }
}
