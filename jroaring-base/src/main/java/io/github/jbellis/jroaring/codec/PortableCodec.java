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
import io.github.jbellis.jroaring.container.Container;
import io.github.jbellis.jroaring.container.ContainerKind;
import io.github.jbellis.jroaring.container.ContainerPolicy;
import io.github.jbellis.jroaring.container.ContainerView;
import io.github.jbellis.jroaring.exceptions.InvalidFormatException;
import io.github.jbellis.jroaring.io.LittleEndianInput;
import io.github.jbellis.jroaring.io.LittleEndianOutput;

import java.io.IOException;

/**
 * The standard Roaring serialization format, readable by every Roaring implementation. Only
 * {@link KeyMode#NARROW} bitmaps can be represented. All fields are little-endian:
 * <pre>
 * if any container is a run container:
 *     u32 cookie = 12347 | (containerCount - 1) &lt;&lt; 16
 *     byte[(containerCount + 7) / 8] run flags, bit i set if container i is a run container
 * else:
 *     u32 cookie = 12346
 *     u32 containerCount
 * containerCount x (u16 key, u16 cardinality - 1)
 * if there is no run container or containerCount &gt;= 4:
 *     containerCount x u32 offset of the payload from the start of the bitmap
 * payloads, in key order:
 *     run:    u16 runCount, runCount x (u16 start, u16 length - 1)
 *     bitmap: 1024 x u64, for non-run containers of more than 4096 values
 *     array:  cardinality x u16, for the other non-run containers
 * </pre>
 * A container is written as a run container exactly when its in-memory representation is
 * {@link ContainerKind#RUN}. Otherwise the bitmap/array choice is made at the standard threshold
 * of 4096, whatever the in-memory threshold.
 */
public class PortableCodec extends AbstractBitmapCodec {
    static final int SERIAL_COOKIE_NO_RUNCONTAINER = 12346;
    static final int SERIAL_COOKIE = 12347;
    static final int NO_OFFSET_THRESHOLD = 4;
    static final int MAX_CONTAINERS = 1 << 16;

    public PortableCodec() {
        super(KeyMode.NARROW);
    }

    private static boolean hasRunContainer(ChunkMapView chunks) {
        for (int i = 0; i < chunks.size(); i++) {
            if (chunks.containerAt(i).kind() == ContainerKind.RUN) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasOffsets(boolean hasRuns, int containerCount) {
        return !hasRuns || containerCount >= NO_OFFSET_THRESHOLD;
    }

    private static int headerSize(boolean hasRuns, int containerCount) {
        int size = hasRuns
                ? Integer.BYTES + (containerCount + 7) / 8
                : 2 * Integer.BYTES;
        size += containerCount * 2 * Short.BYTES;
        if (hasOffsets(hasRuns, containerCount)) {
            size += containerCount * Integer.BYTES;
        }
        return size;
    }

    private static int payloadSize(ContainerView container) {
        if (container.kind() == ContainerKind.RUN) {
            return ContainerPolicy.runSizeInBytes(container.runCount());
        }
        return container.cardinality() > ContainerPolicy.DEFAULT_ARRAY_MAX_CARDINALITY
                ? ContainerPolicy.bitmapSizeInBytes()
                : ContainerPolicy.arraySizeInBytes(container.cardinality());
    }

    @Override
    protected long sizeOf(RoaringBitmap bitmap) {
        ChunkMapView chunks = bitmap.chunks();
        long size = headerSize(hasRunContainer(chunks), chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            size += payloadSize(chunks.containerAt(i));
        }
        return size;
    }

    @Override
    protected void writeBitmap(RoaringBitmap bitmap, LittleEndianOutput out) throws IOException {
        ChunkMapView chunks = bitmap.chunks();
        int n = chunks.size();
        boolean hasRuns = hasRunContainer(chunks);

        if (hasRuns) {
            out.writeInt(SERIAL_COOKIE | ((n - 1) << 16));
            byte[] runFlags = new byte[(n + 7) / 8];
            for (int i = 0; i < n; i++) {
                if (chunks.containerAt(i).kind() == ContainerKind.RUN) {
                    runFlags[i / 8] |= (byte) (1 << (i % 8));
                }
            }
            for (byte b : runFlags) {
                out.writeByte(b);
            }
        } else {
            out.writeInt(SERIAL_COOKIE_NO_RUNCONTAINER);
            out.writeInt(n);
        }

        for (int i = 0; i < n; i++) {
            out.writeShort((int) chunks.keyAt(i));
            out.writeShort(chunks.containerAt(i).cardinality() - 1);
        }

        if (hasOffsets(hasRuns, n)) {
            int offset = headerSize(hasRuns, n);
            for (int i = 0; i < n; i++) {
                out.writeInt(offset);
                offset += payloadSize(chunks.containerAt(i));
            }
        }

        for (int i = 0; i < n; i++) {
            ContainerView container = chunks.containerAt(i);
            if (container.kind() == ContainerKind.RUN) {
                out.writeShort(container.runCount());
                writeRunPairs(container, out);
            } else if (container.cardinality() > ContainerPolicy.DEFAULT_ARRAY_MAX_CARDINALITY) {
                writeWords(container, out);
            } else {
                writeArrayValues(container, out);
            }
        }
    }

    @Override
    protected RoaringBitmap readBitmap(LittleEndianInput in) throws IOException {
        long base = in.position();
        int cookie = in.readInt("cookie");
        int n;
        boolean hasRuns;
        byte[] runFlags = null;
        if ((cookie & 0xFFFF) == SERIAL_COOKIE) {
            hasRuns = true;
            n = (cookie >>> 16) + 1;
            runFlags = new byte[(n + 7) / 8];
            for (int i = 0; i < runFlags.length; i++) {
                runFlags[i] = (byte) in.readUnsignedByte("run flags");
            }
        } else if (cookie == SERIAL_COOKIE_NO_RUNCONTAINER) {
            hasRuns = false;
            long at = in.position();
            int count = in.readInt("container count");
            if (count < 0 || count > MAX_CONTAINERS) {
                throw new InvalidFormatException(at, "container count",
                        "container count " + Integer.toUnsignedString(count) + " exceeds " + MAX_CONTAINERS);
            }
            n = count;
        } else {
            throw new InvalidFormatException(base, "cookie", "unknown cookie " + Integer.toUnsignedString(cookie));
        }

        int[] keys = new int[n];
        int[] cardinalities = new int[n];
        for (int i = 0; i < n; i++) {
            long at = in.position();
            keys[i] = in.readUnsignedShort("key");
            cardinalities[i] = in.readUnsignedShort("cardinality") + 1;
            if (i > 0 && keys[i] <= keys[i - 1]) {
                throw new InvalidFormatException(at, "key",
                        String.format("key %d does not exceed the previous key %d", keys[i], keys[i - 1]));
            }
        }

        long[] offsets = null;
        long offsetsStart = in.position();
        if (hasOffsets(hasRuns, n)) {
            offsets = new long[n];
            for (int i = 0; i < n; i++) {
                offsets[i] = Integer.toUnsignedLong(in.readInt("offset"));
            }
        }

        ChunkMap chunks = new ChunkMap(n);
        for (int i = 0; i < n; i++) {
            long payloadOffset = in.position() - base;
            if (offsets != null && offsets[i] != payloadOffset) {
                throw new InvalidFormatException(offsetsStart + (long) i * Integer.BYTES, "offset",
                        String.format("offset %d of container %d does not match its payload position %d", offsets[i], i, payloadOffset));
            }
            Container container;
            if (runFlags != null && (runFlags[i / 8] & (1 << (i % 8))) != 0) {
                long at = in.position();
                int runCount = in.readUnsignedShort("run count");
                if (runCount == 0) {
                    throw new InvalidFormatException(at, "run count", "run container with no runs");
                }
                container = readRunPairs(in, runCount, cardinalities[i]);
            } else if (cardinalities[i] > ContainerPolicy.DEFAULT_ARRAY_MAX_CARDINALITY) {
                container = readWords(in, cardinalities[i]);
            } else {
                container = readArrayValues(in, cardinalities[i]);
            }
            chunks.append(keys[i], container);
        }
        return RoaringBitmap.fromChunks(KeyMode.NARROW, chunks);
    }
}
