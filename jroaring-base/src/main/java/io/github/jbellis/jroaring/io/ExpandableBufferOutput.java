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

package io.github.jbellis.jroaring.io;

import org.agrona.ExpandableArrayBuffer;

import java.nio.ByteOrder;

/**
 * A LittleEndianOutput backed by a growable heap buffer, for encoding a whole bitmap into a byte array.
 * <p>
 * Not thread-safe. Each thread should use its own instance.
 */
public class ExpandableBufferOutput implements LittleEndianOutput {
    private static final ByteOrder ORDER = ByteOrder.LITTLE_ENDIAN;

    private final ExpandableArrayBuffer buffer;
    private int position;

    public ExpandableBufferOutput() {
        this(64);
    }

    /**
     * Creates an output whose buffer starts with the given capacity; it grows as needed.
     */
    public ExpandableBufferOutput(int initialCapacity) {
        this.buffer = new ExpandableArrayBuffer(Math.max(1, initialCapacity));
    }

    @Override
    public long position() {
        return position;
    }

    @Override
    public void writeByte(int v) {
        buffer.putByte(position, (byte) v);
        position += Byte.BYTES;
    }

    @Override
    public void writeShort(int v) {
        buffer.putShort(position, (short) v, ORDER);
        position += Short.BYTES;
    }

    @Override
    public void writeInt(int v) {
        buffer.putInt(position, v, ORDER);
        position += Integer.BYTES;
    }

    @Override
    public void writeLong(long v) {
        buffer.putLong(position, v, ORDER);
        position += Long.BYTES;
    }

    /**
     * Returns a copy of the bytes written so far.
     */
    public byte[] toByteArray() {
        byte[] bytes = new byte[position];
        buffer.getBytes(0, bytes, 0, position);
        return bytes;
    }

    /**
     * Discards everything written, allowing reuse.
     */
    public void reset() {
        position = 0;
    }
}
