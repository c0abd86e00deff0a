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

import io.github.jbellis.jroaring.exceptions.InvalidFormatException;
import org.agrona.concurrent.UnsafeBuffer;

import java.nio.ByteOrder;

/**
 * A LittleEndianInput over an in-memory byte array. Reads past the end are reported as
 * {@link InvalidFormatException}s, never as buffer exceptions.
 */
public class BufferInput implements LittleEndianInput {
    private static final ByteOrder ORDER = ByteOrder.LITTLE_ENDIAN;

    private final UnsafeBuffer buffer;
    private final int length;
    private int position;

    public BufferInput(byte[] bytes) {
        this.buffer = new UnsafeBuffer(bytes);
        this.length = bytes.length;
    }

    @Override
    public long position() {
        return position;
    }

    /**
     * @return the number of unread bytes
     */
    public int remaining() {
        return length - position;
    }

    private int advance(int width, String field) throws InvalidFormatException {
        if (length - position < width) {
            throw new InvalidFormatException(position, field,
                    String.format("truncated input, needed %d bytes but only %d remain", width, length - position));
        }
        int index = position;
        position += width;
        return index;
    }

    @Override
    public int readUnsignedByte(String field) throws InvalidFormatException {
        return buffer.getByte(advance(Byte.BYTES, field)) & 0xFF;
    }

    @Override
    public int readUnsignedShort(String field) throws InvalidFormatException {
        return buffer.getShort(advance(Short.BYTES, field), ORDER) & 0xFFFF;
    }

    @Override
    public int readInt(String field) throws InvalidFormatException {
        return buffer.getInt(advance(Integer.BYTES, field), ORDER);
    }

    @Override
    public long readLong(String field) throws InvalidFormatException {
        return buffer.getLong(advance(Long.BYTES, field), ORDER);
    }
}
