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

import java.io.IOException;

/**
 * A source of the little-endian fields and unsigned LEB128 varints that the bitmap formats are
 * made of. Every read names the field being decoded, so that a truncated or malformed input is
 * reported as an {@link InvalidFormatException} pointing at that field and its byte offset.
 * <p>
 * Implementations are stateful and NOT threadsafe.
 */
public interface LittleEndianInput {
    /** Longest canonical encoding of a 64-bit value. */
    int MAX_VARLONG_BYTES = 10;

    /**
     * @return the number of bytes consumed so far
     */
    long position();

    /**
     * @param field the field being decoded
     * @return the next byte, 0..255
     * @throws InvalidFormatException if the input is exhausted
     * @throws IOException if the underlying source fails
     */
    int readUnsignedByte(String field) throws IOException;

    /**
     * @param field the field being decoded
     * @return the next 16-bit value, 0..65535
     * @throws InvalidFormatException if fewer than 2 bytes remain
     * @throws IOException if the underlying source fails
     */
    int readUnsignedShort(String field) throws IOException;

    /**
     * @param field the field being decoded
     * @return the next 32-bit value
     * @throws InvalidFormatException if fewer than 4 bytes remain
     * @throws IOException if the underlying source fails
     */
    int readInt(String field) throws IOException;

    /**
     * @param field the field being decoded
     * @return the next 64-bit value
     * @throws InvalidFormatException if fewer than 8 bytes remain
     * @throws IOException if the underlying source fails
     */
    long readLong(String field) throws IOException;

    /**
     * Read {@code count} 16-bit values into the array.
     * @throws IOException if the input is exhausted or the underlying source fails
     */
    default void readShorts(String field, char[] values, int count) throws IOException {
        for (int i = 0; i < count; i++) {
            values[i] = (char) readUnsignedShort(field);
        }
    }

    /**
     * Fill the array with 64-bit values.
     * @throws IOException if the input is exhausted or the underlying source fails
     */
    default void readLongs(String field, long[] values) throws IOException {
        for (int i = 0; i < values.length; i++) {
            values[i] = readLong(field);
        }
    }

    /**
     * Read an unsigned LEB128 varint, accepting only its canonical (shortest) form.
     *
     * @param field the field being decoded
     * @return the value, interpreted as unsigned
     * @throws InvalidFormatException if the varint is truncated, longer than 10 bytes,
     *         overflows 64 bits or is not in its shortest form
     * @throws IOException if the underlying source fails
     */
    default long readVarLong(String field) throws IOException {
        long start = position();
        long value = 0;
        for (int i = 0; i < MAX_VARLONG_BYTES; i++) {
            int b = readUnsignedByte(field);
            long payload = b & 0x7F;
            if (i == MAX_VARLONG_BYTES - 1 && payload > 1) {
                throw new InvalidFormatException(start, field, "varint overflows 64 bits");
            }
            value |= payload << (7 * i);
            if ((b & 0x80) == 0) {
                if (i > 0 && payload == 0) {
                    throw new InvalidFormatException(start, field, "varint is not in canonical form");
                }
                return value;
            }
        }
        throw new InvalidFormatException(start, field, "varint longer than " + MAX_VARLONG_BYTES + " bytes");
    }
}
