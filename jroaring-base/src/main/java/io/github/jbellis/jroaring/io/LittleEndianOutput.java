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

import java.io.IOException;

/**
 * A sink for the fixed-width little-endian fields and unsigned LEB128 varints that the bitmap
 * formats are made of.
 * <p>
 * Implementations are stateful and NOT threadsafe.
 */
public interface LittleEndianOutput {
    /**
     * @return the number of bytes written so far
     */
    long position();

    /**
     * Write the low 8 bits of the given value.
     * @param v the value
     * @throws IOException if an error occurs
     */
    void writeByte(int v) throws IOException;

    /**
     * Write the low 16 bits of the given value.
     * @param v the value
     * @throws IOException if an error occurs
     */
    void writeShort(int v) throws IOException;

    /**
     * Write a 32-bit value.
     * @param v the value
     * @throws IOException if an error occurs
     */
    void writeInt(int v) throws IOException;

    /**
     * Write a 64-bit value.
     * @param v the value
     * @throws IOException if an error occurs
     */
    void writeLong(long v) throws IOException;

    /**
     * Write a value as an unsigned LEB128 varint in its shortest form (1 to 10 bytes).
     * @param v the value, interpreted as unsigned
     * @throws IOException if an error occurs
     */
    default void writeVarLong(long v) throws IOException {
        while ((v & ~0x7FL) != 0) {
            writeByte((int) ((v & 0x7F) | 0x80));
            v >>>= 7;
        }
        writeByte((int) v);
    }

    /**
     * Write {@code count} 16-bit values starting at {@code offset}.
     * @throws IOException if an error occurs
     */
    default void writeShorts(char[] values, int offset, int count) throws IOException {
        for (int i = offset; i < offset + count; i++) {
            writeShort(values[i]);
        }
    }

    /**
     * Write every value of the array.
     * @throws IOException if an error occurs
     */
    default void writeLongs(long[] values) throws IOException {
        for (long v : values) {
            writeLong(v);
        }
    }

    /**
     * @param v an unsigned value
     * @return the number of bytes {@link #writeVarLong} uses for it
     */
    static int varLongSize(long v) {
        int bits = Long.SIZE - Long.numberOfLeadingZeros(v | 1);
        return (bits + 6) / 7;
    }
}
