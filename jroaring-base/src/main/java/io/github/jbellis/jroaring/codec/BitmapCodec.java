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
import io.github.jbellis.jroaring.exceptions.InvalidFormatException;
import io.github.jbellis.jroaring.exceptions.KeyModeMismatchException;
import io.github.jbellis.jroaring.io.LittleEndianInput;
import io.github.jbellis.jroaring.io.LittleEndianOutput;

import java.io.IOException;

/**
 * A binary format for {@link RoaringBitmap}s of one {@link KeyMode}.
 * <p>
 * Codecs only use the public read contract of containers and their public factories, so a new
 * format needs nothing from the container internals.
 */
public interface BitmapCodec {
    /**
     * @return the only key mode this format can represent
     */
    KeyMode mode();

    /**
     * Encode a bitmap.
     * @param bitmap the bitmap
     * @param out where to write it
     * @throws KeyModeMismatchException if the bitmap's mode is not {@link #mode()}
     * @throws IOException if the output fails
     */
    void write(RoaringBitmap bitmap, LittleEndianOutput out) throws IOException;

    /**
     * Decode one bitmap, consuming exactly its bytes.
     * @param in where to read it from
     * @return a bitmap of mode {@link #mode()}
     * @throws InvalidFormatException at the first violation of the format
     * @throws IOException if the input fails
     */
    RoaringBitmap read(LittleEndianInput in) throws IOException;

    /**
     * @param bitmap the bitmap
     * @return the exact number of bytes {@link #write} produces for it
     * @throws KeyModeMismatchException if the bitmap's mode is not {@link #mode()}
     */
    long serializedSizeInBytes(RoaringBitmap bitmap);

    /**
     * @param bitmap the bitmap
     * @return its encoding
     * @throws KeyModeMismatchException if the bitmap's mode is not {@link #mode()}
     */
    byte[] toBytes(RoaringBitmap bitmap);

    /**
     * Decode a bitmap that must span the whole array.
     * @param bytes the encoding
     * @return a bitmap of mode {@link #mode()}
     * @throws InvalidFormatException at the first violation of the format, or if bytes are left over
     */
    RoaringBitmap fromBytes(byte[] bytes) throws InvalidFormatException;
}
