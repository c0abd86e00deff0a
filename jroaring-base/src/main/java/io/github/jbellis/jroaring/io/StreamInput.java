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
import java.io.InputStream;

/**
 * A LittleEndianInput reading from an InputStream. Exactly the bytes of the decoded fields are
 * consumed, so the stream can hold more data after a bitmap. The stream is not closed.
 */
public class StreamInput implements LittleEndianInput {
    private final InputStream in;
    private final byte[] scratch = new byte[Long.BYTES];
    private long bytesRead;

    public StreamInput(InputStream in) {
        this.in = in;
    }

    @Override
    public long position() {
        return bytesRead;
    }

    @Override
    public int readUnsignedByte(String field) throws IOException {
        int b = in.read();
        if (b < 0) {
            throw new InvalidFormatException(bytesRead, field, "truncated input, end of stream");
        }
        bytesRead++;
        return b;
    }

    @Override
    public int readUnsignedShort(String field) throws IOException {
        return (int) readLittleEndian(field, Short.BYTES);
    }

    @Override
    public int readInt(String field) throws IOException {
        return (int) readLittleEndian(field, Integer.BYTES);
    }

    @Override
    public long readLong(String field) throws IOException {
        return readLittleEndian(field, Long.BYTES);
    }

    private long readLittleEndian(String field, int width) throws IOException {
        int n = in.readNBytes(scratch, 0, width);
        if (n < width) {
            throw new InvalidFormatException(bytesRead, field,
                    String.format("truncated input, needed %d bytes but the stream ended after %d", width, n));
        }
        bytesRead += width;
        long v = 0;
        for (int i = width - 1; i >= 0; i--) {
            v = (v << 8) | (scratch[i] & 0xFF);
        }
        return v;
    }
}
