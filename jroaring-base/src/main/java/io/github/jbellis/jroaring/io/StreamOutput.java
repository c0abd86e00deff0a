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
import java.io.OutputStream;

/**
 * A LittleEndianOutput that writes through to an OutputStream. The stream is not buffered
 * or closed by this class; callers that write many small fields should hand in a buffered stream.
 */
public class StreamOutput implements LittleEndianOutput {
    private final OutputStream out;
    private final byte[] scratch = new byte[Long.BYTES];
    private long bytesWritten;

    public StreamOutput(OutputStream out) {
        this.out = out;
    }

    @Override
    public long position() {
        return bytesWritten;
    }

    @Override
    public void writeByte(int v) throws IOException {
        out.write(v);
        bytesWritten++;
    }

    @Override
    public void writeShort(int v) throws IOException {
        writeLittleEndian(v, Short.BYTES);
    }

    @Override
    public void writeInt(int v) throws IOException {
        writeLittleEndian(v, Integer.BYTES);
    }

    @Override
    public void writeLong(long v) throws IOException {
        writeLittleEndian(v, Long.BYTES);
    }

    private void writeLittleEndian(long v, int width) throws IOException {
        for (int i = 0; i < width; i++) {
            scratch[i] = (byte) (v >>> (8 * i));
        }
        out.write(scratch, 0, width);
        bytesWritten += width;
    }

    public void flush() throws IOException {
        out.flush();
    }
}
