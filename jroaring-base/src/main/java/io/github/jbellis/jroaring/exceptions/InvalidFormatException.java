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

package io.github.jbellis.jroaring.exceptions;

import java.io.IOException;

/**
 * Thrown when a serialized bitmap cannot be decoded: the stream is truncated, a field holds an
 * impossible value, or two fields contradict each other.
 * <p>
 * Decoding stops at the first violation, so the caller never sees a partially-built bitmap.
 * The byte offset is relative to the first byte handed to the decoder.
 */
public class InvalidFormatException extends IOException {
    private final long offset;
    private final String field;

    /**
     * Creates a new exception.
     * @param offset the byte offset at which the violation was detected
     * @param field the name of the field being decoded
     * @param message what is wrong with it
     */
    public InvalidFormatException(long offset, String field, String message) {
        super(String.format("%s at offset %d: %s", field, offset, message));
        this.offset = offset;
        this.field = field;
    }

    /**
     * @return the byte offset at which the violation was detected
     */
    public long getOffset() {
        return offset;
    }

    /**
     * @return the name of the field being decoded when the violation was detected
     */
    public String getField() {
        return field;
    }
}
