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

import io.github.jbellis.jroaring.KeyMode;

/**
 * Thrown when a value lies outside the range addressable by a bitmap's key mode,
 * e.g. a value of 2^32 added to a 32-bit-key bitmap.
 */
public class ValueOutOfRangeException extends IllegalArgumentException {
    private final KeyMode mode;
    private final long value;

    public ValueOutOfRangeException(KeyMode mode, long value) {
        super("Value " + Long.toUnsignedString(value) + " is out of range for a " + mode + " bitmap");
        this.mode = mode;
        this.value = value;
    }

    public KeyMode getMode() {
        return mode;
    }

    /**
     * @return the offending value, to be read as unsigned
     */
    public long getValue() {
        return value;
    }
}
