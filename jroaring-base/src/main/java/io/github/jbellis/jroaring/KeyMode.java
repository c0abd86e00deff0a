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

package io.github.jbellis.jroaring;

import io.github.jbellis.jroaring.exceptions.ValueOutOfRangeException;

/**
 * The key width of a {@link RoaringBitmap}, fixed when the bitmap is created.
 * <p>
 * Every value splits into a high key, which selects a container, and the low 16 bits stored in
 * it. In NARROW mode values are unsigned 32-bit and high keys have 16 bits; in WIDE mode values
 * are unsigned 64-bit (held in a {@code long}) and high keys have 48 bits.
 */
public enum KeyMode {
    NARROW(16),
    WIDE(48);

    private final int highKeyBits;

    KeyMode(int highKeyBits) {
        this.highKeyBits = highKeyBits;
    }

    public int highKeyBits() {
        return highKeyBits;
    }

    /**
     * @return the largest high key this mode can address
     */
    public long maxHighKey() {
        return (1L << highKeyBits) - 1;
    }

    /**
     * @return the largest value this mode can hold, as an unsigned long
     */
    public long maxValue() {
        return this == WIDE ? -1L : 0xFFFF_FFFFL;
    }

    /**
     * @param value a value, interpreted as unsigned
     * @return true if this mode can hold it
     */
    public boolean isValid(long value) {
        return Long.compareUnsigned(value, maxValue()) <= 0;
    }

    /**
     * @throws ValueOutOfRangeException if this mode cannot hold the value
     */
    public void checkValue(long value) {
        if (!isValid(value)) {
            throw new ValueOutOfRangeException(this, value);
        }
    }

    public static long highKey(long value) {
        return value >>> 16;
    }

    public static char low(long value) {
        return (char) value;
    }

    public static long compose(long highKey, int low) {
        return (highKey << 16) | low;
    }
}
