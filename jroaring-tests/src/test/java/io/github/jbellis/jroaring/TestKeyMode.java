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
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class TestKeyMode extends RandomizedBitmapBase {

    @Test
    public void testRanges() {
        assertEquals(0xFFFFL, KeyMode.NARROW.maxHighKey());
        assertEquals((1L << 48) - 1, KeyMode.WIDE.maxHighKey());
        assertTrue(KeyMode.NARROW.isValid(0));
        assertTrue(KeyMode.NARROW.isValid(0xFFFF_FFFFL));
        assertFalse(KeyMode.NARROW.isValid(1L << 32));
        assertFalse(KeyMode.NARROW.isValid(-1L));
        assertTrue(KeyMode.WIDE.isValid(-1L));
        assertTrue(KeyMode.WIDE.isValid(Long.MIN_VALUE));
    }

    @Test
    public void testCheckValue() {
        KeyMode.NARROW.checkValue(42);
        ValueOutOfRangeException e = assertThrows(ValueOutOfRangeException.class, () -> KeyMode.NARROW.checkValue(1L << 32));
        assertEquals(KeyMode.NARROW, e.getMode());
        assertEquals(1L << 32, e.getValue());
        assertTrue(e.getMessage(), e.getMessage().contains("4294967296"));
    }

    @Test
    public void testSplitAndCompose() {
        for (int i = 0; i < 1000; i++) {
            long value = randomLong();
            long key = KeyMode.highKey(value);
            char low = KeyMode.low(value);
            assertTrue(key <= KeyMode.WIDE.maxHighKey());
            assertEquals(value, KeyMode.compose(key, low));
        }
        assertEquals(1, KeyMode.highKey(65536));
        assertEquals(0, KeyMode.low(65536));
        assertEquals(0xFFFF, KeyMode.low(-1L));
    }
}
