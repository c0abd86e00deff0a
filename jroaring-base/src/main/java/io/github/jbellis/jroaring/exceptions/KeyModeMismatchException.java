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
 * Thrown when an operation combines a 32-bit-key bitmap with a 64-bit-key one, or hands a
 * bitmap to a codec that does not support its key mode.
 * <p>
 * The check runs before any work is done, so no operand is modified.
 */
public class KeyModeMismatchException extends IllegalArgumentException {
    private final KeyMode expected;
    private final KeyMode actual;

    /**
     * Creates a new exception.
     * @param expected the key mode required by the operation
     * @param actual the key mode that was supplied
     */
    public KeyModeMismatchException(KeyMode expected, KeyMode actual) {
        super("Expected a " + expected + " bitmap but got a " + actual + " one");
        this.expected = expected;
        this.actual = actual;
    }

    public KeyMode getExpected() {
        return expected;
    }

    public KeyMode getActual() {
        return actual;
    }
}
