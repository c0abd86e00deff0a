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

package io.github.jbellis.jroaring.util;

/**
 * Rough object and array size arithmetic, assuming a 64-bit JVM with compressed oops.
 * Good enough to compare representations against each other, not to predict GC behavior.
 */
public final class RamUsageEstimator {
    private RamUsageEstimator() {
    }

    /** Size of an object header. */
    public static final int NUM_BYTES_OBJECT_HEADER = 12;
    /** Size of an array header, including the length field. */
    public static final int NUM_BYTES_ARRAY_HEADER = 16;
    /** Size of a (compressed) reference. */
    public static final int NUM_BYTES_OBJECT_REF = 4;
    /** Objects are aligned to this many bytes. */
    public static final int NUM_BYTES_OBJECT_ALIGNMENT = 8;

    /**
     * Rounds the given size up to the object alignment.
     * @param size the unaligned size in bytes
     * @return the aligned size
     */
    public static long alignObjectSize(long size) {
        size += NUM_BYTES_OBJECT_ALIGNMENT - 1L;
        return size - (size % NUM_BYTES_OBJECT_ALIGNMENT);
    }

    /**
     * @param length the number of elements
     * @param elementBytes the size of one element
     * @return the aligned size of a primitive array of the given shape
     */
    public static long sizeOfArray(int length, int elementBytes) {
        return alignObjectSize((long) NUM_BYTES_ARRAY_HEADER + (long) length * elementBytes);
    }

    public static long sizeOf(char[] arr) {
        return arr == null ? 0 : sizeOfArray(arr.length, Character.BYTES);
    }

    public static long sizeOf(long[] arr) {
        return arr == null ? 0 : sizeOfArray(arr.length, Long.BYTES);
    }

    /**
     * @param fieldBytes the combined size of the object's fields
     * @return the aligned shallow size of an object with those fields
     */
    public static long shallowSizeOf(int fieldBytes) {
        return alignObjectSize((long) NUM_BYTES_OBJECT_HEADER + fieldBytes);
    }
}
