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

import io.github.jbellis.jroaring.container.Container;
import io.github.jbellis.jroaring.util.Accountable;
import io.github.jbellis.jroaring.util.ArrayUtil;
import io.github.jbellis.jroaring.util.RamUsageEstimator;

import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * An ordered map from high key to {@link Container}, backed by sorted parallel arrays.
 * <p>
 * Keys are unique and strictly ascending. Apart from the placeholder handed out by
 * {@link #getOrCreate}, which the caller fills right away, no entry holds an empty container.
 * <p>
 * A map that backs a bitmap is never handed out; callers see it through
 * {@link RoaringBitmap#chunks()}.
 * <p>
 * Not thread-safe.
 */
public final class ChunkMap implements ChunkMapView, Accountable, Iterable<ChunkMap.Chunk> {
    private static final long SHALLOW_RAM_BYTES =
            RamUsageEstimator.shallowSizeOf(2 * RamUsageEstimator.NUM_BYTES_OBJECT_REF + Integer.BYTES);

    private long[] keys;
    private Container[] containers;
    private int size;

    public ChunkMap() {
        this(4);
    }

    public ChunkMap(int initialCapacity) {
        int capacity = Math.max(1, initialCapacity);
        this.keys = new long[capacity];
        this.containers = new Container[capacity];
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public boolean isEmpty() {
        return size == 0;
    }

    @Override
    public long keyAt(int index) {
        checkIndex(index);
        return keys[index];
    }

    @Override
    public Container containerAt(int index) {
        checkIndex(index);
        return containers[index];
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException("index " + index + " out of bounds for size " + size);
        }
    }

    /**
     * @return the position of the key, or {@code -(insertion point) - 1} if it is absent
     */
    public int indexOf(long key) {
        return Arrays.binarySearch(keys, 0, size, key);
    }

    /**
     * @return the container for the key, or null if there is none
     */
    Container get(long key) {
        int i = indexOf(key);
        return i >= 0 ? containers[i] : null;
    }

    /**
     * Returns the index of the entry for the key, first inserting an entry with an empty
     * container if there was none. The caller must add at least one value to a new container,
     * or remove it again with {@link #removeIfEmpty}.
     */
    int getOrCreate(long key) {
        int i = indexOf(key);
        if (i >= 0) {
            return i;
        }
        int insertion = -i - 1;
        ensureCapacity(size + 1);
        System.arraycopy(keys, insertion, keys, insertion + 1, size - insertion);
        System.arraycopy(containers, insertion, containers, insertion + 1, size - insertion);
        keys[insertion] = key;
        containers[insertion] = new Container();
        size++;
        return insertion;
    }

    /**
     * Drops the entry for the key if its container has no values left.
     * @return true if an entry was removed
     */
    boolean removeIfEmpty(long key) {
        int i = indexOf(key);
        if (i < 0 || !containers[i].isEmpty()) {
            return false;
        }
        System.arraycopy(keys, i + 1, keys, i, size - i - 1);
        System.arraycopy(containers, i + 1, containers, i, size - i - 1);
        containers[--size] = null;
        return true;
    }

    /**
     * Adds an entry after all existing ones, for building a map in key order.
     *
     * @throws IllegalArgumentException if the key does not exceed the last key, or the container is empty
     */
    public void append(long key, Container container) {
        if (size > 0 && key <= keys[size - 1]) {
            throw new IllegalArgumentException("key " + key + " does not follow the last key " + keys[size - 1]);
        }
        if (container.isEmpty()) {
            throw new IllegalArgumentException("cannot append an empty container for key " + key);
        }
        appendUnchecked(key, container);
    }

    private void appendUnchecked(long key, Container container) {
        ensureCapacity(size + 1);
        keys[size] = key;
        containers[size] = container;
        size++;
    }

    private void ensureCapacity(int minSize) {
        keys = ArrayUtil.grow(keys, minSize);
        containers = ArrayUtil.grow(containers, minSize);
    }

    /**
     * @return the total number of values in all containers
     */
    public long cardinality() {
        long total = 0;
        for (int i = 0; i < size; i++) {
            total += containers[i].cardinality();
        }
        return total;
    }

    /**
     * @return a deep copy
     */
    public ChunkMap copy() {
        ChunkMap copy = new ChunkMap(size);
        for (int i = 0; i < size; i++) {
            copy.appendUnchecked(keys[i], containers[i].copy());
        }
        return copy;
    }

    /**
     * Combines two maps chunk by chunk. Matching keys are combined with {@code operation}; a key
     * present on one side only is kept or dropped as the operation dictates. Empty results are
     * dropped.
     * <p>
     * The result never shares containers with {@code right}. It shares the left-only containers
     * of {@code left} when {@code reuseLeft} is set, which is only safe if {@code left} is
     * discarded afterwards; otherwise those are copied too.
     */
    static ChunkMap merge(ChunkMap left, ChunkMap right, SetOperation operation, boolean reuseLeft) {
        int capacity = operation == SetOperation.INTERSECTION ? Math.min(left.size, right.size) : left.size + right.size;
        ChunkMap out = new ChunkMap(capacity);
        int i = 0;
        int j = 0;
        while (i < left.size && j < right.size) {
            long leftKey = left.keys[i];
            long rightKey = right.keys[j];
            if (leftKey < rightKey) {
                if (operation.keepsLeftOnly()) {
                    out.appendUnchecked(leftKey, reuseLeft ? left.containers[i] : left.containers[i].copy());
                }
                i++;
            } else if (rightKey < leftKey) {
                if (operation.keepsRightOnly()) {
                    out.appendUnchecked(rightKey, right.containers[j].copy());
                }
                j++;
            } else {
                Container combined = operation.apply(left.containers[i], right.containers[j]);
                if (!combined.isEmpty()) {
                    out.appendUnchecked(leftKey, combined);
                }
                i++;
                j++;
            }
        }
        if (operation.keepsLeftOnly()) {
            for (; i < left.size; i++) {
                out.appendUnchecked(left.keys[i], reuseLeft ? left.containers[i] : left.containers[i].copy());
            }
        }
        if (operation.keepsRightOnly()) {
            for (; j < right.size; j++) {
                out.appendUnchecked(right.keys[j], right.containers[j].copy());
            }
        }
        return out;
    }

    @Override
    public Iterator<Chunk> iterator() {
        return new Iterator<>() {
            private int next;

            @Override
            public boolean hasNext() {
                return next < size;
            }

            @Override
            public Chunk next() {
                if (next >= size) {
                    throw new NoSuchElementException();
                }
                Chunk chunk = new Chunk(keys[next], containers[next]);
                next++;
                return chunk;
            }
        };
    }

    @Override
    public long ramBytesUsed() {
        long total = SHALLOW_RAM_BYTES
                + RamUsageEstimator.sizeOf(keys)
                + RamUsageEstimator.sizeOfArray(containers.length, RamUsageEstimator.NUM_BYTES_OBJECT_REF);
        for (int i = 0; i < size; i++) {
            total += containers[i].ramBytesUsed();
        }
        return total;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ChunkMap)) {
            return false;
        }
        ChunkMap that = (ChunkMap) o;
        return size == that.size
                && Arrays.equals(keys, 0, size, that.keys, 0, size)
                && Arrays.equals(containers, 0, size, that.containers, 0, size);
    }

    @Override
    public int hashCode() {
        int h = 1;
        for (int i = 0; i < size; i++) {
            h = 31 * h + Long.hashCode(keys[i]);
            h = 31 * h + containers[i].hashCode();
        }
        return h;
    }

    /**
     * A view of one entry: a high key and the container holding its low values.
     */
    public static final class Chunk {
        private final long key;
        private final Container container;

        Chunk(long key, Container container) {
            this.key = key;
            this.container = container;
        }

        public long key() {
            return key;
        }

        public Container container() {
            return container;
        }
    }
}
