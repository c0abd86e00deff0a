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

package io.github.jbellis.jroaring.container;

import io.github.jbellis.jroaring.util.ArrayUtil;
import io.github.jbellis.jroaring.util.RamUsageEstimator;

import java.util.Arrays;
import java.util.NoSuchElementException;
import java.util.PrimitiveIterator;

import static io.github.jbellis.jroaring.container.ContainerPolicy.BITMAP_WORDS;
import static io.github.jbellis.jroaring.container.ContainerPolicy.MAX_CARDINALITY;

/**
 * The set of low 16-bit values sharing one high key.
 * <p>
 * A container is stored in exactly one of three representations, named by {@link #kind()}:
 * a sorted array of values, a 65536-bit vector, or a sorted list of runs. The representation
 * is re-chosen by {@link ContainerPolicy#bestKind} after every mutation, so callers only ever
 * observe the value set; membership, cardinality and iteration order never depend on it.
 * <p>
 * Both the cardinality and the number of maximal runs are maintained incrementally, which is
 * what lets the policy compare the encoded sizes of all three representations in O(1).
 * <p>
 * The set-algebra methods ({@link #union}, {@link #intersection}, {@link #difference},
 * {@link #symmetricDifference}) never modify or alias their operands.
 * <p>
 * Not thread-safe.
 */
public final class Container implements ContainerView {
    private static final long SHALLOW_RAM_BYTES =
            RamUsageEstimator.shallowSizeOf(3 * RamUsageEstimator.NUM_BYTES_OBJECT_REF + 2 * Integer.BYTES);

    ContainerKind kind;
    // ARRAY: sorted values in [0, cardinality). RUN: (start, length - 1) pairs in [0, 2 * runCount).
    char[] content;
    // BITMAP only
    long[] words;
    int cardinality;
    int runCount;

    /**
     * Creates an empty container.
     */
    public Container() {
        this(ContainerKind.ARRAY, new char[4], null, 0, 0);
    }

    private Container(ContainerKind kind, char[] content, long[] words, int cardinality, int runCount) {
        this.kind = kind;
        this.content = content;
        this.words = words;
        this.cardinality = cardinality;
        this.runCount = runCount;
    }

    // package-private factories take ownership of the arrays passed in

    static Container ofArray(char[] values, int cardinality) {
        int runs = 0;
        for (int i = 0; i < cardinality; i++) {
            if (i == 0 || values[i] != values[i - 1] + 1) {
                runs++;
            }
        }
        Container c = new Container(ContainerKind.ARRAY, values, null, cardinality, runs);
        c.optimize();
        return c;
    }

    static Container ofWords(long[] words, int cardinality) {
        Container c = new Container(ContainerKind.BITMAP, null, words, cardinality, BitmapOps.countRuns(words));
        c.optimize();
        return c;
    }

    static Container ofWords(long[] words) {
        return ofWords(words, BitmapOps.cardinality(words));
    }

    static Container ofRuns(char[] runs, int runCount, int cardinality) {
        Container c = new Container(ContainerKind.RUN, runs, null, cardinality, runCount);
        c.optimize();
        return c;
    }

    /**
     * Creates a container holding the given values, in any order, duplicates allowed.
     * @param values the values to add
     * @return a new container
     */
    public static Container of(char... values) {
        Container c = new Container();
        for (char value : values) {
            c.add(value);
        }
        return c;
    }

    /**
     * Creates a container from strictly ascending values. The array is copied.
     *
     * @param values the values; only the first {@code count} are used
     * @param count the number of values
     * @return a new container in its best representation
     * @throws IllegalArgumentException if the values are not strictly ascending
     */
    public static Container fromSortedValues(char[] values, int count) {
        if (count < 0 || count > values.length) {
            throw new IllegalArgumentException("count " + count + " out of bounds for " + values.length + " values");
        }
        for (int i = 1; i < count; i++) {
            if (values[i] <= values[i - 1]) {
                throw new IllegalArgumentException("values not strictly ascending at index " + i);
            }
        }
        return ofArray(Arrays.copyOf(values, count), count);
    }

    /**
     * Creates a container from a 65536-bit vector. The array is copied.
     *
     * @param words exactly 1024 words, bit {@code v & 63} of word {@code v >>> 6} standing for value v
     * @return a new container in its best representation
     */
    public static Container fromWords(long[] words) {
        if (words.length != BITMAP_WORDS) {
            throw new IllegalArgumentException("expected " + BITMAP_WORDS + " words, got " + words.length);
        }
        return ofWords(words.clone());
    }

    /**
     * Creates a container from runs. The array is copied.
     *
     * @param runs {@code (start, length - 1)} pairs, sorted, disjoint and non-adjacent
     * @param runCount the number of pairs to use
     * @return a new container in its best representation
     * @throws IllegalArgumentException if the runs are unsorted, overlap, touch or pass 65535
     */
    public static Container fromRuns(char[] runs, int runCount) {
        if (runCount < 0 || 2 * runCount > runs.length) {
            throw new IllegalArgumentException("run count " + runCount + " out of bounds for " + runs.length / 2 + " runs");
        }
        int cardinality = 0;
        int previousEnd = -2;
        for (int i = 0; i < runCount; i++) {
            int start = runs[2 * i];
            int end = start + runs[2 * i + 1];
            if (end >= MAX_CARDINALITY) {
                throw new IllegalArgumentException("run " + i + " extends past " + (MAX_CARDINALITY - 1));
            }
            if (start <= previousEnd + 1) {
                throw new IllegalArgumentException("run " + i + " is unsorted, overlapping or adjacent to the previous run");
            }
            cardinality += end - start + 1;
            previousEnd = end;
        }
        return ofRuns(Arrays.copyOf(runs, Math.max(2, 2 * runCount)), runCount, cardinality);
    }

    /**
     * @param start the first value, inclusive
     * @param end the last value, exclusive; at most 65536
     * @return a new container holding exactly the values in [start, end)
     */
    public static Container range(int start, int end) {
        checkRange(start, end);
        if (start == end) {
            return new Container();
        }
        return ofRuns(new char[] {(char) start, (char) (end - start - 1)}, 1, end - start);
    }

    private static void checkRange(int start, int end) {
        if (start < 0 || end > MAX_CARDINALITY || start > end) {
            throw new IllegalArgumentException("invalid range [" + start + ", " + end + ")");
        }
    }

    /**
     * @return a view that reads through to this container and cannot modify it
     */
    public ContainerView unmodifiableView() {
        return new UnmodifiableContainer(this);
    }

    @Override
    public ContainerKind kind() {
        return kind;
    }

    public int cardinality() {
        return cardinality;
    }

    /**
     * @return the number of maximal runs of consecutive values, whatever the representation
     */
    public int runCount() {
        return runCount;
    }

    public boolean isEmpty() {
        return cardinality == 0;
    }

    /**
     * @param value the value to add
     * @return true if the value was not present before
     */
    public boolean add(char value) {
        boolean added;
        switch (kind) {
            case ARRAY:
                added = arrayAdd(value);
                break;
            case BITMAP:
                added = bitmapAdd(value);
                break;
            case RUN:
                added = runAdd(value);
                break;
            default:
                throw unknownKind(kind);
        }
        if (added) {
            optimize();
        }
        return added;
    }

    /**
     * @param value the value to remove
     * @return true if the value was present
     */
    public boolean remove(char value) {
        boolean removed;
        switch (kind) {
            case ARRAY:
                removed = arrayRemove(value);
                break;
            case BITMAP:
                removed = bitmapRemove(value);
                break;
            case RUN:
                removed = runRemove(value);
                break;
            default:
                throw unknownKind(kind);
        }
        if (removed) {
            optimize();
        }
        return removed;
    }

    public boolean contains(char value) {
        switch (kind) {
            case ARRAY:
                return Arrays.binarySearch(content, 0, cardinality, value) >= 0;
            case BITMAP:
                return BitmapOps.get(words, value);
            case RUN:
                int i = findRun(value);
                return i >= 0 && value <= runEnd(i);
            default:
                throw unknownKind(kind);
        }
    }

    /**
     * Adds every value in [start, end).
     *
     * @param start the first value, inclusive
     * @param end the last value, exclusive; at most 65536
     * @return the number of values that were not present before
     */
    public int addRange(int start, int end) {
        checkRange(start, end);
        if (start == end) {
            return 0;
        }
        Container merged = ContainerAlgebra.union(this, range(start, end));
        int added = merged.cardinality - cardinality;
        kind = merged.kind;
        content = merged.content;
        words = merged.words;
        cardinality = merged.cardinality;
        runCount = merged.runCount;
        return added;
    }

    /**
     * @return the smallest value
     * @throws NoSuchElementException if the container is empty
     */
    public int min() {
        checkNotEmpty();
        switch (kind) {
            case ARRAY:
            case RUN:
                return content[0];
            case BITMAP:
                return BitmapOps.nextSetBit(words, 0);
            default:
                throw unknownKind(kind);
        }
    }

    /**
     * @return the largest value
     * @throws NoSuchElementException if the container is empty
     */
    public int max() {
        checkNotEmpty();
        switch (kind) {
            case ARRAY:
                return content[cardinality - 1];
            case BITMAP:
                return BitmapOps.prevSetBit(words, MAX_CARDINALITY - 1);
            case RUN:
                return runEnd(runCount - 1);
            default:
                throw unknownKind(kind);
        }
    }

    /**
     * @return the number of values less than or equal to {@code value}
     */
    public int rank(char value) {
        switch (kind) {
            case ARRAY:
                int i = Arrays.binarySearch(content, 0, cardinality, value);
                return i >= 0 ? i + 1 : -i - 1;
            case BITMAP:
                return BitmapOps.rank(words, value);
            case RUN:
                int count = 0;
                for (int r = 0; r < runCount && runStart(r) <= value; r++) {
                    count += Math.min(runEnd(r), value) - runStart(r) + 1;
                }
                return count;
            default:
                throw unknownKind(kind);
        }
    }

    /**
     * @param index a 0-based position in ascending order
     * @return the value at that position
     * @throws IndexOutOfBoundsException unless {@code 0 <= index < cardinality()}
     */
    public int select(int index) {
        if (index < 0 || index >= cardinality) {
            throw new IndexOutOfBoundsException("index " + index + " out of bounds for cardinality " + cardinality);
        }
        switch (kind) {
            case ARRAY:
                return content[index];
            case BITMAP:
                return BitmapOps.select(words, index);
            case RUN:
                int remaining = index;
                for (int r = 0; ; r++) {
                    int length = content[2 * r + 1] + 1;
                    if (remaining < length) {
                        return runStart(r) + remaining;
                    }
                    remaining -= length;
                }
            default:
                throw unknownKind(kind);
        }
    }

    /**
     * @return the values in ascending order; a new iterator starts over from the smallest value
     */
    public PrimitiveIterator.OfInt iterator() {
        switch (kind) {
            case ARRAY:
                return new ArrayIterator(content, cardinality);
            case BITMAP:
                return new BitmapIterator(words);
            case RUN:
                return new RunIterator(content, runCount);
            default:
                throw unknownKind(kind);
        }
    }

    /**
     * Calls the visitor once per maximal run, in ascending order.
     */
    public void forEachRun(RunVisitor visitor) {
        switch (kind) {
            case ARRAY:
                int i = 0;
                while (i < cardinality) {
                    int j = i;
                    while (j + 1 < cardinality && content[j + 1] == content[j] + 1) {
                        j++;
                    }
                    visitor.visit(content[i], j - i + 1);
                    i = j + 1;
                }
                break;
            case BITMAP:
                BitmapOps.forEachRun(words, visitor);
                break;
            case RUN:
                for (int r = 0; r < runCount; r++) {
                    visitor.visit(content[2 * r], content[2 * r + 1] + 1);
                }
                break;
            default:
                throw unknownKind(kind);
        }
    }

    /**
     * @return a new 1024-word vector holding the values of this container
     */
    public long[] toWords() {
        switch (kind) {
            case ARRAY:
                long[] fromArray = new long[BITMAP_WORDS];
                for (int i = 0; i < cardinality; i++) {
                    BitmapOps.set(fromArray, content[i]);
                }
                return fromArray;
            case BITMAP:
                return words.clone();
            case RUN:
                long[] fromRuns = new long[BITMAP_WORDS];
                for (int r = 0; r < runCount; r++) {
                    BitmapOps.setRange(fromRuns, runStart(r), runEnd(r) + 1);
                }
                return fromRuns;
            default:
                throw unknownKind(kind);
        }
    }

    /**
     * @return a new array of exactly {@link #cardinality()} values in ascending order
     */
    public char[] toSortedValues() {
        switch (kind) {
            case ARRAY:
                return ArrayUtil.copyOfSubArray(content, cardinality);
            case BITMAP:
                return BitmapOps.toArray(words, cardinality);
            case RUN:
                char[] out = new char[cardinality];
                int k = 0;
                for (int r = 0; r < runCount; r++) {
                    for (int v = runStart(r), end = runEnd(r); v <= end; v++) {
                        out[k++] = (char) v;
                    }
                }
                return out;
            default:
                throw unknownKind(kind);
        }
    }

    /**
     * @return a deep copy, sized to its contents
     */
    public Container copy() {
        switch (kind) {
            case ARRAY:
                return new Container(kind, Arrays.copyOf(content, Math.max(1, cardinality)), null, cardinality, runCount);
            case BITMAP:
                return new Container(kind, null, words.clone(), cardinality, runCount);
            case RUN:
                return new Container(kind, Arrays.copyOf(content, Math.max(2, 2 * runCount)), null, cardinality, runCount);
            default:
                throw unknownKind(kind);
        }
    }

    public static Container union(Container a, Container b) {
        return ContainerAlgebra.union(a, b);
    }

    public static Container intersection(Container a, Container b) {
        return ContainerAlgebra.intersection(a, b);
    }

    /**
     * @return the values of {@code a} that are not in {@code b}
     */
    public static Container difference(Container a, Container b) {
        return ContainerAlgebra.difference(a, b);
    }

    public static Container symmetricDifference(Container a, Container b) {
        return ContainerAlgebra.symmetricDifference(a, b);
    }

    /**
     * Switches to the representation the policy prefers for the current shape.
     */
    void optimize() {
        ContainerKind target = ContainerPolicy.bestKind(cardinality, runCount);
        if (target == kind) {
            return;
        }
        switch (target) {
            case ARRAY:
                content = toSortedValues();
                words = null;
                break;
            case BITMAP:
                words = toWords();
                content = null;
                break;
            case RUN:
                content = toRunPairs();
                words = null;
                break;
            default:
                throw unknownKind(target);
        }
        kind = target;
    }

    private char[] toRunPairs() {
        char[] pairs = new char[Math.max(2, 2 * runCount)];
        int[] next = new int[1];
        forEachRun((start, length) -> {
            pairs[next[0]++] = (char) start;
            pairs[next[0]++] = (char) (length - 1);
        });
        return pairs;
    }

    private boolean arrayAdd(char value) {
        int i = Arrays.binarySearch(content, 0, cardinality, value);
        if (i >= 0) {
            return false;
        }
        int insertion = -i - 1;
        boolean joinsPrevious = insertion > 0 && content[insertion - 1] == value - 1;
        boolean joinsNext = insertion < cardinality && content[insertion] == value + 1;
        content = ArrayUtil.grow(content, cardinality + 1);
        System.arraycopy(content, insertion, content, insertion + 1, cardinality - insertion);
        content[insertion] = value;
        cardinality++;
        runCount += 1 - (joinsPrevious ? 1 : 0) - (joinsNext ? 1 : 0);
        return true;
    }

    private boolean arrayRemove(char value) {
        int i = Arrays.binarySearch(content, 0, cardinality, value);
        if (i < 0) {
            return false;
        }
        boolean hasPrevious = i > 0 && content[i - 1] == value - 1;
        boolean hasNext = i < cardinality - 1 && content[i + 1] == value + 1;
        System.arraycopy(content, i + 1, content, i, cardinality - i - 1);
        cardinality--;
        runCount += (hasPrevious ? 1 : 0) + (hasNext ? 1 : 0) - 1;
        return true;
    }

    private boolean bitmapAdd(char value) {
        if (BitmapOps.get(words, value)) {
            return false;
        }
        boolean joinsPrevious = value > 0 && BitmapOps.get(words, value - 1);
        boolean joinsNext = value < MAX_CARDINALITY - 1 && BitmapOps.get(words, value + 1);
        BitmapOps.set(words, value);
        cardinality++;
        runCount += 1 - (joinsPrevious ? 1 : 0) - (joinsNext ? 1 : 0);
        return true;
    }

    private boolean bitmapRemove(char value) {
        if (!BitmapOps.get(words, value)) {
            return false;
        }
        boolean hasPrevious = value > 0 && BitmapOps.get(words, value - 1);
        boolean hasNext = value < MAX_CARDINALITY - 1 && BitmapOps.get(words, value + 1);
        BitmapOps.clear(words, value);
        cardinality--;
        runCount += (hasPrevious ? 1 : 0) + (hasNext ? 1 : 0) - 1;
        return true;
    }

    private boolean runAdd(char value) {
        int i = findRun(value);
        if (i >= 0 && value <= runEnd(i)) {
            return false;
        }
        if (i >= 0 && value == runEnd(i) + 1) {
            content[2 * i + 1]++;
            if (i + 1 < runCount && runStart(i + 1) == value + 1) {
                content[2 * i + 1] = (char) (runEnd(i + 1) - runStart(i));
                deleteRun(i + 1);
            }
        } else if (i + 1 < runCount && runStart(i + 1) == value + 1) {
            content[2 * (i + 1)] = value;
            content[2 * (i + 1) + 1]++;
        } else {
            insertRun(i + 1, value, 0);
        }
        cardinality++;
        return true;
    }

    private boolean runRemove(char value) {
        int i = findRun(value);
        if (i < 0 || value > runEnd(i)) {
            return false;
        }
        int start = runStart(i);
        int end = runEnd(i);
        if (start == end) {
            deleteRun(i);
        } else if (value == start) {
            content[2 * i] = (char) (start + 1);
            content[2 * i + 1]--;
        } else if (value == end) {
            content[2 * i + 1]--;
        } else {
            content[2 * i + 1] = (char) (value - 1 - start);
            insertRun(i + 1, value + 1, end - value - 1);
        }
        cardinality--;
        return true;
    }

    /**
     * @return the index of the last run starting at or before {@code value}, or -1
     */
    private int findRun(int value) {
        int lo = 0;
        int hi = runCount - 1;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            if (content[2 * mid] <= value) {
                lo = mid + 1;
            } else {
                hi = mid - 1;
            }
        }
        return hi;
    }

    private int runStart(int run) {
        return content[2 * run];
    }

    private int runEnd(int run) {
        return content[2 * run] + content[2 * run + 1];
    }

    private void insertRun(int index, int start, int lengthMinusOne) {
        content = ArrayUtil.grow(content, 2 * runCount + 2);
        System.arraycopy(content, 2 * index, content, 2 * index + 2, 2 * (runCount - index));
        content[2 * index] = (char) start;
        content[2 * index + 1] = (char) lengthMinusOne;
        runCount++;
    }

    private void deleteRun(int index) {
        System.arraycopy(content, 2 * index + 2, content, 2 * index, 2 * (runCount - index - 1));
        runCount--;
    }

    private void checkNotEmpty() {
        if (cardinality == 0) {
            throw new NoSuchElementException("empty container");
        }
    }

    static IllegalStateException unknownKind(ContainerKind kind) {
        return new IllegalStateException("Unknown container kind " + kind);
    }

    @Override
    public long ramBytesUsed() {
        return SHALLOW_RAM_BYTES + RamUsageEstimator.sizeOf(content) + RamUsageEstimator.sizeOf(words);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Container)) {
            return false;
        }
        Container that = (Container) o;
        if (cardinality != that.cardinality || runCount != that.runCount) {
            return false;
        }
        if (kind == that.kind) {
            switch (kind) {
                case ARRAY:
                    return Arrays.equals(content, 0, cardinality, that.content, 0, cardinality);
                case BITMAP:
                    return Arrays.equals(words, that.words);
                case RUN:
                    return Arrays.equals(content, 0, 2 * runCount, that.content, 0, 2 * runCount);
                default:
                    throw unknownKind(kind);
            }
        }
        PrimitiveIterator.OfInt mine = iterator();
        PrimitiveIterator.OfInt theirs = that.iterator();
        while (mine.hasNext()) {
            if (mine.nextInt() != theirs.nextInt()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = 1;
        for (PrimitiveIterator.OfInt it = iterator(); it.hasNext(); ) {
            h = 31 * h + it.nextInt();
        }
        return h;
    }

    @Override
    public String toString() {
        return "Container{kind=" + kind + ", cardinality=" + cardinality + ", runs=" + runCount + '}';
    }

    private static final class ArrayIterator implements PrimitiveIterator.OfInt {
        private final char[] values;
        private final int count;
        private int next;

        ArrayIterator(char[] values, int count) {
            this.values = values;
            this.count = count;
        }

        @Override
        public boolean hasNext() {
            return next < count;
        }

        @Override
        public int nextInt() {
            if (next >= count) {
                throw new NoSuchElementException();
            }
            return values[next++];
        }
    }

    private static final class BitmapIterator implements PrimitiveIterator.OfInt {
        private final long[] words;
        private int next;

        BitmapIterator(long[] words) {
            this.words = words;
            this.next = BitmapOps.nextSetBit(words, 0);
        }

        @Override
        public boolean hasNext() {
            return next >= 0;
        }

        @Override
        public int nextInt() {
            if (next < 0) {
                throw new NoSuchElementException();
            }
            int value = next;
            next = BitmapOps.nextSetBit(words, value + 1);
            return value;
        }
    }

    private static final class RunIterator implements PrimitiveIterator.OfInt {
        private final char[] runs;
        private final int runCount;
        private int run;
        private int offset;

        RunIterator(char[] runs, int runCount) {
            this.runs = runs;
            this.runCount = runCount;
        }

        @Override
        public boolean hasNext() {
            return run < runCount;
        }

        @Override
        public int nextInt() {
            if (run >= runCount) {
                throw new NoSuchElementException();
            }
            int value = runs[2 * run] + offset;
            if (offset == runs[2 * run + 1]) {
                run++;
                offset = 0;
            } else {
                offset++;
            }
            return value;
        }
    }
}
