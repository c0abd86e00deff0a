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

import io.github.jbellis.jroaring.codec.SerializationFormat;
import io.github.jbellis.jroaring.container.Container;
import io.github.jbellis.jroaring.container.ContainerView;
import io.github.jbellis.jroaring.exceptions.InvalidFormatException;
import io.github.jbellis.jroaring.exceptions.KeyModeMismatchException;
import io.github.jbellis.jroaring.exceptions.ValueOutOfRangeException;
import io.github.jbellis.jroaring.io.StreamInput;
import io.github.jbellis.jroaring.io.StreamOutput;
import io.github.jbellis.jroaring.util.Accountable;
import io.github.jbellis.jroaring.util.RamUsageEstimator;
import org.agrona.collections.LongArrayList;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.NoSuchElementException;
import java.util.OptionalLong;
import java.util.PrimitiveIterator;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.LongStream;
import java.util.stream.StreamSupport;

/**
 * A compressed set of unsigned integers.
 * <p>
 * Values are split into a high key and 16 low bits. Values sharing a high key live in one
 * {@link Container}, which picks the most compact of its representations on its own; the
 * containers are kept in a {@link ChunkMap} ordered by high key. The {@link KeyMode} chosen at
 * construction fixes the value range: unsigned 32-bit for {@link KeyMode#NARROW}, unsigned
 * 64-bit for {@link KeyMode#WIDE}. Values are always ordered as unsigned numbers.
 * <p>
 * Binary operations require both bitmaps to have the same mode and throw
 * {@link KeyModeMismatchException} otherwise, before doing any work.
 * <p>
 * Not thread-safe. Concurrent reads of a bitmap that is not being modified are fine.
 */
public final class RoaringBitmap implements Iterable<Long>, Accountable {
    private static final long SHALLOW_RAM_BYTES =
            RamUsageEstimator.shallowSizeOf(2 * RamUsageEstimator.NUM_BYTES_OBJECT_REF + Long.BYTES);
    private static final int MAX_TO_STRING_VALUES = 32;

    private final KeyMode mode;
    private ChunkMap chunks;
    private long cardinality;

    public RoaringBitmap(KeyMode mode) {
        this(mode, new ChunkMap());
    }

    private RoaringBitmap(KeyMode mode, ChunkMap chunks) {
        if (mode == null) {
            throw new NullPointerException("mode");
        }
        this.mode = mode;
        this.chunks = chunks;
        this.cardinality = chunks.cardinality();
    }

    /**
     * @return a new, empty bitmap of unsigned 32-bit values
     */
    public static RoaringBitmap narrow() {
        return new RoaringBitmap(KeyMode.NARROW);
    }

    /**
     * @return a new, empty bitmap of unsigned 64-bit values
     */
    public static RoaringBitmap wide() {
        return new RoaringBitmap(KeyMode.WIDE);
    }

    public static RoaringBitmap of(KeyMode mode, long... values) {
        RoaringBitmap bitmap = new RoaringBitmap(mode);
        bitmap.addAll(values);
        return bitmap;
    }

    /**
     * Wraps a chunk map built by a decoder. The bitmap takes ownership of the map.
     *
     * @throws ValueOutOfRangeException if a high key is too large for the mode
     * @throws IllegalArgumentException if the map holds an empty container
     */
    public static RoaringBitmap fromChunks(KeyMode mode, ChunkMap chunks) {
        for (int i = 0; i < chunks.size(); i++) {
            if (chunks.containerAt(i).isEmpty()) {
                throw new IllegalArgumentException("empty container for key " + chunks.keyAt(i));
            }
        }
        if (chunks.size() > 0 && chunks.keyAt(chunks.size() - 1) > mode.maxHighKey()) {
            throw new ValueOutOfRangeException(mode, KeyMode.compose(chunks.keyAt(chunks.size() - 1), 0));
        }
        return new RoaringBitmap(mode, chunks);
    }

    /**
     * Decodes a whole byte array; trailing bytes are an error.
     * The mode of the result is the one the format carries.
     */
    public static RoaringBitmap fromBytes(SerializationFormat format, byte[] bytes) throws InvalidFormatException {
        return format.codec().fromBytes(bytes);
    }

    /**
     * Decodes one bitmap from the stream, consuming exactly its bytes. The stream is not closed.
     *
     * @throws InvalidFormatException if the bytes are not a valid bitmap in this format
     * @throws IOException if reading from the stream fails
     */
    public static RoaringBitmap deserialize(SerializationFormat format, InputStream in) throws IOException {
        return format.codec().read(new StreamInput(in));
    }

    public KeyMode mode() {
        return mode;
    }

    /**
     * A read-only view of the chunks, for codecs and diagnostics. The view follows later
     * changes to this bitmap; {@link ContainerView#copy()} gives a detached container.
     */
    public ChunkMapView chunks() {
        return new ChunksView();
    }

    /**
     * @param value the value to add, interpreted as unsigned
     * @return true if the value was not present before
     * @throws ValueOutOfRangeException if the value is outside the mode's range
     */
    public boolean add(long value) {
        mode.checkValue(value);
        int i = chunks.getOrCreate(KeyMode.highKey(value));
        if (chunks.containerAt(i).add(KeyMode.low(value))) {
            cardinality++;
            return true;
        }
        return false;
    }

    /**
     * @param value the value to remove, interpreted as unsigned
     * @return true if the value was present
     * @throws ValueOutOfRangeException if the value is outside the mode's range
     */
    public boolean remove(long value) {
        mode.checkValue(value);
        long key = KeyMode.highKey(value);
        Container container = chunks.get(key);
        if (container == null || !container.remove(KeyMode.low(value))) {
            return false;
        }
        chunks.removeIfEmpty(key);
        cardinality--;
        return true;
    }

    /**
     * @return true if the value is present; values outside the mode's range never are
     */
    public boolean contains(long value) {
        if (!mode.isValid(value)) {
            return false;
        }
        Container container = chunks.get(KeyMode.highKey(value));
        return container != null && container.contains(KeyMode.low(value));
    }

    /**
     * Adds every given value. The values are checked first, so an out-of-range value leaves
     * the bitmap unchanged.
     *
     * @return the number of values that were not present before
     */
    public long addAll(long... values) {
        for (long value : values) {
            mode.checkValue(value);
        }
        long added = 0;
        for (long value : values) {
            if (add(value)) {
                added++;
            }
        }
        return added;
    }

    /**
     * Adds every value the iterator yields. The values are collected and checked first, so an
     * out-of-range value leaves the bitmap unchanged.
     *
     * @return the number of values that were not present before
     */
    public long addAll(PrimitiveIterator.OfLong values) {
        LongArrayList buffer = new LongArrayList();
        while (values.hasNext()) {
            long value = values.nextLong();
            mode.checkValue(value);
            buffer.addLong(value);
        }
        long added = 0;
        for (int i = 0; i < buffer.size(); i++) {
            if (add(buffer.getLong(i))) {
                added++;
            }
        }
        return added;
    }

    /**
     * @return the number of values that were present
     */
    public long removeAll(long... values) {
        for (long value : values) {
            mode.checkValue(value);
        }
        long removed = 0;
        for (long value : values) {
            if (remove(value)) {
                removed++;
            }
        }
        return removed;
    }

    /**
     * Adds every value in [start, end), both compared as unsigned.
     *
     * @return the number of values that were not present before
     * @throws IllegalArgumentException if start is greater than end
     * @throws ValueOutOfRangeException if the range reaches past the mode's largest value
     */
    public long addRange(long start, long end) {
        if (Long.compareUnsigned(start, end) > 0) {
            throw new IllegalArgumentException("invalid range [" + Long.toUnsignedString(start) + ", " + Long.toUnsignedString(end) + ")");
        }
        if (start == end) {
            return 0;
        }
        long last = end - 1;
        mode.checkValue(last);
        long firstKey = KeyMode.highKey(start);
        long lastKey = KeyMode.highKey(last);
        long added = 0;
        for (long key = firstKey; key <= lastKey; key++) {
            int low = key == firstKey ? KeyMode.low(start) : 0;
            int high = key == lastKey ? KeyMode.low(last) + 1 : 1 << 16;
            int i = chunks.getOrCreate(key);
            added += chunks.containerAt(i).addRange(low, high);
        }
        cardinality += added;
        return added;
    }

    /**
     * Removes every value.
     */
    public void clear() {
        chunks = new ChunkMap();
        cardinality = 0;
    }

    public long cardinality() {
        return cardinality;
    }

    public boolean isEmpty() {
        return cardinality == 0;
    }

    /**
     * @return the smallest value in unsigned order, or empty if the bitmap is empty
     */
    public OptionalLong min() {
        if (chunks.isEmpty()) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(KeyMode.compose(chunks.keyAt(0), chunks.containerAt(0).min()));
    }

    /**
     * @return the largest value in unsigned order, or empty if the bitmap is empty
     */
    public OptionalLong max() {
        if (chunks.isEmpty()) {
            return OptionalLong.empty();
        }
        int last = chunks.size() - 1;
        return OptionalLong.of(KeyMode.compose(chunks.keyAt(last), chunks.containerAt(last).max()));
    }

    /**
     * @return the number of values less than or equal to {@code value}, in unsigned order
     */
    public long rank(long value) {
        if (!mode.isValid(value)) {
            return cardinality;
        }
        long key = KeyMode.highKey(value);
        long rank = 0;
        for (int i = 0; i < chunks.size(); i++) {
            long k = chunks.keyAt(i);
            if (k > key) {
                break;
            }
            Container container = chunks.containerAt(i);
            rank += k < key ? container.cardinality() : container.rank(KeyMode.low(value));
        }
        return rank;
    }

    /**
     * @param index a 0-based position in ascending unsigned order
     * @return the value at that position
     * @throws IndexOutOfBoundsException unless {@code 0 <= index < cardinality()}
     */
    public long select(long index) {
        if (index < 0 || index >= cardinality) {
            throw new IndexOutOfBoundsException("index " + index + " out of bounds for cardinality " + cardinality);
        }
        long remaining = index;
        for (int i = 0; ; i++) {
            Container container = chunks.containerAt(i);
            if (remaining < container.cardinality()) {
                return KeyMode.compose(chunks.keyAt(i), container.select((int) remaining));
            }
            remaining -= container.cardinality();
        }
    }

    /**
     * @return the values in ascending unsigned order
     */
    @Override
    public PrimitiveIterator.OfLong iterator() {
        return new ValueIterator(chunks);
    }

    /**
     * @return the values in ascending unsigned order
     */
    public LongStream stream() {
        Spliterator.OfLong spliterator = Spliterators.spliterator(iterator(), cardinality,
                Spliterator.ORDERED | Spliterator.DISTINCT | Spliterator.NONNULL);
        return StreamSupport.longStream(spliterator, false);
    }

    /**
     * @return the values in ascending unsigned order
     * @throws IllegalStateException if there are too many values for an array
     */
    public long[] toArray() {
        if (cardinality > Integer.MAX_VALUE - 8) {
            throw new IllegalStateException("too many values for an array: " + cardinality);
        }
        long[] out = new long[(int) cardinality];
        int k = 0;
        for (PrimitiveIterator.OfLong it = iterator(); it.hasNext(); ) {
            out[k++] = it.nextLong();
        }
        return out;
    }

    private void checkMode(RoaringBitmap other) {
        if (other.mode != mode) {
            throw new KeyModeMismatchException(mode, other.mode);
        }
    }

    /**
     * @return a new bitmap holding the values of either bitmap
     */
    public RoaringBitmap union(RoaringBitmap other) {
        return combine(other, SetOperation.UNION);
    }

    /**
     * @return a new bitmap holding the values present in both bitmaps
     */
    public RoaringBitmap intersection(RoaringBitmap other) {
        return combine(other, SetOperation.INTERSECTION);
    }

    /**
     * @return a new bitmap holding the values of this bitmap that are not in {@code other}
     */
    public RoaringBitmap difference(RoaringBitmap other) {
        return combine(other, SetOperation.DIFFERENCE);
    }

    /**
     * @return a new bitmap holding the values present in exactly one of the bitmaps
     */
    public RoaringBitmap symmetricDifference(RoaringBitmap other) {
        return combine(other, SetOperation.SYMMETRIC_DIFFERENCE);
    }

    private RoaringBitmap combine(RoaringBitmap other, SetOperation operation) {
        checkMode(other);
        return new RoaringBitmap(mode, ChunkMap.merge(chunks, other.chunks, operation, false));
    }

    /** Adds the values of {@code other} to this bitmap. */
    public void unionWith(RoaringBitmap other) {
        combineInPlace(other, SetOperation.UNION);
    }

    /** Keeps only the values also present in {@code other}. */
    public void intersectWith(RoaringBitmap other) {
        combineInPlace(other, SetOperation.INTERSECTION);
    }

    /** Removes the values present in {@code other}. */
    public void subtract(RoaringBitmap other) {
        combineInPlace(other, SetOperation.DIFFERENCE);
    }

    /** Keeps the values present in exactly one of the two bitmaps. */
    public void symmetricDifferenceWith(RoaringBitmap other) {
        combineInPlace(other, SetOperation.SYMMETRIC_DIFFERENCE);
    }

    private void combineInPlace(RoaringBitmap other, SetOperation operation) {
        checkMode(other);
        chunks = ChunkMap.merge(chunks, other.chunks, operation, other != this);
        cardinality = chunks.cardinality();
    }

    /**
     * @throws KeyModeMismatchException if the format does not support this bitmap's mode
     */
    public byte[] toBytes(SerializationFormat format) {
        return format.codec().toBytes(this);
    }

    /**
     * Writes this bitmap to the stream, which is flushed but not closed.
     *
     * @throws KeyModeMismatchException if the format does not support this bitmap's mode
     * @throws IOException if writing to the stream fails
     */
    public void serialize(SerializationFormat format, OutputStream out) throws IOException {
        BufferedOutputStream buffered = new BufferedOutputStream(out);
        StreamOutput output = new StreamOutput(buffered);
        format.codec().write(this, output);
        output.flush();
    }

    /**
     * @return the exact number of bytes {@link #toBytes} would produce
     * @throws KeyModeMismatchException if the format does not support this bitmap's mode
     */
    public long serializedSizeInBytes(SerializationFormat format) {
        return format.codec().serializedSizeInBytes(this);
    }

    public BitmapStats stats() {
        return new BitmapStats(chunks, min(), max());
    }

    @Override
    public long ramBytesUsed() {
        return SHALLOW_RAM_BYTES + chunks.ramBytesUsed();
    }

    /**
     * @return a deep copy sharing no state with this bitmap
     */
    public RoaringBitmap copy() {
        return new RoaringBitmap(mode, chunks.copy());
    }

    /**
     * Returns a copy of this bitmap in the given mode.
     *
     * @throws ValueOutOfRangeException if a value does not fit the target mode
     */
    public RoaringBitmap convertTo(KeyMode target) {
        OptionalLong max = max();
        if (max.isPresent()) {
            target.checkValue(max.getAsLong());
        }
        return new RoaringBitmap(target, chunks.copy());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RoaringBitmap)) {
            return false;
        }
        RoaringBitmap that = (RoaringBitmap) o;
        return mode == that.mode && cardinality == that.cardinality && chunks.equals(that.chunks);
    }

    @Override
    public int hashCode() {
        return 31 * mode.hashCode() + chunks.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("RoaringBitmap{mode=").append(mode)
                .append(", cardinality=").append(cardinality)
                .append(", values=[");
        PrimitiveIterator.OfLong it = iterator();
        for (int i = 0; it.hasNext() && i < MAX_TO_STRING_VALUES; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(Long.toUnsignedString(it.nextLong()));
        }
        if (it.hasNext()) {
            sb.append(", ...");
        }
        return sb.append("]}").toString();
    }

    /**
     * Reads whichever chunk map currently backs this bitmap.
     */
    private final class ChunksView implements ChunkMapView {
        @Override
        public int size() {
            return chunks.size();
        }

        @Override
        public boolean isEmpty() {
            return chunks.isEmpty();
        }

        @Override
        public long keyAt(int index) {
            return chunks.keyAt(index);
        }

        @Override
        public ContainerView containerAt(int index) {
            return chunks.containerAt(index).unmodifiableView();
        }
    }

    private static final class ValueIterator implements PrimitiveIterator.OfLong {
        private final ChunkMap chunks;
        private int chunk = -1;
        private long highBits;
        private PrimitiveIterator.OfInt lows;

        ValueIterator(ChunkMap chunks) {
            this.chunks = chunks;
            advance();
        }

        private void advance() {
            while ((lows == null || !lows.hasNext()) && ++chunk < chunks.size()) {
                highBits = KeyMode.compose(chunks.keyAt(chunk), 0);
                lows = chunks.containerAt(chunk).iterator();
            }
        }

        @Override
        public boolean hasNext() {
            return lows != null && lows.hasNext();
        }

        @Override
        public long nextLong() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            long value = highBits | lows.nextInt();
            if (!lows.hasNext()) {
                advance();
            }
            return value;
        }
    }
}
