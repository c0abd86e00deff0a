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

import java.util.Arrays;

import static io.github.jbellis.jroaring.container.ContainerPolicy.BITMAP_WORDS;
import static io.github.jbellis.jroaring.container.ContainerPolicy.MAX_CARDINALITY;

/**
 * Bit manipulation over the 1024-word vector of a bitmap container.
 */
final class BitmapOps {
    private BitmapOps() {
    }

    static boolean get(long[] words, int index) {
        return (words[index >>> 6] & (1L << index)) != 0;
    }

    static void set(long[] words, int index) {
        words[index >>> 6] |= 1L << index;
    }

    static void clear(long[] words, int index) {
        words[index >>> 6] &= ~(1L << index);
    }

    static int cardinality(long[] words) {
        int count = 0;
        for (long word : words) {
            count += Long.bitCount(word);
        }
        return count;
    }

    /**
     * Counts the maximal runs by counting set bits whose predecessor is clear.
     */
    static int countRuns(long[] words) {
        int runs = 0;
        long carry = 0;
        for (long word : words) {
            runs += Long.bitCount(word & ~((word << 1) | carry));
            carry = word >>> 63;
        }
        return runs;
    }

    /**
     * @return the index of the first set bit at or after {@code from}, or -1
     */
    static int nextSetBit(long[] words, int from) {
        if (from >= MAX_CARDINALITY) {
            return -1;
        }
        int i = from >>> 6;
        long word = words[i] & (-1L << from);
        while (true) {
            if (word != 0) {
                return (i << 6) + Long.numberOfTrailingZeros(word);
            }
            if (++i == BITMAP_WORDS) {
                return -1;
            }
            word = words[i];
        }
    }

    /**
     * @return the index of the first clear bit at or after {@code from}, or 65536 if there is none
     */
    static int nextClearBit(long[] words, int from) {
        if (from >= MAX_CARDINALITY) {
            return MAX_CARDINALITY;
        }
        int i = from >>> 6;
        long word = ~words[i] & (-1L << from);
        while (true) {
            if (word != 0) {
                return (i << 6) + Long.numberOfTrailingZeros(word);
            }
            if (++i == BITMAP_WORDS) {
                return MAX_CARDINALITY;
            }
            word = ~words[i];
        }
    }

    /**
     * @return the index of the last set bit at or before {@code from}, or -1
     */
    static int prevSetBit(long[] words, int from) {
        int i = from >>> 6;
        long word = words[i] & (-1L >>> (63 - (from & 63)));
        while (true) {
            if (word != 0) {
                return (i << 6) + 63 - Long.numberOfLeadingZeros(word);
            }
            if (--i < 0) {
                return -1;
            }
            word = words[i];
        }
    }

    /** Sets the bits in [start, end). */
    static void setRange(long[] words, int start, int end) {
        if (end <= start) {
            return;
        }
        int startWord = start >>> 6;
        int endWord = (end - 1) >>> 6;
        long startMask = -1L << start;
        long endMask = -1L >>> -end;
        if (startWord == endWord) {
            words[startWord] |= startMask & endMask;
            return;
        }
        words[startWord] |= startMask;
        Arrays.fill(words, startWord + 1, endWord, -1L);
        words[endWord] |= endMask;
    }

    /** Clears the bits in [start, end). */
    static void clearRange(long[] words, int start, int end) {
        if (end <= start) {
            return;
        }
        int startWord = start >>> 6;
        int endWord = (end - 1) >>> 6;
        long startMask = -1L << start;
        long endMask = -1L >>> -end;
        if (startWord == endWord) {
            words[startWord] &= ~(startMask & endMask);
            return;
        }
        words[startWord] &= ~startMask;
        Arrays.fill(words, startWord + 1, endWord, 0L);
        words[endWord] &= ~endMask;
    }

    /**
     * @return the number of set bits at or below {@code index}
     */
    static int rank(long[] words, int index) {
        int w = index >>> 6;
        int count = 0;
        for (int i = 0; i < w; i++) {
            count += Long.bitCount(words[i]);
        }
        return count + Long.bitCount(words[w] & (-1L >>> (63 - (index & 63))));
    }

    /**
     * @return the index of the {@code n}-th set bit (0-based); the caller guarantees it exists
     */
    static int select(long[] words, int n) {
        int remaining = n;
        for (int i = 0; i < BITMAP_WORDS; i++) {
            long word = words[i];
            int bits = Long.bitCount(word);
            if (remaining < bits) {
                for (int k = 0; k < remaining; k++) {
                    word &= word - 1;
                }
                return (i << 6) + Long.numberOfTrailingZeros(word);
            }
            remaining -= bits;
        }
        throw new IllegalStateException("Fewer than " + (n + 1) + " bits set");
    }

    static char[] toArray(long[] words, int cardinality) {
        char[] out = new char[cardinality];
        int k = 0;
        for (int i = 0; i < BITMAP_WORDS; i++) {
            long word = words[i];
            while (word != 0) {
                out[k++] = (char) ((i << 6) + Long.numberOfTrailingZeros(word));
                word &= word - 1;
            }
        }
        return out;
    }

    static void forEachRun(long[] words, RunVisitor visitor) {
        int start = nextSetBit(words, 0);
        while (start >= 0) {
            int end = nextClearBit(words, start);
            visitor.visit(start, end - start);
            start = nextSetBit(words, end);
        }
    }
}
