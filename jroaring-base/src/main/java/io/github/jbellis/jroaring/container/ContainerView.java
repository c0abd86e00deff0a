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

import io.github.jbellis.jroaring.util.Accountable;

import java.util.PrimitiveIterator;

/**
 * Read access to the low values of one chunk. This is what a bitmap hands out to codecs and
 * other callers; it has no way to change the values it describes.
 */
public interface ContainerView extends Accountable {
    ContainerKind kind();

    int cardinality();

    /**
     * @return the number of maximal runs of consecutive values
     */
    int runCount();

    boolean isEmpty();

    boolean contains(char value);

    /**
     * @throws java.util.NoSuchElementException if there are no values
     */
    int min();

    /**
     * @throws java.util.NoSuchElementException if there are no values
     */
    int max();

    /**
     * @return the number of values less than or equal to {@code value}
     */
    int rank(char value);

    /**
     * @throws IndexOutOfBoundsException unless {@code 0 <= index < cardinality()}
     */
    int select(int index);

    /**
     * @return the values in ascending order
     */
    PrimitiveIterator.OfInt iterator();

    /**
     * Calls the visitor for every maximal run, in ascending order.
     */
    void forEachRun(RunVisitor visitor);

    /**
     * @return a new array of 1024 words with the values as set bits
     */
    long[] toWords();

    /**
     * @return a new array holding exactly the values, ascending
     */
    char[] toSortedValues();

    /**
     * @return a new, independent container holding the same values
     */
    Container copy();
}
