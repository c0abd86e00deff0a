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

import java.util.PrimitiveIterator;

/**
 * Delegates every read to a live container, so it always reflects the current values.
 */
final class UnmodifiableContainer implements ContainerView {
    private final Container container;

    UnmodifiableContainer(Container container) {
        this.container = container;
    }

    @Override
    public ContainerKind kind() {
        return container.kind();
    }

    @Override
    public int cardinality() {
        return container.cardinality();
    }

    @Override
    public int runCount() {
        return container.runCount();
    }

    @Override
    public boolean isEmpty() {
        return container.isEmpty();
    }

    @Override
    public boolean contains(char value) {
        return container.contains(value);
    }

    @Override
    public int min() {
        return container.min();
    }

    @Override
    public int max() {
        return container.max();
    }

    @Override
    public int rank(char value) {
        return container.rank(value);
    }

    @Override
    public int select(int index) {
        return container.select(index);
    }

    @Override
    public PrimitiveIterator.OfInt iterator() {
        return container.iterator();
    }

    @Override
    public void forEachRun(RunVisitor visitor) {
        container.forEachRun(visitor);
    }

    @Override
    public long[] toWords() {
        return container.toWords();
    }

    @Override
    public char[] toSortedValues() {
        return container.toSortedValues();
    }

    @Override
    public Container copy() {
        return container.copy();
    }

    @Override
    public long ramBytesUsed() {
        return container.ramBytesUsed();
    }

    @Override
    public String toString() {
        return container.toString();
    }
}
