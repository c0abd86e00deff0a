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

/**
 * Accumulates runs given in ascending order of start, merging runs that overlap or touch so the
 * result is always a list of disjoint, non-adjacent runs. Ends are inclusive.
 */
final class RunBuilder implements RunVisitor {
    private char[] runs;
    private int runCount;
    private int lastStart = -1;
    private int lastEnd = -2;
    private int cardinality;

    RunBuilder(int expectedRuns) {
        runs = new char[Math.max(2, 2 * expectedRuns)];
    }

    void add(int start, int end) {
        if (runCount > 0 && start <= lastEnd + 1) {
            if (end > lastEnd) {
                cardinality += end - lastEnd;
                lastEnd = end;
                runs[2 * runCount - 1] = (char) (lastEnd - lastStart);
            }
            return;
        }
        runs = ArrayUtil.grow(runs, 2 * runCount + 2);
        runs[2 * runCount] = (char) start;
        runs[2 * runCount + 1] = (char) (end - start);
        runCount++;
        lastStart = start;
        lastEnd = end;
        cardinality += end - start + 1;
    }

    @Override
    public void visit(int start, int length) {
        add(start, start + length - 1);
    }

    int runCount() {
        return runCount;
    }

    /** The backing (start, length - 1) pairs; valid for the first {@link #runCount()} runs. */
    char[] pairs() {
        return runs;
    }

    Container build() {
        return Container.ofRuns(runs, runCount, cardinality);
    }
}
