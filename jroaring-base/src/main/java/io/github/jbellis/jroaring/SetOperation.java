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

/**
 * The binary set operations, as applied chunk by chunk by {@link ChunkMap#merge}.
 */
public enum SetOperation {
    UNION(true, true),
    INTERSECTION(false, false),
    DIFFERENCE(true, false),
    SYMMETRIC_DIFFERENCE(true, true);

    private final boolean keepsLeftOnly;
    private final boolean keepsRightOnly;

    SetOperation(boolean keepsLeftOnly, boolean keepsRightOnly) {
        this.keepsLeftOnly = keepsLeftOnly;
        this.keepsRightOnly = keepsRightOnly;
    }

    /**
     * @return whether a chunk present only in the left operand survives unchanged
     */
    public boolean keepsLeftOnly() {
        return keepsLeftOnly;
    }

    /**
     * @return whether a chunk present only in the right operand survives unchanged
     */
    public boolean keepsRightOnly() {
        return keepsRightOnly;
    }

    /**
     * Combines two containers sharing a high key into a new container.
     */
    public Container apply(Container left, Container right) {
        switch (this) {
            case UNION:
                return Container.union(left, right);
            case INTERSECTION:
                return Container.intersection(left, right);
            case DIFFERENCE:
                return Container.difference(left, right);
            case SYMMETRIC_DIFFERENCE:
                return Container.symmetricDifference(left, right);
            default:
                throw new IllegalArgumentException("Unknown set operation " + this);
        }
    }
}
