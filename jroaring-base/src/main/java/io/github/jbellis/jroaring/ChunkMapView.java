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

import io.github.jbellis.jroaring.container.ContainerView;

/**
 * Read access to the chunks of a bitmap, in ascending key order.
 */
public interface ChunkMapView {
    int size();

    boolean isEmpty();

    /**
     * @throws IndexOutOfBoundsException unless {@code 0 <= index < size()}
     */
    long keyAt(int index);

    /**
     * @throws IndexOutOfBoundsException unless {@code 0 <= index < size()}
     */
    ContainerView containerAt(int index);
}
