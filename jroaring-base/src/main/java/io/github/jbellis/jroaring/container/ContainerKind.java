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

/**
 * The representation currently used by a {@link Container}.
 */
public enum ContainerKind {
    /** Sorted array of distinct 16-bit values, for sparse chunks. */
    ARRAY,
    /** 65536-bit vector, for dense chunks. */
    BITMAP,
    /** Sorted list of disjoint, non-adjacent runs, for clustered chunks. */
    RUN
}
