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

/**
 * Low-level helpers shared by the container engine and the codecs.
 *
 * <ul>
 *   <li><b>Array growth</b>: {@link io.github.jbellis.jroaring.util.ArrayUtil} grows the
 *       {@code char[]} backing arrays of array and run containers.</li>
 *   <li><b>Memory estimation</b>: {@link io.github.jbellis.jroaring.util.Accountable} and
 *       {@link io.github.jbellis.jroaring.util.RamUsageEstimator} provide approximate heap
 *       footprints, used by bitmap statistics.</li>
 * </ul>
 */
package io.github.jbellis.jroaring.util;
