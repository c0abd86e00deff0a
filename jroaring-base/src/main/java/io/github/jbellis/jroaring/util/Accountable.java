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

package io.github.jbellis.jroaring.util;

/**
 * An object whose heap footprint can be estimated.
 */
public interface Accountable {
    /**
     * Returns an approximation of the memory held by this object, in bytes.
     * The estimate covers the object itself and everything it exclusively owns.
     * @return the approximate number of bytes used
     */
    long ramBytesUsed();
}
