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
 * Exception types reported by JRoaring.
 *
 * <h2>Exception Types</h2>
 * <ul>
 *   <li>{@link io.github.jbellis.jroaring.exceptions.InvalidFormatException} - a checked
 *       {@link java.io.IOException} raised when serialized bytes cannot be decoded. It names the
 *       byte offset and the field at which decoding stopped.</li>
 *   <li>{@link io.github.jbellis.jroaring.exceptions.KeyModeMismatchException} - an unchecked
 *       usage error raised when 32-bit-key and 64-bit-key bitmaps are mixed, or a bitmap is handed
 *       to a codec that does not accept its key mode.</li>
 *   <li>{@link io.github.jbellis.jroaring.exceptions.ValueOutOfRangeException} - an unchecked
 *       usage error raised for values the bitmap's key mode cannot address.</li>
 * </ul>
 *
 * <h2>Exception Handling Example</h2>
 * <pre>{@code
 * try {
 *     RoaringBitmap bitmap = RoaringBitmap.fromBytes(SerializationFormat.PORTABLE, bytes);
 * } catch (InvalidFormatException e) {
 *     logger.warn("Rejected bitmap: field {} at offset {}", e.getField(), e.getOffset());
 * }
 * }</pre>
 *
 * <p>
 * None of these exceptions leave a bitmap half-modified: mode and range checks run before any
 * mutation, and decoding never returns a partially-built bitmap.
 */
package io.github.jbellis.jroaring.exceptions;
