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

package io.github.jbellis.jroaring.codec;

import io.github.jbellis.jroaring.KeyMode;

/**
 * The supported serialization formats.
 */
public enum SerializationFormat {
    /** The standard cross-language Roaring format, for 32-bit ({@link KeyMode#NARROW}) bitmaps. */
    PORTABLE(new PortableCodec()),
    /** A denser, jroaring-specific format for 64-bit ({@link KeyMode#WIDE}) bitmaps. */
    COMPACT(new CompactCodec());

    private final BitmapCodec codec;

    SerializationFormat(BitmapCodec codec) {
        this.codec = codec;
    }

    public BitmapCodec codec() {
        return codec;
    }

    public KeyMode mode() {
        return codec.mode();
    }
}
