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
import io.github.jbellis.jroaring.container.ContainerKind;

import java.util.Locale;
import java.util.OptionalLong;

/**
 * The composition of a bitmap: how many containers of each representation it has, and how many
 * values and (approximate) heap bytes they account for.
 */
public final class BitmapStats {
    private final int[] containers = new int[ContainerKind.values().length];
    private final long[] values = new long[ContainerKind.values().length];
    private final long[] bytes = new long[ContainerKind.values().length];
    private final OptionalLong min;
    private final OptionalLong max;

    BitmapStats(ChunkMap chunks, OptionalLong min, OptionalLong max) {
        for (int i = 0; i < chunks.size(); i++) {
            Container c = chunks.containerAt(i);
            int kind = c.kind().ordinal();
            containers[kind]++;
            values[kind] += c.cardinality();
            bytes[kind] += c.ramBytesUsed();
        }
        this.min = min;
        this.max = max;
    }

    public int containers() {
        int total = 0;
        for (int n : containers) {
            total += n;
        }
        return total;
    }

    public int containers(ContainerKind kind) {
        return containers[kind.ordinal()];
    }

    /**
     * @return the cardinality of the bitmap
     */
    public long values() {
        long total = 0;
        for (long n : values) {
            total += n;
        }
        return total;
    }

    public long values(ContainerKind kind) {
        return values[kind.ordinal()];
    }

    /**
     * @return the approximate heap bytes held by all containers
     */
    public long bytes() {
        long total = 0;
        for (long n : bytes) {
            total += n;
        }
        return total;
    }

    public long bytes(ContainerKind kind) {
        return bytes[kind.ordinal()];
    }

    /**
     * @return the smallest value, empty if the bitmap is empty
     */
    public OptionalLong min() {
        return min;
    }

    /**
     * @return the largest value, empty if the bitmap is empty
     */
    public OptionalLong max() {
        return max;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("BitmapStats{containers=").append(containers());
        for (ContainerKind kind : ContainerKind.values()) {
            sb.append(", ").append(kind.name().toLowerCase(Locale.ROOT)).append("=")
              .append(containers(kind)).append('/').append(values(kind)).append('/').append(bytes(kind));
        }
        sb.append(", values=").append(values())
          .append(", bytes=").append(bytes())
          .append(", min=").append(min.isPresent() ? Long.toUnsignedString(min.getAsLong()) : "none")
          .append(", max=").append(max.isPresent() ? Long.toUnsignedString(max.getAsLong()) : "none")
          .append('}');
        return sb.toString();
    }
}
