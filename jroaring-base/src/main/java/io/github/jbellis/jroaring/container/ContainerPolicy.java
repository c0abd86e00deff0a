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

import io.github.jbellis.jroaring.annotations.VisibleForTesting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides which representation a container should use, based on its cardinality and run count.
 * <p>
 * The array/bitmap threshold and whether run containers are used at all can be tuned through
 * the system properties {@code jroaring.container.array_max_cardinality} (default 4096) and
 * {@code jroaring.container.runs_enabled} (default true). Serialization formats do not depend
 * on these settings.
 */
public final class ContainerPolicy {
    private static final Logger log = LoggerFactory.getLogger(ContainerPolicy.class);

    /** Number of distinct values a container can hold. */
    public static final int MAX_CARDINALITY = 1 << 16;
    /** Number of 64-bit words in a bitmap container. */
    public static final int BITMAP_WORDS = MAX_CARDINALITY / Long.SIZE;
    /** The array/bitmap threshold used by every Roaring implementation. */
    public static final int DEFAULT_ARRAY_MAX_CARDINALITY = 4096;

    /** Containers with more values than this are not stored as arrays. */
    public static final int ARRAY_MAX_CARDINALITY = clampArrayMaxCardinality(
            Integer.getInteger("jroaring.container.array_max_cardinality", DEFAULT_ARRAY_MAX_CARDINALITY));
    /** Whether the run representation may be selected for in-memory containers. */
    public static final boolean RUNS_ENABLED =
            Boolean.parseBoolean(System.getProperty("jroaring.container.runs_enabled", "true"));

    static {
        if (ARRAY_MAX_CARDINALITY != DEFAULT_ARRAY_MAX_CARDINALITY || !RUNS_ENABLED) {
            log.info("Using container policy array_max_cardinality={} runs_enabled={}", ARRAY_MAX_CARDINALITY, RUNS_ENABLED);
        }
    }

    private ContainerPolicy() {
    }

    /**
     * @return the requested threshold limited to {@code [1, 65535]}
     */
    @VisibleForTesting
    static int clampArrayMaxCardinality(int requested) {
        return Math.max(1, Math.min(MAX_CARDINALITY - 1, requested));
    }

    /**
     * @param cardinality the number of values
     * @return the payload size of an array representation, in bytes
     */
    public static int arraySizeInBytes(int cardinality) {
        return cardinality * Character.BYTES;
    }

    /**
     * @return the payload size of a bitmap representation, in bytes
     */
    public static int bitmapSizeInBytes() {
        return BITMAP_WORDS * Long.BYTES;
    }

    /**
     * @param runCount the number of runs
     * @return the payload size of a run representation (count prefix plus start/length pairs), in bytes
     */
    public static int runSizeInBytes(int runCount) {
        return Character.BYTES + runCount * 2 * Character.BYTES;
    }

    /**
     * Picks the representation for a container with the given shape. Arrays are used up to
     * {@link #ARRAY_MAX_CARDINALITY} values, bitmaps above; runs win only when strictly smaller
     * than both the array and the bitmap encoding.
     *
     * @param cardinality the number of values in the container
     * @param runCount the number of maximal runs in the container
     * @return the representation to use
     */
    public static ContainerKind bestKind(int cardinality, int runCount) {
        if (RUNS_ENABLED && cardinality > 0) {
            int smallest = Math.min(arraySizeInBytes(cardinality), bitmapSizeInBytes());
            if (runSizeInBytes(runCount) < smallest) {
                return ContainerKind.RUN;
            }
        }
        return cardinality <= ARRAY_MAX_CARDINALITY ? ContainerKind.ARRAY : ContainerKind.BITMAP;
    }
}
