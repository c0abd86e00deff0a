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

package io.github.jbellis.jroaring.example;

import io.github.jbellis.jroaring.BitmapStats;
import io.github.jbellis.jroaring.RoaringBitmap;
import io.github.jbellis.jroaring.container.ContainerKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Builds a bitmap from 32,000 random values below 500,000 and prints its composition.
 */
public class StatsExample {
    private static final Logger log = LoggerFactory.getLogger(StatsExample.class);

    public static void main(String[] args) {
        int count = args.length > 0 ? Integer.parseInt(args[0]) : 32_000;
        int bound = args.length > 1 ? Integer.parseInt(args[1]) : 500_000;

        var random = ThreadLocalRandom.current();
        long[] values = random.longs(count, 0, bound).toArray();
        Arrays.sort(values);

        var bitmap = RoaringBitmap.narrow();
        bitmap.addAll(values);

        BitmapStats stats = bitmap.stats();
        log.info("{} random values below {} ({} distinct)", count, bound, stats.values());
        for (ContainerKind kind : ContainerKind.values()) {
            log.info("{} containers: {} holding {} values in {} bytes", kind, stats.containers(kind),
                     stats.values(kind), stats.bytes(kind));
        }
        log.info("total: {} containers, {} bytes in containers, {} bytes overall", stats.containers(),
                 stats.bytes(), bitmap.ramBytesUsed());
        System.out.println(stats);
    }
}
