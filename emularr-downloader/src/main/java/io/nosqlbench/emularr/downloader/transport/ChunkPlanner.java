package io.nosqlbench.emularr.downloader.transport;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import java.util.ArrayList;
import java.util.List;

/// Splits a byte region into contiguous, disjoint chunks.
public final class ChunkPlanner {

    private ChunkPlanner() {
    }

    /// Split {@code [start, totalLength)} into {@code count} chunks of
    /// {@code floor((totalLength - start) / count)} bytes each, the last one absorbing the
    /// remainder. A region shorter than {@code count} bytes yields one chunk per byte.
    /// @param start the first byte of the region
    /// @param totalLength the total resource length, exclusive end of the region
    /// @param count the requested number of chunks
    /// @return the chunks in offset order; empty when the region is empty
    public static List<Chunk> split(long start, long totalLength, int count) {
        if (count < 1) {
            throw new IllegalArgumentException("chunk count must be positive, got " + count);
        }
        if (start < 0 || start > totalLength) {
            throw new IllegalArgumentException(
                "start " + start + " outside of region [0, " + totalLength + "]");
        }
        long region = totalLength - start;
        if (region == 0) {
            return List.of();
        }
        int chunks = (int) Math.min(count, region);
        long chunkSize = region / chunks;
        List<Chunk> plan = new ArrayList<>(chunks);
        for (int i = 0; i < chunks; i++) {
            long first = start + i * chunkSize;
            long last = (i == chunks - 1) ? totalLength - 1 : first + chunkSize - 1;
            plan.add(new Chunk(i, first, last));
        }
        return plan;
    }
}
