package io.nosqlbench.emularr.downloader;

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

import io.nosqlbench.emularr.downloader.transport.ResourceCapabilities;

/// How a task moves its bytes.
public sealed interface TransferStrategy permits TransferStrategy.SingleStream, TransferStrategy.Chunked {

    /// One request for the whole body.
    record SingleStream() implements TransferStrategy {
        @Override
        public String toString() {
            return "SingleStream";
        }
    }

    /// {@code chunkCount} concurrent range requests into a pre-allocated file.
    /// @param chunkCount the number of chunks, greater than one
    record Chunked(int chunkCount) implements TransferStrategy {
        public Chunked {
            if (chunkCount < 2) {
                throw new IllegalArgumentException("chunked transfers need at least 2 chunks, got " + chunkCount);
            }
        }

        @Override
        public String toString() {
            return "Chunked(" + chunkCount + ")";
        }
    }

    /// Pick a strategy. Chunking needs confirmed range support, a known length and more than
    /// one configured thread; a hint can only force the single stream.
    /// @param capabilities what the prober learned
    /// @param threadCount the configured chunk count
    /// @param hint the caller's preference
    /// @return the strategy to use
    static TransferStrategy select(ResourceCapabilities capabilities, int threadCount, TransferStrategyHint hint) {
        if (hint == TransferStrategyHint.SINGLE_STREAM
            || !capabilities.supportsRange()
            || capabilities.contentLength() <= 0
            || threadCount < 2) {
            return new SingleStream();
        }
        return new Chunked(threadCount);
    }
}
