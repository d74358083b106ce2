package io.nosqlbench.emularr.downloader.progress;

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

import java.util.OptionalDouble;

/// Something whose transfer progress is sampled by the {@link ProgressAggregator}.
public interface ProgressTarget {

    /// @return false once the transfer left its active state; sampling then stops
    boolean isTransferring();

    /// @return the expected total in bytes, or 0 when unknown
    long totalBytes();

    /// Publish a sample.
    /// @param downloadedBytes bytes on disk so far
    /// @param bytesPerSecond throughput over the last interval
    /// @param etaSeconds remaining time, empty when it cannot be estimated
    void recordProgress(long downloadedBytes, double bytesPerSecond, OptionalDouble etaSeconds);
}
