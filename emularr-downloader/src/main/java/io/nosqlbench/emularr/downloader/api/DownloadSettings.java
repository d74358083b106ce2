package io.nosqlbench.emularr.downloader.api;

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

import java.nio.file.Path;

/// User-level download settings consulted by the transfer controller when a task starts.
/// Values are read once per task; later edits only affect tasks started afterwards.
public interface DownloadSettings {

    /// The default number of chunks a task is split into when the server supports ranges
    int DEFAULT_CHUNK_THREADS = 8;

    /// @return the directory downloads land in when the caller does not name one
    Path destinationDirectory();

    /// @return the number of concurrent chunks for a ranged transfer, always positive
    int chunkThreadCount();

    /// Create fixed settings, mostly useful for embedding and tests.
    /// @param destinationDirectory the download directory
    /// @param chunkThreadCount the chunk count, must be positive
    /// @return settings returning the given values
    static DownloadSettings of(Path destinationDirectory, int chunkThreadCount) {
        if (destinationDirectory == null) {
            throw new IllegalArgumentException("destinationDirectory must not be null");
        }
        if (chunkThreadCount < 1) {
            throw new IllegalArgumentException("chunkThreadCount must be positive, got " + chunkThreadCount);
        }
        return new DownloadSettings() {
            @Override
            public Path destinationDirectory() {
                return destinationDirectory;
            }

            @Override
            public int chunkThreadCount() {
                return chunkThreadCount;
            }
        };
    }
}
