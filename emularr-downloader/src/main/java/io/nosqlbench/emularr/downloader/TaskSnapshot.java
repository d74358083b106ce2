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

import java.net.URL;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/// An immutable copy of a task's caller-visible state. Snapshots taken while a transfer runs
/// are eventually consistent with the bytes on disk.
/// @param id the task id
/// @param sourceUrl the resource being downloaded
/// @param destinationDir the directory the file is written to
/// @param outputFile the file being written
/// @param metadata what the caller said about the game
/// @param status the lifecycle state
/// @param strategy the transfer strategy, null until the resource was probed
/// @param totalBytes the expected length, 0 when unknown
/// @param downloadedBytes bytes on disk at the last sample
/// @param progressFraction progress in [0, 1], empty while the length is unknown
/// @param bytesPerSecond throughput at the last sample
/// @param etaSeconds estimated remaining time, empty when it cannot be estimated
/// @param errorDetail why the task failed, present only in {@link TransferStatus#ERROR}
/// @param resolvedPath what was handed to the catalog, present after post-processing
/// @param chunks per-chunk state for chunked transfers
/// @param createdAt when the task was started
public record TaskSnapshot(
    String id,
    URL sourceUrl,
    Path destinationDir,
    Path outputFile,
    GameMetadata metadata,
    TransferStatus status,
    TransferStrategy strategy,
    long totalBytes,
    long downloadedBytes,
    OptionalDouble progressFraction,
    double bytesPerSecond,
    OptionalDouble etaSeconds,
    Optional<String> errorDetail,
    Optional<Path> resolvedPath,
    List<ChunkSnapshot> chunks,
    Instant createdAt
) {
    public TaskSnapshot {
        chunks = List.copyOf(chunks);
    }

    /// @return the name shown for the task: the caller's name, or the output file name
    public String displayName() {
        return metadata.hasName() ? metadata.name() : outputFile.getFileName().toString();
    }

    /// @return progress as a whole percentage, or -1 while indeterminate
    public int percent() {
        return progressFraction.isPresent() ? (int) Math.floor(progressFraction.getAsDouble() * 100.0d) : -1;
    }
}
