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

import io.nosqlbench.emularr.downloader.progress.ProgressAggregator;
import io.nosqlbench.emularr.downloader.progress.ProgressTarget;
import io.nosqlbench.emularr.downloader.transport.CancellationToken;
import io.nosqlbench.emularr.downloader.transport.Chunk;

import java.net.URL;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.CompletableFuture;

/// The mutable state of one download. Every mutation goes through this object's monitor;
/// chunk byte counters are atomics and may be read without it.
///
/// Each run of the transfer (the first one and every resume) is an {@link Attempt} with its
/// own {@link CancellationToken}. Pausing or cancelling cancels the current attempt's token,
/// and a resumed attempt waits for its predecessor before touching the file.
final class DownloadTask implements ProgressTarget {

    private final String id;
    private final URL sourceUrl;
    private final Path destinationDir;
    private final Path outputFile;
    private final GameMetadata metadata;
    private final int threadCount;
    private final TransferStrategyHint hint;
    private final Instant createdAt = Instant.now();

    private TransferStatus status = TransferStatus.DOWNLOADING;
    private TransferStrategy strategy;
    private long totalBytes;
    private List<Chunk> chunks = List.of();
    private long downloadedBytes;
    private double bytesPerSecond;
    private OptionalDouble etaSeconds = OptionalDouble.empty();
    private String errorDetail;
    private Path resolvedPath;

    private Attempt currentAttempt;
    private ProgressAggregator.Tracking tracking;

    DownloadTask(String id, URL sourceUrl, Path destinationDir, Path outputFile, GameMetadata metadata,
                 int threadCount, TransferStrategyHint hint) {
        this.id = id;
        this.sourceUrl = sourceUrl;
        this.destinationDir = destinationDir;
        this.outputFile = outputFile;
        this.metadata = metadata;
        this.threadCount = threadCount;
        this.hint = hint;
    }

    String id() {
        return id;
    }

    URL sourceUrl() {
        return sourceUrl;
    }

    Path destinationDir() {
        return destinationDir;
    }

    Path outputFile() {
        return outputFile;
    }

    GameMetadata metadata() {
        return metadata;
    }

    int threadCount() {
        return threadCount;
    }

    TransferStrategyHint hint() {
        return hint;
    }

    Instant createdAt() {
        return createdAt;
    }

    synchronized TransferStatus status() {
        return status;
    }

    synchronized TransferStrategy strategy() {
        return strategy;
    }

    synchronized List<Chunk> chunks() {
        return chunks;
    }

    synchronized boolean isChunked() {
        return strategy instanceof TransferStrategy.Chunked;
    }

    /// Record the probe outcome and the chunk plan.
    synchronized void plan(long totalBytes, TransferStrategy strategy, List<Chunk> chunks) {
        this.totalBytes = totalBytes;
        this.strategy = strategy;
        this.chunks = List.copyOf(chunks);
    }

    synchronized void learnTotal(long totalBytes) {
        if (this.totalBytes <= 0) {
            this.totalBytes = totalBytes;
        }
    }

    /// Switch a chunked transfer whose server ignored ranges over to a single stream.
    synchronized void fallBackToSingleStream() {
        this.strategy = new TransferStrategy.SingleStream();
        this.chunks = List.of();
        this.downloadedBytes = 0L;
    }

    /// @return the sum of all chunk counters
    long chunkBytes() {
        long sum = 0;
        for (Chunk chunk : chunks()) {
            sum += chunk.bytesDownloaded();
        }
        return sum;
    }

    /// Begin a transfer attempt if the task is still downloading.
    /// @return the new attempt, or null if the task was paused or cancelled meanwhile
    synchronized Attempt beginAttempt() {
        if (status != TransferStatus.DOWNLOADING) {
            return null;
        }
        CompletableFuture<Void> previous = currentAttempt == null
            ? CompletableFuture.completedFuture(null)
            : currentAttempt.done;
        currentAttempt = new Attempt(previous);
        return currentAttempt;
    }

    /// Mark an attempt as finished; it no longer touches the output file.
    void endAttempt(Attempt attempt) {
        if (attempt != null) {
            attempt.done.complete(null);
        }
    }

    /// @return completes once the most recent attempt has finished
    synchronized CompletableFuture<Void> attemptDone() {
        return currentAttempt == null ? CompletableFuture.completedFuture(null) : currentAttempt.done;
    }

    synchronized void track(ProgressAggregator.Tracking tracking) {
        this.tracking = tracking;
    }

    /// Stop sampling and publish one last sample.
    void finishTracking() {
        ProgressAggregator.Tracking current;
        synchronized (this) {
            current = tracking;
            tracking = null;
        }
        if (current != null) {
            current.stop();
            current.sample();
        }
    }

    /// DOWNLOADING to PAUSED; aborts the running attempt.
    synchronized boolean pause() {
        if (!transitionTo(TransferStatus.PAUSED)) {
            return false;
        }
        if (currentAttempt != null) {
            currentAttempt.token.cancel();
        }
        bytesPerSecond = 0.0d;
        etaSeconds = OptionalDouble.empty();
        return true;
    }

    /// PAUSED to DOWNLOADING.
    synchronized boolean resume() {
        return transitionTo(TransferStatus.DOWNLOADING);
    }

    /// Any non-terminal state to CANCELLED; aborts the running attempt.
    synchronized boolean cancel() {
        if (!transitionTo(TransferStatus.CANCELLED)) {
            return false;
        }
        if (currentAttempt != null) {
            currentAttempt.token.cancel();
        }
        chunks.forEach(Chunk::cancel);
        return true;
    }

    /// DOWNLOADING to COMPLETED.
    synchronized boolean complete(long finalSize) {
        if (!transitionTo(TransferStatus.COMPLETED)) {
            return false;
        }
        if (totalBytes <= 0) {
            totalBytes = finalSize;
        }
        downloadedBytes = finalSize;
        bytesPerSecond = 0.0d;
        etaSeconds = OptionalDouble.of(0.0d);
        return true;
    }

    /// DOWNLOADING or PAUSED to ERROR.
    synchronized boolean fail(String detail) {
        if (!transitionTo(TransferStatus.ERROR)) {
            return false;
        }
        errorDetail = detail;
        bytesPerSecond = 0.0d;
        etaSeconds = OptionalDouble.empty();
        return true;
    }

    synchronized void resolvedPath(Path path) {
        this.resolvedPath = path;
    }

    private boolean transitionTo(TransferStatus next) {
        if (!status.canTransitionTo(next)) {
            return false;
        }
        status = next;
        return true;
    }

    @Override
    public synchronized boolean isTransferring() {
        return status == TransferStatus.DOWNLOADING;
    }

    @Override
    public synchronized long totalBytes() {
        return totalBytes;
    }

    @Override
    public synchronized void recordProgress(long downloadedBytes, double bytesPerSecond, OptionalDouble etaSeconds) {
        if (status.isTerminal()) {
            return;
        }
        this.downloadedBytes = downloadedBytes;
        if (status == TransferStatus.DOWNLOADING) {
            this.bytesPerSecond = bytesPerSecond;
            this.etaSeconds = etaSeconds;
        }
    }

    synchronized TaskSnapshot snapshot() {
        OptionalDouble fraction;
        if (status == TransferStatus.COMPLETED) {
            fraction = OptionalDouble.of(1.0d);
        } else if (totalBytes > 0) {
            fraction = OptionalDouble.of(Math.min(1.0d, (double) downloadedBytes / totalBytes));
        } else {
            fraction = OptionalDouble.empty();
        }
        List<ChunkSnapshot> chunkViews = chunks.stream()
            .map(c -> new ChunkSnapshot(c.index(), c.startOffset(), c.endOffset(), c.bytesDownloaded(), c.isCancelled()))
            .toList();
        return new TaskSnapshot(id, sourceUrl, destinationDir, outputFile, metadata, status, strategy,
            totalBytes, downloadedBytes, fraction, bytesPerSecond, etaSeconds,
            Optional.ofNullable(status == TransferStatus.ERROR ? errorDetail : null),
            Optional.ofNullable(resolvedPath), chunkViews, createdAt);
    }

    /// One run of the transfer.
    static final class Attempt {
        private final CancellationToken token = new CancellationToken();
        private final CompletableFuture<Void> done = new CompletableFuture<>();
        private final CompletableFuture<Void> previous;

        private Attempt(CompletableFuture<Void> previous) {
            this.previous = previous;
        }

        CancellationToken token() {
            return token;
        }

        /// @return completes when the attempt before this one finished
        CompletableFuture<Void> previous() {
            return previous;
        }
    }
}
