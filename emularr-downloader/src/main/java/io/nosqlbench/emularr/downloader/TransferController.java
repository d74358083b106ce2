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

import io.nosqlbench.emularr.downloader.api.ArchiveExtractor;
import io.nosqlbench.emularr.downloader.api.CatalogEntry;
import io.nosqlbench.emularr.downloader.api.CatalogEntryRequest;
import io.nosqlbench.emularr.downloader.api.DownloadSettings;
import io.nosqlbench.emularr.downloader.api.ExtractionException;
import io.nosqlbench.emularr.downloader.api.GameCatalog;
import io.nosqlbench.emularr.downloader.progress.ProgressAggregator;
import io.nosqlbench.emularr.downloader.transport.CapabilityProber;
import io.nosqlbench.emularr.downloader.transport.Chunk;
import io.nosqlbench.emularr.downloader.transport.ChunkPlanner;
import io.nosqlbench.emularr.downloader.transport.ChunkScheduler;
import io.nosqlbench.emularr.downloader.transport.HttpClients;
import io.nosqlbench.emularr.downloader.transport.RangeNotHonoredException;
import io.nosqlbench.emularr.downloader.transport.ResourceCapabilities;
import io.nosqlbench.emularr.downloader.transport.SingleStreamFetcher;
import io.nosqlbench.emularr.downloader.transport.TransferCancelledException;
import okhttp3.OkHttpClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/// Owns the lifecycle of download tasks: probing, strategy selection, chunked or
/// single-stream transfer, pause, resume, cancel and the post-processing handoff to the
/// extractor and the catalog.
///
/// Every public operation returns promptly. Network and disk work runs on the controller's
/// own daemon threads, and expected failures are reported through the task's status rather
/// than thrown. Only caller mistakes, such as a missing URL, raise
/// {@link IllegalArgumentException}.
///
/// A chunked task that is paused keeps its chunk plan; resuming relaunches each chunk from
/// where its own counter stopped. A single-stream task resumes from the current file size.
public class TransferController implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(TransferController.class);

    private final TaskRegistry registry;
    private final DownloadSettings settings;
    private final ArchiveExtractor extractor;
    private final GameCatalog catalog;
    private final EngineOptions options;

    private final OkHttpClient transferClient;
    private final OkHttpClient probeClient;
    private final CapabilityProber prober;
    private final ExecutorService transferExecutor;
    private final ScheduledExecutorService progressScheduler;
    private final ChunkScheduler chunkScheduler;
    private final ProgressAggregator aggregator;
    private final AtomicBoolean closed = new AtomicBoolean();

    /// Create a controller with default engine options.
    /// @param registry the registry tasks are kept in
    /// @param settings where downloads go and how many chunks to use
    /// @param extractor unpacks finished archives
    /// @param catalog receives finished downloads
    public TransferController(TaskRegistry registry, DownloadSettings settings, ArchiveExtractor extractor,
                              GameCatalog catalog) {
        this(registry, settings, extractor, catalog, EngineOptions.defaults());
    }

    /// Create a controller.
    /// @param registry the registry tasks are kept in
    /// @param settings where downloads go and how many chunks to use
    /// @param extractor unpacks finished archives
    /// @param catalog receives finished downloads
    /// @param options engine tuning
    public TransferController(TaskRegistry registry, DownloadSettings settings, ArchiveExtractor extractor,
                              GameCatalog catalog, EngineOptions options) {
        this.registry = require(registry, "registry");
        this.settings = require(settings, "settings");
        this.extractor = require(extractor, "extractor");
        this.catalog = require(catalog, "catalog");
        this.options = require(options, "options");

        this.transferClient = HttpClients.transferClient(options.readTimeout());
        this.probeClient = HttpClients.probeClient(options.probeTimeout());
        this.prober = new CapabilityProber(probeClient);
        this.transferExecutor = Executors.newCachedThreadPool(daemonThreads("emularr-transfer"));
        this.progressScheduler = Executors.newSingleThreadScheduledExecutor(daemonThreads("emularr-progress"));
        this.chunkScheduler = new ChunkScheduler(transferClient, transferExecutor, options.bufferSize(),
            options.maxChunkAttempts(), options.retryBackoff());
        this.aggregator = new ProgressAggregator(progressScheduler, options.sampleInterval());
    }

    /// Start a download into the configured download directory.
    /// @param url the resource
    /// @param hint the caller's strategy preference
    /// @param metadata what is known about the game
    /// @return the new task id
    public String startDownload(URL url, TransferStrategyHint hint, GameMetadata metadata) {
        return start(url, settings.destinationDirectory(), metadata, hint);
    }

    /// Start a download, letting the engine choose the strategy.
    /// @param url the resource
    /// @param destinationDir where to write the file
    /// @param metadata what is known about the game
    /// @return the new task id
    public String start(URL url, Path destinationDir, GameMetadata metadata) {
        return start(url, destinationDir, metadata, TransferStrategyHint.AUTO);
    }

    /// Start a download. Returns before any network I/O happens.
    /// @param url the resource, http or https
    /// @param destinationDir where to write the file
    /// @param metadata what is known about the game, may be null
    /// @param hint the caller's strategy preference, may be null for {@link TransferStrategyHint#AUTO}
    /// @return the new task id
    public String start(URL url, Path destinationDir, GameMetadata metadata, TransferStrategyHint hint) {
        if (url == null) {
            throw new IllegalArgumentException("url must not be null");
        }
        String protocol = url.getProtocol();
        if (!"http".equalsIgnoreCase(protocol) && !"https".equalsIgnoreCase(protocol)) {
            throw new IllegalArgumentException("Only http and https downloads are supported: " + url);
        }
        if (destinationDir == null) {
            throw new IllegalArgumentException("destinationDir must not be null");
        }
        int threads = settings.chunkThreadCount();
        if (threads < 1) {
            throw new IllegalArgumentException("chunk thread count must be positive, got " + threads);
        }
        if (closed.get()) {
            throw new IllegalStateException("TransferController is closed");
        }
        GameMetadata gameMetadata = metadata == null ? GameMetadata.empty() : metadata;
        TransferStrategyHint strategyHint = hint == null ? TransferStrategyHint.AUTO : hint;

        String id = UUID.randomUUID().toString();
        Path outputFile = destinationDir.resolve(OutputNames.fileNameFor(url, gameMetadata, id));
        DownloadTask task = new DownloadTask(id, url, destinationDir, outputFile, gameMetadata, threads, strategyHint);
        registry.register(task);
        DownloadTask.Attempt attempt = task.beginAttempt();
        logger.info("Queued download {} of {} to {}", id, url, outputFile);
        transferExecutor.execute(() -> runFirstAttempt(task, attempt));
        return id;
    }

    /// Pause a downloading task. Bytes already written stay on disk.
    /// @param taskId the task
    /// @return true if the task was downloading and is now paused
    public boolean pause(String taskId) {
        DownloadTask task = registry.get(taskId);
        if (task == null || !task.pause()) {
            return false;
        }
        task.finishTracking();
        logger.info("Paused download {}", taskId);
        return true;
    }

    /// Resume a paused task. The server is probed again; if it no longer supports byte ranges
    /// or reports a different length, the task fails rather than starting over. A closed
    /// controller resumes nothing.
    /// @param taskId the task
    /// @return true if the transfer continues
    public boolean resume(String taskId) {
        DownloadTask task = registry.get(taskId);
        if (task == null || task.status() != TransferStatus.PAUSED || closed.get()) {
            return false;
        }
        ResourceCapabilities capabilities = prober.probe(task.sourceUrl());
        if (!capabilities.supportsRange()) {
            failResume(task, "Cannot resume: " + task.sourceUrl() + " does not support byte ranges");
            return false;
        }
        long knownTotal = task.totalBytes();
        if (knownTotal > 0 && capabilities.contentLength() != knownTotal) {
            failResume(task, "Cannot resume: remote size changed from " + knownTotal + " to "
                + capabilities.contentLength() + " bytes");
            return false;
        }
        if (!task.resume()) {
            return false;
        }
        DownloadTask.Attempt attempt = task.beginAttempt();
        if (attempt == null) {
            return false;
        }
        logger.info("Resuming download {}", taskId);
        try {
            transferExecutor.execute(() -> runResumedAttempt(task, attempt, capabilities));
        } catch (RejectedExecutionException e) {
            task.endAttempt(attempt);
            failResume(task, "Cannot resume: the transfer controller is closed");
            return false;
        }
        return true;
    }

    /// Cancel a task that has not finished: stop its transfer, delete the partial file and
    /// forget the task.
    /// @param taskId the task
    /// @return true if the task was cancelled by this call
    public boolean cancel(String taskId) {
        DownloadTask task = registry.get(taskId);
        if (task == null || !task.cancel()) {
            return false;
        }
        registry.remove(taskId, task);
        task.finishTracking();
        deletePartial(task);
        // a writer still unwinding may recreate the file; delete again once it is gone
        task.attemptDone().whenComplete((ignored, error) -> deletePartial(task));
        logger.info("Cancelled download {}", taskId);
        return true;
    }

    /// @param taskId the task
    /// @return a snapshot of the task, or null if it is unknown or was cancelled
    public TaskSnapshot getProgress(String taskId) {
        return registry.snapshot(taskId);
    }

    /// @return snapshots of all known tasks, oldest first
    public List<TaskSnapshot> getAllTasks() {
        return registry.snapshots();
    }

    /// @return ids of tasks that are downloading or paused
    public Set<String> getActiveTaskIds() {
        return registry.activeIds();
    }

    /// Forget a completed or failed task. Its files are left alone.
    /// @param taskId the task
    /// @return true if the task was removed
    public boolean prune(String taskId) {
        DownloadTask task = registry.get(taskId);
        if (task == null) {
            return false;
        }
        TransferStatus status = task.status();
        if (status != TransferStatus.COMPLETED && status != TransferStatus.ERROR) {
            return false;
        }
        return registry.remove(taskId, task);
    }

    /// Forget all completed and failed tasks.
    /// @return the number of tasks removed
    public int pruneFinished() {
        int removed = 0;
        for (DownloadTask task : registry.tasks()) {
            TransferStatus status = task.status();
            if ((status == TransferStatus.COMPLETED || status == TransferStatus.ERROR)
                && registry.remove(task.id(), task)) {
                removed++;
            }
        }
        return removed;
    }

    /// Pause every running transfer and stop the controller's threads. Paused tasks keep
    /// their partial files.
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        for (DownloadTask task : registry.tasks()) {
            if (task.pause()) {
                task.finishTracking();
            }
        }
        transferExecutor.shutdown();
        progressScheduler.shutdownNow();
        try {
            if (!transferExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                transferExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            transferExecutor.shutdownNow();
        }
        transferClient.connectionPool().evictAll();
        probeClient.connectionPool().evictAll();
        logger.debug("TransferController closed");
    }

    private void runFirstAttempt(DownloadTask task, DownloadTask.Attempt attempt) {
        try {
            Files.createDirectories(task.destinationDir());
            ResourceCapabilities capabilities = prober.probe(task.sourceUrl());
            TransferStrategy strategy = TransferStrategy.select(capabilities, task.threadCount(), task.hint());
            List<Chunk> chunks = List.of();
            if (strategy instanceof TransferStrategy.Chunked chunked) {
                chunks = ChunkPlanner.split(0L, capabilities.contentLength(), chunked.chunkCount());
                if (chunks.size() < 2) {
                    strategy = new TransferStrategy.SingleStream();
                    chunks = List.of();
                }
            }
            task.plan(capabilities.contentLength(), strategy, chunks);
            logger.info("Download {} using {} for {} ({})", task.id(), strategy, task.sourceUrl(),
                capabilities.lengthKnown() ? capabilities.contentLength() + " bytes" : "unknown length");

            if (task.isChunked()) {
                preallocate(task.outputFile(), capabilities.contentLength());
                if (!attempt.token().isCancelled()) {
                    transferChunked(task, attempt, false);
                }
            } else if (!attempt.token().isCancelled()) {
                transferSingle(task, attempt, 0L, false);
            }
        } catch (IOException e) {
            handleFailure(task, attempt, e, false);
        } catch (RuntimeException e) {
            logger.error("Unexpected failure in download {}", task.id(), e);
            handleFailure(task, attempt, e, false);
        } finally {
            task.endAttempt(attempt);
        }
    }

    private void runResumedAttempt(DownloadTask task, DownloadTask.Attempt attempt,
                                   ResourceCapabilities capabilities) {
        try {
            awaitPrevious(attempt);
            if (attempt.token().isCancelled()) {
                return;
            }
            task.learnTotal(capabilities.contentLength());
            if (task.isChunked()) {
                transferChunked(task, attempt, true);
            } else {
                transferSingle(task, attempt, sizeOf(task.outputFile()), true);
            }
        } catch (RuntimeException e) {
            logger.error("Unexpected failure resuming download {}", task.id(), e);
            handleFailure(task, attempt, e, true);
        } finally {
            task.endAttempt(attempt);
        }
    }

    private void transferChunked(DownloadTask task, DownloadTask.Attempt attempt, boolean resuming) {
        startTracking(task);
        Throwable failure = null;
        try {
            chunkScheduler.launch(task.sourceUrl(), task.outputFile(), task.chunks(), attempt.token()).join();
        } catch (CompletionException | CancellationException e) {
            failure = ChunkScheduler.unwrap(e);
        } finally {
            task.finishTracking();
        }

        if (failure == null) {
            completeTask(task);
        } else if (failure instanceof RangeNotHonoredException && !resuming && !attempt.token().isCancelled()) {
            logger.warn("Server for {} ignored byte ranges, restarting download {} as a single stream",
                task.sourceUrl(), task.id());
            task.fallBackToSingleStream();
            transferSingle(task, attempt, 0L, false);
        } else {
            handleFailure(task, attempt, failure, resuming);
        }
    }

    private void transferSingle(DownloadTask task, DownloadTask.Attempt attempt, long offset, boolean resuming) {
        long total = task.totalBytes();
        if (resuming && total > 0 && offset >= total) {
            if (offset == total) {
                completeTask(task);
            } else {
                task.fail("Cannot resume: local file has " + offset + " bytes but the remote has " + total);
            }
            return;
        }
        startTracking(task);
        Throwable failure = null;
        try {
            new SingleStreamFetcher(transferClient, task.sourceUrl(), task.outputFile(), offset, total,
                attempt.token(), options.bufferSize()).fetch();
        } catch (IOException | RuntimeException e) {
            failure = e;
        } finally {
            task.finishTracking();
        }

        if (failure == null) {
            completeTask(task);
        } else {
            handleFailure(task, attempt, failure, resuming);
        }
    }

    private void completeTask(DownloadTask task) {
        long size;
        try {
            size = Files.size(task.outputFile());
        } catch (IOException e) {
            if (task.fail("Downloaded file is missing: " + e.getMessage())) {
                logger.error("Download {} finished but {} cannot be read", task.id(), task.outputFile(), e);
            }
            return;
        }
        if (task.isChunked() && task.chunkBytes() != task.totalBytes()) {
            if (task.fail("Chunks delivered " + task.chunkBytes() + " of " + task.totalBytes() + " bytes")) {
                logger.error("Download {} finished with missing chunk data", task.id());
            }
            return;
        }
        if (!task.complete(size)) {
            return;
        }
        logger.info("Download {} completed: {} ({} bytes)", task.id(), task.outputFile(), size);
        postProcess(task);
    }

    private void postProcess(DownloadTask task) {
        Path file = task.outputFile();
        String fileName = file.getFileName().toString();
        Path resolved = file;
        boolean extracted = false;
        if (extractor.shouldExtract(file)) {
            Path target = task.destinationDir().resolve(OutputNames.extractionFolderFor(task.metadata(), fileName));
            try {
                resolved = extractor.extract(file, target);
                extracted = true;
                logger.info("Extracted {} to {}", file, resolved);
            } catch (ExtractionException e) {
                logger.warn("Extraction of {} failed, keeping the original file: {}", file, e.getMessage());
            } catch (RuntimeException e) {
                logger.warn("Extraction of {} failed, keeping the original file", file, e);
            }
        }
        task.resolvedPath(resolved);

        GameMetadata metadata = task.metadata();
        Map<String, String> properties = new LinkedHashMap<>(metadata.properties());
        properties.put(CatalogEntryRequest.ORIGINAL_FILE_NAME, fileName);
        properties.put(CatalogEntryRequest.EXTRACTED, Boolean.toString(extracted));
        properties.put(CatalogEntryRequest.SOURCE_URL, task.sourceUrl().toString());
        String name = metadata.hasName()
            ? metadata.name()
            : OutputNames.extractionFolderFor(GameMetadata.empty(), fileName);
        try {
            CatalogEntry entry = catalog.registerEntry(
                new CatalogEntryRequest(name, metadata.platform(), resolved, task.destinationDir(), properties));
            logger.info("Added {} to the library as {}", name, entry.id());
        } catch (RuntimeException e) {
            logger.error("Failed to add {} to the library", name, e);
        }
    }

    private void handleFailure(DownloadTask task, DownloadTask.Attempt attempt, Throwable failure, boolean resuming) {
        if (failure instanceof TransferCancelledException || attempt.token().isCancelled()) {
            logger.debug("Transfer attempt for {} stopped while {}", task.id(), task.status());
            return;
        }
        String detail = resuming && failure instanceof RangeNotHonoredException
            ? "Cannot resume: server ignored the byte range request"
            : describe(failure);
        if (task.fail(detail)) {
            logger.error("Download {} failed: {}", task.id(), detail);
            logger.debug("Failure detail for {}", task.id(), failure);
        }
    }

    private void failResume(DownloadTask task, String detail) {
        if (task.fail(detail)) {
            logger.warn("Download {}: {}", task.id(), detail);
        }
    }

    private void startTracking(DownloadTask task) {
        task.track(aggregator.track(task, () -> bytesOnDisk(task)));
    }

    private static long bytesOnDisk(DownloadTask task) {
        return task.isChunked() ? task.chunkBytes() : sizeOf(task.outputFile());
    }

    private static void awaitPrevious(DownloadTask.Attempt attempt) {
        try {
            attempt.previous().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransferCancelledException("Interrupted waiting for the previous transfer to stop", e);
        } catch (ExecutionException e) {
            logger.debug("Previous attempt ended with {}", e.getCause().toString());
        }
    }

    private static void preallocate(Path file, long length) throws IOException {
        try (RandomAccessFile raf = new RandomAccessFile(file.toFile(), "rw")) {
            raf.setLength(length);
        }
    }

    private static long sizeOf(Path file) {
        try {
            return Files.size(file);
        } catch (NoSuchFileException e) {
            return 0L;
        } catch (IOException e) {
            logger.debug("Unable to read size of {}: {}", file, e.getMessage());
            return 0L;
        }
    }

    private static void deletePartial(DownloadTask task) {
        try {
            if (Files.deleteIfExists(task.outputFile())) {
                logger.debug("Deleted partial file {}", task.outputFile());
            }
        } catch (IOException e) {
            logger.warn("Unable to delete partial file {}: {}", task.outputFile(), e.getMessage());
        }
    }

    private static String describe(Throwable failure) {
        String message = failure.getMessage();
        return message == null || message.isBlank() ? failure.getClass().getSimpleName() : message;
    }

    private static <T> T require(T value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " must not be null");
        }
        return value;
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
