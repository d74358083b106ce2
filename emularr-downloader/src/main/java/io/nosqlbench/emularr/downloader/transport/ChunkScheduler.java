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

import okhttp3.OkHttpClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.URL;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;

/// Runs one {@link ChunkFetcher} per unfinished chunk and joins them behind a single barrier.
///
/// The barrier completes normally only when every chunk finished. The first real failure
/// stops the remaining chunks and becomes the barrier's failure, so a sibling's
/// {@link TransferCancelledException} never masks it.
public class ChunkScheduler {
    private static final Logger logger = LogManager.getLogger(ChunkScheduler.class);

    private final OkHttpClient client;
    private final Executor executor;
    private final int bufferSize;
    private final int maxAttempts;
    private final Duration retryBackoff;

    public ChunkScheduler(OkHttpClient client, Executor executor, int bufferSize, int maxAttempts,
                          Duration retryBackoff) {
        this.client = client;
        this.executor = executor;
        this.bufferSize = bufferSize;
        this.maxAttempts = maxAttempts;
        this.retryBackoff = retryBackoff;
    }

    /// Launch fetchers for all chunks that still have bytes to fetch.
    /// @param url the resource
    /// @param targetFile the pre-allocated destination
    /// @param chunks the plan; completed chunks are skipped, the others are re-armed
    /// @param token the task-wide cancellation token
    /// @return a barrier completing when all chunks are done, or exceptionally with the
    ///     first failure (unwrapped)
    public CompletableFuture<Void> launch(URL url, Path targetFile, List<Chunk> chunks, CancellationToken token) {
        AtomicReference<Throwable> firstFailure = new AtomicReference<>();
        List<CompletableFuture<Void>> tracked = new ArrayList<>();
        for (Chunk chunk : chunks) {
            if (chunk.isComplete()) {
                continue;
            }
            chunk.rearm();
            ChunkFetcher fetcher = new ChunkFetcher(client, url, targetFile, chunk, token,
                bufferSize, maxAttempts, retryBackoff);
            CompletableFuture<Void> future = CompletableFuture.runAsync(fetcher, executor)
                .whenComplete((ignored, error) -> {
                    if (error == null) {
                        return;
                    }
                    Throwable cause = unwrap(error);
                    if (!(cause instanceof TransferCancelledException)
                        && firstFailure.compareAndSet(null, cause)) {
                        logger.debug("Chunk {} failed, stopping remaining chunks", chunk.index());
                        chunks.forEach(Chunk::cancel);
                    }
                });
            tracked.add(future);
        }
        logger.debug("Launched {} of {} chunks for {}", tracked.size(), chunks.size(), url);

        CompletableFuture<Void> barrier = new CompletableFuture<>();
        CompletableFuture.allOf(tracked.toArray(new CompletableFuture[0]))
            .whenComplete((ignored, error) -> {
                Throwable failure = firstFailure.get();
                if (failure != null) {
                    barrier.completeExceptionally(failure);
                } else if (error != null) {
                    barrier.completeExceptionally(unwrap(error));
                } else {
                    barrier.complete(null);
                }
            });
        return barrier;
    }

    /// Strip the {@link CompletionException} wrappers futures add.
    /// @param error a failure from a future
    /// @return the innermost meaningful cause
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
