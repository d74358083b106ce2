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

import okhttp3.Call;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.BufferedSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.URL;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.concurrent.CompletionException;

/// Downloads the unfinished part of one {@link Chunk} and writes it at the chunk's offset in
/// the pre-allocated target file.
///
/// The chunk's own flag and the task-wide {@link CancellationToken} are checked before the
/// request, once the response arrives, before every buffer and between backoff sleeps.
/// Transient I/O failures are retried from the chunk's current offset with exponential
/// backoff; cancellation and a server that ignores the range are not.
public class ChunkFetcher implements Runnable {
    private static final Logger logger = LogManager.getLogger(ChunkFetcher.class);
    private static final long BACKOFF_SLICE_MILLIS = 50L;

    private final OkHttpClient client;
    private final URL url;
    private final Path targetFile;
    private final Chunk chunk;
    private final CancellationToken token;
    private final int bufferSize;
    private final int maxAttempts;
    private final Duration retryBackoff;

    /// @param client the http client
    /// @param url the resource
    /// @param targetFile the pre-allocated destination shared by all chunks
    /// @param chunk the range to fill
    /// @param token the task-wide cancellation token
    /// @param bufferSize bytes per read
    /// @param maxAttempts attempts before giving up, at least 1
    /// @param retryBackoff the delay before the first retry, doubled on each further one
    public ChunkFetcher(OkHttpClient client, URL url, Path targetFile, Chunk chunk,
                        CancellationToken token, int bufferSize, int maxAttempts,
                        Duration retryBackoff) {
        this.client = client;
        this.url = url;
        this.targetFile = targetFile;
        this.chunk = chunk;
        this.token = token;
        this.bufferSize = bufferSize;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.retryBackoff = retryBackoff;
    }

    @Override
    public void run() {
        int attempt = 0;
        while (true) {
            checkCancelled("before request");
            if (chunk.isComplete()) {
                return;
            }
            attempt++;
            try {
                fetchRemaining();
                return;
            } catch (RangeNotHonoredException e) {
                throw new CompletionException(e);
            } catch (IOException e) {
                if (isCancelled()) {
                    throw new TransferCancelledException("Chunk " + chunk.index() + " cancelled", e);
                }
                if (attempt >= maxAttempts) {
                    logger.error("Chunk {} failed after {} attempts: {}", chunk.index(), attempt, e.getMessage());
                    throw new CompletionException(new IOException(
                        "Chunk " + chunk.index() + " (" + chunk.startOffset() + "-" + chunk.endOffset()
                            + ") failed after " + attempt + " attempts: " + e.getMessage(), e));
                }
                logger.warn("Chunk {} failed at offset {} (attempt {}/{}): {}",
                    chunk.index(), chunk.nextOffset(), attempt, maxAttempts, e.getMessage());
                backoff(attempt);
            }
        }
    }

    private void fetchRemaining() throws IOException {
        long from = chunk.nextOffset();
        String rangeHeader = "bytes=" + from + "-" + chunk.endOffset();
        Request request = HttpClients.requestFor(url).header("Range", rangeHeader).build();
        logger.debug("Chunk {} requesting {}", chunk.index(), rangeHeader);

        Call call = client.newCall(request);
        chunk.attach(call);
        token.register(call);
        try (Response response = call.execute()) {
            checkCancelled("after response");
            if (response.code() == 200) {
                throw new RangeNotHonoredException(
                    "Server ignored range " + rangeHeader + " and sent the whole body");
            }
            if (response.code() != 206) {
                throw new IOException("Unexpected HTTP status " + response.code() + " for range " + rangeHeader);
            }
            ContentRange contentRange = ContentRange.parse(response.header("Content-Range"));
            if (contentRange != null && contentRange.first() != from) {
                throw new IOException("Requested " + rangeHeader + " but server sent bytes starting at "
                    + contentRange.first());
            }
            ResponseBody body = response.body();
            if (body == null) {
                throw new IOException("No response body for range " + rangeHeader);
            }
            try (FileChannel channel = FileChannel.open(targetFile, StandardOpenOption.WRITE);
                 BufferedSource source = body.source()) {
                writeRange(source, channel, from);
            }
        } finally {
            token.unregister(call);
            chunk.detach(call);
        }
    }

    private void writeRange(BufferedSource source, FileChannel channel, long from) throws IOException {
        byte[] buffer = new byte[bufferSize];
        long position = from;
        long remaining = chunk.endOffset() - from + 1;
        while (remaining > 0) {
            checkCancelled("while streaming");
            int read = source.read(buffer, 0, (int) Math.min(buffer.length, remaining));
            if (read == -1) {
                throw new IOException("Stream for chunk " + chunk.index() + " ended at offset " + position
                    + ", expected data through " + chunk.endOffset());
            }
            ByteBuffer data = ByteBuffer.wrap(buffer, 0, read);
            while (data.hasRemaining()) {
                position += channel.write(data, position);
            }
            chunk.recordWritten(read);
            remaining -= read;
        }
        logger.debug("Chunk {} finished at offset {}", chunk.index(), position - 1);
    }

    private void backoff(int attempt) {
        long delay = Math.min(retryBackoff.toMillis() * (1L << Math.min(attempt - 1, 5)), 30_000L);
        long deadline = System.nanoTime() + Duration.ofMillis(delay).toNanos();
        try {
            long left;
            while ((left = deadline - System.nanoTime()) > 0) {
                checkCancelled("during retry backoff");
                Thread.sleep(Math.min(BACKOFF_SLICE_MILLIS, Duration.ofNanos(left).toMillis() + 1));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransferCancelledException("Chunk " + chunk.index() + " interrupted during retry backoff", e);
        }
    }

    private boolean isCancelled() {
        return chunk.isCancelled() || token.isCancelled();
    }

    private void checkCancelled(String where) {
        if (isCancelled()) {
            throw new TransferCancelledException("Chunk " + chunk.index() + " cancelled " + where);
        }
    }
}
