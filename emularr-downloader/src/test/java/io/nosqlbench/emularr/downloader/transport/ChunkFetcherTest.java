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

import io.nosqlbench.emularr.downloader.testserver.RangeTestServer;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class ChunkFetcherTest {

    private static final int LENGTH = 10_000;

    @TempDir
    Path tempDir;

    private RangeTestServer server;
    private OkHttpClient client;
    private byte[] content;
    private Path target;
    private URL url;

    @BeforeEach
    void setUp() throws IOException {
        server = new RangeTestServer().start();
        client = HttpClients.transferClient(Duration.ofSeconds(10));
        content = RangeTestServer.content(LENGTH);
        server.serve("/data.bin", content);
        url = server.url("/data.bin");
        target = tempDir.resolve("data.bin");
        try (RandomAccessFile raf = new RandomAccessFile(target.toFile(), "rw")) {
            raf.setLength(LENGTH);
        }
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    private ChunkFetcher fetcher(Chunk chunk, CancellationToken token, int attempts) {
        return new ChunkFetcher(client, url, target, chunk, token, 1024, attempts, Duration.ofMillis(1));
    }

    @Test
    void testWritesRangeAtItsOffset() throws IOException {
        Chunk chunk = new Chunk(1, 2_500L, 4_999L);

        fetcher(chunk, new CancellationToken(), 3).run();

        assertTrue(chunk.isComplete());
        assertEquals(2_500L, chunk.bytesDownloaded());
        byte[] written = Files.readAllBytes(target);
        assertArrayEquals(Arrays.copyOfRange(content, 2_500, 5_000), Arrays.copyOfRange(written, 2_500, 5_000));
        assertArrayEquals(new byte[2_500], Arrays.copyOfRange(written, 0, 2_500));
        assertEquals("bytes=2500-4999", server.requests("GET", "/data.bin").get(0).range());
    }

    @Test
    void testContinuesFromDownloadedPrefix() {
        Chunk chunk = new Chunk(1, 2_500L, 4_999L);
        chunk.recordWritten(500L);

        fetcher(chunk, new CancellationToken(), 3).run();

        assertTrue(chunk.isComplete());
        assertEquals("bytes=3000-4999", server.requests("GET", "/data.bin").get(0).range());
    }

    @Test
    void testIgnoredRangeIsReported() {
        server.serve("/data.bin", content).ignoringRanges();
        Chunk chunk = new Chunk(0, 0L, 999L);

        CompletionException thrown = assertThrows(CompletionException.class,
            () -> fetcher(chunk, new CancellationToken(), 3).run());

        assertInstanceOf(RangeNotHonoredException.class, thrown.getCause());
        assertEquals(1, server.requests("GET", "/data.bin").size());
    }

    @Test
    void testCancelledTokenStopsBeforeRequest() {
        CancellationToken token = new CancellationToken();
        token.cancel();

        assertThrows(TransferCancelledException.class, () -> fetcher(new Chunk(0, 0L, 999L), token, 3).run());
        assertTrue(server.requests("GET", "/data.bin").isEmpty());
    }

    @Test
    void testCancelledChunkStopsBeforeRequest() {
        Chunk chunk = new Chunk(0, 0L, 999L);
        chunk.cancel();

        assertThrows(TransferCancelledException.class, () -> fetcher(chunk, new CancellationToken(), 3).run());
        assertTrue(server.requests("GET", "/data.bin").isEmpty());
    }

    @Test
    void testGivesUpAfterBoundedAttempts() {
        server.serve("/data.bin", content).failingWith(500);

        CompletionException thrown = assertThrows(CompletionException.class,
            () -> fetcher(new Chunk(0, 0L, 999L), new CancellationToken(), 2).run());

        assertInstanceOf(IOException.class, thrown.getCause());
        assertTrue(thrown.getCause().getMessage().contains("after 2 attempts"), thrown.getCause().getMessage());
        List<RangeTestServer.RecordedRequest> gets = server.requests("GET", "/data.bin");
        assertEquals(2, gets.size());
    }

    @Test
    void testCancelInterruptsRetryBackoff() {
        server.serve("/data.bin", content).failingWith(500);
        CancellationToken token = new CancellationToken();
        ChunkFetcher slowRetry = new ChunkFetcher(client, url, target, new Chunk(0, 0L, 999L), token,
            1024, 3, Duration.ofSeconds(30));

        CompletableFuture<Void> running = CompletableFuture.runAsync(slowRetry);
        assertTimeoutPreemptively(Duration.ofSeconds(10), () -> {
            while (server.requests("GET", "/data.bin").isEmpty()) {
                Thread.sleep(10);
            }
        });
        token.cancel();

        ExecutionException thrown = assertThrows(ExecutionException.class, () -> running.get(2, TimeUnit.SECONDS));
        assertInstanceOf(TransferCancelledException.class, thrown.getCause());
        assertEquals(1, server.requests("GET", "/data.bin").size());
    }

    @Test
    void testCompletedChunkMakesNoRequest() {
        Chunk chunk = new Chunk(0, 0L, 99L);
        chunk.recordWritten(100L);

        fetcher(chunk, new CancellationToken(), 3).run();

        assertTrue(server.requests().isEmpty());
    }
}
