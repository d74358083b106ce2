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
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class SingleStreamFetcherTest {

    private static final int LENGTH = 20_000;

    @TempDir
    Path tempDir;

    private RangeTestServer server;
    private OkHttpClient client;
    private byte[] content;
    private Path target;

    @BeforeEach
    void setUp() throws IOException {
        server = new RangeTestServer().start();
        client = HttpClients.transferClient(Duration.ofSeconds(10));
        content = RangeTestServer.content(LENGTH);
        target = tempDir.resolve("rom.bin");
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    void testFetchesWholeBody() throws IOException {
        server.serve("/rom.bin", content).withoutContentLength();

        long size = new SingleStreamFetcher(client, server.url("/rom.bin"), target, 0L, 0L,
            new CancellationToken(), 4096).fetch();

        assertEquals(LENGTH, size);
        assertArrayEquals(content, Files.readAllBytes(target));
        assertNull(server.requests("GET", "/rom.bin").get(0).range());
    }

    @Test
    void testFreshTransferTruncatesStaleFile() throws IOException {
        server.serve("/rom.bin", content);
        Files.write(target, new byte[LENGTH * 2]);

        new SingleStreamFetcher(client, server.url("/rom.bin"), target, 0L, LENGTH,
            new CancellationToken(), 4096).fetch();

        assertArrayEquals(content, Files.readAllBytes(target));
    }

    @Test
    void testResumeSendsOpenEndedRange() throws IOException {
        server.serve("/rom.bin", content);
        Files.write(target, Arrays.copyOf(content, 7_000));

        long size = new SingleStreamFetcher(client, server.url("/rom.bin"), target, 7_000L, LENGTH,
            new CancellationToken(), 4096).fetch();

        assertEquals(LENGTH, size);
        assertEquals("bytes=7000-", server.requests("GET", "/rom.bin").get(0).range());
        assertArrayEquals(content, Files.readAllBytes(target));
    }

    @Test
    void testResumeRejectsIgnoredRange() throws IOException {
        server.serve("/rom.bin", content).ignoringRanges();
        Files.write(target, Arrays.copyOf(content, 7_000));

        assertThrows(RangeNotHonoredException.class, () -> new SingleStreamFetcher(client,
            server.url("/rom.bin"), target, 7_000L, LENGTH, new CancellationToken(), 4096).fetch());
        assertEquals(7_000L, Files.size(target));
    }

    @Test
    void testHttpErrorIsReported() {
        IOException thrown = assertThrows(IOException.class, () -> new SingleStreamFetcher(client,
            server.url("/missing.bin"), target, 0L, 0L, new CancellationToken(), 4096).fetch());

        assertTrue(thrown.getMessage().contains("404"), thrown.getMessage());
    }

    @Test
    void testShortBodyIsReported() {
        server.serve("/rom.bin", content);

        IOException thrown = assertThrows(IOException.class, () -> new SingleStreamFetcher(client,
            server.url("/rom.bin"), target, 0L, LENGTH + 10, new CancellationToken(), 4096).fetch());

        assertTrue(thrown.getMessage().contains("ended at " + LENGTH), thrown.getMessage());
    }

    @Test
    void testCancelledTokenMakesNoRequest() {
        server.serve("/rom.bin", content);
        CancellationToken token = new CancellationToken();
        token.cancel();

        assertThrows(TransferCancelledException.class, () -> new SingleStreamFetcher(client,
            server.url("/rom.bin"), target, 0L, 0L, token, 4096).fetch());
        assertTrue(server.requests().isEmpty());
    }
}
