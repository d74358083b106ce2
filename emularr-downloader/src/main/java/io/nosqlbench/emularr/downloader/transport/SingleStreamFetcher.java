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
import java.nio.file.OpenOption;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/// Streams a whole resource, or its tail from a resume offset, into the target file.
///
/// A fresh transfer truncates the file. A resumed transfer sends
/// {@code Range: bytes=<offset>-} and appends at that offset; a 200 answer to that request
/// raises {@link RangeNotHonoredException}.
public class SingleStreamFetcher {
    private static final Logger logger = LogManager.getLogger(SingleStreamFetcher.class);

    private final OkHttpClient client;
    private final URL url;
    private final Path targetFile;
    private final long resumeOffset;
    private final long expectedLength;
    private final CancellationToken token;
    private final int bufferSize;

    /// @param client the http client
    /// @param url the resource
    /// @param targetFile the destination
    /// @param resumeOffset the number of bytes already on disk, 0 for a fresh transfer
    /// @param expectedLength the full length if known, otherwise 0
    /// @param token the task-wide cancellation token
    /// @param bufferSize bytes per read
    public SingleStreamFetcher(OkHttpClient client, URL url, Path targetFile, long resumeOffset,
                               long expectedLength, CancellationToken token, int bufferSize) {
        this.client = client;
        this.url = url;
        this.targetFile = targetFile;
        this.resumeOffset = resumeOffset;
        this.expectedLength = expectedLength;
        this.token = token;
        this.bufferSize = bufferSize;
    }

    /// Run the transfer on the calling thread.
    /// @return the final file size
    /// @throws IOException on network or file errors
    /// @throws TransferCancelledException if the token was cancelled
    public long fetch() throws IOException {
        checkCancelled("before request");
        Request.Builder builder = HttpClients.requestFor(url);
        if (resumeOffset > 0) {
            builder.header("Range", "bytes=" + resumeOffset + "-");
        }
        Call call = client.newCall(builder.build());
        token.register(call);
        try (Response response = call.execute()) {
            checkCancelled("after response");
            if (resumeOffset > 0) {
                if (response.code() == 200) {
                    throw new RangeNotHonoredException(
                        "Server ignored range bytes=" + resumeOffset + "- and sent the whole body");
                }
                if (response.code() != 206) {
                    throw new IOException("Unexpected HTTP status " + response.code()
                        + " resuming at offset " + resumeOffset);
                }
                ContentRange contentRange = ContentRange.parse(response.header("Content-Range"));
                if (contentRange != null && contentRange.first() != resumeOffset) {
                    throw new IOException("Resumed at " + resumeOffset + " but server sent bytes starting at "
                        + contentRange.first());
                }
            } else if (!response.isSuccessful()) {
                throw new IOException("HTTP " + response.code() + " fetching " + url);
            }
            ResponseBody body = response.body();
            if (body == null) {
                throw new IOException("No response body from " + url);
            }
            OpenOption[] options = resumeOffset > 0
                ? new OpenOption[]{StandardOpenOption.CREATE, StandardOpenOption.WRITE}
                : new OpenOption[]{StandardOpenOption.CREATE, StandardOpenOption.WRITE,
                    StandardOpenOption.TRUNCATE_EXISTING};
            long position;
            try (FileChannel channel = FileChannel.open(targetFile, options);
                 BufferedSource source = body.source()) {
                position = stream(source, channel);
            }
            if (expectedLength > 0 && position != expectedLength) {
                throw new IOException("Stream from " + url + " ended at " + position
                    + " of " + expectedLength + " bytes");
            }
            logger.debug("Single stream for {} finished with {} bytes", url, position);
            return position;
        } catch (IOException e) {
            if (token.isCancelled()) {
                throw new TransferCancelledException("Single stream cancelled", e);
            }
            throw e;
        } finally {
            token.unregister(call);
        }
    }

    private long stream(BufferedSource source, FileChannel channel) throws IOException {
        byte[] buffer = new byte[bufferSize];
        long position = resumeOffset;
        while (true) {
            checkCancelled("while streaming");
            int read = source.read(buffer);
            if (read == -1) {
                return position;
            }
            ByteBuffer data = ByteBuffer.wrap(buffer, 0, read);
            while (data.hasRemaining()) {
                position += channel.write(data, position);
            }
        }
    }

    private void checkCancelled(String where) {
        if (token.isCancelled()) {
            throw new TransferCancelledException("Single stream cancelled " + where);
        }
    }
}
