package io.nosqlbench.emularr.downloader.testserver;

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

import org.apache.hc.core5.http.ClassicHttpRequest;
import org.apache.hc.core5.http.ClassicHttpResponse;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpException;
import org.apache.hc.core5.http.HttpStatus;
import org.apache.hc.core5.http.impl.bootstrap.HttpServer;
import org.apache.hc.core5.http.impl.bootstrap.ServerBootstrap;
import org.apache.hc.core5.http.io.HttpRequestHandler;
import org.apache.hc.core5.http.io.entity.InputStreamEntity;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.apache.hc.core5.http.protocol.HttpContext;
import org.apache.hc.core5.io.CloseMode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.net.MalformedURLException;
import java.net.ServerSocket;
import java.net.URL;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/// An in-process HTTP server for download tests. It serves generated byte arrays and can be
/// told, per resource, to hide {@code Accept-Ranges} or {@code Content-Length}, to ignore
/// range requests, to reject HEAD, to fail with a status code, or to trickle data slowly.
///
/// Every request is recorded with its {@code Range} header, and the number of response
/// bodies currently being written is tracked so tests can see when client streams closed.
///
/// ```java
/// try (RangeTestServer server = new RangeTestServer().start()) {
///     server.serve("/game.zip", RangeTestServer.content(1024));
///     URL url = server.url("/game.zip");
/// }
/// ```
public class RangeTestServer implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(RangeTestServer.class);

    private final Map<String, ServedResource> resources = new ConcurrentHashMap<>();
    private final List<RecordedRequest> requests = new CopyOnWriteArrayList<>();
    private final AtomicInteger activeStreams = new AtomicInteger();
    private HttpServer server;
    private int port;

    /// Start listening on a free port.
    /// @return this server
    /// @throws IOException if the server cannot bind
    public RangeTestServer start() throws IOException {
        this.port = findAvailablePort();
        server = ServerBootstrap.bootstrap()
            .setListenerPort(port)
            .setCanonicalHostName("127.0.0.1")
            .register("*", new ResourceHandler())
            .create();
        server.start();
        logger.debug("Range test server started on port {}", port);
        return this;
    }

    /// Serve content at a path.
    /// @param path the request path, starting with a slash
    /// @param content the body
    /// @return the resource, for further configuration
    public ServedResource serve(String path, byte[] content) {
        ServedResource resource = new ServedResource(content);
        resources.put(path, resource);
        return resource;
    }

    /// @param path a request path
    /// @return the absolute URL of the path on this server
    public URL url(String path) {
        try {
            return new URL("http://127.0.0.1:" + port + path);
        } catch (MalformedURLException e) {
            throw new IllegalArgumentException("Bad path " + path, e);
        }
    }

    /// @return every request received so far
    public List<RecordedRequest> requests() {
        return List.copyOf(requests);
    }

    /// @param method an HTTP method
    /// @param path a request path
    /// @return the requests with that method and path
    public List<RecordedRequest> requests(String method, String path) {
        return requests.stream()
            .filter(r -> r.method().equalsIgnoreCase(method) && r.path().equals(path))
            .collect(Collectors.toList());
    }

    /// @return the number of response bodies currently being written
    public int activeStreams() {
        return activeStreams.get();
    }

    @Override
    public void close() {
        if (server != null) {
            server.close(CloseMode.IMMEDIATE);
            logger.debug("Range test server stopped");
        }
    }

    /// Deterministic content whose bytes depend on their offset, so misplaced writes show up.
    /// @param length the number of bytes
    /// @return the content
    public static byte[] content(int length) {
        byte[] data = new byte[length];
        for (int i = 0; i < length; i++) {
            data[i] = (byte) ((i * 31L + (i >>> 8) * 7L + 11L) % 251L);
        }
        return data;
    }

    private static int findAvailablePort() {
        try (ServerSocket socket = new ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        } catch (IOException e) {
            throw new RuntimeException("Failed to find available port", e);
        }
    }

    /// A request as the server saw it.
    /// @param method the HTTP method
    /// @param path the request path
    /// @param range the Range header, or null
    public record RecordedRequest(String method, String path, String range) {
    }

    /// Behavior switches for one served resource. All switches may be flipped while the
    /// server is running.
    public static final class ServedResource {
        private final byte[] content;
        private volatile boolean acceptRanges = true;
        private volatile boolean contentLength = true;
        private volatile boolean honorRanges = true;
        private volatile boolean headAllowed = true;
        private volatile int failureStatus;
        private volatile int throttleBytes;
        private volatile long throttleMillis;

        private ServedResource(byte[] content) {
            this.content = content;
        }

        /// Stop advertising {@code Accept-Ranges} and answer range requests with the full body.
        public ServedResource withoutRangeSupport() {
            this.acceptRanges = false;
            this.honorRanges = false;
            return this;
        }

        /// Keep advertising {@code Accept-Ranges} but answer range requests with a 200.
        public ServedResource ignoringRanges() {
            this.honorRanges = false;
            return this;
        }

        /// Stream bodies with chunked transfer encoding and no {@code Content-Length}.
        public ServedResource withoutContentLength() {
            this.contentLength = false;
            return this;
        }

        /// Answer HEAD with 405.
        public ServedResource rejectingHead() {
            this.headAllowed = false;
            return this;
        }

        /// Answer every request with the given status.
        public ServedResource failingWith(int status) {
            this.failureStatus = status;
            return this;
        }

        /// Deliver at most {@code bytes} per read, sleeping {@code millis} before each read.
        public ServedResource throttled(int bytes, long millis) {
            this.throttleBytes = bytes;
            this.throttleMillis = millis;
            return this;
        }

        /// Serve at full speed again.
        public ServedResource unthrottled() {
            this.throttleBytes = 0;
            this.throttleMillis = 0;
            return this;
        }
    }

    private final class ResourceHandler implements HttpRequestHandler {

        @Override
        public void handle(ClassicHttpRequest request, ClassicHttpResponse response, HttpContext context)
            throws IOException, HttpException {
            String path = request.getPath();
            int query = path.indexOf('?');
            if (query >= 0) {
                path = path.substring(0, query);
            }
            String method = request.getMethod();
            Header rangeHeader = request.getHeader("Range");
            String range = rangeHeader == null ? null : rangeHeader.getValue();
            requests.add(new RecordedRequest(method, path, range));

            ServedResource resource = resources.get(path);
            if (resource == null) {
                response.setCode(HttpStatus.SC_NOT_FOUND);
                response.setEntity(new StringEntity("Not found: " + path));
                return;
            }
            if (resource.failureStatus > 0) {
                response.setCode(resource.failureStatus);
                response.setEntity(new StringEntity("Failure requested for " + path));
                return;
            }
            boolean head = "HEAD".equalsIgnoreCase(method);
            if (head && !resource.headAllowed) {
                response.setCode(HttpStatus.SC_METHOD_NOT_ALLOWED);
                return;
            }
            if (resource.acceptRanges) {
                response.setHeader("Accept-Ranges", "bytes");
            }

            long total = resource.content.length;
            long first = 0;
            long last = total - 1;
            if (range != null && resource.honorRanges) {
                long[] bounds = parseRange(range, total);
                if (bounds == null) {
                    response.setCode(HttpStatus.SC_REQUESTED_RANGE_NOT_SATISFIABLE);
                    response.setHeader("Content-Range", "bytes */" + total);
                    return;
                }
                first = bounds[0];
                last = bounds[1];
                response.setCode(HttpStatus.SC_PARTIAL_CONTENT);
                response.setHeader("Content-Range", "bytes " + first + "-" + last + "/" + total);
            } else {
                response.setCode(HttpStatus.SC_OK);
            }

            long length = last - first + 1;
            InputStream body = new ServedStream(resource, (int) first, (int) length, !head);
            response.setEntity(new InputStreamEntity(body, resource.contentLength ? length : -1L,
                ContentType.APPLICATION_OCTET_STREAM));
        }

        private long[] parseRange(String range, long total) {
            if (!range.startsWith("bytes=")) {
                return null;
            }
            String spec = range.substring("bytes=".length()).trim();
            int dash = spec.indexOf('-');
            if (dash <= 0) {
                return null;
            }
            try {
                long first = Long.parseLong(spec.substring(0, dash).trim());
                String lastText = spec.substring(dash + 1).trim();
                long last = lastText.isEmpty() ? total - 1 : Math.min(Long.parseLong(lastText), total - 1);
                if (first >= total || last < first) {
                    return null;
                }
                return new long[]{first, last};
            } catch (NumberFormatException e) {
                return null;
            }
        }
    }

    /// Reads a slice of a resource, optionally throttled, counting itself as an active stream
    /// from its first read until it is closed.
    private final class ServedStream extends InputStream {
        private final ServedResource resource;
        private final boolean counted;
        private int position;
        private final int end;
        private boolean opened;
        private boolean closed;

        ServedStream(ServedResource resource, int offset, int length, boolean counted) {
            this.resource = resource;
            this.position = offset;
            this.end = offset + length;
            this.counted = counted;
        }

        @Override
        public int read() throws IOException {
            byte[] one = new byte[1];
            int n = read(one, 0, 1);
            return n == -1 ? -1 : one[0] & 0xFF;
        }

        @Override
        public int read(byte[] buffer, int offset, int length) throws IOException {
            if (!opened) {
                opened = true;
                if (counted) {
                    activeStreams.incrementAndGet();
                }
            }
            if (position >= end) {
                return -1;
            }
            int limit = Math.min(length, end - position);
            int throttle = resource.throttleBytes;
            if (throttle > 0) {
                limit = Math.min(limit, throttle);
                try {
                    Thread.sleep(resource.throttleMillis);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IOException("Interrupted while throttling", e);
                }
            }
            System.arraycopy(resource.content, position, buffer, offset, limit);
            position += limit;
            return limit;
        }

        @Override
        public void close() {
            if (!closed) {
                closed = true;
                if (opened && counted) {
                    activeStreams.decrementAndGet();
                }
            }
        }
    }
}
