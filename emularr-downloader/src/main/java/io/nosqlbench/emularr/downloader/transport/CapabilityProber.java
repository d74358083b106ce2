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
import okhttp3.Request;
import okhttp3.Response;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.URL;

/// Learns the size of a remote resource and whether it can be fetched in byte ranges,
/// without transferring the body.
///
/// A HEAD request is tried first. Servers that reject HEAD get a one-byte ranged GET
/// instead. Network failures never escape: they yield {@link ResourceCapabilities#unknown()},
/// which makes the caller fall back to a single stream.
public class CapabilityProber {
    private static final Logger logger = LogManager.getLogger(CapabilityProber.class);

    private final OkHttpClient client;

    /// @param client the client to probe with; it should carry bounded timeouts
    public CapabilityProber(OkHttpClient client) {
        this.client = client;
    }

    /// Probe a resource.
    /// @param url the resource
    /// @return what the server reported
    public ResourceCapabilities probe(URL url) {
        Request request = HttpClients.requestFor(url).head().build();
        logger.debug("Requesting HEAD metadata from {}", url);
        try (Response response = client.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                logger.debug("HEAD request failed ({}), trying ranged GET for metadata", response.code());
                return probeWithGet(url);
            }
            long contentLength = parseLength(response.header("Content-Length"));
            boolean acceptsRanges = "bytes".equalsIgnoreCase(trim(response.header("Accept-Ranges")));
            ResourceCapabilities capabilities =
                new ResourceCapabilities(acceptsRanges && contentLength > 0, contentLength);
            logger.debug("Metadata via HEAD for {}: {}", url, capabilities);
            return capabilities;
        } catch (IOException | RuntimeException e) {
            logger.warn("Unable to probe {}: {}", url, e.toString());
            return ResourceCapabilities.unknown();
        }
    }

    private ResourceCapabilities probeWithGet(URL url) {
        Request request = HttpClients.requestFor(url).get().header("Range", "bytes=0-0").build();
        try (Response response = client.newCall(request).execute()) {
            if (response.code() == 206) {
                ContentRange range = ContentRange.parse(response.header("Content-Range"));
                if (range != null && range.totalLength() > 0) {
                    ResourceCapabilities capabilities = new ResourceCapabilities(true, range.totalLength());
                    logger.debug("Metadata via ranged GET for {}: {}", url, capabilities);
                    return capabilities;
                }
                return ResourceCapabilities.unknown();
            }
            if (response.isSuccessful()) {
                // 200 means the range was ignored; the length may still be useful
                return new ResourceCapabilities(false, parseLength(response.header("Content-Length")));
            }
            logger.debug("Ranged GET for metadata failed with code {}", response.code());
            return ResourceCapabilities.unknown();
        } catch (IOException | RuntimeException e) {
            logger.warn("Unable to probe {} with ranged GET: {}", url, e.toString());
            return ResourceCapabilities.unknown();
        }
    }

    static long parseLength(String value) {
        if (value == null) {
            return 0L;
        }
        try {
            return Math.max(0L, Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            logger.debug("Ignoring malformed Content-Length '{}'", value);
            return 0L;
        }
    }

    private static String trim(String value) {
        return value == null ? null : value.trim();
    }
}
