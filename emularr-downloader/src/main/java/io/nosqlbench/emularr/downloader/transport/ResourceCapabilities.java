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

/// What a metadata probe learned about a remote resource.
/// @param supportsRange true only when the server accepts byte ranges and reported a positive length
/// @param contentLength the total length in bytes, or 0 when unknown
public record ResourceCapabilities(boolean supportsRange, long contentLength) {

    private static final ResourceCapabilities UNKNOWN = new ResourceCapabilities(false, 0L);

    public ResourceCapabilities {
        if (contentLength < 0) {
            contentLength = 0L;
        }
        if (contentLength == 0) {
            supportsRange = false;
        }
    }

    /// @return capabilities for a resource nothing is known about
    public static ResourceCapabilities unknown() {
        return UNKNOWN;
    }

    /// @return true if the total length is known
    public boolean lengthKnown() {
        return contentLength > 0;
    }
}
