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

/// A parsed {@code Content-Range: bytes <first>-<last>/<total>} header.
/// @param first the first byte in the response
/// @param last the last byte in the response, inclusive
/// @param totalLength the full resource length, or -1 when the server sent {@code *}
public record ContentRange(long first, long last, long totalLength) {

    /// Parse a Content-Range header value.
    /// @param header the raw header, may be null
    /// @return the parsed range, or null if the header is absent or not a satisfied byte range
    public static ContentRange parse(String header) {
        if (header == null) {
            return null;
        }
        String value = header.trim();
        if (!value.startsWith("bytes ")) {
            return null;
        }
        value = value.substring("bytes ".length()).trim();
        int dash = value.indexOf('-');
        int slash = value.indexOf('/');
        if (dash <= 0 || slash <= dash) {
            return null;
        }
        try {
            long first = Long.parseLong(value.substring(0, dash).trim());
            long last = Long.parseLong(value.substring(dash + 1, slash).trim());
            String totalText = value.substring(slash + 1).trim();
            long total = "*".equals(totalText) ? -1L : Long.parseLong(totalText);
            return new ContentRange(first, last, total);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
