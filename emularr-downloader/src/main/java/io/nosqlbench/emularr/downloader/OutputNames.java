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

import java.net.URLDecoder;
import java.net.URL;
import java.nio.charset.StandardCharsets;

/// Derives local file names for downloads.
final class OutputNames {

    private OutputNames() {
    }

    /// @return the last path segment of the URL, else {@code <name>.bin}, else {@code <id>.bin}
    static String fileNameFor(URL url, GameMetadata metadata, String id) {
        String fromUrl = sanitize(lastSegment(url));
        if (!fromUrl.isEmpty()) {
            return fromUrl;
        }
        if (metadata.hasName()) {
            String fromName = sanitize(metadata.name());
            if (!fromName.isEmpty()) {
                return fromName + ".bin";
            }
        }
        return id + ".bin";
    }

    /// @return the name of the directory an archive is extracted into
    static String extractionFolderFor(GameMetadata metadata, String fileName) {
        if (metadata.hasName()) {
            String fromName = sanitize(metadata.name());
            if (!fromName.isEmpty()) {
                return fromName;
            }
        }
        String lower = fileName.toLowerCase();
        for (String compound : new String[]{".tar.gz", ".tar.xz", ".tar.bz2"}) {
            if (lower.endsWith(compound)) {
                return fileName.substring(0, fileName.length() - compound.length());
            }
        }
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName + "_extracted";
    }

    private static String lastSegment(URL url) {
        String path = url.getPath();
        if (path == null || path.isEmpty()) {
            return "";
        }
        int slash = path.lastIndexOf('/');
        String segment = slash >= 0 ? path.substring(slash + 1) : path;
        try {
            return URLDecoder.decode(segment, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return segment;
        }
    }

    static String sanitize(String name) {
        if (name == null) {
            return "";
        }
        String cleaned = name.replaceAll("[\\\\/:*?\"<>|\\p{Cntrl}]", "_").trim();
        while (cleaned.startsWith(".")) {
            cleaned = cleaned.substring(1);
        }
        return cleaned.trim();
    }
}
