package io.nosqlbench.emularr.downloader.api;

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

import java.nio.file.Path;
import java.util.Map;

/// What the controller hands to the catalog after a download completes.
/// @param name the display name of the game
/// @param platform the platform label, may be null when unknown
/// @param filePath the extracted directory, or the downloaded file when nothing was extracted
/// @param sourceDownloadDir the directory the download was written to
/// @param metadata free-form properties, including {@code originalFileName} and {@code extracted}
public record CatalogEntryRequest(
    String name,
    String platform,
    Path filePath,
    Path sourceDownloadDir,
    Map<String, String> metadata
) {
    /// Metadata key naming the file as it was downloaded
    public static final String ORIGINAL_FILE_NAME = "originalFileName";
    /// Metadata key recording whether the download was unpacked
    public static final String EXTRACTED = "extracted";
    /// Metadata key recording the source URL
    public static final String SOURCE_URL = "sourceUrl";

    public CatalogEntryRequest {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        if (filePath == null) {
            throw new IllegalArgumentException("filePath must not be null");
        }
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
