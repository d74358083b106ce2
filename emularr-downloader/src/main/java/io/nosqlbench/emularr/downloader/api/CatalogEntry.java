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
import java.time.Instant;
import java.util.List;
import java.util.Map;

/// A game recorded in the catalog.
/// @param id the catalog id
/// @param name the display name
/// @param platform the platform label, may be null
/// @param filePath where the game lives on disk
/// @param sourceDownloadDir the directory it was downloaded into
/// @param addedAt when it was cataloged
/// @param tags user tags
/// @param metadata free-form properties
public record CatalogEntry(
    String id,
    String name,
    String platform,
    Path filePath,
    Path sourceDownloadDir,
    Instant addedAt,
    List<String> tags,
    Map<String, String> metadata
) {
    public CatalogEntry {
        tags = tags == null ? List.of() : List.copyOf(tags);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    /// Build an untagged entry from a registration request.
    /// @param id the id to assign
    /// @param request the request
    /// @return a new entry stamped with the current time
    public static CatalogEntry from(String id, CatalogEntryRequest request) {
        return new CatalogEntry(id, request.name(), request.platform(), request.filePath(),
            request.sourceDownloadDir(), Instant.now(), List.of(), request.metadata());
    }
}
