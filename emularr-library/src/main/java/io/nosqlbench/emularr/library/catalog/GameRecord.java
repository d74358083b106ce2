package io.nosqlbench.emularr.library.catalog;

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

import io.nosqlbench.emularr.downloader.api.CatalogEntry;

import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// The JSON shape of one game in {@code games.json}. Paths and timestamps are kept as
/// strings so the file stays readable and portable.
record GameRecord(
    String id,
    String name,
    String platform,
    String filePath,
    String downloadPath,
    List<String> tags,
    String dateAdded,
    Map<String, String> metadata
) {

    static GameRecord of(CatalogEntry entry) {
        return new GameRecord(
            entry.id(),
            entry.name(),
            entry.platform(),
            entry.filePath().toString(),
            entry.sourceDownloadDir() == null ? null : entry.sourceDownloadDir().toString(),
            entry.tags(),
            entry.addedAt().toString(),
            entry.metadata()
        );
    }

    CatalogEntry toEntry() {
        Instant added;
        try {
            added = dateAdded == null ? Instant.EPOCH : Instant.parse(dateAdded);
        } catch (DateTimeParseException e) {
            added = Instant.EPOCH;
        }
        return new CatalogEntry(
            id,
            name,
            platform,
            Path.of(filePath),
            downloadPath == null ? null : Path.of(downloadPath),
            added,
            tags == null ? null : tags.stream().filter(Objects::nonNull).toList(),
            presentValues(metadata)
        );
    }

    /// Hand-edited files may carry {@code null} properties; those are dropped on load.
    private static Map<String, String> presentValues(Map<String, String> metadata) {
        if (metadata == null) {
            return null;
        }
        Map<String, String> present = new LinkedHashMap<>();
        metadata.forEach((key, value) -> {
            if (key != null && value != null) {
                present.put(key, value);
            }
        });
        return present;
    }
}
