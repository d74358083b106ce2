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

/// Unpacks finished downloads. Implementations decide by file name whether a file is an
/// archive worth unpacking; the controller only calls {@link #extract(Path, Path)} when
/// {@link #shouldExtract(Path)} said yes.
public interface ArchiveExtractor {

    /// @param file a completed download
    /// @return true if the file should be unpacked after download
    boolean shouldExtract(Path file);

    /// Unpack an archive.
    /// @param archive the archive file
    /// @param destinationDir the directory to unpack into, created if missing
    /// @return the path that should be cataloged in place of the archive
    /// @throws ExtractionException if the archive cannot be unpacked
    Path extract(Path archive, Path destinationDir) throws ExtractionException;

    /// @return an extractor that never extracts anything
    static ArchiveExtractor none() {
        return new ArchiveExtractor() {
            @Override
            public boolean shouldExtract(Path file) {
                return false;
            }

            @Override
            public Path extract(Path archive, Path destinationDir) throws ExtractionException {
                throw new ExtractionException("Extraction is disabled for " + archive);
            }
        };
    }
}
