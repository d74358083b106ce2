package io.nosqlbench.emularr.library.archive;

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
import java.util.List;
import java.util.Locale;

/// Decides from a file name whether a download is an archive to unpack.
///
/// Disc and console images ({@code .iso .nkit .ciso .wbfs .wad}) are never unpacked,
/// even when an archive extension also matches. Compound extensions such as
/// {@code .tar.gz} are matched before their last component.
public final class ArchiveClassifier {

    /// Archive layouts recognized by name
    public enum Format {
        ZIP(".zip"),
        SEVEN_Z(".7z"),
        RAR(".rar"),
        TAR_GZ(".tar.gz", ".tgz"),
        TAR(".tar"),
        GZIP(".gz"),
        NONE;

        private final List<String> extensions;

        Format(String... extensions) {
            this.extensions = List.of(extensions);
        }

        /// @return the lower-case extensions, each including the leading dot
        public List<String> extensions() {
            return extensions;
        }
    }

    private static final List<String> NEVER_EXTRACT = List.of(".iso", ".nkit", ".ciso", ".wbfs", ".wad");

    private ArchiveClassifier() {
    }

    /// @param file a downloaded file
    /// @return true if the name carries an archive extension and no image extension
    public static boolean isExtractable(Path file) {
        return formatOf(file) != Format.NONE;
    }

    /// @param file a downloaded file
    /// @return true if the name carries a disc or console image extension
    public static boolean isDiscImage(Path file) {
        String name = lowerName(file);
        for (String ext : NEVER_EXTRACT) {
            if (name.endsWith(ext) || name.contains(ext + ".")) {
                return true;
            }
        }
        return false;
    }

    /// @param file a downloaded file
    /// @return the archive layout its name indicates, {@link Format#NONE} for images and other files
    public static Format formatOf(Path file) {
        if (file == null || file.getFileName() == null || isDiscImage(file)) {
            return Format.NONE;
        }
        String name = lowerName(file);
        for (Format format : Format.values()) {
            for (String ext : format.extensions()) {
                if (name.endsWith(ext) && name.length() > ext.length()) {
                    return format;
                }
            }
        }
        return Format.NONE;
    }

    /// Strip the archive extension from a file name, compound extensions included.
    /// @param fileName a file name
    /// @return the name without its archive extension, or the name unchanged
    public static String baseName(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        for (Format format : Format.values()) {
            for (String ext : format.extensions()) {
                if (lower.endsWith(ext) && lower.length() > ext.length()) {
                    return fileName.substring(0, fileName.length() - ext.length());
                }
            }
        }
        return fileName;
    }

    private static String lowerName(Path file) {
        return file.getFileName().toString().toLowerCase(Locale.ROOT);
    }
}
