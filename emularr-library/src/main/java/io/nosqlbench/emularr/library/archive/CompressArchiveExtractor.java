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

import io.nosqlbench.emularr.downloader.api.ArchiveExtractor;
import io.nosqlbench.emularr.downloader.api.ExtractionException;
import org.apache.commons.compress.archivers.ArchiveEntry;
import org.apache.commons.compress.archivers.ArchiveInputStream;
import org.apache.commons.compress.archivers.sevenz.SevenZArchiveEntry;
import org.apache.commons.compress.archivers.sevenz.SevenZFile;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipFile;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Comparator;
import java.util.Enumeration;
import java.util.stream.Stream;

/// Unpacks zip, 7z, tar, gzipped tar and single-file gzip downloads with Apache Commons Compress.
///
/// RAR archives are recognized but not unpacked; {@link #extract(Path, Path)} rejects them so
/// the caller keeps the original file. Entries whose names resolve outside the destination
/// directory fail the whole extraction. A failed extraction removes the destination directory
/// if this call created it.
public class CompressArchiveExtractor implements ArchiveExtractor {
    private static final Logger logger = LogManager.getLogger(CompressArchiveExtractor.class);
    private static final int BUFFER_SIZE = 64 * 1024;

    @Override
    public boolean shouldExtract(Path file) {
        return ArchiveClassifier.isExtractable(file);
    }

    @Override
    public Path extract(Path archive, Path destinationDir) throws ExtractionException {
        ArchiveClassifier.Format format = ArchiveClassifier.formatOf(archive);
        if (format == ArchiveClassifier.Format.NONE) {
            throw new ExtractionException("Not a supported archive: " + archive);
        }
        if (format == ArchiveClassifier.Format.RAR) {
            throw new ExtractionException("RAR archives are not supported, extract manually: " + archive);
        }
        if (!Files.isRegularFile(archive)) {
            throw new ExtractionException("Archive does not exist: " + archive);
        }
        Path target = destinationDir.toAbsolutePath().normalize();
        boolean created = !Files.exists(target);
        try {
            Files.createDirectories(target);
            int entries = switch (format) {
                case ZIP -> extractZip(archive, target);
                case SEVEN_Z -> extractSevenZ(archive, target);
                case TAR -> extractTar(archive, target, false);
                case TAR_GZ -> extractTar(archive, target, true);
                case GZIP -> extractGzip(archive, target);
                default -> throw new ExtractionException("Unsupported archive format " + format + ": " + archive);
            };
            logger.info("Extracted {} entries from {} into {}", entries, archive.getFileName(), target);
            return target;
        } catch (IOException e) {
            if (created) {
                removeQuietly(target);
            }
            throw new ExtractionException("Failed to extract " + archive + ": " + e.getMessage(), e);
        } catch (ExtractionException e) {
            if (created) {
                removeQuietly(target);
            }
            throw e;
        }
    }

    private int extractZip(Path archive, Path target) throws IOException, ExtractionException {
        int count = 0;
        try (ZipFile zip = ZipFile.builder().setPath(archive).get()) {
            Enumeration<ZipArchiveEntry> entries = zip.getEntries();
            while (entries.hasMoreElements()) {
                ZipArchiveEntry entry = entries.nextElement();
                Path out = resolveEntry(target, entry.getName());
                if (entry.isDirectory()) {
                    Files.createDirectories(out);
                } else {
                    try (InputStream in = zip.getInputStream(entry)) {
                        writeEntry(in, out);
                    }
                }
                count++;
            }
        }
        return count;
    }

    private int extractSevenZ(Path archive, Path target) throws IOException, ExtractionException {
        int count = 0;
        try (SevenZFile sevenZ = SevenZFile.builder().setPath(archive).get()) {
            SevenZArchiveEntry entry;
            byte[] buffer = new byte[BUFFER_SIZE];
            while ((entry = sevenZ.getNextEntry()) != null) {
                Path out = resolveEntry(target, entry.getName());
                if (entry.isDirectory()) {
                    Files.createDirectories(out);
                } else {
                    Files.createDirectories(out.getParent());
                    try (OutputStream os = Files.newOutputStream(out,
                        StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
                        if (entry.hasStream()) {
                            int len;
                            while ((len = sevenZ.read(buffer)) > 0) {
                                os.write(buffer, 0, len);
                            }
                        }
                    }
                }
                count++;
            }
        }
        return count;
    }

    private int extractTar(Path archive, Path target, boolean gzipped) throws IOException, ExtractionException {
        try (InputStream fis = Files.newInputStream(archive);
             BufferedInputStream bis = new BufferedInputStream(fis);
             InputStream raw = gzipped ? new GzipCompressorInputStream(bis, true) : bis;
             TarArchiveInputStream tis = new TarArchiveInputStream(raw)) {
            return extractStream(tis, target);
        }
    }

    private int extractStream(ArchiveInputStream<? extends ArchiveEntry> in, Path target)
        throws IOException, ExtractionException {
        int count = 0;
        ArchiveEntry entry;
        while ((entry = in.getNextEntry()) != null) {
            if (entry instanceof TarArchiveEntry tarEntry && (tarEntry.isSymbolicLink() || tarEntry.isLink())) {
                logger.debug("Skipping link entry {}", entry.getName());
                continue;
            }
            Path out = resolveEntry(target, entry.getName());
            if (entry.isDirectory()) {
                Files.createDirectories(out);
            } else {
                writeEntry(in, out);
            }
            count++;
        }
        return count;
    }

    private int extractGzip(Path archive, Path target) throws IOException, ExtractionException {
        String name = ArchiveClassifier.baseName(archive.getFileName().toString());
        Path out = resolveEntry(target, name);
        try (InputStream fis = Files.newInputStream(archive);
             BufferedInputStream bis = new BufferedInputStream(fis);
             GzipCompressorInputStream gis = new GzipCompressorInputStream(bis, true)) {
            writeEntry(gis, out);
        }
        return 1;
    }

    private static Path resolveEntry(Path target, String entryName) throws ExtractionException {
        Path out = target.resolve(entryName).normalize();
        if (!out.startsWith(target)) {
            throw new ExtractionException("Archive entry escapes the destination directory: " + entryName);
        }
        return out;
    }

    private static void writeEntry(InputStream in, Path out) throws IOException {
        Files.createDirectories(out.getParent());
        try (OutputStream os = Files.newOutputStream(out,
            StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            in.transferTo(os);
        }
    }

    private static void removeQuietly(Path dir) {
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> p.toFile().delete());
        } catch (IOException e) {
            logger.warn("Could not remove partial extraction at {}: {}", dir, e.getMessage());
        }
    }
}
