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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import io.nosqlbench.emularr.downloader.api.CatalogEntry;
import io.nosqlbench.emularr.downloader.api.CatalogEntryRequest;
import io.nosqlbench.emularr.downloader.api.CatalogException;
import io.nosqlbench.emularr.downloader.api.GameCatalog;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.stream.Stream;

/// A game library persisted as pretty-printed JSON in {@code games.json}.
///
/// Every mutation rewrites the file. Methods are synchronized; one instance should own a
/// given file.
public class JsonGameLibrary implements GameCatalog {
    private static final Logger logger = LogManager.getLogger(JsonGameLibrary.class);
    private static final Gson gson = new GsonBuilder().setPrettyPrinting().create();
    private static final SecureRandom random = new SecureRandom();

    /// The library file name inside the config directory
    public static final String FILE_NAME = "games.json";

    private final Path libraryFile;
    private final Map<String, CatalogEntry> games = new LinkedHashMap<>();

    /// Open a library file, reading it if it exists.
    /// @param libraryFile the JSON file
    /// @throws CatalogException if the file exists but cannot be read or parsed
    public JsonGameLibrary(Path libraryFile) {
        this.libraryFile = libraryFile;
        load();
    }

    /// @param configDir the config directory
    /// @return the library stored as {@code games.json} in that directory
    public static JsonGameLibrary inConfigDir(Path configDir) {
        return new JsonGameLibrary(configDir.resolve(FILE_NAME));
    }

    private void load() {
        if (!Files.exists(libraryFile)) {
            logger.debug("No library at {}, starting empty", libraryFile);
            return;
        }
        LibraryDocument document;
        try {
            document = gson.fromJson(Files.readString(libraryFile), LibraryDocument.class);
        } catch (IOException e) {
            throw new CatalogException("Failed to read game library " + libraryFile, e);
        } catch (JsonParseException e) {
            throw new CatalogException("Invalid JSON in game library " + libraryFile, e);
        }
        if (document == null || document.games() == null) {
            return;
        }
        for (GameRecord record : document.games()) {
            if (record == null || record.id() == null || record.name() == null || record.filePath() == null) {
                logger.warn("Skipping incomplete library record {}", record);
                continue;
            }
            games.put(record.id(), record.toEntry());
        }
        logger.debug("Loaded {} games from {}", games.size(), libraryFile);
    }

    private void persist() {
        List<GameRecord> records = games.values().stream().map(GameRecord::of).toList();
        String json = gson.toJson(new LibraryDocument(records));
        try {
            Path parent = libraryFile.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            Path temp = Files.createTempFile(parent, FILE_NAME, ".tmp");
            Files.writeString(temp, json);
            try {
                Files.move(temp, libraryFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, libraryFile, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new CatalogException("Failed to write game library " + libraryFile, e);
        }
    }

    @Override
    public synchronized CatalogEntry registerEntry(CatalogEntryRequest request) {
        CatalogEntry entry = CatalogEntry.from(newId(), request);
        games.put(entry.id(), entry);
        persist();
        logger.info("Added '{}' ({}) to the library as {}", entry.name(),
            entry.platform() == null ? "unknown platform" : entry.platform(), entry.id());
        return entry;
    }

    /// @return all games in insertion order
    public synchronized List<CatalogEntry> getGames() {
        return List.copyOf(games.values());
    }

    /// @param id a game id
    /// @return the game, if present
    public synchronized Optional<CatalogEntry> findGame(String id) {
        return Optional.ofNullable(id == null ? null : games.get(id));
    }

    /// Change a game's descriptive fields. Null arguments leave the field unchanged;
    /// metadata is merged into the existing properties.
    /// @param id a game id
    /// @param name a new name, or null
    /// @param platform a new platform, or null
    /// @param metadata properties to add or replace, or null
    /// @return the updated game, empty if the id is unknown
    public synchronized Optional<CatalogEntry> updateGame(String id, String name, String platform,
                                                         Map<String, String> metadata) {
        CatalogEntry existing = id == null ? null : games.get(id);
        if (existing == null) {
            return Optional.empty();
        }
        if (name != null && name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        Map<String, String> merged = new HashMap<>(existing.metadata());
        if (metadata != null) {
            merged.putAll(metadata);
        }
        CatalogEntry updated = new CatalogEntry(
            existing.id(),
            name == null ? existing.name() : name,
            platform == null ? existing.platform() : platform,
            existing.filePath(),
            existing.sourceDownloadDir(),
            existing.addedAt(),
            existing.tags(),
            merged
        );
        games.put(id, updated);
        persist();
        return Optional.of(updated);
    }

    /// @param id a game id
    /// @param tag a tag to add
    /// @return true if the game exists; adding a tag it already has is a no-op
    public synchronized boolean addTag(String id, String tag) {
        if (tag == null || tag.isBlank()) {
            throw new IllegalArgumentException("tag must not be blank");
        }
        CatalogEntry existing = id == null ? null : games.get(id);
        if (existing == null) {
            return false;
        }
        String trimmed = tag.trim();
        if (!existing.tags().contains(trimmed)) {
            List<String> tags = new ArrayList<>(existing.tags());
            tags.add(trimmed);
            games.put(id, withTags(existing, tags));
            persist();
        }
        return true;
    }

    /// @param id a game id
    /// @param tag a tag to remove
    /// @return true if the game exists
    public synchronized boolean removeTag(String id, String tag) {
        CatalogEntry existing = id == null ? null : games.get(id);
        if (existing == null) {
            return false;
        }
        List<String> tags = new ArrayList<>(existing.tags());
        if (tag != null && tags.remove(tag.trim())) {
            games.put(id, withTags(existing, tags));
            persist();
        }
        return true;
    }

    /// @return every tag used by any game, sorted and without duplicates
    public synchronized List<String> getAllTags() {
        TreeSet<String> tags = new TreeSet<>();
        games.values().forEach(g -> tags.addAll(g.tags()));
        return List.copyOf(tags);
    }

    /// Remove a game and delete its file or directory from disk. A failure to delete the
    /// files is logged and the entry is still removed.
    /// @param id a game id
    /// @return true if the game was in the library
    public synchronized boolean deleteGame(String id) {
        CatalogEntry removed = id == null ? null : games.remove(id);
        if (removed == null) {
            return false;
        }
        try {
            deleteRecursively(removed.filePath());
        } catch (IOException e) {
            logger.error("Failed to delete files for '{}' at {}: {}", removed.name(), removed.filePath(),
                e.getMessage());
        }
        persist();
        logger.info("Removed '{}' from the library", removed.name());
        return true;
    }

    /// @return the JSON file backing this library
    public Path libraryFile() {
        return libraryFile;
    }

    private static void deleteRecursively(Path path) throws IOException {
        if (!Files.exists(path)) {
            return;
        }
        if (Files.isDirectory(path)) {
            try (Stream<Path> walk = Files.walk(path)) {
                for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                    Files.delete(p);
                }
            }
        } else {
            Files.delete(path);
        }
    }

    private static CatalogEntry withTags(CatalogEntry entry, List<String> tags) {
        return new CatalogEntry(entry.id(), entry.name(), entry.platform(), entry.filePath(),
            entry.sourceDownloadDir(), entry.addedAt(), tags, entry.metadata());
    }

    private static String newId() {
        return Long.toString(System.currentTimeMillis(), 36) + String.format("%06x", random.nextInt(0x1000000));
    }

    private record LibraryDocument(List<GameRecord> games) {
    }
}
