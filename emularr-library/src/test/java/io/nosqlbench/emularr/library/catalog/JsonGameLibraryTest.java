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
import io.nosqlbench.emularr.downloader.api.CatalogEntryRequest;
import io.nosqlbench.emularr.downloader.api.CatalogException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class JsonGameLibraryTest {

    @TempDir
    Path tempDir;

    private CatalogEntry register(JsonGameLibrary library, String name, Path file) {
        return library.registerEntry(new CatalogEntryRequest(name, "snes", file, tempDir,
            Map.of(CatalogEntryRequest.ORIGINAL_FILE_NAME, file.getFileName().toString(),
                CatalogEntryRequest.EXTRACTED, "false")));
    }

    @Test
    void testRegisterPersistsAndReloads() {
        JsonGameLibrary library = JsonGameLibrary.inConfigDir(tempDir.resolve("config"));
        CatalogEntry entry = register(library, "Chrono Trigger", tempDir.resolve("ct.sfc"));

        assertNotNull(entry.id());
        assertTrue(entry.tags().isEmpty());
        assertTrue(Files.isRegularFile(library.libraryFile()));

        JsonGameLibrary reopened = JsonGameLibrary.inConfigDir(tempDir.resolve("config"));
        List<CatalogEntry> games = reopened.getGames();
        assertEquals(1, games.size());
        CatalogEntry loaded = games.get(0);
        assertEquals(entry.id(), loaded.id());
        assertEquals("Chrono Trigger", loaded.name());
        assertEquals("snes", loaded.platform());
        assertEquals(tempDir.resolve("ct.sfc"), loaded.filePath());
        assertEquals(tempDir, loaded.sourceDownloadDir());
        assertEquals(entry.addedAt(), loaded.addedAt());
        assertEquals("ct.sfc", loaded.metadata().get(CatalogEntryRequest.ORIGINAL_FILE_NAME));
    }

    @Test
    void testIdsAreUnique() {
        JsonGameLibrary library = new JsonGameLibrary(tempDir.resolve("games.json"));
        CatalogEntry a = register(library, "A", tempDir.resolve("a.bin"));
        CatalogEntry b = register(library, "B", tempDir.resolve("b.bin"));
        assertNotEquals(a.id(), b.id());
        assertEquals(2, library.getGames().size());
    }

    @Test
    void testTags() {
        JsonGameLibrary library = new JsonGameLibrary(tempDir.resolve("games.json"));
        CatalogEntry a = register(library, "A", tempDir.resolve("a.bin"));
        CatalogEntry b = register(library, "B", tempDir.resolve("b.bin"));

        assertTrue(library.addTag(a.id(), "rpg"));
        assertTrue(library.addTag(a.id(), "rpg"));
        assertTrue(library.addTag(a.id(), "favorite"));
        assertTrue(library.addTag(b.id(), "action"));
        assertFalse(library.addTag("missing", "rpg"));

        assertEquals(List.of("rpg", "favorite"), library.findGame(a.id()).orElseThrow().tags());
        assertEquals(List.of("action", "favorite", "rpg"), library.getAllTags());

        assertTrue(library.removeTag(a.id(), "rpg"));
        assertFalse(library.removeTag("missing", "rpg"));
        assertEquals(List.of("action", "favorite"), library.getAllTags());

        JsonGameLibrary reopened = new JsonGameLibrary(tempDir.resolve("games.json"));
        assertEquals(List.of("favorite"), reopened.findGame(a.id()).orElseThrow().tags());
    }

    @Test
    void testUpdateMergesFields() {
        JsonGameLibrary library = new JsonGameLibrary(tempDir.resolve("games.json"));
        CatalogEntry a = register(library, "A", tempDir.resolve("a.bin"));

        CatalogEntry updated = library.updateGame(a.id(), "Renamed", null, Map.of("region", "USA")).orElseThrow();
        assertEquals("Renamed", updated.name());
        assertEquals("snes", updated.platform());
        assertEquals("USA", updated.metadata().get("region"));
        assertEquals("a.bin", updated.metadata().get(CatalogEntryRequest.ORIGINAL_FILE_NAME));
        assertTrue(library.updateGame("missing", "x", null, null).isEmpty());
    }

    @Test
    void testDeleteRemovesEntryAndFiles() throws IOException {
        JsonGameLibrary library = new JsonGameLibrary(tempDir.resolve("games.json"));
        Path dir = Files.createDirectories(tempDir.resolve("Extracted/disc"));
        Files.writeString(dir.resolve("track.bin"), "data");
        CatalogEntry entry = register(library, "Extracted", tempDir.resolve("Extracted"));

        assertTrue(library.deleteGame(entry.id()));
        assertFalse(Files.exists(tempDir.resolve("Extracted")));
        assertTrue(library.findGame(entry.id()).isEmpty());
        assertFalse(library.deleteGame(entry.id()));
    }

    @Test
    void testDeleteStillRemovesEntryWhenFileIsGone() {
        JsonGameLibrary library = new JsonGameLibrary(tempDir.resolve("games.json"));
        CatalogEntry entry = register(library, "Ghost", tempDir.resolve("never-downloaded.bin"));
        assertTrue(library.deleteGame(entry.id()));
        assertTrue(new JsonGameLibrary(tempDir.resolve("games.json")).getGames().isEmpty());
    }

    @Test
    void testMalformedFileIsReported() throws IOException {
        Path file = Files.writeString(tempDir.resolve("games.json"), "{ not json");
        assertThrows(CatalogException.class, () -> new JsonGameLibrary(file));
    }

    @Test
    void testIncompleteRecordsAreSkipped() throws IOException {
        Path file = Files.writeString(tempDir.resolve("games.json"),
            "{\"games\":[{\"id\":\"x1\",\"name\":\"Kept\",\"filePath\":\"/tmp/k.bin\"},{\"id\":\"x2\"}]}");
        JsonGameLibrary library = new JsonGameLibrary(file);
        assertEquals(1, library.getGames().size());
        assertEquals("Kept", library.findGame("x1").orElseThrow().name());
    }

    @Test
    void testNullPropertiesAndTagsAreDroppedOnLoad() throws IOException {
        Path file = Files.writeString(tempDir.resolve("games.json"),
            "{\"games\":[{\"id\":\"x1\",\"name\":\"Edited\",\"filePath\":\"/tmp/e.bin\","
                + "\"tags\":[\"rpg\",null],\"metadata\":{\"region\":\"PAL\",\"serial\":null}}]}");
        CatalogEntry entry = new JsonGameLibrary(file).findGame("x1").orElseThrow();
        assertEquals(Map.of("region", "PAL"), entry.metadata());
        assertEquals(List.of("rpg"), entry.tags());
    }
}
