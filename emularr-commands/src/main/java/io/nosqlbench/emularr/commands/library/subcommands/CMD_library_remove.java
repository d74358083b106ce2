package io.nosqlbench.emularr.commands.library.subcommands;

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

import io.nosqlbench.emularr.commands.library.LibraryLocation;
import io.nosqlbench.emularr.downloader.api.CatalogEntry;
import io.nosqlbench.emularr.downloader.api.CatalogException;
import io.nosqlbench.emularr.library.catalog.JsonGameLibrary;
import picocli.CommandLine;

import java.util.Optional;
import java.util.concurrent.Callable;

/// Remove a game from the library and delete its files
@CommandLine.Command(name = "remove",
    header = "Remove a game from the library and delete its files",
    exitCodeList = {"0: success", "1: unknown game or library error"})
public class CMD_library_remove implements Callable<Integer> {

    @CommandLine.Mixin
    private LibraryLocation location;

    @CommandLine.Parameters(index = "0", description = "The game id")
    private String id;

    @Override
    public Integer call() {
        try {
            JsonGameLibrary library = location.open();
            Optional<CatalogEntry> game = library.findGame(id);
            if (game.isEmpty() || !library.deleteGame(id)) {
                System.err.println("No game with id " + id);
                return 1;
            }
            System.out.println("Removed " + game.get().name() + " and deleted " + game.get().filePath());
            return 0;
        } catch (CatalogException e) {
            System.err.println(e.getMessage());
            return 1;
        }
    }
}
