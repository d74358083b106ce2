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
import picocli.CommandLine;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/// List the games in the library
@CommandLine.Command(name = "list",
    header = "List the games in the library",
    exitCodeList = {"0: success", "1: error"})
public class CMD_library_list implements Callable<Integer> {

    @CommandLine.Mixin
    private LibraryLocation location;

    @CommandLine.Option(names = {"--tag"}, description = "Only games carrying this tag")
    private String tag;

    @CommandLine.Option(names = {"--platform", "-p"}, description = "Only games for this platform")
    private String platform;

    @Override
    public Integer call() {
        List<CatalogEntry> games;
        try {
            games = location.open().getGames().stream()
                .filter(g -> tag == null || g.tags().contains(tag))
                .filter(g -> platform == null || platform.equalsIgnoreCase(g.platform()))
                .collect(Collectors.toList());
        } catch (CatalogException e) {
            System.err.println(e.getMessage());
            return 1;
        }
        if (games.isEmpty()) {
            System.out.println("No games found");
            return 0;
        }
        for (CatalogEntry game : games) {
            System.out.printf("%s  %s  [%s]  %s%s%n",
                game.id(),
                game.name(),
                game.platform() == null ? "unknown" : game.platform(),
                game.filePath(),
                game.tags().isEmpty() ? "" : "  tags: " + String.join(", ", game.tags()));
        }
        return 0;
    }
}
