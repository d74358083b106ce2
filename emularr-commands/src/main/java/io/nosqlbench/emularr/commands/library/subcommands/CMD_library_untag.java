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
import io.nosqlbench.emularr.downloader.api.CatalogException;
import io.nosqlbench.emularr.library.catalog.JsonGameLibrary;
import picocli.CommandLine;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/// Remove tags from a game
@CommandLine.Command(name = "untag",
    header = "Remove tags from a game",
    exitCodeList = {"0: success", "1: unknown game or library error"})
public class CMD_library_untag implements Callable<Integer> {

    @CommandLine.Mixin
    private LibraryLocation location;

    @CommandLine.Parameters(index = "0", description = "The game id")
    private String id;

    @CommandLine.Parameters(index = "1..*", arity = "1..*", description = "Tags to remove")
    private List<String> tags = new ArrayList<>();

    @Override
    public Integer call() {
        try {
            JsonGameLibrary library = location.open();
            for (String tag : tags) {
                if (!library.removeTag(id, tag)) {
                    System.err.println("No game with id " + id);
                    return 1;
                }
            }
        } catch (CatalogException e) {
            System.err.println(e.getMessage());
            return 1;
        }
        System.out.println("Removed " + String.join(", ", tags) + " from " + id);
        return 0;
    }
}
