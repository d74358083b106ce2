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
import picocli.CommandLine;

import java.util.List;
import java.util.concurrent.Callable;

/// List every tag used in the library
@CommandLine.Command(name = "tags", header = "List every tag used in the library")
public class CMD_library_tags implements Callable<Integer> {

    @CommandLine.Mixin
    private LibraryLocation location;

    @Override
    public Integer call() {
        List<String> tags;
        try {
            tags = location.open().getAllTags();
        } catch (CatalogException e) {
            System.err.println(e.getMessage());
            return 1;
        }
        tags.forEach(System.out::println);
        return 0;
    }
}
