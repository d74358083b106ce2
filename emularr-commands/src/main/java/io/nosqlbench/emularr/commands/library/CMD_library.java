package io.nosqlbench.emularr.commands.library;

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

import io.nosqlbench.emularr.commands.library.subcommands.CMD_library_list;
import io.nosqlbench.emularr.commands.library.subcommands.CMD_library_remove;
import io.nosqlbench.emularr.commands.library.subcommands.CMD_library_tag;
import io.nosqlbench.emularr.commands.library.subcommands.CMD_library_tags;
import io.nosqlbench.emularr.commands.library.subcommands.CMD_library_untag;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/// Inspect and edit the local game library
@CommandLine.Command(name = "library",
    header = "Inspect and edit the local game library",
    description = "Contains subcommands to list, tag and remove downloaded games",
    subcommands = {
        CMD_library_list.class,
        CMD_library_tags.class,
        CMD_library_tag.class,
        CMD_library_untag.class,
        CMD_library_remove.class,
        CommandLine.HelpCommand.class
    })
public class CMD_library implements Callable<Integer> {

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }
}
