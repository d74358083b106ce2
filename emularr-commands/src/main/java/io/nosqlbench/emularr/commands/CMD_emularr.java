package io.nosqlbench.emularr.commands;

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

import io.nosqlbench.emularr.commands.config.CMD_config;
import io.nosqlbench.emularr.commands.download.CMD_download;
import io.nosqlbench.emularr.commands.library.CMD_library;
import picocli.CommandLine;

/// Download games and manage the local game library
///
/// This is the top level command which serves as the entry point for all sub-commands
@CommandLine.Command(name = "emularr",
    mixinStandardHelpOptions = true,
    version = "emularr 0.1.0",
    subcommands = {
        CommandLine.HelpCommand.class, CMD_download.class, CMD_library.class, CMD_config.class
    })
public class CMD_emularr {

    /// run an emularr command
    /// @param args
    ///     command line args
    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    /// @return the configured command line, shared by {@link #main(String[])} and tests
    public static CommandLine commandLine() {
        return new CommandLine(new CMD_emularr())
            .setCaseInsensitiveEnumValuesAllowed(true)
            .setOptionsCaseInsensitive(true);
    }
}
