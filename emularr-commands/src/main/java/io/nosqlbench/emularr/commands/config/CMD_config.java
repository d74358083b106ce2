package io.nosqlbench.emularr.commands.config;

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

import io.nosqlbench.emularr.commands.config.subcommands.CMD_config_set;
import io.nosqlbench.emularr.commands.config.subcommands.CMD_config_show;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/// Show and change download settings
@CommandLine.Command(name = "config",
    header = "Show and change download settings",
    description = "Reads and writes settings.yaml in the config directory",
    subcommands = {
        CMD_config_show.class,
        CMD_config_set.class,
        CommandLine.HelpCommand.class
    })
public class CMD_config implements Callable<Integer> {

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }
}
