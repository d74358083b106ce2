package io.nosqlbench.emularr.commands.config.subcommands;

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

import io.nosqlbench.emularr.library.settings.SettingsException;
import io.nosqlbench.emularr.library.settings.YamlDownloadSettings;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/// Print the effective download settings
@CommandLine.Command(name = "show", header = "Print the effective download settings")
public class CMD_config_show implements Callable<Integer> {

    @CommandLine.Option(names = {"--config-dir"},
        description = "The directory holding settings.yaml",
        defaultValue = YamlDownloadSettings.DEFAULT_CONFIG_DIR)
    private Path configDir;

    @Override
    public Integer call() {
        YamlDownloadSettings settings;
        try {
            settings = YamlDownloadSettings.load(configDir);
        } catch (SettingsException e) {
            System.err.println(e.getMessage());
            return 1;
        }
        System.out.println("# " + settings.settingsFile());
        settings.toMap().forEach((key, value) -> System.out.println(key + ": " + value));
        return 0;
    }
}
