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

import io.nosqlbench.emularr.library.catalog.JsonGameLibrary;
import io.nosqlbench.emularr.library.settings.YamlDownloadSettings;
import picocli.CommandLine;

import java.nio.file.Path;

/// The {@code --config-dir} option shared by the library subcommands
public class LibraryLocation {

    @CommandLine.Option(names = {"--config-dir"},
        description = "The directory holding games.json",
        defaultValue = YamlDownloadSettings.DEFAULT_CONFIG_DIR)
    private Path configDir;

    /// @return the library stored in the configured directory
    public JsonGameLibrary open() {
        return JsonGameLibrary.inConfigDir(Path.of(YamlDownloadSettings.expandTilde(configDir.toString())));
    }
}
