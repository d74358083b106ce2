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
import java.util.Locale;
import java.util.concurrent.Callable;

/// Change one download setting and save it
@CommandLine.Command(name = "set",
    header = "Change one download setting and save it",
    description = "Keys: downloadPath, downloadThreads, maxConcurrentDownloads, defaultPlatform, autoStartDownloads",
    exitCodeList = {"0: success", "1: settings file error", "2: unknown key or invalid value"})
public class CMD_config_set implements Callable<Integer> {

    @CommandLine.Option(names = {"--config-dir"},
        description = "The directory holding settings.yaml",
        defaultValue = YamlDownloadSettings.DEFAULT_CONFIG_DIR)
    private Path configDir;

    @CommandLine.Parameters(index = "0", description = "The setting name")
    private String key;

    @CommandLine.Parameters(index = "1", description = "The new value, or an empty string to clear defaultPlatform")
    private String value;

    @Override
    public Integer call() {
        YamlDownloadSettings settings;
        try {
            settings = YamlDownloadSettings.load(configDir);
        } catch (SettingsException e) {
            System.err.println(e.getMessage());
            return 1;
        }
        try {
            switch (key) {
                case YamlDownloadSettings.KEY_DOWNLOAD_PATH -> settings.setDownloadPath(Path.of(value));
                case YamlDownloadSettings.KEY_DOWNLOAD_THREADS -> settings.setDownloadThreads(Integer.parseInt(value));
                case YamlDownloadSettings.KEY_MAX_CONCURRENT ->
                    settings.setMaxConcurrentDownloads(Integer.parseInt(value));
                case YamlDownloadSettings.KEY_DEFAULT_PLATFORM -> settings.setDefaultPlatform(value);
                case YamlDownloadSettings.KEY_AUTO_START -> settings.setAutoStartDownloads(parseBoolean(value));
                default -> {
                    System.err.println("Unknown setting '" + key + "'");
                    return 2;
                }
            }
        } catch (IllegalArgumentException e) {
            System.err.println("Invalid value '" + value + "' for " + key + ": " + e.getMessage());
            return 2;
        }
        try {
            settings.save();
        } catch (SettingsException e) {
            System.err.println(e.getMessage());
            return 1;
        }
        System.out.println(key + " = " + settings.toMap().getOrDefault(key, ""));
        return 0;
    }

    private static boolean parseBoolean(String text) {
        return switch (text.toLowerCase(Locale.ROOT)) {
            case "true", "yes", "on" -> true;
            case "false", "no", "off" -> false;
            default -> throw new IllegalArgumentException("expected true or false");
        };
    }
}
