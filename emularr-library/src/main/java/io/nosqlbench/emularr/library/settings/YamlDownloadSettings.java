package io.nosqlbench.emularr.library.settings;

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

import io.nosqlbench.emularr.downloader.api.DownloadSettings;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.snakeyaml.engine.v2.api.Dump;
import org.snakeyaml.engine.v2.api.DumpSettings;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;
import org.snakeyaml.engine.v2.common.FlowStyle;
import org.snakeyaml.engine.v2.exceptions.YamlEngineException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/// Download settings stored in {@code settings.yaml} under a config directory,
/// {@code ~/.config/emularr} by default.
///
/// Recognized keys are {@code downloadPath}, {@code downloadThreads},
/// {@code maxConcurrentDownloads}, {@code defaultPlatform} and {@code autoStartDownloads}.
/// A missing file yields the defaults. Values of the wrong type or out of range are
/// replaced by their defaults with a warning; unknown keys are ignored.
public class YamlDownloadSettings implements DownloadSettings {
    private static final Logger logger = LogManager.getLogger(YamlDownloadSettings.class);

    /// The settings file name inside the config directory
    public static final String FILE_NAME = "settings.yaml";
    /// The config directory used when none is given
    public static final String DEFAULT_CONFIG_DIR = "~/.config/emularr";
    /// Default number of downloads run side by side
    public static final int DEFAULT_MAX_CONCURRENT_DOWNLOADS = 3;

    public static final String KEY_DOWNLOAD_PATH = "downloadPath";
    public static final String KEY_DOWNLOAD_THREADS = "downloadThreads";
    public static final String KEY_MAX_CONCURRENT = "maxConcurrentDownloads";
    public static final String KEY_DEFAULT_PLATFORM = "defaultPlatform";
    public static final String KEY_AUTO_START = "autoStartDownloads";

    private final Path configDir;
    private volatile Path downloadPath;
    private volatile int downloadThreads;
    private volatile int maxConcurrentDownloads;
    private volatile String defaultPlatform;
    private volatile boolean autoStartDownloads;

    private YamlDownloadSettings(Path configDir) {
        this.configDir = configDir;
        this.downloadPath = defaultDownloadPath();
        this.downloadThreads = DEFAULT_CHUNK_THREADS;
        this.maxConcurrentDownloads = DEFAULT_MAX_CONCURRENT_DOWNLOADS;
        this.defaultPlatform = null;
        this.autoStartDownloads = true;
    }

    /// Load settings from {@code ~/.config/emularr/settings.yaml}.
    /// @return the settings, defaults where the file is silent
    public static YamlDownloadSettings load() {
        return load(Path.of(expandTilde(DEFAULT_CONFIG_DIR)));
    }

    /// Load settings from a config directory.
    /// @param configDir the directory holding {@code settings.yaml}; a leading {@code ~} is expanded
    /// @return the settings, defaults where the file is silent
    /// @throws SettingsException if the file exists but cannot be read or parsed
    public static YamlDownloadSettings load(Path configDir) {
        Path dir = Path.of(expandTilde(configDir.toString()));
        YamlDownloadSettings settings = new YamlDownloadSettings(dir);
        Path file = settings.settingsFile();
        if (!Files.exists(file)) {
            logger.debug("No settings at {}, using defaults", file);
            return settings;
        }
        Object loaded;
        try {
            LoadSettings loadSettings = LoadSettings.builder().build();
            Load yaml = new Load(loadSettings);
            loaded = yaml.loadFromString(Files.readString(file));
        } catch (IOException e) {
            throw new SettingsException("Failed to read settings file: " + file, e);
        } catch (YamlEngineException e) {
            throw new SettingsException("Invalid YAML in settings file: " + file, e);
        }
        if (loaded == null) {
            return settings;
        }
        if (loaded instanceof Map<?, ?> map) {
            settings.apply(map);
        } else {
            throw new SettingsException(FILE_NAME + " must be a map of setting names to values: " + file);
        }
        logger.debug("Loaded settings from {}", file);
        return settings;
    }

    /// Settings with every value at its default, bound to a config directory for {@link #save()}.
    /// @param configDir the directory {@code settings.yaml} is saved to
    /// @return default settings
    public static YamlDownloadSettings defaults(Path configDir) {
        return new YamlDownloadSettings(Path.of(expandTilde(configDir.toString())));
    }

    private void apply(Map<?, ?> values) {
        for (Map.Entry<?, ?> entry : values.entrySet()) {
            String key = String.valueOf(entry.getKey());
            Object value = entry.getValue();
            switch (key) {
                case KEY_DOWNLOAD_PATH -> {
                    if (value instanceof String s && !s.isBlank()) {
                        downloadPath = Path.of(expandTilde(s.trim()));
                    } else {
                        warnInvalid(key, value, downloadPath);
                    }
                }
                case KEY_DOWNLOAD_THREADS -> downloadThreads = positiveInt(key, value, DEFAULT_CHUNK_THREADS);
                case KEY_MAX_CONCURRENT ->
                    maxConcurrentDownloads = positiveInt(key, value, DEFAULT_MAX_CONCURRENT_DOWNLOADS);
                case KEY_DEFAULT_PLATFORM -> {
                    if (value == null || value instanceof String) {
                        String platform = (String) value;
                        defaultPlatform = platform == null || platform.isBlank() ? null : platform.trim();
                    } else {
                        warnInvalid(key, value, null);
                    }
                }
                case KEY_AUTO_START -> {
                    if (value instanceof Boolean b) {
                        autoStartDownloads = b;
                    } else {
                        warnInvalid(key, value, true);
                    }
                }
                default -> logger.debug("Ignoring unknown setting '{}'", key);
            }
        }
    }

    private static int positiveInt(String key, Object value, int fallback) {
        if (value instanceof Number number && number.longValue() > 0 && number.longValue() <= Integer.MAX_VALUE) {
            return number.intValue();
        }
        if (value instanceof String s) {
            try {
                int parsed = Integer.parseInt(s.trim());
                if (parsed > 0) {
                    return parsed;
                }
            } catch (NumberFormatException ignored) {
                // reported below
            }
        }
        warnInvalid(key, value, fallback);
        return fallback;
    }

    private static void warnInvalid(String key, Object value, Object fallback) {
        logger.warn("Invalid value '{}' for setting '{}', using {}", value, key, fallback);
    }

    /// Write the current values to {@code settings.yaml}, creating the config directory if needed.
    /// @throws SettingsException if the file cannot be written
    public void save() {
        Path file = settingsFile();
        DumpSettings dumpSettings = DumpSettings.builder()
            .setDefaultFlowStyle(FlowStyle.BLOCK)
            .build();
        Dump dump = new Dump(dumpSettings);
        try {
            Files.createDirectories(configDir);
            Files.writeString(file, dump.dumpToString(toMap()));
        } catch (IOException e) {
            throw new SettingsException("Failed to write settings file: " + file, e);
        }
        logger.info("Saved settings to {}", file);
    }

    /// @return the values as they would be written to YAML, in a stable key order
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(KEY_DOWNLOAD_PATH, downloadPath.toString());
        map.put(KEY_DOWNLOAD_THREADS, downloadThreads);
        map.put(KEY_MAX_CONCURRENT, maxConcurrentDownloads);
        if (defaultPlatform != null) {
            map.put(KEY_DEFAULT_PLATFORM, defaultPlatform);
        }
        map.put(KEY_AUTO_START, autoStartDownloads);
        return map;
    }

    @Override
    public Path destinationDirectory() {
        return downloadPath;
    }

    @Override
    public int chunkThreadCount() {
        return downloadThreads;
    }

    /// @return the config directory
    public Path configDir() {
        return configDir;
    }

    /// @return the settings file path, whether or not it exists
    public Path settingsFile() {
        return configDir.resolve(FILE_NAME);
    }

    public int maxConcurrentDownloads() {
        return maxConcurrentDownloads;
    }

    public Optional<String> defaultPlatform() {
        return Optional.ofNullable(defaultPlatform);
    }

    public boolean autoStartDownloads() {
        return autoStartDownloads;
    }

    /// @param downloadPath the new download directory; a leading {@code ~} is expanded
    public void setDownloadPath(Path downloadPath) {
        if (downloadPath == null) {
            throw new IllegalArgumentException("downloadPath must not be null");
        }
        this.downloadPath = Path.of(expandTilde(downloadPath.toString()));
    }

    /// @param downloadThreads chunks per ranged transfer, must be positive
    public void setDownloadThreads(int downloadThreads) {
        if (downloadThreads < 1) {
            throw new IllegalArgumentException("downloadThreads must be positive, got " + downloadThreads);
        }
        this.downloadThreads = downloadThreads;
    }

    /// @param maxConcurrentDownloads downloads run side by side, must be positive
    public void setMaxConcurrentDownloads(int maxConcurrentDownloads) {
        if (maxConcurrentDownloads < 1) {
            throw new IllegalArgumentException(
                "maxConcurrentDownloads must be positive, got " + maxConcurrentDownloads);
        }
        this.maxConcurrentDownloads = maxConcurrentDownloads;
    }

    /// @param defaultPlatform the platform applied when a download names none, null to clear
    public void setDefaultPlatform(String defaultPlatform) {
        this.defaultPlatform = defaultPlatform == null || defaultPlatform.isBlank() ? null : defaultPlatform.trim();
    }

    public void setAutoStartDownloads(boolean autoStartDownloads) {
        this.autoStartDownloads = autoStartDownloads;
    }

    /// @return {@code ~/Documents/Emularr/Games} under the current user's home
    public static Path defaultDownloadPath() {
        return Path.of(System.getProperty("user.home"), "Documents", "Emularr", "Games");
    }

    /// Replace a leading {@code ~} with the user's home directory.
    /// @param path a path string
    /// @return the expanded path string
    public static String expandTilde(String path) {
        if (path.equals("~")) {
            return System.getProperty("user.home");
        }
        if (path.startsWith("~/") || path.startsWith("~\\")) {
            return System.getProperty("user.home") + path.substring(1);
        }
        return path;
    }

    @Override
    public String toString() {
        return "YamlDownloadSettings" + toMap();
    }
}
