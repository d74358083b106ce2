package io.nosqlbench.emularr.commands.download;

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

import io.nosqlbench.emularr.downloader.GameMetadata;
import io.nosqlbench.emularr.downloader.TaskRegistry;
import io.nosqlbench.emularr.downloader.TaskSnapshot;
import io.nosqlbench.emularr.downloader.TransferController;
import io.nosqlbench.emularr.downloader.TransferStatus;
import io.nosqlbench.emularr.downloader.TransferStrategyHint;
import io.nosqlbench.emularr.downloader.api.ArchiveExtractor;
import io.nosqlbench.emularr.downloader.api.CatalogException;
import io.nosqlbench.emularr.downloader.api.DownloadSettings;
import io.nosqlbench.emularr.library.archive.CompressArchiveExtractor;
import io.nosqlbench.emularr.library.catalog.JsonGameLibrary;
import io.nosqlbench.emularr.library.settings.SettingsException;
import io.nosqlbench.emularr.library.settings.YamlDownloadSettings;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.net.MalformedURLException;
import java.net.URL;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

/// Download a game, unpack it if it is an archive, and add it to the library
@CommandLine.Command(name = "download",
    header = "Download a game into the library",
    description = "Download a file over HTTP(S), in parallel chunks when the server allows it, "
        + "then unpack archives and record the result in the game library",
    exitCodeList = {"0: success", "1: download failed or was cancelled", "2: invalid arguments"})
public class CMD_download implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_download.class);

    @CommandLine.Parameters(index = "0", description = "The http or https URL to download")
    private String url;

    @CommandLine.Option(names = {"--name", "-n"}, description = "The game's display name")
    private String name;

    @CommandLine.Option(names = {"--platform", "-p"},
        description = "The platform label, defaults to defaultPlatform from the settings")
    private String platform;

    @CommandLine.Option(names = {"--dir", "-d"},
        description = "The download directory, defaults to downloadPath from the settings")
    private Path dir;

    @CommandLine.Option(names = {"--threads", "-t"},
        description = "Chunks per download, defaults to downloadThreads from the settings")
    private Integer threads;

    @CommandLine.Option(names = {"--single-stream"}, description = "Never split the download into chunks")
    private boolean singleStream = false;

    @CommandLine.Option(names = {"--no-extract"}, description = "Keep archives as downloaded")
    private boolean noExtract = false;

    @CommandLine.Option(names = {"--config-dir"},
        description = "The directory holding settings.yaml and games.json",
        defaultValue = YamlDownloadSettings.DEFAULT_CONFIG_DIR)
    private Path configDir;

    @CommandLine.Option(names = {"--poll-ms"}, description = "Milliseconds between progress updates",
        defaultValue = "500", hidden = true)
    private long pollMillis;

    @Override
    public Integer call() {
        URL source;
        try {
            source = new URL(url);
        } catch (MalformedURLException e) {
            System.err.println("Invalid URL '" + url + "': " + e.getMessage());
            return 2;
        }
        if (threads != null && threads < 1) {
            System.err.println("--threads must be positive, got " + threads);
            return 2;
        }

        YamlDownloadSettings settings;
        JsonGameLibrary library;
        try {
            settings = YamlDownloadSettings.load(configDir);
            library = JsonGameLibrary.inConfigDir(settings.configDir());
        } catch (SettingsException | CatalogException e) {
            System.err.println(e.getMessage());
            return 1;
        }
        DownloadSettings effective = DownloadSettings.of(
            dir != null ? Path.of(YamlDownloadSettings.expandTilde(dir.toString())) : settings.destinationDirectory(),
            threads != null ? threads : settings.chunkThreadCount());
        ArchiveExtractor extractor = noExtract ? ArchiveExtractor.none() : new CompressArchiveExtractor();
        GameMetadata metadata = new GameMetadata(name,
            platform != null ? platform : settings.defaultPlatform().orElse(null), Map.of());
        TransferStrategyHint hint = singleStream ? TransferStrategyHint.SINGLE_STREAM : TransferStrategyHint.AUTO;

        try (TransferController controller = new TransferController(new TaskRegistry(), effective, extractor, library)) {
            String id;
            try {
                id = controller.startDownload(source, hint, metadata);
            } catch (IllegalArgumentException e) {
                System.err.println(e.getMessage());
                return 2;
            }
            Thread cancelOnExit = new Thread(() -> controller.cancel(id), "emularr-cancel");
            Runtime.getRuntime().addShutdownHook(cancelOnExit);
            try {
                return awaitCompletion(controller, id);
            } finally {
                try {
                    Runtime.getRuntime().removeShutdownHook(cancelOnExit);
                } catch (IllegalStateException e) {
                    logger.debug("Shutdown already in progress, download {} is being cancelled", id);
                }
            }
        }
    }

    private int awaitCompletion(TransferController controller, String id) {
        boolean console = System.console() != null;
        String lastLine = null;
        while (true) {
            TaskSnapshot snapshot = controller.getProgress(id);
            if (snapshot == null || snapshot.status() == TransferStatus.CANCELLED) {
                finishLine(console);
                System.err.println("Download cancelled");
                return 1;
            }
            String line = ProgressFormat.line(snapshot);
            if (console) {
                System.out.print("\r" + line);
            } else if (!line.equals(lastLine)) {
                System.out.println(line);
            }
            lastLine = line;

            if (snapshot.status() == TransferStatus.ERROR) {
                finishLine(console);
                System.err.println("Download failed: " + snapshot.errorDetail().orElse("unknown error"));
                return 1;
            }
            if (snapshot.status() == TransferStatus.COMPLETED && snapshot.resolvedPath().isPresent()) {
                finishLine(console);
                System.out.println("Saved " + snapshot.displayName() + " to " + snapshot.resolvedPath().get());
                return 0;
            }
            try {
                Thread.sleep(pollMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                controller.cancel(id);
                finishLine(console);
                System.err.println("Interrupted, download cancelled");
                return 1;
            }
        }
    }

    private static void finishLine(boolean console) {
        if (console) {
            System.out.println();
        }
    }
}
