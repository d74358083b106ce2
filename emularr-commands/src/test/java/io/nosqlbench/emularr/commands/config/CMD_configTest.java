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

import io.nosqlbench.emularr.commands.CMD_emularr;
import io.nosqlbench.emularr.library.settings.YamlDownloadSettings;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class CMD_configTest {

    @TempDir
    Path configDir;

    private int run(ByteArrayOutputStream out, String... args) {
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(new PrintStream(out));
        System.setErr(new PrintStream(new ByteArrayOutputStream()));
        try {
            return CMD_emularr.commandLine().execute(args);
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    @Test
    public void testSetPersistsAndShowReports() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        assertEquals(0, run(out, "config", "set", "downloadThreads", "4", "--config-dir", configDir.toString()));
        assertEquals(0, run(out, "config", "set", "defaultPlatform", "gba", "--config-dir", configDir.toString()));
        assertEquals(0, run(out, "config", "set", "autoStartDownloads", "no", "--config-dir", configDir.toString()));

        YamlDownloadSettings settings = YamlDownloadSettings.load(configDir);
        assertEquals(4, settings.chunkThreadCount());
        assertEquals("gba", settings.defaultPlatform().orElseThrow());
        assertFalse(settings.autoStartDownloads());

        ByteArrayOutputStream shown = new ByteArrayOutputStream();
        assertEquals(0, run(shown, "config", "show", "--config-dir", configDir.toString()));
        assertTrue(shown.toString().contains("downloadThreads: 4"), shown.toString());
        assertTrue(shown.toString().contains("defaultPlatform: gba"), shown.toString());
    }

    @Test
    public void testRejectsBadInput() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        assertEquals(2, run(out, "config", "set", "colour", "blue", "--config-dir", configDir.toString()));
        assertEquals(2, run(out, "config", "set", "downloadThreads", "0", "--config-dir", configDir.toString()));
        assertEquals(2, run(out, "config", "set", "downloadThreads", "many", "--config-dir", configDir.toString()));
        assertEquals(8, YamlDownloadSettings.load(configDir).chunkThreadCount());
    }
}
