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
import io.nosqlbench.emularr.downloader.TaskSnapshot;
import io.nosqlbench.emularr.downloader.TransferStatus;
import io.nosqlbench.emularr.downloader.TransferStrategy;
import org.junit.jupiter.api.Test;

import java.net.MalformedURLException;
import java.net.URL;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

import static org.assertj.core.api.Assertions.assertThat;

public class ProgressFormatTest {

    @Test
    void testBytes() {
        assertThat(ProgressFormat.bytes(0)).isEqualTo("0 B");
        assertThat(ProgressFormat.bytes(1023)).isEqualTo("1023 B");
        assertThat(ProgressFormat.bytes(1536)).isEqualTo("1.5 KiB");
        assertThat(ProgressFormat.bytes(800_000_000L)).isEqualTo("762.9 MiB");
    }

    @Test
    void testEta() {
        assertThat(ProgressFormat.eta(OptionalDouble.empty())).isEqualTo("--:--");
        assertThat(ProgressFormat.eta(OptionalDouble.of(4.2))).isEqualTo("0:05");
        assertThat(ProgressFormat.eta(OptionalDouble.of(3725))).isEqualTo("1:02:05");
    }

    @Test
    void testLineForKnownAndUnknownLength() throws MalformedURLException {
        TaskSnapshot known = snapshot(1000, 420, OptionalDouble.of(0.42), OptionalDouble.of(2));
        assertThat(ProgressFormat.line(known))
            .startsWith("[ 42%] Zelda  420 B of 1000 B")
            .contains("ETA 0:02")
            .endsWith("DOWNLOADING");

        TaskSnapshot unknown = snapshot(0, 2048, OptionalDouble.empty(), OptionalDouble.empty());
        assertThat(ProgressFormat.line(unknown))
            .startsWith("[ ?? ] Zelda  2.0 KiB  ")
            .contains("ETA --:--");
    }

    private static TaskSnapshot snapshot(long total, long downloaded, OptionalDouble fraction, OptionalDouble eta)
        throws MalformedURLException {
        return new TaskSnapshot("id", new URL("http://example.test/zelda.zip"), Path.of("games"),
            Path.of("games/zelda.zip"), GameMetadata.of("Zelda", "n64"), TransferStatus.DOWNLOADING,
            new TransferStrategy.SingleStream(), total, downloaded, fraction, 210, eta, Optional.empty(),
            Optional.empty(), List.of(), Instant.now());
    }
}
