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

import io.nosqlbench.emularr.downloader.TaskSnapshot;

import java.util.Locale;
import java.util.OptionalDouble;

/// Human readable renderings of task progress for the console.
public final class ProgressFormat {

    private static final String[] UNITS = {"B", "KiB", "MiB", "GiB", "TiB"};

    private ProgressFormat() {
    }

    /// @param bytes a byte count
    /// @return the count in binary units, one decimal above bytes
    public static String bytes(long bytes) {
        if (bytes < 1024) {
            return bytes + " B";
        }
        double value = bytes;
        int unit = 0;
        while (value >= 1024 && unit < UNITS.length - 1) {
            value /= 1024;
            unit++;
        }
        return String.format(Locale.ROOT, "%.1f %s", value, UNITS[unit]);
    }

    /// @param bytesPerSecond a transfer rate
    /// @return the rate in binary units per second
    public static String rate(double bytesPerSecond) {
        return bytes(Math.round(Math.max(0d, bytesPerSecond))) + "/s";
    }

    /// @param etaSeconds remaining seconds, if known
    /// @return {@code h:mm:ss}, {@code m:ss}, or {@code --:--} when unknown
    public static String eta(OptionalDouble etaSeconds) {
        if (etaSeconds.isEmpty()) {
            return "--:--";
        }
        long total = (long) Math.ceil(etaSeconds.getAsDouble());
        long hours = total / 3600;
        long minutes = (total % 3600) / 60;
        long seconds = total % 60;
        return hours > 0
            ? String.format(Locale.ROOT, "%d:%02d:%02d", hours, minutes, seconds)
            : String.format(Locale.ROOT, "%d:%02d", minutes, seconds);
    }

    /// @param snapshot a task snapshot
    /// @return a one-line status such as {@code [ 42%] Game  1.2 MiB of 3.0 MiB  512.0 KiB/s  ETA 0:04}
    public static String line(TaskSnapshot snapshot) {
        StringBuilder sb = new StringBuilder();
        int percent = snapshot.percent();
        sb.append(percent < 0 ? "[ ?? ]" : String.format(Locale.ROOT, "[%3d%%]", percent));
        sb.append(' ').append(snapshot.displayName());
        sb.append("  ").append(bytes(snapshot.downloadedBytes()));
        if (snapshot.totalBytes() > 0) {
            sb.append(" of ").append(bytes(snapshot.totalBytes()));
        }
        sb.append("  ").append(rate(snapshot.bytesPerSecond()));
        sb.append("  ETA ").append(eta(snapshot.etaSeconds()));
        sb.append("  ").append(snapshot.status());
        return sb.toString();
    }
}
