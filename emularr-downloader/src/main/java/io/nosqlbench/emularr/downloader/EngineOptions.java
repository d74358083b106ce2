package io.nosqlbench.emularr.downloader;

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

import java.time.Duration;

/// Tuning knobs of the transfer engine.
/// @param sampleInterval how often progress is sampled
/// @param probeTimeout connect and read timeout of capability probes
/// @param readTimeout the longest a single body read may block
/// @param maxChunkAttempts attempts per chunk before the task fails
/// @param retryBackoff delay before the first chunk retry, doubled on each further retry
/// @param bufferSize bytes per read from the network
public record EngineOptions(
    Duration sampleInterval,
    Duration probeTimeout,
    Duration readTimeout,
    int maxChunkAttempts,
    Duration retryBackoff,
    int bufferSize
) {
    public static final Duration DEFAULT_SAMPLE_INTERVAL = Duration.ofMillis(500);
    public static final Duration DEFAULT_PROBE_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_READ_TIMEOUT = Duration.ofMinutes(5);
    public static final int DEFAULT_MAX_CHUNK_ATTEMPTS = 3;
    public static final Duration DEFAULT_RETRY_BACKOFF = Duration.ofSeconds(1);
    public static final int DEFAULT_BUFFER_SIZE = 64 * 1024;

    public EngineOptions {
        requirePositive(sampleInterval, "sampleInterval");
        requirePositive(probeTimeout, "probeTimeout");
        requirePositive(readTimeout, "readTimeout");
        if (retryBackoff == null || retryBackoff.isNegative()) {
            throw new IllegalArgumentException("retryBackoff must not be negative");
        }
        if (maxChunkAttempts < 1) {
            throw new IllegalArgumentException("maxChunkAttempts must be positive, got " + maxChunkAttempts);
        }
        if (bufferSize < 1024) {
            throw new IllegalArgumentException("bufferSize must be at least 1024, got " + bufferSize);
        }
    }

    /// @return the default options
    public static EngineOptions defaults() {
        return new EngineOptions(DEFAULT_SAMPLE_INTERVAL, DEFAULT_PROBE_TIMEOUT, DEFAULT_READ_TIMEOUT,
            DEFAULT_MAX_CHUNK_ATTEMPTS, DEFAULT_RETRY_BACKOFF, DEFAULT_BUFFER_SIZE);
    }

    public EngineOptions withSampleInterval(Duration interval) {
        return new EngineOptions(interval, probeTimeout, readTimeout, maxChunkAttempts, retryBackoff, bufferSize);
    }

    public EngineOptions withProbeTimeout(Duration timeout) {
        return new EngineOptions(sampleInterval, timeout, readTimeout, maxChunkAttempts, retryBackoff, bufferSize);
    }

    public EngineOptions withReadTimeout(Duration timeout) {
        return new EngineOptions(sampleInterval, probeTimeout, timeout, maxChunkAttempts, retryBackoff, bufferSize);
    }

    public EngineOptions withRetries(int attempts, Duration backoff) {
        return new EngineOptions(sampleInterval, probeTimeout, readTimeout, attempts, backoff, bufferSize);
    }

    public EngineOptions withBufferSize(int size) {
        return new EngineOptions(sampleInterval, probeTimeout, readTimeout, maxChunkAttempts, retryBackoff, size);
    }

    private static void requirePositive(Duration duration, String name) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive, got " + duration);
        }
    }
}
