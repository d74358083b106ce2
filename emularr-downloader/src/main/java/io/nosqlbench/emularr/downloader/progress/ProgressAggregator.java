package io.nosqlbench.emularr.downloader.progress;

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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.OptionalDouble;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/// Samples the bytes written by active transfers at a fixed interval and derives throughput
/// and remaining time from consecutive samples.
///
/// All tracked transfers share the scheduler passed in. A tracking stops itself on the first
/// tick after its target left the transferring state.
public class ProgressAggregator {
    private static final Logger logger = LogManager.getLogger(ProgressAggregator.class);

    private final ScheduledExecutorService scheduler;
    private final Duration interval;
    private final LongSupplier nanoClock;

    /// @param scheduler the shared scheduler sampling runs on
    /// @param interval the sampling interval
    public ProgressAggregator(ScheduledExecutorService scheduler, Duration interval) {
        this(scheduler, interval, System::nanoTime);
    }

    ProgressAggregator(ScheduledExecutorService scheduler, Duration interval, LongSupplier nanoClock) {
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("sampling interval must be positive, got " + interval);
        }
        this.scheduler = scheduler;
        this.interval = interval;
        this.nanoClock = nanoClock;
    }

    /// Start sampling a target.
    /// @param target the transfer to publish samples to
    /// @param bytesOnDisk reads the current number of downloaded bytes
    /// @return the tracking handle
    public Tracking track(ProgressTarget target, LongSupplier bytesOnDisk) {
        Tracking tracking = new Tracking(target, bytesOnDisk, nanoClock);
        long millis = interval.toMillis();
        tracking.future = scheduler.scheduleAtFixedRate(tracking::tick, millis, millis, TimeUnit.MILLISECONDS);
        return tracking;
    }

    /// The sampling state of one tracked transfer.
    public static final class Tracking {
        private final ProgressTarget target;
        private final LongSupplier bytesOnDisk;
        private final LongSupplier nanoClock;
        private volatile ScheduledFuture<?> future;
        private long lastBytes;
        private long lastNanos;

        Tracking(ProgressTarget target, LongSupplier bytesOnDisk, LongSupplier nanoClock) {
            this.target = target;
            this.bytesOnDisk = bytesOnDisk;
            this.nanoClock = nanoClock;
            this.lastBytes = bytesOnDisk.getAsLong();
            this.lastNanos = nanoClock.getAsLong();
        }

        void tick() {
            if (!target.isTransferring()) {
                stop();
                return;
            }
            try {
                sample();
            } catch (RuntimeException e) {
                // an exception would silently end the periodic schedule
                logger.warn("Progress sample failed: {}", e.toString());
            }
        }

        /// Take one sample now and publish it to the target.
        public synchronized void sample() {
            long now = nanoClock.getAsLong();
            long bytes = bytesOnDisk.getAsLong();
            double elapsedSeconds = (now - lastNanos) / 1_000_000_000.0d;
            double bytesPerSecond = 0.0d;
            if (elapsedSeconds > 0) {
                bytesPerSecond = Math.max(0L, bytes - lastBytes) / elapsedSeconds;
            }
            long total = target.totalBytes();
            OptionalDouble eta = OptionalDouble.empty();
            if (total > 0 && bytesPerSecond > 0) {
                eta = OptionalDouble.of(Math.max(0L, total - bytes) / bytesPerSecond);
            }
            lastBytes = bytes;
            lastNanos = now;
            target.recordProgress(bytes, bytesPerSecond, eta);
        }

        /// Stop periodic sampling. Idempotent.
        public void stop() {
            ScheduledFuture<?> scheduled = future;
            if (scheduled != null) {
                scheduled.cancel(false);
            }
        }

        /// @return true once sampling was stopped
        public boolean isStopped() {
            ScheduledFuture<?> scheduled = future;
            return scheduled != null && scheduled.isCancelled();
        }
    }
}
