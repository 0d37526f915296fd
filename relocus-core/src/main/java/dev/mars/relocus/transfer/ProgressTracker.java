/*
 * Copyright 2026 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.relocus.transfer;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Counts bytes moved through a relayed channel and derives a smoothed throughput.
 * Safe for concurrent updates from the pumping threads.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-07
 * @version 1.0
 */
public class ProgressTracker {
    private final String label;
    private final AtomicLong transferredBytes;
    private final AtomicReference<Instant> startTime;
    private final AtomicReference<Instant> lastRateUpdate;
    private final AtomicLong bytesAtLastRateUpdate;
    private final AtomicReference<Double> currentRate; // bytes per second

    // Don't recompute the rate more often than this
    private static final long RATE_UPDATE_INTERVAL_MS = 1000;

    public ProgressTracker(String label) {
        this.label = label;
        this.transferredBytes = new AtomicLong(0);
        this.startTime = new AtomicReference<>();
        this.lastRateUpdate = new AtomicReference<>();
        this.bytesAtLastRateUpdate = new AtomicLong(0);
        this.currentRate = new AtomicReference<>(0.0);
    }

    public String getLabel() {
        return label;
    }

    public void start() {
        Instant now = Instant.now();
        startTime.compareAndSet(null, now);
        lastRateUpdate.compareAndSet(null, now);
    }

    public void addBytes(long bytes) {
        long total = transferredBytes.addAndGet(bytes);
        updateRate(total, Instant.now());
    }

    public long getTransferredBytes() {
        return transferredBytes.get();
    }

    public double getCurrentRateBytesPerSecond() {
        return currentRate.get();
    }

    public double getAverageRateBytesPerSecond() {
        Instant start = startTime.get();
        if (start == null) {
            return 0.0;
        }
        long elapsedMs = Duration.between(start, Instant.now()).toMillis();
        if (elapsedMs <= 0) {
            return 0.0;
        }
        return (double) transferredBytes.get() / elapsedMs * 1000.0;
    }

    /**
     * @return for example {@code fs: 12.50MB (3.10MB/s)}
     */
    public String describe() {
        return label + ": " + formatBytes(transferredBytes.get()) + " (" + formatBytes((long) currentRate.get().doubleValue()) + "/s)";
    }

    private void updateRate(long currentBytes, Instant now) {
        Instant last = lastRateUpdate.get();
        if (last == null) {
            return;
        }
        long elapsedMs = Duration.between(last, now).toMillis();
        if (elapsedMs < RATE_UPDATE_INTERVAL_MS || !lastRateUpdate.compareAndSet(last, now)) {
            return;
        }
        long delta = currentBytes - bytesAtLastRateUpdate.getAndSet(currentBytes);
        if (delta > 0) {
            double instantRate = (double) delta / elapsedMs * 1000.0;
            double previous = currentRate.get();
            // Exponential moving average
            currentRate.set(previous == 0.0 ? instantRate : previous * 0.7 + instantRate * 0.3);
        }
    }

    static String formatBytes(long bytes) {
        if (bytes < 1024) {
            return bytes + "B";
        }
        if (bytes < 1024L * 1024) {
            return String.format("%.2fkB", bytes / 1024.0);
        }
        if (bytes < 1024L * 1024 * 1024) {
            return String.format("%.2fMB", bytes / (1024.0 * 1024));
        }
        return String.format("%.2fGB", bytes / (1024.0 * 1024 * 1024));
    }

    @Override
    public String toString() {
        return "ProgressTracker{" + describe() + "}";
    }
}
