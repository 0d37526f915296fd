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

import dev.mars.relocus.connection.MigrationChannel;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Copies bytes in both directions between pairs of migration channels, one pair per
 * named stream, on background threads.
 *
 * <p>When one side reaches end of stream the other side's output is closed. The first
 * I/O error closes every channel so that both servers see the transfer break.</p>
 */
public class RelayPump implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(RelayPump.class.getName());
    private static final AtomicInteger threadCounter = new AtomicInteger();

    private final int bufferSize;
    private final ExecutorService executor;
    private final List<MigrationChannel> channels = new ArrayList<>();
    private final List<ProgressTracker> trackers = new ArrayList<>();
    private final AtomicReference<IOException> failure = new AtomicReference<>();
    private CountDownLatch finished = new CountDownLatch(0);

    public RelayPump(int bufferSize) {
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("Buffer size must be positive: " + bufferSize);
        }
        this.bufferSize = bufferSize;
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "relocus-relay-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start relaying. Each pair is {source channel, destination channel} for one stream name.
     */
    public synchronized void start(List<MigrationChannel[]> pairs) {
        finished = new CountDownLatch(pairs.size() * 2);
        for (MigrationChannel[] pair : pairs) {
            MigrationChannel source = pair[0];
            MigrationChannel destination = pair[1];
            channels.add(source);
            channels.add(destination);

            ProgressTracker outbound = new ProgressTracker(source.getName());
            ProgressTracker inbound = new ProgressTracker(source.getName() + "-return");
            trackers.add(outbound);
            trackers.add(inbound);

            executor.execute(() -> pump(source, destination, outbound));
            executor.execute(() -> pump(destination, source, inbound));
        }
        logger.fine("Relaying " + pairs.size() + " channel(s)");
    }

    private void pump(MigrationChannel from, MigrationChannel to, ProgressTracker tracker) {
        byte[] buffer = new byte[bufferSize];
        tracker.start();
        try {
            int read;
            while ((read = from.read(buffer)) >= 0) {
                if (read > 0) {
                    to.write(buffer, 0, read);
                    tracker.addBytes(read);
                }
            }
            to.closeOutput();
            logger.fine("Relay " + tracker.describe() + " reached end of stream");
        } catch (IOException e) {
            if (failure.compareAndSet(null, e)) {
                logger.log(Level.WARNING, "Relay of channel " + from.getName() + " failed", e);
                closeChannels();
            }
        } finally {
            finished.countDown();
        }
    }

    /**
     * Wait for every direction to reach end of stream or fail.
     *
     * @return true if all directions finished within the timeout
     */
    public boolean awaitCompletion(long timeout, TimeUnit unit) throws InterruptedException {
        return finished.await(timeout, unit);
    }

    /**
     * @return the first I/O error seen by any direction, or null
     */
    public IOException getFailure() {
        return failure.get();
    }

    public long getBytesRelayed() {
        long total = 0;
        synchronized (this) {
            for (ProgressTracker tracker : trackers) {
                total += tracker.getTransferredBytes();
            }
        }
        return total;
    }

    private synchronized void closeChannels() {
        for (MigrationChannel channel : channels) {
            try {
                channel.close();
            } catch (IOException e) {
                logger.fine("Error closing relay channel " + channel.getName() + ": " + e.getMessage());
            }
        }
    }

    @Override
    public void close() {
        closeChannels();
        executor.shutdownNow();
        logger.fine("Relay closed after " + ProgressTracker.formatBytes(getBytesRelayed()));
    }
}
