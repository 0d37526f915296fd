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
import dev.mars.relocus.simulator.SimulatedMigrationChannel;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class RelayPumpTest {

    private static byte[] payload(int size) {
        byte[] bytes = new byte[size];
        for (int i = 0; i < size; i++) {
            bytes[i] = (byte) (i % 251);
        }
        return bytes;
    }

    private static List<MigrationChannel[]> pairsOf(MigrationChannel... channels) {
        List<MigrationChannel[]> pairs = new ArrayList<>();
        for (int i = 0; i < channels.length; i += 2) {
            pairs.add(new MigrationChannel[]{channels[i], channels[i + 1]});
        }
        return pairs;
    }

    @Test
    void relaysBothDirectionsAndClosesOutputs() throws InterruptedException {
        byte[] filesystem = payload(10_000);
        byte[] acknowledgements = "ack".getBytes(StandardCharsets.UTF_8);
        SimulatedMigrationChannel source = new SimulatedMigrationChannel("fs", filesystem);
        SimulatedMigrationChannel destination = new SimulatedMigrationChannel("fs", acknowledgements);

        try (RelayPump pump = new RelayPump(1024)) {
            pump.start(pairsOf(source, destination));

            assertTrue(pump.awaitCompletion(5, TimeUnit.SECONDS));
            assertNull(pump.getFailure());
            assertArrayEquals(filesystem, destination.getWritten());
            assertArrayEquals(acknowledgements, source.getWritten());
            assertTrue(source.isOutputClosed());
            assertTrue(destination.isOutputClosed());
            assertEquals(filesystem.length + acknowledgements.length, pump.getBytesRelayed());
        }
    }

    @Test
    void relaysSeveralChannels() throws InterruptedException {
        byte[] control = payload(100);
        byte[] filesystem = payload(5000);
        SimulatedMigrationChannel sourceControl = new SimulatedMigrationChannel("control", control);
        SimulatedMigrationChannel destinationControl = new SimulatedMigrationChannel("control", new byte[0]);
        SimulatedMigrationChannel sourceFs = new SimulatedMigrationChannel("fs", filesystem);
        SimulatedMigrationChannel destinationFs = new SimulatedMigrationChannel("fs", new byte[0]);

        try (RelayPump pump = new RelayPump(64)) {
            pump.start(pairsOf(sourceControl, destinationControl, sourceFs, destinationFs));

            assertTrue(pump.awaitCompletion(5, TimeUnit.SECONDS));
            assertArrayEquals(control, destinationControl.getWritten());
            assertArrayEquals(filesystem, destinationFs.getWritten());
        }
    }

    @Test
    void firstFailureClosesEveryChannel() throws InterruptedException {
        SimulatedMigrationChannel source = new SimulatedMigrationChannel("fs", payload(10_000), 100);
        SimulatedMigrationChannel destination = new SimulatedMigrationChannel("fs", new byte[0]);
        SimulatedMigrationChannel otherSource = new SimulatedMigrationChannel("control", new byte[0]);
        SimulatedMigrationChannel otherDestination = new SimulatedMigrationChannel("control", new byte[0]);

        try (RelayPump pump = new RelayPump(16)) {
            pump.start(pairsOf(source, destination, otherSource, otherDestination));

            assertTrue(pump.awaitCompletion(5, TimeUnit.SECONDS));
            assertNotNull(pump.getFailure());
            assertTrue(pump.getFailure().getMessage().contains("Connection reset"));
            assertTrue(source.isClosed());
            assertTrue(destination.isClosed());
            assertTrue(otherSource.isClosed());
            assertTrue(otherDestination.isClosed());
            assertEquals(100, destination.getWritten().length);
        }
    }

    @Test
    void closeClosesChannels() {
        SimulatedMigrationChannel source = new SimulatedMigrationChannel("fs", new byte[0]);
        SimulatedMigrationChannel destination = new SimulatedMigrationChannel("fs", new byte[0]);
        RelayPump pump = new RelayPump(16);
        pump.start(pairsOf(source, destination));

        pump.close();

        assertTrue(source.isClosed());
        assertTrue(destination.isClosed());
    }

    @Test
    void bufferSizeMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new RelayPump(0));
    }
}
