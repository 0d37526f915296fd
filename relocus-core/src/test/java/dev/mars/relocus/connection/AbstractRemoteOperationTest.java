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

package dev.mars.relocus.connection;

import dev.mars.relocus.core.OperationStatus;
import dev.mars.relocus.core.exceptions.RelocationException;
import dev.mars.relocus.simulator.SimulatedOperation;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class AbstractRemoteOperationTest {

    @Test
    void skippedRunningStateIsFilledIn() throws Exception {
        SimulatedOperation operation = SimulatedOperation.succeeding("op-1");
        List<OperationStatus> seen = new CopyOnWriteArrayList<>();
        operation.addProgressHandler(event -> seen.add(event.getStatus()));

        assertEquals(OperationStatus.SUCCESS, operation.waitFor(Duration.ofSeconds(1)));
        assertEquals(List.of(OperationStatus.SUCCESS), seen);
        assertEquals(OperationStatus.SUCCESS, operation.getStatus());
    }

    @Test
    void reportAfterTerminalStateIsIgnored() {
        SimulatedOperation operation = SimulatedOperation.succeeding("op-2");
        operation.report(OperationStatus.RUNNING, null, null);
        operation.report(OperationStatus.FAILURE, "disk full", null);

        operation.report(OperationStatus.SUCCESS, null, null);

        assertEquals(OperationStatus.FAILURE, operation.getStatus());
        assertEquals("disk full", operation.getError().orElse(null));
    }

    @Test
    void rejectedReportKeepsErrorAndFiresNoEvent() {
        SimulatedOperation operation = SimulatedOperation.succeeding("op-2b");
        operation.report(OperationStatus.RUNNING, null, null);
        operation.report(OperationStatus.CANCELLED, "cancelled by user", null);
        List<OperationStatus> seen = new CopyOnWriteArrayList<>();
        operation.addProgressHandler(event -> seen.add(event.getStatus()));

        operation.report(OperationStatus.FAILURE, "late failure", Map.of("fs_progress", "10%"));

        assertEquals(OperationStatus.CANCELLED, operation.getStatus());
        assertEquals("cancelled by user", operation.getError().orElse(null));
        assertTrue(seen.isEmpty());
    }

    @Test
    void refreshDoesNotPollTerminalOperation() throws RelocationException {
        SimulatedOperation operation = SimulatedOperation.succeeding("op-3");
        operation.refresh();
        int polls = operation.getPollCount();

        operation.refresh();

        assertEquals(polls, operation.getPollCount());
    }

    @Test
    void waitForReturnsCurrentStatusOnTimeout() throws Exception {
        SimulatedOperation operation = SimulatedOperation.hanging("op-4");

        assertEquals(OperationStatus.RUNNING, operation.waitFor(Duration.ofMillis(30)));
        assertTrue(operation.getPollCount() > 1);
    }

    @Test
    void waitForWakesOnReportedChange() throws Exception {
        SimulatedOperation operation = SimulatedOperation.hanging("op-5");
        Thread reporter = new Thread(() -> {
            try {
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            operation.report(OperationStatus.CANCELLED, null, null);
        });
        reporter.start();

        assertEquals(OperationStatus.CANCELLED, operation.waitFor(Duration.ofSeconds(5)));
        reporter.join();
    }

    @Test
    void progressIsDeliveredWithoutStatusChange() throws Exception {
        SimulatedOperation operation = SimulatedOperation.succeeding("op-6")
                .runningFor(2)
                .withProgress(Map.of("fs_progress", "rootfs: 10MB"))
                .withProgress(Map.of("fs_progress", "rootfs: 20MB"));
        List<String> progress = new ArrayList<>();
        operation.addProgressHandler(event -> {
            if (event.hasProgress()) {
                progress.add(event.getProgressText());
            }
        });

        operation.waitFor(Duration.ofSeconds(1));

        assertEquals(List.of("rootfs: 10MB", "rootfs: 20MB"), progress);
    }

    @Test
    void failingHandlerDoesNotBreakOperation() throws Exception {
        SimulatedOperation operation = SimulatedOperation.succeeding("op-7");
        operation.addProgressHandler(event -> {
            throw new IllegalStateException("renderer broke");
        });

        assertEquals(OperationStatus.SUCCESS, operation.waitFor(Duration.ofSeconds(1)));
    }

    @Test
    void cancelOfTerminalOperationIsNotSent() throws Exception {
        SimulatedOperation operation = SimulatedOperation.succeeding("op-8");
        operation.waitFor(Duration.ofSeconds(1));

        operation.cancel();

        assertFalse(operation.wasCancelRequested());
    }

    @Test
    void cancelledOperationEndsCancelled() throws Exception {
        SimulatedOperation operation = SimulatedOperation.hanging("op-9");
        operation.refresh();

        operation.cancel();

        assertEquals(OperationStatus.CANCELLED, operation.waitFor(Duration.ofSeconds(1)));
        assertEquals(1, operation.getCancelRequests());
    }
}
