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

package dev.mars.relocus.executor;

import dev.mars.relocus.capability.CapabilityProber;
import dev.mars.relocus.config.RelocusConfiguration;
import dev.mars.relocus.connection.InstanceCreateSpec;
import dev.mars.relocus.core.InstanceDefinition;
import dev.mars.relocus.core.LocationRef;
import dev.mars.relocus.core.PeerCapabilities;
import dev.mars.relocus.core.RelocationRequest;
import dev.mars.relocus.core.RelocationStatus;
import dev.mars.relocus.core.TransferMode;
import dev.mars.relocus.core.exceptions.OperationFailedException;
import dev.mars.relocus.core.exceptions.OrphanedSourceAfterMoveException;
import dev.mars.relocus.core.exceptions.RelocationErrorKind;
import dev.mars.relocus.core.exceptions.RelocationException;
import dev.mars.relocus.override.OverrideMerger;
import dev.mars.relocus.override.ResolvedOverrides;
import dev.mars.relocus.simulator.InMemoryInstanceServerSimulator;
import dev.mars.relocus.simulator.SimulatedOperation;
import dev.mars.relocus.supervisor.OperationSupervisor;
import dev.mars.relocus.supervisor.ProgressRenderer;
import dev.mars.relocus.supervisor.RelocationContext;
import dev.mars.relocus.supervisor.RelocationPhase;
import dev.mars.relocus.transfer.TopologyRunnerFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for copy-then-delete relocation between two simulated servers.
 */
class ClientMediatedCopyExecutorTest {

    private InMemoryInstanceServerSimulator serverA;
    private InMemoryInstanceServerSimulator serverB;
    private ClientMediatedCopyExecutor executor;

    @BeforeEach
    void setUp() {
        serverA = new InMemoryInstanceServerSimulator("a");
        serverB = new InMemoryInstanceServerSimulator("b");
        serverA.addInstance(InstanceDefinition.builder()
                .name("db1")
                .status("Running")
                .profiles(List.of("default"))
                .config(Map.of("limits.cpu", "2", "volatile.uuid", "abc"))
                .expandedConfig(Map.of("limits.cpu", "2", "volatile.uuid", "abc"))
                .expandedDevice("root", Map.of("type", "disk", "path", "/", "pool", "default"))
                .expandedDevice("eth0", Map.of("type", "nic", "network", "lxdbr0"))
                .build());

        OperationSupervisor supervisor = new OperationSupervisor(SimulatedOperation.POLL_INTERVAL, Duration.ofSeconds(10));
        executor = new ClientMediatedCopyExecutor(supervisor, new OverrideMerger(),
                new TopologyRunnerFactory(supervisor, new RelocusConfiguration(new Properties()), null),
                new CapabilityProber());
    }

    private RelocationRequest.Builder copy(TransferMode mode) {
        return RelocationRequest.builder()
                .source(LocationRef.of("a", "db1"))
                .destination(LocationRef.of("b", "db1"))
                .transferMode(mode);
    }

    private ExecutionContext contextFor(RelocationRequest request, ProgressRenderer renderer) {
        return new ExecutionContext(request, serverA, serverB, PeerCapabilities.none(),
                new RelocationContext(request), renderer);
    }

    private ExecutionContext contextFor(RelocationRequest request) {
        return contextFor(request, null);
    }

    @Nested
    @DisplayName("Copy then delete")
    class CopyThenDelete {

        @Test
        void pullCopyDeletesSourceAfterSuccess() throws RelocationException {
            ExecutionContext context = contextFor(copy(TransferMode.PULL).build());

            assertEquals(RelocationStatus.SUCCESS, executor.execute(context));

            assertTrue(serverB.hasInstance("db1"));
            assertFalse(serverA.hasInstance("db1"));
            assertEquals(List.of("getInstance", "prepareMigrationSource", "deleteInstance"), serverA.getCalls());
            assertEquals(RelocationPhase.DELETING_SOURCE, context.relocation().getPhase());
        }

        @Test
        void relayCopyDeletesSourceAfterSuccess() throws RelocationException {
            assertEquals(RelocationStatus.SUCCESS, executor.execute(contextFor(copy(TransferMode.RELAY).build())));

            assertTrue(serverB.hasInstance("db1"));
            assertFalse(serverA.hasInstance("db1"));
            assertEquals(2, serverA.getCallCount("openMigrationChannel"));
        }

        @Test
        void pushCopyDeletesSourceAfterSuccess() throws RelocationException {
            assertEquals(RelocationStatus.SUCCESS, executor.execute(contextFor(copy(TransferMode.PUSH).build())));

            assertTrue(serverB.hasInstance("db1"));
            assertFalse(serverA.hasInstance("db1"));
        }

        @Test
        void runningInstanceIsCopiedLive() throws RelocationException {
            executor.execute(contextFor(copy(TransferMode.PULL).build()));

            assertTrue(serverA.getLastSourceSpec().live());
            assertTrue(serverB.getLastCreateSpec().isLive());
            assertEquals("Running", serverB.getStoredInstance("db1").getStatus());
        }

        @Test
        void statelessCopyIsNotLive() throws RelocationException {
            executor.execute(contextFor(copy(TransferMode.PULL).stateless(true).build()));

            assertFalse(serverA.getLastSourceSpec().live());
            assertFalse(serverB.getLastCreateSpec().isLive());
        }

        @Test
        void deleteProtectionIsClearedFirst() throws RelocationException {
            serverA.addInstance(serverA.getStoredInstance("db1").toBuilder()
                    .expandedConfig(Map.of(ClientMediatedCopyExecutor.DELETE_PROTECTION_KEY, "true"))
                    .build());

            assertEquals(RelocationStatus.SUCCESS, executor.execute(contextFor(copy(TransferMode.PULL).build())));

            assertThat(serverA.getCalls()).containsSubsequence("unsetInstanceConfig", "deleteInstance");
            assertFalse(serverA.hasInstance("db1"));
        }
    }

    @Nested
    @DisplayName("Source safety")
    class SourceSafety {

        @Test
        void failedCopyNeverDeletesSource() {
            serverB.failNext("createInstanceFromMigration", "Failed to create instance: quota exceeded");

            OperationFailedException e = assertThrows(OperationFailedException.class,
                    () -> executor.execute(contextFor(copy(TransferMode.PULL).build())));

            assertEquals("Failed to create instance: quota exceeded", e.getMessage());
            assertEquals(0, serverA.getCallCount("deleteInstance"));
            assertTrue(serverA.hasInstance("db1"));
            assertFalse(serverB.hasInstance("db1"));
        }

        @Test
        void cancelledCopyNeverDeletesSource() throws Exception {
            serverB.hangNext("createInstanceFromMigration");
            ExecutionContext context = contextFor(copy(TransferMode.PULL).build());
            Thread canceller = new Thread(() -> {
                try {
                    Thread.sleep(30);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                context.relocation().cancel();
            });
            canceller.start();

            assertEquals(RelocationStatus.CANCELLED, executor.execute(context));
            canceller.join();

            assertEquals(0, serverA.getCallCount("deleteInstance"));
            assertTrue(serverA.hasInstance("db1"));
        }

        @Test
        void cancelBeforeCopyStartsNothing() throws RelocationException {
            ExecutionContext context = contextFor(copy(TransferMode.PULL).build());
            context.relocation().cancel();

            assertEquals(RelocationStatus.CANCELLED, executor.execute(context));
            assertEquals(0, serverA.getCallCount("prepareMigrationSource"));
            assertEquals(0, serverB.getCallCount("createInstanceFromMigration"));
        }

        @Test
        void cancelAfterCopyLeavesBothInstances() throws RelocationException {
            serverA.scriptNext("prepareMigrationSource", id -> SimulatedOperation.succeeding(id).ignoringCancel());
            serverB.scriptNext("createInstanceFromMigration", id -> SimulatedOperation.succeeding(id)
                    .runningFor(1)
                    .withProgress(Map.of("fs_progress", "rootfs: 99%"))
                    .ignoringCancel());
            RelocationRequest request = copy(TransferMode.PULL).build();
            RelocationContext relocation = new RelocationContext(request);
            ProgressRenderer cancelOnProgress = new ProgressRenderer() {
                @Override
                public void update(String progress) {
                    relocation.cancel();
                }

                @Override
                public void done(String message) {
                }
            };
            ExecutionContext context = new ExecutionContext(request, serverA, serverB, PeerCapabilities.none(),
                    relocation, cancelOnProgress);

            assertEquals(RelocationStatus.CANCELLED, executor.execute(context));

            assertTrue(serverA.hasInstance("db1"));
            assertTrue(serverB.hasInstance("db1"));
            assertEquals(0, serverA.getCallCount("deleteInstance"));
        }

        @Test
        void failedDeleteIsOrphanedSource() {
            serverA.failNext("deleteInstance", "Failed to delete storage volume: device busy");

            OrphanedSourceAfterMoveException e = assertThrows(OrphanedSourceAfterMoveException.class,
                    () -> executor.execute(contextFor(copy(TransferMode.PULL).build())));

            assertEquals(RelocationErrorKind.ORPHANED_SOURCE_AFTER_MOVE, e.getKind());
            assertEquals(LocationRef.of("a", "db1"), e.getSource());
            assertEquals(LocationRef.of("b", "db1"), e.getDestination());
            assertTrue(e.getMessage().contains("device busy"));
            assertTrue(serverA.hasInstance("db1"));
            assertTrue(serverB.hasInstance("db1"));
        }

        @Test
        void failedProtectionClearIsOrphanedSource() {
            serverA.addInstance(serverA.getStoredInstance("db1").toBuilder()
                    .expandedConfig(Map.of(ClientMediatedCopyExecutor.DELETE_PROTECTION_KEY, "true"))
                    .build());
            serverA.failNext("unsetInstanceConfig", "permission denied");

            assertThrows(OrphanedSourceAfterMoveException.class,
                    () -> executor.execute(contextFor(copy(TransferMode.PULL).build())));
            assertEquals(0, serverA.getCallCount("deleteInstance"));
            assertTrue(serverB.hasInstance("db1"));
        }

        @Test
        void deleteIsNotTiedToCancellation() throws RelocationException {
            serverA.scriptNext("deleteInstance", id -> SimulatedOperation.succeeding(id).runningFor(3));

            ExecutionContext context = contextFor(copy(TransferMode.PULL).build());
            assertEquals(RelocationStatus.SUCCESS, executor.execute(context));

            assertFalse(serverA.getLastOperation("deleteInstance").wasCancelRequested());
            assertFalse(serverA.hasInstance("db1"));
        }
    }

    @Nested
    @DisplayName("Cluster targets")
    class ClusterTargets {

        @Test
        void targetMemberNeedsClusteredDestination() {
            RelocationException e = assertThrows(RelocationException.class,
                    () -> executor.execute(contextFor(copy(TransferMode.PULL).targetMember("node2").build())));

            assertEquals(RelocationErrorKind.INVALID_REQUEST, e.getKind());
            assertEquals(1, serverB.getCallCount("getServerInfo"));
            assertEquals(0, serverB.getCallCount("createInstanceFromMigration"));
        }

        @Test
        void targetMemberOnClusteredDestination() throws RelocationException {
            serverB.clustered(true);

            executor.execute(contextFor(copy(TransferMode.PULL).targetMember("node2").build()));

            assertEquals("node2", serverB.getLastTargetMember());
            assertEquals("node2", serverB.getStoredInstance("db1").getLocation());
        }
    }

    @Nested
    @DisplayName("Create spec")
    class CreateSpec {

        private InstanceDefinition instance;

        @BeforeEach
        void loadInstance() {
            instance = serverA.getStoredInstance("db1");
        }

        @Test
        void keepsVolatileKeysAndProfiles() {
            RelocationRequest request = copy(TransferMode.RELAY).build();

            InstanceCreateSpec spec = executor.buildCreateSpec(request, instance, ResolvedOverrides.none(), true);

            assertTrue(spec.isKeepVolatile());
            assertEquals("abc", spec.getConfig().get("volatile.uuid"));
            assertEquals(List.of("default"), spec.getProfiles());
            assertEquals(TransferMode.RELAY, spec.getMode());
            assertEquals("db1", spec.getName());
        }

        @Test
        void targetPoolRewritesRootDisk() {
            RelocationRequest request = copy(TransferMode.PULL).targetPool("fast").build();

            InstanceCreateSpec spec = executor.buildCreateSpec(request, instance, ResolvedOverrides.none(), false);

            assertEquals(Map.of("type", "disk", "path", "/", "pool", "fast"), spec.getDevices().get("root"));
        }

        @Test
        void overridesWinOverInstance() {
            RelocationRequest request = copy(TransferMode.PULL).targetPool("fast").build();
            ResolvedOverrides overrides = new ResolvedOverrides(
                    Map.of("limits.cpu", "8"),
                    Map.of("root", Map.of("type", "disk", "path", "/", "pool", "fast", "size", "50GiB"),
                            "gpu0", Map.of("type", "gpu")),
                    List.of());

            InstanceCreateSpec spec = executor.buildCreateSpec(request, instance, overrides, false);

            assertEquals("8", spec.getConfig().get("limits.cpu"));
            assertEquals("50GiB", spec.getDevices().get("root").get("size"));
            assertEquals(Map.of("type", "gpu"), spec.getDevices().get("gpu0"));
            assertEquals(List.of(), spec.getProfiles());
        }
    }
}
