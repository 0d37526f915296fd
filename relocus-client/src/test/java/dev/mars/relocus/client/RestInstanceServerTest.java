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

package dev.mars.relocus.client;

import dev.mars.relocus.connection.InstanceCreateSpec;
import dev.mars.relocus.connection.InstanceMigration;
import dev.mars.relocus.connection.MigrationChannel;
import dev.mars.relocus.connection.MigrationEndpoint;
import dev.mars.relocus.connection.MigrationSourceSpec;
import dev.mars.relocus.connection.RemoteOperation;
import dev.mars.relocus.connection.ServerInfo;
import dev.mars.relocus.core.InstanceDefinition;
import dev.mars.relocus.core.OperationStatus;
import dev.mars.relocus.core.TransferMode;
import dev.mars.relocus.core.exceptions.OperationFailedException;
import dev.mars.relocus.core.exceptions.UnreachableException;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.io.ByteArrayOutputStream;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

import static dev.mars.relocus.client.FakeRemoteServer.async;
import static dev.mars.relocus.client.FakeRemoteServer.instance;
import static dev.mars.relocus.client.FakeRemoteServer.operation;
import static dev.mars.relocus.client.FakeRemoteServer.serverInfo;
import static dev.mars.relocus.client.FakeRemoteServer.sync;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RestInstanceServer against a real HTTP server (no mocking).
 */
@ExtendWith(VertxExtension.class)
class RestInstanceServerTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private FakeRemoteServer remote;
    private String baseUrl;
    private RestInstanceServer server;

    @BeforeEach
    void setUp(Vertx vertx, VertxTestContext testContext) {
        remote = new FakeRemoteServer();
        remote.start(vertx).onComplete(testContext.succeeding(port -> {
            baseUrl = "http://127.0.0.1:" + port;
            server = new RestInstanceServer(new RelocusApiClient("b", baseUrl, HttpClient.newHttpClient(), TIMEOUT),
                    null, null, Duration.ofMillis(10));
            testContext.completeNow();
        }));
    }

    @AfterEach
    void tearDown(VertxTestContext testContext) {
        remote.stop().onComplete(testContext.succeedingThenComplete());
    }

    @Nested
    @DisplayName("Reads")
    class Reads {

        @Test
        void serverInfo() throws Exception {
            remote.route("GET", "/1.0", sync(FakeRemoteServer.serverInfo("b1", true, "instance_pool_move")));

            ServerInfo info = server.getServerInfo();

            assertEquals("b1", info.getServerName());
            assertTrue(info.isClustered());
            assertTrue(info.hasExtension("instance_pool_move"));
            assertFalse(info.hasExtension("instance_move_config"));
            assertEquals("CERT-b1", info.getCertificate());
        }

        @Test
        void instanceIsReadWithExpandedView() throws Exception {
            remote.route("GET", "/1.0/instances/web1", sync(instance("web1", "Running")));

            InstanceDefinition definition = server.getInstance("web1");

            assertEquals("web1", definition.getName());
            assertTrue(definition.isRunning());
            assertEquals(List.of("default"), definition.getProfiles());
            assertEquals(List.of("snap0"), definition.getSnapshots());
            assertEquals("default", definition.getExpandedDevices().get("root").get("pool"));
            assertEquals(List.of("GET /1.0/instances/web1?recursion=1"), remote.getRequests());
        }

        @Test
        void projectAndTargetTravelAsQuery() throws Exception {
            remote.route("GET", "/1.0/instances/web1", sync(instance("web1", "Stopped")));

            server.useProject("prod").useTarget("node2").getInstance("web1");

            assertEquals(List.of("GET /1.0/instances/web1?project=prod&target=node2&recursion=1"), remote.getRequests());
        }

        @Test
        void errorEnvelopeBecomesApiException() {
            ApiException e = assertThrows(ApiException.class, () -> server.getInstance("missing"));

            assertTrue(e.isNotFound());
            assertEquals("not found", e.getServerError());
        }

        @Test
        void unreachableRemote() {
            RestInstanceServer closed = new RestInstanceServer(
                    new RelocusApiClient("c", "http://127.0.0.1:1", HttpClient.newHttpClient(), TIMEOUT),
                    null, null, Duration.ofMillis(10));

            UnreachableException e = assertThrows(UnreachableException.class, closed::getServerInfo);
            assertEquals("c", e.getRemoteAlias());
        }
    }

    @Nested
    @DisplayName("Operations")
    class Operations {

        @Test
        void renameIsPolledToCompletion() throws Exception {
            remote.route("POST", "/1.0/instances/web1", async("op1", 103, null))
                    .route("GET", "/1.0/operations/op1", sync(operation("op1", 200, null)));

            RemoteOperation op = server.renameInstance("web1", "web2");

            assertEquals("op1", op.getId());
            assertEquals(OperationStatus.SUCCESS, op.waitFor(TIMEOUT));
            assertThat(remote.getBody("POST", "/1.0/instances/web1")).contains("\"name\":\"web2\"");
        }

        @Test
        void failedOperationCarriesServerError() throws Exception {
            remote.route("POST", "/1.0/instances/web1", async("op1", 103, null))
                    .route("GET", "/1.0/operations/op1", sync(operation("op1", 400, "Instance is running")));

            RemoteOperation op = server.renameInstance("web1", "web2");

            assertEquals(OperationStatus.FAILURE, op.waitFor(TIMEOUT));
            assertEquals("Instance is running", op.getError().orElseThrow());
        }

        @Test
        void cancelDeletesOperation() throws Exception {
            remote.route("POST", "/1.0/instances/web1", async("op1", 103, null))
                    .route("GET", "/1.0/operations/op1", sync(operation("op1", 103, null)))
                    .route("DELETE", "/1.0/operations/op1", sync(new JsonObject()));

            RemoteOperation op = server.renameInstance("web1", "web2");
            op.cancel();

            assertThat(remote.getRequests()).contains("DELETE /1.0/operations/op1");
        }

        @Test
        void syncResponseWhereOperationExpected() {
            remote.route("POST", "/1.0/instances/web1", sync(new JsonObject()));

            assertThrows(OperationFailedException.class, () -> server.renameInstance("web1", "web2"));
        }

        @Test
        void serverSideMoveSendsMigrationRequest() throws Exception {
            remote.route("POST", "/1.0/instances/web1", async("op1", 200, null));

            server.migrateInstance("web1", InstanceMigration.builder()
                    .name("web1")
                    .pool("pool2")
                    .build());

            assertThat(remote.getBody("POST", "/1.0/instances/web1"))
                    .contains("\"migration\":true")
                    .contains("\"pool\":\"pool2\"");
        }

        @Test
        void forceDeleteStopsRunningInstanceFirst() throws Exception {
            remote.route("GET", "/1.0/instances/web1", sync(instance("web1", "Running")))
                    .route("PUT", "/1.0/instances/web1/state", async("stop1", 200, null))
                    .route("DELETE", "/1.0/instances/web1", async("del1", 103, null));

            server.deleteInstance("web1", true);

            List<String> requests = remote.getRequests();
            assertThat(requests).containsSubsequence(
                    "GET /1.0/instances/web1?recursion=1",
                    "PUT /1.0/instances/web1/state",
                    "DELETE /1.0/instances/web1");
            assertThat(remote.getBody("PUT", "/1.0/instances/web1/state"))
                    .contains("\"action\":\"stop\"")
                    .contains("\"force\":true");
        }

        @Test
        void unsetConfigKeepsOtherKeys() throws Exception {
            remote.route("GET", "/1.0/instances/web1", sync(instance("web1", "Stopped")
                            .put("config", new JsonObject().put("limits.cpu", "2").put("security.protection.delete", "true"))))
                    .route("PUT", "/1.0/instances/web1", async("put1", 200, null));

            server.unsetInstanceConfig("web1", "security.protection.delete");

            assertThat(remote.getBody("PUT", "/1.0/instances/web1"))
                    .contains("limits.cpu")
                    .doesNotContain("security.protection.delete");
        }

        @Test
        void unsetConfigWithoutConfigSection() throws Exception {
            JsonObject bare = instance("web1", "Stopped");
            bare.remove("config");
            remote.route("GET", "/1.0/instances/web1", sync(bare))
                    .route("PUT", "/1.0/instances/web1", async("put2", 200, null));

            server.unsetInstanceConfig("web1", "security.protection.delete");

            assertThat(remote.getBody("PUT", "/1.0/instances/web1")).doesNotContain("limits.cpu");
        }
    }

    @Nested
    @DisplayName("Migration")
    class Migration {

        @Test
        void pullSourceIsListening() throws Exception {
            remote.route("GET", "/1.0", sync(serverInfo("a1", false)))
                    .route("POST", "/1.0/instances/db1", async("mig1", 103,
                            new JsonObject().put("control", "s1").put("fs", "s2")));

            MigrationEndpoint endpoint = server.prepareMigrationSource("db1",
                    new MigrationSourceSpec(true, false, false, null));

            assertTrue(endpoint.isListening());
            assertEquals(baseUrl + "/1.0/operations/mig1", endpoint.getOperationUrl());
            assertEquals("s2", endpoint.getSecret("fs"));
            assertEquals("CERT-a1", endpoint.getCertificate());
            assertThat(remote.getBody("POST", "/1.0/instances/db1")).contains("\"live\":true");
        }

        @Test
        void pullingDestinationPointsAtSource() throws Exception {
            MigrationEndpoint source = listeningSource(new JsonObject().put("fs", "s2"));
            remote.route("POST", "/1.0/instances", async("create1", 103, null));

            MigrationEndpoint endpoint = server.createInstanceFromMigration(InstanceCreateSpec.builder()
                    .name("db1")
                    .mode(TransferMode.PULL)
                    .sourceEndpoint(source)
                    .build());

            assertFalse(endpoint.isListening());
            assertThat(remote.getBody("POST", "/1.0/instances"))
                    .contains("\"mode\":\"pull\"")
                    .contains("\"operation\":\"" + baseUrl + "/1.0/operations/mig1\"")
                    .contains("\"certificate\":\"CERT-a1\"");
        }

        @Test
        void relayedDestinationListensAsPushTarget() throws Exception {
            remote.route("GET", "/1.0", sync(serverInfo("b1", false)))
                    .route("POST", "/1.0/instances", async("create1", 103, new JsonObject().put("fs", "t1")));

            MigrationEndpoint endpoint = server.createInstanceFromMigration(InstanceCreateSpec.builder()
                    .name("db1")
                    .mode(TransferMode.RELAY)
                    .build());

            assertTrue(endpoint.isListening());
            assertThat(remote.getBody("POST", "/1.0/instances")).contains("\"mode\":\"push\"");
        }

        @Test
        void pullWithoutSourceEndpointIsRejected() {
            assertThrows(OperationFailedException.class, () -> server.createInstanceFromMigration(
                    InstanceCreateSpec.builder().name("db1").mode(TransferMode.PULL).build()));
            assertTrue(remote.getRequests().isEmpty());
        }

        @Test
        void channelCarriesDataBothWays() throws Exception {
            remote.setChannelPayload("rootfs-bytes".getBytes(StandardCharsets.UTF_8));
            MigrationEndpoint endpoint = listeningSource(new JsonObject().put("fs", "s2"));

            try (MigrationChannel channel = server.openMigrationChannel(endpoint, "fs")) {
                ByteArrayOutputStream data = new ByteArrayOutputStream();
                byte[] buffer = new byte[4];
                while (data.size() < 12) {
                    int read = channel.read(buffer);
                    if (read < 0) {
                        break;
                    }
                    data.write(buffer, 0, read);
                }
                assertEquals("rootfs-bytes", data.toString(StandardCharsets.UTF_8));

                byte[] reply = "ack".getBytes(StandardCharsets.UTF_8);
                channel.write(reply, 0, reply.length);
                long deadline = System.currentTimeMillis() + 5000;
                while (!"ack".equals(remote.getReceived()) && System.currentTimeMillis() < deadline) {
                    Thread.sleep(10);
                }
            }

            assertEquals("ack", remote.getReceived());
            assertEquals(List.of("secret=s2"), remote.getWebSocketQueries());
        }

        @Test
        void unknownChannelIsRejected() throws Exception {
            MigrationEndpoint endpoint = listeningSource(new JsonObject().put("fs", "s2"));

            assertThrows(OperationFailedException.class, () -> server.openMigrationChannel(endpoint, "control"));
            assertTrue(remote.getWebSocketQueries().isEmpty());
        }

        private MigrationEndpoint listeningSource(JsonObject secrets) throws Exception {
            remote.route("GET", "/1.0", sync(serverInfo("a1", false)))
                    .route("POST", "/1.0/instances/db1", async("mig1", 103, secrets));
            return server.prepareMigrationSource("db1", new MigrationSourceSpec(false, false, false, null));
        }
    }
}
