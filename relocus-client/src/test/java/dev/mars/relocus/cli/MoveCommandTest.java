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

package dev.mars.relocus.cli;

import dev.mars.relocus.client.RemoteDefinition;
import dev.mars.relocus.client.RemotesConfiguration;
import dev.mars.relocus.client.RestConnectionProvider;
import dev.mars.relocus.config.RelocusConfiguration;
import dev.mars.relocus.core.LocationRef;
import dev.mars.relocus.core.RelocationRequest;
import dev.mars.relocus.core.TransferMode;
import dev.mars.relocus.core.exceptions.RelocationErrorKind;
import dev.mars.relocus.core.exceptions.RelocationException;
import dev.mars.relocus.endpoint.EndpointResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class MoveCommandTest {

    private MoveCommand command;

    @BeforeEach
    void setUp() {
        Map<String, RemoteDefinition> remotes = new LinkedHashMap<>();
        remotes.put("local", new RemoteDefinition("local", "https://127.0.0.1:8443", null));
        remotes.put("b", new RemoteDefinition("b", "https://host-b:8443", null));
        RestConnectionProvider provider = new RestConnectionProvider(new RemotesConfiguration("local", remotes),
                new RelocusConfiguration(new Properties()));
        command = new MoveCommand(new EndpointResolver(provider), TransferMode.PULL);
    }

    private RelocationRequest toRequest(String... args) throws Exception {
        return command.toRequest(MoveArguments.parse(args));
    }

    @Test
    void plainMove() throws Exception {
        RelocationRequest request = toRequest("web1", "b:web2");

        assertEquals(LocationRef.of("local", "web1"), request.getSource());
        assertEquals(LocationRef.of("b", "web2"), request.getDestination());
        assertEquals(TransferMode.PULL, request.getTransferMode());
        assertFalse(request.hasOverrides());
        assertTrue(request.isStateful());
    }

    @Test
    void loneSourceMovesInPlace() throws Exception {
        RelocationRequest request = toRequest("web1", "--target-project", "prod");

        assertEquals(request.getSource(), request.getDestination());
        assertEquals("prod", request.getTargetProject());
    }

    @Test
    void overridesAndMode() throws Exception {
        RelocationRequest request = toRequest("web1", "b:", "--mode", "push", "-c", "limits.cpu=2",
                "-d", "root,size=10GiB", "-p", "web", "--stateless");

        assertEquals(TransferMode.PUSH, request.getTransferMode());
        assertEquals(Map.of("limits.cpu", "2"), request.getConfigOverrides());
        assertEquals(Map.of("size", "10GiB"), request.getDeviceOverrides().get("root"));
        assertEquals(List.of("web"), request.getProfiles());
        assertFalse(request.isStateful());
    }

    @Test
    void badModeIsUsageError() {
        assertThrows(UsageException.class, () -> toRequest("web1", "web2", "--mode", "teleport"));
    }

    @Test
    void badOverrideIsRejected() {
        RelocationException e = assertThrows(RelocationException.class,
                () -> toRequest("web1", "b:", "-c", "limits.cpu"));

        assertEquals(RelocationErrorKind.INVALID_OVERRIDE, e.getKind());
    }

    @Test
    void unknownRemoteIsMalformed() {
        RelocationException e = assertThrows(RelocationException.class, () -> toRequest("web1", "zz:web1"));

        assertEquals(RelocationErrorKind.MALFORMED_REFERENCE, e.getKind());
    }
}
