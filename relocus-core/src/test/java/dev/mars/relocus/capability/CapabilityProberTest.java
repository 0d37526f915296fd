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

package dev.mars.relocus.capability;

import dev.mars.relocus.core.ApiExtension;
import dev.mars.relocus.core.PeerCapabilities;
import dev.mars.relocus.core.exceptions.OperationFailedException;
import dev.mars.relocus.core.exceptions.UnreachableException;
import dev.mars.relocus.simulator.InMemoryInstanceServerSimulator;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CapabilityProberTest {

    private final CapabilityProber prober = new CapabilityProber();

    @Test
    void reportsAdvertisedExtensions() throws UnreachableException {
        InMemoryInstanceServerSimulator server = new InMemoryInstanceServerSimulator("local")
                .withExtensions(ApiExtension.INSTANCE_MOVE_CONFIG, ApiExtension.INSTANCE_POOL_MOVE)
                .clustered(true);

        PeerCapabilities capabilities = prober.probe(server);

        assertTrue(capabilities.canMoveConfig());
        assertTrue(capabilities.canMovePool());
        assertFalse(capabilities.canMoveProject());
        assertTrue(capabilities.isClustered());
    }

    @Test
    void probesAgainOnEveryCall() throws UnreachableException {
        InMemoryInstanceServerSimulator server = new InMemoryInstanceServerSimulator("local");

        assertFalse(prober.probe(server).canMovePool());
        server.withExtensions(ApiExtension.INSTANCE_POOL_MOVE);
        assertTrue(prober.probe(server).canMovePool());
        assertEquals(2, server.getCallCount("getServerInfo"));
    }

    @Test
    void serverErrorDegradesToNoCapabilities() throws UnreachableException {
        InMemoryInstanceServerSimulator server = new InMemoryInstanceServerSimulator("local")
                .withExtensions(ApiExtension.INSTANCE_MOVE_CONFIG);
        server.failServerInfo(new OperationFailedException(null, 500, "internal error", null));

        PeerCapabilities capabilities = prober.probe(server);

        assertFalse(capabilities.canMoveConfig());
        assertFalse(capabilities.isClustered());
    }

    @Test
    void unreachableServerIsReported() {
        InMemoryInstanceServerSimulator server = new InMemoryInstanceServerSimulator("remote");
        server.failServerInfo(new UnreachableException("remote", "connection refused"));

        UnreachableException e = assertThrows(UnreachableException.class, () -> prober.probe(server));
        assertEquals("remote", e.getRemoteAlias());
    }
}
