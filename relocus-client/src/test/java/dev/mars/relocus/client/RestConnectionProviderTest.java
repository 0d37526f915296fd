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

import dev.mars.relocus.config.RelocusConfiguration;
import dev.mars.relocus.connection.InstanceServer;
import dev.mars.relocus.core.exceptions.UnreachableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RestConnectionProviderTest {

    private RestConnectionProvider provider;

    @BeforeEach
    void setUp() {
        Map<String, RemoteDefinition> remotes = new LinkedHashMap<>();
        remotes.put("local", new RemoteDefinition("local", "https://127.0.0.1:8443", null));
        remotes.put("b", new RemoteDefinition("b", "https://host-b:8443/", "staging"));
        provider = new RestConnectionProvider(new RemotesConfiguration("local", remotes),
                new RelocusConfiguration(new Properties()));
    }

    @Test
    void connectionsAreCachedPerRemote() throws Exception {
        InstanceServer first = provider.connect("b");

        assertSame(first, provider.connect("b"));
        assertNotSame(first, provider.connect("local"));
        assertEquals("b", first.getRemoteAlias());
        assertEquals("staging", first.getProject());
    }

    @Test
    void connectDoesNotTouchTheNetwork() throws Exception {
        RestInstanceServer server = (RestInstanceServer) provider.connect("b");

        assertEquals("https://host-b:8443", server.getApiClient().getBaseUrl());
    }

    @Test
    void unknownRemote() {
        UnreachableException e = assertThrows(UnreachableException.class, () -> provider.connect("nope"));

        assertEquals("nope", e.getRemoteAlias());
        assertTrue(e.getMessage().contains("doesn't exist"));
    }

    @Test
    void remoteDirectory() {
        assertEquals(Set.of("local", "b"), provider.getRemoteNames());
        assertEquals("local", provider.getDefaultRemote());
        assertEquals("staging", provider.getDefaultProject("b"));
        assertNull(provider.getDefaultProject("local"));
        assertNull(provider.getDefaultProject("nope"));
        assertTrue(provider.hasRemote("b"));
    }

    @Test
    void webSocketUriFollowsScheme() {
        RelocusApiClient secure = new RelocusApiClient("b", "https://host-b:8443", null, null);
        RelocusApiClient plain = new RelocusApiClient("c", "http://host-c:8080", null, null);

        assertEquals("wss://host-b:8443/1.0/operations/x/websocket",
                secure.webSocketUri("/1.0/operations/x/websocket").toString());
        assertEquals("ws://host-c:8080/1.0/operations/x/websocket",
                plain.webSocketUri("/1.0/operations/x/websocket").toString());
    }
}
