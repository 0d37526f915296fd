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

import dev.mars.relocus.connection.InstanceServer;
import dev.mars.relocus.connection.ServerInfo;
import dev.mars.relocus.core.PeerCapabilities;
import dev.mars.relocus.core.exceptions.RelocationException;
import dev.mars.relocus.core.exceptions.UnreachableException;

import java.util.logging.Logger;

/**
 * Asks a connected server which optional features it supports.
 *
 * <p>Each call queries the server again. Anything short of the server being unreachable
 * is reported as "no capabilities" so that strategy selection falls back to the
 * universally supported path instead of failing.</p>
 */
public class CapabilityProber {
    private static final Logger logger = Logger.getLogger(CapabilityProber.class.getName());

    /**
     * @throws UnreachableException only when the server cannot be contacted at all
     */
    public PeerCapabilities probe(InstanceServer server) throws UnreachableException {
        ServerInfo info;
        try {
            info = server.getServerInfo();
        } catch (UnreachableException e) {
            throw e;
        } catch (RelocationException e) {
            logger.warning("Could not read server info from " + server.getRemoteAlias() +
                    ", assuming no optional features: " + e.getMessage());
            return PeerCapabilities.none();
        }

        PeerCapabilities capabilities = new PeerCapabilities(info.getExtensions(), info.isClustered());
        logger.fine("Capabilities of " + server.getRemoteAlias() + ": moveConfig=" + capabilities.canMoveConfig() +
                ", movePool=" + capabilities.canMovePool() + ", moveProject=" + capabilities.canMoveProject() +
                ", clustered=" + capabilities.isClustered());
        return capabilities;
    }
}
