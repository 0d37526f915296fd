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

import dev.mars.relocus.connection.InstanceServer;
import dev.mars.relocus.core.PeerCapabilities;
import dev.mars.relocus.core.RelocationRequest;
import dev.mars.relocus.supervisor.ProgressRenderer;
import dev.mars.relocus.supervisor.RelocationContext;

import java.util.Objects;

/**
 * Everything an executor needs for one request.
 *
 * @param request            the request with its destination normalized
 * @param sourceServer       connection to the source, scoped to the source project
 * @param destinationServer  connection to the destination, scoped to the destination project
 * @param sourceCapabilities the source's probed capabilities, or none when probing was not needed
 * @param relocation         cancel flag and phase of the running relocation
 * @param renderer           receives transfer progress
 */
public record ExecutionContext(RelocationRequest request,
                               InstanceServer sourceServer,
                               InstanceServer destinationServer,
                               PeerCapabilities sourceCapabilities,
                               RelocationContext relocation,
                               ProgressRenderer renderer) {

    public ExecutionContext {
        Objects.requireNonNull(request, "Request cannot be null");
        Objects.requireNonNull(sourceServer, "Source server cannot be null");
        Objects.requireNonNull(destinationServer, "Destination server cannot be null");
        Objects.requireNonNull(relocation, "Relocation context cannot be null");
        sourceCapabilities = sourceCapabilities != null ? sourceCapabilities : PeerCapabilities.none();
        renderer = renderer != null ? renderer : ProgressRenderer.noop();
    }

    public boolean isSameConnection() {
        return request.getSource().isSameConnection(request.getDestination());
    }
}
