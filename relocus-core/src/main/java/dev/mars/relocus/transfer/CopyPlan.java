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

import dev.mars.relocus.connection.InstanceCreateSpec;
import dev.mars.relocus.connection.InstanceServer;
import dev.mars.relocus.connection.MigrationSourceSpec;
import dev.mars.relocus.supervisor.ProgressRenderer;

import java.util.Objects;

/**
 * What a topology runner needs to copy one instance between two servers.
 *
 * @param sourceServer      connection to the server holding the instance
 * @param sourceName        the instance to copy
 * @param destinationServer connection to the receiving server, already scoped to its project and member
 * @param sourceSpec        how the source should serve the instance
 * @param createSpec        the instance to create on the destination; the runner sets the mode
 * @param renderer          receives transfer progress
 */
public record CopyPlan(InstanceServer sourceServer,
                       String sourceName,
                       InstanceServer destinationServer,
                       MigrationSourceSpec sourceSpec,
                       InstanceCreateSpec createSpec,
                       ProgressRenderer renderer) {

    public CopyPlan {
        Objects.requireNonNull(sourceServer, "Source server cannot be null");
        Objects.requireNonNull(sourceName, "Source name cannot be null");
        Objects.requireNonNull(destinationServer, "Destination server cannot be null");
        Objects.requireNonNull(sourceSpec, "Source spec cannot be null");
        Objects.requireNonNull(createSpec, "Create spec cannot be null");
        renderer = renderer != null ? renderer : ProgressRenderer.noop();
    }
}
