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

import dev.mars.relocus.connection.InstanceMigration;
import dev.mars.relocus.connection.InstanceServer;
import dev.mars.relocus.connection.RemoteOperation;
import dev.mars.relocus.core.InstanceDefinition;
import dev.mars.relocus.core.OperationStatus;
import dev.mars.relocus.core.RelocationRequest;
import dev.mars.relocus.core.RelocationStatus;
import dev.mars.relocus.core.StrategyKind;
import dev.mars.relocus.core.exceptions.RelocationErrorKind;
import dev.mars.relocus.core.exceptions.RelocationException;
import dev.mars.relocus.override.OverrideMerger;
import dev.mars.relocus.override.ResolvedOverrides;
import dev.mars.relocus.supervisor.OperationSupervisor;
import dev.mars.relocus.supervisor.RelocationPhase;

import java.util.logging.Logger;

/**
 * Asks the source server to relocate the instance itself, in one operation.
 *
 * <p>The server moves the instance between cluster members, pools or projects and
 * retargets it; no separate delete is issued. If the operation fails the server leaves
 * the instance where it was.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-07
 * @version 1.0
 */
public class ServerSideMoveExecutor implements RelocationExecutor {
    private static final Logger logger = Logger.getLogger(ServerSideMoveExecutor.class.getName());

    private final OperationSupervisor supervisor;
    private final OverrideMerger overrideMerger;

    public ServerSideMoveExecutor(OperationSupervisor supervisor, OverrideMerger overrideMerger) {
        this.supervisor = supervisor;
        this.overrideMerger = overrideMerger;
    }

    @Override
    public StrategyKind getKind() {
        return StrategyKind.SERVER_SIDE_MOVE;
    }

    @Override
    public RelocationStatus execute(ExecutionContext context) throws RelocationException {
        RelocationRequest request = context.request();
        String sourceName = request.getSource().getInstanceName();
        InstanceServer server = context.sourceServer();

        if (request.getTargetMember() != null) {
            if (!context.sourceCapabilities().isClustered()) {
                throw new RelocationException(RelocationErrorKind.INVALID_REQUEST, "--target can only be used with clusters");
            }
            server = server.useTarget(request.getTargetMember());
        }

        // The server cannot create devices during a move, so every overridden device must exist
        InstanceDefinition instance = request.hasDeviceOverrides() ? server.getInstance(sourceName) : null;
        ResolvedOverrides overrides = overrideMerger.resolve(request, instance, false);

        InstanceMigration migration = InstanceMigration.builder()
                .name(request.getDestination().getInstanceName())
                .live(request.isStateful())
                .instanceOnly(request.isInstanceOnly())
                .pool(request.getTargetPool())
                .project(request.getProjectChange())
                .profiles(overrides.getProfiles())
                .config(overrides.getConfig())
                .devices(overrides.getDevices())
                .build();

        if (context.relocation().isCancelled()) {
            return RelocationStatus.CANCELLED;
        }

        context.relocation().enterPhase(RelocationPhase.MOVING);
        logger.info("Submitting server-side move of " + request.getSource() + ": " + migration);
        RemoteOperation operation = server.migrateInstance(sourceName, migration);

        OperationStatus status = supervisor.supervise(operation, context.renderer(), context.relocation());
        return RelocationStatus.fromOperation(status);
    }
}
