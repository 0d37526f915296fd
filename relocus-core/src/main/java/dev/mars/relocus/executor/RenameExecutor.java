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
import dev.mars.relocus.connection.RemoteOperation;
import dev.mars.relocus.core.LocationRef;
import dev.mars.relocus.core.OperationStatus;
import dev.mars.relocus.core.RelocationStatus;
import dev.mars.relocus.core.StrategyKind;
import dev.mars.relocus.core.exceptions.RelocationException;
import dev.mars.relocus.supervisor.OperationSupervisor;
import dev.mars.relocus.supervisor.RelocationPhase;

import java.util.logging.Logger;

/**
 * Renames an instance, or a snapshot within its instance, in place.
 *
 * <p>A single request; the name either changes or it does not. Failures are not retried
 * since a blind retry cannot tell whether the first attempt took effect.</p>
 */
public class RenameExecutor implements RelocationExecutor {
    private static final Logger logger = Logger.getLogger(RenameExecutor.class.getName());

    private final OperationSupervisor supervisor;

    public RenameExecutor(OperationSupervisor supervisor) {
        this.supervisor = supervisor;
    }

    @Override
    public StrategyKind getKind() {
        return StrategyKind.RENAME;
    }

    @Override
    public RelocationStatus execute(ExecutionContext context) throws RelocationException {
        LocationRef source = context.request().getSource();
        LocationRef destination = context.request().getDestination();
        InstanceServer server = context.sourceServer();
        context.relocation().enterPhase(RelocationPhase.RENAMING);

        RemoteOperation operation;
        if (source.isSnapshot()) {
            logger.info("Renaming snapshot " + source + " to " + destination.getSnapshotName());
            operation = server.renameSnapshot(source.getInstanceName(), source.getSnapshotName(), destination.getSnapshotName());
        } else {
            logger.info("Renaming instance " + source + " to " + destination.getInstanceName());
            operation = server.renameInstance(source.getInstanceName(), destination.getInstanceName());
        }

        OperationStatus status = supervisor.await(operation, context.relocation());
        return RelocationStatus.fromOperation(status);
    }
}
