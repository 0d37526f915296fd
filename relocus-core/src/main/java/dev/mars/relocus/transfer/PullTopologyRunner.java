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
import dev.mars.relocus.connection.MigrationEndpoint;
import dev.mars.relocus.core.OperationStatus;
import dev.mars.relocus.core.TransferMode;
import dev.mars.relocus.core.exceptions.RelocationException;
import dev.mars.relocus.supervisor.OperationSupervisor;
import dev.mars.relocus.supervisor.RelocationContext;

import java.util.logging.Logger;

/**
 * The source listens and the destination connects to it and reads.
 */
public class PullTopologyRunner extends AbstractTopologyRunner {
    private static final Logger logger = Logger.getLogger(PullTopologyRunner.class.getName());

    public PullTopologyRunner(OperationSupervisor supervisor) {
        super(supervisor);
    }

    @Override
    public TransferMode getMode() {
        return TransferMode.PULL;
    }

    @Override
    public OperationStatus run(CopyPlan plan, RelocationContext context) throws RelocationException {
        MigrationEndpoint source = plan.sourceServer().prepareMigrationSource(plan.sourceName(), plan.sourceSpec().withTarget(null));
        logger.fine("Source " + plan.sourceName() + " listening on operation " + source.getOperation().getId());

        InstanceCreateSpec create = plan.createSpec().toBuilder()
                .mode(TransferMode.PULL)
                .sourceEndpoint(source)
                .build();

        MigrationEndpoint destination;
        try {
            destination = plan.destinationServer().createInstanceFromMigration(create);
        } catch (RelocationException e) {
            abandon(source.getOperation(), e);
            throw e;
        }

        logger.info("Destination pulling " + plan.sourceName() + " as " + create.getName() +
                " (operation " + destination.getOperation().getId() + ")");
        return awaitBoth(destination.getOperation(), source.getOperation(), plan.renderer(), context);
    }
}
