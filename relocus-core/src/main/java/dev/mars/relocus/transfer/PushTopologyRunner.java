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
 * The destination listens and the source connects to it and writes.
 */
public class PushTopologyRunner extends AbstractTopologyRunner {
    private static final Logger logger = Logger.getLogger(PushTopologyRunner.class.getName());

    public PushTopologyRunner(OperationSupervisor supervisor) {
        super(supervisor);
    }

    @Override
    public TransferMode getMode() {
        return TransferMode.PUSH;
    }

    @Override
    public OperationStatus run(CopyPlan plan, RelocationContext context) throws RelocationException {
        InstanceCreateSpec create = plan.createSpec().toBuilder()
                .mode(TransferMode.PUSH)
                .sourceEndpoint(null)
                .build();
        MigrationEndpoint destination = plan.destinationServer().createInstanceFromMigration(create);
        logger.fine("Destination " + create.getName() + " listening on operation " + destination.getOperation().getId());

        MigrationEndpoint source;
        try {
            source = plan.sourceServer().prepareMigrationSource(plan.sourceName(), plan.sourceSpec().withTarget(destination));
        } catch (RelocationException e) {
            abandon(destination.getOperation(), e);
            throw e;
        }

        logger.info("Source pushing " + plan.sourceName() + " as " + create.getName() +
                " (operation " + source.getOperation().getId() + ")");
        return awaitBoth(source.getOperation(), destination.getOperation(), plan.renderer(), context);
    }
}
