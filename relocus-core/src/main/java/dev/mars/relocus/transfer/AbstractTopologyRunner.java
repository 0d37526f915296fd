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

import dev.mars.relocus.connection.RemoteOperation;
import dev.mars.relocus.core.OperationStatus;
import dev.mars.relocus.core.exceptions.RelocationException;
import dev.mars.relocus.supervisor.OperationSupervisor;
import dev.mars.relocus.supervisor.ProgressRenderer;
import dev.mars.relocus.supervisor.RelocationContext;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Shared waiting logic: every topology ends with one operation on each server, and the
 * copy only counts when both succeed.
 */
public abstract class AbstractTopologyRunner implements TopologyRunner {
    private static final Logger logger = Logger.getLogger(AbstractTopologyRunner.class.getName());

    protected final OperationSupervisor supervisor;

    protected AbstractTopologyRunner(OperationSupervisor supervisor) {
        this.supervisor = Objects.requireNonNull(supervisor, "Supervisor cannot be null");
    }

    /**
     * Wait for the operation that reports progress, then for its peer. If the first does
     * not succeed the peer is asked to cancel.
     */
    protected OperationStatus awaitBoth(RemoteOperation primary, RemoteOperation secondary,
                                        ProgressRenderer renderer, RelocationContext context) throws RelocationException {
        OperationStatus status;
        try {
            status = supervisor.supervise(primary, renderer, context);
        } catch (RelocationException e) {
            supervisor.requestCancel(secondary);
            throw e;
        }
        if (status != OperationStatus.SUCCESS) {
            logger.info("Operation " + primary.getId() + " ended " + status.name() + ", cancelling peer operation " + secondary.getId());
            supervisor.requestCancel(secondary);
            return status;
        }
        return supervisor.await(secondary, context);
    }

    /**
     * Cancel an operation that was started before a later step of the setup failed.
     */
    protected void abandon(RemoteOperation operation, RelocationException cause) {
        logger.warning("Abandoning operation " + operation.getId() + " after setup failure: " + cause.getMessage());
        supervisor.requestCancel(operation);
    }
}
