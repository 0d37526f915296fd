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
import dev.mars.relocus.connection.MigrationChannel;
import dev.mars.relocus.connection.MigrationEndpoint;
import dev.mars.relocus.core.OperationStatus;
import dev.mars.relocus.core.TransferMode;
import dev.mars.relocus.core.exceptions.RelocationErrorKind;
import dev.mars.relocus.core.exceptions.RelocationException;
import dev.mars.relocus.observability.RelocationTelemetryMetrics;
import dev.mars.relocus.supervisor.OperationSupervisor;
import dev.mars.relocus.supervisor.RelocationContext;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Both servers listen; this client connects to each and copies bytes between them.
 *
 * <p>Useful when neither server can reach the other but both are reachable from here,
 * at the cost of carrying every byte twice.</p>
 */
public class RelayTopologyRunner extends AbstractTopologyRunner {
    private static final Logger logger = Logger.getLogger(RelayTopologyRunner.class.getName());
    private static final long DRAIN_TIMEOUT_SECONDS = 5;

    private final int bufferSize;
    private final RelocationTelemetryMetrics metrics;

    public RelayTopologyRunner(OperationSupervisor supervisor, int bufferSize, RelocationTelemetryMetrics metrics) {
        super(supervisor);
        this.bufferSize = bufferSize;
        this.metrics = metrics;
    }

    @Override
    public TransferMode getMode() {
        return TransferMode.RELAY;
    }

    @Override
    public OperationStatus run(CopyPlan plan, RelocationContext context) throws RelocationException {
        MigrationEndpoint source = plan.sourceServer().prepareMigrationSource(plan.sourceName(), plan.sourceSpec().withTarget(null));

        InstanceCreateSpec create = plan.createSpec().toBuilder()
                .mode(TransferMode.RELAY)
                .sourceEndpoint(null)
                .build();
        MigrationEndpoint destination;
        try {
            destination = plan.destinationServer().createInstanceFromMigration(create);
        } catch (RelocationException e) {
            abandon(source.getOperation(), e);
            throw e;
        }

        TreeSet<String> channelNames = new TreeSet<>(source.getChannelNames());
        channelNames.retainAll(destination.getChannelNames());
        if (channelNames.isEmpty()) {
            RelocationException e = new RelocationException(RelocationErrorKind.OPERATION_FAILED,
                    "Source and destination share no migration channels to relay");
            abandon(source.getOperation(), e);
            abandon(destination.getOperation(), e);
            throw e;
        }

        RelayPump pump = new RelayPump(bufferSize);
        try {
            List<MigrationChannel[]> pairs = new ArrayList<>();
            try {
                for (String channelName : channelNames) {
                    MigrationChannel from = plan.sourceServer().openMigrationChannel(source, channelName);
                    MigrationChannel to = plan.destinationServer().openMigrationChannel(destination, channelName);
                    pairs.add(new MigrationChannel[]{from, to});
                }
            } catch (RelocationException e) {
                closeAll(pairs);
                abandon(source.getOperation(), e);
                abandon(destination.getOperation(), e);
                throw e;
            }

            logger.info("Relaying " + plan.sourceName() + " to " + create.getName() + " over channels " + channelNames);
            pump.start(pairs);

            OperationStatus status;
            try {
                status = awaitBoth(destination.getOperation(), source.getOperation(), plan.renderer(), context);
            } catch (RelocationException e) {
                IOException relayFailure = pump.getFailure();
                if (relayFailure != null) {
                    e.addSuppressed(relayFailure);
                }
                throw e;
            }
            if (status == OperationStatus.SUCCESS) {
                drain(pump);
            }
            return status;
        } finally {
            pump.close();
            if (metrics != null) {
                metrics.recordRelayBytes(pump.getBytesRelayed());
            }
        }
    }

    // Both operations finished; the pump threads may still be forwarding the last buffers
    private static void drain(RelayPump pump) {
        try {
            if (!pump.awaitCompletion(DRAIN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                logger.warning("Relay channels still open " + DRAIN_TIMEOUT_SECONDS + "s after both operations finished");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.fine("Interrupted while draining relay");
        }
    }

    private static void closeAll(List<MigrationChannel[]> pairs) {
        for (MigrationChannel[] pair : pairs) {
            for (MigrationChannel channel : pair) {
                try {
                    channel.close();
                } catch (IOException e) {
                    logger.fine("Error closing channel " + channel.getName() + ": " + e.getMessage());
                }
            }
        }
    }
}
