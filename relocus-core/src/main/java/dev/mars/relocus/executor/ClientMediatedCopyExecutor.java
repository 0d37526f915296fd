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

import dev.mars.relocus.capability.CapabilityProber;
import dev.mars.relocus.connection.InstanceCreateSpec;
import dev.mars.relocus.connection.InstanceServer;
import dev.mars.relocus.connection.MigrationSourceSpec;
import dev.mars.relocus.connection.RemoteOperation;
import dev.mars.relocus.core.InstanceDefinition;
import dev.mars.relocus.core.LocationRef;
import dev.mars.relocus.core.OperationStatus;
import dev.mars.relocus.core.PeerCapabilities;
import dev.mars.relocus.core.RelocationRequest;
import dev.mars.relocus.core.RelocationStatus;
import dev.mars.relocus.core.StrategyKind;
import dev.mars.relocus.core.exceptions.OrphanedSourceAfterMoveException;
import dev.mars.relocus.core.exceptions.RelocationErrorKind;
import dev.mars.relocus.core.exceptions.RelocationException;
import dev.mars.relocus.override.OverrideMerger;
import dev.mars.relocus.override.ResolvedOverrides;
import dev.mars.relocus.supervisor.OperationSupervisor;
import dev.mars.relocus.supervisor.RelocationPhase;
import dev.mars.relocus.transfer.CopyPlan;
import dev.mars.relocus.transfer.TopologyRunner;
import dev.mars.relocus.transfer.TopologyRunnerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Moves an instance by copying it to the destination and then deleting the source.
 *
 * <p>The two phases are strictly ordered. The source is deleted only after the copy's
 * operations have reported success, and never if the relocation was cancelled first. A
 * failed or cancelled copy leaves the source untouched; cleaning up a partial destination
 * is left to the destination server. A delete that fails after a successful copy leaves
 * two instances behind and is reported as {@link OrphanedSourceAfterMoveException}.</p>
 *
 * <p>The copy keeps the source's volatile keys and ephemeral setting, includes snapshots
 * unless asked not to, and lays device overrides over the expanded devices; a device the
 * source does not have is created as given.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-07
 * @version 1.0
 */
public class ClientMediatedCopyExecutor implements RelocationExecutor {
    private static final Logger logger = Logger.getLogger(ClientMediatedCopyExecutor.class.getName());

    static final String DELETE_PROTECTION_KEY = "security.protection.delete";

    private final OperationSupervisor supervisor;
    private final OverrideMerger overrideMerger;
    private final TopologyRunnerFactory runnerFactory;
    private final CapabilityProber capabilityProber;

    public ClientMediatedCopyExecutor(OperationSupervisor supervisor, OverrideMerger overrideMerger,
                                      TopologyRunnerFactory runnerFactory, CapabilityProber capabilityProber) {
        this.supervisor = supervisor;
        this.overrideMerger = overrideMerger;
        this.runnerFactory = runnerFactory;
        this.capabilityProber = capabilityProber;
    }

    @Override
    public StrategyKind getKind() {
        return StrategyKind.CLIENT_MEDIATED_COPY;
    }

    @Override
    public RelocationStatus execute(ExecutionContext context) throws RelocationException {
        RelocationRequest request = context.request();
        LocationRef source = request.getSource();
        LocationRef destination = request.getDestination();

        TopologyRunner runner = runnerFactory.getRunner(request.getTransferMode());
        if (runner == null) {
            throw new RelocationException(RelocationErrorKind.INVALID_REQUEST,
                    "Unsupported transfer mode: " + request.getTransferMode().getWireName());
        }

        InstanceServer sourceServer = context.sourceServer();
        InstanceServer destinationServer = targetDestination(context);

        InstanceDefinition instance = sourceServer.getInstance(source.getInstanceName());
        ResolvedOverrides overrides = overrideMerger.resolve(request, instance, true);
        boolean live = request.isStateful() && instance.isRunning();

        CopyPlan plan = new CopyPlan(sourceServer, source.getInstanceName(), destinationServer,
                new MigrationSourceSpec(live, request.isInstanceOnly(), request.isAllowInconsistent(), null),
                buildCreateSpec(request, instance, overrides, live),
                context.renderer());

        // Phase 1: copy
        if (context.relocation().isCancelled()) {
            return RelocationStatus.CANCELLED;
        }
        context.relocation().enterPhase(RelocationPhase.COPYING);
        logger.info("Copying " + source + " to " + destination + " using " + runner.getMode().getWireName() + " transfer");
        OperationStatus copyStatus = runner.run(plan, context.relocation());

        if (copyStatus != OperationStatus.SUCCESS) {
            logger.info("Copy of " + source + " ended " + copyStatus.name() + ", source left untouched");
            return RelocationStatus.CANCELLED;
        }
        if (context.relocation().isCancelled()) {
            logger.warning("Relocation cancelled after copy completed; " + source +
                    " was not deleted and a copy exists at " + destination);
            return RelocationStatus.CANCELLED;
        }

        // Phase 2: delete the source, only after the copy succeeded
        context.relocation().enterPhase(RelocationPhase.DELETING_SOURCE);
        try {
            deleteSource(sourceServer, instance);
        } catch (RelocationException e) {
            OrphanedSourceAfterMoveException orphaned = new OrphanedSourceAfterMoveException(source, destination, e);
            logger.severe(orphaned.getMessage() + ". Both instances exist; remove the source manually.");
            throw orphaned;
        }

        logger.info("Moved " + source + " to " + destination);
        return RelocationStatus.SUCCESS;
    }

    private InstanceServer targetDestination(ExecutionContext context) throws RelocationException {
        RelocationRequest request = context.request();
        InstanceServer destinationServer = context.destinationServer();
        if (request.getTargetMember() == null) {
            return destinationServer;
        }
        PeerCapabilities destinationCapabilities = context.isSameConnection()
                ? context.sourceCapabilities()
                : capabilityProber.probe(destinationServer);
        if (!destinationCapabilities.isClustered()) {
            throw new RelocationException(RelocationErrorKind.INVALID_REQUEST, "--target can only be used with clusters");
        }
        return destinationServer.useTarget(request.getTargetMember());
    }

    InstanceCreateSpec buildCreateSpec(RelocationRequest request, InstanceDefinition instance,
                                       ResolvedOverrides overrides, boolean live) {
        Map<String, String> config = new LinkedHashMap<>(instance.getConfig());
        if (overrides.getConfig() != null) {
            config.putAll(overrides.getConfig());
        }

        InstanceCreateSpec.Builder builder = InstanceCreateSpec.builder()
                .name(request.getDestination().getInstanceName())
                .type(instance.getType())
                .mode(request.getTransferMode())
                .profiles(overrides.getProfiles() != null ? overrides.getProfiles() : instance.getProfiles())
                .config(config)
                .devices(instance.getDevices())
                .ephemeral(instance.isEphemeral())
                .live(live)
                .instanceOnly(request.isInstanceOnly())
                .allowInconsistent(request.isAllowInconsistent())
                .keepVolatile(true);

        if (request.getTargetPool() != null) {
            Map.Entry<String, Map<String, String>> root = findRootDisk(instance);
            Map<String, String> rootDevice = new LinkedHashMap<>(root.getValue());
            rootDevice.put("pool", request.getTargetPool());
            builder.device(root.getKey(), rootDevice);
        }
        if (overrides.getDevices() != null) {
            builder.devices(overrides.getDevices());
        }
        return builder.build();
    }

    private static Map.Entry<String, Map<String, String>> findRootDisk(InstanceDefinition instance) {
        for (Map.Entry<String, Map<String, String>> entry : instance.getExpandedDevices().entrySet()) {
            Map<String, String> device = entry.getValue();
            if ("disk".equals(device.get("type")) && "/".equals(device.get("path"))) {
                return entry;
            }
        }
        return Map.entry("root", Map.of("type", "disk", "path", "/"));
    }

    private void deleteSource(InstanceServer server, InstanceDefinition instance) throws RelocationException {
        if ("true".equalsIgnoreCase(instance.getExpandedConfig().get(DELETE_PROTECTION_KEY))) {
            logger.fine("Clearing delete protection on " + instance.getName());
            awaitDetached(server.unsetInstanceConfig(instance.getName(), DELETE_PROTECTION_KEY));
        }
        awaitDetached(server.deleteInstance(instance.getName(), true));
    }

    // The delete is not tied to the relocation's cancel flag: once the copy exists the source has to go
    private void awaitDetached(RemoteOperation operation) throws RelocationException {
        OperationStatus status = supervisor.await(operation, null);
        if (status != OperationStatus.SUCCESS) {
            throw new RelocationException(RelocationErrorKind.OPERATION_FAILED,
                    "Operation " + operation.getId() + " ended " + status.name());
        }
    }
}
