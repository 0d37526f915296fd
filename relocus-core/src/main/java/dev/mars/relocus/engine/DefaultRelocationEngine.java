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

package dev.mars.relocus.engine;

import dev.mars.relocus.capability.CapabilityProber;
import dev.mars.relocus.config.RelocusConfiguration;
import dev.mars.relocus.connection.ConnectionProvider;
import dev.mars.relocus.connection.InstanceServer;
import dev.mars.relocus.core.LocationRef;
import dev.mars.relocus.core.PeerCapabilities;
import dev.mars.relocus.core.RelocationOutcome;
import dev.mars.relocus.core.RelocationRequest;
import dev.mars.relocus.core.RelocationStatus;
import dev.mars.relocus.core.RelocationStrategy;
import dev.mars.relocus.core.exceptions.RelocationErrorKind;
import dev.mars.relocus.core.exceptions.RelocationException;
import dev.mars.relocus.executor.ExecutionContext;
import dev.mars.relocus.executor.RelocationExecutorFactory;
import dev.mars.relocus.observability.RelocationTelemetryMetrics;
import dev.mars.relocus.override.OverrideMerger;
import dev.mars.relocus.strategy.SelectionContext;
import dev.mars.relocus.strategy.StrategySelector;
import dev.mars.relocus.supervisor.OperationSupervisor;
import dev.mars.relocus.supervisor.ProgressRenderer;
import dev.mars.relocus.supervisor.RelocationContext;
import dev.mars.relocus.supervisor.RelocationPhase;
import dev.mars.relocus.transfer.TopologyRunnerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Default relocation pipeline: validate, connect, probe, select, execute.
 *
 * <p>Each request runs sequentially on the calling thread. Several requests may run at
 * once from different threads; they share only the connection provider. Capabilities are
 * probed for every request that needs them and never kept between requests.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-08
 * @version 1.0
 */
public class DefaultRelocationEngine implements RelocationEngine {
    private static final Logger logger = Logger.getLogger(DefaultRelocationEngine.class.getName());

    private final ConnectionProvider connectionProvider;
    private final CapabilityProber capabilityProber;
    private final StrategySelector strategySelector;
    private final RelocationExecutorFactory executorFactory;
    private final RequestValidator requestValidator;
    private final RelocationTelemetryMetrics metrics;

    private final ConcurrentHashMap<String, RelocationContext> activeContexts = new ConcurrentHashMap<>();
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    public DefaultRelocationEngine(ConnectionProvider connectionProvider, RelocusConfiguration configuration) {
        this(connectionProvider, configuration, new OperationSupervisor(configuration));
    }

    public DefaultRelocationEngine(ConnectionProvider connectionProvider, RelocusConfiguration configuration,
                                   OperationSupervisor supervisor) {
        this(connectionProvider, supervisor, new OverrideMerger(), new CapabilityProber(), new StrategySelector(),
                configuration.isMetricsEnabled() ? RelocationTelemetryMetrics.getInstance() : null,
                configuration);
    }

    private DefaultRelocationEngine(ConnectionProvider connectionProvider, OperationSupervisor supervisor,
                                    OverrideMerger overrideMerger, CapabilityProber capabilityProber,
                                    StrategySelector strategySelector, RelocationTelemetryMetrics metrics,
                                    RelocusConfiguration configuration) {
        this(connectionProvider, capabilityProber, strategySelector,
                new RelocationExecutorFactory(supervisor, overrideMerger,
                        new TopologyRunnerFactory(supervisor, configuration, metrics), capabilityProber),
                new RequestValidator(overrideMerger), metrics);
    }

    public DefaultRelocationEngine(ConnectionProvider connectionProvider, CapabilityProber capabilityProber,
                                   StrategySelector strategySelector, RelocationExecutorFactory executorFactory,
                                   RequestValidator requestValidator, RelocationTelemetryMetrics metrics) {
        this.connectionProvider = Objects.requireNonNull(connectionProvider, "Connection provider cannot be null");
        this.capabilityProber = Objects.requireNonNull(capabilityProber, "Capability prober cannot be null");
        this.strategySelector = Objects.requireNonNull(strategySelector, "Strategy selector cannot be null");
        this.executorFactory = Objects.requireNonNull(executorFactory, "Executor factory cannot be null");
        this.requestValidator = Objects.requireNonNull(requestValidator, "Request validator cannot be null");
        this.metrics = metrics;
        logger.info("DefaultRelocationEngine initialized");
    }

    @Override
    public RelocationOutcome relocate(RelocationRequest request) {
        return relocate(request, ProgressRenderer.noop());
    }

    @Override
    public RelocationOutcome relocate(RelocationRequest request, ProgressRenderer renderer) {
        Instant startTime = Instant.now();
        RelocationOutcome.Builder outcome = RelocationOutcome.builder()
                .requestId(request.getRequestId())
                .startTime(startTime);

        if (shutdown.get()) {
            return outcome.status(RelocationStatus.FAILURE)
                    .error(new RelocationException(RelocationErrorKind.INVALID_REQUEST, "Relocation engine is shut down"))
                    .sourceIntact(true)
                    .endTime(Instant.now())
                    .build();
        }

        RelocationContext context = new RelocationContext(request);
        if (activeContexts.putIfAbsent(request.getRequestId(), context) != null) {
            return outcome.status(RelocationStatus.FAILURE)
                    .error(new RelocationException(RelocationErrorKind.INVALID_REQUEST,
                            "A relocation with id " + request.getRequestId() + " is already running"))
                    .sourceIntact(true)
                    .endTime(Instant.now())
                    .build();
        }

        recordStarted();
        RelocationStrategy strategy = null;
        try {
            RelocationRequest normalized = requestValidator.validate(request);
            context.enterPhase(RelocationPhase.CONNECTING);
            Endpoints endpoints = connect(normalized);
            PeerCapabilities capabilities = probeIfNeeded(normalized, endpoints.source);

            context.enterPhase(RelocationPhase.SELECTING);
            strategy = strategySelector.select(SelectionContext.of(normalized, capabilities));
            logger.info("Relocating " + normalized.getSource() + " to " + normalized.getDestination() +
                    " using " + describe(strategy) + " (request " + normalized.getRequestId() + ")");

            RelocationStatus status;
            if (context.isCancelled()) {
                status = RelocationStatus.CANCELLED;
            } else {
                ExecutionContext executionContext = new ExecutionContext(normalized, endpoints.source,
                        endpoints.destination, capabilities, context, renderer);
                status = executorFactory.getExecutor(strategy).execute(executionContext);
            }
            context.enterPhase(RelocationPhase.COMPLETED);

            RelocationOutcome result = outcome.status(status)
                    .strategy(strategy)
                    .sourceIntact(status != RelocationStatus.SUCCESS)
                    .endTime(Instant.now())
                    .build();
            recordFinished(result);
            logger.info("Relocation " + request.getRequestId() + " finished: " + status.name());
            return result;

        } catch (RelocationException e) {
            logFailure(request, e);
            RelocationOutcome result = outcome.status(RelocationStatus.FAILURE)
                    .strategy(strategy)
                    .error(e)
                    .sourceIntact(true)
                    .endTime(Instant.now())
                    .build();
            recordFinished(result);
            return result;
        } finally {
            activeContexts.remove(request.getRequestId());
        }
    }

    @Override
    public RelocationStrategy plan(RelocationRequest request) throws RelocationException {
        RelocationRequest normalized = requestValidator.validate(request);
        Endpoints endpoints = connect(normalized);
        PeerCapabilities capabilities = probeIfNeeded(normalized, endpoints.source);
        return strategySelector.select(SelectionContext.of(normalized, capabilities));
    }

    @Override
    public boolean cancelRelocation(String requestId) {
        RelocationContext context = activeContexts.get(requestId);
        if (context == null) {
            return false;
        }
        context.cancel();
        return true;
    }

    @Override
    public int getActiveRelocationCount() {
        return activeContexts.size();
    }

    @Override
    public void shutdown() {
        if (shutdown.getAndSet(true)) {
            return;
        }
        logger.info("Shutting down relocation engine, cancelling " + activeContexts.size() + " relocation(s)");
        activeContexts.values().forEach(RelocationContext::cancel);
    }

    private Endpoints connect(RelocationRequest request) throws RelocationException {
        LocationRef source = request.getSource();
        LocationRef destination = request.getDestination();

        InstanceServer sourceConnection = connectionProvider.connect(source.getRemoteAlias());
        InstanceServer destinationConnection = source.isSameConnection(destination)
                ? sourceConnection
                : connectionProvider.connect(destination.getRemoteAlias());

        String destinationProject = request.changesProject()
                ? request.getProjectChange()
                : destination.getProject();
        return new Endpoints(scope(sourceConnection, source.getProject()), scope(destinationConnection, destinationProject));
    }

    private static InstanceServer scope(InstanceServer server, String project) {
        return project != null ? server.useProject(project) : server;
    }

    private PeerCapabilities probeIfNeeded(RelocationRequest request, InstanceServer source) throws RelocationException {
        if (!strategySelector.needsCapabilities(request)) {
            return PeerCapabilities.none();
        }
        return capabilityProber.probe(source);
    }

    private static String describe(RelocationStrategy strategy) {
        if (strategy instanceof RelocationStrategy.ClientMediatedCopy) {
            return strategy.kind().getLabel() + " (" + ((RelocationStrategy.ClientMediatedCopy) strategy).topology().getWireName() + ")";
        }
        return strategy.kind().getLabel();
    }

    private static void logFailure(RelocationRequest request, RelocationException e) {
        if (e.getKind() == RelocationErrorKind.ORPHANED_SOURCE_AFTER_MOVE) {
            logger.log(Level.SEVERE, "Relocation " + request.getRequestId() + " left its source behind", e);
        } else if (e.isInputError()) {
            logger.warning("Relocation " + request.getRequestId() + " rejected: " + e.getMessage());
        } else {
            logger.warning("Relocation " + request.getRequestId() + " failed: " + e.getMessage());
        }
    }

    private void recordStarted() {
        if (metrics != null) {
            metrics.recordRelocationStarted();
        }
    }

    private void recordFinished(RelocationOutcome outcome) {
        if (metrics == null) {
            return;
        }
        RelocationStrategy strategy = outcome.getStrategy().orElse(null);
        switch (outcome.getStatus()) {
            case SUCCESS:
                double seconds = outcome.getDuration().map(Duration::toMillis).orElse(0L) / 1000.0;
                metrics.recordRelocationSucceeded(strategy, seconds);
                break;
            case CANCELLED:
                metrics.recordRelocationCancelled(strategy);
                break;
            default:
                metrics.recordRelocationFailed(strategy, outcome.getErrorKind().orElse(null));
                break;
        }
    }

    private static final class Endpoints {
        private final InstanceServer source;
        private final InstanceServer destination;

        private Endpoints(InstanceServer source, InstanceServer destination) {
            this.source = source;
            this.destination = destination;
        }
    }
}
