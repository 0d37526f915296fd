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
import dev.mars.relocus.core.RelocationStrategy;
import dev.mars.relocus.core.StrategyKind;
import dev.mars.relocus.override.OverrideMerger;
import dev.mars.relocus.supervisor.OperationSupervisor;
import dev.mars.relocus.transfer.TopologyRunnerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Registry of executors by strategy kind.
 */
public class RelocationExecutorFactory {
    private static final Logger logger = Logger.getLogger(RelocationExecutorFactory.class.getName());

    private final Map<StrategyKind, RelocationExecutor> executors = new EnumMap<>(StrategyKind.class);

    public RelocationExecutorFactory(OperationSupervisor supervisor, OverrideMerger overrideMerger,
                                     TopologyRunnerFactory runnerFactory, CapabilityProber capabilityProber) {
        registerExecutor(new RenameExecutor(supervisor));
        registerExecutor(new ServerSideMoveExecutor(supervisor, overrideMerger));
        registerExecutor(new ClientMediatedCopyExecutor(supervisor, overrideMerger, runnerFactory, capabilityProber));
    }

    public void registerExecutor(RelocationExecutor executor) {
        executors.put(executor.getKind(), executor);
        logger.fine("Registered executor: " + executor.getKind().getLabel());
    }

    /**
     * @throws IllegalStateException if no executor is registered for the strategy
     */
    public RelocationExecutor getExecutor(RelocationStrategy strategy) {
        RelocationExecutor executor = executors.get(strategy.kind());
        if (executor == null) {
            throw new IllegalStateException("No executor registered for strategy " + strategy.kind().getLabel());
        }
        return executor;
    }
}
