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

import dev.mars.relocus.config.RelocusConfiguration;
import dev.mars.relocus.core.TransferMode;
import dev.mars.relocus.observability.RelocationTelemetryMetrics;
import dev.mars.relocus.supervisor.OperationSupervisor;

import java.util.EnumMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Registry of topology runners by transfer mode.
 */
public class TopologyRunnerFactory {
    private static final Logger logger = Logger.getLogger(TopologyRunnerFactory.class.getName());

    private final Map<TransferMode, TopologyRunner> runners = new EnumMap<>(TransferMode.class);

    /**
     * Create a factory with no runners registered.
     */
    public TopologyRunnerFactory() {
    }

    /**
     * Create a factory with the pull, push and relay runners registered.
     */
    public TopologyRunnerFactory(OperationSupervisor supervisor, RelocusConfiguration configuration,
                                 RelocationTelemetryMetrics metrics) {
        registerRunner(new PullTopologyRunner(supervisor));
        registerRunner(new PushTopologyRunner(supervisor));
        registerRunner(new RelayTopologyRunner(supervisor, configuration.getRelayBufferSize(), metrics));
        logger.fine("Registered default topology runners: pull, push, relay");
    }

    public void registerRunner(TopologyRunner runner) {
        runners.put(runner.getMode(), runner);
        logger.fine("Registered topology runner: " + runner.getMode().getWireName());
    }

    /**
     * @return the runner for a mode, or null if none is registered
     */
    public TopologyRunner getRunner(TransferMode mode) {
        return mode != null ? runners.get(mode) : null;
    }

    public boolean isSupported(TransferMode mode) {
        return mode != null && runners.containsKey(mode);
    }
}
