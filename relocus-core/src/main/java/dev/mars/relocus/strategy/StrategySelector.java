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

package dev.mars.relocus.strategy;

import dev.mars.relocus.core.PeerCapabilities;
import dev.mars.relocus.core.RelocationRequest;
import dev.mars.relocus.core.RelocationStrategy;
import dev.mars.relocus.core.TransferMode;

import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Chooses the cheapest strategy that can carry out a relocation.
 *
 * <p>Rules are evaluated in a fixed order and the first match wins:</p>
 * <ol>
 *   <li><b>rename</b> - same remote and project, no target member or pool, and no overrides</li>
 *   <li><b>server-side-move</b> - same remote, default transfer mode, and the server supports
 *       every requested change: config, device or profile overrides need
 *       {@code instance_move_config}, a pool change needs {@code instance_pool_move}, and a
 *       project change (target project or a destination in another project) needs {@code instance_project_move}</li>
 *   <li><b>client-mediated-copy</b> - always, using the requested transfer mode</li>
 * </ol>
 *
 * <p>Selection performs no I/O and is deterministic for a given context.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-06
 * @version 1.0
 */
public class StrategySelector {
    private static final Logger logger = Logger.getLogger(StrategySelector.class.getName());

    public static final SelectionRule RENAME = new SelectionRule("rename",
            StrategySelector::isRenameEligible,
            context -> RelocationStrategy.rename());

    public static final SelectionRule SERVER_SIDE_MOVE = new SelectionRule("server-side-move",
            StrategySelector::isServerSideMoveEligible,
            context -> RelocationStrategy.serverSideMove());

    public static final SelectionRule CLIENT_MEDIATED_COPY = new SelectionRule("client-mediated-copy",
            context -> true,
            context -> RelocationStrategy.copy(context.request().getTransferMode()));

    private static final List<SelectionRule> DEFAULT_RULES = List.of(RENAME, SERVER_SIDE_MOVE, CLIENT_MEDIATED_COPY);

    private final List<SelectionRule> rules;

    public StrategySelector() {
        this(DEFAULT_RULES);
    }

    public StrategySelector(List<SelectionRule> rules) {
        if (rules == null || rules.isEmpty()) {
            throw new IllegalArgumentException("At least one selection rule is required");
        }
        this.rules = List.copyOf(rules);
    }

    public List<SelectionRule> getRules() {
        return rules;
    }

    /**
     * @throws IllegalStateException if no rule matches, which cannot happen with the default rules
     */
    public RelocationStrategy select(SelectionContext context) {
        for (SelectionRule rule : rules) {
            Optional<RelocationStrategy> strategy = rule.evaluate(context);
            if (strategy.isPresent()) {
                logger.fine("Rule '" + rule.getName() + "' matched request " + context.request().getRequestId());
                return strategy.get();
            }
            logger.finer("Rule '" + rule.getName() + "' did not match");
        }
        throw new IllegalStateException("No selection rule matched request " + context.request().getRequestId());
    }

    /**
     * Whether selection for this request depends on the source server's capabilities.
     * When false the caller can skip probing.
     */
    public boolean needsCapabilities(RelocationRequest request) {
        return request.getSource().isSameConnection(request.getDestination())
                && !isRenameEligible(SelectionContext.of(request, PeerCapabilities.none()));
    }

    static boolean isRenameEligible(SelectionContext context) {
        RelocationRequest request = context.request();
        return context.sameConnection() && !request.hasTargets() && !request.hasOverrides();
    }

    static boolean isServerSideMoveEligible(SelectionContext context) {
        RelocationRequest request = context.request();
        PeerCapabilities capabilities = context.capabilities();
        if (!context.sameConnection()) {
            return false;
        }
        if (request.getTransferMode() != TransferMode.DEFAULT) {
            return false;
        }
        if (request.hasOverrides() && !capabilities.canMoveConfig()) {
            return false;
        }
        if (request.getTargetPool() != null && !capabilities.canMovePool()) {
            return false;
        }
        return !request.changesProject() || capabilities.canMoveProject();
    }
}
