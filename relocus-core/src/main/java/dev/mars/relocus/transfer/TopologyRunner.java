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

import dev.mars.relocus.core.OperationStatus;
import dev.mars.relocus.core.TransferMode;
import dev.mars.relocus.core.exceptions.RelocationException;
import dev.mars.relocus.supervisor.RelocationContext;

/**
 * Runs the data path of a client-mediated copy for one transfer mode.
 */
public interface TopologyRunner {

    TransferMode getMode();

    /**
     * Start the copy and wait until the destination instance is complete.
     *
     * @return {@link OperationStatus#SUCCESS} once both sides report success, or
     *         {@link OperationStatus#CANCELLED}
     * @throws RelocationException if either side fails or cannot be reached
     */
    OperationStatus run(CopyPlan plan, RelocationContext context) throws RelocationException;
}
