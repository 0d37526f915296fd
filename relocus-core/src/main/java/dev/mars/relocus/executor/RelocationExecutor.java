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

import dev.mars.relocus.core.RelocationStatus;
import dev.mars.relocus.core.StrategyKind;
import dev.mars.relocus.core.exceptions.RelocationException;

/**
 * Carries out one relocation strategy.
 */
public interface RelocationExecutor {

    StrategyKind getKind();

    /**
     * Run the strategy to its end.
     *
     * @return {@link RelocationStatus#SUCCESS} or {@link RelocationStatus#CANCELLED}
     * @throws RelocationException for every failure; server errors are passed on unchanged
     */
    RelocationStatus execute(ExecutionContext context) throws RelocationException;
}
