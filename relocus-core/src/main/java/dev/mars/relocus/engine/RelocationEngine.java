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

import dev.mars.relocus.core.RelocationOutcome;
import dev.mars.relocus.core.RelocationRequest;
import dev.mars.relocus.core.RelocationStrategy;
import dev.mars.relocus.core.exceptions.RelocationException;
import dev.mars.relocus.supervisor.ProgressRenderer;

/**
 * Moves instances between locations, choosing the cheapest strategy that works.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-08
 * @version 1.0
 */
public interface RelocationEngine {

    /**
     * Run a relocation to its end. Blocks the calling thread.
     *
     * <p>Failures are not thrown: the outcome carries the terminal status and, for
     * {@code FAILURE}, the error.</p>
     */
    RelocationOutcome relocate(RelocationRequest request);

    /**
     * Same as {@link #relocate(RelocationRequest)}, forwarding transfer progress to a renderer.
     */
    RelocationOutcome relocate(RelocationRequest request, ProgressRenderer renderer);

    /**
     * Validate, connect, probe and select without changing anything on either server.
     */
    RelocationStrategy plan(RelocationRequest request) throws RelocationException;

    /**
     * Ask a running relocation to stop. The remote operation in progress is asked to cancel
     * and no further phase is started.
     *
     * @return true if a relocation with that id was running
     */
    boolean cancelRelocation(String requestId);

    int getActiveRelocationCount();

    /**
     * Cancel every running relocation and refuse new ones.
     */
    void shutdown();
}
