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

package dev.mars.relocus.supervisor;

import dev.mars.relocus.core.RelocationRequest;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * Per-request state shared between the engine, the executors and any thread that
 * wants to cancel the relocation.
 *
 * <p>Cancellation is cooperative: {@link #cancel()} only raises a flag, which the
 * supervisor turns into a cancel request to whichever remote operation is running and
 * which the executors check before starting any further phase.</p>
 */
public class RelocationContext {
    private static final Logger logger = Logger.getLogger(RelocationContext.class.getName());

    private final RelocationRequest request;
    private final AtomicBoolean cancelled;
    private volatile RelocationPhase phase;

    public RelocationContext(RelocationRequest request) {
        this.request = Objects.requireNonNull(request, "Request cannot be null");
        this.cancelled = new AtomicBoolean(false);
        this.phase = RelocationPhase.VALIDATING;
    }

    public RelocationRequest getRequest() {
        return request;
    }

    public String getRequestId() {
        return request.getRequestId();
    }

    public RelocationPhase getPhase() {
        return phase;
    }

    public void enterPhase(RelocationPhase next) {
        logger.fine("Relocation " + request.getRequestId() + ": " + phase.name() + " -> " + next.name());
        this.phase = next;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * @return true if this call raised the flag, false if it was already raised
     */
    public boolean cancel() {
        boolean first = cancelled.compareAndSet(false, true);
        if (first) {
            logger.info("Cancellation requested for relocation " + request.getRequestId() + " during " + phase.name());
        }
        return first;
    }
}
