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

package dev.mars.relocus.core;

/**
 * Lifecycle status of an asynchronous operation tracked by a server.
 *
 * The normal flow is:
 * PENDING -> RUNNING -> SUCCESS
 *
 * Alternative flows:
 * RUNNING -> FAILURE (the server reported an error)
 * RUNNING -> CANCELLED (the server honoured a cancel request)
 * PENDING -> FAILURE | CANCELLED (rejected or cancelled before it started)
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-03
 * @version 1.0
 */
public enum OperationStatus {

    /**
     * Accepted by the server but not yet started.
     */
    PENDING("Operation pending", false, false),

    /**
     * The server is executing the operation.
     */
    RUNNING("Operation running", false, false),

    /**
     * Completed successfully. Terminal.
     */
    SUCCESS("Operation succeeded", true, true),

    /**
     * Completed with an error reported by the server. Terminal.
     */
    FAILURE("Operation failed", true, false),

    /**
     * Cancelled by the server after a cancel request. Terminal.
     */
    CANCELLED("Operation cancelled", true, false);

    private final String description;
    private final boolean terminal;
    private final boolean successful;

    OperationStatus(String description, boolean terminal, boolean successful) {
        this.description = description;
        this.terminal = terminal;
        this.successful = successful;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Terminal states cannot transition to other states.
     */
    public boolean isTerminal() {
        return terminal;
    }

    public boolean isSuccessful() {
        return successful;
    }

    /**
     * A cancel request is only meaningful while the operation has not finished.
     */
    public boolean isCancellable() {
        return this == PENDING || this == RUNNING;
    }

    /**
     * Check if transition from this status to the target status is valid.
     *
     * @param target the target status to transition to
     * @return true if the transition is valid
     */
    public boolean canTransitionTo(OperationStatus target) {
        if (this.isTerminal()) {
            return false;
        }

        switch (this) {
            case PENDING:
                return target == RUNNING || target == FAILURE || target == CANCELLED;

            case RUNNING:
                return target == SUCCESS || target == FAILURE || target == CANCELLED;

            default:
                return false;
        }
    }

    /**
     * Get all valid transition targets from this status.
     *
     * @return array of valid target statuses
     */
    public OperationStatus[] getValidTransitions() {
        switch (this) {
            case PENDING:
                return new OperationStatus[]{RUNNING, FAILURE, CANCELLED};
            case RUNNING:
                return new OperationStatus[]{SUCCESS, FAILURE, CANCELLED};
            default:
                return new OperationStatus[0];
        }
    }

    @Override
    public String toString() {
        return name() + " (" + description + ")";
    }
}
