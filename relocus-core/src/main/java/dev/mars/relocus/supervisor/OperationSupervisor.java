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

import dev.mars.relocus.config.RelocusConfiguration;
import dev.mars.relocus.connection.RemoteOperation;
import dev.mars.relocus.core.OperationStatus;
import dev.mars.relocus.core.exceptions.OperationFailedException;
import dev.mars.relocus.core.exceptions.RelocationErrorKind;
import dev.mars.relocus.core.exceptions.RelocationException;

import java.time.Duration;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Follows a remote operation to its end.
 *
 * <p>The supervisor polls the operation until the server reports a terminal state. While
 * waiting it watches the relocation's cancel flag and forwards it to the server once; the
 * server decides whether the operation ends cancelled. If the waiting thread is interrupted
 * the supervisor asks the server to cancel, restores the interrupt flag and returns
 * {@link OperationStatus#CANCELLED} without waiting further. An optional wait bound turns a
 * never-ending operation into an {@code OPERATION_TIMEOUT} error.</p>
 *
 * <p>A failed operation is reported as {@link OperationFailedException} carrying the
 * server's message unchanged.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-06
 * @version 1.0
 */
public class OperationSupervisor {
    private static final Logger logger = Logger.getLogger(OperationSupervisor.class.getName());

    private final Duration pollInterval;
    private final Duration waitTimeout;

    public OperationSupervisor(RelocusConfiguration configuration) {
        this(Duration.ofMillis(configuration.getOperationPollIntervalMs()), configuration.getOperationWaitTimeout());
    }

    /**
     * @param pollInterval how often to ask the server for status
     * @param waitTimeout  how long to wait for one operation, or null to wait until it ends
     */
    public OperationSupervisor(Duration pollInterval, Duration waitTimeout) {
        this.pollInterval = Objects.requireNonNull(pollInterval, "Poll interval cannot be null");
        if (pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("Poll interval must be positive");
        }
        this.waitTimeout = waitTimeout;
    }

    public Duration getWaitTimeout() {
        return waitTimeout;
    }

    /**
     * Forward the operation's progress to a renderer, wait for it, and close the renderer.
     */
    public OperationStatus supervise(RemoteOperation operation, ProgressRenderer renderer, RelocationContext context)
            throws RelocationException {
        attach(operation, renderer);
        try {
            return await(operation, context);
        } finally {
            renderer.done("");
        }
    }

    public void attach(RemoteOperation operation, ProgressRenderer renderer) {
        operation.addProgressHandler(event -> {
            if (event.hasProgress()) {
                renderer.update(event.getProgressText());
            }
        });
    }

    /**
     * Wait for an operation to end.
     *
     * @param context the relocation whose cancel flag is forwarded, or null to ignore cancellation
     * @return {@link OperationStatus#SUCCESS} or {@link OperationStatus#CANCELLED}
     * @throws OperationFailedException if the server reports failure
     * @throws RelocationException      with kind OPERATION_TIMEOUT if the wait bound is exceeded
     */
    public OperationStatus await(RemoteOperation operation, RelocationContext context) throws RelocationException {
        long start = System.nanoTime();
        boolean cancelRequested = false;
        logger.fine("Waiting for operation " + operation.getId());

        try {
            while (true) {
                if (context != null && context.isCancelled() && !cancelRequested) {
                    requestCancel(operation);
                    cancelRequested = true;
                }

                Duration slice = pollInterval;
                if (waitTimeout != null) {
                    Duration remaining = waitTimeout.minus(Duration.ofNanos(System.nanoTime() - start));
                    if (remaining.isZero() || remaining.isNegative()) {
                        logger.warning("Operation " + operation.getId() + " did not finish within " +
                                waitTimeout.toMillis() + " ms, requesting cancellation");
                        requestCancel(operation);
                        throw new RelocationException(RelocationErrorKind.OPERATION_TIMEOUT,
                                "Operation " + operation.getId() + " did not finish within " + waitTimeout.toMillis() + " ms");
                    }
                    if (remaining.compareTo(slice) < 0) {
                        slice = remaining;
                    }
                }

                OperationStatus status = operation.waitFor(slice);
                if (status.isTerminal()) {
                    return finish(operation, status);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warning("Interrupted while waiting for operation " + operation.getId() + ", requesting cancellation");
            if (!cancelRequested) {
                requestCancel(operation);
            }
            if (context != null) {
                context.cancel();
            }
            return OperationStatus.CANCELLED;
        }
    }

    private OperationStatus finish(RemoteOperation operation, OperationStatus status) throws OperationFailedException {
        logger.fine("Operation " + operation.getId() + " finished: " + status.name());
        if (status == OperationStatus.FAILURE) {
            throw new OperationFailedException(operation.getId(), operation.getError().orElse("Operation failed"));
        }
        return status;
    }

    /**
     * Ask the server to cancel. A failure to deliver the request is logged; the caller
     * keeps its original outcome.
     */
    public void requestCancel(RemoteOperation operation) {
        try {
            operation.cancel();
        } catch (RelocationException e) {
            logger.warning("Failed to cancel operation " + operation.getId() + ": " + e.getMessage());
        }
    }
}
