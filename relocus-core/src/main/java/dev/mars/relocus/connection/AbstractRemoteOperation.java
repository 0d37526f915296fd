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

package dev.mars.relocus.connection;

import dev.mars.relocus.core.OperationStatus;
import dev.mars.relocus.core.exceptions.RelocationException;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Status bookkeeping shared by operation handles.
 *
 * <p>Subclasses fetch state from their server in {@link #fetchState()} and report it
 * through {@link #observe(OperationStatus, String, Map)}; this class enforces the
 * operation lifecycle, notifies progress handlers, and implements polling waits that
 * wake early when a status change is observed from another thread.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 * @version 1.0
 */
public abstract class AbstractRemoteOperation implements RemoteOperation {
    private static final Logger logger = Logger.getLogger(AbstractRemoteOperation.class.getName());

    private final String id;
    private final long pollIntervalNanos;
    private final List<Consumer<OperationEvent>> handlers = new CopyOnWriteArrayList<>();

    private final Lock stateLock = new ReentrantLock();
    private final Condition stateChanged = stateLock.newCondition();

    private volatile OperationStatus status;
    private volatile String error;

    protected AbstractRemoteOperation(String id, OperationStatus initialStatus, Duration pollInterval) {
        this.id = Objects.requireNonNull(id, "Operation ID cannot be null");
        this.status = Objects.requireNonNull(initialStatus, "Initial status cannot be null");
        this.pollIntervalNanos = pollInterval.toNanos();
    }

    /**
     * Fetch the operation's state from the server and report it through {@link #observe}.
     */
    protected abstract void fetchState() throws RelocationException;

    /**
     * Send the cancel request to the server.
     */
    protected abstract void requestCancel() throws RelocationException;

    @Override
    public String getId() {
        return id;
    }

    @Override
    public OperationStatus getStatus() {
        return status;
    }

    @Override
    public Optional<String> getError() {
        return Optional.ofNullable(error);
    }

    @Override
    public OperationStatus refresh() throws RelocationException {
        if (!status.isTerminal()) {
            fetchState();
        }
        return status;
    }

    @Override
    public OperationStatus waitFor(Duration timeout) throws RelocationException, InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            OperationStatus current = refresh();
            if (current.isTerminal()) {
                return current;
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return current;
            }
            stateLock.lock();
            try {
                if (!status.isTerminal()) {
                    stateChanged.awaitNanos(Math.min(remaining, pollIntervalNanos));
                }
            } finally {
                stateLock.unlock();
            }
        }
    }

    @Override
    public void cancel() throws RelocationException {
        if (!status.isCancellable()) {
            logger.fine("Operation " + id + " already " + status.name() + ", not cancelling");
            return;
        }
        logger.info("Requesting cancellation of operation " + id);
        requestCancel();
    }

    @Override
    public void addProgressHandler(Consumer<OperationEvent> handler) {
        handlers.add(Objects.requireNonNull(handler, "Handler cannot be null"));
    }

    /**
     * Record state reported by the server. A skipped RUNNING state is filled in; a report
     * that contradicts the lifecycle (for example a change after a terminal state) is
     * logged and ignored.
     */
    protected void observe(OperationStatus reported, String errorMessage, Map<String, String> progress) {
        boolean changed = false;
        stateLock.lock();
        try {
            if (reported != status) {
                if (!isValidReport(reported)) {
                    logger.warning("Ignoring status report for operation " + id + ": " + status.name() + " -> "
                            + reported.name() + " is not one of " + Arrays.toString(status.getValidTransitions()));
                    return;
                }
                if (status == OperationStatus.PENDING && reported != OperationStatus.RUNNING) {
                    transitionTo(OperationStatus.RUNNING);
                }
                transitionTo(reported);
                changed = true;
            }
            if (errorMessage != null && !errorMessage.isEmpty()) {
                this.error = errorMessage;
            }
            if (changed) {
                stateChanged.signalAll();
            }
        } finally {
            stateLock.unlock();
        }

        if (changed || (progress != null && !progress.isEmpty())) {
            fireEvent(new OperationEvent(id, status, progress));
        }
    }

    // A pending operation may skip straight past RUNNING
    private boolean isValidReport(OperationStatus reported) {
        if (status.canTransitionTo(reported)) {
            return true;
        }
        return status == OperationStatus.PENDING && OperationStatus.RUNNING.canTransitionTo(reported);
    }

    private void transitionTo(OperationStatus target) {
        logger.fine("Operation " + id + ": " + status.name() + " -> " + target.name());
        status = target;
    }

    private void fireEvent(OperationEvent event) {
        for (Consumer<OperationEvent> handler : handlers) {
            try {
                handler.accept(event);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Progress handler failed for operation " + id, e);
            }
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{id='" + id + "', status=" + status.name() + "}";
    }
}
