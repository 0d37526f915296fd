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
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Client-side handle to an asynchronous operation owned by a server.
 *
 * <p>The server decides every state change; the handle only observes them and may
 * ask for cancellation.</p>
 */
public interface RemoteOperation {

    String getId();

    /**
     * @return the last status observed, without contacting the server
     */
    OperationStatus getStatus();

    /**
     * Fetch the current status from the server.
     */
    OperationStatus refresh() throws RelocationException;

    /**
     * Block until the operation reaches a terminal state or the timeout elapses.
     *
     * @param timeout how long to wait; must be positive
     * @return the status observed when the wait ended, terminal or not
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    OperationStatus waitFor(Duration timeout) throws RelocationException, InterruptedException;

    /**
     * Ask the server to cancel. Whether and when the operation ends as
     * {@link OperationStatus#CANCELLED} is the server's decision.
     */
    void cancel() throws RelocationException;

    void addProgressHandler(Consumer<OperationEvent> handler);

    /**
     * @return the server's failure message once the operation has failed
     */
    Optional<String> getError();
}
