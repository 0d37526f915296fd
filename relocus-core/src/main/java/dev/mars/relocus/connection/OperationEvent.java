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

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * A status or progress update for a remote operation.
 *
 * <p>Progress entries are the server's human-readable strings, keyed by what is being
 * transferred (for example {@code fs_progress}).</p>
 */
public final class OperationEvent {

    private final String operationId;
    private final OperationStatus status;
    private final Map<String, String> progress;

    public OperationEvent(String operationId, OperationStatus status, Map<String, String> progress) {
        this.operationId = operationId;
        this.status = status;
        this.progress = progress != null ? Collections.unmodifiableMap(new TreeMap<>(progress)) : Map.of();
    }

    public String getOperationId() {
        return operationId;
    }

    public OperationStatus getStatus() {
        return status;
    }

    public Map<String, String> getProgress() {
        return progress;
    }

    public boolean hasProgress() {
        return !progress.isEmpty();
    }

    /**
     * @return the progress entries joined into one line, or an empty string
     */
    public String getProgressText() {
        return String.join(" ", progress.values());
    }

    @Override
    public String toString() {
        return "OperationEvent{id='" + operationId + "', status=" + status.name() + ", progress=" + progress + "}";
    }
}
