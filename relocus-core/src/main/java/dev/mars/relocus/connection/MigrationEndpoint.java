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

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * One side of a migration: the server operation driving it and, when that side listens,
 * the per-channel secrets a peer needs to connect.
 *
 * <p>A pulling destination or a pushing source receives the other side's endpoint and
 * connects to {@link #getOperationUrl()} itself; a relaying client opens the channels.</p>
 */
public final class MigrationEndpoint {

    private final RemoteOperation operation;
    private final String operationUrl;
    private final Map<String, String> secrets;
    private final String certificate;

    public MigrationEndpoint(RemoteOperation operation, String operationUrl, Map<String, String> secrets, String certificate) {
        this.operation = Objects.requireNonNull(operation, "Operation cannot be null");
        this.operationUrl = operationUrl;
        this.secrets = secrets != null ? Collections.unmodifiableMap(new TreeMap<>(secrets)) : Map.of();
        this.certificate = certificate;
    }

    public RemoteOperation getOperation() {
        return operation;
    }

    /**
     * @return the absolute URL of the operation a peer connects to, or null if this side does not listen
     */
    public String getOperationUrl() {
        return operationUrl;
    }

    public Map<String, String> getSecrets() {
        return secrets;
    }

    public Set<String> getChannelNames() {
        return secrets.keySet();
    }

    public String getSecret(String channelName) {
        return secrets.get(channelName);
    }

    public String getCertificate() {
        return certificate;
    }

    public boolean isListening() {
        return !secrets.isEmpty();
    }

    @Override
    public String toString() {
        return "MigrationEndpoint{operation=" + operation.getId() + ", channels=" + secrets.keySet() + "}";
    }
}
