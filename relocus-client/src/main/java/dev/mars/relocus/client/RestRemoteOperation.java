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


package dev.mars.relocus.client;

import dev.mars.relocus.client.dto.ApiResponse;
import dev.mars.relocus.client.dto.OperationDto;
import dev.mars.relocus.connection.AbstractRemoteOperation;
import dev.mars.relocus.core.OperationStatus;
import dev.mars.relocus.core.exceptions.RelocationException;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A background operation on a REST remote, polled through {@code /1.0/operations/{id}}
 * and cancelled with {@code DELETE} on the same path.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-09
 * @version 1.0
 */
public class RestRemoteOperation extends AbstractRemoteOperation {

    static final String PROGRESS_SUFFIX = "_progress";

    private final RestInstanceServer server;
    private final Map<String, String> initialMetadata;

    RestRemoteOperation(RestInstanceServer server, OperationDto operation, Duration pollInterval) {
        super(operation.getId(), OperationStatus.PENDING, pollInterval);
        this.server = server;
        this.initialMetadata = stringValues(operation.getMetadata());
        observe(toOperationStatus(operation.getStatusCode()), operation.getErr(), progressOf(operation.getMetadata()));
    }

    /**
     * @return the string-valued metadata the operation was created with; for a listening
     *         migration endpoint these are the per-channel secrets
     */
    Map<String, String> getInitialMetadata() {
        return initialMetadata;
    }

    String getPath() {
        return "/1.0/operations/" + getId();
    }

    @Override
    protected void fetchState() throws RelocationException {
        ApiResponse response = server.getApiClient().get(server.scoped(getPath()));
        OperationDto operation = server.getApiClient().readMetadata(response, OperationDto.class);
        observe(toOperationStatus(operation.getStatusCode()), operation.getErr(), progressOf(operation.getMetadata()));
    }

    @Override
    protected void requestCancel() throws RelocationException {
        server.getApiClient().delete(server.scoped(getPath()));
    }

    /**
     * Map a server status code onto the operation lifecycle. Codes below 200 that are not
     * pending count as running; cancelling is still running until the server confirms.
     */
    static OperationStatus toOperationStatus(int statusCode) {
        switch (statusCode) {
            case 100:
            case 105:
                return OperationStatus.PENDING;
            case 200:
                return OperationStatus.SUCCESS;
            case 400:
                return OperationStatus.FAILURE;
            case 401:
                return OperationStatus.CANCELLED;
            default:
                return statusCode < 200 ? OperationStatus.RUNNING : OperationStatus.FAILURE;
        }
    }

    static Map<String, String> progressOf(Map<String, Object> metadata) {
        Map<String, String> progress = new LinkedHashMap<>();
        if (metadata != null) {
            metadata.forEach((key, value) -> {
                if (key.endsWith(PROGRESS_SUFFIX) && value != null) {
                    progress.put(key, value.toString());
                }
            });
        }
        return progress;
    }

    private static Map<String, String> stringValues(Map<String, Object> metadata) {
        Map<String, String> values = new LinkedHashMap<>();
        if (metadata != null) {
            metadata.forEach((key, value) -> {
                if (value instanceof String && !key.endsWith(PROGRESS_SUFFIX)) {
                    values.put(key, (String) value);
                }
            });
        }
        return values;
    }
}
