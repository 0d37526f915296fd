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

package dev.mars.relocus.core.exceptions;

/**
 * Thrown when a server rejects a request or reports a remote operation as failed.
 * The message is the server's own error text, unmodified.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class OperationFailedException extends RelocationException {

    private final String operationId;
    private final int statusCode;

    public OperationFailedException(String operationId, String message) {
        this(operationId, 0, message, null);
    }

    public OperationFailedException(String operationId, int statusCode, String message, Throwable cause) {
        super(RelocationErrorKind.OPERATION_FAILED, message, cause);
        this.operationId = operationId;
        this.statusCode = statusCode;
    }

    /**
     * @return the id of the failed operation, or null when the request was rejected synchronously
     */
    public String getOperationId() {
        return operationId;
    }

    /**
     * @return the HTTP-style status code reported by the server, 0 when unknown
     */
    public int getStatusCode() {
        return statusCode;
    }
}
