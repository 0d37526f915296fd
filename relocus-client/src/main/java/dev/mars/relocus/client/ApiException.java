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

import dev.mars.relocus.core.exceptions.OperationFailedException;

/**
 * A request the server answered with an error envelope or a non-success HTTP status.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-09
 * @version 1.0
 */
public class ApiException extends OperationFailedException {

    private final String serverError;

    public ApiException(int statusCode, String serverError) {
        super(null, statusCode, serverError, null);
        this.serverError = serverError;
    }

    /**
     * @return the error text the server sent, as-is
     */
    public String getServerError() {
        return serverError;
    }

    public boolean isNotFound() {
        return getStatusCode() == 404;
    }
}
