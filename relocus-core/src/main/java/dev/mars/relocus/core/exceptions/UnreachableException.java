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
 * Thrown when no connection can be established to a remote at all.
 * Retry policy, if any, belongs to the connection provider.
 */
public class UnreachableException extends RelocationException {

    private final String remoteAlias;

    public UnreachableException(String remoteAlias, String message) {
        super(RelocationErrorKind.UNREACHABLE, message);
        this.remoteAlias = remoteAlias;
    }

    public UnreachableException(String remoteAlias, String message, Throwable cause) {
        super(RelocationErrorKind.UNREACHABLE, message, cause);
        this.remoteAlias = remoteAlias;
    }

    public String getRemoteAlias() {
        return remoteAlias;
    }
}
