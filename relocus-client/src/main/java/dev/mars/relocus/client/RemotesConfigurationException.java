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

import dev.mars.relocus.core.exceptions.RelocusException;

/**
 * Thrown when the remotes file cannot be read or does not describe a usable set of remotes.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-09
 * @version 1.0
 */
public class RemotesConfigurationException extends RelocusException {

    private final String fieldPath;

    public RemotesConfigurationException(String message) {
        super(message);
        this.fieldPath = null;
    }

    public RemotesConfigurationException(String message, Throwable cause) {
        super(message, cause);
        this.fieldPath = null;
    }

    public RemotesConfigurationException(String fieldPath, String message) {
        super(fieldPath + ": " + message);
        this.fieldPath = fieldPath;
    }

    public String getFieldPath() {
        return fieldPath;
    }
}
