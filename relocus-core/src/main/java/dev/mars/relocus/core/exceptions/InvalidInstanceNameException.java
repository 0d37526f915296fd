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
 * Thrown when an instance or snapshot name fails the naming grammar.
 */
public class InvalidInstanceNameException extends RelocationException {

    private final String name;

    public InvalidInstanceNameException(String name, String reason) {
        super(RelocationErrorKind.INVALID_INSTANCE_NAME,
                String.format("Invalid instance name '%s': %s", name, reason));
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
