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

package dev.mars.relocus.core;

/**
 * Terminal status of a whole relocation request.
 */
public enum RelocationStatus {
    SUCCESS("Relocation completed"),
    FAILURE("Relocation failed"),
    CANCELLED("Relocation cancelled");

    private final String description;

    RelocationStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Map the terminal status of the operation that finished a relocation.
     *
     * @throws IllegalArgumentException if the status is not terminal
     */
    public static RelocationStatus fromOperation(OperationStatus status) {
        switch (status) {
            case SUCCESS:
                return SUCCESS;
            case FAILURE:
                return FAILURE;
            case CANCELLED:
                return CANCELLED;
            default:
                throw new IllegalArgumentException("Operation status is not terminal: " + status.name());
        }
    }
}
