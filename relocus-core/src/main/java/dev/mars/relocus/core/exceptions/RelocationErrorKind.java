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
 * Classification of the errors a relocation can end with.
 *
 * <p>Input errors are detected before any network call and are never retried.
 * {@link #ORPHANED_SOURCE_AFTER_MOVE} is the only {@link Severity#CRITICAL} kind: the
 * destination copy exists and the source could not be removed, so two copies of the
 * instance are left behind and an operator has to clean up.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public enum RelocationErrorKind {

    MALFORMED_REFERENCE("Malformed location reference", true, Severity.ERROR),

    INVALID_INSTANCE_NAME("Invalid instance name", true, Severity.ERROR),

    CONFLICTING_PROFILE_OVERRIDE("Conflicting profile override", true, Severity.ERROR),

    UNKNOWN_DEVICE("Unknown device in override", true, Severity.ERROR),

    INVALID_OVERRIDE("Malformed override entry", true, Severity.ERROR),

    INVALID_REQUEST("Invalid relocation request", true, Severity.ERROR),

    UNREACHABLE("Server unreachable", false, Severity.ERROR),

    OPERATION_FAILED("Remote operation failed", false, Severity.ERROR),

    OPERATION_TIMEOUT("Remote operation timed out", false, Severity.ERROR),

    ORPHANED_SOURCE_AFTER_MOVE("Source left behind after copy", false, Severity.CRITICAL);

    /**
     * How loudly an error must be reported.
     */
    public enum Severity {
        ERROR,
        CRITICAL
    }

    private final String description;
    private final boolean inputError;
    private final Severity severity;

    RelocationErrorKind(String description, boolean inputError, Severity severity) {
        this.description = description;
        this.inputError = inputError;
        this.severity = severity;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Input errors are raised from the request alone, before any connection is used.
     */
    public boolean isInputError() {
        return inputError;
    }

    public Severity getSeverity() {
        return severity;
    }
}
