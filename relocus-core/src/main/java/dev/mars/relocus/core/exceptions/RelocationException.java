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

import java.util.Objects;

/**
 * Exception thrown when a relocation cannot be planned or carried out.
 * Every instance carries a {@link RelocationErrorKind} so callers can tell input errors,
 * remote failures and an orphaned source apart without inspecting messages.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class RelocationException extends RelocusException {

    private final RelocationErrorKind kind;

    public RelocationException(RelocationErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "Error kind cannot be null");
    }

    public RelocationException(RelocationErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "Error kind cannot be null");
    }

    public RelocationErrorKind getKind() {
        return kind;
    }

    public boolean isInputError() {
        return kind.isInputError();
    }

    public RelocationErrorKind.Severity getSeverity() {
        return kind.getSeverity();
    }
}
