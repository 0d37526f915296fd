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

import dev.mars.relocus.core.LocationRef;

/**
 * Thrown when the destination copy of an instance completed but deleting the source failed.
 *
 * <p>Both copies now exist. This is never a plain copy failure: the caller must report it
 * with {@link RelocationErrorKind.Severity#CRITICAL} severity so the source can be removed
 * by hand.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class OrphanedSourceAfterMoveException extends RelocationException {

    private final LocationRef source;
    private final LocationRef destination;

    public OrphanedSourceAfterMoveException(LocationRef source, LocationRef destination, Throwable cause) {
        super(RelocationErrorKind.ORPHANED_SOURCE_AFTER_MOVE,
                String.format("Failed to delete original instance %s after copying it to %s: %s",
                        source, destination, cause != null ? cause.getMessage() : "unknown error"),
                cause);
        this.source = source;
        this.destination = destination;
    }

    public LocationRef getSource() {
        return source;
    }

    public LocationRef getDestination() {
        return destination;
    }
}
