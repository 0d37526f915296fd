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
 * Thrown when a location token does not follow {@code [<remote>:]<instance>[/<snapshot>]}.
 */
public class MalformedReferenceException extends RelocationException {

    private final String reference;

    public MalformedReferenceException(String reference, String reason) {
        super(RelocationErrorKind.MALFORMED_REFERENCE,
                String.format("Malformed reference '%s': %s", reference, reason));
        this.reference = reference;
    }

    public String getReference() {
        return reference;
    }
}
