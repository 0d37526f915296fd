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

import java.util.Locale;

/**
 * Which side opens the data connection during a client-mediated copy.
 *
 * <ul>
 *   <li>{@link #PULL} - the destination server connects to the source and reads</li>
 *   <li>{@link #PUSH} - the source server connects to the destination and writes</li>
 *   <li>{@link #RELAY} - this client connects to both and copies bytes between them</li>
 * </ul>
 *
 * <p>Pull is the default as it is compatible with all server versions.</p>
 */
public enum TransferMode {
    PULL("pull"),
    PUSH("push"),
    RELAY("relay");

    public static final TransferMode DEFAULT = PULL;

    private final String wireName;

    TransferMode(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public boolean isDefault() {
        return this == DEFAULT;
    }

    /**
     * Parse a mode name as given on the command line or in configuration.
     *
     * @throws IllegalArgumentException if the name is not one of pull, push or relay
     */
    public static TransferMode fromString(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (TransferMode mode : values()) {
            if (mode.wireName.equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Invalid transfer mode '" + value + "'. One of pull, push or relay");
    }
}
