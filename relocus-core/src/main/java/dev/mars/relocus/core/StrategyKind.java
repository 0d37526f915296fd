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
 * Tag of a {@link RelocationStrategy}, usable as a map key and metric attribute.
 */
public enum StrategyKind {
    RENAME("rename"),
    SERVER_SIDE_MOVE("server-side-move"),
    CLIENT_MEDIATED_COPY("client-mediated-copy");

    private final String label;

    StrategyKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
