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
 * Server API extensions the relocation engine negotiates on.
 */
public enum ApiExtension {
    /** Server-side move accepts config, device and profile overrides. */
    INSTANCE_MOVE_CONFIG("instance_move_config"),
    /** Server-side move can change the storage pool. */
    INSTANCE_POOL_MOVE("instance_pool_move"),
    /** Server-side move can change the project. */
    INSTANCE_PROJECT_MOVE("instance_project_move");

    private final String extensionName;

    ApiExtension(String extensionName) {
        this.extensionName = extensionName;
    }

    public String getExtensionName() {
        return extensionName;
    }
}
