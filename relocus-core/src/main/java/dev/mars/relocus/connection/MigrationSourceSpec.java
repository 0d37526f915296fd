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

package dev.mars.relocus.connection;

/**
 * How a source server should serve an instance for migration.
 *
 * @param live              transfer runtime state along with the filesystem
 * @param instanceOnly      leave the instance's snapshots behind
 * @param allowInconsistent tolerate copy errors for files that change during the copy
 * @param target            the destination's listening endpoint for a push, or null when the
 *                          source should listen itself
 */
public record MigrationSourceSpec(boolean live, boolean instanceOnly, boolean allowInconsistent, MigrationEndpoint target) {

    public boolean isPush() {
        return target != null;
    }

    public MigrationSourceSpec withTarget(MigrationEndpoint pushTarget) {
        return new MigrationSourceSpec(live, instanceOnly, allowInconsistent, pushTarget);
    }
}
