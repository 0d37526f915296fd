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

package dev.mars.relocus.supervisor;

/**
 * Where a relocation is in its pipeline.
 */
public enum RelocationPhase {
    VALIDATING,
    CONNECTING,
    SELECTING,
    RENAMING,
    MOVING,
    COPYING,
    DELETING_SOURCE,
    COMPLETED
}
