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

import java.util.List;

/**
 * Thrown when a request both replaces the profile list and asks for no profiles.
 */
public class ConflictingProfileOverrideException extends RelocationException {

    private final List<String> profiles;

    public ConflictingProfileOverrideException(List<String> profiles) {
        super(RelocationErrorKind.CONFLICTING_PROFILE_OVERRIDE,
                "Profiles " + profiles + " and --no-profiles cannot be used together");
        this.profiles = List.copyOf(profiles);
    }

    public List<String> getProfiles() {
        return profiles;
    }
}
