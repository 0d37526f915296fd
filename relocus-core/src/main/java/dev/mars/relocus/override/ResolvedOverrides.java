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

package dev.mars.relocus.override;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Overrides ready to submit to a server. A null field means the caller asked for no
 * change to that part of the instance.
 */
public final class ResolvedOverrides {

    private static final ResolvedOverrides NONE = new ResolvedOverrides(null, null, null);

    private final Map<String, String> config;
    private final Map<String, Map<String, String>> devices;
    private final List<String> profiles;

    public ResolvedOverrides(Map<String, String> config, Map<String, Map<String, String>> devices, List<String> profiles) {
        this.config = config != null ? Collections.unmodifiableMap(new LinkedHashMap<>(config)) : null;
        this.devices = devices != null ? Collections.unmodifiableMap(new LinkedHashMap<>(devices)) : null;
        this.profiles = profiles != null ? List.copyOf(profiles) : null;
    }

    public static ResolvedOverrides none() {
        return NONE;
    }

    /**
     * @return the configuration keys to set, or null
     */
    public Map<String, String> getConfig() {
        return config;
    }

    /**
     * @return complete definitions of the overridden devices, or null
     */
    public Map<String, Map<String, String>> getDevices() {
        return devices;
    }

    /**
     * @return the replacement profile list (possibly empty), or null
     */
    public List<String> getProfiles() {
        return profiles;
    }

    public boolean isEmpty() {
        return config == null && devices == null && profiles == null;
    }

    @Override
    public String toString() {
        return "ResolvedOverrides{config=" + config + ", devices=" + (devices != null ? devices.keySet() : null) +
                ", profiles=" + profiles + "}";
    }
}
