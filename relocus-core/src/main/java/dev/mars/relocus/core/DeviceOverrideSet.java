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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Partial device definitions to lay over an instance's expanded devices.
 *
 * <p>Each entry maps a device name to the keys that should change; keys not named
 * here keep their expanded value. Built once per request and never mutated.</p>
 */
public final class DeviceOverrideSet {

    private static final DeviceOverrideSet EMPTY = new DeviceOverrideSet(Map.of());

    private final Map<String, Map<String, String>> overrides;

    private DeviceOverrideSet(Map<String, Map<String, String>> overrides) {
        Map<String, Map<String, String>> copy = new LinkedHashMap<>();
        overrides.forEach((device, keys) -> copy.put(device, Collections.unmodifiableMap(new LinkedHashMap<>(keys))));
        this.overrides = Collections.unmodifiableMap(copy);
    }

    public static DeviceOverrideSet empty() {
        return EMPTY;
    }

    public static DeviceOverrideSet of(Map<String, Map<String, String>> overrides) {
        return overrides == null || overrides.isEmpty() ? EMPTY : new DeviceOverrideSet(overrides);
    }

    public boolean isEmpty() {
        return overrides.isEmpty();
    }

    public Set<String> getDeviceNames() {
        return overrides.keySet();
    }

    /**
     * @return the override keys for a device, or an empty map when the device is not overridden
     */
    public Map<String, String> get(String deviceName) {
        return overrides.getOrDefault(deviceName, Map.of());
    }

    public Map<String, Map<String, String>> asMap() {
        return overrides;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, Map<String, String>> overrides = new LinkedHashMap<>();

        public Builder set(String deviceName, String key, String value) {
            overrides.computeIfAbsent(deviceName, d -> new LinkedHashMap<>()).put(key, value);
            return this;
        }

        public DeviceOverrideSet build() {
            return DeviceOverrideSet.of(overrides);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return overrides.equals(((DeviceOverrideSet) o).overrides);
    }

    @Override
    public int hashCode() {
        return overrides.hashCode();
    }

    @Override
    public String toString() {
        return "DeviceOverrideSet" + overrides;
    }
}
