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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An instance as reported by its server, including the expanded configuration and devices
 * (profile-inherited settings merged with the instance's own).
 *
 * <p>Every instance handed out by a connection is an owned deep copy: callers may read
 * and copy its maps without affecting any cached server state or other relocations.
 * The maps exposed here are unmodifiable; use {@link #copyExpandedDevices()} to get a
 * mutable working copy.</p>
 */
public final class InstanceDefinition {

    private final String name;
    private final String project;
    private final String location;
    private final String status;
    private final String type;
    private final boolean ephemeral;
    private final List<String> profiles;
    private final Map<String, String> config;
    private final Map<String, Map<String, String>> devices;
    private final Map<String, String> expandedConfig;
    private final Map<String, Map<String, String>> expandedDevices;
    private final List<String> snapshots;

    private InstanceDefinition(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "Instance name cannot be null");
        this.project = builder.project;
        this.location = builder.location;
        this.status = builder.status != null ? builder.status : "Stopped";
        this.type = builder.type != null ? builder.type : "container";
        this.ephemeral = builder.ephemeral;
        this.profiles = List.copyOf(builder.profiles);
        this.config = Collections.unmodifiableMap(new LinkedHashMap<>(builder.config));
        this.devices = deepCopy(builder.devices, true);
        this.expandedConfig = Collections.unmodifiableMap(new LinkedHashMap<>(builder.expandedConfig));
        this.expandedDevices = deepCopy(builder.expandedDevices, true);
        this.snapshots = List.copyOf(builder.snapshots);
    }

    static Map<String, Map<String, String>> deepCopy(Map<String, Map<String, String>> source, boolean readOnly) {
        Map<String, Map<String, String>> copy = new LinkedHashMap<>();
        source.forEach((device, keys) -> {
            Map<String, String> keysCopy = new LinkedHashMap<>(keys);
            copy.put(device, readOnly ? Collections.unmodifiableMap(keysCopy) : keysCopy);
        });
        return readOnly ? Collections.unmodifiableMap(copy) : copy;
    }

    public String getName() { return name; }
    public String getProject() { return project; }
    public String getLocation() { return location; }
    public String getStatus() { return status; }
    public String getType() { return type; }
    public boolean isEphemeral() { return ephemeral; }
    public List<String> getProfiles() { return profiles; }
    public Map<String, String> getConfig() { return config; }
    public Map<String, Map<String, String>> getDevices() { return devices; }
    public Map<String, String> getExpandedConfig() { return expandedConfig; }
    public Map<String, Map<String, String>> getExpandedDevices() { return expandedDevices; }
    public List<String> getSnapshots() { return snapshots; }

    public boolean isRunning() {
        return "Running".equalsIgnoreCase(status);
    }

    /**
     * @return a mutable, independent copy of the expanded devices
     */
    public Map<String, Map<String, String>> copyExpandedDevices() {
        return deepCopy(expandedDevices, false);
    }

    /**
     * @return an independent copy of this definition
     */
    public InstanceDefinition copy() {
        return toBuilder().build();
    }

    public Builder toBuilder() {
        Builder builder = new Builder()
                .name(name)
                .project(project)
                .location(location)
                .status(status)
                .type(type)
                .ephemeral(ephemeral)
                .profiles(profiles)
                .config(config)
                .expandedConfig(expandedConfig)
                .snapshots(snapshots);
        devices.forEach(builder::device);
        expandedDevices.forEach(builder::expandedDevice);
        return builder;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String project;
        private String location;
        private String status;
        private String type;
        private boolean ephemeral;
        private final List<String> profiles = new ArrayList<>();
        private final Map<String, String> config = new LinkedHashMap<>();
        private final Map<String, Map<String, String>> devices = new LinkedHashMap<>();
        private final Map<String, String> expandedConfig = new LinkedHashMap<>();
        private final Map<String, Map<String, String>> expandedDevices = new LinkedHashMap<>();
        private final List<String> snapshots = new ArrayList<>();

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder project(String project) {
            this.project = project;
            return this;
        }

        public Builder location(String location) {
            this.location = location;
            return this;
        }

        public Builder status(String status) {
            this.status = status;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder ephemeral(boolean ephemeral) {
            this.ephemeral = ephemeral;
            return this;
        }

        public Builder profiles(List<String> profiles) {
            this.profiles.clear();
            if (profiles != null) {
                this.profiles.addAll(profiles);
            }
            return this;
        }

        public Builder config(Map<String, String> config) {
            if (config != null) {
                this.config.putAll(config);
            }
            return this;
        }

        public Builder device(String name, Map<String, String> device) {
            this.devices.put(name, new LinkedHashMap<>(device));
            return this;
        }

        public Builder expandedConfig(Map<String, String> expandedConfig) {
            if (expandedConfig != null) {
                this.expandedConfig.putAll(expandedConfig);
            }
            return this;
        }

        public Builder expandedDevice(String name, Map<String, String> device) {
            this.expandedDevices.put(name, new LinkedHashMap<>(device));
            return this;
        }

        public Builder snapshots(List<String> snapshots) {
            this.snapshots.clear();
            this.snapshots.addAll(snapshots);
            return this;
        }

        public InstanceDefinition build() {
            return new InstanceDefinition(this);
        }
    }

    @Override
    public String toString() {
        return "InstanceDefinition{name='" + name + "', status='" + status + "', devices=" + expandedDevices.keySet() + "}";
    }
}
