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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Body of a server-side move request.
 *
 * <p>Null override fields mean "leave unchanged"; an empty profile list means "remove all
 * profiles". Devices are complete definitions, not partial maps.</p>
 */
public final class InstanceMigration {

    private final String name;
    private final boolean live;
    private final boolean instanceOnly;
    private final String pool;
    private final String project;
    private final List<String> profiles;
    private final Map<String, String> config;
    private final Map<String, Map<String, String>> devices;

    private InstanceMigration(Builder builder) {
        this.name = builder.name;
        this.live = builder.live;
        this.instanceOnly = builder.instanceOnly;
        this.pool = builder.pool;
        this.project = builder.project;
        this.profiles = builder.profiles != null ? List.copyOf(builder.profiles) : null;
        this.config = builder.config != null ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.config)) : null;
        this.devices = builder.devices != null ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.devices)) : null;
    }

    public String getName() { return name; }
    public boolean isMigration() { return true; }
    public boolean isLive() { return live; }
    public boolean isInstanceOnly() { return instanceOnly; }
    public String getPool() { return pool; }
    public String getProject() { return project; }
    public List<String> getProfiles() { return profiles; }
    public Map<String, String> getConfig() { return config; }
    public Map<String, Map<String, String>> getDevices() { return devices; }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private boolean live;
        private boolean instanceOnly;
        private String pool;
        private String project;
        private List<String> profiles;
        private Map<String, String> config;
        private Map<String, Map<String, String>> devices;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder live(boolean live) {
            this.live = live;
            return this;
        }

        public Builder instanceOnly(boolean instanceOnly) {
            this.instanceOnly = instanceOnly;
            return this;
        }

        public Builder pool(String pool) {
            this.pool = pool;
            return this;
        }

        public Builder project(String project) {
            this.project = project;
            return this;
        }

        public Builder profiles(List<String> profiles) {
            this.profiles = profiles;
            return this;
        }

        public Builder config(Map<String, String> config) {
            this.config = config;
            return this;
        }

        public Builder devices(Map<String, Map<String, String>> devices) {
            this.devices = devices;
            return this;
        }

        public InstanceMigration build() {
            return new InstanceMigration(this);
        }
    }

    @Override
    public String toString() {
        return "InstanceMigration{name='" + name + "', live=" + live + ", instanceOnly=" + instanceOnly +
                (pool != null ? ", pool=" + pool : "") + (project != null ? ", project=" + project : "") + "}";
    }
}
