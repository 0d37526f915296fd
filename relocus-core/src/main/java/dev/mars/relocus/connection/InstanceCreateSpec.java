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

import dev.mars.relocus.core.TransferMode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Request to create an instance whose contents arrive by migration from another server.
 *
 * <p>For {@link TransferMode#PULL} the spec carries the source's listening endpoint and
 * the destination connects to it. For push and relay the destination listens and the
 * source (or the client) connects in.</p>
 */
public final class InstanceCreateSpec {

    private final String name;
    private final String type;
    private final TransferMode mode;
    private final MigrationEndpoint sourceEndpoint;
    private final List<String> profiles;
    private final Map<String, String> config;
    private final Map<String, Map<String, String>> devices;
    private final boolean ephemeral;
    private final boolean live;
    private final boolean instanceOnly;
    private final boolean allowInconsistent;
    private final boolean keepVolatile;

    private InstanceCreateSpec(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "Instance name cannot be null");
        this.type = builder.type;
        this.mode = Objects.requireNonNull(builder.mode, "Transfer mode cannot be null");
        this.sourceEndpoint = builder.sourceEndpoint;
        this.profiles = List.copyOf(builder.profiles);
        this.config = Collections.unmodifiableMap(new LinkedHashMap<>(builder.config));
        Map<String, Map<String, String>> deviceCopy = new LinkedHashMap<>();
        builder.devices.forEach((device, keys) -> deviceCopy.put(device, Collections.unmodifiableMap(new LinkedHashMap<>(keys))));
        this.devices = Collections.unmodifiableMap(deviceCopy);
        this.ephemeral = builder.ephemeral;
        this.live = builder.live;
        this.instanceOnly = builder.instanceOnly;
        this.allowInconsistent = builder.allowInconsistent;
        this.keepVolatile = builder.keepVolatile;
    }

    public String getName() { return name; }
    public String getType() { return type; }
    public TransferMode getMode() { return mode; }
    public MigrationEndpoint getSourceEndpoint() { return sourceEndpoint; }
    public List<String> getProfiles() { return profiles; }
    public Map<String, String> getConfig() { return config; }
    public Map<String, Map<String, String>> getDevices() { return devices; }
    public boolean isEphemeral() { return ephemeral; }
    public boolean isLive() { return live; }
    public boolean isInstanceOnly() { return instanceOnly; }
    public boolean isAllowInconsistent() { return allowInconsistent; }
    public boolean isKeepVolatile() { return keepVolatile; }

    /**
     * A relocation copy never refreshes an existing instance.
     */
    public boolean isRefresh() {
        return false;
    }

    public Builder toBuilder() {
        Builder builder = new Builder()
                .name(name)
                .type(type)
                .mode(mode)
                .sourceEndpoint(sourceEndpoint)
                .profiles(profiles)
                .config(config)
                .ephemeral(ephemeral)
                .live(live)
                .instanceOnly(instanceOnly)
                .allowInconsistent(allowInconsistent)
                .keepVolatile(keepVolatile);
        devices.forEach(builder::device);
        return builder;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String type;
        private TransferMode mode = TransferMode.PULL;
        private MigrationEndpoint sourceEndpoint;
        private final List<String> profiles = new ArrayList<>();
        private final Map<String, String> config = new LinkedHashMap<>();
        private final Map<String, Map<String, String>> devices = new LinkedHashMap<>();
        private boolean ephemeral;
        private boolean live;
        private boolean instanceOnly;
        private boolean allowInconsistent;
        private boolean keepVolatile;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder mode(TransferMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder sourceEndpoint(MigrationEndpoint sourceEndpoint) {
            this.sourceEndpoint = sourceEndpoint;
            return this;
        }

        public Builder profiles(List<String> profiles) {
            this.profiles.clear();
            this.profiles.addAll(profiles);
            return this;
        }

        public Builder config(Map<String, String> config) {
            this.config.putAll(config);
            return this;
        }

        public Builder device(String deviceName, Map<String, String> device) {
            this.devices.put(deviceName, new LinkedHashMap<>(device));
            return this;
        }

        public Builder devices(Map<String, Map<String, String>> devices) {
            devices.forEach(this::device);
            return this;
        }

        public Builder ephemeral(boolean ephemeral) {
            this.ephemeral = ephemeral;
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

        public Builder allowInconsistent(boolean allowInconsistent) {
            this.allowInconsistent = allowInconsistent;
            return this;
        }

        public Builder keepVolatile(boolean keepVolatile) {
            this.keepVolatile = keepVolatile;
            return this;
        }

        public InstanceCreateSpec build() {
            return new InstanceCreateSpec(this);
        }
    }

    @Override
    public String toString() {
        return "InstanceCreateSpec{name='" + name + "', mode=" + mode.getWireName() + ", devices=" + devices.keySet() + "}";
    }
}
