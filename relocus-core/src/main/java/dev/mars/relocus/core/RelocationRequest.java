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
import java.util.UUID;

/**
 * Everything a caller asks of one relocation: where from, where to, how, and with
 * which overrides.
 *
 * <p>The request is immutable. It is not validated on construction; contract checks
 * such as the profile/no-profiles conflict run in the engine before any connection is
 * used so that a rejected request still produces an outcome.</p>
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * RelocationRequest request = RelocationRequest.builder()
 *     .source(LocationRef.of("a", "db1"))
 *     .destination(LocationRef.of("b", "db1"))
 *     .transferMode(TransferMode.RELAY)
 *     .config("limits.cpu", "4")
 *     .build();
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-03
 * @version 1.0
 */
public final class RelocationRequest {

    private final String requestId;
    private final LocationRef source;
    private final LocationRef destination;
    private final TransferMode transferMode;
    private final String targetMember;
    private final String targetPool;
    private final String targetProject;
    private final boolean instanceOnly;
    private final boolean stateless;
    private final boolean allowInconsistent;
    private final boolean noProfiles;
    private final Map<String, String> configOverrides;
    private final DeviceOverrideSet deviceOverrides;
    private final List<String> profiles;

    private RelocationRequest(Builder builder) {
        this.requestId = builder.requestId != null ? builder.requestId : UUID.randomUUID().toString();
        this.source = Objects.requireNonNull(builder.source, "Source cannot be null");
        this.destination = builder.destination != null ? builder.destination : builder.source;
        this.transferMode = builder.transferMode != null ? builder.transferMode : TransferMode.DEFAULT;
        this.targetMember = emptyToNull(builder.targetMember);
        this.targetPool = emptyToNull(builder.targetPool);
        this.targetProject = emptyToNull(builder.targetProject);
        this.instanceOnly = builder.instanceOnly;
        this.stateless = builder.stateless;
        this.allowInconsistent = builder.allowInconsistent;
        this.noProfiles = builder.noProfiles;
        this.configOverrides = Collections.unmodifiableMap(new LinkedHashMap<>(builder.configOverrides));
        this.deviceOverrides = builder.deviceOverrides.build();
        this.profiles = List.copyOf(builder.profiles);
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    public String getRequestId() { return requestId; }
    public LocationRef getSource() { return source; }
    public LocationRef getDestination() { return destination; }
    public TransferMode getTransferMode() { return transferMode; }
    public String getTargetMember() { return targetMember; }
    public String getTargetPool() { return targetPool; }
    public String getTargetProject() { return targetProject; }
    public boolean isInstanceOnly() { return instanceOnly; }
    public boolean isStateless() { return stateless; }
    public boolean isAllowInconsistent() { return allowInconsistent; }
    public boolean isNoProfiles() { return noProfiles; }
    public Map<String, String> getConfigOverrides() { return configOverrides; }
    public DeviceOverrideSet getDeviceOverrides() { return deviceOverrides; }
    public List<String> getProfiles() { return profiles; }

    /**
     * A stateful relocation carries the runtime state along (live migration).
     */
    public boolean isStateful() {
        return !stateless;
    }

    public boolean hasConfigOverrides() {
        return !configOverrides.isEmpty();
    }

    public boolean hasDeviceOverrides() {
        return !deviceOverrides.isEmpty();
    }

    /**
     * True when either a replacement profile list or {@code noProfiles} was requested.
     */
    public boolean hasProfileOverride() {
        return !profiles.isEmpty() || noProfiles;
    }

    public boolean hasOverrides() {
        return hasConfigOverrides() || hasDeviceOverrides() || hasProfileOverride();
    }

    /**
     * The project the destination lands in when it differs from the source's: the target
     * project when one was requested, otherwise the destination reference's project.
     *
     * @return the new project, or null when the project does not change
     */
    public String getProjectChange() {
        if (targetProject != null) {
            return targetProject;
        }
        String destinationProject = destination.getProject();
        return destinationProject != null && !destinationProject.equals(source.getProject()) ? destinationProject : null;
    }

    public boolean changesProject() {
        return getProjectChange() != null;
    }

    /**
     * True when a cluster member, storage pool or another project was requested for the destination.
     */
    public boolean hasTargets() {
        return targetMember != null || targetPool != null || changesProject();
    }

    public Builder toBuilder() {
        Builder builder = new Builder()
                .requestId(requestId)
                .source(source)
                .destination(destination)
                .transferMode(transferMode)
                .targetMember(targetMember)
                .targetPool(targetPool)
                .targetProject(targetProject)
                .instanceOnly(instanceOnly)
                .stateless(stateless)
                .allowInconsistent(allowInconsistent)
                .noProfiles(noProfiles)
                .configOverrides(configOverrides)
                .profiles(profiles);
        deviceOverrides.asMap().forEach((device, keys) -> keys.forEach((k, v) -> builder.deviceOverride(device, k, v)));
        return builder;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String requestId;
        private LocationRef source;
        private LocationRef destination;
        private TransferMode transferMode;
        private String targetMember;
        private String targetPool;
        private String targetProject;
        private boolean instanceOnly;
        private boolean stateless;
        private boolean allowInconsistent;
        private boolean noProfiles;
        private final Map<String, String> configOverrides = new LinkedHashMap<>();
        private final DeviceOverrideSet.Builder deviceOverrides = DeviceOverrideSet.builder();
        private final List<String> profiles = new ArrayList<>();

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder source(LocationRef source) {
            this.source = source;
            return this;
        }

        public Builder destination(LocationRef destination) {
            this.destination = destination;
            return this;
        }

        public Builder transferMode(TransferMode transferMode) {
            this.transferMode = transferMode;
            return this;
        }

        public Builder targetMember(String targetMember) {
            this.targetMember = targetMember;
            return this;
        }

        public Builder targetPool(String targetPool) {
            this.targetPool = targetPool;
            return this;
        }

        public Builder targetProject(String targetProject) {
            this.targetProject = targetProject;
            return this;
        }

        public Builder instanceOnly(boolean instanceOnly) {
            this.instanceOnly = instanceOnly;
            return this;
        }

        public Builder stateless(boolean stateless) {
            this.stateless = stateless;
            return this;
        }

        public Builder allowInconsistent(boolean allowInconsistent) {
            this.allowInconsistent = allowInconsistent;
            return this;
        }

        public Builder noProfiles(boolean noProfiles) {
            this.noProfiles = noProfiles;
            return this;
        }

        public Builder config(String key, String value) {
            this.configOverrides.put(key, value);
            return this;
        }

        public Builder configOverrides(Map<String, String> overrides) {
            this.configOverrides.putAll(overrides);
            return this;
        }

        public Builder deviceOverride(String deviceName, String key, String value) {
            this.deviceOverrides.set(deviceName, key, value);
            return this;
        }

        public Builder deviceOverrides(DeviceOverrideSet overrides) {
            overrides.asMap().forEach((device, keys) -> keys.forEach((k, v) -> deviceOverrides.set(device, k, v)));
            return this;
        }

        public Builder profile(String profile) {
            this.profiles.add(profile);
            return this;
        }

        public Builder profiles(List<String> profiles) {
            this.profiles.addAll(profiles);
            return this;
        }

        public RelocationRequest build() {
            return new RelocationRequest(this);
        }
    }

    @Override
    public String toString() {
        return "RelocationRequest{" +
                "requestId='" + requestId + '\'' +
                ", source=" + source +
                ", destination=" + destination +
                ", mode=" + transferMode.getWireName() +
                (targetMember != null ? ", target=" + targetMember : "") +
                (targetPool != null ? ", pool=" + targetPool : "") +
                (targetProject != null ? ", targetProject=" + targetProject : "") +
                '}';
    }
}
