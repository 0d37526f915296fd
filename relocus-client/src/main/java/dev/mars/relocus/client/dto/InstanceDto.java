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


package dev.mars.relocus.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An instance as returned by {@code GET /1.0/instances/{name}?recursion=1}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class InstanceDto {

    @JsonProperty("name")
    private String name;

    @JsonProperty("project")
    private String project;

    @JsonProperty("location")
    private String location;

    @JsonProperty("status")
    private String status;

    @JsonProperty("type")
    private String type;

    @JsonProperty("description")
    private String description;

    @JsonProperty("ephemeral")
    private boolean ephemeral;

    @JsonProperty("stateful")
    private boolean stateful;

    @JsonProperty("profiles")
    private List<String> profiles = new ArrayList<>();

    @JsonProperty("config")
    private Map<String, String> config = new LinkedHashMap<>();

    @JsonProperty("devices")
    private Map<String, Map<String, String>> devices = new LinkedHashMap<>();

    @JsonProperty("expanded_config")
    private Map<String, String> expandedConfig = new LinkedHashMap<>();

    @JsonProperty("expanded_devices")
    private Map<String, Map<String, String>> expandedDevices = new LinkedHashMap<>();

    @JsonProperty("snapshots")
    private List<SnapshotDto> snapshots = new ArrayList<>();

    public InstanceDto() {
    }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getProject() { return project; }
    public void setProject(String project) { this.project = project; }

    public String getLocation() { return location; }
    public void setLocation(String location) { this.location = location; }

    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }

    public String getType() { return type; }
    public void setType(String type) { this.type = type; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public boolean isEphemeral() { return ephemeral; }
    public void setEphemeral(boolean ephemeral) { this.ephemeral = ephemeral; }

    public boolean isStateful() { return stateful; }
    public void setStateful(boolean stateful) { this.stateful = stateful; }

    public List<String> getProfiles() { return profiles; }
    public void setProfiles(List<String> profiles) { this.profiles = profiles; }

    public Map<String, String> getConfig() { return config; }
    public void setConfig(Map<String, String> config) { this.config = config; }

    public Map<String, Map<String, String>> getDevices() { return devices; }
    public void setDevices(Map<String, Map<String, String>> devices) { this.devices = devices; }

    public Map<String, String> getExpandedConfig() { return expandedConfig; }
    public void setExpandedConfig(Map<String, String> expandedConfig) { this.expandedConfig = expandedConfig; }

    public Map<String, Map<String, String>> getExpandedDevices() { return expandedDevices; }
    public void setExpandedDevices(Map<String, Map<String, String>> expandedDevices) { this.expandedDevices = expandedDevices; }

    public List<SnapshotDto> getSnapshots() { return snapshots; }
    public void setSnapshots(List<SnapshotDto> snapshots) { this.snapshots = snapshots; }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SnapshotDto {

        @JsonProperty("name")
        private String name;

        public SnapshotDto() {
        }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
    }
}
