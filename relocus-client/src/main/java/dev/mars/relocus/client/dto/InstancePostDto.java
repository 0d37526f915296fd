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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Body of {@code POST /1.0/instances/{name}}. With only {@code name} set the server renames
 * the instance; with {@code migration} set it either relocates internally or, when
 * {@code target} is set or absent on a remote move, prepares a migration source.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class InstancePostDto {

    @JsonProperty("name")
    private String name;

    @JsonProperty("migration")
    private Boolean migration;

    @JsonProperty("live")
    private Boolean live;

    @JsonProperty("instance_only")
    private Boolean instanceOnly;

    @JsonProperty("allow_inconsistent")
    private Boolean allowInconsistent;

    @JsonProperty("pool")
    private String pool;

    @JsonProperty("project")
    private String project;

    @JsonProperty("profiles")
    private List<String> profiles;

    @JsonProperty("config")
    private Map<String, String> config;

    @JsonProperty("devices")
    private Map<String, Map<String, String>> devices;

    @JsonProperty("target")
    private MigrationTargetDto target;

    public InstancePostDto() {
    }

    public static InstancePostDto rename(String newName) {
        InstancePostDto dto = new InstancePostDto();
        dto.setName(newName);
        return dto;
    }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public Boolean getMigration() { return migration; }
    public void setMigration(Boolean migration) { this.migration = migration; }

    public Boolean getLive() { return live; }
    public void setLive(Boolean live) { this.live = live; }

    public Boolean getInstanceOnly() { return instanceOnly; }
    public void setInstanceOnly(Boolean instanceOnly) { this.instanceOnly = instanceOnly; }

    public Boolean getAllowInconsistent() { return allowInconsistent; }
    public void setAllowInconsistent(Boolean allowInconsistent) { this.allowInconsistent = allowInconsistent; }

    public String getPool() { return pool; }
    public void setPool(String pool) { this.pool = pool; }

    public String getProject() { return project; }
    public void setProject(String project) { this.project = project; }

    public List<String> getProfiles() { return profiles; }
    public void setProfiles(List<String> profiles) { this.profiles = profiles; }

    public Map<String, String> getConfig() { return config; }
    public void setConfig(Map<String, String> config) { this.config = config; }

    public Map<String, Map<String, String>> getDevices() { return devices; }
    public void setDevices(Map<String, Map<String, String>> devices) { this.devices = devices; }

    public MigrationTargetDto getTarget() { return target; }
    public void setTarget(MigrationTargetDto target) { this.target = target; }
}
