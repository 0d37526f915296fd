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
 * Writable fields of an instance, sent with {@code PUT /1.0/instances/{name}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class InstancePutDto {

    @JsonProperty("description")
    private String description;

    @JsonProperty("ephemeral")
    private boolean ephemeral;

    @JsonProperty("profiles")
    private List<String> profiles;

    @JsonProperty("config")
    private Map<String, String> config;

    @JsonProperty("devices")
    private Map<String, Map<String, String>> devices;

    public InstancePutDto() {
    }

    public static InstancePutDto from(InstanceDto instance) {
        InstancePutDto dto = new InstancePutDto();
        dto.setDescription(instance.getDescription());
        dto.setEphemeral(instance.isEphemeral());
        dto.setProfiles(instance.getProfiles());
        dto.setConfig(instance.getConfig());
        dto.setDevices(instance.getDevices());
        return dto;
    }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public boolean isEphemeral() { return ephemeral; }
    public void setEphemeral(boolean ephemeral) { this.ephemeral = ephemeral; }

    public List<String> getProfiles() { return profiles; }
    public void setProfiles(List<String> profiles) { this.profiles = profiles; }

    public Map<String, String> getConfig() { return config; }
    public void setConfig(Map<String, String> config) { this.config = config; }

    public Map<String, Map<String, String>> getDevices() { return devices; }
    public void setDevices(Map<String, Map<String, String>> devices) { this.devices = devices; }
}
