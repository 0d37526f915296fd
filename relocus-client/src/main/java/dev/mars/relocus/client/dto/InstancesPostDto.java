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
 * Body of {@code POST /1.0/instances} for an instance created from a migration source.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class InstancesPostDto {

    @JsonProperty("name")
    private String name;

    @JsonProperty("type")
    private String type;

    @JsonProperty("profiles")
    private List<String> profiles;

    @JsonProperty("config")
    private Map<String, String> config;

    @JsonProperty("devices")
    private Map<String, Map<String, String>> devices;

    @JsonProperty("ephemeral")
    private boolean ephemeral;

    @JsonProperty("source")
    private Source source;

    public InstancesPostDto() {
    }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getType() { return type; }
    public void setType(String type) { this.type = type; }

    public List<String> getProfiles() { return profiles; }
    public void setProfiles(List<String> profiles) { this.profiles = profiles; }

    public Map<String, String> getConfig() { return config; }
    public void setConfig(Map<String, String> config) { this.config = config; }

    public Map<String, Map<String, String>> getDevices() { return devices; }
    public void setDevices(Map<String, Map<String, String>> devices) { this.devices = devices; }

    public boolean isEphemeral() { return ephemeral; }
    public void setEphemeral(boolean ephemeral) { this.ephemeral = ephemeral; }

    public Source getSource() { return source; }
    public void setSource(Source source) { this.source = source; }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Source {

        public static final String TYPE_MIGRATION = "migration";

        @JsonProperty("type")
        private String type = TYPE_MIGRATION;

        @JsonProperty("mode")
        private String mode;

        @JsonProperty("operation")
        private String operation;

        @JsonProperty("secrets")
        private Map<String, String> secrets;

        @JsonProperty("certificate")
        private String certificate;

        @JsonProperty("live")
        private boolean live;

        @JsonProperty("instance_only")
        private boolean instanceOnly;

        @JsonProperty("allow_inconsistent")
        private boolean allowInconsistent;

        @JsonProperty("refresh")
        private boolean refresh;

        public Source() {
        }

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }

        public String getMode() { return mode; }
        public void setMode(String mode) { this.mode = mode; }

        public String getOperation() { return operation; }
        public void setOperation(String operation) { this.operation = operation; }

        public Map<String, String> getSecrets() { return secrets; }
        public void setSecrets(Map<String, String> secrets) { this.secrets = secrets; }

        public String getCertificate() { return certificate; }
        public void setCertificate(String certificate) { this.certificate = certificate; }

        public boolean isLive() { return live; }
        public void setLive(boolean live) { this.live = live; }

        public boolean isInstanceOnly() { return instanceOnly; }
        public void setInstanceOnly(boolean instanceOnly) { this.instanceOnly = instanceOnly; }

        public boolean isAllowInconsistent() { return allowInconsistent; }
        public void setAllowInconsistent(boolean allowInconsistent) { this.allowInconsistent = allowInconsistent; }

        public boolean isRefresh() { return refresh; }
        public void setRefresh(boolean refresh) { this.refresh = refresh; }
    }
}
