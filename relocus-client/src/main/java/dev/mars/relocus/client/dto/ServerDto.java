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
import java.util.List;

/**
 * Response body of {@code GET /1.0}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ServerDto {

    @JsonProperty("api_extensions")
    private List<String> apiExtensions = new ArrayList<>();

    @JsonProperty("api_version")
    private String apiVersion;

    @JsonProperty("environment")
    private Environment environment;

    public ServerDto() {
    }

    public List<String> getApiExtensions() {
        return apiExtensions;
    }

    public void setApiExtensions(List<String> apiExtensions) {
        this.apiExtensions = apiExtensions;
    }

    public String getApiVersion() {
        return apiVersion;
    }

    public void setApiVersion(String apiVersion) {
        this.apiVersion = apiVersion;
    }

    public Environment getEnvironment() {
        return environment;
    }

    public void setEnvironment(Environment environment) {
        this.environment = environment;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Environment {

        @JsonProperty("server_name")
        private String serverName;

        @JsonProperty("server_clustered")
        private boolean serverClustered;

        @JsonProperty("certificate")
        private String certificate;

        public Environment() {
        }

        public String getServerName() {
            return serverName;
        }

        public void setServerName(String serverName) {
            this.serverName = serverName;
        }

        public boolean isServerClustered() {
            return serverClustered;
        }

        public void setServerClustered(boolean serverClustered) {
            this.serverClustered = serverClustered;
        }

        public String getCertificate() {
            return certificate;
        }

        public void setCertificate(String certificate) {
            this.certificate = certificate;
        }
    }
}
