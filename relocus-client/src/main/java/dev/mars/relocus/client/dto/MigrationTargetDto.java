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

import java.util.Map;

/**
 * Where a pushing source or pulling destination connects: the peer's operation URL,
 * its channel secrets and its certificate.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MigrationTargetDto {

    @JsonProperty("operation")
    private String operation;

    @JsonProperty("secrets")
    private Map<String, String> secrets;

    @JsonProperty("certificate")
    private String certificate;

    public MigrationTargetDto() {
    }

    public MigrationTargetDto(String operation, Map<String, String> secrets, String certificate) {
        this.operation = operation;
        this.secrets = secrets;
        this.certificate = certificate;
    }

    public String getOperation() { return operation; }
    public void setOperation(String operation) { this.operation = operation; }

    public Map<String, String> getSecrets() { return secrets; }
    public void setSecrets(Map<String, String> secrets) { this.secrets = secrets; }

    public String getCertificate() { return certificate; }
    public void setCertificate(String certificate) { this.certificate = certificate; }
}
