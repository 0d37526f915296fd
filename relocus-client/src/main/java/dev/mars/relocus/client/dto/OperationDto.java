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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A background operation as returned by {@code GET /1.0/operations/{id}} and in the
 * metadata of async responses.
 *
 * <p>For migration operations the nested {@code metadata} holds one secret per data
 * channel; during a transfer it carries {@code *_progress} entries.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class OperationDto {

    @JsonProperty("id")
    private String id;

    @JsonProperty("class")
    private String operationClass;

    @JsonProperty("status")
    private String status;

    @JsonProperty("status_code")
    private int statusCode;

    @JsonProperty("may_cancel")
    private boolean mayCancel;

    @JsonProperty("err")
    private String err;

    @JsonProperty("metadata")
    private Map<String, Object> metadata = new LinkedHashMap<>();

    public OperationDto() {
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getOperationClass() { return operationClass; }
    public void setOperationClass(String operationClass) { this.operationClass = operationClass; }

    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }

    public int getStatusCode() { return statusCode; }
    public void setStatusCode(int statusCode) { this.statusCode = statusCode; }

    public boolean isMayCancel() { return mayCancel; }
    public void setMayCancel(boolean mayCancel) { this.mayCancel = mayCancel; }

    public String getErr() { return err; }
    public void setErr(String err) { this.err = err; }

    public Map<String, Object> getMetadata() { return metadata; }
    public void setMetadata(Map<String, Object> metadata) { this.metadata = metadata; }
}
