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
import com.fasterxml.jackson.databind.JsonNode;

/**
 * The envelope every server response arrives in. {@code type} is one of
 * {@code sync}, {@code async} or {@code error}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ApiResponse {

    public static final String TYPE_SYNC = "sync";
    public static final String TYPE_ASYNC = "async";
    public static final String TYPE_ERROR = "error";

    @JsonProperty("type")
    private String type;

    @JsonProperty("status_code")
    private int statusCode;

    @JsonProperty("error_code")
    private int errorCode;

    @JsonProperty("error")
    private String error;

    @JsonProperty("operation")
    private String operation;

    @JsonProperty("metadata")
    private JsonNode metadata;

    public ApiResponse() {
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public void setStatusCode(int statusCode) {
        this.statusCode = statusCode;
    }

    public int getErrorCode() {
        return errorCode;
    }

    public void setErrorCode(int errorCode) {
        this.errorCode = errorCode;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    /**
     * @return the path of the background operation for an async response
     */
    public String getOperation() {
        return operation;
    }

    public void setOperation(String operation) {
        this.operation = operation;
    }

    public JsonNode getMetadata() {
        return metadata;
    }

    public void setMetadata(JsonNode metadata) {
        this.metadata = metadata;
    }

    public boolean isError() {
        return TYPE_ERROR.equals(type);
    }

    public boolean isAsync() {
        return TYPE_ASYNC.equals(type);
    }
}
