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


package dev.mars.relocus.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.relocus.client.dto.ApiResponse;
import dev.mars.relocus.core.exceptions.OperationFailedException;
import dev.mars.relocus.core.exceptions.RelocationErrorKind;
import dev.mars.relocus.core.exceptions.RelocationException;
import dev.mars.relocus.core.exceptions.UnreachableException;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.logging.Logger;

/**
 * Low-level JSON client for one remote's REST API.
 *
 * <p>Every response is unwrapped from its envelope. Transport failures surface as
 * {@link UnreachableException}; error envelopes and unexpected HTTP statuses surface as
 * {@link ApiException}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-09
 * @version 1.0
 */
public class RelocusApiClient {
    private static final Logger logger = Logger.getLogger(RelocusApiClient.class.getName());

    private final String remoteAlias;
    private final String baseUrl;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;

    public RelocusApiClient(String remoteAlias, String baseUrl, HttpClient httpClient, Duration requestTimeout) {
        this.remoteAlias = remoteAlias;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.httpClient = httpClient;
        this.requestTimeout = requestTimeout;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public String getRemoteAlias() {
        return remoteAlias;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public HttpClient getHttpClient() {
        return httpClient;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public ApiResponse get(String path) throws RelocationException {
        return query("GET", path, null);
    }

    public ApiResponse post(String path, Object body) throws RelocationException {
        return query("POST", path, body);
    }

    public ApiResponse put(String path, Object body) throws RelocationException {
        return query("PUT", path, body);
    }

    public ApiResponse delete(String path) throws RelocationException {
        return query("DELETE", path, null);
    }

    /**
     * Send one request and unwrap the response envelope.
     *
     * @param path path and query relative to the remote's address, starting with {@code /}
     */
    public ApiResponse query(String method, String path, Object body) throws RelocationException {
        HttpRequest request;
        try {
            HttpRequest.BodyPublisher publisher = body != null
                    ? HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body))
                    : HttpRequest.BodyPublishers.noBody();
            request = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path))
                    .timeout(requestTimeout)
                    .header("Content-Type", "application/json")
                    .header("Accept", "application/json")
                    .method(method, publisher)
                    .build();
        } catch (JsonProcessingException e) {
            throw new RelocationException(RelocationErrorKind.INVALID_REQUEST,
                    "Failed to encode request for " + method + " " + path, e);
        }

        HttpResponse<String> response;
        try {
            logger.fine(remoteAlias + ": " + method + " " + path);
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new UnreachableException(remoteAlias,
                    "Failed to reach remote \"" + remoteAlias + "\" at " + baseUrl + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationFailedException(null, "Interrupted during " + method + " " + path);
        }

        ApiResponse envelope;
        try {
            envelope = objectMapper.readValue(response.body(), ApiResponse.class);
        } catch (JsonProcessingException e) {
            if (response.statusCode() >= 400) {
                throw new ApiException(response.statusCode(),
                        "HTTP " + response.statusCode() + " - " + response.body());
            }
            throw new OperationFailedException(null, response.statusCode(),
                    "Unreadable response from " + method + " " + path, e);
        }

        if (envelope.isError() || response.statusCode() >= 400) {
            int code = envelope.getErrorCode() != 0 ? envelope.getErrorCode() : response.statusCode();
            String message = envelope.getError() != null ? envelope.getError() : "HTTP " + response.statusCode();
            throw new ApiException(code, message);
        }
        return envelope;
    }

    /**
     * Bind response metadata to a DTO.
     */
    public <T> T readMetadata(ApiResponse response, Class<T> type) throws RelocationException {
        JsonNode metadata = response.getMetadata();
        if (metadata == null || metadata.isNull()) {
            throw new OperationFailedException(null, "Response carried no metadata for " + type.getSimpleName());
        }
        try {
            return objectMapper.treeToValue(metadata, type);
        } catch (JsonProcessingException e) {
            throw new OperationFailedException(null, 0,
                    "Failed to decode " + type.getSimpleName() + ": " + e.getOriginalMessage(), e);
        }
    }

    /**
     * @return the WebSocket form of a path on this remote
     */
    public URI webSocketUri(String path) {
        String wsBase;
        if (baseUrl.startsWith("https://")) {
            wsBase = "wss://" + baseUrl.substring("https://".length());
        } else if (baseUrl.startsWith("http://")) {
            wsBase = "ws://" + baseUrl.substring("http://".length());
        } else {
            wsBase = baseUrl;
        }
        return URI.create(wsBase + path);
    }
}
