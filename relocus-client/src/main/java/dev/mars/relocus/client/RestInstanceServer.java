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

import dev.mars.relocus.client.dto.ApiResponse;
import dev.mars.relocus.client.dto.InstanceDto;
import dev.mars.relocus.client.dto.InstancePostDto;
import dev.mars.relocus.client.dto.InstancePutDto;
import dev.mars.relocus.client.dto.InstanceStatePutDto;
import dev.mars.relocus.client.dto.InstancesPostDto;
import dev.mars.relocus.client.dto.MigrationTargetDto;
import dev.mars.relocus.client.dto.OperationDto;
import dev.mars.relocus.client.dto.ServerDto;
import dev.mars.relocus.connection.InstanceCreateSpec;
import dev.mars.relocus.connection.InstanceMigration;
import dev.mars.relocus.connection.InstanceServer;
import dev.mars.relocus.connection.MigrationChannel;
import dev.mars.relocus.connection.MigrationEndpoint;
import dev.mars.relocus.connection.MigrationSourceSpec;
import dev.mars.relocus.connection.RemoteOperation;
import dev.mars.relocus.connection.ServerInfo;
import dev.mars.relocus.core.InstanceDefinition;
import dev.mars.relocus.core.OperationStatus;
import dev.mars.relocus.core.TransferMode;
import dev.mars.relocus.core.exceptions.OperationFailedException;
import dev.mars.relocus.core.exceptions.RelocationException;
import dev.mars.relocus.core.exceptions.UnreachableException;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.StringJoiner;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * {@link InstanceServer} backed by a remote's {@code /1.0} REST API.
 *
 * <p>Instances are immutable views: {@link #useProject(String)} and
 * {@link #useTarget(String)} return new views sharing the same HTTP client.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-09
 * @version 1.0
 */
public class RestInstanceServer implements InstanceServer {
    private static final Logger logger = Logger.getLogger(RestInstanceServer.class.getName());

    private static final String INSTANCES = "/1.0/instances";

    private final RelocusApiClient apiClient;
    private final String project;
    private final String targetMember;
    private final Duration pollInterval;

    public RestInstanceServer(RelocusApiClient apiClient, String project, String targetMember, Duration pollInterval) {
        this.apiClient = apiClient;
        this.project = project;
        this.targetMember = targetMember;
        this.pollInterval = pollInterval;
    }

    RelocusApiClient getApiClient() {
        return apiClient;
    }

    @Override
    public String getRemoteAlias() {
        return apiClient.getRemoteAlias();
    }

    @Override
    public String getProject() {
        return project;
    }

    public String getTargetMember() {
        return targetMember;
    }

    @Override
    public ServerInfo getServerInfo() throws RelocationException {
        ServerDto server = apiClient.readMetadata(apiClient.get("/1.0"), ServerDto.class);
        ServerDto.Environment environment = server.getEnvironment() != null
                ? server.getEnvironment() : new ServerDto.Environment();
        return new ServerInfo(environment.getServerName(), server.getApiVersion(), server.getApiExtensions(),
                environment.isServerClustered(), environment.getCertificate());
    }

    @Override
    public InstanceServer useTarget(String memberName) {
        return new RestInstanceServer(apiClient, project, memberName, pollInterval);
    }

    @Override
    public InstanceServer useProject(String newProject) {
        return new RestInstanceServer(apiClient, newProject, targetMember, pollInterval);
    }

    @Override
    public InstanceDefinition getInstance(String name) throws RelocationException {
        return toDefinition(fetchInstance(name));
    }

    @Override
    public RemoteOperation renameInstance(String name, String newName) throws RelocationException {
        return operation(apiClient.post(scoped(instancePath(name)), InstancePostDto.rename(newName)));
    }

    @Override
    public RemoteOperation renameSnapshot(String instanceName, String snapshotName, String newName)
            throws RelocationException {
        String path = instancePath(instanceName) + "/snapshots/" + encode(snapshotName);
        return operation(apiClient.post(scoped(path), InstancePostDto.rename(newName)));
    }

    @Override
    public RemoteOperation migrateInstance(String name, InstanceMigration migration) throws RelocationException {
        InstancePostDto body = new InstancePostDto();
        body.setName(migration.getName());
        body.setMigration(migration.isMigration());
        body.setLive(migration.isLive());
        body.setInstanceOnly(migration.isInstanceOnly());
        body.setPool(migration.getPool());
        body.setProject(migration.getProject());
        body.setProfiles(migration.getProfiles());
        body.setConfig(migration.getConfig());
        body.setDevices(migration.getDevices());
        logger.info("Requesting server-side move of " + name + " on " + getRemoteAlias());
        return operation(apiClient.post(scoped(instancePath(name)), body));
    }

    @Override
    public MigrationEndpoint prepareMigrationSource(String name, MigrationSourceSpec spec) throws RelocationException {
        InstancePostDto body = new InstancePostDto();
        body.setMigration(true);
        body.setLive(spec.live());
        body.setInstanceOnly(spec.instanceOnly());
        body.setAllowInconsistent(spec.allowInconsistent());
        if (spec.isPush()) {
            MigrationEndpoint target = spec.target();
            body.setTarget(new MigrationTargetDto(target.getOperationUrl(), target.getSecrets(), target.getCertificate()));
        }
        RestRemoteOperation operation = operation(apiClient.post(scoped(instancePath(name)), body));
        return spec.isPush() ? new MigrationEndpoint(operation, null, null, null) : listening(operation);
    }

    @Override
    public MigrationEndpoint createInstanceFromMigration(InstanceCreateSpec spec) throws RelocationException {
        InstancesPostDto.Source source = new InstancesPostDto.Source();
        source.setLive(spec.isLive());
        source.setInstanceOnly(spec.isInstanceOnly());
        source.setAllowInconsistent(spec.isAllowInconsistent());
        source.setRefresh(spec.isRefresh());
        // A relayed copy is a push from the destination's point of view
        source.setMode(spec.getMode() == TransferMode.PULL ? "pull" : "push");
        if (spec.getMode() == TransferMode.PULL) {
            MigrationEndpoint peer = spec.getSourceEndpoint();
            if (peer == null) {
                throw new OperationFailedException(null, "A pulling destination needs the source endpoint");
            }
            source.setOperation(peer.getOperationUrl());
            source.setSecrets(peer.getSecrets());
            source.setCertificate(peer.getCertificate());
        }

        InstancesPostDto body = new InstancesPostDto();
        body.setName(spec.getName());
        body.setType(spec.getType());
        body.setProfiles(spec.getProfiles());
        body.setConfig(spec.getConfig());
        body.setDevices(spec.getDevices());
        body.setEphemeral(spec.isEphemeral());
        body.setSource(source);

        RestRemoteOperation operation = operation(apiClient.post(scoped(INSTANCES), body));
        return spec.getMode() == TransferMode.PULL ? new MigrationEndpoint(operation, null, null, null) : listening(operation);
    }

    @Override
    public MigrationChannel openMigrationChannel(MigrationEndpoint endpoint, String channelName)
            throws RelocationException {
        String secret = endpoint.getSecret(channelName);
        if (secret == null) {
            throw new OperationFailedException(endpoint.getOperation().getId(),
                    "Operation has no migration channel named " + channelName);
        }
        String path = scoped("/1.0/operations/" + endpoint.getOperation().getId() + "/websocket", "secret", secret);
        try {
            return WebSocketMigrationChannel.open(apiClient.getHttpClient(), apiClient.webSocketUri(path),
                    channelName, apiClient.getRequestTimeout());
        } catch (IOException e) {
            throw new UnreachableException(getRemoteAlias(), e.getMessage(), e);
        }
    }

    @Override
    public RemoteOperation unsetInstanceConfig(String name, String key) throws RelocationException {
        InstanceDto instance = fetchInstance(name);
        InstancePutDto body = InstancePutDto.from(instance);
        Map<String, String> config = instance.getConfig() != null
                ? new LinkedHashMap<>(instance.getConfig())
                : new LinkedHashMap<>();
        config.remove(key);
        body.setConfig(config);
        return operation(apiClient.put(scoped(instancePath(name)), body));
    }

    @Override
    public RemoteOperation deleteInstance(String name, boolean force) throws RelocationException {
        if (force && "Running".equalsIgnoreCase(fetchInstance(name).getStatus())) {
            stop(name);
        }
        logger.info("Deleting instance " + name + " on " + getRemoteAlias());
        return operation(apiClient.delete(scoped(instancePath(name))));
    }

    private void stop(String name) throws RelocationException {
        RemoteOperation stop = operation(apiClient.put(scoped(instancePath(name) + "/state"),
                InstanceStatePutDto.forceStop()));
        OperationStatus status;
        try {
            status = stop.waitFor(apiClient.getRequestTimeout());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationFailedException(stop.getId(), "Interrupted while stopping " + name);
        }
        if (status != OperationStatus.SUCCESS) {
            throw new OperationFailedException(stop.getId(),
                    stop.getError().orElse("Failed to stop " + name + " (" + status.name() + ")"));
        }
    }

    private InstanceDto fetchInstance(String name) throws RelocationException {
        ApiResponse response = apiClient.get(scoped(instancePath(name), "recursion", "1"));
        return apiClient.readMetadata(response, InstanceDto.class);
    }

    private MigrationEndpoint listening(RestRemoteOperation operation) throws RelocationException {
        String certificate = getServerInfo().getCertificate();
        return new MigrationEndpoint(operation, apiClient.getBaseUrl() + operation.getPath(),
                operation.getInitialMetadata(), certificate);
    }

    private RestRemoteOperation operation(ApiResponse response) throws RelocationException {
        if (!response.isAsync()) {
            throw new OperationFailedException(null, response.getStatusCode(),
                    "Expected a background operation but got a " + response.getType() + " response", null);
        }
        OperationDto dto = apiClient.readMetadata(response, OperationDto.class);
        if (dto.getId() == null && response.getOperation() != null) {
            String path = response.getOperation();
            dto.setId(path.substring(path.lastIndexOf('/') + 1));
        }
        return new RestRemoteOperation(this, dto, pollInterval);
    }

    private static InstanceDefinition toDefinition(InstanceDto dto) {
        InstanceDefinition.Builder builder = InstanceDefinition.builder()
                .name(dto.getName())
                .project(dto.getProject())
                .location(dto.getLocation())
                .status(dto.getStatus())
                .type(dto.getType())
                .ephemeral(dto.isEphemeral())
                .profiles(dto.getProfiles())
                .config(dto.getConfig())
                .expandedConfig(dto.getExpandedConfig());
        if (dto.getDevices() != null) {
            dto.getDevices().forEach(builder::device);
        }
        if (dto.getExpandedDevices() != null) {
            dto.getExpandedDevices().forEach(builder::expandedDevice);
        }
        if (dto.getSnapshots() != null) {
            builder.snapshots(dto.getSnapshots().stream().map(InstanceDto.SnapshotDto::getName).collect(Collectors.toList()));
        }
        return builder.build();
    }

    private static String instancePath(String name) {
        return INSTANCES + "/" + encode(name);
    }

    /**
     * Append the connection's project and target member to a path, plus extra key/value pairs.
     */
    String scoped(String path, String... extraParams) {
        StringJoiner query = new StringJoiner("&");
        if (project != null) {
            query.add("project=" + encode(project));
        }
        if (targetMember != null) {
            query.add("target=" + encode(targetMember));
        }
        for (int i = 0; i + 1 < extraParams.length; i += 2) {
            query.add(extraParams[i] + "=" + encode(extraParams[i + 1]));
        }
        return query.length() == 0 ? path : path + "?" + query;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "RestInstanceServer{remote='" + getRemoteAlias() + "', project='" + project +
                "', target='" + targetMember + "'}";
    }
}
