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

import dev.mars.relocus.config.RelocusConfiguration;
import dev.mars.relocus.connection.ConnectionProvider;
import dev.mars.relocus.connection.InstanceServer;
import dev.mars.relocus.core.exceptions.UnreachableException;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Opens REST connections to the remotes of a {@link RemotesConfiguration}.
 *
 * <p>One HTTP client serves every remote; connections are cached per alias and are safe
 * to share between concurrent relocations.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-09
 * @version 1.0
 */
public class RestConnectionProvider implements ConnectionProvider {
    private static final Logger logger = Logger.getLogger(RestConnectionProvider.class.getName());

    private final RemotesConfiguration remotes;
    private final HttpClient httpClient;
    private final Duration requestTimeout;
    private final Duration pollInterval;
    private final Map<String, RestInstanceServer> connections = new ConcurrentHashMap<>();

    public RestConnectionProvider(RemotesConfiguration remotes, RelocusConfiguration configuration) {
        this.remotes = remotes;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(configuration.getConnectionTimeoutMs()))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        this.requestTimeout = Duration.ofMillis(configuration.getRequestTimeoutMs());
        this.pollInterval = Duration.ofMillis(configuration.getOperationPollIntervalMs());
    }

    @Override
    public InstanceServer connect(String remoteAlias) throws UnreachableException {
        RemoteDefinition remote = remotes.getRemote(remoteAlias);
        if (remote == null) {
            throw new UnreachableException(remoteAlias, "The remote \"" + remoteAlias + "\" doesn't exist");
        }
        return connections.computeIfAbsent(remoteAlias, alias -> {
            logger.fine("Opening connection to " + alias + " at " + remote.getAddress());
            RelocusApiClient apiClient = new RelocusApiClient(alias, remote.getAddress(), httpClient, requestTimeout);
            return new RestInstanceServer(apiClient, remote.getProject(), null, pollInterval);
        });
    }

    @Override
    public Set<String> getRemoteNames() {
        return remotes.getRemoteNames();
    }

    @Override
    public String getDefaultRemote() {
        return remotes.getDefaultRemote();
    }

    @Override
    public String getDefaultProject(String remoteAlias) {
        RemoteDefinition remote = remotes.getRemote(remoteAlias);
        return remote != null ? remote.getProject() : null;
    }
}
