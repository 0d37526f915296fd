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


package dev.mars.relocus.simulator;

import dev.mars.relocus.connection.ConnectionProvider;
import dev.mars.relocus.connection.InstanceServer;
import dev.mars.relocus.core.exceptions.UnreachableException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Connection provider over a fixed set of {@link InMemoryInstanceServerSimulator}s.
 */
public class InMemoryConnectionProvider implements ConnectionProvider {

    private final Map<String, InMemoryInstanceServerSimulator> servers = new LinkedHashMap<>();
    private final Map<String, String> defaultProjects = new ConcurrentHashMap<>();
    private final Set<String> unreachable = ConcurrentHashMap.newKeySet();
    private final AtomicInteger connectCalls = new AtomicInteger();
    private final String defaultRemote;

    public InMemoryConnectionProvider(String defaultRemote) {
        this.defaultRemote = defaultRemote;
    }

    public InMemoryInstanceServerSimulator addServer(String alias) {
        InMemoryInstanceServerSimulator server = new InMemoryInstanceServerSimulator(alias);
        servers.put(alias, server);
        return server;
    }

    public InMemoryInstanceServerSimulator getServer(String alias) {
        return servers.get(alias);
    }

    public void setDefaultProject(String alias, String project) {
        defaultProjects.put(alias, project);
    }

    public void markUnreachable(String alias) {
        unreachable.add(alias);
    }

    public int getConnectCalls() {
        return connectCalls.get();
    }

    /**
     * @return provider connects plus every call made on any server
     */
    public int getTotalCalls() {
        return connectCalls.get() + servers.values().stream().mapToInt(InMemoryInstanceServerSimulator::getTotalCalls).sum();
    }

    @Override
    public InstanceServer connect(String remoteAlias) throws UnreachableException {
        connectCalls.incrementAndGet();
        InMemoryInstanceServerSimulator server = servers.get(remoteAlias);
        if (server == null) {
            throw new UnreachableException(remoteAlias, "The remote \"" + remoteAlias + "\" doesn't exist");
        }
        if (unreachable.contains(remoteAlias)) {
            throw new UnreachableException(remoteAlias, "Failed to connect to " + remoteAlias + ": connection refused");
        }
        return server;
    }

    @Override
    public Set<String> getRemoteNames() {
        return Collections.unmodifiableSet(servers.keySet());
    }

    @Override
    public String getDefaultRemote() {
        return defaultRemote;
    }

    @Override
    public String getDefaultProject(String remoteAlias) {
        return defaultProjects.get(remoteAlias);
    }
}
