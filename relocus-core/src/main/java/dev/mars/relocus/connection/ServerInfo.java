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

package dev.mars.relocus.connection;

import java.util.List;
import java.util.Objects;

/**
 * Metadata a server reports about itself: API extensions and cluster membership.
 */
public final class ServerInfo {

    private final String serverName;
    private final String apiVersion;
    private final List<String> extensions;
    private final boolean clustered;
    private final String certificate;

    public ServerInfo(String serverName, String apiVersion, List<String> extensions, boolean clustered, String certificate) {
        this.serverName = serverName;
        this.apiVersion = apiVersion;
        this.extensions = extensions != null ? List.copyOf(extensions) : List.of();
        this.clustered = clustered;
        this.certificate = certificate;
    }

    public String getServerName() {
        return serverName;
    }

    public String getApiVersion() {
        return apiVersion;
    }

    public List<String> getExtensions() {
        return extensions;
    }

    public boolean isClustered() {
        return clustered;
    }

    /**
     * @return the server's TLS certificate in PEM form, used by a peer pulling from it; may be null
     */
    public String getCertificate() {
        return certificate;
    }

    public boolean hasExtension(String name) {
        return extensions.contains(name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ServerInfo that = (ServerInfo) o;
        return clustered == that.clustered
                && Objects.equals(serverName, that.serverName)
                && Objects.equals(apiVersion, that.apiVersion)
                && extensions.equals(that.extensions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(serverName, apiVersion, extensions, clustered);
    }

    @Override
    public String toString() {
        return "ServerInfo{name='" + serverName + "', api=" + apiVersion + ", clustered=" + clustered +
                ", extensions=" + extensions.size() + "}";
    }
}
