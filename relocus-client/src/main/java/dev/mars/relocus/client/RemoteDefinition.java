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

import java.util.Objects;

/**
 * One named remote from the remotes file: where its API lives and which project
 * requests default to.
 */
public final class RemoteDefinition {

    private final String name;
    private final String address;
    private final String project;

    public RemoteDefinition(String name, String address, String project) {
        this.name = Objects.requireNonNull(name, "Remote name cannot be null");
        this.address = Objects.requireNonNull(address, "Remote address cannot be null");
        this.project = project;
    }

    public String getName() {
        return name;
    }

    public String getAddress() {
        return address;
    }

    /**
     * @return the default project, or null for the server's own default
     */
    public String getProject() {
        return project;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RemoteDefinition that = (RemoteDefinition) o;
        return name.equals(that.name) && address.equals(that.address) && Objects.equals(project, that.project);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, address, project);
    }

    @Override
    public String toString() {
        return "RemoteDefinition{name='" + name + "', address='" + address + "', project='" + project + "'}";
    }
}
