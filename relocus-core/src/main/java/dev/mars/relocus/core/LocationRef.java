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

package dev.mars.relocus.core;

import java.util.Objects;

/**
 * Immutable reference to an instance, or one of its snapshots, on a named remote.
 *
 * <p>The project is optional; a null project means the remote's current project.
 * An empty instance name is only ever produced for a destination and means
 * "keep the source name" until the engine normalizes it.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public final class LocationRef {

    private final String remoteAlias;
    private final String project;
    private final String instanceName;
    private final String snapshotName;

    public LocationRef(String remoteAlias, String project, String instanceName, String snapshotName) {
        this.remoteAlias = Objects.requireNonNull(remoteAlias, "Remote alias cannot be null");
        this.project = project;
        this.instanceName = instanceName != null ? instanceName : "";
        this.snapshotName = snapshotName;
    }

    public static LocationRef of(String remoteAlias, String instanceName) {
        return new LocationRef(remoteAlias, null, instanceName, null);
    }

    public static LocationRef of(String remoteAlias, String project, String instanceName) {
        return new LocationRef(remoteAlias, project, instanceName, null);
    }

    public static LocationRef snapshot(String remoteAlias, String project, String instanceName, String snapshotName) {
        return new LocationRef(remoteAlias, project, instanceName, snapshotName);
    }

    public String getRemoteAlias() {
        return remoteAlias;
    }

    public String getProject() {
        return project;
    }

    public String getInstanceName() {
        return instanceName;
    }

    public String getSnapshotName() {
        return snapshotName;
    }

    public boolean isSnapshot() {
        return snapshotName != null;
    }

    public boolean hasInstanceName() {
        return !instanceName.isEmpty();
    }

    /**
     * Two references share a connection when they name the same remote.
     */
    public boolean isSameConnection(LocationRef other) {
        return other != null && remoteAlias.equals(other.remoteAlias);
    }

    /**
     * @return {@code instance} or {@code instance/snapshot}
     */
    public String getResourceName() {
        return snapshotName == null ? instanceName : instanceName + "/" + snapshotName;
    }

    public LocationRef withInstanceName(String name) {
        return new LocationRef(remoteAlias, project, name, snapshotName);
    }

    public LocationRef withProject(String newProject) {
        return new LocationRef(remoteAlias, newProject, instanceName, snapshotName);
    }

    public LocationRef withSnapshotName(String name) {
        return new LocationRef(remoteAlias, project, instanceName, name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LocationRef that = (LocationRef) o;
        return remoteAlias.equals(that.remoteAlias)
                && Objects.equals(project, that.project)
                && instanceName.equals(that.instanceName)
                && Objects.equals(snapshotName, that.snapshotName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(remoteAlias, project, instanceName, snapshotName);
    }

    @Override
    public String toString() {
        return remoteAlias + ":" + getResourceName() + (project != null ? " (project " + project + ")" : "");
    }
}
