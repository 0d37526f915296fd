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

import dev.mars.relocus.core.InstanceDefinition;
import dev.mars.relocus.core.exceptions.RelocationException;

/**
 * A connection to one server, scoped to a project and optionally to a cluster member.
 *
 * <p>Methods that start server-side work return a {@link RemoteOperation}; the caller
 * decides how long to wait for it. Every method may block on the network and is subject
 * to the connection's own timeouts. Failures are reported as
 * {@link dev.mars.relocus.core.exceptions.UnreachableException} when the server could not
 * be reached and {@link dev.mars.relocus.core.exceptions.OperationFailedException} when
 * it rejected the request.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 * @version 1.0
 */
public interface InstanceServer {

    /**
     * @return the alias this connection was opened for
     */
    String getRemoteAlias();

    /**
     * @return the project requests are scoped to, or null for the server default
     */
    String getProject();

    /**
     * Fetch server metadata. Not cached: each call asks the server.
     */
    ServerInfo getServerInfo() throws RelocationException;

    default boolean hasExtension(String extensionName) throws RelocationException {
        return getServerInfo().hasExtension(extensionName);
    }

    default boolean isClustered() throws RelocationException {
        return getServerInfo().isClustered();
    }

    /**
     * @return a view of this connection that directs requests at one cluster member
     */
    InstanceServer useTarget(String memberName);

    /**
     * @return a view of this connection scoped to another project
     */
    InstanceServer useProject(String project);

    /**
     * Fetch an instance with its expanded configuration and devices.
     *
     * @return an owned copy that shares no state with the server's cache
     */
    InstanceDefinition getInstance(String name) throws RelocationException;

    RemoteOperation renameInstance(String name, String newName) throws RelocationException;

    RemoteOperation renameSnapshot(String instanceName, String snapshotName, String newName) throws RelocationException;

    /**
     * Ask the server to relocate an instance internally (pool, project or cluster member change).
     */
    RemoteOperation migrateInstance(String name, InstanceMigration migration) throws RelocationException;

    /**
     * Put an instance into migration-source mode. The returned endpoint either listens for a
     * peer (pull, relay) or, when the spec names a target endpoint, connects out to it (push).
     */
    MigrationEndpoint prepareMigrationSource(String name, MigrationSourceSpec spec) throws RelocationException;

    /**
     * Create an instance whose contents arrive by migration.
     */
    MigrationEndpoint createInstanceFromMigration(InstanceCreateSpec spec) throws RelocationException;

    /**
     * Open one named data channel of a migration endpoint on this server.
     */
    MigrationChannel openMigrationChannel(MigrationEndpoint endpoint, String channelName) throws RelocationException;

    /**
     * Remove one configuration key from an instance.
     */
    RemoteOperation unsetInstanceConfig(String name, String key) throws RelocationException;

    /**
     * @param force stop the instance first if it is running
     */
    RemoteOperation deleteInstance(String name, boolean force) throws RelocationException;
}
