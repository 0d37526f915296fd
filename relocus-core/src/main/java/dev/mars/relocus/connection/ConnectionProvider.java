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

import dev.mars.relocus.core.exceptions.UnreachableException;

import java.util.Set;

/**
 * Hands out server connections by remote alias.
 *
 * <p>Implementations must allow the same connection to be used by several relocations
 * at once.</p>
 */
public interface ConnectionProvider {

    /**
     * Connect to a named remote.
     *
     * @param remoteAlias the remote's alias
     * @return a connection handle, possibly shared with other callers
     * @throws UnreachableException if the remote is unknown or no connection can be established
     */
    InstanceServer connect(String remoteAlias) throws UnreachableException;

    /**
     * @return the aliases this provider knows about
     */
    Set<String> getRemoteNames();

    /**
     * @return the alias used when a reference names no remote
     */
    String getDefaultRemote();

    /**
     * @return the project configured for a remote, or null for the server default
     */
    default String getDefaultProject(String remoteAlias) {
        return null;
    }

    default boolean hasRemote(String remoteAlias) {
        return getRemoteNames().contains(remoteAlias);
    }
}
