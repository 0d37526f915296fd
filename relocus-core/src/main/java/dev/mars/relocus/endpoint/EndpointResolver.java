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

package dev.mars.relocus.endpoint;

import dev.mars.relocus.connection.ConnectionProvider;
import dev.mars.relocus.core.LocationRef;
import dev.mars.relocus.core.exceptions.InvalidInstanceNameException;
import dev.mars.relocus.core.exceptions.MalformedReferenceException;
import dev.mars.relocus.core.exceptions.RelocationErrorKind;
import dev.mars.relocus.core.exceptions.RelocationException;

import java.util.Objects;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Parses {@code [<remote>:]<instance>[/<snapshot>]} tokens into {@link LocationRef}s.
 *
 * <p>Resolution needs only the provider's list of remotes; no connection is opened.
 * An empty instance name is accepted on the destination side and means "keep the
 * source name".</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-05
 * @version 1.0
 */
public class EndpointResolver {
    private static final Logger logger = Logger.getLogger(EndpointResolver.class.getName());

    public static final int MAX_NAME_LENGTH = 63;

    private static final Pattern INSTANCE_NAME = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9-]{0," + (MAX_NAME_LENGTH - 1) + "}$");

    private final ConnectionProvider connectionProvider;

    public EndpointResolver(ConnectionProvider connectionProvider) {
        this.connectionProvider = Objects.requireNonNull(connectionProvider, "Connection provider cannot be null");
    }

    /**
     * Resolve the source side of a relocation. The instance name is mandatory.
     *
     * @param project project override, or null for the remote's configured project
     */
    public LocationRef resolveSource(String token, String project) throws RelocationException {
        LocationRef ref = resolve(token, project);
        if (!ref.hasInstanceName()) {
            throw new RelocationException(RelocationErrorKind.INVALID_REQUEST, "You must specify a source instance name");
        }
        return ref;
    }

    /**
     * Resolve the destination side of a relocation. {@code remote:} alone is valid.
     */
    public LocationRef resolveDestination(String token, String project) throws RelocationException {
        return resolve(token, project);
    }

    private LocationRef resolve(String token, String project) throws RelocationException {
        if (token == null || token.isEmpty()) {
            throw new MalformedReferenceException(String.valueOf(token), "empty reference");
        }

        String remote;
        String resource;
        int separator = token.indexOf(':');
        if (separator < 0) {
            remote = connectionProvider.getDefaultRemote();
            resource = token;
        } else {
            if (token.indexOf(':', separator + 1) >= 0) {
                throw new MalformedReferenceException(token, "more than one remote separator");
            }
            remote = token.substring(0, separator);
            resource = token.substring(separator + 1);
            if (remote.isEmpty()) {
                throw new MalformedReferenceException(token, "empty remote name");
            }
            if (!connectionProvider.hasRemote(remote)) {
                throw new MalformedReferenceException(token, "the remote \"" + remote + "\" doesn't exist");
            }
        }

        String instanceName = resource;
        String snapshotName = null;
        int slash = resource.indexOf('/');
        if (slash >= 0) {
            if (resource.indexOf('/', slash + 1) >= 0) {
                throw new MalformedReferenceException(token, "more than one snapshot separator");
            }
            instanceName = resource.substring(0, slash);
            snapshotName = resource.substring(slash + 1);
            if (instanceName.isEmpty()) {
                throw new MalformedReferenceException(token, "snapshot without an instance name");
            }
            validateSnapshotName(snapshotName);
        }

        if (!instanceName.isEmpty()) {
            validateInstanceName(instanceName);
        }

        String effectiveProject = project != null && !project.isEmpty()
                ? project
                : connectionProvider.getDefaultProject(remote);

        LocationRef ref = new LocationRef(remote, effectiveProject, instanceName, snapshotName);
        logger.fine("Resolved '" + token + "' to " + ref);
        return ref;
    }

    /**
     * Check a name against the instance naming rules: letters, digits and hyphens,
     * at most {@value #MAX_NAME_LENGTH} characters, not starting with a hyphen.
     */
    public static void validateInstanceName(String name) throws InvalidInstanceNameException {
        if (name == null || name.isEmpty()) {
            throw new InvalidInstanceNameException(String.valueOf(name), "name cannot be empty");
        }
        if (name.length() > MAX_NAME_LENGTH) {
            throw new InvalidInstanceNameException(name, "name longer than " + MAX_NAME_LENGTH + " characters");
        }
        if (name.startsWith("-")) {
            throw new InvalidInstanceNameException(name, "name cannot start with a hyphen");
        }
        if (!INSTANCE_NAME.matcher(name).matches()) {
            throw new InvalidInstanceNameException(name, "only letters, digits and hyphens are allowed");
        }
    }

    public static void validateSnapshotName(String name) throws InvalidInstanceNameException {
        if (name == null || name.isEmpty()) {
            throw new InvalidInstanceNameException(String.valueOf(name), "snapshot name cannot be empty");
        }
        if (name.length() > MAX_NAME_LENGTH) {
            throw new InvalidInstanceNameException(name, "snapshot name longer than " + MAX_NAME_LENGTH + " characters");
        }
        for (int i = 0; i < name.length(); i++) {
            if (Character.isWhitespace(name.charAt(i))) {
                throw new InvalidInstanceNameException(name, "snapshot name cannot contain whitespace");
            }
        }
    }
}
