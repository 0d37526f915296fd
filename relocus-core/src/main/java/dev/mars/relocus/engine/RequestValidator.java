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

package dev.mars.relocus.engine;

import dev.mars.relocus.core.LocationRef;
import dev.mars.relocus.core.RelocationRequest;
import dev.mars.relocus.core.exceptions.RelocationErrorKind;
import dev.mars.relocus.core.exceptions.RelocationException;
import dev.mars.relocus.endpoint.EndpointResolver;
import dev.mars.relocus.override.OverrideMerger;

/**
 * Checks a request before any connection is used and fills in the destination name.
 */
public class RequestValidator {

    private final OverrideMerger overrideMerger;

    public RequestValidator(OverrideMerger overrideMerger) {
        this.overrideMerger = overrideMerger;
    }

    /**
     * @return the request with an empty destination name replaced by the source name
     * @throws RelocationException with an input error kind if the request is invalid
     */
    public RelocationRequest validate(RelocationRequest request) throws RelocationException {
        overrideMerger.validateProfiles(request);

        LocationRef source = request.getSource();
        if (!source.hasInstanceName()) {
            throw new RelocationException(RelocationErrorKind.INVALID_REQUEST, "You must specify a source instance name");
        }
        EndpointResolver.validateInstanceName(source.getInstanceName());
        if (source.isSnapshot()) {
            EndpointResolver.validateSnapshotName(source.getSnapshotName());
        }

        LocationRef destination = request.getDestination();
        if (!destination.hasInstanceName()) {
            destination = destination.withInstanceName(source.getInstanceName())
                    .withSnapshotName(destination.isSnapshot() ? destination.getSnapshotName() : source.getSnapshotName());
        } else {
            EndpointResolver.validateInstanceName(destination.getInstanceName());
        }
        if (destination.isSnapshot()) {
            EndpointResolver.validateSnapshotName(destination.getSnapshotName());
        }

        validateSnapshots(request, source, destination);

        if (destination.equals(request.getDestination())) {
            return request;
        }
        return request.toBuilder().destination(destination).build();
    }

    private static void validateSnapshots(RelocationRequest request, LocationRef source, LocationRef destination)
            throws RelocationException {
        if (!source.isSnapshot()) {
            if (destination.isSnapshot()) {
                throw new RelocationException(RelocationErrorKind.INVALID_REQUEST,
                        "An instance cannot be moved to a snapshot: " + destination);
            }
            return;
        }
        if (!source.isSameConnection(destination) || request.hasTargets() || request.hasOverrides()) {
            throw new RelocationException(RelocationErrorKind.INVALID_REQUEST,
                    "Snapshots can only be renamed in place: " + source);
        }
        if (!destination.isSnapshot() || !destination.getInstanceName().equals(source.getInstanceName())) {
            throw new RelocationException(RelocationErrorKind.INVALID_REQUEST,
                    "A snapshot can only be renamed within its instance: " + source + " -> " + destination);
        }
    }
}
