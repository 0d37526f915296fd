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

package dev.mars.relocus.strategy;

import dev.mars.relocus.core.PeerCapabilities;
import dev.mars.relocus.core.RelocationRequest;

import java.util.Objects;

/**
 * Inputs to strategy selection.
 *
 * @param request        the relocation request
 * @param sameConnection whether source and destination are on the same remote
 * @param capabilities   the source server's capabilities; {@link PeerCapabilities#none()} when not probed
 */
public record SelectionContext(RelocationRequest request, boolean sameConnection, PeerCapabilities capabilities) {

    public SelectionContext {
        Objects.requireNonNull(request, "Request cannot be null");
        capabilities = capabilities != null ? capabilities : PeerCapabilities.none();
    }

    public static SelectionContext of(RelocationRequest request, PeerCapabilities capabilities) {
        return new SelectionContext(request,
                request.getSource().isSameConnection(request.getDestination()), capabilities);
    }
}
