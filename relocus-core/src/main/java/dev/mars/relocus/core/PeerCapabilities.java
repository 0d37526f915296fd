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

import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Feature flags and topology reported by one server for one request.
 *
 * <p>Instances are never shared between requests: a server can be upgraded between two
 * runs of a long-lived process, so capabilities are probed again every time.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-03
 * @version 1.0
 */
public final class PeerCapabilities {

    private static final PeerCapabilities NONE = new PeerCapabilities(Set.of(), false);

    private final Set<String> extensions;
    private final boolean clustered;

    public PeerCapabilities(Collection<String> extensions, boolean clustered) {
        this.extensions = Collections.unmodifiableSet(new TreeSet<>(extensions));
        this.clustered = clustered;
    }

    /**
     * Capabilities of a peer that advertises nothing.
     */
    public static PeerCapabilities none() {
        return NONE;
    }

    public boolean supports(String extensionName) {
        return extensions.contains(extensionName);
    }

    public boolean supports(ApiExtension extension) {
        return supports(extension.getExtensionName());
    }

    public boolean canMoveConfig() {
        return supports(ApiExtension.INSTANCE_MOVE_CONFIG);
    }

    public boolean canMovePool() {
        return supports(ApiExtension.INSTANCE_POOL_MOVE);
    }

    public boolean canMoveProject() {
        return supports(ApiExtension.INSTANCE_PROJECT_MOVE);
    }

    public boolean isClustered() {
        return clustered;
    }

    public Set<String> getExtensions() {
        return extensions;
    }

    @Override
    public String toString() {
        return "PeerCapabilities{clustered=" + clustered + ", extensions=" + extensions.size() + "}";
    }
}
