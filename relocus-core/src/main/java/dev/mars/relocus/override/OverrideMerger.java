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

package dev.mars.relocus.override;

import dev.mars.relocus.core.DeviceOverrideSet;
import dev.mars.relocus.core.InstanceDefinition;
import dev.mars.relocus.core.RelocationRequest;
import dev.mars.relocus.core.exceptions.ConflictingProfileOverrideException;
import dev.mars.relocus.core.exceptions.RelocationException;
import dev.mars.relocus.core.exceptions.UnknownDeviceException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Combines a request's configuration, device and profile overrides with an instance's
 * expanded definition.
 *
 * <p>Configuration overrides are set as given. Device overrides are laid key-wise over
 * the expanded device and the result replaces the whole device. Profile overrides replace
 * the profile list. All merging happens on copies: the instance definition passed in is
 * never modified.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-06
 * @version 1.0
 */
public class OverrideMerger {
    private static final Logger logger = Logger.getLogger(OverrideMerger.class.getName());

    /**
     * Reject a request asking for both a profile list and no profiles.
     */
    public void validateProfiles(RelocationRequest request) throws ConflictingProfileOverrideException {
        if (!request.getProfiles().isEmpty() && request.isNoProfiles()) {
            throw new ConflictingProfileOverrideException(request.getProfiles());
        }
    }

    /**
     * @return the replacement profile list, an empty list for no profiles, or null for unchanged
     */
    public List<String> resolveProfiles(RelocationRequest request) throws ConflictingProfileOverrideException {
        validateProfiles(request);
        if (!request.getProfiles().isEmpty()) {
            return request.getProfiles();
        }
        return request.isNoProfiles() ? List.of() : null;
    }

    /**
     * Lay device overrides over expanded devices.
     *
     * @param expandedDevices the instance's expanded devices; not modified
     * @param overrides       the keys to change per device
     * @param instanceName    used in the error for an unknown device
     * @param allowNewDevices whether a device missing from the expanded set may be staged as given
     * @return complete definitions of the overridden devices only
     * @throws UnknownDeviceException if a device is unknown and new devices are not allowed
     */
    public Map<String, Map<String, String>> mergeDevices(Map<String, Map<String, String>> expandedDevices,
                                                         DeviceOverrideSet overrides,
                                                         String instanceName,
                                                         boolean allowNewDevices) throws UnknownDeviceException {
        Map<String, Map<String, String>> merged = new LinkedHashMap<>();
        for (String deviceName : overrides.getDeviceNames()) {
            Map<String, String> base = expandedDevices.get(deviceName);
            if (base == null && !allowNewDevices) {
                throw new UnknownDeviceException(instanceName, deviceName);
            }
            Map<String, String> device = base != null ? new LinkedHashMap<>(base) : new LinkedHashMap<>();
            device.putAll(overrides.get(deviceName));
            merged.put(deviceName, device);
            if (base == null) {
                logger.fine("Staging new device '" + deviceName + "' for " + instanceName);
            }
        }
        return merged;
    }

    /**
     * Resolve every override of a request against the instance it applies to.
     *
     * @param instance the source instance; only read when device overrides are present
     */
    public ResolvedOverrides resolve(RelocationRequest request, InstanceDefinition instance, boolean allowNewDevices)
            throws RelocationException {
        List<String> profiles = resolveProfiles(request);
        Map<String, String> config = request.hasConfigOverrides() ? request.getConfigOverrides() : null;

        Map<String, Map<String, String>> devices = null;
        if (request.hasDeviceOverrides()) {
            devices = mergeDevices(instance.getExpandedDevices(), request.getDeviceOverrides(),
                    instance.getName(), allowNewDevices);
        }
        return new ResolvedOverrides(config, devices, profiles);
    }
}
