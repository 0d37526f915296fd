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

package dev.mars.relocus.core.exceptions;

/**
 * Thrown when a device override names a device the instance does not have and the
 * chosen strategy cannot add devices.
 */
public class UnknownDeviceException extends RelocationException {

    private final String instanceName;
    private final String deviceName;

    public UnknownDeviceException(String instanceName, String deviceName) {
        super(RelocationErrorKind.UNKNOWN_DEVICE,
                String.format("Device '%s' doesn't exist in instance '%s'", deviceName, instanceName));
        this.instanceName = instanceName;
        this.deviceName = deviceName;
    }

    public String getInstanceName() {
        return instanceName;
    }

    public String getDeviceName() {
        return deviceName;
    }
}
