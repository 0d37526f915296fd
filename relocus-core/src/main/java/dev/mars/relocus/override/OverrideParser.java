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
import dev.mars.relocus.core.exceptions.RelocationErrorKind;
import dev.mars.relocus.core.exceptions.RelocationException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses override arguments: {@code key=value} for configuration and
 * {@code <device>,<key>=<value>} for devices.
 */
public final class OverrideParser {

    private OverrideParser() {
    }

    public static Map<String, String> parseConfig(List<String> entries) throws RelocationException {
        Map<String, String> config = new LinkedHashMap<>();
        for (String entry : entries) {
            String[] pair = splitKeyValue(entry);
            config.put(pair[0], pair[1]);
        }
        return config;
    }

    /**
     * Repeated entries for the same device accumulate; a repeated key keeps the last value.
     */
    public static DeviceOverrideSet parseDevices(List<String> entries) throws RelocationException {
        DeviceOverrideSet.Builder builder = DeviceOverrideSet.builder();
        for (String entry : entries) {
            int comma = entry.indexOf(',');
            if (comma <= 0 || comma == entry.length() - 1) {
                throw new RelocationException(RelocationErrorKind.INVALID_OVERRIDE,
                        "Bad device override syntax, expecting <device>,<key>=<value>: \"" + entry + "\"");
            }
            String device = entry.substring(0, comma);
            String[] pair = splitKeyValue(entry.substring(comma + 1));
            builder.set(device, pair[0], pair[1]);
        }
        return builder.build();
    }

    private static String[] splitKeyValue(String entry) throws RelocationException {
        int equals = entry.indexOf('=');
        if (equals <= 0) {
            throw new RelocationException(RelocationErrorKind.INVALID_OVERRIDE, "Bad key=value pair: \"" + entry + "\"");
        }
        return new String[]{entry.substring(0, equals), entry.substring(equals + 1)};
    }
}
