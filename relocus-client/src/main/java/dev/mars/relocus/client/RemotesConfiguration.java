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


package dev.mars.relocus.client;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * The set of remotes a user can address, loaded from a YAML file:
 *
 * <pre>
 * default-remote: local
 * remotes:
 *   local:
 *     addr: https://127.0.0.1:8443
 *   b:
 *     addr: https://host-b:8443
 *     project: staging
 * </pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-09
 * @version 1.0
 */
public class RemotesConfiguration {
    private static final Logger logger = Logger.getLogger(RemotesConfiguration.class.getName());

    public static final String LOCAL_REMOTE = "local";
    public static final String LOCAL_ADDRESS = "https://127.0.0.1:8443";

    private final String defaultRemote;
    private final Map<String, RemoteDefinition> remotes;

    public RemotesConfiguration(String defaultRemote, Map<String, RemoteDefinition> remotes) {
        this.defaultRemote = defaultRemote;
        this.remotes = Collections.unmodifiableMap(new LinkedHashMap<>(remotes));
    }

    /**
     * @return a configuration with only the {@code local} remote
     */
    public static RemotesConfiguration defaults() {
        Map<String, RemoteDefinition> remotes = new LinkedHashMap<>();
        remotes.put(LOCAL_REMOTE, new RemoteDefinition(LOCAL_REMOTE, LOCAL_ADDRESS, null));
        return new RemotesConfiguration(LOCAL_REMOTE, remotes);
    }

    /**
     * Load the remotes file, falling back to {@link #defaults()} when it does not exist.
     */
    public static RemotesConfiguration load(Path file) throws RemotesConfigurationException {
        if (!Files.exists(file)) {
            logger.fine("No remotes file at " + file + ", using defaults");
            return defaults();
        }
        try {
            RemotesConfiguration configuration = parse(Files.readString(file));
            logger.info("Loaded " + configuration.remotes.size() + " remotes from " + file);
            return configuration;
        } catch (IOException e) {
            throw new RemotesConfigurationException("Failed to read remotes file: " + file, e);
        }
    }

    public static RemotesConfiguration parse(String yamlContent) throws RemotesConfigurationException {
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object data;
        try {
            data = yaml.load(yamlContent);
        } catch (YAMLException e) {
            throw new RemotesConfigurationException("YAML parsing failed", e);
        }
        if (data == null) {
            return defaults();
        }
        if (!(data instanceof Map)) {
            throw new RemotesConfigurationException("Remotes file must contain a mapping");
        }
        return fromMap(asMap(data));
    }

    private static RemotesConfiguration fromMap(Map<String, Object> data) throws RemotesConfigurationException {
        Map<String, RemoteDefinition> remotes = new LinkedHashMap<>();
        Object remotesValue = data.get("remotes");
        if (remotesValue != null && !(remotesValue instanceof Map)) {
            throw new RemotesConfigurationException("remotes", "must be a mapping of alias to remote");
        }
        if (remotesValue != null) {
            for (Map.Entry<String, Object> entry : asMap(remotesValue).entrySet()) {
                remotes.put(entry.getKey(), parseRemote(entry.getKey(), entry.getValue()));
            }
        }
        if (remotes.isEmpty()) {
            remotes.putAll(defaults().remotes);
        }

        String defaultRemote = getStringValue(data, "default-remote", LOCAL_REMOTE);
        if (!remotes.containsKey(defaultRemote)) {
            throw new RemotesConfigurationException("default-remote",
                    "names unknown remote \"" + defaultRemote + "\"");
        }
        return new RemotesConfiguration(defaultRemote, remotes);
    }

    private static RemoteDefinition parseRemote(String name, Object value) throws RemotesConfigurationException {
        if (name.isEmpty() || name.contains(":") || name.contains("/")) {
            throw new RemotesConfigurationException("remotes." + name, "alias may not be empty or contain ':' or '/'");
        }
        if (!(value instanceof Map)) {
            throw new RemotesConfigurationException("remotes." + name, "must be a mapping");
        }
        Map<String, Object> remote = asMap(value);
        String address = getStringValue(remote, "addr", null);
        if (address == null || address.trim().isEmpty()) {
            throw new RemotesConfigurationException("remotes." + name + ".addr", "address is required");
        }
        return new RemoteDefinition(name, address.trim(), getStringValue(remote, "project", null));
    }

    public String getDefaultRemote() {
        return defaultRemote;
    }

    public Set<String> getRemoteNames() {
        return remotes.keySet();
    }

    /**
     * @return the named remote, or null if there is none
     */
    public RemoteDefinition getRemote(String name) {
        return remotes.get(name);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        return (Map<String, Object>) value;
    }

    private static String getStringValue(Map<String, Object> data, String key, String defaultValue) {
        Object value = data.get(key);
        return value != null ? value.toString() : defaultValue;
    }
}
