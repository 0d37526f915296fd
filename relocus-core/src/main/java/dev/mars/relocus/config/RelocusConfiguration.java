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

package dev.mars.relocus.config;

import dev.mars.relocus.core.TransferMode;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Configuration for the relocation engine and its command-line front end.
 *
 * <p>Values are layered: built-in defaults, then the first readable
 * {@code relocus.properties} found on disk (or on the classpath), then any
 * {@code relocus.*} system properties.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-05
 * @version 1.0
 */
public class RelocusConfiguration {
    private static final Logger logger = Logger.getLogger(RelocusConfiguration.class.getName());

    public static final String OPERATION_WAIT_TIMEOUT_MS = "relocus.operation.wait.timeout.ms";
    public static final String OPERATION_POLL_INTERVAL_MS = "relocus.operation.poll.interval.ms";
    public static final String TRANSFER_DEFAULT_MODE = "relocus.transfer.default.mode";
    public static final String RELAY_BUFFER_SIZE = "relocus.relay.buffer.size";
    public static final String CONNECTION_TIMEOUT_MS = "relocus.network.connection.timeout.ms";
    public static final String REQUEST_TIMEOUT_MS = "relocus.network.request.timeout.ms";
    public static final String BATCH_MAX_CONCURRENT = "relocus.batch.max.concurrent";
    public static final String PROGRESS_QUIET = "relocus.progress.quiet";
    public static final String METRICS_ENABLED = "relocus.metrics.enabled";
    public static final String REMOTES_FILE = "relocus.remotes.file";

    // 0 means wait until the operation ends or is cancelled
    private static final long DEFAULT_OPERATION_WAIT_TIMEOUT_MS = 0;
    private static final long DEFAULT_OPERATION_POLL_INTERVAL_MS = 500;
    private static final int DEFAULT_RELAY_BUFFER_SIZE = 64 * 1024;
    private static final int DEFAULT_CONNECTION_TIMEOUT_MS = 10000;
    private static final int DEFAULT_REQUEST_TIMEOUT_MS = 60000;
    private static final int DEFAULT_BATCH_MAX_CONCURRENT = 4;

    private final Properties properties;

    public RelocusConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }

    public RelocusConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    // Operation supervision
    public long getOperationWaitTimeoutMs() {
        return getLongProperty(OPERATION_WAIT_TIMEOUT_MS, DEFAULT_OPERATION_WAIT_TIMEOUT_MS);
    }

    /**
     * @return the wait bound for a single operation, or null when waits are unbounded
     */
    public Duration getOperationWaitTimeout() {
        long timeoutMs = getOperationWaitTimeoutMs();
        return timeoutMs > 0 ? Duration.ofMillis(timeoutMs) : null;
    }

    public long getOperationPollIntervalMs() {
        long interval = getLongProperty(OPERATION_POLL_INTERVAL_MS, DEFAULT_OPERATION_POLL_INTERVAL_MS);
        if (interval <= 0) {
            logger.warning("Poll interval must be positive: " + interval + ". Using default: " + DEFAULT_OPERATION_POLL_INTERVAL_MS);
            return DEFAULT_OPERATION_POLL_INTERVAL_MS;
        }
        return interval;
    }

    // Transfer
    public TransferMode getDefaultTransferMode() {
        String value = getStringProperty(TRANSFER_DEFAULT_MODE, TransferMode.DEFAULT.getWireName());
        try {
            return TransferMode.fromString(value);
        } catch (IllegalArgumentException e) {
            logger.warning("Invalid transfer mode for property " + TRANSFER_DEFAULT_MODE + ": " + value +
                    ". Using default: " + TransferMode.DEFAULT.getWireName());
            return TransferMode.DEFAULT;
        }
    }

    public int getRelayBufferSize() {
        return getIntProperty(RELAY_BUFFER_SIZE, DEFAULT_RELAY_BUFFER_SIZE);
    }

    // Network
    public int getConnectionTimeoutMs() {
        return getIntProperty(CONNECTION_TIMEOUT_MS, DEFAULT_CONNECTION_TIMEOUT_MS);
    }

    public int getRequestTimeoutMs() {
        return getIntProperty(REQUEST_TIMEOUT_MS, DEFAULT_REQUEST_TIMEOUT_MS);
    }

    public Path getRemotesFile() {
        return Paths.get(getStringProperty(REMOTES_FILE, defaultRemotesFile()));
    }

    private static String defaultRemotesFile() {
        return System.getProperty("user.home") + "/.relocus/remotes.yml";
    }

    // Batch
    public int getBatchMaxConcurrent() {
        return getIntProperty(BATCH_MAX_CONCURRENT, DEFAULT_BATCH_MAX_CONCURRENT);
    }

    // Output and monitoring
    public boolean isProgressQuiet() {
        return getBooleanProperty(PROGRESS_QUIET, false);
    }

    public boolean isMetricsEnabled() {
        return getBooleanProperty(METRICS_ENABLED, true);
    }

    // Generic property access
    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    public String getProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public void setProperty(String key, String value) {
        properties.setProperty(key, value);
    }

    private String getStringProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    private int getIntProperty(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                logger.warning("Invalid integer value for property " + key + ": " + value +
                        ". Using default: " + defaultValue);
            }
        }
        return defaultValue;
    }

    private long getLongProperty(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                logger.warning("Invalid long value for property " + key + ": " + value +
                        ". Using default: " + defaultValue);
            }
        }
        return defaultValue;
    }

    private boolean getBooleanProperty(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            return Boolean.parseBoolean(value.trim());
        }
        return defaultValue;
    }

    private void loadDefaultConfiguration() {
        properties.setProperty(OPERATION_WAIT_TIMEOUT_MS, String.valueOf(DEFAULT_OPERATION_WAIT_TIMEOUT_MS));
        properties.setProperty(OPERATION_POLL_INTERVAL_MS, String.valueOf(DEFAULT_OPERATION_POLL_INTERVAL_MS));
        properties.setProperty(TRANSFER_DEFAULT_MODE, TransferMode.DEFAULT.getWireName());
        properties.setProperty(RELAY_BUFFER_SIZE, String.valueOf(DEFAULT_RELAY_BUFFER_SIZE));
        properties.setProperty(CONNECTION_TIMEOUT_MS, String.valueOf(DEFAULT_CONNECTION_TIMEOUT_MS));
        properties.setProperty(REQUEST_TIMEOUT_MS, String.valueOf(DEFAULT_REQUEST_TIMEOUT_MS));
        properties.setProperty(BATCH_MAX_CONCURRENT, String.valueOf(DEFAULT_BATCH_MAX_CONCURRENT));
        properties.setProperty(PROGRESS_QUIET, "false");
        properties.setProperty(METRICS_ENABLED, "true");
        properties.setProperty(REMOTES_FILE, defaultRemotesFile());
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                "relocus.properties",
                "config/relocus.properties",
                System.getProperty("user.home") + "/.relocus/relocus.properties",
                "/etc/relocus/relocus.properties"
        };

        for (String configFile : configFiles) {
            Path configPath = Paths.get(configFile);
            if (Files.exists(configPath) && Files.isReadable(configPath)) {
                try (InputStream input = Files.newInputStream(configPath)) {
                    properties.load(input);
                    logger.info("Loaded configuration from: " + configPath);
                    return;
                } catch (IOException e) {
                    logger.warning("Failed to load configuration from " + configPath + ": " + e.getMessage());
                }
            }
        }

        try (InputStream input = getClass().getClassLoader().getResourceAsStream("relocus.properties")) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from classpath");
            }
        } catch (IOException e) {
            logger.warning("Failed to load configuration from classpath: " + e.getMessage());
        }
    }

    private void loadConfigurationFromSystemProperties() {
        System.getProperties().entrySet().stream()
                .filter(entry -> entry.getKey().toString().startsWith("relocus."))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.fine("Override from system property: " + entry.getKey() + "=" + entry.getValue());
                });
    }

    @Override
    public String toString() {
        return "RelocusConfiguration{" +
                "operationWaitTimeoutMs=" + getOperationWaitTimeoutMs() +
                ", pollIntervalMs=" + getOperationPollIntervalMs() +
                ", defaultMode=" + getDefaultTransferMode().getWireName() +
                ", metricsEnabled=" + isMetricsEnabled() +
                '}';
    }
}
