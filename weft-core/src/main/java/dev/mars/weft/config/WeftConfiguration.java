/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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

package dev.mars.weft.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import java.util.Properties;

/**
 * Configuration management for the Weft engine.
 *
 * <p>Values are layered: built-in defaults, then the first {@code weft.properties} found in the
 * working directory, {@code config/}, {@code ~/.weft/} or on the classpath, then any
 * {@code weft.*} system property.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class WeftConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(WeftConfiguration.class);

    public static final String WORKERS_MAX = "weft.workers.max";
    public static final String HISTORY_MAX = "weft.history.max";
    public static final String TASK_DEFAULT_TIMEOUT_SECONDS = "weft.task.default.timeout.seconds";
    public static final String SHUTDOWN_TIMEOUT_SECONDS = "weft.shutdown.timeout.seconds";
    public static final String SNAPSHOT_PATH = "weft.snapshot.path";

    private static final int DEFAULT_MAX_WORKERS = 8;
    private static final int DEFAULT_MAX_HISTORY = 500;
    private static final long DEFAULT_TASK_TIMEOUT_SECONDS = 0;
    private static final long DEFAULT_SHUTDOWN_TIMEOUT_SECONDS = 30;

    private static final String CONFIG_FILE = "weft.properties";

    private final Properties properties;

    public WeftConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }

    public WeftConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    /**
     * Capacity of the worker pool shared by all executions of one engine.
     */
    public int getMaxWorkers() {
        int value = getIntProperty(WORKERS_MAX, DEFAULT_MAX_WORKERS);
        if (value < 1) {
            logger.warn("Property {} must be at least 1, got {}. Using default: {}",
                    WORKERS_MAX, value, DEFAULT_MAX_WORKERS);
            return DEFAULT_MAX_WORKERS;
        }
        return value;
    }

    /**
     * Number of terminal executions kept by the in-memory state store before the oldest are evicted.
     */
    public int getMaxHistory() {
        return getIntProperty(HISTORY_MAX, DEFAULT_MAX_HISTORY);
    }

    /**
     * Deadline applied to tasks that declare a zero timeout. Zero keeps them unbounded.
     */
    public long getDefaultTaskTimeoutSeconds() {
        return getLongProperty(TASK_DEFAULT_TIMEOUT_SECONDS, DEFAULT_TASK_TIMEOUT_SECONDS);
    }

    public long getShutdownTimeoutSeconds() {
        return getLongProperty(SHUTDOWN_TIMEOUT_SECONDS, DEFAULT_SHUTDOWN_TIMEOUT_SECONDS);
    }

    public Optional<Path> getSnapshotPath() {
        String value = properties.getProperty(SNAPSHOT_PATH);
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(Paths.get(value.trim()));
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

    private int getIntProperty(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid integer value for property {}: {}. Using default: {}",
                        key, value, defaultValue);
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
                logger.warn("Invalid long value for property {}: {}. Using default: {}",
                        key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    private void loadDefaultConfiguration() {
        properties.setProperty(WORKERS_MAX, String.valueOf(DEFAULT_MAX_WORKERS));
        properties.setProperty(HISTORY_MAX, String.valueOf(DEFAULT_MAX_HISTORY));
        properties.setProperty(TASK_DEFAULT_TIMEOUT_SECONDS, String.valueOf(DEFAULT_TASK_TIMEOUT_SECONDS));
        properties.setProperty(SHUTDOWN_TIMEOUT_SECONDS, String.valueOf(DEFAULT_SHUTDOWN_TIMEOUT_SECONDS));
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                CONFIG_FILE,
                "config/" + CONFIG_FILE,
                System.getProperty("user.home") + "/.weft/" + CONFIG_FILE
        };

        for (String configFile : configFiles) {
            Path configPath = Paths.get(configFile);
            if (Files.exists(configPath) && Files.isReadable(configPath)) {
                try (InputStream input = Files.newInputStream(configPath)) {
                    properties.load(input);
                    logger.info("Loaded configuration from: {}", configPath);
                    return;
                } catch (IOException e) {
                    logger.warn("Failed to load configuration from {}: {}", configPath, e.getMessage());
                }
            }
        }

        try (InputStream input = getClass().getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from classpath");
            }
        } catch (IOException e) {
            logger.warn("Failed to load configuration from classpath: {}", e.getMessage());
        }
    }

    private void loadConfigurationFromSystemProperties() {
        System.getProperties().entrySet().stream()
                .filter(entry -> entry.getKey().toString().startsWith("weft."))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.debug("Override from system property: {}={}", entry.getKey(), entry.getValue());
                });
    }

    @Override
    public String toString() {
        return "WeftConfiguration{" +
                "maxWorkers=" + getMaxWorkers() +
                ", maxHistory=" + getMaxHistory() +
                ", defaultTaskTimeoutSeconds=" + getDefaultTaskTimeoutSeconds() +
                ", shutdownTimeoutSeconds=" + getShutdownTimeoutSeconds() +
                '}';
    }
}
