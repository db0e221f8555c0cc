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

package dev.mars.blockship.config;

import dev.mars.blockship.block.SourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;

/**
 * Configuration for the Blockship shipper and agent.
 *
 * <p>Resolution order (highest to lowest priority):
 * <ol>
 *   <li>Environment variable (e.g., BLOCKSHIP_DATA_DIR)</li>
 *   <li>System property (e.g., -Dblockship.data.dir=...)</li>
 *   <li>Properties file (blockship.properties in the working directory, ./config,
 *       /etc/blockship or the classpath)</li>
 *   <li>Default value</li>
 * </ol>
 * Instances built from explicit {@link Properties} skip the environment and system property
 * layers.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-05
 * @version 1.0
 */
public class ShipperConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(ShipperConfiguration.class);

    static final String CONFIG_FILE = "blockship.properties";

    public static final String DATA_DIR = "blockship.data.dir";
    public static final String BUCKET_DIR = "blockship.bucket.dir";
    public static final String SOURCE = "blockship.source";
    public static final String LABELS = "blockship.labels";
    public static final String SYNC_INTERVAL_MS = "blockship.sync.interval.ms";
    public static final String SYNC_INITIAL_DELAY_MS = "blockship.sync.initial.delay.ms";
    public static final String FSYNC_ENABLED = "blockship.fsync.enabled";
    public static final String METRICS_ENABLED = "blockship.metrics.enabled";

    // Default configuration values
    private static final String DEFAULT_DATA_DIR = "./data";
    private static final String DEFAULT_BUCKET_DIR = "./bucket";
    private static final String DEFAULT_SOURCE = SourceType.SIDECAR.getValue();
    private static final long DEFAULT_SYNC_INTERVAL_MS = 30000;
    private static final long DEFAULT_SYNC_INITIAL_DELAY_MS = 0;

    private final Properties properties;
    private final boolean layered;

    /**
     * Loads configuration from file, system properties and environment.
     */
    public ShipperConfiguration() {
        this.properties = new Properties();
        this.layered = true;
        loadConfigurationFromFile();
    }

    /**
     * Uses only the given properties on top of the defaults.
     */
    public ShipperConfiguration(Properties properties) {
        this.properties = new Properties();
        this.layered = false;
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    // ==================== Shipper ====================

    public Path getDataDir() {
        return Paths.get(getString(DATA_DIR, DEFAULT_DATA_DIR));
    }

    public Path getBucketDir() {
        return Paths.get(getString(BUCKET_DIR, DEFAULT_BUCKET_DIR));
    }

    /**
     * @throws IllegalArgumentException if the configured value is not a known source type
     */
    public SourceType getSource() {
        return SourceType.fromValue(getString(SOURCE, DEFAULT_SOURCE));
    }

    /**
     * External labels in {@code key1=value1,key2=value2} form.
     *
     * @return the labels in declaration order, empty when none are configured
     * @throws IllegalArgumentException if an entry has no '=' or an empty key
     */
    public Map<String, String> getLabels() {
        String raw = getString(LABELS, "");
        if (raw.isBlank()) {
            return Collections.emptyMap();
        }
        Map<String, String> labels = new LinkedHashMap<>();
        for (String entry : raw.split(",")) {
            if (entry.isBlank()) {
                continue;
            }
            int eq = entry.indexOf('=');
            if (eq <= 0) {
                throw new IllegalArgumentException("Malformed label '" + entry.trim() + "' in " + LABELS);
            }
            String key = entry.substring(0, eq).trim();
            if (key.isEmpty()) {
                throw new IllegalArgumentException("Empty label name in " + LABELS);
            }
            labels.put(key, entry.substring(eq + 1).trim());
        }
        return Collections.unmodifiableMap(labels);
    }

    public boolean isFsyncEnabled() {
        return getBoolean(FSYNC_ENABLED, true);
    }

    // ==================== Agent ====================

    public long getSyncIntervalMs() {
        return getLong(SYNC_INTERVAL_MS, DEFAULT_SYNC_INTERVAL_MS);
    }

    public long getSyncInitialDelayMs() {
        return getLong(SYNC_INITIAL_DELAY_MS, DEFAULT_SYNC_INITIAL_DELAY_MS);
    }

    public boolean isMetricsEnabled() {
        return getBoolean(METRICS_ENABLED, true);
    }

    /**
     * Validates that values are sensible. Called during startup to fail fast on misconfiguration.
     *
     * @throws IllegalStateException if the configuration is invalid
     */
    public void validate() {
        if (getSyncIntervalMs() <= 0) {
            throw new IllegalStateException("Sync interval must be positive, got: " + getSyncIntervalMs());
        }
        if (getSyncInitialDelayMs() < 0) {
            throw new IllegalStateException(
                    "Sync initial delay must not be negative, got: " + getSyncInitialDelayMs());
        }
        try {
            getSource();
            getLabels();
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException(e.getMessage(), e);
        }
        logger.info("Shipper configuration validated successfully");
    }

    public void logConfiguration() {
        logger.info("=== Blockship Configuration ===");
        logger.info("  Data Dir:        {}", getDataDir());
        logger.info("  Bucket Dir:      {}", getBucketDir());
        logger.info("  Source:          {}", getString(SOURCE, DEFAULT_SOURCE));
        logger.info("  Labels:          {}", getString(LABELS, ""));
        logger.info("  Sync Interval:   {}ms", getSyncIntervalMs());
        logger.info("  Initial Delay:   {}ms", getSyncInitialDelayMs());
        logger.info("  Fsync:           {}", isFsyncEnabled());
        logger.info("  Metrics:         {}", isMetricsEnabled());
        logger.info("===============================");
    }

    // ==================== Core Property Accessors ====================

    public String getString(String key, String defaultValue) {
        if (layered) {
            // 1. Environment variable (BLOCKSHIP_XXX format)
            String envKey = key.toUpperCase().replace('.', '_').replace('-', '_');
            String envValue = System.getenv(envKey);
            if (envValue != null && !envValue.isEmpty()) {
                return envValue;
            }

            // 2. System property
            String sysProp = System.getProperty(key);
            if (sysProp != null && !sysProp.isEmpty()) {
                return sysProp;
            }
        }

        // 3. Properties file
        return properties.getProperty(key, defaultValue);
    }

    public void setProperty(String key, String value) {
        properties.setProperty(key, value);
    }

    public long getLong(String key, long defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid long value for {}: '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                CONFIG_FILE,
                "config/" + CONFIG_FILE,
                "/etc/blockship/" + CONFIG_FILE
        };

        for (String configFile : configFiles) {
            Path configPath = Paths.get(configFile);
            if (Files.isRegularFile(configPath) && Files.isReadable(configPath)) {
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
            } else {
                logger.info("No {} found, using defaults and environment variables", CONFIG_FILE);
            }
        } catch (IOException e) {
            logger.warn("Failed to load configuration from classpath: {}", e.getMessage());
        }
    }

    @Override
    public String toString() {
        return "ShipperConfiguration{" +
                "dataDir=" + getDataDir() +
                ", bucketDir=" + getBucketDir() +
                ", source=" + getString(SOURCE, DEFAULT_SOURCE) +
                ", syncIntervalMs=" + getSyncIntervalMs() +
                '}';
    }
}
