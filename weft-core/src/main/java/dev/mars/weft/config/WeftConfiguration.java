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
import java.time.Duration;
import java.util.Properties;

/**
 * Configuration management for the Weft workflow engine.
 * Values are layered: built-in defaults, then the first readable {@code weft.properties}
 * file (working directory, {@code config/}, {@code ~/.weft/}, {@code /etc/weft/}, classpath),
 * then system properties starting with {@code weft.}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class WeftConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(WeftConfiguration.class);

    public static final String MISSING_VARIABLE_POLICY = "weft.engine.missing.variable.policy";
    public static final String DEFAULT_STEP_TIMEOUT_MS = "weft.engine.default.step.timeout.ms";
    public static final String METRICS_ENABLED = "weft.engine.metrics.enabled";
    public static final String EXECUTOR_THREAD_PREFIX = "weft.engine.executor.thread.prefix";

    private static final MissingVariablePolicy DEFAULT_MISSING_VARIABLE_POLICY = MissingVariablePolicy.LENIENT;
    private static final long DEFAULT_STEP_TIMEOUT = 0L; // unbounded
    private static final String DEFAULT_THREAD_PREFIX = "weft-workflow";

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
     * Defaults only; no file or system property lookup.
     */
    public static WeftConfiguration defaults() {
        return new WeftConfiguration(null);
    }

    // Engine configuration
    public MissingVariablePolicy getMissingVariablePolicy() {
        return MissingVariablePolicy.fromString(properties.getProperty(MISSING_VARIABLE_POLICY),
                DEFAULT_MISSING_VARIABLE_POLICY);
    }

    /**
     * Deadline applied to collaborator calls when neither the step nor the workflow sets one.
     * A zero duration means no deadline.
     */
    public Duration getDefaultStepTimeout() {
        long millis = getLongProperty(DEFAULT_STEP_TIMEOUT_MS, DEFAULT_STEP_TIMEOUT);
        return Duration.ofMillis(Math.max(0L, millis));
    }

    public boolean isMetricsEnabled() {
        return getBooleanProperty(METRICS_ENABLED, true);
    }

    public String getExecutorThreadPrefix() {
        return getStringProperty(EXECUTOR_THREAD_PREFIX, DEFAULT_THREAD_PREFIX);
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

    private long getLongProperty(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid long value for property {}: {}. Using default: {}", key, value, defaultValue);
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
        properties.setProperty(MISSING_VARIABLE_POLICY, DEFAULT_MISSING_VARIABLE_POLICY.name().toLowerCase());
        properties.setProperty(DEFAULT_STEP_TIMEOUT_MS, String.valueOf(DEFAULT_STEP_TIMEOUT));
        properties.setProperty(METRICS_ENABLED, "true");
        properties.setProperty(EXECUTOR_THREAD_PREFIX, DEFAULT_THREAD_PREFIX);
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                "weft.properties",
                "config/weft.properties",
                System.getProperty("user.home") + "/.weft/weft.properties",
                "/etc/weft/weft.properties"
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

        try (InputStream input = getClass().getClassLoader().getResourceAsStream("weft.properties")) {
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
                "missingVariablePolicy=" + getMissingVariablePolicy() +
                ", defaultStepTimeout=" + getDefaultStepTimeout() +
                ", metricsEnabled=" + isMetricsEnabled() +
                '}';
    }
}
