package io.plinth.core;

import io.plinth.core.exception.ConfigurationException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;

/// Configuration options for a Plinth deployment environment.
///
/// Controls the deployment name, storage backend selection and the task execution defaults
/// handed to workflow implementations. Use the {@link Builder} for fluent configuration,
/// {@link #fromProperties(Properties)} to read `plinth.*` keys, or the setters.
///
/// ### Default Values
/// - `deploymentName`: `"local"`
/// - `storageType`: `"memory"`
/// - `storageDirectory`: `${java.io.tmpdir}/plinth-workflows` (file backend only)
/// - `clearStorage`: `false` (file backend only)
/// - `taskThreadPoolSize`: `1`
/// - `taskRetries`: `-1` (unlimited)
/// - `taskRetryInterval`: `30s`
///
/// @implNote **Not thread-safe**. This is a mutable configuration object intended to be
/// configured before passing to {@link PlinthFactory}. Do not modify after environment
/// creation.
///
/// @see PlinthFactory.Builder#config(PlinthConfig)
public class PlinthConfig {

    public static final String DEPLOYMENT_NAME = "plinth.deployment.name";
    public static final String STORAGE_TYPE = "plinth.storage.type";
    public static final String STORAGE_DIRECTORY = "plinth.storage.directory";
    public static final String STORAGE_CLEAR = "plinth.storage.clear";
    public static final String TASK_THREAD_POOL_SIZE = "plinth.task.thread-pool-size";
    public static final String TASK_RETRIES = "plinth.task.retries";
    public static final String TASK_RETRY_INTERVAL_SECONDS = "plinth.task.retry-interval-seconds";

    private String deploymentName = "local";
    private String storageType = "memory";
    private Path storageDirectory =
            Path.of(System.getProperty("java.io.tmpdir"), "plinth-workflows");
    private boolean clearStorage = false;
    private int taskThreadPoolSize = 1;
    private int taskRetries = -1;
    private Duration taskRetryInterval = Duration.ofSeconds(30);

    /// Creates a configuration with default values.
    public PlinthConfig() {}

    /// Reads a configuration from properties.
    ///
    /// Unset keys keep their defaults. Recognized keys are the `plinth.*` constants of this
    /// class.
    ///
    /// @param properties source properties, not null
    /// @return new configuration, never null
    /// @throws ConfigurationException if a numeric value cannot be parsed
    public static PlinthConfig fromProperties(Properties properties) {
        PlinthConfig config = new PlinthConfig();
        String value = properties.getProperty(DEPLOYMENT_NAME);
        if (value != null) {
            config.setDeploymentName(value.trim());
        }
        value = properties.getProperty(STORAGE_TYPE);
        if (value != null) {
            config.setStorageType(value.trim());
        }
        value = properties.getProperty(STORAGE_DIRECTORY);
        if (value != null) {
            config.setStorageDirectory(Path.of(value.trim()));
        }
        value = properties.getProperty(STORAGE_CLEAR);
        if (value != null) {
            config.setClearStorage(Boolean.parseBoolean(value.trim()));
        }
        value = properties.getProperty(TASK_THREAD_POOL_SIZE);
        if (value != null) {
            config.setTaskThreadPoolSize(parseInt(TASK_THREAD_POOL_SIZE, value));
        }
        value = properties.getProperty(TASK_RETRIES);
        if (value != null) {
            config.setTaskRetries(parseInt(TASK_RETRIES, value));
        }
        value = properties.getProperty(TASK_RETRY_INTERVAL_SECONDS);
        if (value != null) {
            config.setTaskRetryInterval(
                    Duration.ofSeconds(parseInt(TASK_RETRY_INTERVAL_SECONDS, value)));
        }
        return config;
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(
                    "Property " + key + " must be an integer but was '" + value + "'", e);
        }
    }

    /// Returns the deployment name, also used as blueprint id and file storage sub-directory.
    ///
    /// @return deployment name, never null
    public String getDeploymentName() {
        return deploymentName;
    }

    public void setDeploymentName(String deploymentName) {
        this.deploymentName = deploymentName;
    }

    /// Returns the storage backend name.
    ///
    /// @return one of the registered provider names, `"memory"` by default
    public String getStorageType() {
        return storageType;
    }

    public void setStorageType(String storageType) {
        this.storageType = storageType;
    }

    /// Returns the parent directory of per-deployment file storage.
    ///
    /// @return storage directory, never null
    public Path getStorageDirectory() {
        return storageDirectory;
    }

    public void setStorageDirectory(Path storageDirectory) {
        this.storageDirectory = storageDirectory;
    }

    /// Returns whether an existing deployment directory is removed before the file backend
    /// starts.
    public boolean isClearStorage() {
        return clearStorage;
    }

    public void setClearStorage(boolean clearStorage) {
        this.clearStorage = clearStorage;
    }

    /// Returns the default size of the thread pool workflow implementations run tasks on.
    public int getTaskThreadPoolSize() {
        return taskThreadPoolSize;
    }

    /// Sets the default task thread pool size.
    ///
    /// ### Contracts
    /// - **Precondition**: `taskThreadPoolSize` should be positive
    ///
    /// @param taskThreadPoolSize number of task threads, must be positive
    public void setTaskThreadPoolSize(int taskThreadPoolSize) {
        this.taskThreadPoolSize = taskThreadPoolSize;
    }

    public int getTaskRetries() {
        return taskRetries;
    }

    public void setTaskRetries(int taskRetries) {
        this.taskRetries = taskRetries;
    }

    public Duration getTaskRetryInterval() {
        return taskRetryInterval;
    }

    public void setTaskRetryInterval(Duration taskRetryInterval) {
        this.taskRetryInterval = taskRetryInterval;
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for constructing {@link PlinthConfig} instances.
    ///
    /// @implNote The builder mutates a single config instance and returns it on
    /// {@link #build()}.
    public static class Builder {
        private final PlinthConfig config = new PlinthConfig();

        public Builder deploymentName(String deploymentName) {
            config.deploymentName = deploymentName;
            return this;
        }

        /// Selects the storage backend.
        ///
        /// @param storageType backend name: `"memory"`, `"file"` or a custom provider's name
        /// @return this builder for chaining, never null
        public Builder storageType(String storageType) {
            config.storageType = storageType;
            return this;
        }

        public Builder storageDirectory(Path storageDirectory) {
            config.storageDirectory = storageDirectory;
            return this;
        }

        public Builder clearStorage(boolean clearStorage) {
            config.clearStorage = clearStorage;
            return this;
        }

        public Builder taskThreadPoolSize(int taskThreadPoolSize) {
            config.taskThreadPoolSize = taskThreadPoolSize;
            return this;
        }

        public Builder taskRetries(int taskRetries) {
            config.taskRetries = taskRetries;
            return this;
        }

        public Builder taskRetryInterval(Duration taskRetryInterval) {
            config.taskRetryInterval = taskRetryInterval;
            return this;
        }

        /// Builds and returns the configured {@link PlinthConfig} instance.
        ///
        /// @return the configured instance, never null
        public PlinthConfig build() {
            return config;
        }
    }
}
