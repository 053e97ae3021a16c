package io.plinth.core;

import io.plinth.core.execution.OperationResolver;
import io.plinth.core.output.DefaultFunctionParser;
import io.plinth.core.output.FunctionParser;
import io.plinth.core.plan.DeploymentPlan;
import io.plinth.core.storage.InstanceStoreProviders;
import io.plinth.core.storage.spi.InstanceStoreProvider;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/// Factory for creating and wiring Plinth deployment environments.
///
/// Provides a static factory method and a fluent {@link Builder} for constructing
/// {@link PlinthEnvironment} instances. Selects the storage backend named by
/// {@link PlinthConfig#getStorageType()} among the built-in, discovered and explicitly
/// registered {@link InstanceStoreProvider}s.
///
/// ### Usage Patterns
///
/// **Builder**:
/// {@snippet :
/// var env = PlinthFactory.builder()
///     .config(PlinthConfig.builder().deploymentName("shop").storageType("file").build())
///     .plan(plan)
///     .resourcesRoot(blueprintDir)
///     .operationResolver(registry)
///     .build();
/// env.execute("install");
/// }
///
/// **Quick start with defaults** (memory storage, deployment name `local`):
/// {@snippet :
/// var env = PlinthFactory.createEnvironment(plan, blueprintDir, registry);
/// }
///
/// @see PlinthEnvironment
/// @see PlinthConfig
public final class PlinthFactory {

    private PlinthFactory() {
        // Utility class - prevent instantiation
    }

    /// Creates an environment with default configuration.
    ///
    /// @param plan the compiled plan, not null
    /// @param resourcesRoot directory blueprint resources are read from, not null
    /// @param resolver registry of operation and workflow implementations, not null
    /// @return a validated environment, never null
    /// @throws io.plinth.core.exception.ConfigurationException if an operation mapping cannot be
    /// resolved
    public static PlinthEnvironment createEnvironment(
            DeploymentPlan plan, Path resourcesRoot, OperationResolver resolver) {
        return builder().plan(plan).resourcesRoot(resourcesRoot).operationResolver(resolver).build();
    }

    /// Creates a new builder.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link PlinthEnvironment}.
    ///
    /// Required: `plan`, `resourcesRoot`, `operationResolver`.
    public static final class Builder {
        private PlinthConfig config = new PlinthConfig();
        private DeploymentPlan plan;
        private Path resourcesRoot;
        private OperationResolver operationResolver;
        private List<InstanceStoreProvider> storeProviders = List.of();
        private boolean discoverStoreProviders = true;
        private FunctionParser functionParser = new DefaultFunctionParser();

        private Builder() {}

        public Builder config(PlinthConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
            return this;
        }

        public Builder plan(DeploymentPlan plan) {
            this.plan = plan;
            return this;
        }

        /// Sets the directory blueprint resources are resolved against, usually the directory
        /// the compiled plan was read from.
        ///
        /// @param resourcesRoot resources directory, not null
        /// @return this builder for chaining
        public Builder resourcesRoot(Path resourcesRoot) {
            this.resourcesRoot = resourcesRoot;
            return this;
        }

        public Builder operationResolver(OperationResolver operationResolver) {
            this.operationResolver = operationResolver;
            return this;
        }

        /// Registers storage providers in addition to the built-in and discovered ones.
        ///
        /// @param storeProviders providers, not null; they take precedence on name clashes
        /// @return this builder for chaining
        public Builder storeProviders(List<InstanceStoreProvider> storeProviders) {
            this.storeProviders = List.copyOf(storeProviders);
            return this;
        }

        /// Enables or disables `ServiceLoader` discovery of storage providers (enabled by
        /// default).
        ///
        /// @param discoverStoreProviders `false` to use only built-in and explicit providers
        /// @return this builder for chaining
        public Builder discoverStoreProviders(boolean discoverStoreProviders) {
            this.discoverStoreProviders = discoverStoreProviders;
            return this;
        }

        public Builder functionParser(FunctionParser functionParser) {
            this.functionParser = Objects.requireNonNull(functionParser);
            return this;
        }

        /// Builds and validates the environment.
        ///
        /// @return a validated environment, never null
        /// @throws NullPointerException if a required component is missing
        /// @throws io.plinth.core.exception.ConfigurationException if the storage backend is
        /// unknown or an operation mapping cannot be resolved
        public PlinthEnvironment build() {
            Objects.requireNonNull(plan, "plan must not be null");
            Objects.requireNonNull(resourcesRoot, "resourcesRoot must not be null");
            Objects.requireNonNull(operationResolver, "operationResolver must not be null");

            InstanceStoreProvider storeProvider =
                    new InstanceStoreProviders(storeProviders, discoverStoreProviders)
                            .get(config.getStorageType());

            return new PlinthEnvironment(
                    config, plan, resourcesRoot, operationResolver, storeProvider, functionParser);
        }
    }
}
