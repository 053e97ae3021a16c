package io.plinth.core;

import io.plinth.core.exception.ConfigurationException;
import io.plinth.core.exception.NotFoundException;
import io.plinth.core.exception.WorkflowExecutionException;
import io.plinth.core.execution.ExecutionContext;
import io.plinth.core.execution.MappingValidator;
import io.plinth.core.execution.OperationHandler;
import io.plinth.core.execution.OperationResolver;
import io.plinth.core.execution.RetryPolicy;
import io.plinth.core.execution.WorkflowParameters;
import io.plinth.core.output.FunctionParser;
import io.plinth.core.output.OutputsResolver;
import io.plinth.core.plan.DeploymentPlan;
import io.plinth.core.plan.WorkflowDefinition;
import io.plinth.core.storage.InstanceStore;
import io.plinth.core.storage.spi.InstanceStoreProvider;
import io.plinth.core.storage.spi.StoreContext;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.logging.Logger;

/// Local execution environment of one deployment.
///
/// Binds a compiled {@link DeploymentPlan} to an {@link InstanceStore} and dispatches named
/// workflows to their registered implementations.
///
/// ### Construction
/// 1. Every node and relationship operation of the plan is resolved through the
/// {@link OperationResolver}; the first unresolved mapping aborts construction with a
/// {@link ConfigurationException}
/// 2. Only then is the store created, so an invalid plan never leaves storage behind
///
/// ### Execution
/// {@link #execute} looks the workflow up, resolves its implementation, merges parameters
/// and invokes the implementation synchronously with an {@link ExecutionContext}. Any
/// concurrency inside the workflow is the implementation's own concern.
///
/// @implNote Safe for concurrent use after construction. All fields are final; the store is
/// thread-safe.
///
/// @see PlinthFactory for wiring
public final class PlinthEnvironment {

    private static final Logger logger = Logger.getLogger(PlinthEnvironment.class.getName());

    private final String name;
    private final PlinthConfig config;
    private final DeploymentPlan plan;
    private final MappingValidator mappingValidator;
    private final InstanceStore storage;
    private final OutputsResolver outputsResolver;

    /// Creates and validates an environment.
    ///
    /// @param config environment configuration, not null
    /// @param plan the compiled plan, not null
    /// @param resourcesRoot directory blueprint resources are read from, not null
    /// @param resolver registry of operation and workflow implementations, not null
    /// @param storeProvider backend creating the instance store, not null
    /// @param functionParser recognizes function expressions in outputs, not null
    /// @throws ConfigurationException if an operation mapping cannot be resolved
    public PlinthEnvironment(
            PlinthConfig config,
            DeploymentPlan plan,
            Path resourcesRoot,
            OperationResolver resolver,
            InstanceStoreProvider storeProvider,
            FunctionParser functionParser) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.plan = Objects.requireNonNull(plan, "plan must not be null");
        this.name = Objects.requireNonNull(config.getDeploymentName(), "deploymentName required");
        Objects.requireNonNull(resourcesRoot, "resourcesRoot must not be null");
        Objects.requireNonNull(storeProvider, "storeProvider must not be null");

        this.mappingValidator = new MappingValidator(resolver);
        mappingValidator.validate(plan);

        this.storage =
                storeProvider.create(
                        new StoreContext(
                                name,
                                resourcesRoot,
                                plan.getNodes(),
                                plan.getNodeInstances(),
                                config));
        this.outputsResolver = new OutputsResolver(storage, functionParser);

        logger.info(
                "Created environment '"
                        + name
                        + "' with "
                        + plan.getNodes().size()
                        + " nodes, "
                        + plan.getNodeInstances().size()
                        + " node instances, storage: "
                        + storeProvider.getName());
    }

    /// Returns the deployment name.
    ///
    /// @return deployment name, never null
    public String getName() {
        return name;
    }

    public DeploymentPlan getPlan() {
        return plan;
    }

    /// Returns the deployment's instance store.
    ///
    /// @return the store, never null
    public InstanceStore getStorage() {
        return storage;
    }

    /// Resolves the plan's outputs against the current instance state.
    ///
    /// @return output name to resolved value, a fresh map on every call, never null
    /// @see OutputsResolver
    public Map<String, Object> outputs() {
        return outputsResolver.resolve(plan.getOutputs());
    }

    /// Executes a workflow with no parameters and the configured defaults.
    ///
    /// @param workflowName the workflow to run, not null
    /// @throws WorkflowExecutionException if the implementation fails with a checked exception
    /// @see #execute(String, Map, boolean, RetryPolicy, int)
    public void execute(String workflowName) throws WorkflowExecutionException {
        execute(workflowName, Map.of());
    }

    /// Executes a workflow with the configured retry and thread pool defaults.
    ///
    /// @param workflowName the workflow to run, not null
    /// @param parameters execution parameters, may be null
    /// @throws WorkflowExecutionException if the implementation fails with a checked exception
    /// @see #execute(String, Map, boolean, RetryPolicy, int)
    public void execute(String workflowName, Map<String, Object> parameters)
            throws WorkflowExecutionException {
        execute(workflowName, parameters, false);
    }

    /// Executes a workflow with the configured retry and thread pool defaults.
    ///
    /// @param workflowName the workflow to run, not null
    /// @param parameters execution parameters, may be null
    /// @param allowCustomParameters whether undeclared parameters are passed through
    /// @throws WorkflowExecutionException if the implementation fails with a checked exception
    /// @see #execute(String, Map, boolean, RetryPolicy, int)
    public void execute(
            String workflowName, Map<String, Object> parameters, boolean allowCustomParameters)
            throws WorkflowExecutionException {
        execute(
                workflowName,
                parameters,
                allowCustomParameters,
                new RetryPolicy(config.getTaskRetries(), config.getTaskRetryInterval()),
                config.getTaskThreadPoolSize());
    }

    /// Executes a workflow.
    ///
    /// @param workflowName the workflow to run, not null
    /// @param parameters execution parameters, may be null
    /// @param allowCustomParameters whether undeclared parameters are passed through
    /// @param retryPolicy task retry settings for the implementation, not null
    /// @param taskThreadPoolSize task thread pool size for the implementation
    /// @throws NotFoundException if the plan has no such workflow
    /// @throws ConfigurationException if the workflow implementation cannot be resolved
    /// @throws io.plinth.core.exception.ParameterValidationException if parameters are missing
    /// or not allowed
    /// @throws WorkflowExecutionException if the implementation fails with a checked exception
    public void execute(
            String workflowName,
            Map<String, Object> parameters,
            boolean allowCustomParameters,
            RetryPolicy retryPolicy,
            int taskThreadPoolSize)
            throws WorkflowExecutionException {
        Map<String, WorkflowDefinition> workflows = plan.getWorkflows();
        WorkflowDefinition workflow = workflows.get(workflowName);
        if (workflow == null) {
            throw new NotFoundException(
                    "'"
                            + workflowName
                            + "' workflow does not exist. existing workflows are: "
                            + workflows.keySet());
        }

        OperationHandler handler =
                mappingValidator.resolve(
                        workflow.operation().operation(), MappingValidator.WORKFLOW, workflowName);
        String executionId = UUID.randomUUID().toString();

        Map<String, Object> mergedParameters =
                WorkflowParameters.merge(workflow, parameters, allowCustomParameters);

        ExecutionContext context =
                new ExecutionContext(
                        true,
                        name,
                        name,
                        executionId,
                        workflowName,
                        storage,
                        retryPolicy,
                        taskThreadPoolSize);

        logger.info(
                "Executing workflow '"
                        + workflowName
                        + "' [deployment="
                        + name
                        + ", execution="
                        + executionId
                        + "]");
        try {
            handler.invoke(context, mergedParameters);
        } catch (RuntimeException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkflowExecutionException(workflowName, executionId, e);
        } catch (Exception e) {
            throw new WorkflowExecutionException(workflowName, executionId, e);
        }
        logger.info("Workflow '" + workflowName + "' finished [execution=" + executionId + "]");
    }
}
