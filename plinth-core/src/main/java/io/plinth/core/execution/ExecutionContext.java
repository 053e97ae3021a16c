package io.plinth.core.execution;

import io.plinth.core.storage.InstanceStore;
import java.util.Objects;

/// Context handed to a workflow implementation for one execution.
///
/// This record is the whole contract between the engine and externally supplied workflow
/// code: identifiers of the run, the store handle and the task settings.
///
/// @param local always `true` for this engine
/// @param deploymentId deployment name, not null
/// @param blueprintId blueprint name (equal to the deployment name), not null
/// @param executionId fresh id of this run, not null
/// @param workflowId name of the executed workflow, not null
/// @param storage the deployment's instance store, not null
/// @param retryPolicy task retry settings, not null
/// @param taskThreadPoolSize number of threads the implementation may run tasks on
public record ExecutionContext(
        boolean local,
        String deploymentId,
        String blueprintId,
        String executionId,
        String workflowId,
        InstanceStore storage,
        RetryPolicy retryPolicy,
        int taskThreadPoolSize) {

    public ExecutionContext {
        Objects.requireNonNull(deploymentId, "deploymentId must not be null");
        Objects.requireNonNull(blueprintId, "blueprintId must not be null");
        Objects.requireNonNull(executionId, "executionId must not be null");
        Objects.requireNonNull(workflowId, "workflowId must not be null");
        Objects.requireNonNull(storage, "storage must not be null");
        Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
    }
}
