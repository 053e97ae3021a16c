package io.plinth.core.execution;

import java.util.Map;

/// Externally supplied implementation of a node operation or a workflow.
///
/// Handlers are registered with an {@link OperationResolver} under a dotted path
/// (`<module>.<attribute>`) and referenced from the plan by that path only.
///
/// ### Example Implementation
/// {@snippet :
/// OperationHandler install = (ctx, params) -> {
///     InstanceStore store = ctx.storage();
///     for (NodeInstance instance : store.getNodeInstances()) {
///         store.updateNodeInstance(instance.getId(), instance.getVersion(), null, "started");
///     }
/// };
/// registry.register("default_workflows.install", install);
/// }
///
/// @implNote Workflow handlers may fan work out over a thread pool of
/// {@link ExecutionContext#taskThreadPoolSize()} threads; the store is safe for concurrent use.
///
/// @see DefaultOperationRegistry
@FunctionalInterface
public interface OperationHandler {

    /// Runs the operation.
    ///
    /// @param context execution context with the store handle and task settings, not null
    /// @param parameters merged workflow parameters or operation inputs, not null
    /// @throws Exception if the operation fails
    void invoke(ExecutionContext context, Map<String, Object> parameters) throws Exception;
}
