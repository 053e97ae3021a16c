package io.plinth.core.execution;

import io.plinth.core.exception.ConfigurationException;
import io.plinth.core.plan.DeploymentPlan;
import io.plinth.core.plan.Node;
import io.plinth.core.plan.OperationDescriptor;
import io.plinth.core.plan.Relationship;
import java.util.Map;
import java.util.Objects;

/// Resolves every operation mapping of a plan up front.
///
/// A mapping that points at a missing module or attribute would otherwise surface deep into
/// a workflow run. Validating at environment construction turns it into an immediate failure
/// naming the node, the operation kind and the unresolved path.
///
/// ### Checked mappings
/// For every node:
/// - `operations`: the node's own operations
/// - `source_operations` and `target_operations`: both sides of every relationship
///
/// Workflow mappings are resolved when the workflow is executed.
public final class MappingValidator {

    public static final String OPERATIONS = "operations";
    public static final String SOURCE_OPERATIONS = "source_operations";
    public static final String TARGET_OPERATIONS = "target_operations";
    public static final String WORKFLOW = "workflow";

    private final OperationResolver resolver;

    public MappingValidator(OperationResolver resolver) {
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
    }

    /// Resolves all node and relationship operations of a plan.
    ///
    /// @param plan the plan to check, not null
    /// @throws ConfigurationException on the first unresolved mapping
    public void validate(DeploymentPlan plan) {
        for (Node node : plan.getNodes()) {
            resolveAll(node.getOperations(), OPERATIONS, node.getId());
            for (Relationship relationship : node.getRelationships()) {
                resolveAll(relationship.getSourceOperations(), SOURCE_OPERATIONS, node.getId());
                resolveAll(relationship.getTargetOperations(), TARGET_OPERATIONS, node.getId());
            }
        }
    }

    /// Resolves a single mapping.
    ///
    /// @param operationPath dotted path, not null
    /// @param kind operation kind for the error message, e.g. {@link #WORKFLOW}
    /// @param nodeName owning node, empty for workflows
    /// @return the implementation, never null
    /// @throws ConfigurationException if the path cannot be resolved
    public OperationHandler resolve(String operationPath, String kind, String nodeName) {
        try {
            return resolver.resolve(operationPath);
        } catch (OperationNotFoundException e) {
            throw new ConfigurationException(
                    "mapping error: "
                            + e.getMessage()
                            + " [node="
                            + nodeName
                            + ", type="
                            + kind
                            + "]",
                    e);
        }
    }

    private void resolveAll(
            Map<String, OperationDescriptor> operations, String kind, String nodeName) {
        for (OperationDescriptor descriptor : operations.values()) {
            resolve(descriptor.operation(), kind, nodeName);
        }
    }
}
