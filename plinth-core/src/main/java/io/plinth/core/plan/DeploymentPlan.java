package io.plinth.core.plan;

import io.plinth.core.exception.ConfigurationException;
import io.plinth.core.util.Values;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Compiled deployment plan, as produced by the external blueprint compiler.
///
/// Holds the complete node and node-instance sets, the workflows by name and the output
/// definitions. Output values are either literals or function expressions resolved later
/// against live instance state (see {@link io.plinth.core.output.OutputsResolver}).
///
/// ### Validation
/// On build the plan checks that node ids and instance ids are unique and that every
/// instance references a node of the same plan. Operation wiring is validated separately
/// by {@link io.plinth.core.execution.MappingValidator} because it needs a resolver.
///
/// @implNote Immutable after construction. The node instances held here are the initial
/// snapshot and are only ever copied, never handed out.
public final class DeploymentPlan {

    private final List<Node> nodes;
    private final List<NodeInstance> nodeInstances;
    private final Map<String, WorkflowDefinition> workflows;
    private final Map<String, Object> outputs;

    private DeploymentPlan(Builder builder) {
        this.nodes = List.copyOf(builder.nodes);
        this.nodeInstances = builder.nodeInstances.stream().map(NodeInstance::copy).toList();
        this.workflows = Collections.unmodifiableMap(new LinkedHashMap<>(builder.workflows));
        this.outputs = Values.frozenCopy(builder.outputs);

        validate();
    }

    private void validate() {
        Set<String> nodeIds = new HashSet<>();
        for (Node node : nodes) {
            if (!nodeIds.add(node.getId())) {
                throw new ConfigurationException("Duplicate node id '" + node.getId() + "'");
            }
        }

        Set<String> instanceIds = new HashSet<>();
        for (NodeInstance instance : nodeInstances) {
            if (!instanceIds.add(instance.getId())) {
                throw new ConfigurationException(
                        "Duplicate node instance id '" + instance.getId() + "'");
            }
            if (!nodeIds.contains(instance.getNodeId())) {
                throw new ConfigurationException(
                        "Node instance '"
                                + instance.getId()
                                + "' references node '"
                                + instance.getNodeId()
                                + "' which is not declared in the plan");
            }
        }
    }

    public List<Node> getNodes() {
        return nodes;
    }

    /// Returns the initial node instance snapshot as fresh copies.
    ///
    /// @return list of independent copies in plan order, never null
    public List<NodeInstance> getNodeInstances() {
        return nodeInstances.stream().map(NodeInstance::copy).toList();
    }

    /// Returns the workflows by name.
    ///
    /// @return unmodifiable map, never null
    public Map<String, WorkflowDefinition> getWorkflows() {
        return workflows;
    }

    /// Returns the output definitions.
    ///
    /// @return deeply unmodifiable map of output name to definition, never null
    public Map<String, Object> getOutputs() {
        return outputs;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Builder for {@link DeploymentPlan}. All fields default to empty.
    public static final class Builder {
        private List<Node> nodes = List.of();
        private List<NodeInstance> nodeInstances = List.of();
        private Map<String, WorkflowDefinition> workflows = Map.of();
        private Map<String, Object> outputs = Map.of();

        private Builder() {}

        public Builder nodes(List<Node> nodes) {
            this.nodes = nodes != null ? nodes : List.of();
            return this;
        }

        public Builder nodeInstances(List<NodeInstance> nodeInstances) {
            this.nodeInstances = nodeInstances != null ? nodeInstances : List.of();
            return this;
        }

        public Builder workflows(Map<String, WorkflowDefinition> workflows) {
            this.workflows = workflows != null ? workflows : Map.of();
            return this;
        }

        /// Adds or replaces a single workflow, keyed by its name.
        ///
        /// @param workflow the workflow definition, not null
        /// @return this builder for chaining
        public Builder workflow(WorkflowDefinition workflow) {
            Map<String, WorkflowDefinition> copy = new LinkedHashMap<>(this.workflows);
            copy.put(workflow.name(), workflow);
            this.workflows = copy;
            return this;
        }

        public Builder outputs(Map<String, Object> outputs) {
            this.outputs = outputs;
            return this;
        }

        /// Builds and validates the plan.
        ///
        /// @return the plan, never null
        /// @throws ConfigurationException if ids are duplicated or an instance references an
        /// unknown node
        public DeploymentPlan build() {
            return new DeploymentPlan(this);
        }
    }
}
