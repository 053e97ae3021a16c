package io.plinth.core.plan;

import io.plinth.core.util.Values;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Template-level entity of a deployment plan.
///
/// A node declares its type, configured properties, the operations it supports (operation
/// name to {@link OperationDescriptor}) and its outgoing {@link Relationship}s. Running
/// copies of a node are {@link NodeInstance}s.
///
/// ### Contracts
/// - **Invariant**: every nested collection is unmodifiable, so a node handed out by an
/// {@link io.plinth.core.storage.InstanceStore} cannot be used to change store state
///
/// @implNote Immutable and thread-safe after construction.
///
/// @see NodeInstance
/// @see DeploymentPlan
public final class Node {

    private final String id;
    private final String type;
    private final List<String> typeHierarchy;
    private final Map<String, Object> properties;
    private final Map<String, OperationDescriptor> operations;
    private final List<Relationship> relationships;

    private Node(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Node ID required");
        this.type = builder.type;
        this.typeHierarchy = List.copyOf(builder.typeHierarchy);
        this.properties = Values.frozenCopy(builder.properties);
        this.operations = Collections.unmodifiableMap(new LinkedHashMap<>(builder.operations));
        this.relationships = List.copyOf(builder.relationships);
    }

    /// Returns the node identifier, unique within a plan.
    ///
    /// @return node ID, never null
    public String getId() {
        return id;
    }

    /// Returns the node type name.
    ///
    /// @return type, may be null when the plan omits it
    public String getType() {
        return type;
    }

    public List<String> getTypeHierarchy() {
        return typeHierarchy;
    }

    /// Returns the node's configured properties.
    ///
    /// @return deeply unmodifiable map, never null
    public Map<String, Object> getProperties() {
        return properties;
    }

    /// Returns the node's operations by name (e.g. `plinth.interfaces.lifecycle.create`).
    ///
    /// @return unmodifiable map of operation name to descriptor, never null
    public Map<String, OperationDescriptor> getOperations() {
        return operations;
    }

    /// Returns the outgoing relationships of this node.
    ///
    /// @return unmodifiable list, never null (empty when the plan declares none)
    public List<Relationship> getRelationships() {
        return relationships;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Builder for {@link Node}. Required field: `id`.
    public static final class Builder {
        private String id;
        private String type;
        private List<String> typeHierarchy = List.of();
        private Map<String, Object> properties = Map.of();
        private Map<String, OperationDescriptor> operations = Map.of();
        private List<Relationship> relationships = List.of();

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder typeHierarchy(List<String> typeHierarchy) {
            this.typeHierarchy = typeHierarchy != null ? typeHierarchy : List.of();
            return this;
        }

        public Builder properties(Map<String, Object> properties) {
            this.properties = properties;
            return this;
        }

        public Builder operations(Map<String, OperationDescriptor> operations) {
            this.operations = operations != null ? operations : Map.of();
            return this;
        }

        /// Adds or replaces a single operation.
        ///
        /// @param name operation name, not null
        /// @param descriptor implementation descriptor, not null
        /// @return this builder for chaining
        public Builder operation(String name, OperationDescriptor descriptor) {
            Map<String, OperationDescriptor> copy = new LinkedHashMap<>(this.operations);
            copy.put(name, descriptor);
            this.operations = copy;
            return this;
        }

        public Builder relationships(List<Relationship> relationships) {
            this.relationships = relationships != null ? relationships : List.of();
            return this;
        }

        public Node build() {
            return new Node(this);
        }
    }
}
