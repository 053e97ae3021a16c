package io.plinth.core.plan;

import io.plinth.core.util.Values;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Running instance of a {@link Node}.
///
/// Carries the lifecycle state, the runtime properties written by operations and the
/// version counter used for optimistic concurrency control. Instances handed out by an
/// {@link io.plinth.core.storage.InstanceStore} are private copies: callers may edit them
/// freely and submit the edited runtime properties back through
/// {@link io.plinth.core.storage.InstanceStore#updateNodeInstance}.
///
/// ### Contracts
/// - **Invariant**: `id` and `nodeId` never change
/// - **Invariant**: a stored instance's version starts at 0 and grows by exactly one per
/// accepted update
///
/// @implNote **Not thread-safe**. Each copy is meant to be confined to one thread.
///
/// @see #copy()
public final class NodeInstance {

    /// State of an instance that no lifecycle operation has touched yet.
    public static final String INITIAL_STATE = "uninitialized";

    private final String id;
    private final String nodeId;
    private final List<RelationshipInstance> relationships;
    private String state;
    private Map<String, Object> runtimeProperties;
    private long version;

    private NodeInstance(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Node instance ID required");
        this.nodeId = Objects.requireNonNull(builder.nodeId, "Node ID required");
        this.relationships = List.copyOf(builder.relationships);
        this.state = builder.state;
        this.runtimeProperties = Values.mutableCopy(builder.runtimeProperties);
        this.version = builder.version;
    }

    /// Returns the instance identifier, the store's primary key.
    ///
    /// @return instance ID, never null
    public String getId() {
        return id;
    }

    /// Returns the id of the node this instance belongs to.
    ///
    /// @return node ID, never null
    public String getNodeId() {
        return nodeId;
    }

    public List<RelationshipInstance> getRelationships() {
        return relationships;
    }

    /// Returns the lifecycle state, e.g. `"uninitialized"` or `"started"`.
    ///
    /// @return state, may be null when the plan omits it
    public String getState() {
        return state;
    }

    public void setState(String state) {
        this.state = state;
    }

    /// Returns the runtime properties of this copy.
    ///
    /// @return mutable map owned by this copy, never null
    public Map<String, Object> getRuntimeProperties() {
        return runtimeProperties;
    }

    /// Replaces all runtime properties of this copy.
    ///
    /// Values are copied deeply into their JSON form (see {@link Values}), so a `Long` that
    /// fits an `int` is kept as `Integer`, a `Float` as `Double` and an array as a list.
    ///
    /// @param runtimeProperties new properties, copied deeply; null clears them
    /// @throws IllegalArgumentException if a value has no JSON form
    public void setRuntimeProperties(Map<String, Object> runtimeProperties) {
        this.runtimeProperties = Values.mutableCopy(runtimeProperties);
    }

    public long getVersion() {
        return version;
    }

    public void setVersion(long version) {
        this.version = version;
    }

    /// Returns a deep copy of this instance.
    ///
    /// Nested maps and lists of the runtime properties are copied, so no mutation of the
    /// returned value is visible through this one.
    ///
    /// @return independent copy, never null
    public NodeInstance copy() {
        return toBuilder().build();
    }

    /// Returns a builder pre-filled with this instance's values.
    ///
    /// @return new builder, never null
    public Builder toBuilder() {
        return builder()
                .id(id)
                .nodeId(nodeId)
                .state(state)
                .runtimeProperties(runtimeProperties)
                .version(version)
                .relationships(relationships);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NodeInstance other)) {
            return false;
        }
        return version == other.version
                && id.equals(other.id)
                && nodeId.equals(other.nodeId)
                && Objects.equals(state, other.state)
                && runtimeProperties.equals(other.runtimeProperties)
                && relationships.equals(other.relationships);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, nodeId, state, runtimeProperties, version, relationships);
    }

    @Override
    public String toString() {
        return "NodeInstance{id='"
                + id
                + "', nodeId='"
                + nodeId
                + "', state='"
                + state
                + "', version="
                + version
                + "}";
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Builder for {@link NodeInstance}. Required fields: `id`, `nodeId`.
    public static final class Builder {
        private String id;
        private String nodeId;
        private String state = INITIAL_STATE;
        private Map<String, Object> runtimeProperties = Map.of();
        private long version;
        private List<RelationshipInstance> relationships = List.of();

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder nodeId(String nodeId) {
            this.nodeId = nodeId;
            return this;
        }

        public Builder state(String state) {
            this.state = state;
            return this;
        }

        public Builder runtimeProperties(Map<String, Object> runtimeProperties) {
            this.runtimeProperties = runtimeProperties;
            return this;
        }

        public Builder version(long version) {
            this.version = version;
            return this;
        }

        public Builder relationships(List<RelationshipInstance> relationships) {
            this.relationships = relationships != null ? relationships : List.of();
            return this;
        }

        public NodeInstance build() {
            return new NodeInstance(this);
        }
    }
}
