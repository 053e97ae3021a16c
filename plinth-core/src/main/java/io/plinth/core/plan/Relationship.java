package io.plinth.core.plan;

import io.plinth.core.util.Values;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Template-level relationship from a node to a target node.
///
/// Carries the operations run on each side of the relationship. Both operation maps are always
/// present; a plan that omits them yields empty maps.
///
/// @implNote Immutable and thread-safe after construction.
public final class Relationship {

    private final String type;
    private final String targetId;
    private final List<String> typeHierarchy;
    private final Map<String, Object> properties;
    private final Map<String, OperationDescriptor> sourceOperations;
    private final Map<String, OperationDescriptor> targetOperations;

    private Relationship(Builder builder) {
        this.type = Objects.requireNonNull(builder.type, "Relationship type required");
        this.targetId = Objects.requireNonNull(builder.targetId, "Relationship target required");
        this.typeHierarchy = List.copyOf(builder.typeHierarchy);
        this.properties = Values.frozenCopy(builder.properties);
        this.sourceOperations =
                Collections.unmodifiableMap(new LinkedHashMap<>(builder.sourceOperations));
        this.targetOperations =
                Collections.unmodifiableMap(new LinkedHashMap<>(builder.targetOperations));
    }

    public String getType() {
        return type;
    }

    /// Returns the id of the target node.
    ///
    /// @return target node id, never null
    public String getTargetId() {
        return targetId;
    }

    public List<String> getTypeHierarchy() {
        return typeHierarchy;
    }

    public Map<String, Object> getProperties() {
        return properties;
    }

    /// Returns operations executed on the source node's side.
    ///
    /// @return unmodifiable map of operation name to descriptor, never null
    public Map<String, OperationDescriptor> getSourceOperations() {
        return sourceOperations;
    }

    /// Returns operations executed on the target node's side.
    ///
    /// @return unmodifiable map of operation name to descriptor, never null
    public Map<String, OperationDescriptor> getTargetOperations() {
        return targetOperations;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Builder for {@link Relationship}. Required fields: `type`, `targetId`.
    public static final class Builder {
        private String type;
        private String targetId;
        private List<String> typeHierarchy = List.of();
        private Map<String, Object> properties = Map.of();
        private Map<String, OperationDescriptor> sourceOperations = Map.of();
        private Map<String, OperationDescriptor> targetOperations = Map.of();

        private Builder() {}

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder targetId(String targetId) {
            this.targetId = targetId;
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

        public Builder sourceOperations(Map<String, OperationDescriptor> sourceOperations) {
            this.sourceOperations = sourceOperations != null ? sourceOperations : Map.of();
            return this;
        }

        public Builder targetOperations(Map<String, OperationDescriptor> targetOperations) {
            this.targetOperations = targetOperations != null ? targetOperations : Map.of();
            return this;
        }

        public Relationship build() {
            return new Relationship(this);
        }
    }
}
