package io.plinth.core.plan;

import io.plinth.core.util.Values;
import java.util.Map;
import java.util.Objects;

/// Names the external implementation behind a node operation or a workflow.
///
/// The `operation` path has the form `<module>.<attribute>` and is resolved through an
/// {@link io.plinth.core.execution.OperationResolver}.
///
/// @param operation dotted path of the implementation, not null
/// @param plugin name of the plugin that ships the implementation, may be null
/// @param inputs declared operation inputs, never null (empty when absent)
public record OperationDescriptor(String operation, String plugin, Map<String, Object> inputs) {

    /// Compact constructor with validation and defensive copying.
    public OperationDescriptor {
        Objects.requireNonNull(operation, "operation must not be null");
        inputs = Values.frozenCopy(inputs);
    }

    /// Creates a descriptor without plugin or inputs.
    ///
    /// @param operation dotted path of the implementation, not null
    /// @return new descriptor, never null
    public static OperationDescriptor of(String operation) {
        return new OperationDescriptor(operation, null, Map.of());
    }
}
