package io.plinth.core.plan;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Named workflow of a deployment plan.
///
/// @param name workflow name, unique within the plan, not null
/// @param operation descriptor of the workflow implementation, not null
/// @param parameters declared parameters by name, never null
public record WorkflowDefinition(
        String name, OperationDescriptor operation, Map<String, ParameterDefinition> parameters) {

    /// Compact constructor with validation and defensive copying.
    public WorkflowDefinition {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(operation, "operation must not be null");
        parameters =
                parameters != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters))
                        : Map.of();
    }
}
