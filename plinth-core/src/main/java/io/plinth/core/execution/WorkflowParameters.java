package io.plinth.core.execution;

import io.plinth.core.exception.ParameterValidationException;
import io.plinth.core.plan.ParameterDefinition;
import io.plinth.core.plan.WorkflowDefinition;
import io.plinth.core.util.Values;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/// Merges caller-supplied execution parameters with a workflow's declared parameters.
///
/// ### Rules
/// - a declared parameter without default must be supplied
/// - a declared parameter with default takes the supplied value, else a mutable copy of the
/// default
/// - an undeclared parameter is a custom parameter: rejected unless custom parameters are
/// allowed, in which case it passes through unchanged
///
/// Failures report every offending name at once.
public final class WorkflowParameters {

    private WorkflowParameters() {}

    /// Merges and validates execution parameters.
    ///
    /// @param workflow the workflow being executed, not null
    /// @param executionParameters caller parameters, may be null
    /// @param allowCustomParameters whether undeclared parameters are accepted
    /// @return merged parameters, declared ones first in declaration order, never null
    /// @throws ParameterValidationException if mandatory parameters are missing, or custom
    /// parameters were supplied but are not allowed
    public static Map<String, Object> merge(
            WorkflowDefinition workflow,
            Map<String, Object> executionParameters,
            boolean allowCustomParameters) {
        Map<String, Object> supplied = executionParameters != null ? executionParameters : Map.of();
        Map<String, ParameterDefinition> declared = workflow.parameters();

        Map<String, Object> merged = new LinkedHashMap<>();
        Set<String> missing = new LinkedHashSet<>();

        for (Map.Entry<String, ParameterDefinition> entry : declared.entrySet()) {
            String name = entry.getKey();
            ParameterDefinition parameter = entry.getValue();
            if (supplied.containsKey(name)) {
                merged.put(name, supplied.get(name));
            } else if (parameter.hasDefault()) {
                merged.put(name, Values.deepCopy(parameter.defaultValue()));
            } else {
                missing.add(name);
            }
        }

        if (!missing.isEmpty()) {
            throw new ParameterValidationException(
                    "Workflow \""
                            + workflow.name()
                            + "\" must be provided with the following parameters to execute: "
                            + String.join(",", missing),
                    missing);
        }

        Map<String, Object> custom = new LinkedHashMap<>();
        supplied.forEach(
                (name, value) -> {
                    if (!declared.containsKey(name)) {
                        custom.put(name, value);
                    }
                });

        if (!allowCustomParameters && !custom.isEmpty()) {
            throw new ParameterValidationException(
                    "Workflow \""
                            + workflow.name()
                            + "\" does not have the following parameters declared: "
                            + String.join(",", custom.keySet())
                            + ". Remove these parameters or use the flag for allowing custom"
                            + " parameters",
                    custom.keySet());
        }

        merged.putAll(custom);
        return merged;
    }
}
