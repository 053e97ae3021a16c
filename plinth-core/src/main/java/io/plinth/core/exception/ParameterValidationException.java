package io.plinth.core.exception;

import java.io.Serial;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/// Thrown when execution parameters do not match a workflow's declared parameters.
///
/// Always carries the complete set of offending names so every problem can be fixed in one
/// pass: either all missing mandatory parameters, or all undeclared parameters when custom
/// parameters are not allowed.
public class ParameterValidationException extends RuntimeException {

    @Serial private static final long serialVersionUID = -3391577206049917710L;

    private final Set<String> parameterNames;

    /// Creates exception with message and the offending parameter names.
    ///
    /// @param message human readable description, not null
    /// @param parameterNames every parameter name at fault, not null
    public ParameterValidationException(String message, Set<String> parameterNames) {
        super(message);
        this.parameterNames = Collections.unmodifiableSet(new LinkedHashSet<>(parameterNames));
    }

    /// Returns the parameter names that caused the failure.
    ///
    /// @return unmodifiable set in the order they were found, never null or empty
    public Set<String> getParameterNames() {
        return parameterNames;
    }
}
