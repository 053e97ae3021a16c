package io.plinth.core.exception;

import java.io.Serial;

/// Thrown when a deployment environment cannot be assembled.
///
/// Raised while constructing a {@link io.plinth.core.PlinthEnvironment}, before any
/// workflow runs. Common causes:
/// - An operation mapping names a module or attribute that is not registered
/// - The configured storage backend is unknown
/// - A node instance references a node that is not part of the plan
///
/// An environment is never returned partially validated; the exception aborts construction.
public class ConfigurationException extends RuntimeException {

    @Serial private static final long serialVersionUID = 2309745519236048108L;

    /// Creates exception with message.
    ///
    /// @param message description of the invalid wiring
    public ConfigurationException(String message) {
        super(message);
    }

    /// Creates exception with message and cause.
    ///
    /// @param message description of the invalid wiring
    /// @param cause the underlying exception
    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
