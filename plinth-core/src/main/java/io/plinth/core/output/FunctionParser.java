package io.plinth.core.output;

import java.util.Optional;

/// Recognizes function expressions inside plan values.
///
/// Pluggable so hosts can replace the expression syntax; the engine only evaluates the
/// {@link IntrinsicFunction} kinds it knows.
///
/// @see DefaultFunctionParser
@FunctionalInterface
public interface FunctionParser {

    /// Parses a value.
    ///
    /// @param value any plan value, may be null
    /// @return the function if `value` is a function expression, empty otherwise
    /// @throws io.plinth.core.exception.ConfigurationException if `value` names a known
    /// function with malformed arguments
    Optional<IntrinsicFunction> parse(Object value);
}
