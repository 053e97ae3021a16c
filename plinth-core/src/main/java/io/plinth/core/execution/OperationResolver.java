package io.plinth.core.execution;

/// Resolves dotted operation paths to registered implementations.
///
/// The host environment decides what backs the resolver; the engine depends on this
/// interface only.
///
/// @see DefaultOperationRegistry
public interface OperationResolver {

    /// Resolves an operation path of the form `<module>.<attribute>`.
    ///
    /// @param operationPath dotted path, not null
    /// @return the implementation, never null
    /// @throws OperationNotFoundException if the module or the attribute is not registered
    OperationHandler resolve(String operationPath) throws OperationNotFoundException;
}
