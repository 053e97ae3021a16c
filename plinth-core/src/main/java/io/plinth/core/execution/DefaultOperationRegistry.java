package io.plinth.core.execution;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/// Default implementation of {@link OperationResolver}, populated by the host.
///
/// Handlers are grouped by module: the path `a.b.c` registers attribute `c` in module `a.b`.
/// A path without a dot belongs to the empty module name and can never be resolved.
///
/// ### Example usage
/// {@snippet :
/// DefaultOperationRegistry registry = new DefaultOperationRegistry();
/// registry.register("plugins.web.start", (ctx, params) -> startServer(params));
/// registry.registerModule("default_workflows", Map.of("install", install, "uninstall", uninstall));
/// }
///
/// @implNote Thread-safe. Registration may happen concurrently with resolution.
public class DefaultOperationRegistry implements OperationResolver {

    private final Map<String, Map<String, OperationHandler>> modules = new ConcurrentHashMap<>();

    /// Registers a handler under a dotted path.
    ///
    /// @param operationPath `<module>.<attribute>`, not null or blank
    /// @param handler the implementation, not null
    /// @throws IllegalArgumentException if the path has no module part or handler is null
    public void register(String operationPath, OperationHandler handler) {
        if (operationPath == null || operationPath.isBlank()) {
            throw new IllegalArgumentException("operationPath cannot be null or blank");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        int split = operationPath.lastIndexOf('.');
        if (split <= 0 || split == operationPath.length() - 1) {
            throw new IllegalArgumentException(
                    "operationPath must have the form <module>.<attribute>: " + operationPath);
        }
        module(operationPath.substring(0, split)).put(operationPath.substring(split + 1), handler);
    }

    /// Registers several attributes of one module.
    ///
    /// @param moduleName module name, not null or blank
    /// @param handlers attribute name to implementation, not null
    public void registerModule(String moduleName, Map<String, OperationHandler> handlers) {
        if (moduleName == null || moduleName.isBlank()) {
            throw new IllegalArgumentException("moduleName cannot be null or blank");
        }
        module(moduleName).putAll(handlers);
    }

    @Override
    public OperationHandler resolve(String operationPath) throws OperationNotFoundException {
        int split = operationPath.lastIndexOf('.');
        String moduleName = split < 0 ? "" : operationPath.substring(0, split);
        String attributeName = operationPath.substring(split + 1);

        Map<String, OperationHandler> module = modules.get(moduleName);
        if (module == null) {
            throw new OperationNotFoundException(
                    OperationNotFoundException.Reason.MODULE, moduleName, attributeName);
        }
        OperationHandler handler = module.get(attributeName);
        if (handler == null) {
            throw new OperationNotFoundException(
                    OperationNotFoundException.Reason.ATTRIBUTE, moduleName, attributeName);
        }
        return handler;
    }

    /// Looks up a handler without failing.
    ///
    /// @param operationPath dotted path, not null
    /// @return the handler if registered
    public Optional<OperationHandler> find(String operationPath) {
        try {
            return Optional.of(resolve(operationPath));
        } catch (OperationNotFoundException e) {
            return Optional.empty();
        }
    }

    /// Returns the registered module names.
    ///
    /// @return snapshot of module names, never null
    public Set<String> getModuleNames() {
        return Set.copyOf(modules.keySet());
    }

    private Map<String, OperationHandler> module(String moduleName) {
        return modules.computeIfAbsent(moduleName, name -> new ConcurrentHashMap<>());
    }
}
