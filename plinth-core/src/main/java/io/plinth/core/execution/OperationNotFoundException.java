package io.plinth.core.execution;

import java.io.Serial;

/// Thrown by an {@link OperationResolver} when a path cannot be resolved.
///
/// Tells a missing module apart from a module that lacks the requested attribute.
public class OperationNotFoundException extends Exception {

    @Serial private static final long serialVersionUID = 1938206437511620784L;

    /// Which part of the path failed to resolve.
    public enum Reason {
        MODULE,
        ATTRIBUTE
    }

    private final Reason reason;
    private final String moduleName;
    private final String attributeName;

    public OperationNotFoundException(Reason reason, String moduleName, String attributeName) {
        super(
                reason == Reason.MODULE
                        ? "No module named " + moduleName
                        : moduleName + " has no attribute '" + attributeName + "'");
        this.reason = reason;
        this.moduleName = moduleName;
        this.attributeName = attributeName;
    }

    public Reason getReason() {
        return reason;
    }

    public String getModuleName() {
        return moduleName;
    }

    public String getAttributeName() {
        return attributeName;
    }
}
