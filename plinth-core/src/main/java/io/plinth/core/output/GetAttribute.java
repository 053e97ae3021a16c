package io.plinth.core.output;

import java.util.Objects;

/// `get_attribute` function: the value of a runtime property on every instance of a node.
///
/// Written in a plan as `{"get_attribute": ["<node name>", "<attribute name>"]}`.
///
/// @param nodeName the node whose instances are read, not null
/// @param attributeName the runtime property to collect, not null
public record GetAttribute(String nodeName, String attributeName) implements IntrinsicFunction {

    /// Key identifying the function in a plan value.
    public static final String NAME = "get_attribute";

    public GetAttribute {
        Objects.requireNonNull(nodeName, "nodeName must not be null");
        Objects.requireNonNull(attributeName, "attributeName must not be null");
    }
}
