package io.plinth.core.output;

import io.plinth.core.exception.ConfigurationException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Parser for the plan's JSON function syntax: a single-entry map keyed by the function name.
///
/// Only `get_attribute` is recognized. Any other map, including multi-entry maps that happen
/// to contain a `get_attribute` key, is a plain value.
public class DefaultFunctionParser implements FunctionParser {

    @Override
    public Optional<IntrinsicFunction> parse(Object value) {
        if (!(value instanceof Map<?, ?> map) || map.size() != 1) {
            return Optional.empty();
        }
        if (!map.containsKey(GetAttribute.NAME)) {
            return Optional.empty();
        }
        Object arguments = map.get(GetAttribute.NAME);
        if (arguments instanceof List<?> list
                && list.size() == 2
                && list.get(0) instanceof String nodeName
                && list.get(1) instanceof String attributeName) {
            return Optional.of(new GetAttribute(nodeName, attributeName));
        }
        throw new ConfigurationException(
                "Illegal arguments passed to "
                        + GetAttribute.NAME
                        + " function: expected [node_name, attribute_name] but got "
                        + arguments);
    }
}
