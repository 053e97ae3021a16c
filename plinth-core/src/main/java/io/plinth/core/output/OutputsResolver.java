package io.plinth.core.output;

import io.plinth.core.plan.NodeInstance;
import io.plinth.core.storage.InstanceStore;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Evaluates deployment outputs against the current instance state.
///
/// The output definitions are walked recursively through nested maps and lists. Every value
/// the {@link FunctionParser} recognizes is replaced by its result; all other values are
/// copied unchanged. The result never shares structure with the definitions.
///
/// A `get_attribute` result is a list with one entry per instance of the named node, in the
/// store's instance order, holding that instance's runtime property or null when unset.
/// Instances are read from the store at most once per {@link #resolve} call.
public final class OutputsResolver {

    private final InstanceStore store;
    private final FunctionParser parser;

    public OutputsResolver(InstanceStore store, FunctionParser parser) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
    }

    /// Resolves output definitions.
    ///
    /// @param outputs output name to definition, not null
    /// @return resolved outputs as a new mutable map, never null
    public Map<String, Object> resolve(Map<String, Object> outputs) {
        Scan scan = new Scan();
        Map<String, Object> resolved = new LinkedHashMap<>();
        outputs.forEach((name, value) -> resolved.put(name, scan.resolve(value)));
        return resolved;
    }

    /// State of one resolution pass, caching the instance list.
    private final class Scan {
        private List<NodeInstance> instances;

        private Object resolve(Object value) {
            var function = parser.parse(value);
            if (function.isPresent()) {
                return evaluate(function.get());
            }
            if (value instanceof Map<?, ?> map) {
                Map<Object, Object> copy = new LinkedHashMap<>();
                map.forEach((k, v) -> copy.put(k, resolve(v)));
                return copy;
            }
            if (value instanceof List<?> list) {
                List<Object> copy = new ArrayList<>(list.size());
                for (Object element : list) {
                    copy.add(resolve(element));
                }
                return copy;
            }
            return value;
        }

        private Object evaluate(IntrinsicFunction function) {
            GetAttribute getAttribute = (GetAttribute) function;
            List<Object> attributes = new ArrayList<>();
            for (NodeInstance instance : instances()) {
                if (instance.getNodeId().equals(getAttribute.nodeName())) {
                    attributes.add(
                            instance.getRuntimeProperties().get(getAttribute.attributeName()));
                }
            }
            return attributes;
        }

        private List<NodeInstance> instances() {
            if (instances == null) {
                instances = store.getNodeInstances();
            }
            return instances;
        }
    }
}
