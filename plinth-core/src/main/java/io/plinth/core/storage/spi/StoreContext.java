package io.plinth.core.storage.spi;

import io.plinth.core.PlinthConfig;
import io.plinth.core.plan.Node;
import io.plinth.core.plan.NodeInstance;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/// Everything a storage backend needs to create a store.
///
/// @param name deployment name, not null
/// @param resourcesRoot blueprint resources directory, not null
/// @param nodes plan nodes, not null
/// @param nodeInstances initial instance snapshot, not null
/// @param config environment configuration (storage directory, clear flag), not null
public record StoreContext(
        String name,
        Path resourcesRoot,
        List<Node> nodes,
        List<NodeInstance> nodeInstances,
        PlinthConfig config) {

    public StoreContext {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(resourcesRoot, "resourcesRoot must not be null");
        Objects.requireNonNull(config, "config must not be null");
        nodes = List.copyOf(nodes);
        nodeInstances = List.copyOf(nodeInstances);
    }
}
