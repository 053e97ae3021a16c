package io.plinth.core.storage;

import io.plinth.core.storage.spi.InstanceStoreProvider;
import io.plinth.core.storage.spi.StoreContext;

/// Provider of the built-in `"memory"` backend.
public class InMemoryInstanceStoreProvider implements InstanceStoreProvider {

    /// Backend name selecting this provider.
    public static final String NAME = "memory";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public InstanceStore create(StoreContext context) {
        return new InMemoryInstanceStore(
                context.name(), context.resourcesRoot(), context.nodes(), context.nodeInstances());
    }
}
