package io.plinth.storage.file;

import io.plinth.core.storage.InstanceStore;
import io.plinth.core.storage.spi.InstanceStoreProvider;
import io.plinth.core.storage.spi.StoreContext;

/// Provides the `"file"` storage backend.
///
/// Discovered through `META-INF/services`; selected with `plinth.storage.type=file`. Reads
/// the storage directory and clear flag from the environment configuration.
public class FileInstanceStoreProvider implements InstanceStoreProvider {

    public static final String NAME = "file";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public InstanceStore create(StoreContext context) {
        return new FileInstanceStore(
                context.name(),
                context.resourcesRoot(),
                context.nodes(),
                context.nodeInstances(),
                context.config().getStorageDirectory(),
                context.config().isClearStorage());
    }
}
