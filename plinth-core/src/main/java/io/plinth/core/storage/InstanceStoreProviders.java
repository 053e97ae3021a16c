package io.plinth.core.storage;

import io.plinth.core.exception.ConfigurationException;
import io.plinth.core.storage.spi.InstanceStoreProvider;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.logging.Logger;

/// Set of available storage backends, looked up by name.
///
/// ### Provider Discovery
/// The built-in `"memory"` provider is always present. Further providers come from two
/// sources, in increasing precedence:
/// - `META-INF/services/io.plinth.core.storage.spi.InstanceStoreProvider` on the classpath
/// - providers passed explicitly to {@link #InstanceStoreProviders(List, boolean)}
///
/// A later provider replaces an earlier one with the same name.
///
/// @implNote Thread-safe after construction.
public final class InstanceStoreProviders {

    private static final Logger logger = Logger.getLogger(InstanceStoreProviders.class.getName());

    private final Map<String, InstanceStoreProvider> providers;

    /// Creates the set from the built-in provider, discovered providers and explicit ones.
    ///
    /// @param explicitProviders providers wired by the caller, not null (may be empty)
    /// @param discover whether to consult `ServiceLoader`
    public InstanceStoreProviders(List<InstanceStoreProvider> explicitProviders, boolean discover) {
        Map<String, InstanceStoreProvider> byName = new LinkedHashMap<>();
        register(byName, new InMemoryInstanceStoreProvider());
        if (discover) {
            for (InstanceStoreProvider provider : ServiceLoader.load(InstanceStoreProvider.class)) {
                logger.fine("Discovered storage provider: " + provider.getName());
                register(byName, provider);
            }
        }
        for (InstanceStoreProvider provider : explicitProviders) {
            register(byName, provider);
        }
        this.providers = Collections.unmodifiableMap(byName);
    }

    private static void register(
            Map<String, InstanceStoreProvider> byName, InstanceStoreProvider provider) {
        byName.put(provider.getName(), provider);
    }

    /// Returns the provider for a backend name.
    ///
    /// @param storageType backend name, e.g. `"memory"` or `"file"`, not null
    /// @return the provider, never null
    /// @throws ConfigurationException if no provider has that name
    public InstanceStoreProvider get(String storageType) {
        InstanceStoreProvider provider = providers.get(storageType);
        if (provider == null) {
            throw new ConfigurationException(
                    "Unknown storage backend '"
                            + storageType
                            + "'. Available backends: "
                            + new ArrayList<>(providers.keySet()));
        }
        return provider;
    }

    /// Returns the names of all available backends.
    ///
    /// @return unmodifiable list in registration order, never null
    public List<String> names() {
        return List.copyOf(providers.keySet());
    }
}
