package io.plinth.core.storage.spi;

import io.plinth.core.storage.InstanceStore;

/// Provider interface for pluggable storage backends.
///
/// A backend is chosen by name through configuration (`plinth.storage.type`). Backends are
/// complete {@link InstanceStore} implementations; they share the locking and update rules
/// through composition, not through a common base class.
///
/// ### Registration
/// Either list the implementation in
/// `META-INF/services/io.plinth.core.storage.spi.InstanceStoreProvider`, or pass it to
/// {@link io.plinth.core.PlinthFactory.Builder#storeProviders(java.util.List)}.
///
/// @implNote Implementations should be stateless; each call to {@link #create} yields a new
/// store.
public interface InstanceStoreProvider {

    /// Returns the backend name used in configuration.
    ///
    /// @return backend name (e.g. "memory", "file"), never null
    String getName();

    /// Creates a store for one deployment.
    ///
    /// @param context deployment name, resources root, initial plan snapshot and configuration,
    /// not null
    /// @return a ready-to-use store, never null
    /// @throws io.plinth.core.exception.ConfigurationException if the context is unusable for
    /// this backend
    InstanceStore create(StoreContext context);
}
