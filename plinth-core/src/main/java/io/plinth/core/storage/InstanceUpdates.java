package io.plinth.core.storage;

import io.plinth.core.exception.StorageConflictException;
import io.plinth.core.plan.NodeInstance;
import java.util.Map;

/// Version-check and mutation rules of {@link InstanceStore#updateNodeInstance}.
///
/// Shared by every backend so the consistency contract is defined in exactly one place.
/// Callers must hold the instance's lock and pass a working copy they own.
public final class InstanceUpdates {

    private InstanceUpdates() {}

    /// Applies an update to a working copy.
    ///
    /// @param current working copy of the stored instance, modified in place, not null
    /// @param expectedVersion the version the caller based its change on
    /// @param runtimeProperties replacement properties, or null to keep the current ones
    /// @param state new state, or null for a property-only update
    /// @throws StorageConflictException if `state` is null and `expectedVersion` differs from
    /// the stored version; `current` is left untouched
    public static void apply(
            NodeInstance current,
            long expectedVersion,
            Map<String, Object> runtimeProperties,
            String state)
            throws StorageConflictException {
        if (state == null && expectedVersion != current.getVersion()) {
            throw new StorageConflictException(
                    current.getId(), expectedVersion, current.getVersion());
        }
        current.setVersion(current.getVersion() + 1);
        if (runtimeProperties != null) {
            current.setRuntimeProperties(runtimeProperties);
        }
        if (state != null) {
            current.setState(state);
        }
    }
}
