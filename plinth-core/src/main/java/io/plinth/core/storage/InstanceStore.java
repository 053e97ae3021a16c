package io.plinth.core.storage;

import io.plinth.core.exception.StorageConflictException;
import io.plinth.core.plan.Node;
import io.plinth.core.plan.NodeInstance;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/// Store owning node and node-instance state of one deployment.
///
/// The store is the only shared mutable state a running workflow touches. Worker threads of a
/// workflow implementation call it concurrently; every operation addresses exactly one node
/// instance, so no call ever holds two instance locks at once.
///
/// ### Consistency contract
/// {@link #updateNodeInstance} implements optimistic concurrency control with one deliberate
/// asymmetry:
/// - a **property update** (no `state`) must name the current version, otherwise it is
/// rejected with {@link StorageConflictException} and nothing is written
/// - a **state transition** (non-null `state`) is always accepted, whatever version it names
///
/// Both accepted paths increment the stored version by exactly one.
///
/// ### Copy semantics
/// Nodes are deeply immutable. Node instances are returned as private copies; mutating a
/// returned instance never changes what later reads return.
///
/// ### Usage
/// {@snippet :
/// NodeInstance instance = store.getNodeInstance("web_server_1a2b3");
/// instance.getRuntimeProperties().put("ip", "10.0.0.4");
/// store.updateNodeInstance(
///         instance.getId(), instance.getVersion(), instance.getRuntimeProperties(), null);
/// }
///
/// @implNote Implementations are selected through
/// {@link io.plinth.core.storage.spi.InstanceStoreProvider} and must be observably identical.
///
/// @see InMemoryInstanceStore
public interface InstanceStore {

    /// Returns the deployment name this store belongs to.
    ///
    /// @return deployment name, never null
    String getName();

    /// Returns the directory blueprint resources are resolved against.
    ///
    /// @return absolute resources root, never null
    Path getResourcesRoot();

    /// Reads a blueprint resource.
    ///
    /// @param resourcePath path relative to the resources root, not null
    /// @return the file content, never null
    /// @throws io.plinth.core.exception.NotFoundException if the resource does not exist
    byte[] getResource(String resourcePath);

    /// Copies a blueprint resource to a fresh temporary file.
    ///
    /// @param resourcePath path relative to the resources root, not null
    /// @return the written file, never null
    /// @throws io.plinth.core.exception.NotFoundException if the resource does not exist
    default Path downloadResource(String resourcePath) {
        return downloadResource(resourcePath, null);
    }

    /// Copies a blueprint resource to `targetPath`.
    ///
    /// @param resourcePath path relative to the resources root, not null
    /// @param targetPath destination file, or null for a fresh temporary file
    /// @return the written file, never null
    /// @throws io.plinth.core.exception.NotFoundException if the resource does not exist
    Path downloadResource(String resourcePath, Path targetPath);

    /// Returns a node by id.
    ///
    /// @param nodeId the node id, not null
    /// @return the node, never null
    /// @throws io.plinth.core.exception.NotFoundException if no such node exists
    Node getNode(String nodeId);

    /// Returns all nodes in plan order.
    ///
    /// @return unmodifiable list, never null
    List<Node> getNodes();

    /// Returns the current state of a node instance.
    ///
    /// @param nodeInstanceId the instance id, not null
    /// @return a private copy, never null
    /// @throws io.plinth.core.exception.NotFoundException if no such instance exists
    NodeInstance getNodeInstance(String nodeInstanceId);

    /// Returns the current state of every node instance, ordered by instance id.
    ///
    /// @return list of private copies, never null
    List<NodeInstance> getNodeInstances();

    /// Updates a node instance under its lock.
    ///
    /// An accepted update increments the version by exactly one. Only property-only updates
    /// are version-checked: an update that carries a `state` is always accepted, and any
    /// `runtimeProperties` it carries replace the stored ones even when `version` is stale.
    ///
    /// @param nodeInstanceId the instance to update, not null
    /// @param version the version the caller based its change on
    /// @param runtimeProperties replacement runtime properties (not merged), or null to keep
    /// the current ones
    /// @param state new lifecycle state, or null for a property-only update
    /// @throws StorageConflictException if `state` is null and `version` is stale
    /// @throws io.plinth.core.exception.NotFoundException if no such instance exists
    void updateNodeInstance(
            String nodeInstanceId,
            long version,
            Map<String, Object> runtimeProperties,
            String state)
            throws StorageConflictException;
}
