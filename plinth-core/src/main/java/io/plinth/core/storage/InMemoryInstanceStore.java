package io.plinth.core.storage;

import io.plinth.core.exception.NotFoundException;
import io.plinth.core.exception.StorageConflictException;
import io.plinth.core.plan.Node;
import io.plinth.core.plan.NodeInstance;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/// In-memory instance store (default implementation).
///
/// State lives only in process memory and is lost when the process exits.
///
/// ### Concurrency
/// Each stored instance is a private object that is never modified after it has been
/// published. An update takes the instance lock, applies the change to a fresh copy and
/// publishes that copy. Reads are lock-free: they copy whatever instance is currently
/// published.
///
/// @see InstanceStore for the consistency contract
public final class InMemoryInstanceStore implements InstanceStore {

    private static final Logger logger = Logger.getLogger(InMemoryInstanceStore.class.getName());

    private final String name;
    private final BlueprintResources resources;
    private final NodeCatalog nodes;
    private final Map<String, NodeInstance> instances = new ConcurrentHashMap<>();
    private final InstanceLocks locks;

    /// Creates a store seeded from the plan's initial snapshot.
    ///
    /// Every instance starts at version 0, whatever version the snapshot carries.
    ///
    /// @param name deployment name, not null
    /// @param resourcesRoot blueprint resources directory, not null
    /// @param nodes plan nodes, not null
    /// @param nodeInstances initial instance snapshot, not null
    public InMemoryInstanceStore(
            String name, Path resourcesRoot, List<Node> nodes, List<NodeInstance> nodeInstances) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.resources = new BlueprintResources(resourcesRoot);
        this.nodes = new NodeCatalog(nodes);
        for (NodeInstance instance : nodeInstances) {
            NodeInstance initial = instance.copy();
            initial.setVersion(0);
            instances.put(initial.getId(), initial);
        }
        this.locks = new InstanceLocks(instances.keySet());
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Path getResourcesRoot() {
        return resources.getRoot();
    }

    @Override
    public byte[] getResource(String resourcePath) {
        return resources.read(resourcePath);
    }

    @Override
    public Path downloadResource(String resourcePath, Path targetPath) {
        return resources.download(resourcePath, targetPath);
    }

    @Override
    public Node getNode(String nodeId) {
        return nodes.get(nodeId);
    }

    @Override
    public List<Node> getNodes() {
        return nodes.all();
    }

    @Override
    public NodeInstance getNodeInstance(String nodeInstanceId) {
        return load(nodeInstanceId).copy();
    }

    @Override
    public List<NodeInstance> getNodeInstances() {
        List<NodeInstance> result = new ArrayList<>(instances.size());
        for (String id : locks.ids()) {
            result.add(load(id).copy());
        }
        return result;
    }

    @Override
    public void updateNodeInstance(
            String nodeInstanceId,
            long version,
            Map<String, Object> runtimeProperties,
            String state)
            throws StorageConflictException {
        ReentrantLock lock = locks.lockFor(nodeInstanceId);
        lock.lock();
        try {
            NodeInstance working = load(nodeInstanceId).copy();
            try {
                InstanceUpdates.apply(working, version, runtimeProperties, state);
            } catch (StorageConflictException e) {
                logger.fine("Rejected stale update: " + e.getMessage());
                throw e;
            }
            instances.put(nodeInstanceId, working);
            logger.fine(
                    "Updated node instance " + nodeInstanceId + " to version " + working.getVersion());
        } finally {
            lock.unlock();
        }
    }

    private NodeInstance load(String nodeInstanceId) {
        NodeInstance instance = instances.get(nodeInstanceId);
        if (instance == null) {
            throw new NotFoundException("Node instance " + nodeInstanceId + " does not exist");
        }
        return instance;
    }
}
