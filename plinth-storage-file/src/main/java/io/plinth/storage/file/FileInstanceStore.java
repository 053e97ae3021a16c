package io.plinth.storage.file;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.plinth.core.exception.ConfigurationException;
import io.plinth.core.exception.NotFoundException;
import io.plinth.core.exception.StorageConflictException;
import io.plinth.core.exception.StorageException;
import io.plinth.core.plan.Node;
import io.plinth.core.plan.NodeInstance;
import io.plinth.core.storage.BlueprintResources;
import io.plinth.core.storage.InstanceLocks;
import io.plinth.core.storage.InstanceStore;
import io.plinth.core.storage.InstanceUpdates;
import io.plinth.core.storage.NodeCatalog;
import io.plinth.serialization.PlanSerializer;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Instance store that keeps one JSON file per node instance.
///
/// ### Layout
/// ```
/// <storageDirectory>/<name>/node-instances/<nodeInstanceId>
/// ```
///
/// When the instances directory does not exist yet it is created and seeded from the plan's
/// initial snapshot, every instance at version 0. When it exists, the files on disk are
/// authoritative: the directory listing is the instance set and the snapshot is ignored. A
/// restarted process therefore resumes from the state the previous one left behind, unless
/// the store is opened with `clear`.
///
/// ### Concurrency
/// Every read and write of an instance file happens under that instance's lock. Writes go to
/// a temporary file in the same directory which then replaces the instance file, so a reader
/// never observes a half-written instance. Coordination is in-process only.
///
/// @see InstanceStore for the consistency contract
public final class FileInstanceStore implements InstanceStore {

    private static final Logger logger = Logger.getLogger(FileInstanceStore.class.getName());

    static final String INSTANCES_DIRECTORY = "node-instances";

    private final String name;
    private final BlueprintResources resources;
    private final NodeCatalog nodes;
    private final Path instancesDirectory;
    private final InstanceLocks locks;
    private final ObjectMapper mapper;

    /// Opens or creates the storage of a deployment.
    ///
    /// @param name deployment name, used as sub-directory of `storageDirectory`, not null
    /// @param resourcesRoot blueprint resources directory, not null
    /// @param nodes plan nodes, not null
    /// @param nodeInstances initial snapshot, used only when no stored state exists, not null
    /// @param storageDirectory root directory shared by all deployments, not null
    /// @param clear whether to delete existing stored state of this deployment first
    /// @throws ConfigurationException if an instance id cannot be used as a file name
    /// @throws StorageException if the storage directory cannot be prepared
    public FileInstanceStore(
            String name,
            Path resourcesRoot,
            List<Node> nodes,
            List<NodeInstance> nodeInstances,
            Path storageDirectory,
            boolean clear) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.resources = new BlueprintResources(resourcesRoot);
        this.nodes = new NodeCatalog(nodes);
        this.mapper = PlanSerializer.createMapper();

        Path deploymentDirectory = storageDirectory.resolve(name);
        this.instancesDirectory = deploymentDirectory.resolve(INSTANCES_DIRECTORY);

        try {
            if (clear && Files.exists(deploymentDirectory)) {
                logger.info("Clearing stored state of deployment '" + name + "'");
                deleteRecursively(deploymentDirectory);
            }
            if (Files.isDirectory(instancesDirectory)) {
                this.locks = new InstanceLocks(listStoredIds());
                logger.info(
                        "Opened stored state of deployment '"
                                + name
                                + "' with "
                                + locks.ids().size()
                                + " node instances");
            } else {
                for (NodeInstance instance : nodeInstances) {
                    requireFileName(instance.getId());
                }
                Files.createDirectories(instancesDirectory);
                List<String> ids = new ArrayList<>(nodeInstances.size());
                for (NodeInstance instance : nodeInstances) {
                    NodeInstance initial = instance.copy();
                    initial.setVersion(0);
                    write(initial);
                    ids.add(initial.getId());
                }
                this.locks = new InstanceLocks(ids);
                logger.info(
                        "Initialized storage of deployment '"
                                + name
                                + "' at "
                                + instancesDirectory
                                + " with "
                                + ids.size()
                                + " node instances");
            }
        } catch (IOException e) {
            throw new StorageException(
                    "Failed to prepare storage directory " + instancesDirectory, e);
        }
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Path getResourcesRoot() {
        return resources.getRoot();
    }

    /// Returns the directory holding the instance files.
    ///
    /// @return absolute or relative path as configured, never null
    public Path getInstancesDirectory() {
        return instancesDirectory;
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
        return load(nodeInstanceId);
    }

    @Override
    public List<NodeInstance> getNodeInstances() {
        List<NodeInstance> result = new ArrayList<>(locks.ids().size());
        for (String id : locks.ids()) {
            result.add(load(id));
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
            NodeInstance current = load(nodeInstanceId);
            try {
                InstanceUpdates.apply(current, version, runtimeProperties, state);
            } catch (StorageConflictException e) {
                logger.fine("Rejected stale update: " + e.getMessage());
                throw e;
            }
            write(current);
            logger.fine(
                    "Stored node instance " + nodeInstanceId + " at version " + current.getVersion());
        } catch (IOException e) {
            throw new StorageException("Failed to write node instance " + nodeInstanceId, e);
        } finally {
            lock.unlock();
        }
    }

    private NodeInstance load(String nodeInstanceId) {
        ReentrantLock lock = locks.lockFor(nodeInstanceId);
        lock.lock();
        try {
            return mapper.readValue(
                    Files.readAllBytes(instancesDirectory.resolve(nodeInstanceId)),
                    NodeInstance.class);
        } catch (NoSuchFileException e) {
            throw new NotFoundException("Node instance " + nodeInstanceId + " does not exist", e);
        } catch (IOException e) {
            throw new StorageException("Failed to read node instance " + nodeInstanceId, e);
        } finally {
            lock.unlock();
        }
    }

    private void write(NodeInstance instance) throws IOException {
        Path target = instancesDirectory.resolve(instance.getId());
        Path temp = Files.createTempFile(instancesDirectory, "." + instance.getId() + "-", ".tmp");
        try {
            Files.write(temp, mapper.writeValueAsBytes(instance));
            try {
                Files.move(
                        temp,
                        target,
                        StandardCopyOption.ATOMIC_MOVE,
                        StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException e) {
                logger.log(Level.WARNING, "Failed to delete temporary file " + temp, e);
            }
        }
    }

    private List<String> listStoredIds() throws IOException {
        List<String> ids = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(instancesDirectory)) {
            for (Path file : files) {
                String fileName = file.getFileName().toString();
                if (Files.isRegularFile(file) && !fileName.startsWith(".")) {
                    ids.add(fileName);
                }
            }
        }
        return ids;
    }

    private void requireFileName(String nodeInstanceId) {
        boolean valid =
                !nodeInstanceId.isEmpty()
                        && !nodeInstanceId.startsWith(".")
                        && nodeInstanceId.indexOf('/') < 0
                        && nodeInstanceId.indexOf('\\') < 0
                        && nodeInstanceId.indexOf('\0') < 0;
        if (!valid) {
            throw new ConfigurationException(
                    "Node instance id '"
                            + nodeInstanceId
                            + "' cannot be stored as a file in "
                            + instancesDirectory);
        }
    }

    private static void deleteRecursively(Path directory) throws IOException {
        Files.walkFileTree(
                directory,
                new SimpleFileVisitor<>() {
                    @Override
                    public FileVisitResult visitFile(Path file, BasicFileAttributes attrs)
                            throws IOException {
                        Files.delete(file);
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult postVisitDirectory(Path dir, IOException exc)
                            throws IOException {
                        if (exc != null) {
                            throw exc;
                        }
                        Files.delete(dir);
                        return FileVisitResult.CONTINUE;
                    }
                });
    }
}
