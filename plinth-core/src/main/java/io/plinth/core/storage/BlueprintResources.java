package io.plinth.core.storage;

import io.plinth.core.exception.NotFoundException;
import io.plinth.core.exception.StorageException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/// File access to the resources shipped next to a blueprint.
///
/// Resource paths are resolved against a fixed root, the directory of the compiled
/// blueprint. Paths that would escape the root are treated as missing.
public final class BlueprintResources {

    private final Path root;

    /// @param root the resources root, not null
    public BlueprintResources(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public Path getRoot() {
        return root;
    }

    /// Reads a resource.
    ///
    /// @param resourcePath path relative to the root, not null
    /// @return the file content, never null
    /// @throws NotFoundException if the resource does not exist
    /// @throws StorageException if the file cannot be read
    public byte[] read(String resourcePath) {
        Path path = resolve(resourcePath);
        try {
            return Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            throw new NotFoundException("Resource " + resourcePath + " does not exist", e);
        } catch (IOException e) {
            throw new StorageException("Failed to read resource " + resourcePath, e);
        }
    }

    /// Copies a resource to a file.
    ///
    /// Without a target a temporary file is created whose name ends with `-<resource name>`.
    ///
    /// @param resourcePath path relative to the root, not null
    /// @param targetPath destination, or null for a fresh temporary file
    /// @return the written file, never null
    /// @throws NotFoundException if the resource does not exist
    /// @throws StorageException if the copy fails
    public Path download(String resourcePath, Path targetPath) {
        byte[] content = read(resourcePath);
        try {
            Path target = targetPath;
            if (target == null) {
                String suffix = "-" + resolve(resourcePath).getFileName();
                target = Files.createTempFile(null, suffix);
            }
            return Files.write(target, content);
        } catch (IOException e) {
            throw new StorageException("Failed to download resource " + resourcePath, e);
        }
    }

    private Path resolve(String resourcePath) {
        Path path = root.resolve(resourcePath).normalize();
        if (!path.startsWith(root)) {
            throw new NotFoundException(
                    "Resource " + resourcePath + " is outside of resources root " + root);
        }
        return path;
    }
}
