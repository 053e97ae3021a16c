package io.plinth.core.exception;

import java.io.Serial;

/// Unchecked exception for storage and resource I/O failures.
///
/// Wraps {@link java.io.IOException} to avoid checked exception propagation through the
/// {@link io.plinth.core.storage.InstanceStore} interface, which only declares the
/// recoverable {@link StorageConflictException}.
public class StorageException extends RuntimeException {

    @Serial private static final long serialVersionUID = -4471029675238855012L;

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }

    public StorageException(String message) {
        super(message);
    }
}
