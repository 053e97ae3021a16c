package io.plinth.core.exception;

import java.io.Serial;

/// Thrown when a workflow, node, node instance or blueprint resource does not exist.
public class NotFoundException extends RuntimeException {

    @Serial private static final long serialVersionUID = -1850473281963907164L;

    public NotFoundException(String message) {
        super(message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
