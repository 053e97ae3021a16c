package io.plinth.core.exception;

import java.io.Serial;

/// Thrown when a runtime-properties update is submitted against a stale version.
///
/// Nothing was written and the stored version is unchanged. The condition is expected under
/// concurrent property writers: reload the node instance and resubmit against its current
/// version.
///
/// @see io.plinth.core.storage.InstanceStore#updateNodeInstance
public class StorageConflictException extends Exception {

    @Serial private static final long serialVersionUID = 7702468152386090311L;

    private final String nodeInstanceId;
    private final long expectedVersion;
    private final long currentVersion;

    /// Creates a conflict for the given instance.
    ///
    /// @param nodeInstanceId the instance whose update was rejected, not null
    /// @param expectedVersion the version the caller submitted
    /// @param currentVersion the version currently stored
    public StorageConflictException(
            String nodeInstanceId, long expectedVersion, long currentVersion) {
        super(
                "version "
                        + expectedVersion
                        + " does not match current version of node instance "
                        + nodeInstanceId
                        + " which is "
                        + currentVersion);
        this.nodeInstanceId = nodeInstanceId;
        this.expectedVersion = expectedVersion;
        this.currentVersion = currentVersion;
    }

    public String getNodeInstanceId() {
        return nodeInstanceId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getCurrentVersion() {
        return currentVersion;
    }
}
