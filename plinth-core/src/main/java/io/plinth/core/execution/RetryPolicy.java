package io.plinth.core.execution;

import java.time.Duration;
import java.util.Objects;

/// Task retry settings passed through to workflow implementations.
///
/// The engine does not interpret these values; it only hands them over in the
/// {@link ExecutionContext}.
///
/// @param taskRetries maximum retries per task, `-1` for unlimited
/// @param taskRetryInterval pause between retries, not null
public record RetryPolicy(int taskRetries, Duration taskRetryInterval) {

    /// Unlimited retries, 30 seconds apart.
    public static final RetryPolicy DEFAULT = new RetryPolicy(-1, Duration.ofSeconds(30));

    public RetryPolicy {
        Objects.requireNonNull(taskRetryInterval, "taskRetryInterval must not be null");
        if (taskRetries < -1) {
            throw new IllegalArgumentException("taskRetries must be -1 or greater: " + taskRetries);
        }
    }

    public boolean isUnlimited() {
        return taskRetries == -1;
    }
}
