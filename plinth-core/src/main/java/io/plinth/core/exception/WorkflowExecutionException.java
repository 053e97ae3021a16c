package io.plinth.core.exception;

import java.io.Serial;

/// Thrown when a workflow implementation fails with a checked exception.
///
/// Unchecked failures of the implementation propagate unchanged.
public class WorkflowExecutionException extends Exception {

    @Serial private static final long serialVersionUID = 5018623348871265529L;

    private final String workflowId;
    private final String executionId;

    public WorkflowExecutionException(
            String workflowId, String executionId, Throwable cause) {
        super(
                "Workflow '"
                        + workflowId
                        + "' failed [execution="
                        + executionId
                        + "]: "
                        + cause.getMessage(),
                cause);
        this.workflowId = workflowId;
        this.executionId = executionId;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public String getExecutionId() {
        return executionId;
    }
}
