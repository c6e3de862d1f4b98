package com.github.salilvnair.commandconsole.exception;

public enum CommandConsoleErrorCode {

    // =========================
    // Intent / clarification
    // =========================
    CLARIFICATION_NEEDED(
            "Intent is ambiguous, execution has been paused",
            true
    ),

    INVALID_FILTER(
            "Filter or value cannot be applied to the target entity",
            false
    ),

    // =========================
    // Inference service (absorbed by the fallback strategy)
    // =========================
    INFERENCE_UNAVAILABLE(
            "Intent inference service is not configured",
            true
    ),

    INFERENCE_TIMEOUT(
            "Intent inference call timed out",
            true
    ),

    INFERENCE_FAILED(
            "Intent inference call failed",
            true
    ),

    INFERENCE_INVALID_RESPONSE(
            "Intent inference service returned an invalid response",
            true
    ),

    // =========================
    // Authorization
    // =========================
    PERMISSION_DENIED(
            "Role is not permitted to perform this operation",
            false
    ),

    CONFIRMATION_NOT_PERMITTED(
            "Only the requester or a senior role may confirm this plan",
            false
    ),

    APPROVAL_NOT_PERMITTED(
            "Senior approval is required for this plan",
            false
    ),

    SECOND_FACTOR_REQUIRED(
            "A verified second factor is required to approve this plan",
            true
    ),

    ROLLBACK_NOT_PERMITTED(
            "Only a senior role or the executing actor may roll back this execution",
            false
    ),

    // =========================
    // Configuration
    // =========================
    UNKNOWN_ENTITY(
            "Entity is not registered",
            false
    ),

    REGISTRY_LOAD_FAILED(
            "Failed to load command console configuration",
            false
    ),

    // =========================
    // Plan / execution lifecycle
    // =========================
    PLAN_NOT_FOUND(
            "Plan not found",
            false
    ),

    PLAN_NOT_EXECUTABLE(
            "Plan is not in an executable status",
            false
    ),

    ILLEGAL_STATUS_TRANSITION(
            "Plan status cannot move backwards",
            false
    ),

    IMPACT_CONFLICT(
            "Affected row count changed since the plan was previewed",
            true
    ),

    APPROVAL_SCOPE_INVALID(
            "Approved and rejected rows must be distinct rows of an update or delete plan",
            false
    ),

    EXECUTION_FAILED(
            "Execution failed and was rolled back",
            false
    ),

    EXECUTION_NOT_FOUND(
            "Execution not found",
            false
    ),

    ROLLBACK_CONFLICT(
            "Execution cannot be rolled back",
            false
    ),

    // =========================
    // Audit
    // =========================
    AUDIT_SAVE_FAILED(
            "Failed to save audit record",
            false
    ),

    // =========================
    // Fallback
    // =========================
    INTERNAL_ERROR(
            "Internal command console error",
            false
    );

    private final String defaultMessage;
    private final boolean recoverable;

    CommandConsoleErrorCode(String defaultMessage, boolean recoverable) {
        this.defaultMessage = defaultMessage;
        this.recoverable = recoverable;
    }

    public String defaultMessage() {
        return defaultMessage;
    }

    public boolean recoverable() {
        return recoverable;
    }
}
