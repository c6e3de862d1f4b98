package com.github.salilvnair.commandconsole.audit;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AuditStage {
    INTENT_EXTRACTED,
    CLARIFICATION_REQUESTED,
    PERMISSION_DENIED,
    PLAN_CREATED,
    APPROVAL_GRANTED,
    APPROVAL_REJECTED,
    EXECUTED,
    EXECUTION_FAILED,
    ROLLED_BACK;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
