package com.github.salilvnair.commandconsole.plan;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

public enum PlanStatus {
    CLARIFICATION_REQUIRED("clarification_required"),
    REJECTED("rejected"),
    READY("ready"),
    AWAITING_CONFIRMATION("awaiting_confirmation"),
    AWAITING_APPROVAL("awaiting_approval"),
    EXECUTED("executed"),
    FAILED("failed");

    private static final Map<PlanStatus, Set<PlanStatus>> TRANSITIONS = Map.of(
            CLARIFICATION_REQUIRED, EnumSet.noneOf(PlanStatus.class),
            REJECTED, EnumSet.noneOf(PlanStatus.class),
            READY, EnumSet.of(EXECUTED, FAILED),
            AWAITING_CONFIRMATION, EnumSet.of(EXECUTED, FAILED),
            AWAITING_APPROVAL, EnumSet.of(EXECUTED, FAILED, REJECTED),
            EXECUTED, EnumSet.noneOf(PlanStatus.class),
            FAILED, EnumSet.noneOf(PlanStatus.class)
    );

    private final String code;

    PlanStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public boolean isExecutable() {
        return this == READY || this == AWAITING_CONFIRMATION || this == AWAITING_APPROVAL;
    }

    public boolean canTransitionTo(PlanStatus next) {
        return next != null && TRANSITIONS.get(this).contains(next);
    }
}
