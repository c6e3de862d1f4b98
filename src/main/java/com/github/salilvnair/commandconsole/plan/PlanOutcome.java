package com.github.salilvnair.commandconsole.plan;

import com.github.salilvnair.commandconsole.entity.CcExecution;
import com.github.salilvnair.commandconsole.entity.CcPlan;

import java.util.Optional;

/**
 * A plan and, when it ran, its execution.
 */
public record PlanOutcome(CcPlan plan, CcExecution execution) {

    public static PlanOutcome pending(CcPlan plan) {
        return new PlanOutcome(plan, null);
    }

    public PlanStatus status() {
        return plan.getStatus();
    }

    public Optional<CcExecution> executionIfAny() {
        return Optional.ofNullable(execution);
    }
}
