package com.github.salilvnair.commandconsole.audit;

import com.github.salilvnair.commandconsole.entity.CcPlan;
import com.github.salilvnair.commandconsole.risk.RiskLevel;
import com.github.salilvnair.commandconsole.security.Actor;

public record AuditEntry(
        String planId,
        String executionId,
        String actorId,
        String actorRole,
        RiskLevel riskLevel,
        String entity,
        AuditPayload payload
) {

    public static AuditEntry forPlan(CcPlan plan, Actor actor, AuditPayload payload) {
        return new AuditEntry(
                plan.getPlanId(),
                null,
                actor.userId(),
                actor.role(),
                plan.getRiskLevel(),
                plan.getEntity(),
                payload
        );
    }

    public AuditEntry withExecution(String id) {
        return new AuditEntry(planId, id, actorId, actorRole, riskLevel, entity, payload);
    }

    public AuditStage stage() {
        return payload.stage();
    }
}
