package com.github.salilvnair.commandconsole.preview;

import com.github.salilvnair.commandconsole.intent.IntentType;
import com.github.salilvnair.commandconsole.risk.RiskLevel;

import java.util.List;
import java.util.Map;

/**
 * Human review material for a plan. {@code affectedRows} holds at most the configured
 * preview row count; {@code truncated} tells whether more rows match.
 */
public record PlanPreview(
        String entity,
        IntentType intentType,
        long impactCount,
        RiskLevel riskLevel,
        List<Map<String, Object>> affectedRows,
        boolean truncated,
        List<ProposedChange> proposedChanges,
        RollbackPlan rollbackPlan
) {

    public PlanPreview {
        affectedRows = affectedRows == null ? List.of() : List.copyOf(affectedRows);
        proposedChanges = proposedChanges == null ? List.of() : List.copyOf(proposedChanges);
    }
}
