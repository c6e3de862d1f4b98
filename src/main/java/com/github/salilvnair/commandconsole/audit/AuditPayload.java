package com.github.salilvnair.commandconsole.audit;

import com.github.salilvnair.commandconsole.intent.FieldFilter;
import com.github.salilvnair.commandconsole.intent.IntentSource;
import com.github.salilvnair.commandconsole.intent.IntentType;
import com.github.salilvnair.commandconsole.plan.PlanStatus;
import com.github.salilvnair.commandconsole.risk.RiskLevel;

import java.util.List;
import java.util.Map;

/**
 * Typed audit payload, one record per {@link AuditStage}.
 */
public interface AuditPayload {

    AuditStage stage();

    record IntentExtracted(String message,
                           IntentType intentType,
                           String entity,
                           List<FieldFilter> filters,
                           Map<String, Object> values,
                           double confidence,
                           boolean ambiguous,
                           IntentSource source) implements AuditPayload {
        @Override
        public AuditStage stage() {
            return AuditStage.INTENT_EXTRACTED;
        }
    }

    record ClarificationRequested(String question, double confidence) implements AuditPayload {
        @Override
        public AuditStage stage() {
            return AuditStage.CLARIFICATION_REQUESTED;
        }
    }

    record PermissionDenied(String reason, IntentType intentType, String entity) implements AuditPayload {
        @Override
        public AuditStage stage() {
            return AuditStage.PERMISSION_DENIED;
        }
    }

    record PlanCreated(PlanStatus status,
                       long impactCount,
                       RiskLevel riskLevel,
                       boolean requiresSecondFactor,
                       int previewRows) implements AuditPayload {
        @Override
        public AuditStage stage() {
            return AuditStage.PLAN_CREATED;
        }
    }

    record ApprovalGranted(String comment,
                           boolean secondFactorVerified,
                           List<Long> approvedIds,
                           List<Long> rejectedIds) implements AuditPayload {
        @Override
        public AuditStage stage() {
            return AuditStage.APPROVAL_GRANTED;
        }
    }

    record ApprovalRejected(String comment) implements AuditPayload {
        @Override
        public AuditStage stage() {
            return AuditStage.APPROVAL_REJECTED;
        }
    }

    record Executed(IntentType intentType, int affectedRows, Map<String, Object> analysis) implements AuditPayload {
        @Override
        public AuditStage stage() {
            return AuditStage.EXECUTED;
        }
    }

    record ExecutionFailed(String errorCode, String message) implements AuditPayload {
        @Override
        public AuditStage stage() {
            return AuditStage.EXECUTION_FAILED;
        }
    }

    record RolledBack(String originalExecutionId, int restoredRows) implements AuditPayload {
        @Override
        public AuditStage stage() {
            return AuditStage.ROLLED_BACK;
        }
    }
}
