package com.github.salilvnair.commandconsole.plan;

import com.github.salilvnair.commandconsole.audit.AuditEntry;
import com.github.salilvnair.commandconsole.audit.AuditLog;
import com.github.salilvnair.commandconsole.audit.AuditPayload;
import com.github.salilvnair.commandconsole.config.CommandConsolePipelineConfig;
import com.github.salilvnair.commandconsole.entity.CcExecution;
import com.github.salilvnair.commandconsole.entity.CcPlan;
import com.github.salilvnair.commandconsole.exception.CommandConsoleErrorCode;
import com.github.salilvnair.commandconsole.exception.CommandConsoleException;
import com.github.salilvnair.commandconsole.execution.ExecutionEngine;
import com.github.salilvnair.commandconsole.impact.ImpactEstimator;
import com.github.salilvnair.commandconsole.intent.Intent;
import com.github.salilvnair.commandconsole.intent.IntentNormalizer;
import com.github.salilvnair.commandconsole.intent.NormalizationRequest;
import com.github.salilvnair.commandconsole.preview.PlanPreview;
import com.github.salilvnair.commandconsole.preview.PreviewBuilder;
import com.github.salilvnair.commandconsole.registry.EntityDescriptor;
import com.github.salilvnair.commandconsole.registry.EntityRegistry;
import com.github.salilvnair.commandconsole.repo.PlanRepository;
import com.github.salilvnair.commandconsole.risk.RiskClassifier;
import com.github.salilvnair.commandconsole.risk.RiskLevel;
import com.github.salilvnair.commandconsole.security.Actor;
import com.github.salilvnair.commandconsole.security.PermissionDecision;
import com.github.salilvnair.commandconsole.security.PermissionGate;
import com.github.salilvnair.commandconsole.util.ConsoleIds;
import com.github.salilvnair.commandconsole.util.JsonUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * Runs a message through normalization, clarification gate, permission gate, impact, risk and
 * preview, persists the plan and hands ready plans to the execution engine.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PlanOrchestrator {

    static final String DEFAULT_CLARIFICATION =
            "Could you describe which records you mean and what should happen to them?";

    private final IntentNormalizer intentNormalizer;
    private final EntityRegistry entityRegistry;
    private final PermissionGate permissionGate;
    private final ImpactEstimator impactEstimator;
    private final RiskClassifier riskClassifier;
    private final PreviewBuilder previewBuilder;
    private final ExecutionEngine executionEngine;
    private final PlanRepository planRepository;
    private final AuditLog auditLog;
    private final CommandConsolePipelineConfig pipelineConfig;

    public PlanOutcome submit(String message, Actor actor) {
        Intent intent = intentNormalizer.normalize(new NormalizationRequest(message, actor));
        CcPlan plan = newPlan(message, actor, intent);
        auditLog.append(AuditEntry.forPlan(plan, actor, new AuditPayload.IntentExtracted(
                message,
                intent.type(),
                intent.entity(),
                intent.filters(),
                intent.values(),
                intent.confidence(),
                intent.ambiguous(),
                intent.source()
        )));

        if (intent.ambiguous() || intent.confidence() < pipelineConfig.getConfidenceThreshold() || intent.type() == null || intent.entity() == null) {
            String question = intent.clarificationQuestion() == null || intent.clarificationQuestion().isBlank()
                    ? DEFAULT_CLARIFICATION
                    : intent.clarificationQuestion();
            plan.setClarificationQuestion(question);
            plan.transitionTo(PlanStatus.CLARIFICATION_REQUIRED, CommandConsoleErrorCode.CLARIFICATION_NEEDED.name());
            plan = planRepository.save(plan);
            log.info("Clarification required planId={} confidence={} ambiguous={}", plan.getPlanId(), intent.confidence(), intent.ambiguous());
            auditLog.append(AuditEntry.forPlan(plan, actor, new AuditPayload.ClarificationRequested(question, intent.confidence())));
            return PlanOutcome.pending(plan);
        }

        EntityDescriptor entity = entityRegistry.require(intent.entity());
        PermissionDecision decision = permissionGate.check(actor, intent, entity);
        if (!decision.allowed()) {
            plan.transitionTo(PlanStatus.REJECTED, decision.reason());
            plan = planRepository.save(plan);
            log.warn("Permission denied planId={} role={} type={} entity={} reason={}",
                    plan.getPlanId(), actor.role(), intent.type(), entity.name(), decision.reason());
            auditLog.append(AuditEntry.forPlan(plan, actor, new AuditPayload.PermissionDenied(decision.reason(), intent.type(), entity.name())));
            return PlanOutcome.pending(plan);
        }

        Intent scoped = decision.narrow(intent);
        long impact = impactEstimator.estimate(entity, scoped);
        RiskLevel risk = riskClassifier.classify(scoped.type(), entity.sensitive(), impact);
        PlanPreview preview = previewBuilder.build(entity, scoped, impact, risk);

        plan.setIntentJson(JsonUtil.toJson(scoped));
        plan.setImpactCount(impact);
        plan.setRiskLevel(risk);
        plan.setPreviewJson(JsonUtil.toJson(preview));
        plan.setRequiresSecondFactor(risk == RiskLevel.HIGH && pipelineConfig.isRequireSecondFactorForHighRisk());
        plan.transitionTo(statusFor(risk), null);
        plan = planRepository.save(plan);
        log.info("Plan created planId={} type={} entity={} impact={} risk={} status={}",
                plan.getPlanId(), scoped.type(), entity.name(), impact, risk, plan.getStatus().code());
        auditLog.append(AuditEntry.forPlan(plan, actor, new AuditPayload.PlanCreated(
                plan.getStatus(),
                impact,
                risk,
                plan.isRequiresSecondFactor(),
                preview.affectedRows().size()
        )));

        if (plan.getStatus() != PlanStatus.READY) {
            return PlanOutcome.pending(plan);
        }
        try {
            CcExecution execution = executionEngine.execute(plan.getPlanId(), actor);
            return new PlanOutcome(reload(plan.getPlanId()), execution);
        }
        catch (CommandConsoleException e) {
            if (e.is(CommandConsoleErrorCode.IMPACT_CONFLICT) || e.is(CommandConsoleErrorCode.EXECUTION_FAILED)) {
                return PlanOutcome.pending(reload(plan.getPlanId()));
            }
            throw e;
        }
    }

    /**
     * Follow-up to a clarification request. The original plan stays as it was; the combined
     * text goes through the whole pipeline again as a new plan.
     */
    public PlanOutcome submit(String message, Actor actor, String clarification) {
        if (clarification == null || clarification.isBlank()) {
            return submit(message, actor);
        }
        return submit(message + "\nClarification: " + clarification.trim(), actor);
    }

    public CcExecution confirm(String planId, Actor actor) {
        CcPlan plan = reload(planId);
        if (plan.getStatus() != PlanStatus.AWAITING_CONFIRMATION) {
            throw new CommandConsoleException(
                    CommandConsoleErrorCode.PLAN_NOT_EXECUTABLE,
                    "Plan " + planId + " is " + plan.getStatus().code() + ", not awaiting confirmation"
            );
        }
        if (!Objects.equals(actor.userId(), plan.getRequesterId()) && !pipelineConfig.isSenior(actor.role())) {
            throw new CommandConsoleException(CommandConsoleErrorCode.CONFIRMATION_NOT_PERMITTED);
        }
        return executionEngine.execute(planId, actor);
    }

    public CcPlan reload(String planId) {
        return planRepository.findByPlanId(planId)
                .orElseThrow(() -> new CommandConsoleException(CommandConsoleErrorCode.PLAN_NOT_FOUND, "Plan " + planId + " not found"));
    }

    private CcPlan newPlan(String message, Actor actor, Intent intent) {
        OffsetDateTime now = OffsetDateTime.now();
        return CcPlan.builder()
                .planId(ConsoleIds.planId())
                .requesterId(actor.userId())
                .requesterRole(actor.role())
                .requesterDepartment(actor.department())
                .message(message)
                .intentType(intent.type())
                .entity(intent.entity())
                .intentJson(JsonUtil.toJson(intent))
                .confidence(intent.confidence())
                .ambiguous(intent.ambiguous())
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    private static PlanStatus statusFor(RiskLevel risk) {
        return switch (risk) {
            case LOW -> PlanStatus.READY;
            case MEDIUM -> PlanStatus.AWAITING_CONFIRMATION;
            case HIGH -> PlanStatus.AWAITING_APPROVAL;
        };
    }
}
