package com.github.salilvnair.commandconsole.approval;

import com.github.salilvnair.commandconsole.audit.AuditEntry;
import com.github.salilvnair.commandconsole.audit.AuditLog;
import com.github.salilvnair.commandconsole.audit.AuditPayload;
import com.github.salilvnair.commandconsole.config.CommandConsolePipelineConfig;
import com.github.salilvnair.commandconsole.entity.CcApprovalDecision;
import com.github.salilvnair.commandconsole.entity.CcExecution;
import com.github.salilvnair.commandconsole.entity.CcPlan;
import com.github.salilvnair.commandconsole.exception.CommandConsoleErrorCode;
import com.github.salilvnair.commandconsole.exception.CommandConsoleException;
import com.github.salilvnair.commandconsole.execution.ExecutionEngine;
import com.github.salilvnair.commandconsole.execution.RowScope;
import com.github.salilvnair.commandconsole.intent.IntentType;
import com.github.salilvnair.commandconsole.plan.PlanIntents;
import com.github.salilvnair.commandconsole.plan.PlanLocks;
import com.github.salilvnair.commandconsole.plan.PlanOrchestrator;
import com.github.salilvnair.commandconsole.plan.PlanOutcome;
import com.github.salilvnair.commandconsole.plan.PlanStatus;
import com.github.salilvnair.commandconsole.repo.ApprovalDecisionRepository;
import com.github.salilvnair.commandconsole.repo.PlanRepository;
import com.github.salilvnair.commandconsole.security.Actor;
import com.github.salilvnair.commandconsole.util.JsonUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.concurrent.locks.Lock;

@Slf4j
@Component
@RequiredArgsConstructor
public class ApprovalWorkflow {

    private final PlanOrchestrator planOrchestrator;
    private final PlanRepository planRepository;
    private final ApprovalDecisionRepository approvalDecisionRepository;
    private final ExecutionEngine executionEngine;
    private final SecondFactorVerifier secondFactorVerifier;
    private final AuditLog auditLog;
    private final CommandConsolePipelineConfig pipelineConfig;
    private final PlanLocks planLocks;

    public PlanOutcome decide(String planId,
                              Actor approver,
                              ApprovalDecisionType decision,
                              String comment,
                              String secondFactorCode) {
        return decide(planId, approver, decision, comment, secondFactorCode, RowScope.wholePlan());
    }

    /**
     * Resolves an awaiting_approval plan. APPROVE executes it over the rows {@code scope} admits,
     * REJECT closes it as rejected. Decisions on one plan are serialized with its execution.
     */
    public PlanOutcome decide(String planId,
                              Actor approver,
                              ApprovalDecisionType decision,
                              String comment,
                              String secondFactorCode,
                              RowScope scope) {
        Lock lock = planLocks.forPlan(planId);
        lock.lock();
        try {
            CcPlan plan = planOrchestrator.reload(planId);
            if (plan.getStatus() != PlanStatus.AWAITING_APPROVAL) {
                throw new CommandConsoleException(
                        CommandConsoleErrorCode.PLAN_NOT_EXECUTABLE,
                        "Plan " + planId + " is " + plan.getStatus().code() + ", not awaiting approval"
                );
            }
            if (!pipelineConfig.isSenior(approver.role())) {
                throw new CommandConsoleException(CommandConsoleErrorCode.APPROVAL_NOT_PERMITTED);
            }
            IntentType type = PlanIntents.intent(plan).type();
            if (scope.isPartial() && type != IntentType.UPDATE && type != IntentType.DELETE) {
                throw new CommandConsoleException(
                        CommandConsoleErrorCode.APPROVAL_SCOPE_INVALID,
                        "Plan " + planId + " is a " + type + " and cannot be approved row by row"
                );
            }
            boolean secondFactorVerified = secondFactorCode != null && secondFactorVerifier.verify(approver, plan, secondFactorCode);
            if (decision == ApprovalDecisionType.APPROVE && plan.isRequiresSecondFactor() && !secondFactorVerified) {
                throw new CommandConsoleException(CommandConsoleErrorCode.SECOND_FACTOR_REQUIRED);
            }

            approvalDecisionRepository.save(CcApprovalDecision.builder()
                    .planId(planId)
                    .reviewerId(approver.userId())
                    .reviewerRole(approver.role())
                    .decision(decision)
                    .comment(comment)
                    .approvedIds(JsonUtil.toJson(scope.approvedIds()))
                    .rejectedIds(JsonUtil.toJson(scope.rejectedIds()))
                    .secondFactorVerified(secondFactorVerified)
                    .decidedAt(OffsetDateTime.now())
                    .build());

            if (decision == ApprovalDecisionType.REJECT) {
                plan.transitionTo(PlanStatus.REJECTED, "APPROVAL_REJECTED");
                plan = planRepository.save(plan);
                log.info("Plan rejected by approver planId={} approver={}", planId, approver.userId());
                auditLog.append(AuditEntry.forPlan(plan, approver, new AuditPayload.ApprovalRejected(comment)));
                return PlanOutcome.pending(plan);
            }

            log.info("Plan approved planId={} approver={} approvedRows={} rejectedRows={}",
                    planId, approver.userId(), scope.approvedIds().size(), scope.rejectedIds().size());
            auditLog.append(AuditEntry.forPlan(plan, approver, new AuditPayload.ApprovalGranted(
                    comment, secondFactorVerified, scope.approvedIds(), scope.rejectedIds())));
            CcExecution execution = executionEngine.execute(planId, approver, scope);
            return new PlanOutcome(planOrchestrator.reload(planId), execution);
        }
        finally {
            lock.unlock();
        }
    }

    public List<CcApprovalDecision> decisions(String planId) {
        return approvalDecisionRepository.findByPlanIdOrderByDecidedAtAsc(planId);
    }
}
