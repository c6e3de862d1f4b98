package com.github.salilvnair.commandconsole.service;

import com.github.salilvnair.commandconsole.approval.ApprovalDecisionType;
import com.github.salilvnair.commandconsole.approval.ApprovalWorkflow;
import com.github.salilvnair.commandconsole.audit.AuditQuery;
import com.github.salilvnair.commandconsole.audit.AuditQueryService;
import com.github.salilvnair.commandconsole.config.CommandConsolePipelineConfig;
import com.github.salilvnair.commandconsole.entity.CcApprovalDecision;
import com.github.salilvnair.commandconsole.entity.CcAuditEvent;
import com.github.salilvnair.commandconsole.entity.CcExecution;
import com.github.salilvnair.commandconsole.entity.CcPlan;
import com.github.salilvnair.commandconsole.execution.RollbackEngine;
import com.github.salilvnair.commandconsole.execution.RowScope;
import com.github.salilvnair.commandconsole.plan.PlanOrchestrator;
import com.github.salilvnair.commandconsole.plan.PlanOutcome;
import com.github.salilvnair.commandconsole.plan.PlanStatus;
import com.github.salilvnair.commandconsole.repo.PlanRepository;
import com.github.salilvnair.commandconsole.risk.RiskLevel;
import com.github.salilvnair.commandconsole.security.Actor;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point for the surrounding application.
 */
@Service
@RequiredArgsConstructor
public class CommandConsoleService {

    private final PlanOrchestrator planOrchestrator;
    private final ApprovalWorkflow approvalWorkflow;
    private final RollbackEngine rollbackEngine;
    private final AuditQueryService auditQueryService;
    private final PlanRepository planRepository;
    private final CommandConsolePipelineConfig pipelineConfig;

    public PlanOutcome submit(String message, Actor actor) {
        return planOrchestrator.submit(message, actor);
    }

    public PlanOutcome submit(String message, Actor actor, String clarification) {
        return planOrchestrator.submit(message, actor, clarification);
    }

    public CcExecution confirm(String planId, Actor actor) {
        return planOrchestrator.confirm(planId, actor);
    }

    public PlanOutcome approve(String planId, Actor approver, ApprovalDecisionType decision) {
        return approvalWorkflow.decide(planId, approver, decision, null, null);
    }

    public PlanOutcome approve(String planId,
                               Actor approver,
                               ApprovalDecisionType decision,
                               String comment,
                               String secondFactorCode) {
        return approvalWorkflow.decide(planId, approver, decision, comment, secondFactorCode);
    }

    /**
     * Approves only some of the previewed rows. Rows in {@code rejectedIds} are left untouched and,
     * when {@code approvedIds} is not empty, so is every row outside it.
     */
    public PlanOutcome approveRows(String planId,
                                   Actor approver,
                                   List<Long> approvedIds,
                                   List<Long> rejectedIds,
                                   String comment,
                                   String secondFactorCode) {
        return approvalWorkflow.decide(planId, approver, ApprovalDecisionType.APPROVE, comment, secondFactorCode,
                RowScope.of(approvedIds, rejectedIds));
    }

    public CcExecution rollback(String executionId, Actor actor) {
        return rollbackEngine.rollback(executionId, actor);
    }

    public List<CcApprovalDecision> approvalHistory(String planId) {
        return approvalWorkflow.decisions(planId);
    }

    public List<CcAuditEvent> queryAudit(AuditQuery query, Actor viewer) {
        return auditQueryService.query(query, viewer);
    }

    public List<CcAuditEvent> auditTrail(String planId) {
        return auditQueryService.planTrail(planId);
    }

    public List<CcPlan> pendingApprovals(Actor viewer) {
        if (!pipelineConfig.isSenior(viewer.role())) {
            return List.of();
        }
        return planRepository.findByStatusOrderByCreatedAtAsc(PlanStatus.AWAITING_APPROVAL);
    }

    public ConsoleStats stats() {
        Map<PlanStatus, Long> byStatus = new EnumMap<>(PlanStatus.class);
        for (PlanStatus status : PlanStatus.values()) {
            byStatus.put(status, planRepository.countByStatus(status));
        }
        Map<RiskLevel, Long> byRisk = new EnumMap<>(RiskLevel.class);
        for (RiskLevel risk : RiskLevel.values()) {
            byRisk.put(risk, planRepository.countByRiskLevel(risk));
        }
        return new ConsoleStats(byStatus, byRisk);
    }
}
