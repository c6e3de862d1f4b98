package com.github.salilvnair.commandconsole.execution;

import com.github.salilvnair.commandconsole.audit.AuditEntry;
import com.github.salilvnair.commandconsole.audit.AuditLog;
import com.github.salilvnair.commandconsole.audit.AuditPayload;
import com.github.salilvnair.commandconsole.data.EntityRepository;
import com.github.salilvnair.commandconsole.entity.CcExecution;
import com.github.salilvnair.commandconsole.entity.CcPlan;
import com.github.salilvnair.commandconsole.exception.CommandConsoleErrorCode;
import com.github.salilvnair.commandconsole.exception.CommandConsoleException;
import com.github.salilvnair.commandconsole.intent.FieldFilter;
import com.github.salilvnair.commandconsole.intent.Intent;
import com.github.salilvnair.commandconsole.intent.IntentType;
import com.github.salilvnair.commandconsole.plan.PlanIntents;
import com.github.salilvnair.commandconsole.plan.PlanLocks;
import com.github.salilvnair.commandconsole.plan.PlanStatus;
import com.github.salilvnair.commandconsole.registry.EntityDescriptor;
import com.github.salilvnair.commandconsole.registry.EntityRegistry;
import com.github.salilvnair.commandconsole.repo.ExecutionRepository;
import com.github.salilvnair.commandconsole.repo.PlanRepository;
import com.github.salilvnair.commandconsole.security.Actor;
import com.github.salilvnair.commandconsole.util.ConsoleIds;
import com.github.salilvnair.commandconsole.util.JsonUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.Lock;

/**
 * Applies a plan's mutation in one transaction, capturing before and after snapshots.
 * Callers are responsible for confirmation and approval checks.
 */
@Slf4j
@Component
public class ExecutionEngine {

    private final PlanRepository planRepository;
    private final ExecutionRepository executionRepository;
    private final EntityRegistry entityRegistry;
    private final EntityRepository entityRepository;
    private final AuditLog auditLog;
    private final PlanLocks planLocks;
    private final TransactionTemplate transactionTemplate;

    public ExecutionEngine(PlanRepository planRepository,
                           ExecutionRepository executionRepository,
                           EntityRegistry entityRegistry,
                           EntityRepository entityRepository,
                           AuditLog auditLog,
                           PlanLocks planLocks,
                           PlatformTransactionManager transactionManager) {
        this.planRepository = planRepository;
        this.executionRepository = executionRepository;
        this.entityRegistry = entityRegistry;
        this.entityRepository = entityRepository;
        this.auditLog = auditLog;
        this.planLocks = planLocks;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    public CcExecution execute(String planId, Actor actor) {
        return execute(planId, actor, RowScope.wholePlan());
    }

    /**
     * Runs the plan over the rows {@code scope} admits. A partial scope applies to UPDATE and DELETE only.
     */
    public CcExecution execute(String planId, Actor actor, RowScope scope) {
        Lock lock = planLocks.forPlan(planId);
        lock.lock();
        try {
            CcPlan plan = planRepository.findByPlanId(planId)
                    .orElseThrow(() -> new CommandConsoleException(CommandConsoleErrorCode.PLAN_NOT_FOUND, "Plan " + planId + " not found"));
            if (plan.getStatus() == null || !plan.getStatus().isExecutable()) {
                throw new CommandConsoleException(
                        CommandConsoleErrorCode.PLAN_NOT_EXECUTABLE,
                        "Plan " + planId + " is " + (plan.getStatus() == null ? "unknown" : plan.getStatus().code())
                );
            }
            if (executionRepository.existsByPlanIdAndStatusAndRollbackOfExecutionIdIsNull(planId, ExecutionStatus.EXECUTED)) {
                throw new CommandConsoleException(CommandConsoleErrorCode.PLAN_NOT_EXECUTABLE, "Plan " + planId + " already has an active execution");
            }
            Intent intent = PlanIntents.intent(plan);
            if (scope.isPartial() && intent.type() != IntentType.UPDATE && intent.type() != IntentType.DELETE) {
                throw new CommandConsoleException(
                        CommandConsoleErrorCode.APPROVAL_SCOPE_INVALID,
                        "Plan " + planId + " is a " + intent.type() + " and cannot be approved row by row"
                );
            }
            EntityDescriptor entity = entityRegistry.require(plan.getEntity());
            PlanStatus statusBefore = plan.getStatus();

            CcExecution execution;
            try {
                // the executed audit event commits or rolls back with the mutation
                execution = transactionTemplate.execute(tx -> {
                    CcExecution applied = apply(plan, intent, entity, actor, scope);
                    auditLog.append(AuditEntry.forPlan(plan, actor, new AuditPayload.Executed(
                            intent.type(),
                            JsonUtil.toRows(applied.getAfterState()).size(),
                            applied.getAnalysisJson() == null ? null : JsonUtil.toMap(applied.getAnalysisJson())
                    )).withExecution(applied.getExecutionId()));
                    return applied;
                });
            }
            catch (RuntimeException e) {
                CommandConsoleException failure = asFailure(planId, e);
                markFailed(plan, statusBefore, actor, failure);
                throw failure;
            }

            log.info("Executed plan planId={} executionId={} type={} entity={} rows={}",
                    planId, execution.getExecutionId(), intent.type(), entity.name(), plan.getImpactCount());
            return execution;
        }
        finally {
            lock.unlock();
        }
    }

    private CcExecution apply(CcPlan plan, Intent intent, EntityDescriptor entity, Actor actor, RowScope scope) {
        List<Map<String, Object>> before = List.of();
        if (intent.type() != IntentType.CREATE) {
            List<Map<String, Object>> matched = entityRepository.select(entity, scope.restrict(entity, intent.filters()));
            long expected = scope.expectedRows(plan.getImpactCount() == null ? 0L : plan.getImpactCount());
            if (matched.size() != expected) {
                throw new CommandConsoleException(
                        CommandConsoleErrorCode.IMPACT_CONFLICT,
                        "Plan " + plan.getPlanId() + " expected " + expected + " rows but " + matched.size() + " match now"
                ).withMetaData(Map.of("expected", expected, "actual", matched.size()));
            }
            before = scope.withoutRejected(entity, matched);
        }

        List<Map<String, Object>> after;
        Map<String, Object> analysis = null;
        switch (intent.type()) {
            case CREATE -> after = List.of(entityRepository.insert(entity, intent.values()));
            case UPDATE -> after = entityRepository.update(entity, byIds(entity, before), intent.values());
            case DELETE -> {
                entityRepository.delete(entity, byIds(entity, before));
                after = List.of();
            }
            case ANALYZE -> {
                after = before;
                analysis = AnalysisCalculator.compute(intent.aggregation(), before);
            }
            default -> after = before;
        }

        CcExecution execution = executionRepository.save(CcExecution.builder()
                .executionId(ConsoleIds.executionId())
                .planId(plan.getPlanId())
                .executedBy(actor.userId())
                .executedByRole(actor.role())
                .status(ExecutionStatus.EXECUTED)
                .beforeState(JsonUtil.toJson(before))
                .afterState(JsonUtil.toJson(after))
                .analysisJson(analysis == null ? null : JsonUtil.toJson(analysis))
                .executedAt(OffsetDateTime.now())
                .build());

        plan.transitionTo(PlanStatus.EXECUTED, null);
        planRepository.save(plan);
        return execution;
    }

    private CommandConsoleException asFailure(String planId, RuntimeException e) {
        if (e instanceof CommandConsoleException cce
                && (cce.is(CommandConsoleErrorCode.IMPACT_CONFLICT) || cce.is(CommandConsoleErrorCode.AUDIT_SAVE_FAILED))) {
            return cce;
        }
        return new CommandConsoleException(
                CommandConsoleErrorCode.EXECUTION_FAILED,
                "Execution of plan " + planId + " failed: " + e.getMessage(),
                e
        );
    }

    private void markFailed(CcPlan plan, PlanStatus statusBefore, Actor actor, CommandConsoleException failure) {
        log.warn("Execution failed planId={} code={} msg={}", plan.getPlanId(), failure.getErrorCode(), failure.getMessage());
        // the rolled back transaction may have left the in-memory status at executed
        plan.setStatus(statusBefore);
        plan.transitionTo(PlanStatus.FAILED, failure.getMessage());
        planRepository.save(plan);
        try {
            auditLog.append(AuditEntry.forPlan(plan, actor, new AuditPayload.ExecutionFailed(failure.getErrorCode(), failure.getMessage())));
        }
        catch (CommandConsoleException auditFailure) {
            failure.addSuppressed(auditFailure);
        }
    }

    static List<FieldFilter> byIds(EntityDescriptor entity, List<Map<String, Object>> rows) {
        List<Object> ids = new ArrayList<>();
        for (Map<String, Object> row : rows) {
            ids.add(row.get(entity.idField()));
        }
        return List.of(FieldFilter.in(entity.idField(), ids));
    }
}
