package com.github.salilvnair.commandconsole.execution;

import com.github.salilvnair.commandconsole.audit.AuditEntry;
import com.github.salilvnair.commandconsole.audit.AuditLog;
import com.github.salilvnair.commandconsole.audit.AuditPayload;
import com.github.salilvnair.commandconsole.config.CommandConsolePipelineConfig;
import com.github.salilvnair.commandconsole.data.EntityRepository;
import com.github.salilvnair.commandconsole.entity.CcExecution;
import com.github.salilvnair.commandconsole.entity.CcPlan;
import com.github.salilvnair.commandconsole.exception.CommandConsoleErrorCode;
import com.github.salilvnair.commandconsole.exception.CommandConsoleException;
import com.github.salilvnair.commandconsole.intent.FieldFilter;
import com.github.salilvnair.commandconsole.intent.Intent;
import com.github.salilvnair.commandconsole.plan.PlanIntents;
import com.github.salilvnair.commandconsole.plan.PlanLocks;
import com.github.salilvnair.commandconsole.preview.PlanPreview;
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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.Lock;

/**
 * Restores the before-state of an execution and records the restore as a new execution.
 */
@Slf4j
@Component
public class RollbackEngine {

    private final PlanRepository planRepository;
    private final ExecutionRepository executionRepository;
    private final EntityRegistry entityRegistry;
    private final EntityRepository entityRepository;
    private final AuditLog auditLog;
    private final PlanLocks planLocks;
    private final CommandConsolePipelineConfig pipelineConfig;
    private final TransactionTemplate transactionTemplate;

    public RollbackEngine(PlanRepository planRepository,
                          ExecutionRepository executionRepository,
                          EntityRegistry entityRegistry,
                          EntityRepository entityRepository,
                          AuditLog auditLog,
                          PlanLocks planLocks,
                          CommandConsolePipelineConfig pipelineConfig,
                          PlatformTransactionManager transactionManager) {
        this.planRepository = planRepository;
        this.executionRepository = executionRepository;
        this.entityRegistry = entityRegistry;
        this.entityRepository = entityRepository;
        this.auditLog = auditLog;
        this.planLocks = planLocks;
        this.pipelineConfig = pipelineConfig;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    public CcExecution rollback(String executionId, Actor actor) {
        String planId = findExecution(executionId).getPlanId();
        Lock lock = planLocks.forPlan(planId);
        lock.lock();
        try {
            CcExecution original = findExecution(executionId);
            if (!pipelineConfig.isSenior(actor.role()) && !Objects.equals(original.getExecutedBy(), actor.userId())) {
                throw new CommandConsoleException(CommandConsoleErrorCode.ROLLBACK_NOT_PERMITTED);
            }
            if (original.getStatus() == ExecutionStatus.ROLLED_BACK || original.isRollbackRecord()) {
                throw conflict("Execution " + executionId + " has already been rolled back");
            }
            CcPlan plan = planRepository.findByPlanId(planId)
                    .orElseThrow(() -> new CommandConsoleException(CommandConsoleErrorCode.PLAN_NOT_FOUND, "Plan " + planId + " not found"));
            PlanPreview preview = PlanIntents.preview(plan);
            if (preview == null || preview.rollbackPlan() == null || !preview.rollbackPlan().supportsRollback()) {
                throw conflict("Execution " + executionId + " does not support rollback");
            }
            Intent intent = PlanIntents.intent(plan);
            EntityDescriptor entity = entityRegistry.require(plan.getEntity());

            CcExecution record = transactionTemplate.execute(tx -> {
                CcExecution restored = restore(plan, original, intent, entity, actor);
                auditLog.append(AuditEntry.forPlan(plan, actor, new AuditPayload.RolledBack(
                        executionId,
                        JsonUtil.toRows(restored.getAfterState()).size()
                )).withExecution(restored.getExecutionId()));
                return restored;
            });

            log.info("Rolled back execution executionId={} rollbackId={} planId={}", executionId, record.getExecutionId(), planId);
            return record;
        }
        catch (CommandConsoleException e) {
            log.warn("Rollback refused executionId={} code={} msg={}", executionId, e.getErrorCode(), e.getMessage());
            throw e;
        }
        finally {
            lock.unlock();
        }
    }

    private CcExecution restore(CcPlan plan, CcExecution original, Intent intent, EntityDescriptor entity, Actor actor) {
        List<Map<String, Object>> before = JsonUtil.toRows(original.getBeforeState());
        List<Map<String, Object>> after = JsonUtil.toRows(original.getAfterState());

        List<Map<String, Object>> current;
        List<Map<String, Object>> restored;
        switch (intent.type()) {
            case UPDATE -> {
                current = requireUnchanged(entity, after);
                restored = new ArrayList<>();
                for (Map<String, Object> row : before) {
                    Map<String, Object> revert = new LinkedHashMap<>();
                    intent.values().keySet().forEach(field -> revert.put(field, row.get(field)));
                    restored.addAll(entityRepository.update(entity, List.of(FieldFilter.eq(entity.idField(), row.get(entity.idField()))), revert));
                }
            }
            case CREATE -> {
                current = requireUnchanged(entity, after);
                entityRepository.delete(entity, ExecutionEngine.byIds(entity, after));
                restored = List.of();
            }
            case DELETE -> {
                if (!before.isEmpty() && entityRepository.count(entity, ExecutionEngine.byIds(entity, before)) > 0) {
                    throw conflict("Deleted " + entity.name() + " rows have been re-created since execution " + original.getExecutionId());
                }
                current = List.of();
                restored = new ArrayList<>();
                for (Map<String, Object> row : before) {
                    restored.add(entityRepository.insert(entity, row));
                }
            }
            default -> throw conflict("Execution " + original.getExecutionId() + " does not support rollback");
        }

        OffsetDateTime now = OffsetDateTime.now();
        CcExecution record = executionRepository.save(CcExecution.builder()
                .executionId(ConsoleIds.executionId())
                .planId(plan.getPlanId())
                .executedBy(actor.userId())
                .executedByRole(actor.role())
                .status(ExecutionStatus.ROLLED_BACK)
                .beforeState(JsonUtil.toJson(current))
                .afterState(JsonUtil.toJson(restored))
                .rollbackOfExecutionId(original.getExecutionId())
                .executedAt(now)
                .rolledBackAt(now)
                .build());

        original.setStatus(ExecutionStatus.ROLLED_BACK);
        original.setRolledBackAt(now);
        executionRepository.save(original);
        return record;
    }

    // every row recorded in after_state must still be present with the same values
    private List<Map<String, Object>> requireUnchanged(EntityDescriptor entity, List<Map<String, Object>> after) {
        if (after.isEmpty()) {
            return List.of();
        }
        Map<String, Map<String, Object>> currentById = new LinkedHashMap<>();
        for (Map<String, Object> row : entityRepository.select(entity, ExecutionEngine.byIds(entity, after))) {
            currentById.put(String.valueOf(row.get(entity.idField())), row);
        }
        for (Map<String, Object> recorded : after) {
            Object id = recorded.get(entity.idField());
            Map<String, Object> current = currentById.get(String.valueOf(id));
            if (current == null) {
                throw conflict(entity.name() + " row " + id + " no longer exists");
            }
            for (Map.Entry<String, Object> field : recorded.entrySet()) {
                if (!entity.hasField(field.getKey())) {
                    continue;
                }
                if (!entity.fieldType(field.getKey()).sameValue(field.getKey(), field.getValue(), current.get(field.getKey()))) {
                    throw conflict(entity.name() + " row " + id + " field " + field.getKey() + " changed since execution");
                }
            }
        }
        return new ArrayList<>(currentById.values());
    }

    private CcExecution findExecution(String executionId) {
        return executionRepository.findByExecutionId(executionId)
                .orElseThrow(() -> new CommandConsoleException(CommandConsoleErrorCode.EXECUTION_NOT_FOUND, "Execution " + executionId + " not found"));
    }

    private static CommandConsoleException conflict(String message) {
        return new CommandConsoleException(CommandConsoleErrorCode.ROLLBACK_CONFLICT, message);
    }
}
