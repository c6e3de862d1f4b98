package com.github.salilvnair.commandconsole.preview;

import com.github.salilvnair.commandconsole.config.CommandConsolePipelineConfig;
import com.github.salilvnair.commandconsole.data.EntityRepository;
import com.github.salilvnair.commandconsole.intent.Intent;
import com.github.salilvnair.commandconsole.intent.IntentType;
import com.github.salilvnair.commandconsole.registry.EntityDescriptor;
import com.github.salilvnair.commandconsole.risk.RiskLevel;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class PreviewBuilder {

    private final EntityRepository entityRepository;
    private final CommandConsolePipelineConfig pipelineConfig;

    public PlanPreview build(EntityDescriptor entity, Intent intent, long impactCount, RiskLevel riskLevel) {
        int maxRows = Math.max(1, pipelineConfig.getMaxPreviewRows());
        List<Map<String, Object>> rows = intent.type() == IntentType.CREATE
                ? List.of()
                : entityRepository.select(entity, intent.filters(), maxRows);

        List<ProposedChange> changes = new ArrayList<>();
        if (intent.type() == IntentType.CREATE) {
            intent.values().forEach((field, value) -> changes.add(new ProposedChange(null, field, null, value)));
        }
        else if (intent.type() == IntentType.UPDATE) {
            for (Map<String, Object> row : rows) {
                Object rowId = row.get(entity.idField());
                intent.values().forEach((field, value) -> changes.add(new ProposedChange(rowId, field, row.get(field), value)));
            }
        }

        return new PlanPreview(
                entity.name(),
                intent.type(),
                impactCount,
                riskLevel,
                rows,
                impactCount > rows.size() && intent.type() != IntentType.CREATE,
                changes,
                rollbackPlan(intent.type(), entity)
        );
    }

    private RollbackPlan rollbackPlan(IntentType type, EntityDescriptor entity) {
        return switch (type) {
            case CREATE -> RollbackPlan.snapshot("Delete the inserted " + entity.name() + " row");
            case UPDATE -> RollbackPlan.snapshot("Restore updated fields from the before-state snapshot");
            case DELETE -> RollbackPlan.snapshot("Re-insert deleted " + entity.name() + " rows from the before-state snapshot");
            case READ, ANALYZE -> RollbackPlan.none();
        };
    }
}
