package com.github.salilvnair.commandconsole.audit;

import com.github.salilvnair.commandconsole.config.CommandConsoleAuditConfig;
import com.github.salilvnair.commandconsole.config.CommandConsolePipelineConfig;
import com.github.salilvnair.commandconsole.entity.CcAuditEvent;
import com.github.salilvnair.commandconsole.repo.AuditEventRepository;
import com.github.salilvnair.commandconsole.security.Actor;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Read side of the audit trail. Non-senior viewers only ever see their own events.
 */
@Component
@RequiredArgsConstructor
public class AuditQueryService {

    private final AuditEventRepository auditEventRepository;
    private final CommandConsolePipelineConfig pipelineConfig;
    private final CommandConsoleAuditConfig auditConfig;

    public List<CcAuditEvent> query(AuditQuery query, Actor viewer) {
        AuditQuery effective = query == null ? AuditQuery.all() : query;
        if (!pipelineConfig.isSenior(viewer.role())) {
            effective = effective.toBuilder().actorId(viewer.userId()).build();
        }
        int limit = auditConfig.effectiveLimit(effective.getLimit());
        return auditEventRepository.search(
                effective.getActorId(),
                effective.getActorRole(),
                effective.getRiskLevel(),
                effective.getEntity(),
                effective.getStage(),
                effective.getPlanId(),
                effective.getFrom(),
                effective.getTo(),
                PageRequest.of(0, limit)
        );
    }

    public List<CcAuditEvent> planTrail(String planId) {
        return auditEventRepository.findByPlanIdOrderByCreatedAtAscIdAsc(planId);
    }
}
