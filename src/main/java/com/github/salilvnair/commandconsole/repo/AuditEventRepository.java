package com.github.salilvnair.commandconsole.repo;

import com.github.salilvnair.commandconsole.audit.AuditStage;
import com.github.salilvnair.commandconsole.entity.CcAuditEvent;
import com.github.salilvnair.commandconsole.risk.RiskLevel;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Append and read only. There are no update or delete methods.
 */
public interface AuditEventRepository extends Repository<CcAuditEvent, Long> {

    CcAuditEvent save(CcAuditEvent event);

    List<CcAuditEvent> findByPlanIdOrderByCreatedAtAscIdAsc(String planId);

    @Query("""
            select e from CcAuditEvent e
            where (:actorId is null or e.actorId = :actorId)
              and (:actorRole is null or e.actorRole = :actorRole)
              and (:riskLevel is null or e.riskLevel = :riskLevel)
              and (:entity is null or e.entity = :entity)
              and (:stage is null or e.stage = :stage)
              and (:planId is null or e.planId = :planId)
              and (:fromTime is null or e.createdAt >= :fromTime)
              and (:toTime is null or e.createdAt < :toTime)
            order by e.createdAt asc, e.id asc
            """)
    List<CcAuditEvent> search(@Param("actorId") String actorId,
                              @Param("actorRole") String actorRole,
                              @Param("riskLevel") RiskLevel riskLevel,
                              @Param("entity") String entity,
                              @Param("stage") AuditStage stage,
                              @Param("planId") String planId,
                              @Param("fromTime") OffsetDateTime fromTime,
                              @Param("toTime") OffsetDateTime toTime,
                              Pageable pageable);
}
