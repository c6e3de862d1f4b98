package com.github.salilvnair.commandconsole.audit;

import com.github.salilvnair.commandconsole.audit.dispatch.AuditEventDispatcher;
import com.github.salilvnair.commandconsole.entity.CcAuditEvent;
import com.github.salilvnair.commandconsole.exception.CommandConsoleErrorCode;
import com.github.salilvnair.commandconsole.exception.CommandConsoleException;
import com.github.salilvnair.commandconsole.repo.AuditEventRepository;
import com.github.salilvnair.commandconsole.util.ConsoleIds;
import com.github.salilvnair.commandconsole.util.JsonUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;

@Slf4j
@RequiredArgsConstructor
@Component
public class DbAuditLog implements AuditLog {

    private final AuditEventRepository auditEventRepository;
    private final AuditEventDispatcher eventDispatcher;

    @Override
    public CcAuditEvent append(AuditEntry entry) {
        CcAuditEvent saved;
        try {
            CcAuditEvent event = CcAuditEvent.builder()
                    .eventId(ConsoleIds.auditEventId())
                    .planId(entry.planId())
                    .executionId(entry.executionId())
                    .actorId(entry.actorId())
                    .actorRole(entry.actorRole())
                    .stage(entry.stage())
                    .riskLevel(entry.riskLevel())
                    .entity(entry.entity())
                    .payloadJson(JsonUtil.toJson(entry.payload()))
                    .createdAt(OffsetDateTime.now())
                    .build();
            saved = auditEventRepository.save(event);
        }
        catch (Exception e) {
            log.error("Audit save failed planId={} stage={}", entry.planId(), entry.stage(), e);
            throw new CommandConsoleException(
                    CommandConsoleErrorCode.AUDIT_SAVE_FAILED,
                    "Failed to save audit event for stage " + entry.stage(),
                    e
            );
        }
        eventDispatcher.dispatch(saved);
        return saved;
    }
}
