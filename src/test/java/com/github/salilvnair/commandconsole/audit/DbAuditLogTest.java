package com.github.salilvnair.commandconsole.audit;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.salilvnair.commandconsole.audit.dispatch.AuditEventDispatcher;
import com.github.salilvnair.commandconsole.entity.CcAuditEvent;
import com.github.salilvnair.commandconsole.exception.CommandConsoleErrorCode;
import com.github.salilvnair.commandconsole.exception.CommandConsoleException;
import com.github.salilvnair.commandconsole.intent.IntentType;
import com.github.salilvnair.commandconsole.repo.AuditEventRepository;
import com.github.salilvnair.commandconsole.risk.RiskLevel;
import com.github.salilvnair.commandconsole.util.JsonUtil;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static com.github.salilvnair.commandconsole.support.TestConstants.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DbAuditLogTest {

    @Mock
    private AuditEventRepository auditEventRepository;

    @Mock
    private AuditEventDispatcher eventDispatcher;

    private DbAuditLog auditLog;

    @BeforeEach
    void setUp() {
        auditLog = new DbAuditLog(auditEventRepository, eventDispatcher);
    }

    @Test
    void appendStoresTypedPayloadAndDispatches() {
        when(auditEventRepository.save(any(CcAuditEvent.class))).thenAnswer(invocation -> invocation.getArgument(0));
        AuditEntry entry = new AuditEntry("ops_1", null, ADMIN_ID, ROLE_ADMIN, RiskLevel.HIGH, ENTITY_USER,
                new AuditPayload.PermissionDenied("ROLE_RESTRICTED", IntentType.DELETE, ENTITY_USER))
                .withExecution("exec_1");

        CcAuditEvent saved = auditLog.append(entry);

        ArgumentCaptor<CcAuditEvent> captor = ArgumentCaptor.forClass(CcAuditEvent.class);
        verify(auditEventRepository).save(captor.capture());
        CcAuditEvent event = captor.getValue();
        assertTrue(event.getEventId().startsWith("audit_"));
        assertEquals(AuditStage.PERMISSION_DENIED, event.getStage());
        assertEquals("exec_1", event.getExecutionId());
        assertEquals(RiskLevel.HIGH, event.getRiskLevel());
        assertNotNull(event.getCreatedAt());
        JsonNode payload = JsonUtil.parseOrNull(event.getPayloadJson());
        assertEquals("ROLE_RESTRICTED", payload.path("reason").asText());
        assertEquals("DELETE", payload.path("intentType").asText());
        verify(eventDispatcher).dispatch(saved);
    }

    @Test
    void saveFailureIsReportedAndNotDispatched() {
        when(auditEventRepository.save(any(CcAuditEvent.class))).thenThrow(new IllegalStateException(BOOM));
        AuditEntry entry = new AuditEntry("ops_1", null, ADMIN_ID, ROLE_ADMIN, null, null,
                new AuditPayload.ClarificationRequested("Which records?", 0.4));

        CommandConsoleException ex = assertThrows(CommandConsoleException.class, () -> auditLog.append(entry));

        assertEquals(CommandConsoleErrorCode.AUDIT_SAVE_FAILED, ex.getCode());
        verifyNoInteractions(eventDispatcher);
    }
}
