package com.github.salilvnair.commandconsole.entity;

import com.github.salilvnair.commandconsole.audit.AuditStage;
import com.github.salilvnair.commandconsole.risk.RiskLevel;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;

/**
 * Audit trail row. Insert only: Hibernate never flushes changes to it and the lifecycle
 * callbacks reject update and delete.
 */
@Entity
@Immutable
@Table(name = "cc_audit_event")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CcAuditEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "event_id", nullable = false, unique = true, updatable = false, length = 32)
    private String eventId;

    @Column(name = "plan_id", updatable = false, length = 32)
    private String planId;

    @Column(name = "execution_id", updatable = false, length = 32)
    private String executionId;

    @Column(name = "actor_id", nullable = false, updatable = false)
    private String actorId;

    @Column(name = "actor_role", nullable = false, updatable = false)
    private String actorRole;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private AuditStage stage;

    @Enumerated(EnumType.STRING)
    @Column(name = "risk_level", updatable = false)
    private RiskLevel riskLevel;

    @Column(updatable = false)
    private String entity;

    @Column(name = "payload_json", nullable = false, updatable = false)
    @JdbcTypeCode(SqlTypes.JSON)
    private String payloadJson;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @PreUpdate
    void rejectUpdate() {
        throw new IllegalStateException("Audit event " + eventId + " is append-only and cannot be updated");
    }

    @PreRemove
    void rejectRemove() {
        throw new IllegalStateException("Audit event " + eventId + " is append-only and cannot be deleted");
    }
}
