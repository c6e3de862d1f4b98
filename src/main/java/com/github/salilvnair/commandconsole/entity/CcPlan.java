package com.github.salilvnair.commandconsole.entity;

import com.github.salilvnair.commandconsole.exception.CommandConsoleErrorCode;
import com.github.salilvnair.commandconsole.exception.CommandConsoleException;
import com.github.salilvnair.commandconsole.intent.IntentType;
import com.github.salilvnair.commandconsole.plan.PlanStatus;
import com.github.salilvnair.commandconsole.risk.RiskLevel;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;

@Entity
@Table(name = "cc_plan")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CcPlan {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "plan_id", nullable = false, unique = true, length = 32)
    private String planId;

    @Column(name = "requester_id", nullable = false)
    private String requesterId;

    @Column(name = "requester_role", nullable = false)
    private String requesterRole;

    @Column(name = "requester_department")
    private String requesterDepartment;

    @Column(nullable = false, length = 4000)
    private String message;

    @Enumerated(EnumType.STRING)
    @Column(name = "intent_type")
    private IntentType intentType;

    private String entity;

    /**
     * Serialized Intent (type, entity, filters, values, aggregation, confidence, ambiguity,
     * source) after scope narrowing.
     */
    @Column(name = "intent_json", nullable = false)
    @JdbcTypeCode(SqlTypes.JSON)
    private String intentJson;

    private double confidence;

    private boolean ambiguous;

    @Column(name = "clarification_question", length = 1000)
    private String clarificationQuestion;

    @Column(name = "impact_count")
    private Long impactCount;

    @Enumerated(EnumType.STRING)
    @Column(name = "risk_level")
    private RiskLevel riskLevel;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PlanStatus status;

    @Column(name = "preview_json")
    @JdbcTypeCode(SqlTypes.JSON)
    private String previewJson;

    @Column(name = "requires_second_factor")
    private boolean requiresSecondFactor;

    @Column(name = "status_reason", length = 1000)
    private String statusReason;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    public void transitionTo(PlanStatus next, String reason) {
        if (status != null && !status.canTransitionTo(next)) {
            throw new CommandConsoleException(
                    CommandConsoleErrorCode.ILLEGAL_STATUS_TRANSITION,
                    "Plan " + planId + " cannot move from " + status.code() + " to " + next.code()
            );
        }
        this.status = next;
        this.statusReason = reason;
        this.updatedAt = OffsetDateTime.now();
    }
}
