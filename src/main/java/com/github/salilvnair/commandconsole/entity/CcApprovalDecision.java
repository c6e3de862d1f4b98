package com.github.salilvnair.commandconsole.entity;

import com.github.salilvnair.commandconsole.approval.ApprovalDecisionType;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;

@Entity
@Table(name = "cc_approval_decision")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CcApprovalDecision {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "plan_id", nullable = false, length = 32)
    private String planId;

    @Column(name = "reviewer_id", nullable = false)
    private String reviewerId;

    @Column(name = "reviewer_role", nullable = false)
    private String reviewerRole;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ApprovalDecisionType decision;

    @Column(length = 2000)
    private String comment;

    /**
     * Row ids the approval is limited to, as a JSON array. Empty means every previewed row.
     */
    @Column(name = "approved_ids")
    @JdbcTypeCode(SqlTypes.JSON)
    private String approvedIds;

    @Column(name = "rejected_ids")
    @JdbcTypeCode(SqlTypes.JSON)
    private String rejectedIds;

    @Column(name = "second_factor_verified")
    private boolean secondFactorVerified;

    @Column(name = "decided_at", nullable = false)
    private OffsetDateTime decidedAt;
}
