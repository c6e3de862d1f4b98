package com.github.salilvnair.commandconsole.entity;

import com.github.salilvnair.commandconsole.execution.ExecutionStatus;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;

@Entity
@Table(name = "cc_execution")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CcExecution {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "execution_id", nullable = false, unique = true, length = 32)
    private String executionId;

    @Column(name = "plan_id", nullable = false, length = 32)
    private String planId;

    @Column(name = "executed_by", nullable = false)
    private String executedBy;

    @Column(name = "executed_by_role", nullable = false)
    private String executedByRole;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ExecutionStatus status;

    /**
     * Rows as they were before the mutation. Written once.
     */
    @Column(name = "before_state", nullable = false, updatable = false)
    @JdbcTypeCode(SqlTypes.JSON)
    private String beforeState;

    @Column(name = "after_state", nullable = false)
    @JdbcTypeCode(SqlTypes.JSON)
    private String afterState;

    /** ANALYZE result, null for other intents. */
    @Column(name = "analysis_json")
    @JdbcTypeCode(SqlTypes.JSON)
    private String analysisJson;

    @Column(name = "rollback_of_execution_id", length = 32)
    private String rollbackOfExecutionId;

    @Column(name = "executed_at", nullable = false)
    private OffsetDateTime executedAt;

    @Column(name = "rolled_back_at")
    private OffsetDateTime rolledBackAt;

    public boolean isRollbackRecord() {
        return rollbackOfExecutionId != null;
    }
}
