package com.github.salilvnair.commandconsole.audit;

import com.github.salilvnair.commandconsole.risk.RiskLevel;
import lombok.Builder;
import lombok.Getter;

import java.time.OffsetDateTime;

/**
 * Audit filters. Null fields do not filter; {@code to} is exclusive.
 */
@Getter
@Builder(toBuilder = true)
public class AuditQuery {

    private final String actorId;
    private final String actorRole;
    private final RiskLevel riskLevel;
    private final String entity;
    private final AuditStage stage;
    private final String planId;
    private final OffsetDateTime from;
    private final OffsetDateTime to;
    private final Integer limit;

    public static AuditQuery all() {
        return AuditQuery.builder().build();
    }
}
