package com.github.salilvnair.commandconsole.service;

import com.github.salilvnair.commandconsole.plan.PlanStatus;
import com.github.salilvnair.commandconsole.risk.RiskLevel;

import java.util.Map;

public record ConsoleStats(Map<PlanStatus, Long> plansByStatus, Map<RiskLevel, Long> plansByRisk) {

    public long total() {
        return plansByStatus.values().stream().mapToLong(Long::longValue).sum();
    }
}
