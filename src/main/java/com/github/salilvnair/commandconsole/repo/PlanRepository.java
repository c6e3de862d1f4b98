package com.github.salilvnair.commandconsole.repo;

import com.github.salilvnair.commandconsole.entity.CcPlan;
import com.github.salilvnair.commandconsole.plan.PlanStatus;
import com.github.salilvnair.commandconsole.risk.RiskLevel;
import org.springframework.data.repository.Repository;

import java.util.List;
import java.util.Optional;

public interface PlanRepository extends Repository<CcPlan, Long> {

    CcPlan save(CcPlan plan);

    Optional<CcPlan> findByPlanId(String planId);

    List<CcPlan> findByStatusOrderByCreatedAtAsc(PlanStatus status);

    long countByStatus(PlanStatus status);

    long countByRiskLevel(RiskLevel riskLevel);
}
