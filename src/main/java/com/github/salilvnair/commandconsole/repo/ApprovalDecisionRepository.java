package com.github.salilvnair.commandconsole.repo;

import com.github.salilvnair.commandconsole.entity.CcApprovalDecision;
import org.springframework.data.repository.Repository;

import java.util.List;

public interface ApprovalDecisionRepository extends Repository<CcApprovalDecision, Long> {

    CcApprovalDecision save(CcApprovalDecision decision);

    List<CcApprovalDecision> findByPlanIdOrderByDecidedAtAsc(String planId);
}
