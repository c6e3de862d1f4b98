package com.github.salilvnair.commandconsole.repo;

import com.github.salilvnair.commandconsole.entity.CcExecution;
import com.github.salilvnair.commandconsole.execution.ExecutionStatus;
import org.springframework.data.repository.Repository;

import java.util.List;
import java.util.Optional;

public interface ExecutionRepository extends Repository<CcExecution, Long> {

    CcExecution save(CcExecution execution);

    Optional<CcExecution> findByExecutionId(String executionId);

    List<CcExecution> findByPlanIdOrderByExecutedAtAsc(String planId);

    boolean existsByPlanIdAndStatusAndRollbackOfExecutionIdIsNull(String planId, ExecutionStatus status);
}
