package com.github.salilvnair.commandconsole.execution;

import com.github.salilvnair.commandconsole.approval.ApprovalDecisionType;
import com.github.salilvnair.commandconsole.audit.AuditStage;
import com.github.salilvnair.commandconsole.entity.CcExecution;
import com.github.salilvnair.commandconsole.exception.CommandConsoleErrorCode;
import com.github.salilvnair.commandconsole.exception.CommandConsoleException;
import com.github.salilvnair.commandconsole.plan.PlanOutcome;
import com.github.salilvnair.commandconsole.plan.PlanStatus;
import com.github.salilvnair.commandconsole.security.Actor;
import com.github.salilvnair.commandconsole.support.ConsoleFixtures;
import com.github.salilvnair.commandconsole.support.ConsoleHarness;
import com.github.salilvnair.commandconsole.support.ScenarioResponses;
import com.github.salilvnair.commandconsole.util.JsonUtil;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static com.github.salilvnair.commandconsole.support.TestConstants.*;
import static org.junit.jupiter.api.Assertions.*;

class RollbackEngineTest {

    private ConsoleHarness harness;
    private long mech1;
    private long mech2;
    private long mech3;

    @BeforeEach
    void setUp() {
        harness = new ConsoleHarness();
        ScenarioResponses.scenarios(harness.llmClient)
                .respond("delete section c students", ScenarioResponses.DELETE_STUDENT_SECTION_C)
                .respond("add biotech department", ScenarioResponses.CREATE_DEPARTMENT);
        mech1 = harness.database.insertStudent("m1", DEPT_MECH, 3, "A", "6.1");
        mech2 = harness.database.insertStudent("m2", DEPT_MECH, 3, "B", "7.25");
        mech3 = harness.database.insertStudent("m3", DEPT_MECH, 5, "A", "8.3");
        harness.database.insertStudent("c1", DEPT_CSE, 3, "A", "5.5");
    }

    @AfterEach
    void tearDown() {
        harness.close();
    }

    @Test
    void rollbackRestoresEveryUpdatedRow() {
        CcExecution execution = executeMechUpdate();

        CcExecution rollback = harness.service.rollback(execution.getExecutionId(), ConsoleFixtures.admin());

        assertEquals(0, new BigDecimal("6.1").compareTo(harness.database.studentCgpa(mech1)));
        assertEquals(0, new BigDecimal("7.25").compareTo(harness.database.studentCgpa(mech2)));
        assertEquals(0, new BigDecimal("8.3").compareTo(harness.database.studentCgpa(mech3)));
        assertEquals(ExecutionStatus.ROLLED_BACK, rollback.getStatus());
        assertEquals(execution.getExecutionId(), rollback.getRollbackOfExecutionId());
        assertEquals(3, JsonUtil.toRows(rollback.getAfterState()).size());

        CcExecution original = harness.executions.findByExecutionId(execution.getExecutionId()).orElseThrow();
        assertEquals(ExecutionStatus.ROLLED_BACK, original.getStatus());
        assertNotNull(original.getRolledBackAt());
        List<AuditStage> stages = harness.auditEvents.stages(execution.getPlanId());
        assertEquals(AuditStage.ROLLED_BACK, stages.get(stages.size() - 1));
    }

    @Test
    void rollbackKeepsUntouchedColumns() {
        CcExecution execution = executeMechUpdate();
        harness.service.rollback(execution.getExecutionId(), ConsoleFixtures.admin());

        assertEquals(3, harness.database.studentSemester(mech1));
        assertEquals(5, harness.database.studentSemester(mech3));
    }

    @Test
    void secondRollbackIsAConflict() {
        CcExecution execution = executeMechUpdate();
        harness.service.rollback(execution.getExecutionId(), ConsoleFixtures.admin());

        CommandConsoleException ex = assertThrows(CommandConsoleException.class,
                () -> harness.service.rollback(execution.getExecutionId(), ConsoleFixtures.admin()));
        assertEquals(CommandConsoleErrorCode.ROLLBACK_CONFLICT, ex.getCode());
    }

    @Test
    void rollbackRecordItselfCannotBeRolledBack() {
        CcExecution execution = executeMechUpdate();
        CcExecution rollback = harness.service.rollback(execution.getExecutionId(), ConsoleFixtures.admin());

        CommandConsoleException ex = assertThrows(CommandConsoleException.class,
                () -> harness.service.rollback(rollback.getExecutionId(), ConsoleFixtures.admin()));
        assertEquals(CommandConsoleErrorCode.ROLLBACK_CONFLICT, ex.getCode());
    }

    @Test
    void externalChangeSinceExecutionBlocksRollback() {
        CcExecution execution = executeMechUpdate();
        harness.database.execute("UPDATE students SET cgpa = 3.3 WHERE id = :id", Map.of("id", mech2));

        CommandConsoleException ex = assertThrows(CommandConsoleException.class,
                () -> harness.service.rollback(execution.getExecutionId(), ConsoleFixtures.admin()));

        assertEquals(CommandConsoleErrorCode.ROLLBACK_CONFLICT, ex.getCode());
        assertEquals(0, new BigDecimal("9.5").compareTo(harness.database.studentCgpa(mech1)));
        assertEquals(ExecutionStatus.EXECUTED,
                harness.executions.findByExecutionId(execution.getExecutionId()).orElseThrow().getStatus());
    }

    @Test
    void auditFailureKeepsTheExecutionInPlace() {
        CcExecution execution = executeMechUpdate();
        harness.auditEvents.failOnSave(true);

        CommandConsoleException ex = assertThrows(CommandConsoleException.class,
                () -> harness.service.rollback(execution.getExecutionId(), ConsoleFixtures.admin()));

        assertEquals(CommandConsoleErrorCode.AUDIT_SAVE_FAILED, ex.getCode());
        assertEquals(0, new BigDecimal("9.5").compareTo(harness.database.studentCgpa(mech1)));
        assertEquals(1, harness.executions.all().size());
        assertEquals(ExecutionStatus.EXECUTED,
                harness.executions.findByExecutionId(execution.getExecutionId()).orElseThrow().getStatus());

        harness.auditEvents.failOnSave(false);
        harness.service.rollback(execution.getExecutionId(), ConsoleFixtures.admin());
        assertEquals(0, new BigDecimal("6.1").compareTo(harness.database.studentCgpa(mech1)));
    }

    @Test
    void rolledBackPlanStaysExecutedAndDoesNotRunAgain() {
        CcExecution execution = executeMechUpdate();
        harness.service.rollback(execution.getExecutionId(), ConsoleFixtures.admin());

        assertEquals(PlanStatus.EXECUTED, harness.orchestrator.reload(execution.getPlanId()).getStatus());
        CommandConsoleException ex = assertThrows(CommandConsoleException.class,
                () -> harness.executionEngine.execute(execution.getPlanId(), ConsoleFixtures.admin()));
        assertEquals(CommandConsoleErrorCode.PLAN_NOT_EXECUTABLE, ex.getCode());
        assertEquals(0, new BigDecimal("6.1").compareTo(harness.database.studentCgpa(mech1)));
        assertEquals(2, harness.executions.findByPlanIdOrderByExecutedAtAsc(execution.getPlanId()).size());
    }

    @Test
    void deletedRowsAreReinserted() {
        harness.database.insertStudent("x1", DEPT_CSE, 2, "C", "6.6");
        harness.database.insertStudent("x2", DEPT_ECE, 2, "C", "6.7");
        PlanOutcome outcome = harness.service.submit("delete section c students", ConsoleFixtures.admin());
        assertEquals(PlanStatus.AWAITING_APPROVAL, outcome.status());
        PlanOutcome approved = harness.service.approve(outcome.plan().getPlanId(), ConsoleFixtures.secondAdmin(),
                ApprovalDecisionType.APPROVE);
        assertEquals(4, harness.database.count("students"));

        CcExecution rollback = harness.service.rollback(approved.execution().getExecutionId(), ConsoleFixtures.admin());

        assertEquals(6, harness.database.count("students"));
        assertEquals(2, harness.database.count("students", "section = :section", Map.of("section", "C")));
        assertEquals(2, JsonUtil.toRows(rollback.getAfterState()).size());
    }

    @Test
    void createIsUndoneByDeletingTheRow() {
        PlanOutcome outcome = harness.service.submit("add biotech department", ConsoleFixtures.admin());
        CcExecution execution = harness.service.confirm(outcome.plan().getPlanId(), ConsoleFixtures.admin());
        assertEquals(1, harness.database.count("departments"));

        harness.service.rollback(execution.getExecutionId(), ConsoleFixtures.admin());

        assertEquals(0, harness.database.count("departments"));
    }

    @Test
    void readExecutionCannotBeRolledBack() {
        harness.database.insertStudent("c2", DEPT_CSE, 3, "A", "4.2");
        PlanOutcome outcome = harness.service.submit(SCENARIO_A, ConsoleFixtures.admin());
        assertEquals(PlanStatus.EXECUTED, outcome.status());

        CommandConsoleException ex = assertThrows(CommandConsoleException.class,
                () -> harness.service.rollback(outcome.execution().getExecutionId(), ConsoleFixtures.admin()));
        assertEquals(CommandConsoleErrorCode.ROLLBACK_CONFLICT, ex.getCode());
    }

    @Test
    void onlySeniorRolesOrTheExecutorMayRollBack() {
        CcExecution execution = executeMechUpdate();
        Actor faculty = ConsoleFixtures.cseFaculty();

        CommandConsoleException ex = assertThrows(CommandConsoleException.class,
                () -> harness.service.rollback(execution.getExecutionId(), faculty));
        assertEquals(CommandConsoleErrorCode.ROLLBACK_NOT_PERMITTED, ex.getCode());

        assertNotNull(harness.service.rollback(execution.getExecutionId(), ConsoleFixtures.secondAdmin()));
    }

    @Test
    void unknownExecutionIsNotFound() {
        CommandConsoleException ex = assertThrows(CommandConsoleException.class,
                () -> harness.service.rollback("exec_missing", ConsoleFixtures.admin()));
        assertEquals(CommandConsoleErrorCode.EXECUTION_NOT_FOUND, ex.getCode());
    }

    private CcExecution executeMechUpdate() {
        PlanOutcome outcome = harness.service.submit(SCENARIO_D, ConsoleFixtures.admin());
        assertEquals(PlanStatus.AWAITING_CONFIRMATION, outcome.status());
        CcExecution execution = harness.service.confirm(outcome.plan().getPlanId(), ConsoleFixtures.admin());
        assertEquals(0, new BigDecimal("9.5").compareTo(harness.database.studentCgpa(mech2)));
        return execution;
    }
}
