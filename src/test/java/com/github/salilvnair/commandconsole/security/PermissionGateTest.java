package com.github.salilvnair.commandconsole.security;

import com.github.salilvnair.commandconsole.intent.FieldFilter;
import com.github.salilvnair.commandconsole.intent.FilterOperator;
import com.github.salilvnair.commandconsole.intent.Intent;
import com.github.salilvnair.commandconsole.intent.IntentSource;
import com.github.salilvnair.commandconsole.intent.IntentType;
import com.github.salilvnair.commandconsole.registry.EntityDescriptor;
import com.github.salilvnair.commandconsole.registry.EntityRegistry;
import com.github.salilvnair.commandconsole.support.ConsoleFixtures;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static com.github.salilvnair.commandconsole.support.TestConstants.*;
import static org.junit.jupiter.api.Assertions.*;

class PermissionGateTest {

    private final EntityRegistry registry = ConsoleFixtures.registry();
    private final PermissionGate gate = new PermissionGate(ConsoleFixtures.permissionMatrix(registry));

    @Test
    void adminIsAllowedEverythingWithoutScope() {
        PermissionDecision decision = gate.check(ConsoleFixtures.admin(), intent(IntentType.DELETE, ENTITY_USER, List.of()), entity(ENTITY_USER));
        assertTrue(decision.allowed());
        assertEquals(PermissionDecision.OK, decision.reason());
        assertTrue(decision.scope().isEmpty());
    }

    @Test
    void unknownRoleIsDenied() {
        PermissionDecision decision = gate.check(Actor.of("u-x", "janitor"), intent(IntentType.READ, ENTITY_COURSE, List.of()), entity(ENTITY_COURSE));
        assertFalse(decision.allowed());
        assertEquals(PermissionDecision.UNKNOWN_ROLE, decision.reason());
    }

    @Test
    void studentCannotWriteStudents() {
        Intent update = intent(IntentType.UPDATE, ENTITY_STUDENT, List.of(FieldFilter.eq("section", "A")), Map.of("cgpa", new BigDecimal("10")));
        PermissionDecision decision = gate.check(ConsoleFixtures.student(), update, entity(ENTITY_STUDENT));
        assertFalse(decision.allowed());
        assertEquals(PermissionDecision.ROLE_RESTRICTED, decision.reason());
    }

    @Test
    void facultyCannotTouchSensitiveEntities() {
        PermissionDecision decision = gate.check(ConsoleFixtures.cseFaculty(), intent(IntentType.READ, ENTITY_USER, List.of()), entity(ENTITY_USER));
        assertFalse(decision.allowed());
        assertEquals(PermissionDecision.ROLE_RESTRICTED, decision.reason());
    }

    @Test
    void facultyReadIsNarrowedToOwnDepartment() {
        Intent read = intent(IntentType.READ, ENTITY_STUDENT, List.of(FieldFilter.eq("section", "A")));
        PermissionDecision decision = gate.check(ConsoleFixtures.cseFaculty(), read, entity(ENTITY_STUDENT));

        assertTrue(decision.allowed());
        assertEquals(Map.of("department", DEPT_CSE), decision.scope());
        Intent narrowed = decision.narrow(read);
        assertEquals(2, narrowed.filters().size());
        assertEquals(FieldFilter.eq("department", DEPT_CSE), narrowed.filter("department").orElseThrow());
    }

    @Test
    void facultyTargetingAnotherDepartmentIsDenied() {
        Intent read = intent(IntentType.READ, ENTITY_STUDENT, List.of(FieldFilter.eq("department", DEPT_ECE)));
        PermissionDecision decision = gate.check(ConsoleFixtures.cseFaculty(), read, entity(ENTITY_STUDENT));
        assertFalse(decision.allowed());
        assertEquals(PermissionDecision.DEPARTMENT_SCOPE_RESTRICTED, decision.reason());
    }

    @Test
    void departmentMatchIgnoresCase() {
        Intent read = intent(IntentType.READ, ENTITY_STUDENT, List.of(FieldFilter.eq("department", "cse")));
        assertTrue(gate.check(ConsoleFixtures.cseFaculty(), read, entity(ENTITY_STUDENT)).allowed());
    }

    @Test
    void inFilterMustStayInsideScope() {
        Intent mixed = intent(IntentType.READ, ENTITY_STUDENT, List.of(FieldFilter.in("department", List.of(DEPT_CSE, DEPT_ECE))));
        assertFalse(gate.check(ConsoleFixtures.cseFaculty(), mixed, entity(ENTITY_STUDENT)).allowed());

        Intent own = intent(IntentType.READ, ENTITY_STUDENT, List.of(FieldFilter.in("department", List.of(DEPT_CSE))));
        assertTrue(gate.check(ConsoleFixtures.cseFaculty(), own, entity(ENTITY_STUDENT)).allowed());
    }

    @Test
    void rangeFilterOnScopeFieldIsDenied() {
        Intent read = intent(IntentType.READ, ENTITY_STUDENT, List.of(new FieldFilter("department", FilterOperator.NE, DEPT_ECE)));
        assertFalse(gate.check(ConsoleFixtures.cseFaculty(), read, entity(ENTITY_STUDENT)).allowed());
    }

    @Test
    void movingRowsOutOfScopeIsDenied() {
        Intent update = intent(IntentType.UPDATE, ENTITY_STUDENT, List.of(FieldFilter.eq("section", "A")), Map.of("department", DEPT_ECE));
        PermissionDecision decision = gate.check(ConsoleFixtures.cseFaculty(), update, entity(ENTITY_STUDENT));
        assertFalse(decision.allowed());
        assertEquals(PermissionDecision.DEPARTMENT_SCOPE_RESTRICTED, decision.reason());
    }

    @Test
    void createReceivesScopeAsValues() {
        Intent create = intent(IntentType.CREATE, ENTITY_ATTENDANCE, List.of(), Map.of("student_id", 5L, "is_present", true));
        PermissionDecision decision = gate.check(ConsoleFixtures.cseFaculty(), create, entity(ENTITY_ATTENDANCE));

        assertTrue(decision.allowed());
        Intent narrowed = decision.narrow(create);
        assertTrue(narrowed.filters().isEmpty());
        assertEquals(DEPT_CSE, narrowed.values().get("department"));
    }

    @Test
    void studentReadIsNarrowedToOwnRow() {
        Intent read = intent(IntentType.READ, ENTITY_STUDENT, List.of());
        PermissionDecision decision = gate.check(ConsoleFixtures.student(), read, entity(ENTITY_STUDENT));
        assertTrue(decision.allowed());
        assertEquals(Map.of("user_id", STUDENT_ID), decision.scope());
    }

    @Test
    void studentAskingForSomeoneElsesRowIsDenied() {
        Intent read = intent(IntentType.READ, ENTITY_STUDENT, List.of(FieldFilter.eq("user_id", OTHER_STUDENT_ID)));
        PermissionDecision decision = gate.check(ConsoleFixtures.student(), read, entity(ENTITY_STUDENT));
        assertFalse(decision.allowed());
        assertEquals(PermissionDecision.OWNER_SCOPE_RESTRICTED, decision.reason());
    }

    @Test
    void studentAttendanceIsNarrowedThroughTheStudentLink() {
        Intent read = intent(IntentType.READ, ENTITY_ATTENDANCE, List.of(FieldFilter.eq("student_id", 2L)));
        PermissionDecision decision = gate.check(ConsoleFixtures.student(), read, entity(ENTITY_ATTENDANCE));

        assertTrue(decision.allowed());
        assertTrue(decision.scope().isEmpty());
        assertEquals(List.of(FieldFilter.ownedBy("student_id", STUDENT_ID)), decision.conditions());
        Intent narrowed = decision.narrow(read);
        assertEquals(2, narrowed.filters().size());
        assertEquals(FilterOperator.OWNED_BY, narrowed.filters().get(1).operator());
    }

    @Test
    void linkedOwnershipIsNeverWidenedToTheDepartment() {
        Intent analyze = intent(IntentType.ANALYZE, ENTITY_ATTENDANCE, List.of(FieldFilter.eq("department", DEPT_CSE)));
        PermissionDecision decision = gate.check(ConsoleFixtures.student(), analyze, entity(ENTITY_ATTENDANCE));

        assertTrue(decision.allowed());
        assertFalse(decision.scope().containsKey("department"));
        assertEquals(1, decision.conditions().size());
    }

    @Test
    void studentCoursesAreSharedCatalogData() {
        PermissionDecision decision = gate.check(ConsoleFixtures.student(), intent(IntentType.READ, ENTITY_COURSE, List.of()), entity(ENTITY_COURSE));
        assertTrue(decision.allowed());
        assertTrue(decision.scope().isEmpty());
        assertTrue(decision.conditions().isEmpty());
    }

    @Test
    void referenceDataIsReadableWithoutScope() {
        PermissionDecision decision = gate.check(ConsoleFixtures.student(), intent(IntentType.READ, ENTITY_DEPARTMENT, List.of()), entity(ENTITY_DEPARTMENT));
        assertTrue(decision.allowed());
        assertTrue(decision.scope().isEmpty());
    }

    @Test
    void departmentScopedActorWithoutDepartmentIsUnresolved() {
        Actor faculty = Actor.of(FACULTY_ID, ROLE_FACULTY);
        PermissionDecision decision = gate.check(faculty, intent(IntentType.READ, ENTITY_STUDENT, List.of()), entity(ENTITY_STUDENT));
        assertFalse(decision.allowed());
        assertEquals(PermissionDecision.SCOPE_UNRESOLVED, decision.reason());
    }

    private EntityDescriptor entity(String name) {
        return registry.require(name);
    }

    private static Intent intent(IntentType type, String entity, List<FieldFilter> filters) {
        return intent(type, entity, filters, Map.of());
    }

    private static Intent intent(IntentType type, String entity, List<FieldFilter> filters, Map<String, Object> values) {
        return new Intent(type, entity, filters, values, null, 0.9, false, null, IntentSource.INFERENCE);
    }
}
