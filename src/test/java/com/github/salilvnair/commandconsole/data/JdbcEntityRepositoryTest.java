package com.github.salilvnair.commandconsole.data;

import com.github.salilvnair.commandconsole.exception.CommandConsoleErrorCode;
import com.github.salilvnair.commandconsole.exception.CommandConsoleException;
import com.github.salilvnair.commandconsole.intent.FieldFilter;
import com.github.salilvnair.commandconsole.intent.FilterOperator;
import com.github.salilvnair.commandconsole.registry.EntityDescriptor;
import com.github.salilvnair.commandconsole.registry.EntityRegistry;
import com.github.salilvnair.commandconsole.support.CampusDatabase;
import com.github.salilvnair.commandconsole.support.ConsoleFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static com.github.salilvnair.commandconsole.support.TestConstants.*;
import static org.junit.jupiter.api.Assertions.*;

class JdbcEntityRepositoryTest {

    private final EntityRegistry registry = ConsoleFixtures.registry();
    private final EntityDescriptor students = registry.require(ENTITY_STUDENT);
    private CampusDatabase database;
    private JdbcEntityRepository repository;

    @BeforeEach
    void setUp() {
        database = new CampusDatabase();
        repository = new JdbcEntityRepository(database.jdbc());
        database.insertStudent("s1", DEPT_CSE, 3, "A", "5.5");
        database.insertStudent("s2", DEPT_CSE, 3, "B", "7.1");
        database.insertStudent("s3", DEPT_ECE, 5, "A", "5.9");
        database.insertStudent("s4", DEPT_CSE, 5, "A", "8.4");
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    @Test
    void countsWithCombinedFilters() {
        List<FieldFilter> filters = List.of(
                FieldFilter.eq("department", DEPT_CSE),
                new FieldFilter("cgpa", FilterOperator.LT, new BigDecimal("6"))
        );
        assertEquals(1, repository.count(students, filters));
        assertEquals(4, repository.count(students, List.of()));
    }

    @Test
    void selectReturnsNormalizedLowerCaseRowsOrderedById() {
        List<Map<String, Object>> rows = repository.select(students, List.of(FieldFilter.eq("section", "A")));

        assertEquals(3, rows.size());
        assertEquals("s1", rows.get(0).get("user_id"));
        assertEquals(3L, rows.get(0).get("semester"));
        assertEquals(0, new BigDecimal("5.5").compareTo((BigDecimal) rows.get(0).get("cgpa")));
        assertTrue((Long) rows.get(0).get("id") < (Long) rows.get(1).get("id"));
    }

    @Test
    void selectHonoursLimit() {
        assertEquals(2, repository.select(students, List.of(), 2).size());
    }

    @Test
    void inAndLikeFilters() {
        assertEquals(4, repository.count(students, List.of(FieldFilter.in("semester", List.of(3, 4, 5)))));
        assertEquals(0, repository.count(students, List.of(FieldFilter.in("semester", List.of()))));
        assertEquals(4, repository.count(students, List.of(new FieldFilter("full_name", FilterOperator.LIKE, "STUDENT"))));
    }

    @Test
    void updateTouchesOnlyMatchingRowsAndReturnsAfterState() {
        List<Map<String, Object>> after = repository.update(
                students,
                List.of(FieldFilter.eq("department", DEPT_CSE), FieldFilter.eq("section", "A")),
                Map.of("semester", 6)
        );

        assertEquals(2, after.size());
        after.forEach(row -> assertEquals(6L, row.get("semester")));
        assertEquals(2, repository.count(students, List.of(FieldFilter.eq("semester", 6))));
    }

    @Test
    void deleteReturnsRemovedRows() {
        List<Map<String, Object>> removed = repository.delete(students, List.of(FieldFilter.eq("department", DEPT_ECE)));

        assertEquals(1, removed.size());
        assertEquals("s3", removed.get(0).get("user_id"));
        assertEquals(3, database.count("students"));
    }

    @Test
    void insertGeneratesIdAndReadsRowBack() {
        Map<String, Object> row = repository.insert(students, Map.of("full_name", "New Student", "department", DEPT_MECH, "semester", 1));

        assertNotNull(row.get("id"));
        assertEquals(DEPT_MECH, row.get("department"));
        assertEquals(5, database.count("students"));
    }

    @Test
    void insertKeepsExplicitId() {
        Map<String, Object> row = repository.insert(students, Map.of("id", 900L, "full_name", "Restored", "department", DEPT_CSE));
        assertEquals(900L, row.get("id"));
        assertEquals(1, database.count("students", "id = :id", Map.of("id", 900L)));
    }

    @Test
    void unknownFieldIsRejected() {
        CommandConsoleException ex = assertThrows(CommandConsoleException.class,
                () -> repository.count(students, List.of(FieldFilter.eq("grade", "A"))));
        assertEquals(CommandConsoleErrorCode.INVALID_FILTER, ex.getCode());
    }

    @Test
    void unsafeIdentifiersNeverReachSql() {
        assertThrows(IllegalArgumentException.class, () -> SqlFilterTranslator.identifier("students; DROP TABLE users"));
        assertEquals("", SqlFilterTranslator.where(students, List.of(), new MapSqlParameterSource()));
    }

    @Test
    void nullEqualityBecomesIsNull() {
        MapSqlParameterSource params = new MapSqlParameterSource();
        String where = SqlFilterTranslator.where(students, List.of(FieldFilter.eq("section", null)), params);
        assertEquals(" WHERE section IS NULL", where);
    }
}
