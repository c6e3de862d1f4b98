package com.github.salilvnair.commandconsole.registry;

import com.github.salilvnair.commandconsole.exception.CommandConsoleErrorCode;
import com.github.salilvnair.commandconsole.exception.CommandConsoleException;
import com.github.salilvnair.commandconsole.support.ConsoleFixtures;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ByteArrayResource;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EntityRegistryTest {

    private final EntityRegistry registry = ConsoleFixtures.registry();

    @Test
    void resolvesCanonicalNamesAndAliasesCaseInsensitively() {
        assertEquals("student", registry.resolve("Students").orElseThrow().name());
        assertEquals("faculty", registry.resolve("professor").orElseThrow().name());
        assertEquals("salary_record", registry.resolve("PAYROLL").orElseThrow().name());
        assertTrue(registry.resolve("grade").isEmpty());
        assertTrue(registry.resolve(null).isEmpty());
    }

    @Test
    void requireFailsForUnknownEntity() {
        CommandConsoleException ex = assertThrows(CommandConsoleException.class, () -> registry.require("spaceship"));
        assertEquals(CommandConsoleErrorCode.UNKNOWN_ENTITY, ex.getCode());
    }

    @Test
    void phrasesAreOrderedLongestFirst() {
        List<Map.Entry<String, String>> phrases = registry.phrases();
        for (int i = 1; i < phrases.size(); i++) {
            assertTrue(phrases.get(i - 1).getKey().length() >= phrases.get(i).getKey().length());
        }
    }

    @Test
    void sensitiveEntitiesAreFlagged() {
        assertTrue(registry.require("user").sensitive());
        assertTrue(registry.require("student_fee").sensitive());
        assertTrue(registry.require("salary_record").sensitive());
        assertFalse(registry.require("student").sensitive());
    }

    @Test
    void idFieldIsAlwaysFilterableButNotWritable() {
        EntityDescriptor student = registry.require("student");
        assertTrue(student.isFilterable("id"));
        assertFalse(student.isWritable("id"));
        assertFalse(student.isWritable("user_id"));
        assertTrue(student.isWritable("cgpa"));
    }

    @Test
    void canonicalValueUsesVocabularyThenFieldType() {
        EntityDescriptor student = registry.require("student");
        assertEquals("CSE", student.canonicalValue("department", "cse"));
        assertEquals("Biotech", student.canonicalValue("department", "Biotech"));
        assertEquals(new BigDecimal("6"), student.canonicalValue("cgpa", "6"));
        assertEquals(4L, student.canonicalValue("semester", 4));
    }

    @Test
    void unknownFieldIsAnInvalidFilter() {
        CommandConsoleException ex = assertThrows(CommandConsoleException.class,
                () -> registry.require("student").fieldType("grade"));
        assertEquals(CommandConsoleErrorCode.INVALID_FILTER, ex.getCode());
    }

    @Test
    void rejectsDuplicateEntityNames() {
        String json = """
                {"entities": [
                  {"name": "course", "table": "courses", "fields": {"id": "INTEGER"}},
                  {"name": "Course", "table": "courses_v2", "fields": {"id": "INTEGER"}}
                ]}
                """;
        CommandConsoleException ex = assertThrows(CommandConsoleException.class,
                () -> EntityRegistryLoader.load(new ByteArrayResource(json.getBytes(StandardCharsets.UTF_8))));
        assertEquals(CommandConsoleErrorCode.REGISTRY_LOAD_FAILED, ex.getCode());
    }

    @Test
    void rejectsFilterableFieldThatIsNotDeclared() {
        String json = """
                {"entities": [
                  {"name": "course", "table": "courses", "fields": {"id": "INTEGER"}, "filterable": ["title"]}
                ]}
                """;
        CommandConsoleException ex = assertThrows(CommandConsoleException.class,
                () -> EntityRegistryLoader.load(new ByteArrayResource(json.getBytes(StandardCharsets.UTF_8))));
        assertEquals(CommandConsoleErrorCode.REGISTRY_LOAD_FAILED, ex.getCode());
    }

    @Test
    void ownerLinksResolveToTheTargetOwnerColumn() {
        OwnerLink link = registry.require("attendance").linkedOwner().orElseThrow();

        assertEquals("student_id", link.field());
        assertEquals("students", link.targetTable());
        assertEquals("id", link.keyField());
        assertEquals("user_id", link.ownerField());
        assertEquals(FieldType.STRING, link.ownerType());
        assertTrue(registry.require("prediction").linkedOwner().isPresent());
        assertTrue(registry.require("course").linkedOwner().isEmpty());
    }

    @Test
    void rejectsOwnerLinkToEntityWithoutOwner() {
        String json = """
                {"entities": [
                  {"name": "course", "table": "courses", "fields": {"id": "INTEGER"}},
                  {"name": "attendance", "table": "attendance", "fields": {"id": "INTEGER", "course_id": "INTEGER"},
                   "ownerLink": {"field": "course_id", "entity": "course"}}
                ]}
                """;
        CommandConsoleException ex = assertThrows(CommandConsoleException.class,
                () -> EntityRegistryLoader.load(new ByteArrayResource(json.getBytes(StandardCharsets.UTF_8))));
        assertEquals(CommandConsoleErrorCode.REGISTRY_LOAD_FAILED, ex.getCode());
    }
}
