package com.github.salilvnair.commandconsole.intent;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.salilvnair.commandconsole.support.ConsoleFixtures;
import com.github.salilvnair.commandconsole.util.JsonUtil;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IntentPayloadParserTest {

    private final IntentPayloadParser parser = new IntentPayloadParser(ConsoleFixtures.registry());

    @Test
    void parsesObjectFiltersWithOperatorsAndVocabulary() {
        Intent intent = parse("""
                {"intent_type": "read", "entity": "students",
                 "filters": {"department": "cse", "cgpa": {"lt": 6}},
                 "confidence": 0.93}
                """);

        assertEquals(IntentType.READ, intent.type());
        assertEquals("student", intent.entity());
        assertEquals(FieldFilter.eq("department", "CSE"), intent.filter("department").orElseThrow());
        assertEquals(new FieldFilter("cgpa", FilterOperator.LT, new BigDecimal("6")), intent.filter("cgpa").orElseThrow());
        assertEquals(0.93, intent.confidence());
        assertFalse(intent.ambiguous());
        assertEquals(IntentSource.INFERENCE, intent.source());
    }

    @Test
    void parsesArrayFiltersAndSuffixedKeys() {
        Intent fromArray = parse("""
                {"intent": "READ", "entity": "student",
                 "filters": [{"field": "semester", "op": "gte", "value": "5"}]}
                """);
        assertEquals(new FieldFilter("semester", FilterOperator.GTE, 5L), fromArray.filters().get(0));

        Intent fromSuffix = parse("""
                {"intent_type": "READ", "entity": "student", "filters": {"cgpa_lt": 6}}
                """);
        assertEquals(FilterOperator.LT, fromSuffix.filter("cgpa").orElseThrow().operator());
    }

    @Test
    void listValueBecomesInFilter() {
        Intent intent = parse("""
                {"intent_type": "READ", "entity": "student", "filters": {"section": ["A", "B"]}}
                """);
        assertEquals(FieldFilter.in("section", List.of("A", "B")), intent.filter("section").orElseThrow());
    }

    @Test
    void missingConfidenceUsesDefault() {
        Intent intent = parse("""
                {"intent_type": "READ", "entity": "course"}
                """);
        assertEquals(IntentPayloadParser.DEFAULT_CONFIDENCE, intent.confidence());
    }

    @Test
    void unknownEntityIsAmbiguous() {
        Intent intent = parse("""
                {"intent_type": "UPDATE", "entity": "grades", "values": {"grade": "A"}, "confidence": 0.99}
                """);
        assertNull(intent.entity());
        assertTrue(intent.ambiguous());
        assertTrue(intent.clarificationQuestion().contains("grades"));
    }

    @Test
    void nonWritableValueIsAmbiguous() {
        Intent intent = parse("""
                {"intent_type": "UPDATE", "entity": "student", "filters": {"section": "A"},
                 "values": {"user_id": "u-1"}, "confidence": 0.99}
                """);
        assertTrue(intent.ambiguous());
        assertTrue(intent.clarificationQuestion().contains("user_id"));
    }

    @Test
    void unfilterableFieldIsAmbiguous() {
        Intent intent = parse("""
                {"intent_type": "READ", "entity": "student", "filters": {"favourite_colour": "blue"}, "confidence": 0.99}
                """);
        assertTrue(intent.ambiguous());
    }

    @Test
    void fractionalBoundOnWholeNumberFieldIsAmbiguous() {
        Intent intent = parse("""
                {"intent_type": "READ", "entity": "student", "filters": {"semester": {"lt": 3.5}}, "confidence": 0.95}
                """);
        assertTrue(intent.ambiguous());
        assertTrue(intent.filters().isEmpty());
        assertTrue(intent.clarificationQuestion().contains("semester"));
    }

    @Test
    void emptyEntryInValueListIsAmbiguous() {
        Intent intent = parse("""
                {"intent_type": "READ", "entity": "student", "filters": {"section": ["A", null]}, "confidence": 0.95}
                """);
        assertTrue(intent.ambiguous());
        assertTrue(intent.filter("section").isEmpty());
        assertTrue(intent.clarificationQuestion().contains("section"));
    }

    @Test
    void analyzeDefaultsToCount() {
        Intent intent = parse("""
                {"intent_type": "ANALYZE", "entity": "attendance", "filters": {"is_present": "absent"}, "confidence": 0.9}
                """);
        assertEquals(Aggregation.count(), intent.aggregation());
        assertEquals(FieldFilter.eq("is_present", Boolean.FALSE), intent.filter("is_present").orElseThrow());
    }

    @Test
    void aggregationObjectIsParsed() {
        Intent intent = parse("""
                {"intent_type": "ANALYZE", "entity": "student",
                 "aggregation": {"function": "average", "field": "cgpa"}, "confidence": 0.9}
                """);
        assertEquals(new Aggregation(AggregateFunction.AVG, "cgpa"), intent.aggregation());
    }

    @Test
    void explicitAmbiguityKeepsModelQuestion() {
        Intent intent = parse("""
                {"intent_type": "UPDATE", "entity": "student", "ambiguous": true,
                 "clarification_question": "Which grade field do you mean?", "confidence": 0.4}
                """);
        assertTrue(intent.ambiguous());
        assertEquals("Which grade field do you mean?", intent.clarificationQuestion());
    }

    private Intent parse(String json) {
        JsonNode node = JsonUtil.parseOrNull(json);
        assertNotNull(node);
        return parser.parse(node);
    }
}
