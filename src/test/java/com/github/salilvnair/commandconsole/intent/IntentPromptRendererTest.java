package com.github.salilvnair.commandconsole.intent;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.salilvnair.commandconsole.config.CommandConsoleInferenceConfig;
import com.github.salilvnair.commandconsole.support.ConsoleFixtures;
import com.github.salilvnair.commandconsole.template.PromptTemplateRenderer;
import com.github.salilvnair.commandconsole.util.JsonUtil;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import static com.github.salilvnair.commandconsole.support.TestConstants.*;
import static org.junit.jupiter.api.Assertions.*;

class IntentPromptRendererTest {

    private final IntentPromptRenderer renderer = new IntentPromptRenderer(
            new PromptTemplateRenderer(),
            ConsoleFixtures.registry(),
            new CommandConsoleInferenceConfig(),
            new DefaultResourceLoader()
    );

    @Test
    void promptCarriesMessageRoleAndRegistry() {
        String prompt = renderer.render(new NormalizationRequest(SCENARIO_C, ConsoleFixtures.cseFaculty()));

        assertTrue(prompt.contains("Instruction: " + SCENARIO_C));
        assertTrue(prompt.contains("Acting role: faculty"));
        assertTrue(prompt.contains("READ, CREATE, UPDATE, DELETE, ANALYZE"));
        assertTrue(prompt.contains("- student: "));
        assertTrue(prompt.contains("- salary_record: "));
        assertFalse(prompt.contains("{{"));
    }

    @Test
    void contextIsJsonWithEntityMetadata() {
        JsonNode context = JsonUtil.parseOrNull(renderer.context(new NormalizationRequest(SCENARIO_B, ConsoleFixtures.admin())));

        assertEquals(SCENARIO_B, context.path("message").asText());
        assertEquals(ROLE_ADMIN, context.path("role").asText());
        assertTrue(context.path("entities").isArray());
        assertEquals("student", context.path("entities").get(0).path("name").asText());
    }

    @Test
    void schemaDeclaresIntentType() {
        JsonNode schema = JsonUtil.parseOrNull(renderer.schema());
        assertTrue(schema.path("properties").has("intent_type"));
    }
}
