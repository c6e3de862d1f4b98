package com.github.salilvnair.commandconsole.intent;

import com.github.salilvnair.commandconsole.config.CommandConsoleInferenceConfig;
import com.github.salilvnair.commandconsole.exception.CommandConsoleErrorCode;
import com.github.salilvnair.commandconsole.exception.CommandConsoleException;
import com.github.salilvnair.commandconsole.registry.EntityDescriptor;
import com.github.salilvnair.commandconsole.registry.EntityRegistry;
import com.github.salilvnair.commandconsole.template.PromptTemplateRenderer;
import com.github.salilvnair.commandconsole.util.JsonUtil;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Component
public class IntentPromptRenderer {

    static final String INTENT_SCHEMA = """
            {
              "type": "object",
              "required": ["intent_type", "entity", "confidence"],
              "properties": {
                "intent_type": {"type": "string", "enum": ["READ", "CREATE", "UPDATE", "DELETE", "ANALYZE"]},
                "entity": {"type": "string"},
                "filters": {"type": "object"},
                "values": {"type": "object"},
                "aggregation": {"type": "object"},
                "confidence": {"type": "number", "minimum": 0, "maximum": 1},
                "ambiguous": {"type": "boolean"},
                "clarification_question": {"type": ["string", "null"]}
              }
            }
            """;

    private final PromptTemplateRenderer templateRenderer;
    private final EntityRegistry entityRegistry;
    private final String template;

    public IntentPromptRenderer(PromptTemplateRenderer templateRenderer,
                                EntityRegistry entityRegistry,
                                CommandConsoleInferenceConfig inferenceConfig,
                                ResourceLoader resourceLoader) {
        this.templateRenderer = templateRenderer;
        this.entityRegistry = entityRegistry;
        this.template = readTemplate(resourceLoader.getResource(inferenceConfig.getPromptLocation()));
    }

    public String render(NormalizationRequest request) {
        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("message", request.message());
        variables.put("role", request.actor() == null ? "" : request.actor().role());
        variables.put("intentTypes", Arrays.stream(IntentType.values()).map(Enum::name).collect(Collectors.joining(", ")));
        variables.put("entities", describeEntities());
        return templateRenderer.render(template, variables);
    }

    public String schema() {
        return INTENT_SCHEMA;
    }

    public String context(NormalizationRequest request) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("message", request.message());
        context.put("role", request.actor() == null ? null : request.actor().role());
        List<Map<String, Object>> entities = new ArrayList<>();
        for (EntityDescriptor descriptor : entityRegistry.descriptors()) {
            Map<String, Object> entity = new LinkedHashMap<>();
            entity.put("name", descriptor.name());
            entity.put("aliases", descriptor.aliases());
            entity.put("fields", descriptor.fields());
            entity.put("filterable", descriptor.filterable());
            entity.put("writable", descriptor.writable());
            entity.put("sensitive", descriptor.sensitive());
            entities.add(entity);
        }
        context.put("entities", entities);
        return JsonUtil.toJson(context);
    }

    private String describeEntities() {
        StringBuilder out = new StringBuilder();
        for (EntityDescriptor descriptor : entityRegistry.descriptors()) {
            out.append("- ")
                    .append(descriptor.name())
                    .append(": ")
                    .append(String.join(", ", descriptor.filterable()))
                    .append(" | ")
                    .append(descriptor.writable().isEmpty() ? "(read only)" : String.join(", ", descriptor.writable()))
                    .append('\n');
        }
        return out.toString().stripTrailing();
    }

    private static String readTemplate(Resource resource) {
        try (InputStream in = resource.getInputStream()) {
            return StreamUtils.copyToString(in, StandardCharsets.UTF_8);
        }
        catch (IOException e) {
            throw new CommandConsoleException(
                    CommandConsoleErrorCode.REGISTRY_LOAD_FAILED,
                    "Unable to read intent prompt " + resource.getDescription(),
                    e
            );
        }
    }
}
