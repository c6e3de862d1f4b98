package com.github.salilvnair.commandconsole.template;

import org.springframework.stereotype.Component;
import org.thymeleaf.context.Context;
import org.thymeleaf.spring6.SpringTemplateEngine;
import org.thymeleaf.templatemode.TemplateMode;
import org.thymeleaf.templateresolver.StringTemplateResolver;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class PromptTemplateRenderer {

    private static final Pattern MUSTACHE_VAR_PATTERN = Pattern.compile("\\{\\{\\s*([^{}]+?)\\s*}}");

    private final SpringTemplateEngine templateEngine;

    public PromptTemplateRenderer() {
        StringTemplateResolver resolver = new StringTemplateResolver();
        resolver.setTemplateMode(TemplateMode.TEXT);
        resolver.setCacheable(false);

        SpringTemplateEngine engine = new SpringTemplateEngine();
        engine.setTemplateResolver(resolver);
        engine.setEnableSpringELCompiler(true);
        this.templateEngine = engine;
    }

    public String render(String template, Map<String, Object> variables) {
        String raw = template == null ? "" : template;
        if (raw.isBlank()) {
            return raw;
        }
        Context context = new Context();
        if (variables != null) {
            context.setVariables(variables);
        }
        String rendered = templateEngine.process(normalizeTemplate(raw), context);
        return rendered == null ? "" : rendered;
    }

    // {{var}} is accepted as shorthand for Thymeleaf's inlined [[${var}]]
    private String normalizeTemplate(String template) {
        Matcher matcher = MUSTACHE_VAR_PATTERN.matcher(template);
        StringBuffer out = new StringBuffer();
        while (matcher.find()) {
            String replacement = "[[${" + matcher.group(1).trim() + "}]]";
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
