package com.taskpilot.core.commit;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Minimal mustache-style templates: {@code {{var}}} substitution and {@code {{#var}}...{{/var}}}
 * conditional blocks. Blocks are resolved innermost-first until none remain, then variables are
 * substituted. A block renders when its variable is present and not {@code false} or {@code ""}.
 */
public class TemplateEngine {

    public static final String COMMIT_MESSAGE = "commitMessage";

    static final String DEFAULT_COMMIT_TEMPLATE = """
            {{type}}{{#scope}}({{scope}}){{/scope}}{{#breaking}}!{{/breaking}}: {{description}}

            {{#body}}{{body}}

            {{/body}}{{#taskId}}Task: {{taskId}}{{/taskId}}{{#phase}}
            Phase: {{phase}}{{/phase}}{{#testsPassing}}
            Tests: {{testsPassing}} passing{{#testsFailing}}, {{testsFailing}} failing{{/testsFailing}}{{/testsPassing}}""";

    private static final Pattern VARIABLE = Pattern.compile("\\{\\{\\s*([^}#/\\s]+)\\s*\\}\\}");
    private static final Pattern BLOCK = Pattern.compile(
            "\\{\\{#([^}]+)\\}\\}((?:(?!\\{\\{#).)*?)\\{\\{/\\1\\}\\}", Pattern.DOTALL);

    private final Map<String, String> templates = new LinkedHashMap<>();
    private final boolean preservePlaceholders;

    public TemplateEngine() {
        this(Map.of(), false);
    }

    /**
     * @param customTemplates      templates added to (or overriding) the defaults
     * @param preservePlaceholders keep {@code {{var}}} for absent variables instead of blanking them
     */
    public TemplateEngine(Map<String, String> customTemplates, boolean preservePlaceholders) {
        templates.put(COMMIT_MESSAGE, DEFAULT_COMMIT_TEMPLATE);
        if (customTemplates != null) {
            templates.putAll(customTemplates);
        }
        this.preservePlaceholders = preservePlaceholders;
    }

    /**
     * @throws IllegalArgumentException if no template is registered under {@code templateName}
     */
    public String render(String templateName, Map<String, ?> variables) {
        String template = templates.get(templateName);
        if (template == null) {
            throw new IllegalArgumentException("Template \"" + templateName + "\" not found");
        }
        return renderInline(template, variables);
    }

    public String renderInline(String template, Map<String, ?> variables) {
        Map<String, ?> vars = variables == null ? Map.of() : variables;
        String result = processBlocks(template, vars);

        Matcher m = VARIABLE.matcher(result);
        return m.replaceAll(match -> {
            String name = match.group(1);
            Object value = vars.get(name);
            String replacement;
            if (value != null) {
                replacement = String.valueOf(value);
            } else {
                replacement = preservePlaceholders ? "{{" + name + "}}" : "";
            }
            return Matcher.quoteReplacement(replacement);
        });
    }

    public void setTemplate(String name, String template) {
        templates.put(name, template);
    }

    public String getTemplate(String name) {
        return templates.get(name);
    }

    public boolean hasTemplate(String name) {
        return templates.containsKey(name);
    }

    /**
     * Distinct variable names used by plain substitutions, in order of first appearance.
     */
    public List<String> extractVariables(String template) {
        Set<String> names = new LinkedHashSet<>();
        Matcher m = VARIABLE.matcher(template);
        while (m.find()) {
            names.add(m.group(1));
        }
        return List.copyOf(names);
    }

    public TemplateValidationResult validateTemplate(String template, List<String> requiredVariables) {
        List<String> present = extractVariables(template);
        List<String> missing = requiredVariables.stream()
                .filter(v -> !present.contains(v))
                .toList();
        return new TemplateValidationResult(missing.isEmpty(), missing);
    }

    private static String processBlocks(String template, Map<String, ?> vars) {
        String result = template;
        while (true) {
            Matcher m = BLOCK.matcher(result);
            String next = m.replaceAll(match -> Matcher.quoteReplacement(
                    isTruthy(vars.get(match.group(1).trim())) ? match.group(2) : ""));
            if (next.equals(result)) {
                return result;
            }
            result = next;
        }
    }

    private static boolean isTruthy(Object value) {
        return value != null && !Boolean.FALSE.equals(value) && !"".equals(value);
    }
}
