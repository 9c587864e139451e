package com.taskpilot.core.commit;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds conventional-commit messages from a named template, detecting the scope from the
 * changed files when none is given.
 */
public class CommitMessageGenerator {

    public static final List<String> CONVENTIONAL_COMMIT_TYPES = List.of(
            "feat", "fix", "docs", "style", "refactor", "perf", "test", "build", "ci", "chore", "revert");

    private static final Pattern HEADER = Pattern.compile("^(\\w+)(?:\\(([^)]+)\\))?(!)?:\\s*(.+)$");

    private final TemplateEngine templateEngine;
    private final ScopeDetector scopeDetector;
    private final String templateName;

    public CommitMessageGenerator() {
        this(new TemplateEngine(), new ScopeDetector(), TemplateEngine.COMMIT_MESSAGE);
    }

    public CommitMessageGenerator(TemplateEngine templateEngine, ScopeDetector scopeDetector, String templateName) {
        this.templateEngine = templateEngine;
        this.scopeDetector = scopeDetector;
        this.templateName = templateName == null ? TemplateEngine.COMMIT_MESSAGE : templateName;
        if (!templateEngine.hasTemplate(this.templateName)) {
            throw new IllegalArgumentException("Template \"" + this.templateName + "\" not found");
        }
    }

    public String generateMessage(CommitMessageOptions options) {
        String scope = options.scope() != null ? options.scope() : scopeDetector.detectScope(options.changedFiles());

        Map<String, Object> variables = new HashMap<>();
        variables.put("type", options.type());
        variables.put("scope", scope);
        variables.put("breaking", options.breaking() ? "!" : "");
        variables.put("description", options.description());
        variables.put("body", options.body());
        variables.put("taskId", options.taskId());
        variables.put("phase", options.phase());
        variables.put("tag", options.tag());
        variables.put("testsPassing", options.testsPassing());
        variables.put("testsFailing", options.testsFailing());
        variables.put("coveragePercent", options.coveragePercent());

        return templateEngine.render(templateName, variables);
    }

    public CommitValidationResult validateConventionalCommit(String message) {
        var errors = new ArrayList<String>();
        String header = message == null ? "" : message.split("\n", -1)[0];
        if (header.isEmpty()) {
            errors.add("Missing commit message");
            return new CommitValidationResult(false, errors);
        }

        Matcher m = HEADER.matcher(header);
        if (!m.matches()) {
            errors.add("Invalid conventional commit format. Expected: type(scope): description");
            return new CommitValidationResult(false, errors);
        }
        String type = m.group(1);
        if (!CONVENTIONAL_COMMIT_TYPES.contains(type)) {
            errors.add("Invalid commit type \"%s\". Must be one of: %s".formatted(
                    type, String.join(", ", CONVENTIONAL_COMMIT_TYPES)));
        }
        if (m.group(4).isBlank()) {
            errors.add("Missing description");
        }
        return new CommitValidationResult(errors.isEmpty(), errors);
    }

    /**
     * @throws IllegalArgumentException when the header is not in conventional-commit form
     */
    public ParsedCommitMessage parseCommitMessage(String message) {
        String[] lines = message.split("\n", -1);
        Matcher m = HEADER.matcher(lines[0]);
        if (!m.matches()) {
            throw new IllegalArgumentException("Invalid conventional commit format");
        }

        String body = null;
        for (int i = 1; i < lines.length; i++) {
            if (lines[i].isEmpty()) {
                body = String.join("\n", List.of(lines).subList(i + 1, lines.length)).strip();
                break;
            }
        }
        return new ParsedCommitMessage(m.group(1), m.group(2), "!".equals(m.group(3)), m.group(4), body);
    }

    public ScopeDetector scopeDetector() {
        return scopeDetector;
    }

    public TemplateEngine templateEngine() {
        return templateEngine;
    }
}
