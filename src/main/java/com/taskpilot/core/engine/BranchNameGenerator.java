package com.taskpilot.core.engine;

import java.util.Locale;

/**
 * Renders working-branch names from a pattern with {@code {tagPrefix}}, {@code {tag}},
 * {@code {taskId}} and {@code {slug}} placeholders.
 */
public class BranchNameGenerator {

    public static final String DEFAULT_PATTERN = "{tagPrefix}task-{taskId}-{slug}";

    private static final int MAX_SLUG_LENGTH = 50;

    private final String pattern;

    public BranchNameGenerator() {
        this(DEFAULT_PATTERN);
    }

    public BranchNameGenerator(String pattern) {
        this.pattern = pattern == null || pattern.isBlank() ? DEFAULT_PATTERN : pattern;
    }

    public String generate(String taskId, String title, String tag) {
        String safeTag = tag == null ? "" : tag.trim();
        String name = pattern
                .replace("{tagPrefix}", safeTag.isEmpty() ? "" : safeTag + "/")
                .replace("{tag}", safeTag)
                .replace("{taskId}", taskId.replace('.', '-'))
                .replace("{slug}", slugify(title));
        // an empty slug leaves a dangling separator
        name = name.replaceAll("-{2,}", "-").replaceAll("[-/]+$", "");
        return name.isEmpty() ? "task-" + taskId.replace('.', '-') : name;
    }

    static String slugify(String title) {
        if (title == null) {
            return "";
        }
        String slug = title.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("^-+|-+$", "");
        if (slug.length() > MAX_SLUG_LENGTH) {
            slug = slug.substring(0, MAX_SLUG_LENGTH).replaceAll("-+$", "");
        }
        return slug;
    }

    public String pattern() {
        return pattern;
    }
}
