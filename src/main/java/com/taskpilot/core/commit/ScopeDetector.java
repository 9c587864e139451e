package com.taskpilot.core.commit;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Picks a conventional-commit scope from a set of changed files.
 *
 * <p>Each file maps to the scope of the first matching glob. The winning scope maximises
 * {@code priority * fileCount}; with no match the scope is {@code "repo"}.
 */
public class ScopeDetector {

    public static final String DEFAULT_SCOPE = "repo";

    private static final List<Map.Entry<String, String>> DEFAULT_MAPPINGS = List.of(
            Map.entry("**/src/test/**", "test"),
            Map.entry("src/test/**", "test"),
            Map.entry("**/*.test.*", "test"),
            Map.entry("**/*.spec.*", "test"),
            Map.entry("**/package-lock.json", "deps"),
            Map.entry("package-lock.json", "deps"),
            Map.entry("**/yarn.lock", "deps"),
            Map.entry("yarn.lock", "deps"),
            Map.entry("**/pom.xml", "build"),
            Map.entry("pom.xml", "build"),
            Map.entry("**/build.gradle*", "build"),
            Map.entry("build.gradle*", "build"),
            Map.entry("**/package.json", "config"),
            Map.entry("package.json", "config"),
            Map.entry("**/src/main/resources/**", "config"),
            Map.entry("src/main/resources/**", "config"),
            Map.entry("**/*.md", "docs"),
            Map.entry("*.md", "docs"),
            Map.entry("README*", "docs"),
            Map.entry("CHANGELOG*", "docs"));

    private static final Map<String, Integer> DEFAULT_PRIORITIES = Map.ofEntries(
            Map.entry("core", 100),
            Map.entry("cli", 90),
            Map.entry("workflow", 80),
            Map.entry("git", 75),
            Map.entry("storage", 70),
            Map.entry("config", 60),
            Map.entry("test", 50),
            Map.entry("build", 40),
            Map.entry("docs", 30),
            Map.entry("deps", 20),
            Map.entry(DEFAULT_SCOPE, 10));

    private final List<Map.Entry<Pattern, String>> mappings = new ArrayList<>();
    private final Map<String, Integer> priorities = new HashMap<>(DEFAULT_PRIORITIES);

    public ScopeDetector() {
        this(Map.of(), Map.of());
    }

    /**
     * @param customMappings   glob to scope, checked before the defaults in iteration order
     * @param customPriorities overrides or additions to the default priorities
     */
    public ScopeDetector(Map<String, String> customMappings, Map<String, Integer> customPriorities) {
        if (customMappings != null) {
            customMappings.forEach((glob, scope) -> mappings.add(Map.entry(globToRegex(glob), scope)));
        }
        for (var entry : DEFAULT_MAPPINGS) {
            mappings.add(Map.entry(globToRegex(entry.getKey()), entry.getValue()));
        }
        if (customPriorities != null) {
            priorities.putAll(customPriorities);
        }
    }

    public String detectScope(List<String> files) {
        if (files == null || files.isEmpty()) {
            return DEFAULT_SCOPE;
        }
        var counts = new LinkedHashMap<String, Integer>();
        for (String file : files) {
            String scope = getMatchingScope(file);
            if (scope != null) {
                counts.merge(scope, 1, Integer::sum);
            }
        }

        String best = DEFAULT_SCOPE;
        int bestScore = 0;
        for (var entry : counts.entrySet()) {
            int score = getScopePriority(entry.getKey()) * entry.getValue();
            if (score > bestScore) {
                bestScore = score;
                best = entry.getKey();
            }
        }
        return best;
    }

    public List<String> getAllMatchingScopes(List<String> files) {
        var scopes = new LinkedHashSet<String>();
        for (String file : files) {
            String scope = getMatchingScope(file);
            if (scope != null) {
                scopes.add(scope);
            }
        }
        return List.copyOf(scopes);
    }

    /**
     * Scope of the first mapping matching {@code file}, or null.
     */
    public String getMatchingScope(String file) {
        String normalized = file.replace('\\', '/');
        for (var mapping : mappings) {
            if (mapping.getKey().matcher(normalized).matches()) {
                return mapping.getValue();
            }
        }
        return null;
    }

    public int getScopePriority(String scope) {
        return priorities.getOrDefault(scope, 0);
    }

    /**
     * {@code **} matches across directories, {@code *} within one path segment.
     */
    static Pattern globToRegex(String glob) {
        var regex = new StringBuilder();
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            if (c == '*') {
                if (i + 1 < glob.length() && glob.charAt(i + 1) == '*') {
                    regex.append(".*");
                    i++;
                } else {
                    regex.append("[^/]*");
                }
            } else if (".+^${}()|[]\\?".indexOf(c) >= 0) {
                regex.append('\\').append(c);
            } else {
                regex.append(c);
            }
        }
        return Pattern.compile(regex.toString());
    }
}
