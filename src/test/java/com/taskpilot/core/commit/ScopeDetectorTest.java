package com.taskpilot.core.commit;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ScopeDetectorTest {

    private final ScopeDetector detector = new ScopeDetector();

    @Test
    @DisplayName("test sources map to the test scope")
    void testScope() {
        assertEquals("test", detector.detectScope(List.of("src/test/java/com/acme/ReportTest.java")));
        assertEquals("test", detector.detectScope(List.of("module/src/test/java/FooTest.java")));
    }

    @Test
    @DisplayName("no files or no matches fall back to repo")
    void fallback() {
        assertEquals("repo", detector.detectScope(List.of()));
        assertEquals("repo", detector.detectScope(null));
        assertEquals("repo", detector.detectScope(List.of("src/main/java/com/acme/Report.java")));
    }

    @Test
    @DisplayName("score weighs priority by file count")
    void weightedScore() {
        // build 40 x 1 against docs 30 x 2
        assertEquals("docs", detector.detectScope(List.of("pom.xml", "README.md", "docs/guide.md")));
        assertEquals("build", detector.detectScope(List.of("pom.xml", "README.md")));
    }

    @Test
    @DisplayName("custom mappings win over defaults")
    void customMappings() {
        var custom = new ScopeDetector(Map.of("src/main/java/**/cli/**", "cli"), Map.of());

        assertEquals("cli", custom.detectScope(List.of("src/main/java/com/acme/cli/Main.java", "pom.xml")));
        assertEquals(90, custom.getScopePriority("cli"));
    }

    @Test
    @DisplayName("custom priorities override defaults")
    void customPriorities() {
        var custom = new ScopeDetector(Map.of(), Map.of("docs", 500));

        assertEquals("docs", custom.detectScope(List.of("pom.xml", "README.md")));
        assertEquals(0, custom.getScopePriority("unknown"));
    }

    @Test
    @DisplayName("lists every distinct matching scope in order")
    void allScopes() {
        assertEquals(List.of("build", "test", "docs"), detector.getAllMatchingScopes(List.of(
                "pom.xml", "src/test/java/ATest.java", "src/test/java/BTest.java", "CHANGELOG.md", "Main.java")));
    }

    @Test
    @DisplayName("single star stays within a path segment")
    void globSegments() {
        assertTrue(ScopeDetector.globToRegex("*.md").matcher("README.md").matches());
        assertFalse(ScopeDetector.globToRegex("*.md").matcher("docs/README.md").matches());
        assertTrue(ScopeDetector.globToRegex("**/*.md").matcher("docs/README.md").matches());
        assertEquals("test", detector.getMatchingScope("src\\test\\java\\ATest.java"));
    }
}
