package com.taskpilot.core.engine;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BranchNameGeneratorTest {

    @Test
    @DisplayName("default pattern embeds task id and slug")
    void defaultPattern() {
        var generator = new BranchNameGenerator();

        assertEquals("task-12-add-user-login", generator.generate("12", "Add User Login!", null));
    }

    @Test
    @DisplayName("dots in the task id become dashes")
    void dottedTaskId() {
        assertEquals("task-3-2-fix-it", new BranchNameGenerator().generate("3.2", "Fix it", null));
    }

    @Test
    @DisplayName("tag becomes a path prefix")
    void tagPrefix() {
        assertEquals("backlog/task-1-x", new BranchNameGenerator().generate("1", "x", "backlog"));
    }

    @Test
    @DisplayName("missing title leaves no dangling dash")
    void missingTitle() {
        assertEquals("task-4", new BranchNameGenerator().generate("4", null, null));
    }

    @Test
    @DisplayName("slug is capped at 50 characters")
    void slugLength() {
        String slug = BranchNameGenerator.slugify("a".repeat(30) + " " + "b".repeat(30));

        assertTrue(slug.length() <= 50);
        assertFalse(slug.endsWith("-"));
    }

    @Test
    @DisplayName("custom pattern")
    void customPattern() {
        var generator = new BranchNameGenerator("tdd/{tag}/{taskId}");

        assertEquals("tdd/sprint-2/8", generator.generate("8", "Anything", "sprint-2"));
    }
}
