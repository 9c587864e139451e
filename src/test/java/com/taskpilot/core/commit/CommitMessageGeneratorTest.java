package com.taskpilot.core.commit;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CommitMessageGeneratorTest {

    private final CommitMessageGenerator generator = new CommitMessageGenerator();

    @Nested
    @DisplayName("generateMessage")
    class GenerateTests {

        @Test
        @DisplayName("renders header, task, phase and test lines")
        void fullMessage() {
            var options = CommitMessageOptions.builder("feat", "Add login")
                    .changedFiles(List.of("src/test/java/LoginTest.java"))
                    .taskId("7")
                    .phase("TDD")
                    .testsPassing(5)
                    .testsFailing(1)
                    .build();

            assertEquals("feat(test): Add login\n\nTask: 7\nPhase: TDD\nTests: 5 passing, 1 failing",
                    generator.generateMessage(options));
        }

        @Test
        @DisplayName("explicit scope, breaking marker and body")
        void scopeBreakingBody() {
            var options = CommitMessageOptions.builder("refactor", "Drop legacy format")
                    .scope("storage")
                    .breaking(true)
                    .body("State files written before 0.1 are no longer read.")
                    .taskId("9")
                    .build();

            assertEquals("refactor(storage)!: Drop legacy format\n\n"
                            + "State files written before 0.1 are no longer read.\n\nTask: 9",
                    generator.generateMessage(options));
        }

        @Test
        @DisplayName("no changed files gives the repo scope")
        void repoScope() {
            var message = generator.generateMessage(CommitMessageOptions.builder("chore", "Tidy").build());

            assertTrue(message.startsWith("chore(repo): Tidy"));
        }

        @Test
        @DisplayName("custom template can use tag and coverage")
        void customTemplate() {
            var engine = new TemplateEngine(Map.of("short",
                    "{{type}}: {{description}} [{{tag}}]{{#coveragePercent}} cov={{coveragePercent}}{{/coveragePercent}}"),
                    false);
            var custom = new CommitMessageGenerator(engine, new ScopeDetector(), "short");

            var message = custom.generateMessage(CommitMessageOptions.builder("feat", "x")
                    .tag("backlog").coveragePercent(87.5).build());

            assertEquals("feat: x [backlog] cov=87.5", message);
        }

        @Test
        @DisplayName("unknown template name is rejected at construction")
        void unknownTemplate() {
            assertThrows(IllegalArgumentException.class,
                    () -> new CommitMessageGenerator(new TemplateEngine(), new ScopeDetector(), "missing"));
        }
    }

    @Nested
    @DisplayName("validateConventionalCommit")
    class ValidateTests {

        @Test
        @DisplayName("accepts a well formed header")
        void valid() {
            var result = generator.validateConventionalCommit("feat(core): Add thing\n\nbody");

            assertTrue(result.valid());
            assertEquals(List.of(), result.errors());
        }

        @Test
        @DisplayName("rejects an unknown type")
        void unknownType() {
            var result = generator.validateConventionalCommit("feature: Add thing");

            assertFalse(result.valid());
            assertTrue(result.errors().get(0).startsWith("Invalid commit type \"feature\""));
        }

        @Test
        @DisplayName("rejects missing or malformed headers")
        void malformed() {
            assertEquals(List.of("Missing commit message"), generator.validateConventionalCommit("").errors());
            assertEquals(List.of("Invalid conventional commit format. Expected: type(scope): description"),
                    generator.validateConventionalCommit("just words").errors());
        }
    }

    @Nested
    @DisplayName("parseCommitMessage")
    class ParseTests {

        @Test
        @DisplayName("splits header parts and body")
        void parse() {
            var parsed = generator.parseCommitMessage("fix(git)!: Handle detached HEAD\n\nLine one\nLine two\n");

            assertEquals("fix", parsed.type());
            assertEquals("git", parsed.scope());
            assertTrue(parsed.breaking());
            assertEquals("Handle detached HEAD", parsed.description());
            assertEquals("Line one\nLine two", parsed.body());
        }

        @Test
        @DisplayName("scope and body are optional")
        void minimal() {
            var parsed = generator.parseCommitMessage("docs: Update readme");

            assertNull(parsed.scope());
            assertNull(parsed.body());
            assertFalse(parsed.breaking());
        }

        @Test
        @DisplayName("generated messages parse back")
        void generatedParses() {
            String message = generator.generateMessage(CommitMessageOptions.builder("test", "Cover parser")
                    .changedFiles(List.of("src/test/java/ParserTest.java")).taskId("3").build());

            assertTrue(generator.validateConventionalCommit(message).valid());
            assertEquals("test", generator.parseCommitMessage(message).scope());
        }

        @Test
        @DisplayName("malformed header is rejected")
        void malformed() {
            assertThrows(IllegalArgumentException.class, () -> generator.parseCommitMessage("nonsense"));
        }
    }
}
