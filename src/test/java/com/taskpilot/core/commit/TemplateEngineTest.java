package com.taskpilot.core.commit;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TemplateEngineTest {

    private final TemplateEngine engine = new TemplateEngine();

    @Nested
    @DisplayName("variables")
    class VariableTests {

        @Test
        @DisplayName("substitutes present variables")
        void substitutes() {
            assertEquals("feat: add X",
                    engine.renderInline("{{type}}: {{description}}", Map.of("type", "feat", "description", "add X")));
        }

        @Test
        @DisplayName("blanks absent variables by default")
        void blanksAbsent() {
            assertEquals("feat: ", engine.renderInline("{{type}}: {{description}}", Map.of("type", "feat")));
        }

        @Test
        @DisplayName("keeps absent placeholders when configured")
        void preservesAbsent() {
            var preserving = new TemplateEngine(Map.of(), true);

            assertEquals("feat: {{description}}",
                    preserving.renderInline("{{type}}: {{description}}", Map.of("type", "feat")));
        }

        @Test
        @DisplayName("tolerates whitespace inside braces")
        void whitespace() {
            assertEquals("x", engine.renderInline("{{ name }}", Map.of("name", "x")));
        }

        @Test
        @DisplayName("values containing regex replacement characters are inserted literally")
        void literalValues() {
            assertEquals("cost $5 \\o/", engine.renderInline("{{v}}", Map.of("v", "cost $5 \\o/")));
        }
    }

    @Nested
    @DisplayName("conditional blocks")
    class BlockTests {

        @Test
        @DisplayName("renders a block only for truthy variables")
        void truthiness() {
            String template = "a{{#flag}}-yes{{/flag}}";
            var vars = new HashMap<String, Object>();

            assertEquals("a", engine.renderInline(template, vars));
            vars.put("flag", false);
            assertEquals("a", engine.renderInline(template, vars));
            vars.put("flag", "");
            assertEquals("a", engine.renderInline(template, vars));
            vars.put("flag", 0);
            assertEquals("a-yes", engine.renderInline(template, vars));
        }

        @Test
        @DisplayName("resolves nested blocks innermost first")
        void nested() {
            String template = "{{#outer}}[{{#inner}}{{inner}}{{/inner}}]{{/outer}}";

            assertEquals("[in]", engine.renderInline(template, Map.of("outer", true, "inner", "in")));
            assertEquals("[]", engine.renderInline(template, Map.of("outer", true)));
            assertEquals("", engine.renderInline(template, Map.of("inner", "in")));
        }
    }

    @Nested
    @DisplayName("named templates")
    class NamedTemplateTests {

        @Test
        @DisplayName("commit message template is registered by default")
        void defaultTemplate() {
            assertTrue(engine.hasTemplate(TemplateEngine.COMMIT_MESSAGE));
            assertEquals("fix(git): Handle detached HEAD\n\n",
                    engine.render(TemplateEngine.COMMIT_MESSAGE,
                            Map.of("type", "fix", "scope", "git", "description", "Handle detached HEAD")));
        }

        @Test
        @DisplayName("custom templates override the defaults")
        void custom() {
            var custom = new TemplateEngine(Map.of(TemplateEngine.COMMIT_MESSAGE, "{{type}}: {{description}}"), false);

            assertEquals("feat: x", custom.render(TemplateEngine.COMMIT_MESSAGE,
                    Map.of("type", "feat", "description", "x")));
        }

        @Test
        @DisplayName("unknown template is rejected")
        void unknown() {
            var ex = assertThrows(IllegalArgumentException.class, () -> engine.render("nope", Map.of()));
            assertEquals("Template \"nope\" not found", ex.getMessage());
        }

        @Test
        @DisplayName("setTemplate registers a template")
        void setTemplate() {
            engine.setTemplate("short", "{{type}}");

            assertEquals("{{type}}", engine.getTemplate("short"));
            assertEquals("docs", engine.render("short", Map.of("type", "docs")));
        }
    }

    @Test
    @DisplayName("extracts variables and reports missing required ones")
    void extractAndValidate() {
        String template = "{{type}}{{#scope}}({{scope}}){{/scope}}: {{type}}";

        assertEquals(List.of("type", "scope"), engine.extractVariables(template));

        var result = engine.validateTemplate(template, List.of("type", "description"));
        assertFalse(result.valid());
        assertEquals(List.of("description"), result.missingVariables());
    }
}
