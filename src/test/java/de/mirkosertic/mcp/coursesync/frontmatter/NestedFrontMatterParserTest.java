package de.mirkosertic.mcp.coursesync.frontmatter;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("NestedFrontMatterParser Tests")
class NestedFrontMatterParserTest {

    private final NestedFrontMatterParser parser = new NestedFrontMatterParser();

    @Test
    @DisplayName("Should parse a list of answer maps")
    void shouldParseListOfMaps() {
        // Given
        final String text = """
                ---
                pagetype: multichoice
                answers:
                  - text: "A"
                    correct: true
                    feedback: Right
                  - text: "B"
                    correct: false
                ---
                Which one?
                """;

        // When
        final FrontMatter result = parser.parse(text);

        // Then
        assertThat(result.getString("pagetype")).isEqualTo("multichoice");
        assertThat(result.getList("answers")).containsExactly(
                Map.of("text", "A", "correct", true, "feedback", "Right"),
                Map.of("text", "B", "correct", false));
        assertThat(result.body()).isEqualTo("Which one?\n");
    }

    @Test
    @DisplayName("Should parse scalar list items and integers")
    void shouldParseScalarItems() {
        final String text = "---\ntags:\n  - java\n  - 42\nweight: 7\n---\n";

        final FrontMatter result = parser.parse(text);

        assertThat(result.getList("tags")).containsExactly("java", 42);
        assertThat(result.metadata().get("weight")).isEqualTo(7);
    }

    @Test
    @DisplayName("Should return to top level after a list")
    void shouldReturnToTopLevel() {
        final String text = "---\nanswers:\n  - text: X\ntitle: After\n---\n";

        final FrontMatter result = parser.parse(text);

        assertThat(result.getList("answers")).hasSize(1);
        assertThat(result.getString("title")).isEqualTo("After");
    }

    @Test
    @DisplayName("Should keep an empty list for a key without items")
    void shouldKeepEmptyList() {
        final FrontMatter result = parser.parse("---\nanswers:\ntitle: T\n---\n");

        assertThat(result.metadata().get("answers")).isEqualTo(List.of());
        assertThat(result.getString("title")).isEqualTo("T");
    }

    @Test
    @DisplayName("Should parse true/false question keys")
    void shouldParseTrueFalseKeys() {
        final String text = "---\npagetype: truefalse\ncorrect: false\nfeedback_correct: Yes\n"
                + "feedback_incorrect: No\n---\nIs Java compiled?";

        final FrontMatter result = parser.parse(text);

        assertThat(result.getBoolean("correct", true)).isFalse();
        assertThat(result.getString("feedback_incorrect")).isEqualTo("No");
    }
}
