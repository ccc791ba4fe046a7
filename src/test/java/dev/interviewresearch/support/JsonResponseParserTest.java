package dev.interviewresearch.support;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class JsonResponseParserTest {

    private JsonResponseParser parser;

    @BeforeEach
    void setUp() {
        parser = new JsonResponseParser(new ObjectMapper());
    }

    @Test
    @DisplayName("Should parse a plain JSON object")
    void shouldParsePlainObject() {
        Optional<JsonNode> result = parser.parse("{\"industry\": \"Fintech\"}");

        assertThat(result).isPresent();
        assertThat(result.get().get("industry").asText()).isEqualTo("Fintech");
    }

    @Test
    @DisplayName("Should strip json code fences")
    void shouldStripJsonFences() {
        String content = """
                ```json
                {"interview_stages": [{"name": "Phone screen"}]}
                ```
                """;

        Optional<JsonNode> result = parser.parse(content);

        assertThat(result).isPresent();
        assertThat(result.get().get("interview_stages").get(0).get("name").asText()).isEqualTo("Phone screen");
    }

    @Test
    @DisplayName("Should strip plain code fences and uppercase language tags")
    void shouldStripPlainFences() {
        assertThat(parser.parse("```\n{\"a\": 1}\n```")).isPresent();
        assertThat(parser.parse("```JSON\n{\"a\": 1}\n```")).isPresent();
    }

    @Test
    @DisplayName("Should drop prose around the object")
    void shouldDropSurroundingProse() {
        Optional<JsonNode> result = parser.parse("Here is the analysis you asked for: {\"score\": 7} Hope it helps!");

        assertThat(result).isPresent();
        assertThat(result.get().get("score").asInt()).isEqualTo(7);
    }

    @Test
    @DisplayName("Should reject arrays, garbage and blank input")
    void shouldRejectNonObjects() {
        assertThat(parser.parse("[1, 2, 3]")).isEmpty();
        assertThat(parser.parse("not json at all")).isEmpty();
        assertThat(parser.parse("{\"unterminated\": ")).isEmpty();
        assertThat(parser.parse("   ")).isEmpty();
        assertThat(parser.parse(null)).isEmpty();
    }

    @Test
    @DisplayName("Should leave unwrapped content unchanged")
    void shouldLeaveUnwrappedContent() {
        assertThat(JsonResponseParser.stripWrapping("  {\"a\": 1}  ")).isEqualTo("{\"a\": 1}");
    }
}
