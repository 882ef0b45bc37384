package com.ai.studyengine.service.generation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonResponseRepairTest {

    private final JsonResponseRepair repair = new JsonResponseRepair(new ObjectMapper());

    @Test
    void stripsMarkdownFencesAndSurroundingProse() throws Exception {
        JsonNode node = repair.parse("Here is the result:\n```json\n{\"title\": \"Cells\"}\n```\nHope it helps!", false);

        assertThat(node.get("title").asText()).isEqualTo("Cells");
    }

    @Test
    void restoresTheSeededOpeningBrace() throws Exception {
        JsonNode node = repair.parse("\"categories\": [], \"title\": \"Cells\"}", true);

        assertThat(node.get("categories").isArray()).isTrue();
        assertThat(node.get("title").asText()).isEqualTo("Cells");
    }

    @Test
    void keepsAReplyThatRepeatsTheSeed() throws Exception {
        assertThat(repair.parse("{\"n\": 1}", true).get("n").asInt()).isEqualTo(1);
    }

    @Test
    void acceptsTrailingCommas() throws Exception {
        JsonNode node = repair.parse("{\"options\": [\"A\", \"B\",], \"correctAnswer\": 1,}", false);

        assertThat(node.get("options").size()).isEqualTo(2);
        assertThat(node.get("correctAnswer").asInt()).isEqualTo(1);
    }

    @Test
    void rejectsBlankReplies() {
        assertThatThrownBy(() -> repair.parse("   ", false))
                .isInstanceOf(SchemaViolationException.class)
                .hasMessage("Empty response from backend");
    }

    @Test
    void rejectsRepliesWithoutAnObject() {
        assertThatThrownBy(() -> repair.parse("[1, 2, 3]", false))
                .isInstanceOf(SchemaViolationException.class)
                .hasMessage("No JSON object found in response");
    }

    @Test
    void rejectsMalformedJson() {
        assertThatThrownBy(() -> repair.parse("{\"title\": \"Cells\" \"extra\": 1}", false))
                .isInstanceOf(SchemaViolationException.class)
                .hasMessageStartingWith("Malformed JSON");
    }
}
