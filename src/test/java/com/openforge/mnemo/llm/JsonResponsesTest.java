package com.openforge.mnemo.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class JsonResponsesTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void plainObjectIsReadAsIs() {
        ObjectNode node = JsonResponses.parseObject(mapper, "{\"intent\": \"navigation\"}");

        assertThat(node.path("intent").asText()).isEqualTo("navigation");
    }

    @Test
    void markdownFenceIsStripped() {
        String raw = """
                Here you go:
                ```json
                {"search_keywords": ["airport", "Lisa"]}
                ```
                """;

        ObjectNode node = JsonResponses.parseObject(mapper, raw);

        assertThat(node.path("search_keywords")).hasSize(2);
    }

    @Test
    void outermostBracesAreRecoveredFromProse() {
        ObjectNode node = JsonResponses.parseObject(mapper,
                "Sure! {\"episodic_memories\": [{\"lossless_restatement\": \"x\"}]} Hope that helps.");

        assertThat(node.path("episodic_memories").isArray()).isTrue();
    }

    @Test
    void garbageYieldsAnEmptyObject() {
        assertThat(JsonResponses.parseObject(mapper, "I could not do that")).isEmpty();
        assertThat(JsonResponses.parseObject(mapper, "{broken")).isEmpty();
        assertThat(JsonResponses.parseObject(mapper, "[1, 2, 3]")).isEmpty();
        assertThat(JsonResponses.parseObject(mapper, null)).isEmpty();
    }
}
