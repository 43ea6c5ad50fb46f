package com.motionindex.processing.classification;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClassificationResponseParserTest {

    private final ClassificationResponseParser parser = new ClassificationResponseParser(new ObjectMapper());

    @Test
    void testParsesFencedResponse() throws Exception {
        String response = "```json\n{\"document_type\": \"Motion to Dismiss\", \"legal_category\": \"civil_procedure\","
                + " \"confidence\": 0.87, \"summary\": \"Defendant moves to dismiss.\","
                + " \"keywords\": [\"dismiss\", \"\"], \"legal_tags\": [\"rule_12b6\"]}\n```";

        ClassificationResult result = parser.parse(response, "ollama");

        assertThat(result.getDocumentType()).isEqualTo("motion_to_dismiss");
        assertThat(result.getLegalCategory()).isEqualTo("civil_procedure");
        assertThat(result.getConfidence()).isEqualTo(0.87);
        assertThat(result.getSummary()).isEqualTo("Defendant moves to dismiss.");
        assertThat(result.getKeywords()).containsExactly("dismiss");
        assertThat(result.getTags()).containsExactly("rule_12b6");
        assertThat(result.getProvider()).isEqualTo("ollama");
    }

    @Test
    void testConfidenceIsClamped() throws Exception {
        assertThat(parser.parse("{\"document_type\": \"order\", \"confidence\": 4.2}", "openai").getConfidence())
                .isEqualTo(1.0);
        assertThat(parser.parse("{\"document_type\": \"order\", \"confidence\": -1}", "openai").getConfidence())
                .isZero();
    }

    @Test
    void testMissingLegalCategoryDefaultsToUnknown() throws Exception {
        assertThat(parser.parse("{\"document_type\": \"brief\"}", "gemini").getLegalCategory()).isEqualTo("unknown");
    }

    @Test
    void testMissingDocumentTypeIsValidationError() {
        assertThatThrownBy(() -> parser.parse("{\"legal_category\": \"criminal\"}", "ollama"))
                .isInstanceOf(ClassificationException.class)
                .satisfies(e -> assertThat(((ClassificationException) e).getCategory())
                        .isEqualTo(ErrorCategory.VALIDATION_ERROR));
    }

    @Test
    void testInvalidJsonIsParseError() {
        assertThatThrownBy(() -> parser.parse("I think this is a motion.", "ollama"))
                .isInstanceOf(ClassificationException.class)
                .satisfies(e -> assertThat(((ClassificationException) e).getCategory())
                        .isEqualTo(ErrorCategory.RESPONSE_PARSE_ERROR));
        assertThatThrownBy(() -> parser.parse("[1, 2]", "ollama"))
                .isInstanceOf(ClassificationException.class)
                .hasMessageContaining("not a JSON object");
        assertThatThrownBy(() -> parser.parse("  ", "ollama"))
                .isInstanceOf(ClassificationException.class)
                .hasMessageContaining("empty response");
    }

    @Test
    void testStripCodeFence() {
        assertThat(ClassificationResponseParser.stripCodeFence("```\n{}\n```")).isEqualTo("{}");
        assertThat(ClassificationResponseParser.stripCodeFence(" {\"a\":1} ")).isEqualTo("{\"a\":1}");
    }
}
