package com.motionindex.processing.classification;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class OpenAiClassificationProviderTest {

    private final ClassificationResponseParser parser = new ClassificationResponseParser(new ObjectMapper());

    @Test
    void testReadsCompletionContent() throws Exception {
        RestClient.Builder builder = RestClient.builder();
        MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
        OpenAiClassificationProvider provider = new OpenAiClassificationProvider(builder, "https://openai.test",
                "sk-test", "gpt-4o-mini", 12000, parser);
        server.expect(requestTo("https://openai.test/v1/chat/completions"))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer sk-test"))
                .andExpect(jsonPath("$.response_format.type").value("json_object"))
                .andRespond(withSuccess("{\"choices\":[{\"message\":{\"role\":\"assistant\","
                        + "\"content\":\"{\\\"document_type\\\":\\\"complaint\\\",\\\"confidence\\\":0.9}\"}}]}",
                        MediaType.APPLICATION_JSON));

        ClassificationResult result = provider.classify("COMPLAINT for breach of contract", null);

        assertThat(result.getDocumentType()).isEqualTo("complaint");
        assertThat(result.getProvider()).isEqualTo("openai:gpt-4o-mini");
        server.verify();
    }

    @Test
    void testInsufficientQuotaBody() {
        RestClient.Builder builder = RestClient.builder();
        MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
        OpenAiClassificationProvider provider = new OpenAiClassificationProvider(builder, "https://openai.test",
                "sk-test", "gpt-4o-mini", 12000, parser);
        server.expect(requestTo("https://openai.test/v1/chat/completions"))
                .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"error\":{\"type\":\"insufficient_quota\"}}"));

        assertThatThrownBy(() -> provider.classify("text", null))
                .isInstanceOf(ClassificationException.class)
                .satisfies(e -> assertThat(((ClassificationException) e).getCategory())
                        .isEqualTo(ErrorCategory.INSUFFICIENT_QUOTA));
    }

    @Test
    void testMissingApiKeyIsConfigurationError() {
        OpenAiClassificationProvider provider = new OpenAiClassificationProvider(RestClient.builder(),
                "https://openai.test", "", "gpt-4o-mini", 12000, parser);

        assertThatThrownBy(() -> provider.classify("text", null))
                .isInstanceOf(ClassificationException.class)
                .satisfies(e -> assertThat(((ClassificationException) e).getCategory())
                        .isEqualTo(ErrorCategory.CONFIGURATION_ERROR));
    }
}
