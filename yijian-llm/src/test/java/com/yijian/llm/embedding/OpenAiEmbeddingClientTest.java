package com.yijian.llm.embedding;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yijian.llm.config.LlmProperties;
import com.yijian.llm.provider.ProviderClient.ProviderException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OpenAiEmbeddingClientTest {

    private LlmProperties properties;

    @BeforeEach
    void setUp() {
        properties = new LlmProperties();
        properties.setApiKey("sk-generation");
    }

    private OpenAiEmbeddingClient clientResponding(HttpStatus status, String body) {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> Mono.just(
            ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build()));
        return new OpenAiEmbeddingClient(properties, builder, new ObjectMapper());
    }

    @Test
    void readsTheFirstEmbedding() {
        OpenAiEmbeddingClient client = clientResponding(HttpStatus.OK,
            "{\"data\":[{\"index\":0,\"embedding\":[0.25,-0.5,1.0]}],\"model\":\"text-embedding-3-small\"}");

        assertThat(client.embed("净现值", Duration.ofSeconds(5))).containsExactly(0.25f, -0.5f, 1.0f);
    }

    @Test
    void missingVectorIsAnError() {
        OpenAiEmbeddingClient client = clientResponding(HttpStatus.OK, "{\"data\":[]}");

        assertThatThrownBy(() -> client.embed("净现值", Duration.ofSeconds(5)))
            .isInstanceOf(ProviderException.class);
    }

    @Test
    void embeddingKeyFallsBackToTheGenerationKey() {
        assertThat(properties.embeddingApiKey()).isEqualTo("sk-generation");

        properties.getEmbedding().setApiKey("sk-embedding");

        assertThat(properties.embeddingApiKey()).isEqualTo("sk-embedding");
    }
}
