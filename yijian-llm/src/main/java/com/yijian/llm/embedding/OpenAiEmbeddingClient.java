package com.yijian.llm.embedding;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yijian.llm.config.LlmProperties;
import com.yijian.llm.provider.LlmProvider;
import com.yijian.llm.provider.ProviderClient.ProviderException;
import com.yijian.llm.provider.ProviderErrors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;

/**
 * OpenAI-compatible {@code /embeddings}.
 */
@Component
@Slf4j
public class OpenAiEmbeddingClient implements EmbeddingClient {

    private final LlmProperties properties;
    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    public OpenAiEmbeddingClient(LlmProperties properties, WebClient.Builder webClientBuilder, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.webClient = webClientBuilder.clone()
            .defaultHeader("Content-Type", MediaType.APPLICATION_JSON_VALUE)
            .build();
    }

    @Override
    public float[] embed(String text, Duration timeout) throws ProviderException {
        String apiKey = properties.embeddingApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            throw new ProviderException("OpenAI API key is not set for embeddings", LlmProvider.OPENAI, 401, false);
        }
        String model = properties.embeddingModel(LlmProvider.OPENAI);

        String response;
        try {
            response = webClient.post()
                .uri(properties.embeddingBaseUrl(LlmProvider.OPENAI) + "/embeddings")
                .header("Authorization", "Bearer " + apiKey)
                .bodyValue(Map.of("model", model, "input", text))
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout)
                .block();
        } catch (RuntimeException e) {
            throw ProviderErrors.translate(e, LlmProvider.OPENAI, "embedding", objectMapper);
        }

        JsonNode vector;
        try {
            vector = objectMapper.readTree(response == null ? "{}" : response)
                .path("data").path(0).path("embedding");
        } catch (IOException e) {
            throw new ProviderException("Failed to parse OpenAI embedding response", LlmProvider.OPENAI, 200, false,
                false, false, e);
        }
        if (!vector.isArray() || vector.isEmpty()) {
            throw new ProviderException("OpenAI embedding response carried no vector", LlmProvider.OPENAI, 200, false);
        }

        float[] values = new float[vector.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = (float) vector.get(i).asDouble(Double.NaN);
        }
        log.debug("[OPENAI] Embedding generated | model={} | dimensions={}", model, values.length);
        return values;
    }

    @Override
    public LlmProvider getProvider() {
        return LlmProvider.OPENAI;
    }
}
