package com.yijian.llm.embedding;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yijian.llm.config.LlmProperties;
import com.yijian.llm.model.EmbeddingResponse;
import com.yijian.llm.provider.LlmProvider;
import com.yijian.llm.provider.ProviderClient.ProviderException;
import com.yijian.llm.provider.ProviderErrors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;
import java.util.Map;

@Component
@Slf4j
public class GeminiEmbeddingClient implements EmbeddingClient {

    private final LlmProperties properties;
    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    public GeminiEmbeddingClient(LlmProperties properties, WebClient.Builder webClientBuilder, ObjectMapper objectMapper) {
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
            throw new ProviderException("Gemini API key is not set for embeddings", LlmProvider.GEMINI, 401, false);
        }
        String model = properties.embeddingModel(LlmProvider.GEMINI);
        String url = String.format("%s/models/%s:embedContent?key=%s",
            properties.embeddingBaseUrl(LlmProvider.GEMINI), model, apiKey);

        Map<String, Object> request = Map.of(
            "model", "models/" + model,
            "content", Map.of(
                "parts", List.of(Map.of("text", text))
            )
        );

        EmbeddingResponse response;
        try {
            response = webClient.post()
                .uri(url)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(EmbeddingResponse.class)
                .timeout(timeout)
                .block();
        } catch (RuntimeException e) {
            throw ProviderErrors.translate(e, LlmProvider.GEMINI, "embedding", objectMapper);
        }

        if (response == null || response.getEmbedding() == null || response.getEmbedding().getValues() == null) {
            throw new ProviderException("Gemini embedding response carried no vector", LlmProvider.GEMINI, 200, false);
        }
        float[] values = response.getEmbedding().getValues();
        log.debug("[GEMINI] Embedding generated | model={} | dimensions={}", model, values.length);
        return values;
    }

    @Override
    public LlmProvider getProvider() {
        return LlmProvider.GEMINI;
    }
}
