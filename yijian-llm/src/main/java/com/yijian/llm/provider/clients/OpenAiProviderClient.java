package com.yijian.llm.provider.clients;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yijian.llm.config.LlmProperties;
import com.yijian.llm.provider.LlmProvider;
import com.yijian.llm.provider.ProviderClient;
import com.yijian.llm.provider.ProviderErrors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * OpenAI-compatible {@code /chat/completions}. Works against any base URL that speaks the same API.
 */
@Component
@Slf4j
public class OpenAiProviderClient implements ProviderClient {

    private final LlmProperties properties;
    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    public OpenAiProviderClient(LlmProperties properties, WebClient.Builder webClientBuilder, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.webClient = webClientBuilder.clone()
            .defaultHeader("Content-Type", MediaType.APPLICATION_JSON_VALUE)
            .build();
    }

    @Override
    public String generateContent(String systemPrompt, String prompt, Duration timeout) throws ProviderException {
        long startTime = System.currentTimeMillis();
        String model = properties.generationModel(LlmProvider.OPENAI);
        String apiKey = properties.getApiKey();

        if (apiKey == null || apiKey.isBlank()) {
            throw new ProviderException("OpenAI API key is not set. Set OPENAI_API_KEY or yijian.llm.api-key",
                LlmProvider.OPENAI, 401, false);
        }

        log.info("[OPENAI] Starting content generation | model={} | promptLength={}", model, prompt.length());

        Map<String, Object> request = Map.of(
            "model", model,
            "messages", List.of(
                Map.of("role", "system", "content", systemPrompt),
                Map.of("role", "user", "content", prompt)
            ),
            "temperature", properties.getTemperature(),
            "max_tokens", properties.getMaxOutputTokens()
        );

        String response;
        try {
            response = webClient.post()
                .uri(properties.generationBaseUrl(LlmProvider.OPENAI) + "/chat/completions")
                .header("Authorization", "Bearer " + apiKey)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout)
                .block();
        } catch (RuntimeException e) {
            ProviderException mapped = ProviderErrors.translate(e, LlmProvider.OPENAI, "generation", objectMapper);
            log.error("[OPENAI] Request failed | model={} | statusCode={} | retryable={} | durationMs={} | error={}",
                model, mapped.getStatusCode(), mapped.isRetryable(), System.currentTimeMillis() - startTime,
                mapped.getMessage());
            throw mapped;
        }

        String content = extractContent(response);
        log.info("[OPENAI] Content generated successfully | model={} | durationMs={} | responseLength={}",
            model, System.currentTimeMillis() - startTime, content.length());
        return content;
    }

    private String extractContent(String response) throws ProviderException {
        JsonNode choice;
        try {
            choice = objectMapper.readTree(response == null ? "{}" : response).path("choices").path(0);
        } catch (IOException e) {
            throw new ProviderException("Failed to parse OpenAI response", LlmProvider.OPENAI, 200, false,
                false, false, e);
        }
        String finishReason = choice.path("finish_reason").asText("");
        if ("content_filter".equals(finishReason)) {
            throw new ProviderException("OpenAI completion was blocked by the content filter",
                LlmProvider.OPENAI, 200, false);
        }
        String content = choice.path("message").path("content").asText("");
        if (content.isBlank()) {
            throw new ProviderException("OpenAI returned an empty completion", LlmProvider.OPENAI, 200, false);
        }
        return content;
    }

    @Override
    public LlmProvider getProvider() {
        return LlmProvider.OPENAI;
    }
}
