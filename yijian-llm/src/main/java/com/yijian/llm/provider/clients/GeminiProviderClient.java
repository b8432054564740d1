package com.yijian.llm.provider.clients;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yijian.llm.config.LlmProperties;
import com.yijian.llm.model.GenerationResponse;
import com.yijian.llm.provider.LlmProvider;
import com.yijian.llm.provider.ProviderClient;
import com.yijian.llm.provider.ProviderErrors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Component
@Slf4j
public class GeminiProviderClient implements ProviderClient {

    private static final Set<String> BLOCKED_FINISH_REASONS = Set.of("SAFETY", "RECITATION", "BLOCKLIST", "PROHIBITED_CONTENT");

    private final LlmProperties properties;
    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    public GeminiProviderClient(LlmProperties properties, WebClient.Builder webClientBuilder, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.webClient = webClientBuilder.clone()
            .defaultHeader("Content-Type", MediaType.APPLICATION_JSON_VALUE)
            .build();
    }

    @Override
    public String generateContent(String systemPrompt, String prompt, Duration timeout) throws ProviderException {
        long startTime = System.currentTimeMillis();
        String model = properties.generationModel(LlmProvider.GEMINI);
        String apiKey = properties.getApiKey();

        if (apiKey == null || apiKey.isBlank()) {
            throw new ProviderException("Gemini API key is not set. Set GEMINI_API_KEY or yijian.llm.api-key",
                LlmProvider.GEMINI, 401, false);
        }

        log.info("[GEMINI] Starting content generation | model={} | promptLength={}", model, prompt.length());

        Map<String, Object> request = Map.of(
            "contents", List.of(
                Map.of("parts", List.of(Map.of("text", prompt)))
            ),
            "systemInstruction", Map.of(
                "parts", List.of(Map.of("text", systemPrompt))
            ),
            "generationConfig", Map.of(
                "temperature", properties.getTemperature(),
                "maxOutputTokens", properties.getMaxOutputTokens()
            )
        );

        String url = String.format("%s/models/%s:generateContent?key=%s",
            properties.generationBaseUrl(LlmProvider.GEMINI), model, apiKey);

        GenerationResponse response;
        try {
            response = webClient.post()
                .uri(url)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(GenerationResponse.class)
                .timeout(timeout)
                .block();
        } catch (RuntimeException e) {
            ProviderException mapped = ProviderErrors.translate(e, LlmProvider.GEMINI, "generation", objectMapper);
            log.error("[GEMINI] Request failed | model={} | statusCode={} | retryable={} | durationMs={} | error={}",
                model, mapped.getStatusCode(), mapped.isRetryable(), System.currentTimeMillis() - startTime,
                mapped.getMessage());
            throw mapped;
        }

        if (response == null) {
            throw new ProviderException("Gemini returned no body", LlmProvider.GEMINI, 200, false);
        }
        String finishReason = response.firstFinishReason();
        if (finishReason != null && BLOCKED_FINISH_REASONS.contains(finishReason)) {
            log.warn("[GEMINI] Generation blocked | model={} | finishReason={}", model, finishReason);
            throw new ProviderException("Gemini blocked the completion: " + finishReason, LlmProvider.GEMINI, 200, false);
        }
        String content = response.firstCandidateText();
        if (content.isBlank()) {
            throw new ProviderException("Gemini returned an empty completion", LlmProvider.GEMINI, 200, false);
        }

        log.info("[GEMINI] Content generated successfully | model={} | durationMs={} | responseLength={}",
            model, System.currentTimeMillis() - startTime, content.length());
        return content;
    }

    @Override
    public LlmProvider getProvider() {
        return LlmProvider.GEMINI;
    }
}
