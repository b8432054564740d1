package com.yijian.llm.config;

import com.yijian.llm.provider.LlmProvider;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Generation and embedding backend settings. Base URL, model and key may be left unset, in which
 * case the provider defaults apply and the embedding side falls back to the generation key.
 */
@Configuration
@ConfigurationProperties(prefix = "yijian.llm")
@Getter
@Setter
public class LlmProperties {

    private LlmProvider provider = LlmProvider.OPENAI;
    private String apiKey;
    private String baseUrl;
    private String generationModel;
    private double temperature = 0.7;
    private int maxOutputTokens = 2000;
    private int synthesisTimeoutSeconds = 60;
    private int synthesisRetries = 1;
    private int requestsPerMinute = 0; // 0 = no local budget
    private Embedding embedding = new Embedding();

    @Getter
    @Setter
    public static class Embedding {
        private LlmProvider provider = LlmProvider.OPENAI;
        private String apiKey;
        private String baseUrl;
        private String model;
        private int timeoutSeconds = 15;
    }

    public String generationBaseUrl(LlmProvider client) {
        return client == provider && hasText(baseUrl) ? stripSlash(baseUrl) : client.getDefaultBaseUrl();
    }

    public String generationModel(LlmProvider client) {
        return client == provider && hasText(generationModel) ? generationModel : client.getDefaultGenerationModel();
    }

    public String embeddingBaseUrl(LlmProvider client) {
        if (client == embedding.provider && hasText(embedding.baseUrl)) {
            return stripSlash(embedding.baseUrl);
        }
        return generationBaseUrl(client);
    }

    public String embeddingModel(LlmProvider client) {
        return client == embedding.provider && hasText(embedding.model) ? embedding.model : client.getDefaultEmbeddingModel();
    }

    public String embeddingApiKey() {
        return hasText(embedding.apiKey) ? embedding.apiKey : apiKey;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static String stripSlash(String url) {
        String trimmed = url.trim();
        return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }
}
