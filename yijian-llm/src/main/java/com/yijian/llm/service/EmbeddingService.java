package com.yijian.llm.service;

import com.yijian.common.exception.EmbeddingUnavailableException;
import com.yijian.llm.config.LlmProperties;
import com.yijian.llm.embedding.EmbeddingClient;
import com.yijian.llm.provider.LlmProvider;
import com.yijian.llm.provider.ProviderClient.ProviderException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Turns query text into a vector using the configured embedding backend.
 * One bounded call per query; failures surface as {@link EmbeddingUnavailableException}.
 */
@Service
@Slf4j
public class EmbeddingService {

    private final Map<LlmProvider, EmbeddingClient> clients = new EnumMap<>(LlmProvider.class);
    private final LlmProperties properties;

    public EmbeddingService(List<EmbeddingClient> embeddingClients, LlmProperties properties) {
        this.properties = properties;
        for (EmbeddingClient client : embeddingClients) {
            clients.put(client.getProvider(), client);
        }
    }

    public float[] embed(String text) {
        LlmProvider provider = properties.getEmbedding().getProvider();
        EmbeddingClient client = clients.get(provider);
        if (client == null) {
            throw new EmbeddingUnavailableException("No embedding client registered for " + provider);
        }

        long startTime = System.currentTimeMillis();
        Duration timeout = Duration.ofSeconds(properties.getEmbedding().getTimeoutSeconds());
        float[] vector;
        try {
            vector = client.embed(text, timeout);
        } catch (ProviderException e) {
            log.error("[EMBEDDING] Embedding failed | provider={} | statusCode={} | timeout={} | durationMs={} | error={}",
                provider, e.getStatusCode(), e.isTimeout(), System.currentTimeMillis() - startTime, e.getMessage());
            throw new EmbeddingUnavailableException("Embedding backend unavailable: " + e.getMessage(), e);
        }

        if (!isUsable(vector)) {
            log.error("[EMBEDDING] Malformed vector | provider={} | length={}", provider,
                vector == null ? 0 : vector.length);
            throw new EmbeddingUnavailableException("Embedding backend returned a malformed vector");
        }

        log.debug("[EMBEDDING] Query embedded | provider={} | dimensions={} | durationMs={}",
            provider, vector.length, System.currentTimeMillis() - startTime);
        return vector;
    }

    static boolean isUsable(float[] vector) {
        if (vector == null || vector.length == 0) {
            return false;
        }
        boolean nonZero = false;
        for (float v : vector) {
            if (Float.isNaN(v) || Float.isInfinite(v)) {
                return false;
            }
            if (v != 0f) {
                nonZero = true;
            }
        }
        return nonZero;
    }
}
