package com.yijian.api.controller;

import com.yijian.data.model.CorpusStats;
import com.yijian.data.store.VectorKnowledgeStore;
import com.yijian.llm.config.LlmProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Liveness and a detailed view of the knowledge store and configured backends.
 * No backend is called from here; the store check is a count query.
 */
@RestController
@RequestMapping("/api/health")
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private static final String SERVICE_NAME = "yijian-tutor";

    private final VectorKnowledgeStore knowledgeStore;
    private final LlmProperties llmProperties;

    private final AtomicLong requestCount = new AtomicLong();
    private final Instant startTime = Instant.now();

    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        requestCount.incrementAndGet();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "ok");
        response.put("message", "服务运行正常");
        response.put("service", SERVICE_NAME);
        response.put("timestamp", Instant.now().toString());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/detailed")
    public ResponseEntity<Map<String, Object>> detailedHealth() {
        requestCount.incrementAndGet();

        Map<String, Object> storeHealth = checkKnowledgeStore();

        Map<String, Object> llm = new LinkedHashMap<>();
        llm.put("generationProvider", llmProperties.getProvider().name());
        llm.put("embeddingProvider", llmProperties.getEmbedding().getProvider().name());
        llm.put("apiKeyConfigured", hasText(llmProperties.getApiKey()));
        llm.put("embeddingApiKeyConfigured", hasText(llmProperties.embeddingApiKey()));

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP".equals(storeHealth.get("status")) ? "UP" : "DEGRADED");
        response.put("service", SERVICE_NAME);
        response.put("timestamp", Instant.now().toString());
        response.put("uptime", getUptime());
        response.put("requestCount", requestCount.get());
        response.put("knowledgeStore", storeHealth);
        response.put("llm", llm);
        return ResponseEntity.ok(response);
    }

    private Map<String, Object> checkKnowledgeStore() {
        Map<String, Object> storeHealth = new LinkedHashMap<>();
        storeHealth.put("type", knowledgeStore.type());
        long checkStart = System.currentTimeMillis();
        try {
            CorpusStats stats = knowledgeStore.stats();
            storeHealth.put("status", stats.getTotal() > 0 ? "UP" : "EMPTY");
            storeHealth.put("chunks", stats.getTotal());
        } catch (RuntimeException e) {
            log.warn("Knowledge store health check failed: {}", e.getMessage());
            storeHealth.put("status", "DOWN");
            storeHealth.put("error", e.getMessage());
        }
        storeHealth.put("responseTimeMs", System.currentTimeMillis() - checkStart);
        return storeHealth;
    }

    private String getUptime() {
        long seconds = Instant.now().getEpochSecond() - startTime.getEpochSecond();
        long days = seconds / 86400;
        long hours = (seconds % 86400) / 3600;
        long minutes = (seconds % 3600) / 60;
        long secs = seconds % 60;

        if (days > 0) {
            return String.format("%dd %dh %dm %ds", days, hours, minutes, secs);
        } else if (hours > 0) {
            return String.format("%dh %dm %ds", hours, minutes, secs);
        } else if (minutes > 0) {
            return String.format("%dm %ds", minutes, secs);
        }
        return String.format("%ds", secs);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
