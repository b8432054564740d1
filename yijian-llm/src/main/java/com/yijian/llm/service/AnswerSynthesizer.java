package com.yijian.llm.service;

import com.yijian.common.exception.QuotaExceededException;
import com.yijian.common.exception.SynthesisUnavailableException;
import com.yijian.common.util.TextUtils;
import com.yijian.llm.config.LlmProperties;
import com.yijian.llm.provider.LlmProvider;
import com.yijian.llm.provider.ProviderClient;
import com.yijian.llm.provider.ProviderClient.ProviderException;
import com.yijian.llm.ratelimit.RequestBudget;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Sends a composed prompt to the generation backend and returns the answer text.
 *
 * <p>Timeouts, connection errors and 5xx responses are retried up to
 * {@code yijian.llm.synthesis-retries} times. Quota exhaustion, local or remote, is reported as
 * {@link QuotaExceededException}; every other failure as {@link SynthesisUnavailableException}.
 */
@Service
@Slf4j
public class AnswerSynthesizer {

    private final Map<LlmProvider, ProviderClient> providerClients = new EnumMap<>(LlmProvider.class);
    private final LlmProperties properties;
    private final RequestBudget requestBudget;

    public AnswerSynthesizer(List<ProviderClient> clients, LlmProperties properties) {
        this.properties = properties;
        for (ProviderClient client : clients) {
            providerClients.put(client.getProvider(), client);
        }
        this.requestBudget = properties.getRequestsPerMinute() > 0
            ? RequestBudget.perMinute(properties.getRequestsPerMinute())
            : null;
        log.info("[SYNTHESIZER] Initialized | provider={} | timeoutSeconds={} | retries={} | requestsPerMinute={}",
            properties.getProvider(), properties.getSynthesisTimeoutSeconds(), properties.getSynthesisRetries(),
            properties.getRequestsPerMinute());
    }

    public String synthesize(String systemPrompt, String userPrompt) {
        LlmProvider provider = properties.getProvider();
        ProviderClient client = providerClients.get(provider);
        if (client == null) {
            throw new SynthesisUnavailableException("No generation client registered for " + provider);
        }

        if (requestBudget != null && !requestBudget.tryAcquire()) {
            long waitMs = requestBudget.millisUntilNextPermit();
            log.warn("[SYNTHESIZER] Local request budget exhausted | provider={} | retryInMs={}", provider, waitMs);
            throw new QuotaExceededException("Local request budget exhausted, next slot in " + waitMs + "ms");
        }

        Duration timeout = Duration.ofSeconds(properties.getSynthesisTimeoutSeconds());
        int maxAttempts = 1 + Math.max(0, properties.getSynthesisRetries());
        ProviderException lastFailure = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            long startTime = System.currentTimeMillis();
            try {
                String text = TextUtils.normalizeWhitespace(client.generateContent(systemPrompt, userPrompt, timeout));
                if (text.isEmpty()) {
                    throw new SynthesisUnavailableException("Generation backend returned an empty answer");
                }
                log.info("[SYNTHESIZER] Answer synthesized | provider={} | attempt={}/{} | durationMs={} | answerLength={}",
                    provider, attempt, maxAttempts, System.currentTimeMillis() - startTime, text.length());
                return text;
            } catch (ProviderException e) {
                if (e.isQuotaExhausted()) {
                    log.warn("[SYNTHESIZER] Backend quota exhausted | provider={} | statusCode={}", provider, e.getStatusCode());
                    throw new QuotaExceededException("Generation backend quota exhausted: " + e.getMessage(), e);
                }
                if (Thread.currentThread().isInterrupted()) {
                    throw new SynthesisUnavailableException("Synthesis cancelled", e);
                }
                if (!e.isRetryable()) {
                    throw new SynthesisUnavailableException("Generation backend rejected the request: " + e.getMessage(), e);
                }
                lastFailure = e;
                log.warn("[SYNTHESIZER] Attempt failed | provider={} | attempt={}/{} | timeout={} | statusCode={} | durationMs={}",
                    provider, attempt, maxAttempts, e.isTimeout(), e.getStatusCode(), System.currentTimeMillis() - startTime);
            }
        }

        throw new SynthesisUnavailableException(
            "Generation backend failed after " + maxAttempts + " attempts: " + lastFailure.getMessage(), lastFailure);
    }
}
