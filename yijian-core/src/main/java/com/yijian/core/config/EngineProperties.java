package com.yijian.core.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Retrieval and prompt-assembly tuning.
 */
@Configuration
@ConfigurationProperties(prefix = "yijian.engine")
@Getter
@Setter
public class EngineProperties {
    private int topK = 5;
    private int maxTopK = 20;
    private double similarityFloor = 0.30;
    private double duplicateSimilarity = 0.98;
    private int candidateMultiplier = 3;
    private int excerptMaxChars = 200;
    private int maxContextTokens = 6000;

    /**
     * Requested K, or the default when absent, clamped to {@code [1, maxTopK]}.
     */
    public int resolveTopK(Integer requested) {
        int k = requested != null ? requested : topK;
        return Math.max(1, Math.min(k, maxTopK));
    }
}
