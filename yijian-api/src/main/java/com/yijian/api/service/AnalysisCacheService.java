package com.yijian.api.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.yijian.api.config.AnalysisCacheProperties;
import com.yijian.common.constants.Subject;
import com.yijian.core.query.ExamItemFlattener;
import com.yijian.core.query.model.AnalysisResult;
import com.yijian.core.query.model.ExamItem;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.Base64;
import java.util.function.Supplier;

/**
 * Optional in-process cache in front of exam analysis. Keyed by a SHA-256 of the flattened item
 * and its effective subject. Only successful results are stored; failures always reach the caller.
 */
@Service
@Slf4j
public class AnalysisCacheService {

    private final AnalysisCacheProperties properties;
    private final ExamItemFlattener flattener;
    private final Cache<String, AnalysisResult> cache;

    @Autowired
    public AnalysisCacheService(AnalysisCacheProperties properties, ExamItemFlattener flattener) {
        this(properties, flattener, Ticker.systemTicker());
    }

    AnalysisCacheService(AnalysisCacheProperties properties, ExamItemFlattener flattener, Ticker ticker) {
        this.properties = properties;
        this.flattener = flattener;
        this.cache = Caffeine.newBuilder()
            .recordStats()
            .expireAfterWrite(Duration.ofMinutes(properties.getTtlMinutes()))
            .maximumSize(properties.getMaxEntries())
            .ticker(ticker)
            .build();
    }

    public AnalysisResult getOrCompute(ExamItem item, Subject subject, Supplier<AnalysisResult> analysis) {
        if (!properties.isEnabled()) {
            return analysis.get();
        }

        Subject effectiveSubject = subject != null ? subject : (item == null ? null : item.getSubject());
        String key = cacheKey(flattener.flatten(item, effectiveSubject), effectiveSubject);

        AnalysisResult cached = cache.getIfPresent(key);
        if (cached != null) {
            log.info("[ANALYSIS_CACHE] Cache hit | key={} | hitRate={}",
                key.substring(0, 8), String.format("%.2f", cache.stats().hitRate()));
            return cached;
        }

        // concurrent misses on one key share a single computation
        return cache.get(key, k -> {
            AnalysisResult result = analysis.get();
            log.debug("[ANALYSIS_CACHE] Stored analysis | key={}", k.substring(0, 8));
            return result;
        });
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public void clear() {
        cache.invalidateAll();
    }

    static String cacheKey(String flattenedItem, Subject subject) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            md.update(flattenedItem.getBytes(StandardCharsets.UTF_8));
            md.update((byte) 0);
            md.update((subject == null ? "" : subject.getSlug()).getBytes(StandardCharsets.UTF_8));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(md.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
