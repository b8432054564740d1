package com.yijian.core.query;

import com.yijian.common.constants.Subject;
import com.yijian.common.exception.EmptyQueryException;
import com.yijian.common.util.TextUtils;
import com.yijian.core.config.EngineProperties;
import com.yijian.core.query.model.RetrievedChunk;
import com.yijian.data.model.KnowledgeChunk;
import com.yijian.data.model.ScoredChunk;
import com.yijian.data.store.VectorKnowledgeStore;
import com.yijian.data.store.VectorMath;
import com.yijian.llm.service.EmbeddingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Finds the top-K textbook chunks for a query.
 *
 * <p>The store is asked for {@code k * candidateMultiplier} candidates. Chunks outside the subject
 * filter, below the similarity floor, or near-duplicates of a better chunk from the same source
 * are dropped before the list is cut to {@code k}. An empty result is a valid outcome.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class Retriever {

    static final Comparator<ScoredChunk> BEST_FIRST = Comparator
        .comparingDouble(ScoredChunk::getScore).reversed()
        .thenComparing(ScoredChunk::getId);

    private final EmbeddingService embeddingService;
    private final VectorKnowledgeStore knowledgeStore;
    private final EngineProperties properties;

    public List<RetrievedChunk> retrieve(String query, Subject subjectFilter, int k) {
        if (TextUtils.isBlank(query)) {
            throw new EmptyQueryException();
        }
        if (k < 1) {
            throw new IllegalArgumentException("k must be >= 1, was " + k);
        }

        long startTime = System.currentTimeMillis();
        log.info("[RETRIEVER] Starting retrieval | subject={} | k={} | query={}",
            subjectFilter, k, TextUtils.preview(query, 40));

        long embeddingStartTime = System.currentTimeMillis();
        float[] queryVector = embeddingService.embed(query);
        long embeddingDuration = System.currentTimeMillis() - embeddingStartTime;

        int candidateLimit = k * Math.max(1, properties.getCandidateMultiplier());
        long searchStartTime = System.currentTimeMillis();
        List<ScoredChunk> candidates = knowledgeStore.search(queryVector, subjectFilter, candidateLimit);
        long searchDuration = System.currentTimeMillis() - searchStartTime;

        List<ScoredChunk> eligible = new ArrayList<>();
        int offSubject = 0;
        int belowFloor = 0;
        for (ScoredChunk candidate : candidates) {
            if (subjectFilter != null && candidate.getChunk().getSubject() != subjectFilter) {
                offSubject++;
                continue;
            }
            if (candidate.getScore() < properties.getSimilarityFloor()) {
                belowFloor++;
                continue;
            }
            eligible.add(candidate);
        }
        if (offSubject > 0) {
            log.warn("[RETRIEVER] Store returned chunks outside the subject filter | subject={} | dropped={}",
                subjectFilter, offSubject);
        }
        eligible.sort(BEST_FIRST);

        List<ScoredChunk> kept = new ArrayList<>();
        int duplicates = 0;
        for (ScoredChunk candidate : eligible) {
            if (kept.size() == k) {
                break;
            }
            if (isNearDuplicateOfAny(candidate, kept)) {
                duplicates++;
                continue;
            }
            kept.add(candidate);
        }

        List<RetrievedChunk> result = new ArrayList<>(kept.size());
        for (int i = 0; i < kept.size(); i++) {
            ScoredChunk scored = kept.get(i);
            result.add(new RetrievedChunk(scored.getChunk(), scored.getScore(), i + 1));
        }

        log.info("[RETRIEVER] Retrieval completed | candidates={} | belowFloor={} | duplicates={} | returned={} | embeddingDurationMs={} | searchDurationMs={} | totalDurationMs={}",
            candidates.size(), belowFloor, duplicates, result.size(), embeddingDuration, searchDuration,
            System.currentTimeMillis() - startTime);
        return List.copyOf(result);
    }

    private boolean isNearDuplicateOfAny(ScoredChunk candidate, List<ScoredChunk> kept) {
        for (ScoredChunk better : kept) {
            if (isNearDuplicate(better.getChunk(), candidate.getChunk())) {
                return true;
            }
        }
        return false;
    }

    boolean isNearDuplicate(KnowledgeChunk a, KnowledgeChunk b) {
        if (!Objects.equals(a.getSourceLabel(), b.getSourceLabel())) {
            return false;
        }
        if (a.hasEmbedding() && b.hasEmbedding() && a.getEmbedding().length == b.getEmbedding().length) {
            return VectorMath.cosine(a.getEmbedding(), b.getEmbedding()) >= properties.getDuplicateSimilarity();
        }
        // no vectors to compare: only identical text counts
        return TextUtils.normalizeWhitespace(a.getContent()).equals(TextUtils.normalizeWhitespace(b.getContent()));
    }
}
