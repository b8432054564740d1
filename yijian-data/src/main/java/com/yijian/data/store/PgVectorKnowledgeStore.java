package com.yijian.data.store;

import com.yijian.common.constants.Subject;
import com.yijian.common.exception.EmbeddingUnavailableException;
import com.yijian.data.config.StoreProperties;
import com.yijian.data.model.CorpusStats;
import com.yijian.data.model.ScoredChunk;
import com.yijian.data.repository.TextbookChunkRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Production store: PostgreSQL with the pgvector extension.
 */
@Component
@ConditionalOnProperty(prefix = "yijian.store", name = "type", havingValue = "pgvector", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class PgVectorKnowledgeStore implements VectorKnowledgeStore {
    
    private final TextbookChunkRepository chunkRepository;
    private final StoreProperties storeProperties;
    
    @Override
    @Transactional(readOnly = true)
    public List<ScoredChunk> search(float[] queryVector, Subject subject, int limit) {
        int dimension = storeProperties.getEmbeddingDimension();
        if (dimension > 0 && queryVector.length != dimension) {
            log.error("[PGVECTOR] Query embedding does not match column | queryDimension={} | columnDimension={}",
                queryVector.length, dimension);
            throw new EmbeddingUnavailableException(String.format(
                "Query embedding has %d dimensions, corpus has %d", queryVector.length, dimension));
        }
        long startTime = System.currentTimeMillis();
        
        List<ScoredChunk> hits = chunkRepository.findNearest(
            VectorMath.toVectorString(queryVector), subject, limit);
        
        log.debug("[PGVECTOR] Search completed | subject={} | limit={} | hits={} | durationMs={}", 
            subject, limit, hits.size(), System.currentTimeMillis() - startTime);
        return hits;
    }
    
    @Override
    @Transactional(readOnly = true)
    public CorpusStats stats() {
        Map<Subject, Long> bySubject = new EnumMap<>(Subject.class);
        long total = 0;
        for (Object[] row : chunkRepository.countGroupedBySubject()) {
            Subject subject = (Subject) row[0];
            long count = ((Number) row[1]).longValue();
            bySubject.put(subject, count);
            total += count;
        }
        return CorpusStats.builder()
            .total(total)
            .bySubject(bySubject)
            .build();
    }
    
    @Override
    public String type() {
        return "pgvector";
    }
}
