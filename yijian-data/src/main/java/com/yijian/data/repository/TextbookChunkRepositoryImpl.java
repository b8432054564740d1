package com.yijian.data.repository;

import com.yijian.common.constants.Subject;
import com.yijian.data.model.KnowledgeChunk;
import com.yijian.data.model.ScoredChunk;
import com.yijian.data.store.VectorMath;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.Query;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Picked up by Spring Data as the fragment implementation of {@link TextbookChunkRepositoryCustom}.
 * Not a stereotype bean, so nothing is created when the pgvector store is disabled.
 */
@Slf4j
public class TextbookChunkRepositoryImpl implements TextbookChunkRepositoryCustom {
    
    @PersistenceContext
    private EntityManager entityManager;
    
    @Override
    public List<ScoredChunk> findNearest(String queryEmbedding, Subject subject, int limit) {
        StringBuilder sqlBuilder = new StringBuilder();
        sqlBuilder.append("SELECT c.id, c.subject, c.content, c.source_label, c.page_number, ");
        sqlBuilder.append("CAST(c.embedding AS text) AS embedding_text, ");
        sqlBuilder.append("1 - (c.embedding <=> CAST(:queryEmbedding AS vector)) AS score ");
        sqlBuilder.append("FROM textbook_chunks c ");
        sqlBuilder.append("WHERE c.embedding IS NOT NULL ");
        
        if (subject != null) {
            sqlBuilder.append("AND c.subject = :subject ");
        }
        
        sqlBuilder.append("ORDER BY c.embedding <=> CAST(:queryEmbedding AS vector), c.id ");
        sqlBuilder.append("LIMIT :limit");
        
        Query query = entityManager.createNativeQuery(sqlBuilder.toString());
        query.setParameter("queryEmbedding", queryEmbedding);
        query.setParameter("limit", limit);
        if (subject != null) {
            query.setParameter("subject", subject.name());
        }
        
        @SuppressWarnings("unchecked")
        List<Object[]> rows = query.getResultList();
        
        log.debug("[PGVECTOR] Nearest-neighbour query returned {} rows | subject={} | limit={}", 
            rows.size(), subject, limit);
        
        List<ScoredChunk> results = new ArrayList<>(rows.size());
        for (Object[] row : rows) {
            results.add(mapRow(row));
        }
        return results;
    }
    
    static ScoredChunk mapRow(Object[] row) {
        KnowledgeChunk chunk = KnowledgeChunk.builder()
            .id((String) row[0])
            .subject(Subject.valueOf((String) row[1]))
            .content((String) row[2])
            .sourceLabel((String) row[3])
            .pageNumber(row[4] != null ? ((Number) row[4]).intValue() : null)
            .embedding(row[5] != null ? VectorMath.parseVectorString((String) row[5]) : null)
            .build();
        double score = row[6] != null ? ((Number) row[6]).doubleValue() : 0.0;
        return new ScoredChunk(chunk, score);
    }
}
