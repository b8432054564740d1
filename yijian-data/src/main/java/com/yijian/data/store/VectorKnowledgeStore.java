package com.yijian.data.store;

import com.yijian.common.constants.Subject;
import com.yijian.data.model.CorpusStats;
import com.yijian.data.model.ScoredChunk;

import java.util.List;

/**
 * Read side of the textbook corpus. Implementations must allow concurrent searches without locking.
 */
public interface VectorKnowledgeStore {
    
    /**
     * @param queryVector embedding of the query, same space as the corpus
     * @param subject optional restriction, null searches everything
     * @param limit maximum hits
     * @return hits ordered by descending cosine similarity, ties by ascending chunk id
     */
    List<ScoredChunk> search(float[] queryVector, Subject subject, int limit);
    
    CorpusStats stats();
    
    /**
     * Short backend name for health output.
     */
    String type();
}
