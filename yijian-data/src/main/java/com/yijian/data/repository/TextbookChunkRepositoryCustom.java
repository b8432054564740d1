package com.yijian.data.repository;

import com.yijian.common.constants.Subject;
import com.yijian.data.model.ScoredChunk;

import java.util.List;

public interface TextbookChunkRepositoryCustom {
    /**
     * Nearest chunks by cosine distance, best first, ties ordered by chunk id.
     * @param queryEmbedding query vector in pgvector text form, e.g. {@code [0.1,0.2]}
     * @param subject optional subject restriction (null searches the whole corpus)
     * @param limit maximum number of rows
     * @return chunks with {@code score = 1 - cosine distance}, embeddings included
     */
    List<ScoredChunk> findNearest(String queryEmbedding, Subject subject, int limit);
}
