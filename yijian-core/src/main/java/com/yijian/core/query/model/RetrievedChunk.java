package com.yijian.core.query.model;

import com.yijian.data.model.KnowledgeChunk;
import lombok.Value;

/**
 * A chunk selected for one request. Rank is 1-based in descending score order, ties by chunk id.
 */
@Value
public class RetrievedChunk {
    KnowledgeChunk chunk;
    double score;
    int rank;

    public String getId() {
        return chunk.getId();
    }
}
