package com.yijian.data.model;

import lombok.Value;

/**
 * Store hit: a chunk with its cosine similarity to the query vector.
 */
@Value
public class ScoredChunk {
    KnowledgeChunk chunk;
    double score;

    public String getId() { return chunk.getId(); }
}
