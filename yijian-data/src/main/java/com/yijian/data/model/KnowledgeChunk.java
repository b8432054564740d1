package com.yijian.data.model;

import com.yijian.common.constants.Subject;
import lombok.Builder;
import lombok.Value;

/**
 * One embedded textbook excerpt. Produced by offline ingestion and never mutated afterwards.
 */
@Value
@Builder(toBuilder = true)
public class KnowledgeChunk {
    String id;
    Subject subject;
    String content;
    String sourceLabel;
    Integer pageNumber;
    float[] embedding;

    public boolean hasEmbedding() {
        return embedding != null && embedding.length > 0;
    }
}
