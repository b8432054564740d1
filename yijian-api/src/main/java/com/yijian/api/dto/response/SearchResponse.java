package com.yijian.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.yijian.core.query.model.RetrievedChunk;
import com.yijian.data.model.KnowledgeChunk;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class SearchResponse {
    private String query;
    private List<Hit> results;

    @Data
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Hit {
        private int rank;
        private String id;
        private String subject;
        private String content;
        @JsonProperty("source_label")
        private String sourceLabel;
        private Integer page;
        private double score;

        public static Hit from(RetrievedChunk retrieved) {
            KnowledgeChunk chunk = retrieved.getChunk();
            return Hit.builder()
                .rank(retrieved.getRank())
                .id(chunk.getId())
                .subject(chunk.getSubject() == null ? null : chunk.getSubject().getDisplayName())
                .content(chunk.getContent())
                .sourceLabel(chunk.getSourceLabel())
                .page(chunk.getPageNumber())
                .score(retrieved.getScore())
                .build();
        }
    }
}
