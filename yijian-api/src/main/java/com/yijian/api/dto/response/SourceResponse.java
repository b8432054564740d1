package com.yijian.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.yijian.core.query.model.Source;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SourceResponse {
    private String subject;
    private String content;
    @JsonProperty("source_label")
    private String sourceLabel;
    private Integer page;
    private Double score;

    public static SourceResponse from(Source source) {
        return SourceResponse.builder()
            .subject(source.getSubject() == null ? null : source.getSubject().getDisplayName())
            .content(source.getContent())
            .sourceLabel(source.getSourceLabel())
            .page(source.getPageNumber())
            .score(source.getScore())
            .build();
    }
}
