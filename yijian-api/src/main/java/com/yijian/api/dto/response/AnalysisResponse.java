package com.yijian.api.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.yijian.core.query.model.AnalysisResult;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class AnalysisResponse {
    private String analysis;
    private List<SourceResponse> sources;
    private boolean grounded;
    @JsonProperty("sections_complete")
    private boolean sectionsComplete;
    @JsonProperty("missing_sections")
    private List<String> missingSections;

    public static AnalysisResponse from(AnalysisResult result) {
        return AnalysisResponse.builder()
            .analysis(result.getAnalysisText())
            .sources(result.getSources().stream().map(SourceResponse::from).toList())
            .grounded(result.isGrounded())
            .sectionsComplete(result.isSectionsComplete())
            .missingSections(result.getMissingSections())
            .build();
    }
}
