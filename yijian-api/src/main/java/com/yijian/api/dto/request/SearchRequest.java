package com.yijian.api.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class SearchRequest {

    @Size(max = 4000, message = "查询内容不能超过4000字")
    private String query;

    @JsonProperty("n_results")
    private Integer resultLimit;

    @JsonProperty("subject_filter")
    private String subjectFilter;
}
