package com.yijian.api.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class AskRequest {

    // blank questions are rejected by the engine with the dedicated empty-query error
    @Size(max = 4000, message = "问题内容不能超过4000字")
    private String question;

    @JsonProperty("subject_filter")
    private String subjectFilter;

    @JsonProperty("n_context")
    private Integer contextSize;
}
