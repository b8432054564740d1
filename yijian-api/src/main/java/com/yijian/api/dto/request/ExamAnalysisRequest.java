package com.yijian.api.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * A choice question, or a case study when {@code background} is present.
 */
@Data
public class ExamAnalysisRequest {

    @Size(max = 4000, message = "题目内容不能超过4000字")
    private String question;

    @Size(max = 10, message = "选项不能超过10个")
    private Map<String, String> options;

    private String answer;

    private String subject;

    @Size(max = 20000, message = "案例背景不能超过20000字")
    private String background;

    @JsonProperty("sub_questions")
    @Size(max = 20, message = "案例问题不能超过20个")
    private List<String> subQuestions;

    public boolean isCaseStudy() {
        return background != null && !background.isBlank();
    }
}
