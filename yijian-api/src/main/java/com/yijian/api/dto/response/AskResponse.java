package com.yijian.api.dto.response;

import com.yijian.core.query.model.AnswerResult;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class AskResponse {
    private String question;
    private String answer;
    private boolean grounded;
    private List<SourceResponse> sources;

    public static AskResponse from(AnswerResult result) {
        return AskResponse.builder()
            .question(result.getQuestion())
            .answer(result.getAnswer())
            .grounded(result.isGrounded())
            .sources(result.getSources().stream().map(SourceResponse::from).toList())
            .build();
    }
}
