package com.yijian.api.controller;

import com.yijian.api.dto.request.AskRequest;
import com.yijian.api.dto.response.ApiResponse;
import com.yijian.api.dto.response.AskResponse;
import com.yijian.common.constants.Subject;
import com.yijian.common.util.TextUtils;
import com.yijian.core.query.AnswerEngine;
import com.yijian.core.query.model.AnswerResult;
import com.yijian.core.query.model.Query;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class AskController {

    private final AnswerEngine answerEngine;

    @PostMapping("/ask")
    public ResponseEntity<ApiResponse<AskResponse>> ask(@Valid @RequestBody AskRequest request) {
        Subject subjectFilter = Subject.fromNullable(request.getSubjectFilter());
        log.info("[API] Ask request | subject={} | nContext={} | question={}",
            subjectFilter, request.getContextSize(), TextUtils.preview(request.getQuestion(), 50));

        AnswerResult result = answerEngine.ask(Query.builder()
            .text(request.getQuestion())
            .subjectFilter(subjectFilter)
            .k(request.getContextSize())
            .build());

        return ResponseEntity.ok(ApiResponse.ok(AskResponse.from(result)));
    }
}
