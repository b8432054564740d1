package com.yijian.api.controller;

import com.yijian.api.dto.request.ExamAnalysisRequest;
import com.yijian.api.dto.response.AnalysisResponse;
import com.yijian.api.dto.response.ApiResponse;
import com.yijian.api.service.AnalysisCacheService;
import com.yijian.common.constants.Subject;
import com.yijian.core.query.AnswerEngine;
import com.yijian.core.query.model.AnalysisResult;
import com.yijian.core.query.model.CaseStudy;
import com.yijian.core.query.model.ChoiceQuestion;
import com.yijian.core.query.model.ExamItem;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/exam")
@RequiredArgsConstructor
@Slf4j
public class ExamAnalysisController {

    private final AnswerEngine answerEngine;
    private final AnalysisCacheService analysisCache;

    @PostMapping("/ai-analysis")
    public ResponseEntity<ApiResponse<AnalysisResponse>> analyze(@Valid @RequestBody ExamAnalysisRequest request) {
        Subject subject = Subject.fromNullable(request.getSubject());
        ExamItem item = toExamItem(request, subject);
        log.info("[API] Exam analysis request | type={} | subject={}", item.getClass().getSimpleName(), subject);

        AnalysisResult result = analysisCache.getOrCompute(item, subject,
            () -> answerEngine.analyzeExamItem(item, subject));

        return ResponseEntity.ok(ApiResponse.ok(AnalysisResponse.from(result)));
    }

    static ExamItem toExamItem(ExamAnalysisRequest request, Subject subject) {
        if (request.isCaseStudy()) {
            List<String> subQuestions = request.getSubQuestions() == null ? List.of() : request.getSubQuestions();
            return CaseStudy.builder()
                .background(request.getBackground())
                .subQuestions(subQuestions)
                .subject(subject)
                .build();
        }
        Map<String, String> options = request.getOptions() == null ? Map.of() : request.getOptions();
        return ChoiceQuestion.builder()
            .question(request.getQuestion())
            .options(options)
            .answer(request.getAnswer())
            .subject(subject)
            .build();
    }
}
