package com.yijian.api.controller;

import com.yijian.api.dto.request.SearchRequest;
import com.yijian.api.dto.response.ApiResponse;
import com.yijian.api.dto.response.SearchResponse;
import com.yijian.api.dto.response.StatsResponse;
import com.yijian.api.dto.response.SubjectResponse;
import com.yijian.common.constants.Subject;
import com.yijian.core.query.AnswerEngine;
import com.yijian.core.query.model.RetrievedChunk;
import com.yijian.data.store.VectorKnowledgeStore;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Arrays;
import java.util.List;

/**
 * Read-only views of the textbook corpus: size, subjects and raw retrieval.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class KnowledgeController {

    private final VectorKnowledgeStore knowledgeStore;
    private final AnswerEngine answerEngine;

    @GetMapping("/stats")
    public ResponseEntity<ApiResponse<StatsResponse>> stats() {
        return ResponseEntity.ok(ApiResponse.ok(StatsResponse.from(knowledgeStore.stats(), knowledgeStore.type())));
    }

    @GetMapping("/subjects")
    public ResponseEntity<ApiResponse<List<SubjectResponse>>> subjects() {
        List<SubjectResponse> subjects = Arrays.stream(Subject.values()).map(SubjectResponse::from).toList();
        return ResponseEntity.ok(ApiResponse.ok(subjects));
    }

    @PostMapping("/search")
    public ResponseEntity<ApiResponse<SearchResponse>> search(@Valid @RequestBody SearchRequest request) {
        Subject subjectFilter = Subject.fromNullable(request.getSubjectFilter());
        List<RetrievedChunk> hits = answerEngine.search(request.getQuery(), subjectFilter, request.getResultLimit());
        log.info("[API] Search request | subject={} | limit={} | hits={}", subjectFilter, request.getResultLimit(), hits.size());

        SearchResponse response = SearchResponse.builder()
            .query(request.getQuery())
            .results(hits.stream().map(SearchResponse.Hit::from).toList())
            .build();
        return ResponseEntity.ok(ApiResponse.ok(response));
    }
}
