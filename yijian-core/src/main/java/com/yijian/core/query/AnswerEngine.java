package com.yijian.core.query;

import com.yijian.common.constants.Subject;
import com.yijian.common.exception.EmptyQueryException;
import com.yijian.common.util.TextUtils;
import com.yijian.core.config.EngineProperties;
import com.yijian.core.query.model.AnalysisResult;
import com.yijian.core.query.model.AnswerResult;
import com.yijian.core.query.model.ComposedPrompt;
import com.yijian.core.query.model.ExamItem;
import com.yijian.core.query.model.PromptMode;
import com.yijian.core.query.model.Query;
import com.yijian.core.query.model.RetrievedChunk;
import com.yijian.core.query.model.Source;
import com.yijian.llm.prompt.TutorPrompts;
import com.yijian.llm.service.AnswerSynthesizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Entry point for grounded answers: retrieve, compose, synthesize, cite.
 * Stateless; every call goes to the backends fresh.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnswerEngine {

    private final Retriever retriever;
    private final PromptComposer promptComposer;
    private final AnswerSynthesizer answerSynthesizer;
    private final CitationResolver citationResolver;
    private final ExamItemFlattener examItemFlattener;
    private final EngineProperties properties;

    public AnswerResult ask(String question, Subject subjectFilter) {
        return ask(Query.of(question, subjectFilter));
    }

    public AnswerResult ask(Query query) {
        if (query == null || TextUtils.isBlank(query.getText())) {
            throw new EmptyQueryException();
        }
        long startTime = System.currentTimeMillis();
        int k = properties.resolveTopK(query.getK());
        log.info("[ANSWER_ENGINE] Starting ask | subject={} | k={} | questionLength={}",
            query.getSubjectFilter(), k, query.getText().length());

        // ============================================
        // STEP 1: Retrieve
        // ============================================
        List<RetrievedChunk> chunks = retriever.retrieve(query.getText(), query.getSubjectFilter(), k);

        // ============================================
        // STEP 2: Compose
        // ============================================
        ComposedPrompt prompt = promptComposer.compose(PromptMode.OPEN_QUESTION, query.getText(), chunks);

        // ============================================
        // STEP 3: Synthesize
        // ============================================
        long generationStartTime = System.currentTimeMillis();
        String answer = answerSynthesizer.synthesize(prompt.getSystemPrompt(), prompt.getUserPrompt());
        long generationDuration = System.currentTimeMillis() - generationStartTime;

        // ============================================
        // STEP 4: Cite
        // ============================================
        List<Source> sources = citationResolver.resolve(prompt.getChunks());
        boolean grounded = !sources.isEmpty();

        log.info("[ANSWER_ENGINE] Ask completed | retrieved={} | sources={} | grounded={} | estimatedTokens={} | generationDurationMs={} | totalDurationMs={}",
            chunks.size(), sources.size(), grounded, prompt.getEstimatedTokens(), generationDuration,
            System.currentTimeMillis() - startTime);

        return AnswerResult.builder()
            .question(query.getText())
            .answer(grounded ? answer : withUngroundedNotice(answer))
            .sources(sources)
            .grounded(grounded)
            .build();
    }

    /**
     * @param subject overrides the item's own subject when non-null
     */
    public AnalysisResult analyzeExamItem(ExamItem item, Subject subject) {
        long startTime = System.currentTimeMillis();
        Subject effectiveSubject = subject != null ? subject : (item == null ? null : item.getSubject());
        String itemText = examItemFlattener.flatten(item, effectiveSubject);
        String searchText = examItemFlattener.retrievalText(item);
        int k = properties.resolveTopK(null);

        log.info("[ANSWER_ENGINE] Starting exam analysis | itemType={} | subject={} | itemLength={}",
            item.getClass().getSimpleName(), effectiveSubject, itemText.length());

        List<RetrievedChunk> chunks = retriever.retrieve(searchText, effectiveSubject, k);
        ComposedPrompt prompt = promptComposer.compose(PromptMode.EXAM_ANALYSIS, itemText, chunks);

        long generationStartTime = System.currentTimeMillis();
        String analysis = answerSynthesizer.synthesize(prompt.getSystemPrompt(), prompt.getUserPrompt());
        long generationDuration = System.currentTimeMillis() - generationStartTime;

        List<Source> sources = citationResolver.resolve(prompt.getChunks());
        List<String> missingSections = missingSections(analysis);
        boolean grounded = !sources.isEmpty();

        if (!missingSections.isEmpty()) {
            log.warn("[ANSWER_ENGINE] Analysis is missing sections | missing={}", missingSections);
        }
        log.info("[ANSWER_ENGINE] Exam analysis completed | retrieved={} | sources={} | grounded={} | sectionsComplete={} | generationDurationMs={} | totalDurationMs={}",
            chunks.size(), sources.size(), grounded, missingSections.isEmpty(), generationDuration,
            System.currentTimeMillis() - startTime);

        return AnalysisResult.builder()
            .analysisText(grounded ? analysis : withUngroundedNotice(analysis))
            .sources(sources)
            .grounded(grounded)
            .sectionsComplete(missingSections.isEmpty())
            .missingSections(missingSections)
            .build();
    }

    /**
     * Retrieval only. K defaults and clamps the same way as {@link #ask(Query)}.
     */
    public List<RetrievedChunk> search(String query, Subject subjectFilter, Integer k) {
        return retriever.retrieve(query, subjectFilter, properties.resolveTopK(k));
    }

    static List<String> missingSections(String analysis) {
        List<String> missing = new ArrayList<>();
        for (String section : TutorPrompts.ANALYSIS_SECTIONS) {
            if (!analysis.contains(section)) {
                missing.add(section);
            }
        }
        return List.copyOf(missing);
    }

    private static String withUngroundedNotice(String text) {
        return TutorPrompts.UNGROUNDED_NOTICE + "\n\n" + text;
    }
}
