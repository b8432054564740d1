package com.yijian.core.query;

import com.yijian.common.constants.Subject;
import com.yijian.core.config.EngineProperties;
import com.yijian.core.query.model.ComposedPrompt;
import com.yijian.core.query.model.PromptMode;
import com.yijian.core.query.model.RetrievedChunk;
import com.yijian.data.model.KnowledgeChunk;
import com.yijian.llm.prompt.TutorPrompts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PromptComposerTest {

    private EngineProperties properties;
    private PromptComposer composer;

    private static RetrievedChunk retrieved(String id, Subject subject, String label, Integer page, String content, int rank) {
        KnowledgeChunk chunk = KnowledgeChunk.builder()
            .id(id).subject(subject).sourceLabel(label).pageNumber(page).content(content)
            .build();
        return new RetrievedChunk(chunk, 0.9 - rank * 0.1, rank);
    }

    private final List<RetrievedChunk> chunks = List.of(
        retrieved("econ-1", Subject.ENGINEERING_ECONOMICS, "第1章 资金时间价值", 12, "资金的时间价值是指资金在扩大再生产及其循环周转过程中，随着时间的变化而产生的增值。", 1),
        retrieved("econ-2", Subject.ENGINEERING_ECONOMICS, "第1章 利息计算", null, "复利是以本金与先前周期累计利息之和为基数计算利息。", 2)
    );

    @BeforeEach
    void setUp() {
        properties = new EngineProperties();
        composer = new PromptComposer(properties);
    }

    @Test
    void identicalInputGivesByteIdenticalPrompts() {
        ComposedPrompt first = composer.compose(PromptMode.OPEN_QUESTION, "什么是资金时间价值？", chunks);
        ComposedPrompt second = composer.compose(PromptMode.OPEN_QUESTION, "什么是资金时间价值？", chunks);

        assertThat(second.getUserPrompt()).isEqualTo(first.getUserPrompt());
        assertThat(second.getSystemPrompt()).isEqualTo(first.getSystemPrompt());
    }

    @Test
    void openQuestionPlacesQuestionThenTaggedChunksThenInstruction() {
        String question = "  什么是资金时间价值？ ";
        String prompt = composer.compose(PromptMode.OPEN_QUESTION, question, chunks).getUserPrompt();

        int questionAt = prompt.indexOf(question);
        int firstChunkAt = prompt.indexOf("[片段1] 科目：工程经济 | 来源：第1章 资金时间价值 第12页");
        int secondChunkAt = prompt.indexOf("[片段2] 科目：工程经济 | 来源：第1章 利息计算\n");
        int instructionAt = prompt.indexOf(TutorPrompts.GROUNDED_INSTRUCTION);

        assertThat(questionAt).isGreaterThanOrEqualTo(0);
        assertThat(firstChunkAt).isGreaterThan(questionAt);
        assertThat(secondChunkAt).isGreaterThan(firstChunkAt);
        assertThat(instructionAt).isGreaterThan(secondChunkAt);
    }

    @Test
    void noChunksAsksForAFlaggedGeneralKnowledgeAnswer() {
        ComposedPrompt composed = composer.compose(PromptMode.OPEN_QUESTION, "什么是资金时间价值？", List.of());

        assertThat(composed.isGrounded()).isFalse();
        assertThat(composed.getChunks()).isEmpty();
        assertThat(composed.getUserPrompt())
            .contains(TutorPrompts.NO_MATERIAL_STATEMENT)
            .contains(TutorPrompts.UNGROUNDED_INSTRUCTION)
            .doesNotContain(TutorPrompts.GROUNDED_INSTRUCTION)
            .doesNotContain("[片段");
    }

    @Test
    void examAnalysisListsTheFourSectionHeadersInOrder() {
        String prompt = composer.compose(PromptMode.EXAM_ANALYSIS, "【题目】下列说法正确的是", chunks).getUserPrompt();

        int previous = prompt.indexOf("【题目】下列说法正确的是");
        assertThat(previous).isGreaterThan(0);
        for (String header : List.of("## 1. 知识点分析", "## 2. 解题思路", "## 3. 教材依据", "## 4. 易错点提示")) {
            int at = prompt.indexOf(header);
            assertThat(at).isGreaterThan(previous);
            previous = at;
        }
        assertThat(prompt).startsWith(TutorPrompts.ANALYSIS_INTRO);
    }

    @Test
    void chunksBeyondTheContextBudgetAreLeftOutOfPromptAndCitations() {
        properties.setMaxContextTokens(40);

        ComposedPrompt composed = composer.compose(PromptMode.OPEN_QUESTION, "问题", chunks);

        assertThat(composed.getChunks()).extracting(RetrievedChunk::getId).containsExactly("econ-1");
        assertThat(composed.getUserPrompt()).doesNotContain("复利是以本金");
    }

    @Test
    void topChunkIsPlacedEvenWhenItAloneExceedsTheBudget() {
        properties.setMaxContextTokens(1);

        ComposedPrompt composed = composer.compose(PromptMode.OPEN_QUESTION, "问题", chunks);

        assertThat(composed.getChunks()).hasSize(1);
        assertThat(composed.isGrounded()).isTrue();
    }
}
