package com.yijian.core.query;

import com.yijian.common.util.TokenCounter;
import com.yijian.core.config.EngineProperties;
import com.yijian.core.query.model.ComposedPrompt;
import com.yijian.core.query.model.PromptMode;
import com.yijian.core.query.model.RetrievedChunk;
import com.yijian.data.model.KnowledgeChunk;
import com.yijian.llm.prompt.TutorPrompts;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the user prompt for both modes. Output depends only on the arguments: identical input
 * gives a byte-identical prompt.
 *
 * <p>Chunks are placed in rank order until {@code yijian.engine.max-context-tokens} is reached;
 * the top chunk is always placed. The returned {@link ComposedPrompt} lists exactly the chunks
 * that made it into the text.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PromptComposer {

    private final EngineProperties properties;

    public ComposedPrompt compose(PromptMode mode, String payload, List<RetrievedChunk> retrievedChunks) {
        List<RetrievedChunk> placed = selectWithinBudget(retrievedChunks);
        boolean grounded = !placed.isEmpty();

        StringBuilder prompt = new StringBuilder();
        if (mode == PromptMode.EXAM_ANALYSIS) {
            prompt.append(TutorPrompts.ANALYSIS_INTRO).append("\n\n");
            prompt.append(payload.strip()).append("\n\n");
        } else {
            prompt.append(TutorPrompts.QUESTION_LABEL).append('\n');
            prompt.append(payload).append("\n\n");
        }

        prompt.append(TutorPrompts.MATERIAL_LABEL).append('\n');
        if (grounded) {
            for (int i = 0; i < placed.size(); i++) {
                appendChunk(prompt, i + 1, placed.get(i).getChunk());
            }
        } else {
            prompt.append(TutorPrompts.NO_MATERIAL_STATEMENT).append("\n\n");
        }

        if (mode == PromptMode.EXAM_ANALYSIS) {
            prompt.append(TutorPrompts.ANALYSIS_INSTRUCTION).append('\n');
            for (int i = 0; i < TutorPrompts.ANALYSIS_SECTIONS.size(); i++) {
                prompt.append(TutorPrompts.sectionHeader(i)).append('\n');
            }
            prompt.append('\n');
        }

        prompt.append(grounded ? TutorPrompts.GROUNDED_INSTRUCTION : TutorPrompts.UNGROUNDED_INSTRUCTION);
        if (mode == PromptMode.EXAM_ANALYSIS) {
            prompt.append('\n').append(TutorPrompts.ANALYSIS_CLOSING);
        }
        prompt.append('\n');

        String userPrompt = prompt.toString();
        int tokens = TokenCounter.countTokens(TutorPrompts.SYSTEM_PROMPT) + TokenCounter.countTokens(userPrompt);
        log.debug("[PROMPT_COMPOSER] Prompt composed | mode={} | chunksOffered={} | chunksPlaced={} | estimatedTokens={}",
            mode, retrievedChunks.size(), placed.size(), tokens);

        return ComposedPrompt.builder()
            .mode(mode)
            .systemPrompt(TutorPrompts.SYSTEM_PROMPT)
            .userPrompt(userPrompt)
            .chunks(placed)
            .estimatedTokens(tokens)
            .build();
    }

    private List<RetrievedChunk> selectWithinBudget(List<RetrievedChunk> chunks) {
        List<RetrievedChunk> selected = new ArrayList<>();
        int totalTokens = 0;
        for (RetrievedChunk chunk : chunks) {
            int chunkTokens = TokenCounter.countTokens(chunk.getChunk().getContent());
            if (!selected.isEmpty() && totalTokens + chunkTokens > properties.getMaxContextTokens()) {
                log.info("[PROMPT_COMPOSER] Context budget reached | chunksPlaced={} | totalTokens={} | maxTokens={}",
                    selected.size(), totalTokens, properties.getMaxContextTokens());
                break;
            }
            selected.add(chunk);
            totalTokens += chunkTokens;
        }
        return List.copyOf(selected);
    }

    private static void appendChunk(StringBuilder prompt, int index, KnowledgeChunk chunk) {
        prompt.append("[片段").append(index).append("] 科目：")
            .append(chunk.getSubject() == null ? "未知" : chunk.getSubject().getDisplayName())
            .append(" | 来源：").append(describeSource(chunk)).append('\n');
        prompt.append(chunk.getContent() == null ? "" : chunk.getContent().strip()).append("\n\n");
    }

    static String describeSource(KnowledgeChunk chunk) {
        String label = chunk.getSourceLabel() == null || chunk.getSourceLabel().isBlank()
            ? "教材"
            : chunk.getSourceLabel().strip();
        return chunk.getPageNumber() == null ? label : label + " 第" + chunk.getPageNumber() + "页";
    }
}
