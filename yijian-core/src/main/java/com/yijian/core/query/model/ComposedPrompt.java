package com.yijian.core.query.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Prompt ready for the generation backend, together with the exact chunks it quotes.
 */
@Value
@Builder
public class ComposedPrompt {
    PromptMode mode;
    String systemPrompt;
    String userPrompt;
    List<RetrievedChunk> chunks;
    int estimatedTokens;

    public boolean isGrounded() {
        return !chunks.isEmpty();
    }
}
