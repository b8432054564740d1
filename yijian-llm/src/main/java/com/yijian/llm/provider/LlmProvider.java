package com.yijian.llm.provider;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Backends the tutor can talk to. Both serve generation and embedding.
 */
@Getter
@RequiredArgsConstructor
public enum LlmProvider {

    OPENAI(
        "OpenAI",
        "https://api.openai.com/v1",
        "gpt-4o-mini",
        "text-embedding-3-small"
    ),

    GEMINI(
        "Gemini",
        "https://generativelanguage.googleapis.com/v1beta",
        "gemini-2.0-flash",
        "text-embedding-004"
    );

    private final String displayName;
    private final String defaultBaseUrl;
    private final String defaultGenerationModel;
    private final String defaultEmbeddingModel;

    public static LlmProvider fromString(String name) {
        for (LlmProvider provider : values()) {
            if (provider.name().equalsIgnoreCase(name) ||
                provider.getDisplayName().equalsIgnoreCase(name)) {
                return provider;
            }
        }
        throw new IllegalArgumentException("Unknown provider: " + name);
    }
}
