package com.yijian.llm.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * Gemini {@code :embedContent} response body.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class EmbeddingResponse {
    @JsonProperty("embedding")
    private EmbeddingValues embedding;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingValues {
        @JsonProperty("values")
        private float[] values;
    }
}
