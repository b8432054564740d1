package com.yijian.llm.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;

/**
 * Gemini {@code :generateContent} response body.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class GenerationResponse {
    @JsonProperty("candidates")
    private List<Candidate> candidates;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Candidate {
        @JsonProperty("content")
        private Content content;

        @JsonProperty("finishReason")
        private String finishReason;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Content {
        @JsonProperty("parts")
        private List<Part> parts;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Part {
        @JsonProperty("text")
        private String text;
    }

    /**
     * Concatenated text of the first candidate, or empty when there is none.
     */
    public String firstCandidateText() {
        if (candidates == null || candidates.isEmpty()) {
            return "";
        }
        Content first = candidates.get(0).getContent();
        if (first == null || first.getParts() == null) {
            return "";
        }
        StringBuilder text = new StringBuilder();
        for (Part part : first.getParts()) {
            if (part.getText() != null) {
                text.append(part.getText());
            }
        }
        return text.toString();
    }

    public String firstFinishReason() {
        return candidates == null || candidates.isEmpty() ? null : candidates.get(0).getFinishReason();
    }
}
