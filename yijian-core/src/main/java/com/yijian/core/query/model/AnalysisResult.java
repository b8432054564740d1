package com.yijian.core.query.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Four-section analysis of an exam item. {@code missingSections} lists the section titles the
 * generated text did not contain.
 */
@Value
@Builder
public class AnalysisResult {
    String analysisText;
    List<Source> sources;
    boolean grounded;
    boolean sectionsComplete;
    List<String> missingSections;
}
