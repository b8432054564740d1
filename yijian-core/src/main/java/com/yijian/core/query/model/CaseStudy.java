package com.yijian.core.query.model;

import com.yijian.common.constants.Subject;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class CaseStudy implements ExamItem {
    String background;
    @Singular
    List<String> subQuestions;
    Subject subject;
}
