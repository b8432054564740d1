package com.yijian.core.query.model;

import com.yijian.common.constants.Subject;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class ChoiceQuestion implements ExamItem {
    String question;
    @Singular
    Map<String, String> options;
    String answer;
    Subject subject;
}
