package com.yijian.core.query.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class AnswerResult {
    String question;
    String answer;
    List<Source> sources;
    boolean grounded;
}
