package com.yijian.core.query.model;

import com.yijian.common.constants.Subject;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class Source {
    String chunkId;
    Subject subject;
    String sourceLabel;
    Integer pageNumber;
    String content;
    double score;
}
