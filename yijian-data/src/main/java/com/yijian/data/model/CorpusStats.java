package com.yijian.data.model;

import com.yijian.common.constants.Subject;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class CorpusStats {
    long total;
    Map<Subject, Long> bySubject;
}
