package com.yijian.core.query.model;

import com.yijian.common.constants.Subject;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class Query {
    String text;
    Subject subjectFilter;
    Integer k; // null = engine default

    public static Query of(String text, Subject subjectFilter) {
        return Query.builder().text(text).subjectFilter(subjectFilter).build();
    }
}
