package com.yijian.api.dto.response;

import com.yijian.common.constants.Subject;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class SubjectResponse {
    private String id;
    private String name;

    public static SubjectResponse from(Subject subject) {
        return new SubjectResponse(subject.getSlug(), subject.getDisplayName());
    }
}
