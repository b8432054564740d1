package com.yijian.core.query.model;

import com.yijian.common.constants.Subject;

/**
 * A historical exam item handed in for analysis: a {@link ChoiceQuestion} or a {@link CaseStudy}.
 */
public interface ExamItem {

    /**
     * Subject the item was filed under, may be null.
     */
    Subject getSubject();
}
