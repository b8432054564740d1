package com.yijian.core.query.model;

public enum PromptMode {
    OPEN_QUESTION,
    EXAM_ANALYSIS
}
