package com.yijian.common.constants;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.yijian.common.exception.InvalidInputException;

/**
 * Exam curriculum subjects. Every textbook chunk belongs to exactly one of them.
 */
public enum Subject {

    ENGINEERING_ECONOMICS("engineering-economics", "工程经济"),
    ELECTROMECHANICAL_PRACTICE("electromechanical-practice", "机电实务"),
    LAW_AND_REGULATION("law-and-regulation", "法律法规"),
    PROJECT_MANAGEMENT("project-management", "项目管理");

    private final String slug;
    private final String displayName;

    Subject(String slug, String displayName) {
        this.slug = slug;
        this.displayName = displayName;
    }

    @JsonValue
    public String getSlug() {
        return slug;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Accepts the slug, the constant name or the Chinese display name.
     */
    @JsonCreator
    public static Subject fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Subject must not be null");
        }
        Subject subject = lookup(value);
        if (subject == null) {
            throw new IllegalArgumentException("Unknown subject: " + value);
        }
        return subject;
    }

    /**
     * Parses a request parameter. Null or blank means "no subject"; an unknown value is the
     * caller's mistake.
     */
    public static Subject fromNullable(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        Subject subject = lookup(value);
        if (subject == null) {
            throw new InvalidInputException("未知科目：" + value.trim());
        }
        return subject;
    }

    private static Subject lookup(String value) {
        String trimmed = value.trim();
        for (Subject subject : values()) {
            if (subject.slug.equalsIgnoreCase(trimmed)
                || subject.name().equalsIgnoreCase(trimmed)
                || subject.displayName.equals(trimmed)) {
                return subject;
            }
        }
        return null;
    }
}
