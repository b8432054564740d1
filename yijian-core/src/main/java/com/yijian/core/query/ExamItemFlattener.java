package com.yijian.core.query;

import com.yijian.common.constants.Subject;
import com.yijian.common.exception.EmptyQueryException;
import com.yijian.common.util.TextUtils;
import com.yijian.core.query.model.CaseStudy;
import com.yijian.core.query.model.ChoiceQuestion;
import com.yijian.core.query.model.ExamItem;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Renders an exam item as one block of analysis text. The same item and subject always give the
 * same text.
 */
@Component
public class ExamItemFlattener {

    /** A, B, ... Z, then numeric labels by value. */
    static final Comparator<String> LABEL_ORDER = Comparator
        .comparingInt(String::length)
        .thenComparing(Comparator.naturalOrder());

    public String flatten(ExamItem item, Subject subject) {
        if (item == null) {
            throw new EmptyQueryException();
        }
        StringBuilder text = new StringBuilder();
        if (subject != null) {
            text.append("【科目】").append(subject.getDisplayName()).append('\n');
        }

        if (item instanceof ChoiceQuestion) {
            appendChoice(text, (ChoiceQuestion) item);
        } else if (item instanceof CaseStudy) {
            appendCaseStudy(text, (CaseStudy) item);
        } else {
            throw new IllegalArgumentException("Unsupported exam item: " + item.getClass().getSimpleName());
        }
        return text.toString().strip();
    }

    /**
     * Text used to search the knowledge base: the question stem, or the case background followed by
     * its sub-questions. Subject, options and answer only go into the prompt.
     */
    public String retrievalText(ExamItem item) {
        if (item instanceof ChoiceQuestion) {
            ChoiceQuestion choice = (ChoiceQuestion) item;
            if (TextUtils.isBlank(choice.getQuestion())) {
                throw new EmptyQueryException();
            }
            return choice.getQuestion().strip();
        }
        if (item instanceof CaseStudy) {
            StringBuilder text = new StringBuilder();
            appendCaseStudy(text, (CaseStudy) item);
            return text.toString().strip();
        }
        return flatten(item, null);
    }

    private void appendChoice(StringBuilder text, ChoiceQuestion choice) {
        if (TextUtils.isBlank(choice.getQuestion())) {
            throw new EmptyQueryException();
        }
        text.append("【题目】").append(choice.getQuestion().strip()).append('\n');

        Map<String, String> options = choice.getOptions();
        if (options != null && !options.isEmpty()) {
            Map<String, String> ordered = new TreeMap<>(LABEL_ORDER);
            options.forEach((label, value) -> ordered.put(label.strip(), value == null ? "" : value.strip()));
            text.append("【选项】\n");
            ordered.forEach((label, value) -> text.append(label).append(". ").append(value).append('\n'));
        }

        if (!TextUtils.isBlank(choice.getAnswer())) {
            text.append("【正确答案】").append(choice.getAnswer().strip()).append('\n');
        }
    }

    private void appendCaseStudy(StringBuilder text, CaseStudy caseStudy) {
        List<String> subQuestions = caseStudy.getSubQuestions() == null
            ? List.of()
            : caseStudy.getSubQuestions().stream().filter(q -> !TextUtils.isBlank(q)).toList();
        if (TextUtils.isBlank(caseStudy.getBackground()) && subQuestions.isEmpty()) {
            throw new EmptyQueryException();
        }

        if (!TextUtils.isBlank(caseStudy.getBackground())) {
            text.append("【案例背景】\n").append(caseStudy.getBackground().strip()).append('\n');
        }
        if (!subQuestions.isEmpty()) {
            text.append("【问题】\n");
            for (int i = 0; i < subQuestions.size(); i++) {
                text.append(i + 1).append(". ").append(subQuestions.get(i).strip()).append('\n');
            }
        }
    }
}
