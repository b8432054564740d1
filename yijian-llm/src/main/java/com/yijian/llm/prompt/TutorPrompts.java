package com.yijian.llm.prompt;

import java.util.List;

/**
 * Fixed prompt text for the constructor-exam tutor. Everything here is part of the deterministic
 * prompt contract: changing a string changes every prompt built from it.
 */
public final class TutorPrompts {

    private TutorPrompts() {
    }

    public static final String SYSTEM_PROMPT = """
        你是一个专业的一级建造师考试辅导助手。你的任务是帮助考生理解和掌握一建考试的知识点。

        你的特点：
        1. 专业：精通工程经济、机电实务、法律法规、项目管理四个科目
        2. 耐心：用通俗易懂的语言解释复杂概念
        3. 准确：基于官方教材内容回答问题，不编造信息
        4. 实用：结合实际案例帮助理解，提供记忆技巧

        回答要求：
        - 基于提供的教材内容回答问题
        - 如果教材中没有相关内容，请明确说明
        - 适当使用要点、编号等格式使答案更清晰
        - 可以补充相关知识点帮助理解
        - 如果问题涉及多个科目，请分别说明
        """;

    public static final String QUESTION_LABEL = "【问题】";
    public static final String MATERIAL_LABEL = "【教材内容】";

    public static final String GROUNDED_INSTRUCTION =
        "请仅依据上述教材内容给出专业、准确的回答，不要编造教材中没有的信息。如果教材内容不足以完整回答问题，请明确说明。";

    public static final String NO_MATERIAL_STATEMENT = "（教材中未检索到与本题相关的内容）";

    public static final String UNGROUNDED_INSTRUCTION =
        "教材中没有找到相关内容。请根据你的专业知识作答，并在回答开头明确说明该回答没有教材依据。";

    public static final String ANALYSIS_INTRO = "请结合教材知识，详细解析以下题目：";

    public static final String ANALYSIS_INSTRUCTION = "请严格按照以下四个部分进行解析，每部分使用给定的标题：";

    public static final String ANALYSIS_CLOSING = "请用清晰、易懂的语言进行解析。";

    /** Section titles in the order the analysis must present them. */
    public static final List<String> ANALYSIS_SECTIONS = List.of(
        "知识点分析",
        "解题思路",
        "教材依据",
        "易错点提示"
    );

    public static final String UNGROUNDED_NOTICE = "【提示】教材中未检索到相关内容，以下回答基于通用专业知识，仅供参考。";

    public static String sectionHeader(int index) {
        return "## " + (index + 1) + ". " + ANALYSIS_SECTIONS.get(index);
    }
}
