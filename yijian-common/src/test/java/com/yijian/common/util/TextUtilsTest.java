package com.yijian.common.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextUtilsTest {

    @Test
    void truncationCountsCodePointsNotChars() {
        // U+1F4D8 is a surrogate pair in UTF-16
        String text = "教材📘依据";

        String cut = TextUtils.truncateCodePoints(text, 3);

        assertThat(cut).isEqualTo("教材📘" + TextUtils.ELLIPSIS);
        assertThat(Character.isHighSurrogate(cut.charAt(cut.length() - TextUtils.ELLIPSIS.length() - 1))).isFalse();
    }

    @Test
    void shortTextIsReturnedUnchanged() {
        assertThat(TextUtils.truncateCodePoints("工程经济", 4)).isEqualTo("工程经济");
        assertThat(TextUtils.truncateCodePoints(null, 4)).isNull();
    }

    @Test
    void normalizesLineEndingsTrailingSpacesAndBlankRuns() {
        String raw = "  ## 1. 知识点分析  \r\n\r\n\r\n\r\n内容\t\r\n";

        assertThat(TextUtils.normalizeWhitespace(raw)).isEqualTo("## 1. 知识点分析\n\n内容");
    }

    @Test
    void tokenCountTreatsHanCharactersAsSingleTokens() {
        assertThat(TokenCounter.countTokens("资金时间价值")).isEqualTo(6);
        assertThat(TokenCounter.countTokens("abcdefgh")).isEqualTo(2);
        assertThat(TokenCounter.countTokens("")).isZero();
    }
}
