package com.yijian.common.util;

/**
 * Rough token estimate for prompt budgeting.
 * Han characters count as one token each, everything else as 1 token per 4 characters.
 */
public final class TokenCounter {
    private static final double LATIN_CHARS_PER_TOKEN = 4.0;
    
    private TokenCounter() {}
    
    public static int countTokens(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        int hanChars = 0;
        int otherChars = 0;
        for (int i = 0; i < text.length(); ) {
            int codePoint = text.codePointAt(i);
            if (Character.UnicodeScript.of(codePoint) == Character.UnicodeScript.HAN) {
                hanChars++;
            } else {
                otherChars++;
            }
            i += Character.charCount(codePoint);
        }
        return hanChars + (int) Math.ceil(otherChars / LATIN_CHARS_PER_TOKEN);
    }
}
