package com.textsplit.text;

import java.util.function.IntPredicate;

/**
 * 字符集合分隔符匹配。
 *
 * <p>run 为 true 时，一段连续的集合字符作为一个分隔符。
 */
public class CharClassMatcher implements DelimiterMatcher {

    private final IntPredicate charClass;
    private final boolean run;

    public CharClassMatcher(IntPredicate charClass, boolean run) {
        if (charClass == null) {
            throw new IllegalArgumentException("字符集合不能为空");
        }
        this.charClass = charClass;
        this.run = run;
    }

    /**
     * 由字符列表构造集合，例如 {@code "- "} 表示短横线或空格。
     */
    public static CharClassMatcher of(String chars, boolean run) {
        if (chars == null || chars.isEmpty()) {
            throw new IllegalArgumentException("字符集合不能为空");
        }
        return new CharClassMatcher(ch -> chars.indexOf(ch) >= 0, run);
    }

    /**
     * 连续空白作为一个分隔符。
     */
    public static CharClassMatcher whitespace() {
        return new CharClassMatcher(Character::isWhitespace, true);
    }

    @Override
    public MatchResult find(CharSequence input, int fromOffset) {
        int length = input.length();
        int start = fromOffset;
        while (start < length && !charClass.test(input.charAt(start))) {
            start++;
        }
        if (start >= length) {
            return MatchResult.notFound();
        }

        int end = start + 1;
        if (run) {
            while (end < length && charClass.test(input.charAt(end))) {
                end++;
            }
        }
        return MatchResult.found(start, end);
    }

    public boolean isRun() {
        return run;
    }
}
