package com.textsplit.text;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 正则表达式分隔符匹配。
 *
 * <p>起点处的空匹配会被跳过，从下一个字符重新查找，保证切分总能前进。
 */
public class PatternMatcher implements DelimiterMatcher {

    private final Pattern pattern;

    public PatternMatcher(Pattern pattern) {
        if (pattern == null) {
            throw new IllegalArgumentException("正则表达式不能为空");
        }
        this.pattern = pattern;
    }

    public PatternMatcher(String regex) {
        this(Pattern.compile(regex));
    }

    @Override
    public MatchResult find(CharSequence input, int fromOffset) {
        int length = input.length();
        if (fromOffset >= length) {
            return MatchResult.notFound();
        }

        Matcher regexMatcher = pattern.matcher(input);
        int searchFrom = fromOffset;
        while (searchFrom < length && regexMatcher.find(searchFrom)) {
            if (regexMatcher.end() > fromOffset) {
                return MatchResult.found(regexMatcher.start(), regexMatcher.end());
            }
            searchFrom++;
        }
        return MatchResult.notFound();
    }

    public Pattern getPattern() {
        return pattern;
    }
}
