package com.textsplit.text;

/**
 * 字面量分隔符匹配。
 */
public class LiteralMatcher implements DelimiterMatcher {

    private final String delimiter;

    public LiteralMatcher(String delimiter) {
        if (delimiter == null || delimiter.isEmpty()) {
            throw new IllegalArgumentException("字面量分隔符不能为空");
        }
        this.delimiter = delimiter;
    }

    @Override
    public MatchResult find(CharSequence input, int fromOffset) {
        int index = input.toString().indexOf(delimiter, fromOffset);
        if (index < 0) {
            return MatchResult.notFound();
        }
        return MatchResult.found(index, index + delimiter.length());
    }

    public String getDelimiter() {
        return delimiter;
    }
}
