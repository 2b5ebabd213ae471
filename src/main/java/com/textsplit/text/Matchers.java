package com.textsplit.text;

/**
 * 常用分隔符匹配器的工厂方法。
 */
public final class Matchers {

    private Matchers() {
        // 工具类，禁止实例化
    }

    public static DelimiterMatcher literal(String delimiter) {
        return new LiteralMatcher(delimiter);
    }

    /**
     * 单个字符即为分隔符，连续出现时产生空词项。
     */
    public static DelimiterMatcher anyOf(String chars) {
        return CharClassMatcher.of(chars, false);
    }

    /**
     * 连续的集合字符合并为一个分隔符。
     */
    public static DelimiterMatcher anyRunOf(String chars) {
        return CharClassMatcher.of(chars, true);
    }

    public static DelimiterMatcher whitespaceRun() {
        return CharClassMatcher.whitespace();
    }

    public static DelimiterMatcher regex(String regex) {
        return new PatternMatcher(regex);
    }
}
