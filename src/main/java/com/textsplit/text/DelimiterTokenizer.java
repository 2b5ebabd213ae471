package com.textsplit.text;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 基于分隔符匹配器的字符串切分。
 *
 * <p>无状态，可被多个线程并发调用。
 */
public final class DelimiterTokenizer {

    private DelimiterTokenizer() {
        // 工具类，禁止实例化
    }

    /**
     * 默认模式切分：切分全部匹配并去掉末尾空词项。
     */
    public static List<String> tokenize(String input, DelimiterMatcher matcher) {
        return tokenize(input, matcher, SplitLimit.defaults());
    }

    /**
     * 以可空整数形式的 limit 切分，语义见 {@link SplitLimit#of(Integer)}。
     *
     * @throws InvalidLimitException limit 不是 null、-1 或正整数
     */
    public static List<String> tokenize(String input, DelimiterMatcher matcher, Integer limit) {
        return tokenize(input, matcher, SplitLimit.of(limit));
    }

    /**
     * 按给定限制切分输入。
     *
     * @throws InvalidMatcherResultException 匹配器返回了非法区间
     */
    public static List<String> tokenize(String input, DelimiterMatcher matcher, SplitLimit limit) {
        List<Token> tokens = tokenizeWithOffsets(input, matcher, limit);
        List<String> terms = new ArrayList<>(tokens.size());
        for (Token token : tokens) {
            terms.add(token.term());
        }
        return List.copyOf(terms);
    }

    /**
     * 按给定限制切分输入，并保留每个词项在原文中的偏移。
     */
    public static List<Token> tokenizeWithOffsets(String input, DelimiterMatcher matcher, SplitLimit limit) {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(matcher, "matcher");
        Objects.requireNonNull(limit, "limit");

        int length = input.length();
        int maxTokens = limit.maxTokens();
        List<Token> tokens = new ArrayList<>();
        int cursor = 0;

        while (true) {
            // 只剩最后一个名额时不再查找分隔符，剩余输入整体作为末尾词项
            if (tokens.size() == maxTokens - 1) {
                tokens.add(new Token(input.substring(cursor), tokens.size(), cursor, length));
                break;
            }

            MatchResult result = matcher.find(input, cursor);
            if (!(result instanceof MatchResult.Found found)) {
                tokens.add(new Token(input.substring(cursor), tokens.size(), cursor, length));
                break;
            }

            validate(found, cursor, length);
            tokens.add(new Token(input.substring(cursor, found.start()), tokens.size(), cursor, found.start()));
            cursor = found.end();
        }

        if (limit.trimsTrailingEmpties()) {
            trimTrailingEmpties(tokens);
        }
        return List.copyOf(tokens);
    }

    private static void validate(MatchResult.Found found, int cursor, int length) {
        int start = found.start();
        int end = found.end();
        if (start < cursor) {
            throw new InvalidMatcherResultException("match starts before cursor", cursor, start, end, length);
        }
        if (end < start) {
            throw new InvalidMatcherResultException("match ends before it starts", cursor, start, end, length);
        }
        if (end > length) {
            throw new InvalidMatcherResultException("match ends past input", cursor, start, end, length);
        }
        if (end == cursor) {
            throw new InvalidMatcherResultException("empty match at cursor makes no progress", cursor, start, end, length);
        }
    }

    private static void trimTrailingEmpties(List<Token> tokens) {
        int size = tokens.size();
        while (size > 0 && tokens.get(size - 1).term().isEmpty()) {
            size--;
        }
        tokens.subList(size, tokens.size()).clear();
    }
}
