package com.textsplit.text;

/**
 * 分隔符匹配能力。
 *
 * <p>实现需保证返回的 {@link MatchResult.Found} 满足
 * {@code fromOffset <= start <= end <= input.length()}，
 * 并且在 {@code fromOffset == input.length()} 时返回 {@link MatchResult.NotFound}。
 */
@FunctionalInterface
public interface DelimiterMatcher {

    /**
     * 从 fromOffset 开始查找下一个分隔符。
     */
    MatchResult find(CharSequence input, int fromOffset);
}
