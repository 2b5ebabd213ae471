package com.textsplit.text;

import java.util.List;
import java.util.Objects;

/**
 * 绑定固定匹配器与限制的 {@link Tokenizer}。
 */
public class SplittingTokenizer implements Tokenizer {

    private final DelimiterMatcher matcher;
    private final SplitLimit limit;

    public SplittingTokenizer(DelimiterMatcher matcher) {
        this(matcher, SplitLimit.defaults());
    }

    public SplittingTokenizer(DelimiterMatcher matcher, SplitLimit limit) {
        this.matcher = Objects.requireNonNull(matcher, "matcher");
        this.limit = Objects.requireNonNull(limit, "limit");
    }

    @Override
    public List<Token> tokenize(String text) {
        if (text == null) {
            return List.of();
        }
        return DelimiterTokenizer.tokenizeWithOffsets(text, matcher, limit);
    }

    public DelimiterMatcher getMatcher() {
        return matcher;
    }

    public SplitLimit getLimit() {
        return limit;
    }
}
