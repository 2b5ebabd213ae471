package com.textsplit.text;

/**
 * 分隔符查找结果：命中区间或未命中。
 */
public sealed interface MatchResult permits MatchResult.Found, MatchResult.NotFound {

    static MatchResult found(int start, int end) {
        return new Found(start, end);
    }

    static MatchResult notFound() {
        return NotFound.INSTANCE;
    }

    record Found(int start, int end) implements MatchResult {
    }

    final class NotFound implements MatchResult {
        private static final NotFound INSTANCE = new NotFound();

        private NotFound() {
        }

        @Override
        public String toString() {
            return "NotFound";
        }
    }
}
