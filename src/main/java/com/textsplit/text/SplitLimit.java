package com.textsplit.text;

/**
 * 切分次数限制。
 *
 * <ul>
 *   <li>{@link Default}：不限次数，去掉末尾的空词项</li>
 *   <li>{@link Unbounded}：不限次数，保留全部空词项</li>
 *   <li>{@link Bounded}：最多产生 maxTokens 个词项，最后一个吸收剩余输入</li>
 * </ul>
 */
public sealed interface SplitLimit permits SplitLimit.Default, SplitLimit.Unbounded, SplitLimit.Bounded {

    int UNBOUNDED_VALUE = -1;

    static SplitLimit defaults() {
        return Default.INSTANCE;
    }

    static SplitLimit unbounded() {
        return Unbounded.INSTANCE;
    }

    static SplitLimit bounded(int maxTokens) {
        return new Bounded(maxTokens);
    }

    /**
     * 将可空整数形式的 limit 映射为三态限制：null 为默认，-1 为不限，正数为上限。
     *
     * @throws InvalidLimitException 取值为 0 或 -1 以外的负数
     */
    static SplitLimit of(Integer limit) {
        if (limit == null) {
            return Default.INSTANCE;
        }
        if (limit == UNBOUNDED_VALUE) {
            return Unbounded.INSTANCE;
        }
        return new Bounded(limit);
    }

    /**
     * 是否对结果执行末尾空词项裁剪。
     */
    default boolean trimsTrailingEmpties() {
        return false;
    }

    /**
     * 允许产生的最大词项数，不限时返回 {@link Integer#MAX_VALUE}。
     */
    default int maxTokens() {
        return Integer.MAX_VALUE;
    }

    final class Default implements SplitLimit {
        private static final Default INSTANCE = new Default();

        private Default() {
        }

        @Override
        public boolean trimsTrailingEmpties() {
            return true;
        }

        @Override
        public String toString() {
            return "Default";
        }
    }

    final class Unbounded implements SplitLimit {
        private static final Unbounded INSTANCE = new Unbounded();

        private Unbounded() {
        }

        @Override
        public String toString() {
            return "Unbounded";
        }
    }

    record Bounded(int maxTokens) implements SplitLimit {
        public Bounded {
            if (maxTokens < 1) {
                throw new InvalidLimitException(maxTokens);
            }
        }
    }
}
