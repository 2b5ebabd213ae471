package com.textsplit.text;

/**
 * limit 取值不在 null、-1 或正整数之内，在扫描开始前抛出。
 */
public class InvalidLimitException extends TokenizeException {
    private final int limit;

    public InvalidLimitException(int limit) {
        super("Invalid split limit " + limit + ": expected -1 or a positive integer");
        this.limit = limit;
    }

    public int getLimit() {
        return limit;
    }
}
