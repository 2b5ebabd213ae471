package com.textsplit.text;

/**
 * 匹配器返回了违反前进/不重叠约束的偏移。
 */
public class InvalidMatcherResultException extends TokenizeException {
    private final int cursor;
    private final int matchStart;
    private final int matchEnd;
    private final int inputLength;

    public InvalidMatcherResultException(String reason, int cursor, int matchStart, int matchEnd, int inputLength) {
        super(buildMessage(reason, cursor, matchStart, matchEnd, inputLength));
        this.cursor = cursor;
        this.matchStart = matchStart;
        this.matchEnd = matchEnd;
        this.inputLength = inputLength;
    }

    public int getCursor() {
        return cursor;
    }

    public int getMatchStart() {
        return matchStart;
    }

    public int getMatchEnd() {
        return matchEnd;
    }

    public int getInputLength() {
        return inputLength;
    }

    private static String buildMessage(String reason, int cursor, int start, int end, int length) {
        return "Invalid matcher result [" + start + ", " + end + ") at cursor " + cursor
                + " (input length " + length + "): " + reason;
    }
}
