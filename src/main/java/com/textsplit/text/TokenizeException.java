package com.textsplit.text;

/**
 * 切分过程中的契约错误基类。
 */
public class TokenizeException extends RuntimeException {

    public TokenizeException(String message) {
        super(message);
    }
}
