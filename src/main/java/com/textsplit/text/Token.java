package com.textsplit.text;

/**
 * 切分得到的词项及其在原文中的偏移，endOffset 为开区间。
 */
public record Token(
    String term,
    int position,
    int startOffset,
    int endOffset
) {
}
